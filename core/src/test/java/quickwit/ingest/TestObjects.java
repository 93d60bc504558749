/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest;

import static java.nio.charset.StandardCharsets.UTF_8;

public final class TestObjects {
  /** Encodes a string as the object {"s":value}. */
  public static final RecordEncoder<String> STRING_ENCODER =
    record -> ("{\"s\":\"" + record + "\"}").getBytes(UTF_8);

  public static String json(String value) {
    return "{\"s\":\"" + value + "\"}";
  }

  TestObjects() {
  }
}
