/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest;

import java.util.List;
import org.junit.jupiter.api.Test;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

class JsonLinesTest {
  List<byte[]> records = List.of("{\"s\":\"a\"}".getBytes(UTF_8), "{\"s\":\"b\"}".getBytes(UTF_8));

  @Test void encode_terminatesEachRecordWithNewline() {
    assertThat(new String(JsonLines.encode(records), UTF_8))
      .isEqualTo("{\"s\":\"a\"}\n{\"s\":\"b\"}\n");
  }

  @Test void sizeInBytes_matchesEncodedSize() {
    assertThat(JsonLines.sizeInBytes(records)).isEqualTo(JsonLines.encode(records).length);
  }

  @Test void empty() {
    assertThat(JsonLines.encode(List.of())).isEmpty();
    assertThat(JsonLines.sizeInBytes(List.of())).isZero();
  }
}
