/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest;

import java.util.List;

/**
 * Newline-delimited JSON, the body format of the ingest endpoint. Each encoded record is followed
 * by a line feed, including the last one.
 */
public final class JsonLines {
  /** "Content-Type" of a message body. */
  public static final String MEDIA_TYPE = "application/x-ndjson";

  static final byte NEWLINE = '\n';

  /** Size of the message holding the given records. */
  public static int sizeInBytes(List<byte[]> encodedRecords) {
    int sizeInBytes = 0;
    for (int i = 0, length = encodedRecords.size(); i < length; i++) {
      sizeInBytes += encodedRecords.get(i).length + 1;
    }
    return sizeInBytes;
  }

  /** Concatenates the records into one message, one per line. */
  public static byte[] encode(List<byte[]> encodedRecords) {
    byte[] result = new byte[sizeInBytes(encodedRecords)];
    int pos = 0;
    for (int i = 0, length = encodedRecords.size(); i < length; i++) {
      byte[] next = encodedRecords.get(i);
      System.arraycopy(next, 0, result, pos, next.length);
      pos += next.length;
      result[pos++] = NEWLINE;
    }
    return result;
  }

  JsonLines() {
  }
}
