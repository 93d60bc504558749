/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest.okhttp3;

import java.io.IOException;
import java.util.List;
import okhttp3.MediaType;
import okhttp3.RequestBody;
import okio.BufferedSink;
import quickwit.ingest.JsonLines;

/** Streams encoded records as newline-delimited JSON, without copying them into one array. */
final class JsonLinesRequestBody extends RequestBody {
  static final MediaType CONTENT_TYPE = MediaType.get(JsonLines.MEDIA_TYPE);

  final List<byte[]> values;
  final long contentLength;

  JsonLinesRequestBody(List<byte[]> values) {
    this.values = values;
    this.contentLength = JsonLines.sizeInBytes(values);
  }

  @Override public MediaType contentType() {
    return CONTENT_TYPE;
  }

  @Override public long contentLength() {
    return contentLength;
  }

  @Override public void writeTo(BufferedSink sink) throws IOException {
    for (int i = 0, length = values.size(); i < length; i++) {
      sink.write(values.get(i));
      sink.writeByte('\n');
    }
  }
}
