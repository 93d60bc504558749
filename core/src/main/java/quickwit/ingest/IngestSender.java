/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Sends a batch of encoded records to the ingest endpoint. The typical implementation issues one
 * HTTP POST per call.
 *
 * <p>Unless mentioned otherwise, senders are not thread-safe. They are called by a single worker
 * thread, hence the operation is blocking. A hung call stalls every later flush, so bound the time
 * spent here with transport timeouts.
 *
 * <p>Failures are reported by exception:
 * <ul>
 *   <li>{@link IOException}, including {@link IngestStatusException}, means the batch may succeed
 *   if sent again.</li>
 *   <li>{@link ClosedSenderException} or {@link IllegalArgumentException} means no attempt can
 *   ever succeed.</li>
 * </ul>
 */
public interface IngestSender extends Closeable {

  /**
   * Sends the records as one message, in list order. Returns normally only when the endpoint
   * acknowledged the message.
   *
   * @param encodedRecords records, each already encoded by a {@link RecordEncoder}
   */
  void send(List<byte[]> encodedRecords) throws IOException;

  /** Releases resources. Subsequent calls to {@link #send(List)} throw {@link ClosedSenderException}. */
  @Override void close();
}
