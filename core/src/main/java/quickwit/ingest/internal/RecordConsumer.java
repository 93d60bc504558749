/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest.internal;

/** Receives records drained from a {@link RecordQueue}. */
public interface RecordConsumer<R> {
  /** Returns true if the record was accepted or false if the consumer is full. */
  boolean offer(R next);
}
