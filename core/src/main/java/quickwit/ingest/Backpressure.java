/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest;

/**
 * What {@link AsyncIngester#ingest(Object)} does when the queue of records awaiting the worker is
 * full.
 */
public enum Backpressure {
  /** Suspends the calling thread until the worker frees space, or the ingester is closed. */
  BLOCK,
  /**
   * Never suspends the calling thread. A record that doesn't fit is discarded without signal to the
   * caller, though it is counted in {@link IngestMetrics#incrementRecordsDropped(int)}.
   */
  DROP
}
