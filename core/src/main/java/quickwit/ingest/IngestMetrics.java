/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest;

/**
 * Callbacks invoked by {@link AsyncIngester} to improve the visibility of the pipeline. A typical
 * implementation will report metrics to a telemetry system for analysis and alerting.
 *
 * <h3>Key Relationships</h3>
 *
 * <p>The following relationships can be used to consider health of ingestion.
 * <ul>
 *   <li>{@link #updateQueuedRecords Queued records}. Alert when this increases over time as it
 *   leads to blocked producers or dropped records.</li>
 *   <li>{@link #updatePendingRecords Pending records} stay above zero while the endpoint fails.
 *   </li>
 *   <li>Delivered messages = {@link #incrementMessages() attempts} -
 *   {@link #incrementMessagesFailed failures}.</li>
 * </ul>
 */
public interface IngestMetrics {

  /** Increments count of flush attempts, each a single POST of one or more records. */
  void incrementMessages();

  /**
   * Increments count of flush attempts that failed. Ex connection refused, or a non-OK status.
   * Retried batches are counted once per attempt.
   */
  void incrementMessagesFailed(Throwable cause);

  /** Increments the number of bytes in attempted messages. */
  void incrementMessageBytes(int quantity);

  /** Increments the count of records accepted by ingest, whether or not they were queued. */
  void incrementRecords(int quantity);

  /**
   * Increments the count of records dropped for any reason. For example, a full queue in
   * {@link Backpressure#DROP} mode, an unencodable record or loss at close.
   */
  void incrementRecordsDropped(int quantity);

  /** Updates the count of records waiting in the queue, following a drain. */
  void updateQueuedRecords(int update);

  /** Updates the count of records held by the worker awaiting delivery, following a flush. */
  void updatePendingRecords(int update);

  IngestMetrics NOOP_METRICS = new IngestMetrics() {
    @Override public void incrementMessages() {
    }

    @Override public void incrementMessagesFailed(Throwable cause) {
    }

    @Override public void incrementMessageBytes(int quantity) {
    }

    @Override public void incrementRecords(int quantity) {
    }

    @Override public void incrementRecordsDropped(int quantity) {
    }

    @Override public void updateQueuedRecords(int update) {
    }

    @Override public void updatePendingRecords(int update) {
    }

    @Override public String toString() {
      return "NoOpIngestMetrics";
    }
  };
}
