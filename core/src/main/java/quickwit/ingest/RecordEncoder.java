/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest;

/**
 * Serializes one record into a single JSON value. The result must not contain a raw newline, as
 * records are delimited by newlines on the wire.
 *
 * <p>Encoding happens on the worker thread, each time a batch is flushed. Implementations must be
 * deterministic, so that a retried batch is byte-identical to the failed attempt.
 *
 * @param <R> type of the record
 */
public interface RecordEncoder<R> {
  /**
   * Serializes a record into its JSON form.
   *
   * @throws IllegalArgumentException if the record cannot be represented as JSON
   */
  byte[] encode(R record);
}
