/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest.internal;

/** Result of one flush attempt, which decides what happens to the pending batch. */
public enum FlushOutcome {
  /** The batch was empty, so nothing was sent. */
  EMPTY,
  /** The endpoint acknowledged the batch. The batch was drained. */
  SUCCESS,
  /** Connection failure or a non-OK status. The batch is retained for the next trigger. */
  RETRIABLE_FAILURE,
  /** The sender can never succeed, for example it was closed or the request is malformed. */
  FATAL_FAILURE
}
