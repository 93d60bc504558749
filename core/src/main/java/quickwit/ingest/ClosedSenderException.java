/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest;

/** An exception thrown when an {@link IngestSender} is used after it has been closed. */
public final class ClosedSenderException extends IllegalStateException {
  static final long serialVersionUID = 2717645398716327321L;
}
