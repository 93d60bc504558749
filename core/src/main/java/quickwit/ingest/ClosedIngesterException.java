/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest;

/**
 * Thrown when records are ingested after {@link AsyncIngester#close()}, or after the worker stopped
 * due to a fatal sender failure. Ingesting into a stopped client is a programming error.
 */
public final class ClosedIngesterException extends IllegalStateException {
  static final long serialVersionUID = -1813364627395113284L;

  public ClosedIngesterException() {
    super("closed");
  }
}
