/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest;

import java.io.IOException;

/** Thrown by HTTP senders when the ingest endpoint answers with a status other than 200. */
public final class IngestStatusException extends IOException {
  static final long serialVersionUID = 4365470954113781562L;

  final int statusCode;

  public IngestStatusException(int statusCode, String message) {
    super(message);
    this.statusCode = statusCode;
  }

  public int statusCode() {
    return statusCode;
  }
}
