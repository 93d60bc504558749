/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest;

import java.io.IOException;
import java.net.URI;
import java.net.URL;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Sends records to the Quickwit ingest API, by POSTing newline-delimited JSON to
 * {@code {endpoint}/ingest}. For example, the endpoint "http://localhost:7280/api/v1/logs"
 * results in POST requests to "http://localhost:7280/api/v1/logs/ingest".
 *
 * <p>Calls to {@linkplain #postRecords(Object, Object)} happen on the worker thread, but
 * {@linkplain #close()} might be called from any thread.
 *
 * @param <U> The URL type for the HTTP client, such as {@linkplain URL} or {@linkplain URI}.
 * @param <B> The POST body, such as {@code byte[]} or an HTTP client-specific body type.
 */
public abstract class BaseHttpSender<U, B> implements IngestSender {
  /** The only status that acknowledges a batch. */
  public static final int HTTP_OK = 200;

  final String endpoint;
  final U ingestUrl;

  /** close is typically called from a different thread */
  final AtomicBoolean closeCalled = new AtomicBoolean();

  /**
   * Called once, at construction. Implementations should perform any validation needed here, and
   * throw {@link IllegalArgumentException} if the URL is malformed.
   */
  protected abstract U newIngestUrl(String ingestUrl);

  /**
   * Creates a new POST body from the encoded records. This is invoked once per attempt, so a
   * retried batch produces an identical body.
   *
   * <p>Below is the simplest implementation, when {@code B} is a byte array.
   * <pre>{@code
   * @Override protected byte[] newBody(List<byte[]> encodedRecords) {
   *   return JsonLines.encode(encodedRecords);
   * }
   * }</pre>
   */
  protected abstract B newBody(List<byte[]> encodedRecords) throws IOException;

  /**
   * Implement to POST the body to the given URL. Throw {@link IngestStatusException} unless the
   * response status is {@link #HTTP_OK}. Implementations must fully read and close the response.
   */
  protected abstract void postRecords(U ingestUrl, B body) throws IOException;

  /** Override to close any resources. */
  protected void doClose() {
  }

  protected BaseHttpSender(String endpoint) {
    if (endpoint == null) throw new NullPointerException("endpoint == null");
    this.endpoint = endpoint;
    this.ingestUrl = newIngestUrl(ingestUrl(endpoint));
    if (ingestUrl == null) throw new NullPointerException("newIngestUrl() returned null");
  }

  /** Strips one trailing slash from the endpoint and appends the ingest path. */
  public static String ingestUrl(String endpoint) {
    String result = endpoint;
    if (result.endsWith("/")) result = result.substring(0, result.length() - 1);
    return result + "/ingest";
  }

  /** Sends records as an HTTP POST request. */
  @Override public final void send(List<byte[]> encodedRecords) throws IOException {
    if (closeCalled.get()) throw new ClosedSenderException();
    B body = newBody(encodedRecords);
    if (body == null) throw new NullPointerException("newBody(encodedRecords) returned null");
    postRecords(ingestUrl, body);
  }

  @Override public final void close() {
    if (!closeCalled.compareAndSet(false, true)) return; // already closed
    doClose();
  }

  @Override public String toString() {
    return getClass().getSimpleName() + "{" + ingestUrl + "}";
  }
}
