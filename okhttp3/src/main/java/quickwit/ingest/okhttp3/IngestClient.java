/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest.okhttp3;

import java.io.Closeable;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import quickwit.ingest.AsyncIngester;
import quickwit.ingest.Backpressure;
import quickwit.ingest.BaseHttpSender;
import quickwit.ingest.ClosedIngesterException;
import quickwit.ingest.IngestMetrics;
import quickwit.ingest.RecordEncoder;
import quickwit.ingest.jackson.JacksonRecordEncoder;

/**
 * Batches records of any type and ships them to a Quickwit index as newline-delimited JSON.
 *
 * <p>Usage:
 * <pre>{@code
 * client = IngestClient.create("http://localhost:7280/api/v1/logs")
 *   .batchSize(500)
 *   .maxDelay(200, TimeUnit.MILLISECONDS);
 *
 * client.ingest(Map.of("level", "info", "message", "started"));
 * // on shutdown
 * client.close();
 * }</pre>
 *
 * <p>Configuration is only effective before the first call to {@link #ingest(Object...)}. That
 * call builds the sender and starts the worker thread, exactly once even if called concurrently.
 * A setter invoked later has no effect, and logs a warning.
 *
 * <p>{@link #ingest(Object...)} is fire-and-forget: delivery failures are retried on the worker and
 * only surface in logs and {@link IngestMetrics}.
 */
public final class IngestClient implements Closeable {
  static final Logger logger = Logger.getLogger(IngestClient.class.getName());

  /**
   * @param endpoint the index URL, like "http://localhost:7280/api/v1/logs"
   * @throws IllegalArgumentException if the endpoint isn't an HTTP or HTTPS URL
   */
  public static IngestClient create(String endpoint) {
    return new IngestClient(endpoint);
  }

  final String endpoint;
  final Object lock = new Object();

  // guarded by lock
  OkHttpClient transport;
  AuthDecorator auth = AuthDecorator.NONE;
  RecordEncoder<Object> encoder;
  IngestMetrics metrics = IngestMetrics.NOOP_METRICS;
  Backpressure backpressure = Backpressure.BLOCK;
  int batchSize = 1000, queueCapacity = 10000;
  long maxDelayNanos = TimeUnit.SECONDS.toNanos(1);
  boolean compressionEnabled, closed;
  OkHttpIngestSender sender;

  volatile AsyncIngester<Object> delegate;

  IngestClient(String endpoint) {
    if (endpoint == null) throw new NullPointerException("endpoint == null");
    String ingestUrl = BaseHttpSender.ingestUrl(endpoint);
    if (HttpUrl.parse(ingestUrl) == null) {
      throw new IllegalArgumentException("invalid POST url: " + ingestUrl);
    }
    this.endpoint = endpoint;
  }

  /** Executes requests with the given client, which is not closed by this. Default own client. */
  public IngestClient transport(OkHttpClient transport) {
    if (transport == null) throw new NullPointerException("transport == null");
    synchronized (lock) {
      if (isConfigurable("transport")) this.transport = transport;
    }
    return this;
  }

  /** Decorates each request, for example with a bearer token. Default {@link AuthDecorator#NONE}. */
  public IngestClient auth(AuthDecorator auth) {
    if (auth == null) throw new NullPointerException("auth == null");
    synchronized (lock) {
      if (isConfigurable("auth")) this.auth = auth;
    }
    return this;
  }

  /** Serializes records. Default {@link JacksonRecordEncoder#create()}. */
  public IngestClient encoder(RecordEncoder<Object> encoder) {
    if (encoder == null) throw new NullPointerException("encoder == null");
    synchronized (lock) {
      if (isConfigurable("encoder")) this.encoder = encoder;
    }
    return this;
  }

  /** Count of records that trigger an immediate flush. Default 1000 */
  public IngestClient batchSize(int batchSize) {
    if (batchSize <= 0) throw new IllegalArgumentException("batchSize <= 0: " + batchSize);
    synchronized (lock) {
      if (isConfigurable("batchSize")) this.batchSize = batchSize;
    }
    return this;
  }

  /** Period of the flush timer. Default 1 second */
  public IngestClient maxDelay(long maxDelay, TimeUnit unit) {
    if (maxDelay <= 0) throw new IllegalArgumentException("maxDelay <= 0: " + maxDelay);
    if (unit == null) throw new NullPointerException("unit == null");
    synchronized (lock) {
      if (isConfigurable("maxDelay")) this.maxDelayNanos = unit.toNanos(maxDelay);
    }
    return this;
  }

  /** Maximum records waiting for the worker. Default 10000 */
  public IngestClient queueCapacity(int queueCapacity) {
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity <= 0: " + queueCapacity);
    }
    synchronized (lock) {
      if (isConfigurable("queueCapacity")) this.queueCapacity = queueCapacity;
    }
    return this;
  }

  /** What {@link #ingest(Object...)} does when the queue is full. Default {@link Backpressure#BLOCK} */
  public IngestClient backpressure(Backpressure backpressure) {
    if (backpressure == null) throw new NullPointerException("backpressure == null");
    synchronized (lock) {
      if (isConfigurable("backpressure")) this.backpressure = backpressure;
    }
    return this;
  }

  public IngestClient metrics(IngestMetrics metrics) {
    if (metrics == null) throw new NullPointerException("metrics == null");
    synchronized (lock) {
      if (isConfigurable("metrics")) this.metrics = metrics;
    }
    return this;
  }

  /** Default false. true implies that messages will be gzipped before transport. */
  public IngestClient compressionEnabled(boolean compressionEnabled) {
    synchronized (lock) {
      if (isConfigurable("compressionEnabled")) this.compressionEnabled = compressionEnabled;
    }
    return this;
  }

  boolean isConfigurable(String setting) {
    if (delegate == null && !closed) return true;
    logger.warning("Ignoring " + setting + " on " + this + ": configuration must precede the "
      + "first ingest and close");
    return false;
  }

  /**
   * Queues records for delivery in the order given.
   *
   * @throws ClosedIngesterException if this client was closed
   * @see AsyncIngester#ingest(Object)
   */
  public void ingest(Object... records) {
    if (records == null) throw new NullPointerException("records == null");
    AsyncIngester<Object> delegate = delegate();
    for (Object record : records) {
      delegate.ingest(record);
    }
  }

  /** Like {@link #ingest(Object...)}, in iteration order. */
  public void ingest(Iterable<?> records) {
    if (records == null) throw new NullPointerException("records == null");
    AsyncIngester<Object> delegate = delegate();
    for (Object record : records) {
      delegate.ingest(record);
    }
  }

  AsyncIngester<Object> delegate() {
    AsyncIngester<Object> result = delegate;
    if (result != null) return result;
    synchronized (lock) {
      if (delegate == null) {
        if (closed) throw new ClosedIngesterException();
        OkHttpIngestSender.Builder senderBuilder = OkHttpIngestSender.newBuilder()
          .endpoint(endpoint)
          .authDecorator(auth)
          .compressionEnabled(compressionEnabled);
        if (transport != null) senderBuilder.client(transport);
        sender = senderBuilder.build();
        delegate = AsyncIngester.newBuilder(sender)
          .batchSize(batchSize)
          .maxDelay(maxDelayNanos, TimeUnit.NANOSECONDS)
          .queuedMaxRecords(queueCapacity)
          .backpressure(backpressure)
          .metrics(metrics)
          .build(encoder != null ? encoder : JacksonRecordEncoder.create());
      }
      return delegate;
    }
  }

  /** Lifecycle of the worker behind this client. */
  public AsyncIngester.State state() {
    AsyncIngester<Object> delegate = this.delegate;
    if (delegate != null) return delegate.state();
    synchronized (lock) {
      return closed ? AsyncIngester.State.STOPPED : AsyncIngester.State.UNINITIALIZED;
    }
  }

  /**
   * Stops accepting records, and sends those pending with one final attempt. Records that cannot
   * be sent within a second are lost.
   */
  @Override public void close() {
    AsyncIngester<Object> delegate;
    OkHttpIngestSender sender;
    synchronized (lock) {
      if (closed) return;
      closed = true;
      delegate = this.delegate;
      sender = this.sender;
    }
    if (delegate == null) return;
    delegate.close();
    sender.close();
  }

  @Override public String toString() {
    return "IngestClient{" + endpoint + "}";
  }
}
