/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest;

import java.io.Closeable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;
import quickwit.ingest.internal.Batch;
import quickwit.ingest.internal.Flusher;
import quickwit.ingest.internal.IngestWorker;
import quickwit.ingest.internal.RecordQueue;

/**
 * As records are ingested, they are added to a bounded queue. The task of sending records happens
 * on a separate worker thread. By doing so, callers are protected from latency or exceptions
 * possible when sending records out of process.
 *
 * <p>Records are bundled into batches based on count or a timer, whichever happens first. The
 * timer ticks at a fixed period from the first ingest, and is not reset when a full batch is
 * sent.
 *
 * <p>The worker sends batches in a synchronous loop, so only one request is ever in flight. When
 * a send fails, the batch is kept and sent again on a later trigger, after a backoff. While the
 * batch is kept, new records wait in the queue, where the {@link Backpressure} mode decides what
 * happens when it fills up.
 *
 * <p>Delivery is at-least-once while the process runs: a batch whose response was lost is sent
 * again. Records still pending when {@link #close()} gives up, or when the sender fails fatally,
 * are lost.
 *
 * @param <R> type of the record
 */
public abstract class AsyncIngester<R> implements Closeable {
  public static Builder newBuilder(IngestSender sender) {
    return new Builder(sender);
  }

  /** Lifecycle of the worker. Transitions are one-way. */
  public enum State {
    /** No record was ingested yet, so the worker thread wasn't started. */
    UNINITIALIZED,
    RUNNING,
    /** {@link #close()} was called. The worker is sending what is left. */
    DRAINING,
    /** The worker exited, or was never started before close. */
    STOPPED
  }

  /**
   * Queues the record for delivery, starting the worker thread on first use.
   *
   * <p>In {@link Backpressure#BLOCK} mode, this waits while the queue is full. In
   * {@link Backpressure#DROP} mode, this returns immediately, discarding the record if the queue is
   * full.
   *
   * @throws ClosedIngesterException if this was closed or ingestion stopped due to a fatal error
   */
  public abstract void ingest(R record);

  /** Like {@link #ingest(Object)}, in iteration order. */
  public void ingest(Iterable<? extends R> records) {
    if (records == null) throw new NullPointerException("records == null");
    for (R record : records) {
      ingest(record);
    }
  }

  public abstract State state();

  /**
   * Stops accepting records, and waits up to the close timeout for the worker to send what is
   * left. Records not sent by then are dropped.
   */
  @Override public abstract void close();

  public static final class Builder {
    final IngestSender sender;
    ThreadFactory threadFactory = Executors.defaultThreadFactory();
    IngestMetrics metrics = IngestMetrics.NOOP_METRICS;
    Backpressure backpressure = Backpressure.BLOCK;
    int batchSize = 1000;
    int queuedMaxRecords = 10000;
    long maxDelayNanos = TimeUnit.SECONDS.toNanos(1);
    long initialBackoffNanos = TimeUnit.MILLISECONDS.toNanos(100);
    long maxBackoffNanos = TimeUnit.SECONDS.toNanos(30);
    long closeTimeoutNanos = TimeUnit.SECONDS.toNanos(1);

    Builder(IngestSender sender) {
      if (sender == null) throw new NullPointerException("sender == null");
      this.sender = sender;
    }

    /** Creates the worker thread. Its name is overwritten. */
    public Builder threadFactory(ThreadFactory threadFactory) {
      if (threadFactory == null) throw new NullPointerException("threadFactory == null");
      this.threadFactory = threadFactory;
      return this;
    }

    /** Aggregates and reports ingest metrics to a monitoring system. Defaults to no-op. */
    public Builder metrics(IngestMetrics metrics) {
      if (metrics == null) throw new NullPointerException("metrics == null");
      this.metrics = metrics;
      return this;
    }

    /** What to do when the queue is full. Default {@link Backpressure#BLOCK}. */
    public Builder backpressure(Backpressure backpressure) {
      if (backpressure == null) throw new NullPointerException("backpressure == null");
      this.backpressure = backpressure;
      return this;
    }

    /** Count of records that trigger an immediate flush. Default 1000 */
    public Builder batchSize(int batchSize) {
      if (batchSize <= 0) throw new IllegalArgumentException("batchSize <= 0: " + batchSize);
      this.batchSize = batchSize;
      return this;
    }

    /** Maximum backlog of records ingested vs taken by the worker. Default 10000 */
    public Builder queuedMaxRecords(int queuedMaxRecords) {
      if (queuedMaxRecords <= 0) {
        throw new IllegalArgumentException("queuedMaxRecords <= 0: " + queuedMaxRecords);
      }
      this.queuedMaxRecords = queuedMaxRecords;
      return this;
    }

    /**
     * Period of the flush timer. Default 1 second.
     *
     * <p>This bounds how long a record waits in an incomplete batch, as long as sends succeed.
     */
    public Builder maxDelay(long maxDelay, TimeUnit unit) {
      if (maxDelay <= 0) throw new IllegalArgumentException("maxDelay <= 0: " + maxDelay);
      if (unit == null) throw new NullPointerException("unit == null");
      this.maxDelayNanos = unit.toNanos(maxDelay);
      return this;
    }

    /**
     * Wait after a failed send before the next attempt. It doubles with each consecutive failure,
     * up to the maximum. Default 100 milliseconds, up to 30 seconds. Zero retries on the next
     * trigger without waiting.
     */
    public Builder retryBackoff(long initialBackoff, long maxBackoff, TimeUnit unit) {
      if (initialBackoff < 0) {
        throw new IllegalArgumentException("initialBackoff < 0: " + initialBackoff);
      }
      if (maxBackoff < initialBackoff) {
        throw new IllegalArgumentException("maxBackoff < initialBackoff: " + maxBackoff);
      }
      if (unit == null) throw new NullPointerException("unit == null");
      this.initialBackoffNanos = unit.toNanos(initialBackoff);
      this.maxBackoffNanos = unit.toNanos(maxBackoff);
      return this;
    }

    /** How long to block for in-flight records to send out-of-process on close. Default 1 second */
    public Builder closeTimeout(long timeout, TimeUnit unit) {
      if (timeout < 0) throw new IllegalArgumentException("closeTimeout < 0: " + timeout);
      if (unit == null) throw new NullPointerException("unit == null");
      this.closeTimeoutNanos = unit.toNanos(timeout);
      return this;
    }

    /** Builds an async ingester that encodes records with the given encoder as they are sent. */
    public <R> AsyncIngester<R> build(RecordEncoder<R> encoder) {
      if (encoder == null) throw new NullPointerException("encoder == null");
      return new BoundedAsyncIngester<>(this, encoder);
    }
  }

  static final class BoundedAsyncIngester<R> extends AsyncIngester<R> {
    static final Logger logger = Logger.getLogger(BoundedAsyncIngester.class.getName());

    final AtomicReference<State> state = new AtomicReference<>(State.UNINITIALIZED);
    final RecordEncoder<R> encoder;
    final RecordQueue<R> pending;
    final IngestSender sender;
    final Backpressure backpressure;
    final int batchSize;
    final long maxDelayNanos, initialBackoffNanos, maxBackoffNanos, closeTimeoutNanos;
    final CountDownLatch stopped = new CountDownLatch(1);
    final IngestMetrics metrics;
    final ThreadFactory threadFactory;

    BoundedAsyncIngester(Builder builder, RecordEncoder<R> encoder) {
      this.pending = new RecordQueue<>(builder.queuedMaxRecords);
      this.sender = builder.sender;
      this.backpressure = builder.backpressure;
      this.batchSize = builder.batchSize;
      this.maxDelayNanos = builder.maxDelayNanos;
      this.initialBackoffNanos = builder.initialBackoffNanos;
      this.maxBackoffNanos = builder.maxBackoffNanos;
      this.closeTimeoutNanos = builder.closeTimeoutNanos;
      this.metrics = builder.metrics;
      this.threadFactory = builder.threadFactory;
      this.encoder = encoder;
    }

    void startWorkerThread() {
      IngestWorker<R> worker = new IngestWorker<>(pending, new Batch<>(batchSize),
        new Flusher<>(sender, encoder, metrics), metrics, maxDelayNanos, initialBackoffNanos,
        maxBackoffNanos, state, stopped);
      Thread workerThread = threadFactory.newThread(worker);
      workerThread.setName("AsyncIngester{" + sender + "}");
      workerThread.setDaemon(true);
      workerThread.start();
    }

    @Override public void ingest(R record) {
      if (record == null) throw new NullPointerException("record == null");
      // Lazy start so that ingesters never used don't spawn threads
      if (state.get() == State.UNINITIALIZED
        && state.compareAndSet(State.UNINITIALIZED, State.RUNNING)) {
        startWorkerThread();
      }

      boolean queued;
      if (backpressure == Backpressure.DROP) {
        queued = pending.offer(record);
      } else {
        try {
          pending.put(record);
          queued = true;
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          logger.fine("Interrupted waiting for space in the queue");
          queued = false;
        }
      }

      metrics.incrementRecords(1);
      if (!queued) metrics.incrementRecordsDropped(1);
    }

    @Override public State state() {
      return state.get();
    }

    @Override public void close() {
      if (state.compareAndSet(State.UNINITIALIZED, State.STOPPED)) {
        pending.close(); // the worker never started, so there's nothing to wait for
        return;
      }
      if (!state.compareAndSet(State.RUNNING, State.DRAINING)) return; // already closed
      pending.close();
      try {
        // wait for in-flight records to send
        if (!stopped.await(closeTimeoutNanos, TimeUnit.NANOSECONDS)) {
          logger.warning("Timed out waiting for in-flight records to send");
        }
      } catch (InterruptedException e) {
        logger.warning("Interrupted waiting for in-flight records to send");
        Thread.currentThread().interrupt();
      }
      int count = pending.clear();
      if (count > 0) {
        metrics.incrementRecordsDropped(count);
        logger.warning("Dropped " + count + " records due to AsyncIngester.close()");
      }
    }

    @Override public String toString() {
      return "AsyncIngester{" + sender + "}";
    }
  }
}
