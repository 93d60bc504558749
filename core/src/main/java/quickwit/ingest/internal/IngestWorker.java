/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest.internal;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;
import quickwit.ingest.AsyncIngester.State;
import quickwit.ingest.IngestMetrics;

/**
 * The single consumer of a {@link RecordQueue}. It moves records into a {@link Batch}, and flushes
 * the batch when it is full or the timer ticks. When the queue is closed, it drains what is left
 * and makes one final flush attempt before exiting.
 */
public final class IngestWorker<R> implements Runnable {
  static final Logger logger = Logger.getLogger(IngestWorker.class.getName());

  final RecordQueue<R> queue;
  final Batch<R> batch;
  final Flusher<R> flusher;
  final IngestMetrics metrics;
  final long maxDelayNanos, initialBackoffNanos, maxBackoffNanos;
  final AtomicReference<State> state;
  final CountDownLatch stopped;

  public IngestWorker(RecordQueue<R> queue, Batch<R> batch, Flusher<R> flusher,
    IngestMetrics metrics, long maxDelayNanos, long initialBackoffNanos, long maxBackoffNanos,
    AtomicReference<State> state, CountDownLatch stopped) {
    this.queue = queue;
    this.batch = batch;
    this.flusher = flusher;
    this.metrics = metrics;
    this.maxDelayNanos = maxDelayNanos;
    this.initialBackoffNanos = initialBackoffNanos;
    this.maxBackoffNanos = maxBackoffNanos;
    this.state = state;
    this.stopped = stopped;
  }

  @Override public void run() {
    FlushTrigger trigger =
      new FlushTrigger(System.nanoTime(), maxDelayNanos, initialBackoffNanos, maxBackoffNanos);
    try {
      while (true) {
        long now = System.nanoTime();
        if (trigger.tick(now) && !trigger.backingOff(now)) {
          if (!flush(trigger)) return;
        }

        queue.drainTo(batch, batch.remaining(), trigger.nanosUntilNextEvent(System.nanoTime()));
        metrics.updateQueuedRecords(queue.count());

        if (trigger.sizeTriggered(batch, System.nanoTime())) {
          if (!flush(trigger)) return;
        } else if (queue.isClosed()) {
          drainAndStop();
          return;
        }
      }
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Unexpected error flushing records", e);
      throw e;
    } catch (Error e) {
      logger.log(Level.WARNING, "Unexpected error flushing records", e);
      throw e;
    } finally {
      stop();
    }
  }

  /** Returns false if the worker must stop. */
  boolean flush(FlushTrigger trigger) {
    switch (flusher.flush(batch)) {
      case SUCCESS:
        trigger.onSuccess();
        return true;
      case RETRIABLE_FAILURE:
        trigger.onFailure(System.nanoTime());
        return true;
      case FATAL_FAILURE:
        return false;
      default:
        return true;
    }
  }

  /**
   * Sends everything still queued, then makes one final attempt. Backoff is ignored here. After a
   * failure, the rest of the queue joins the failed batch, so the final attempt carries every
   * record not yet delivered.
   */
  void drainAndStop() {
    while (true) {
      queue.drainTo(batch, batch.remaining(), 0L);
      if (queue.count() == 0) break;

      FlushOutcome outcome = flusher.flush(batch);
      if (outcome == FlushOutcome.FATAL_FAILURE) return;
      if (outcome == FlushOutcome.RETRIABLE_FAILURE) {
        queue.drainTo(batch.ignoringMaxSize(), Integer.MAX_VALUE, 0L);
        break;
      }
    }

    FlushOutcome outcome = flusher.flush(batch); // the final attempt
    if (outcome == FlushOutcome.RETRIABLE_FAILURE) discard("failure of the final flush");
  }

  void discard(String reason) {
    int count = batch.clear();
    if (count == 0) return;
    metrics.incrementRecordsDropped(count);
    metrics.updatePendingRecords(0);
    logger.warning("Dropped " + count + " records due to " + reason);
  }

  /** Anything left at this point can never be delivered. */
  void stop() {
    queue.close(); // unblock producers, and reject further records
    int count = batch.clear() + queue.clear();
    if (count > 0) {
      metrics.incrementRecordsDropped(count);
      logger.warning("Dropped " + count + " records as ingestion stopped");
    }
    metrics.updateQueuedRecords(0);
    metrics.updatePendingRecords(0);
    state.set(State.STOPPED);
    stopped.countDown();
  }

  @Override public String toString() {
    return "IngestWorker{" + flusher.sender + "}";
  }
}
