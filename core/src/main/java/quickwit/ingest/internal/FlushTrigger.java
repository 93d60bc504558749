/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest.internal;

/**
 * Decides when the worker flushes. There are two triggers: the batch reaching its size, and a
 * timer that ticks at a fixed period from worker start.
 *
 * <p>The timer is not reset by size-triggered flushes. A tick that follows a size-triggered flush
 * closely is a no-op when the batch is still empty.
 *
 * <p>After a failed flush, neither trigger fires until a backoff elapses. The backoff doubles with
 * each consecutive failure, up to a maximum, and resets on success.
 *
 * <p>All times are {@link System#nanoTime()} values passed in by the caller.
 */
public final class FlushTrigger {
  final long periodNanos, initialBackoffNanos, maxBackoffNanos;
  long nextTickNanos;
  long retryAfterNanos;
  int consecutiveFailures;

  public FlushTrigger(long startNanos, long periodNanos, long initialBackoffNanos,
    long maxBackoffNanos) {
    if (periodNanos <= 0) throw new IllegalArgumentException("periodNanos <= 0: " + periodNanos);
    if (initialBackoffNanos < 0) {
      throw new IllegalArgumentException("initialBackoffNanos < 0: " + initialBackoffNanos);
    }
    if (maxBackoffNanos < initialBackoffNanos) {
      throw new IllegalArgumentException("maxBackoffNanos < initialBackoffNanos");
    }
    this.periodNanos = periodNanos;
    this.initialBackoffNanos = initialBackoffNanos;
    this.maxBackoffNanos = maxBackoffNanos;
    this.nextTickNanos = startNanos + periodNanos;
  }

  /**
   * Returns true once per elapsed period. Ticks missed while the worker was busy collapse into
   * one.
   */
  public boolean tick(long nowNanos) {
    if (nowNanos - nextTickNanos < 0) return false;
    long missed = (nowNanos - nextTickNanos) / periodNanos;
    nextTickNanos += (missed + 1) * periodNanos;
    return true;
  }

  /** True when the batch is full and no backoff is in effect. */
  public boolean sizeTriggered(Batch<?> batch, long nowNanos) {
    return batch.isFull() && !backingOff(nowNanos);
  }

  public boolean backingOff(long nowNanos) {
    return consecutiveFailures > 0 && nowNanos - retryAfterNanos < 0;
  }

  /** How long the worker may wait for records before it needs to look at a trigger again. */
  public long nanosUntilNextEvent(long nowNanos) {
    long result = nextTickNanos - nowNanos;
    if (backingOff(nowNanos)) result = Math.min(result, retryAfterNanos - nowNanos);
    return Math.max(0, result);
  }

  public void onSuccess() {
    consecutiveFailures = 0;
  }

  public void onFailure(long nowNanos) {
    consecutiveFailures++;
    retryAfterNanos = nowNanos + backoffNanos(consecutiveFailures);
  }

  long backoffNanos(int failures) {
    long result = initialBackoffNanos;
    for (int i = 1; i < failures && result < maxBackoffNanos; i++) {
      result <<= 1;
    }
    return Math.min(result, maxBackoffNanos);
  }

  public int consecutiveFailures() {
    return consecutiveFailures;
  }

  @Override public String toString() {
    return "FlushTrigger{periodNanos=" + periodNanos
      + ", consecutiveFailures=" + consecutiveFailures + "}";
  }
}
