/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest.internal;

import java.util.Arrays;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import quickwit.ingest.ClosedIngesterException;

/**
 * Multi-producer, single-consumer queue that is bounded by count.
 *
 * <p>This is similar to {@link java.util.concurrent.ArrayBlockingQueue} in implementation, except
 * it can be closed. Once closed, producers fail with {@link ClosedIngesterException} and the
 * consumer can drain what remains.
 */
public final class RecordQueue<R> {
  final ReentrantLock lock = new ReentrantLock(false);
  final Condition available = lock.newCondition();
  final Condition space = lock.newCondition();

  final int maxSize;
  final R[] elements;
  int count;
  int writePos;
  int readPos;
  boolean closed;

  @SuppressWarnings("unchecked") public RecordQueue(int maxSize) {
    if (maxSize <= 0) throw new IllegalArgumentException("maxSize <= 0: " + maxSize);
    this.elements = (R[]) new Object[maxSize];
    this.maxSize = maxSize;
  }

  /**
   * Returns true if the record could be added or false if the queue is full.
   *
   * @throws ClosedIngesterException if the queue was closed
   */
  public boolean offer(R next) {
    lock.lock();
    try {
      if (closed) throw new ClosedIngesterException();
      if (count == maxSize) return false;
      enqueue(next);
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits for space to add the record.
   *
   * @throws ClosedIngesterException if the queue was closed before or while waiting
   */
  public void put(R next) throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (count == maxSize && !closed) {
        space.await();
      }
      if (closed) throw new ClosedIngesterException();
      enqueue(next);
    } finally {
      lock.unlock();
    }
  }

  void enqueue(R next) {
    elements[writePos++] = next;

    if (writePos == maxSize) writePos = 0; // circle back to the front of the array

    count++;

    available.signal(); // alert the drainer
  }

  /**
   * Blocks for up to nanosTimeout for records to appear, then moves up to maxElements of them to
   * the consumer in FIFO order. When maxElements is zero, this only waits, returning early if the
   * queue is closed.
   *
   * @return the count of records drained
   */
  public int drainTo(RecordConsumer<R> consumer, int maxElements, long nanosTimeout) {
    try {
      lock.lockInterruptibly();
      try {
        long nanosLeft = nanosTimeout;
        while ((count == 0 || maxElements == 0) && !closed) {
          if (nanosLeft <= 0) return 0;
          nanosLeft = available.awaitNanos(nanosLeft);
        }
        return doDrain(consumer, maxElements);
      } finally {
        lock.unlock();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return 0;
    }
  }

  int doDrain(RecordConsumer<R> consumer, int maxElements) {
    int drainedCount = 0;
    while (drainedCount < maxElements && count > 0) {
      R next = elements[readPos];
      if (!consumer.offer(next)) break;

      elements[readPos] = null;
      if (++readPos == elements.length) readPos = 0; // circle back to the front of the array
      count--;
      drainedCount++;
    }
    if (drainedCount > 0) space.signalAll(); // alert blocked producers
    return drainedCount;
  }

  /** Stops accepting records and wakes every waiting producer and consumer. Idempotent. */
  public void close() {
    lock.lock();
    try {
      closed = true;
      available.signalAll();
      space.signalAll();
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  /** Clears the queue unconditionally and returns count of records cleared. */
  public int clear() {
    lock.lock();
    try {
      int result = count;
      count = readPos = writePos = 0;
      Arrays.fill(elements, null);
      space.signalAll();
      return result;
    } finally {
      lock.unlock();
    }
  }

  public int count() {
    lock.lock();
    try {
      return count;
    } finally {
      lock.unlock();
    }
  }

  public int maxSize() {
    return maxSize;
  }
}
