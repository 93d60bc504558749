/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest.internal;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import quickwit.ingest.ClosedIngesterException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class RecordQueueTest {
  RecordQueue<Integer> queue = new RecordQueue<>(10);
  List<Integer> drained = new ArrayList<>();
  RecordConsumer<Integer> consumer = next -> drained.add(next);

  @Test void offer_failsWhenFull() {
    for (int i = 0; i < queue.maxSize(); i++) {
      assertThat(queue.offer(i)).isTrue();
    }
    assertThat(queue.offer(10)).isFalse();
    assertThat(queue.count()).isEqualTo(10);
  }

  @Test void offer_failsWhenClosed() {
    queue.close();

    assertThatThrownBy(() -> queue.offer(1))
      .isInstanceOf(ClosedIngesterException.class);
  }

  @Test void put_failsWhenClosed() {
    queue.close();

    assertThatThrownBy(() -> queue.put(1))
      .isInstanceOf(ClosedIngesterException.class);
  }

  @Test void put_waitsForSpace() throws InterruptedException {
    for (int i = 0; i < queue.maxSize(); i++) queue.offer(i);

    Thread producer = new Thread(() -> {
      try {
        queue.put(10);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    });
    producer.start();
    await().until(() -> producer.getState() == Thread.State.WAITING);

    queue.drainTo(consumer, 1, 0L);
    producer.join(1000);

    assertThat(producer.isAlive()).isFalse();
    queue.drainTo(consumer, 100, 0L);
    assertThat(drained).containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
  }

  @Test void close_wakesWaitingProducer() throws InterruptedException {
    for (int i = 0; i < queue.maxSize(); i++) queue.offer(i);

    AtomicReference<Throwable> error = new AtomicReference<>();
    Thread producer = new Thread(() -> {
      try {
        queue.put(10);
      } catch (Throwable t) {
        error.set(t);
      }
    });
    producer.start();
    await().until(() -> producer.getState() == Thread.State.WAITING);

    queue.close();
    producer.join(1000);

    assertThat(error.get()).isInstanceOf(ClosedIngesterException.class);
  }

  @Test void drainTo_respectsMaxElements() {
    for (int i = 0; i < 5; i++) queue.offer(i);

    assertThat(queue.drainTo(consumer, 2, 0L)).isEqualTo(2);
    assertThat(drained).containsExactly(0, 1);
    assertThat(queue.count()).isEqualTo(3);
  }

  @Test void drainTo_stopsWhenConsumerIsFull() {
    Batch<Integer> batch = new Batch<>(3);
    for (int i = 0; i < 5; i++) queue.offer(i);

    assertThat(queue.drainTo(batch, 10, 0L)).isEqualTo(3);
    assertThat(batch.records()).containsExactly(0, 1, 2);
    assertThat(queue.count()).isEqualTo(2);
  }

  @Test void drainTo_zeroMaxElementsOnlyWaits() {
    queue.offer(1);

    long start = System.nanoTime();
    assertThat(queue.drainTo(consumer, 0, TimeUnit.MILLISECONDS.toNanos(20))).isZero();

    assertThat(System.nanoTime() - start).isGreaterThanOrEqualTo(TimeUnit.MILLISECONDS.toNanos(20));
    assertThat(queue.count()).isEqualTo(1);
  }

  @Test void drainTo_returnsEarlyWhenClosed() {
    queue.close();

    long start = System.nanoTime();
    assertThat(queue.drainTo(consumer, 10, TimeUnit.SECONDS.toNanos(10))).isZero();

    assertThat(System.nanoTime() - start).isLessThan(TimeUnit.SECONDS.toNanos(1));
  }

  @Test void drainTo_wakesOnOffer() throws InterruptedException {
    Thread drainer = new Thread(() -> queue.drainTo(consumer, 10, TimeUnit.SECONDS.toNanos(10)));
    drainer.start();
    await().until(() -> drainer.getState() == Thread.State.TIMED_WAITING);

    queue.offer(1);
    drainer.join(1000);

    assertThat(drainer.isAlive()).isFalse();
    assertThat(drained).containsExactly(1);
  }

  @Test void closedQueueCanStillBeDrained() {
    queue.offer(1);
    queue.offer(2);
    queue.close();

    queue.drainTo(consumer, 10, 0L);

    assertThat(drained).containsExactly(1, 2);
  }

  @Test void circular() {
    // Offer more than the capacity, draining on each step
    for (int i = 0; i < 15; i++) {
      queue.offer(i);
      queue.drainTo(consumer, 1, 0L);
    }

    assertThat(drained)
      .containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14);
  }

  @Test void clear() {
    for (int i = 0; i < 4; i++) queue.offer(i);

    assertThat(queue.clear()).isEqualTo(4);
    assertThat(queue.count()).isZero();
  }

  @Test void maxSizeMustBePositive() {
    assertThatThrownBy(() -> new RecordQueue<>(0))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessage("maxSize <= 0: 0");
  }
}
