/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest.internal;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchTest {
  Batch<String> batch = new Batch<>(2);

  @Test void offer_rejectsWhenFull() {
    assertThat(batch.offer("a")).isTrue();
    assertThat(batch.isFull()).isFalse();
    assertThat(batch.offer("b")).isTrue();
    assertThat(batch.isFull()).isTrue();
    assertThat(batch.offer("c")).isFalse();

    assertThat(batch.records()).containsExactly("a", "b");
    assertThat(batch.remaining()).isZero();
  }

  @Test void clear() {
    batch.offer("a");

    assertThat(batch.clear()).isEqualTo(1);
    assertThat(batch.isEmpty()).isTrue();
    assertThat(batch.remaining()).isEqualTo(2);
  }

  @Test void ignoringMaxSize_acceptsPastCapacity() {
    batch.offer("a");
    batch.offer("b");

    assertThat(batch.ignoringMaxSize().offer("c")).isTrue();

    assertThat(batch.records()).containsExactly("a", "b", "c");
    assertThat(batch.remaining()).isZero();
    assertThat(batch.offer("d")).isFalse();
  }

  @Test void records_isReadOnly() {
    batch.offer("a");

    assertThatThrownBy(() -> batch.records().add("b"))
      .isInstanceOf(UnsupportedOperationException.class);
  }
}
