/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest.internal;

import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;
import quickwit.ingest.ClosedSenderException;
import quickwit.ingest.FakeSender;
import quickwit.ingest.InMemoryIngestMetrics;
import quickwit.ingest.IngestStatusException;
import quickwit.ingest.RecordEncoder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static quickwit.ingest.TestObjects.STRING_ENCODER;
import static quickwit.ingest.TestObjects.json;

class FlusherTest {
  FakeSender sender = new FakeSender();
  InMemoryIngestMetrics metrics = new InMemoryIngestMetrics();
  Flusher<String> flusher = new Flusher<>(sender, STRING_ENCODER, metrics);
  Batch<String> batch = new Batch<>(10);

  @Test void emptyBatch_sendsNothing() {
    assertThat(flusher.flush(batch)).isEqualTo(FlushOutcome.EMPTY);

    assertThat(sender.attempts()).isEmpty();
    assertThat(metrics.messages()).isZero();
  }

  @Test void success_drainsBatch() {
    batch.offer("a");
    batch.offer("b");

    assertThat(flusher.flush(batch)).isEqualTo(FlushOutcome.SUCCESS);

    assertThat(batch.isEmpty()).isTrue();
    assertThat(sender.attempts()).containsExactly(json("a") + "\n" + json("b") + "\n");
    assertThat(metrics.messages()).isEqualTo(1);
    assertThat(metrics.pendingRecords()).isZero();
  }

  @Test void transportError_retainsBatch() {
    sender.failNext(new IOException("Connection reset"));
    batch.offer("a");
    batch.offer("b");

    assertThat(flusher.flush(batch)).isEqualTo(FlushOutcome.RETRIABLE_FAILURE);

    assertThat(batch.records()).containsExactly("a", "b");
    assertThat(metrics.messagesFailed()).isEqualTo(1);
    assertThat(metrics.pendingRecords()).isEqualTo(2);
  }

  @Test void retry_sendsIdenticalBody() {
    sender.failNext(new IOException("Connection reset"));
    batch.offer("a");
    batch.offer("b");

    flusher.flush(batch);
    assertThat(flusher.flush(batch)).isEqualTo(FlushOutcome.SUCCESS);

    assertThat(sender.attempts()).hasSize(2);
    assertThat(sender.attempts().get(0)).isEqualTo(sender.attempts().get(1));
    assertThat(sender.delivered()).containsExactly(List.of(json("a"), json("b")));
  }

  @Test void errorStatus_retainsBatch() {
    sender.failNext(new IngestStatusException(500, "internal error"));
    batch.offer("a");

    assertThat(flusher.flush(batch)).isEqualTo(FlushOutcome.RETRIABLE_FAILURE);

    assertThat(batch.records()).containsExactly("a");
    assertThat(metrics.messagesFailedByCause())
      .containsEntry(IngestStatusException.class, 1L);
  }

  @Test void unexpectedRuntimeException_isRetriable() {
    sender.failNext(new IllegalStateException("pool exhausted"));
    batch.offer("a");

    assertThat(flusher.flush(batch)).isEqualTo(FlushOutcome.RETRIABLE_FAILURE);
    assertThat(batch.records()).containsExactly("a");
  }

  @Test void closedSender_isFatal() {
    sender.close();
    batch.offer("a");

    assertThat(flusher.flush(batch)).isEqualTo(FlushOutcome.FATAL_FAILURE);
    assertThat(metrics.messagesFailedByCause())
      .containsEntry(ClosedSenderException.class, 1L);
  }

  @Test void malformedRequest_isFatal() {
    sender.failNext(new IllegalArgumentException("unexpected url"));
    batch.offer("a");

    assertThat(flusher.flush(batch)).isEqualTo(FlushOutcome.FATAL_FAILURE);
  }

  @Test void fatalErrorsPropagate() {
    sender.failNext(new StackOverflowError());
    batch.offer("a");

    assertThatThrownBy(() -> flusher.flush(batch)).isInstanceOf(StackOverflowError.class);
  }

  @Test void unencodableRecord_isEvicted() {
    RecordEncoder<String> encoder = record -> {
      if (record.equals("bad")) throw new IllegalArgumentException("not json");
      return STRING_ENCODER.encode(record);
    };
    Flusher<String> flusher = new Flusher<>(sender, encoder, metrics);
    batch.offer("a");
    batch.offer("bad");
    batch.offer("c");

    assertThat(flusher.flush(batch)).isEqualTo(FlushOutcome.SUCCESS);

    assertThat(sender.delivered()).containsExactly(List.of(json("a"), json("c")));
    assertThat(metrics.recordsDropped()).isEqualTo(1);
  }

  @Test void onlyUnencodableRecords_sendsNothing() {
    Flusher<String> flusher = new Flusher<>(sender, record -> {
      throw new IllegalArgumentException("not json");
    }, metrics);
    batch.offer("a");

    assertThat(flusher.flush(batch)).isEqualTo(FlushOutcome.EMPTY);
    assertThat(batch.isEmpty()).isTrue();
    assertThat(sender.attempts()).isEmpty();
  }
}
