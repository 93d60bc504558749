/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest.internal;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import quickwit.ingest.ClosedSenderException;
import quickwit.ingest.IngestMetrics;
import quickwit.ingest.IngestSender;
import quickwit.ingest.IngestStatusException;
import quickwit.ingest.JsonLines;
import quickwit.ingest.RecordEncoder;

import static java.lang.String.format;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.SEVERE;
import static java.util.logging.Level.WARNING;

/**
 * Encodes the pending batch and sends it. The batch is drained only when the sender returns
 * normally. On a retriable failure it is left untouched, so the next attempt sends the same
 * records in the same order.
 */
public final class Flusher<R> {
  static final Logger logger = Logger.getLogger(Flusher.class.getName());

  final IngestSender sender;
  final RecordEncoder<R> encoder;
  final IngestMetrics metrics;

  /** Tracks if we should log the next failure at WARNING. Reset on success. */
  boolean shouldWarnException = true;

  public Flusher(IngestSender sender, RecordEncoder<R> encoder, IngestMetrics metrics) {
    this.sender = sender;
    this.encoder = encoder;
    this.metrics = metrics;
  }

  public FlushOutcome flush(Batch<R> batch) {
    if (batch.isEmpty()) return FlushOutcome.EMPTY;

    List<byte[]> encodedRecords = encode(batch);
    if (encodedRecords.isEmpty()) return FlushOutcome.EMPTY;

    metrics.incrementMessages();
    metrics.incrementMessageBytes(JsonLines.sizeInBytes(encodedRecords));

    try {
      sender.send(encodedRecords);
    } catch (Throwable t) {
      Throwables.propagateIfFatal(t);
      metrics.incrementMessagesFailed(t);
      metrics.updatePendingRecords(batch.count());

      if (t instanceof ClosedSenderException || t instanceof IllegalArgumentException) {
        logger.log(SEVERE, format("Cannot send records to %s. Ingestion will stop.", sender), t);
        return FlushOutcome.FATAL_FAILURE;
      }

      logRetriableFailure(batch.count(), t);
      return FlushOutcome.RETRIABLE_FAILURE;
    }

    int delivered = batch.clear();
    metrics.updatePendingRecords(0);
    if (!shouldWarnException) {
      logger.info(format("Resumed delivery to %s with %s records", sender, delivered));
      shouldWarnException = true;
    }
    return FlushOutcome.SUCCESS;
  }

  /** Encodes each record in order, evicting those the encoder rejects. */
  List<byte[]> encode(Batch<R> batch) {
    List<byte[]> result = new ArrayList<>(batch.count());
    int dropped = 0;
    for (Iterator<R> i = batch.iterator(); i.hasNext(); ) {
      R next = i.next();
      try {
        result.add(encoder.encode(next));
      } catch (RuntimeException e) {
        i.remove();
        dropped++;
        if (logger.isLoggable(WARNING)) {
          logger.log(WARNING, format("Dropped a %s record that could not be encoded: %s",
            next.getClass().getName(), e.getMessage()), e);
        }
      }
    }
    if (dropped > 0) metrics.incrementRecordsDropped(dropped);
    return result;
  }

  void logRetriableFailure(int count, Throwable t) {
    Level logLevel = FINE;

    if (shouldWarnException) {
      logger.log(WARNING, "Records will be retried due to a failed ingest. "
        + "Subsequent errors will be logged at FINE level until delivery resumes.");
      logLevel = WARNING;
      shouldWarnException = false;
    }

    if (!logger.isLoggable(logLevel)) return;
    if (t instanceof IngestStatusException) {
      logger.log(logLevel, format("Retaining %s records: ingest status %s: %s", count,
        ((IngestStatusException) t).statusCode(), t.getMessage()));
    } else {
      logger.log(logLevel, format("Retaining %s records due to %s(%s)", count,
        t.getClass().getSimpleName(), t.getMessage() == null ? "" : t.getMessage()), t);
    }
  }

  @Override public String toString() {
    return "Flusher{" + sender + "}";
  }
}
