/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest.metrics.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;
import quickwit.ingest.IngestMetrics;

/**
 * Implementation of {@link IngestMetrics} with Micrometer. Meters are named with the prefix
 * "quickwit.ingest.".
 */
public class MicrometerIngestMetrics implements IngestMetrics {

  private static final String PREFIX = "quickwit.ingest.";

  final MeterRegistry meterRegistry;
  final Iterable<Tag> extraTags;

  final Counter messages;
  final Counter messageBytes;
  final Counter records;
  final Counter recordsDropped;
  final AtomicInteger queuedRecords;
  final AtomicInteger pendingRecords;

  /**
   * Registers all meters to the given registry, without extra tags.
   *
   * @see #builder(MeterRegistry)
   */
  public static MicrometerIngestMetrics create(MeterRegistry meterRegistry) {
    return new Builder(meterRegistry).build();
  }

  public static Builder builder(MeterRegistry meterRegistry) {
    return new Builder(meterRegistry);
  }

  private MicrometerIngestMetrics(MeterRegistry meterRegistry, Tag... extraTags) {
    this.meterRegistry = meterRegistry;
    this.extraTags = Arrays.asList(extraTags);

    messages = Counter.builder(PREFIX + "messages.total")
      .description("Ingest requests attempted")
      .tags(this.extraTags).register(meterRegistry);
    messageBytes = Counter.builder(PREFIX + "messages")
      .description("Total bytes of attempted ingest requests")
      .baseUnit("bytes")
      .tags(this.extraTags).register(meterRegistry);
    records = Counter.builder(PREFIX + "records.total")
      .description("Records accepted by ingest")
      .tags(this.extraTags).register(meterRegistry);
    recordsDropped = Counter.builder(PREFIX + "records.dropped")
      .description("Records dropped before delivery")
      .tags(this.extraTags).register(meterRegistry);
    queuedRecords = new AtomicInteger();
    Gauge.builder(PREFIX + "queue.records", queuedRecords, AtomicInteger::get)
      .description("Records waiting in the queue")
      .tags(this.extraTags).register(meterRegistry);
    pendingRecords = new AtomicInteger();
    Gauge.builder(PREFIX + "pending.records", pendingRecords, AtomicInteger::get)
      .description("Records held by the worker awaiting delivery")
      .tags(this.extraTags).register(meterRegistry);
  }

  @Override
  public void incrementMessages() {
    messages.increment();
  }

  @Override
  public void incrementMessagesFailed(Throwable cause) {
    Iterable<Tag> tags = Tags.concat(extraTags, "cause", cause.getClass().getSimpleName());
    meterRegistry.counter(PREFIX + "messages.failed", tags).increment();
  }

  @Override
  public void incrementMessageBytes(int quantity) {
    messageBytes.increment(quantity);
  }

  @Override
  public void incrementRecords(int quantity) {
    records.increment(quantity);
  }

  @Override
  public void incrementRecordsDropped(int quantity) {
    recordsDropped.increment(quantity);
  }

  @Override
  public void updateQueuedRecords(int update) {
    queuedRecords.set(update);
  }

  @Override
  public void updatePendingRecords(int update) {
    pendingRecords.set(update);
  }

  @Override public String toString() {
    return "MicrometerIngestMetrics{" + extraTags + "}";
  }

  public static final class Builder {
    final MeterRegistry meterRegistry;
    Tag[] extraTags = new Tag[0];

    Builder(MeterRegistry meterRegistry) {
      if (meterRegistry == null) throw new NullPointerException("meterRegistry == null");
      this.meterRegistry = meterRegistry;
    }

    /** Additional tags to attach to all ingest meters, such as the index name. */
    public Builder extraTags(Tag... extraTags) {
      if (extraTags == null) throw new NullPointerException("extraTags == null");
      this.extraTags = extraTags;
      return this;
    }

    public MicrometerIngestMetrics build() {
      return new MicrometerIngestMetrics(meterRegistry, extraTags);
    }
  }
}
