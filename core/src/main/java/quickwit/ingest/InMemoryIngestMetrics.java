/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

public final class InMemoryIngestMetrics implements IngestMetrics {
  enum MetricKey {
    messages,
    messageBytes,
    records,
    recordsDropped,
    recordsQueued,
    recordsPending
  }

  private final ConcurrentHashMap<MetricKey, AtomicLong> metrics = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<Class<? extends Throwable>, AtomicLong> messagesFailed =
    new ConcurrentHashMap<>();

  @Override public void incrementMessages() {
    increment(MetricKey.messages, 1);
  }

  public long messages() {
    return get(MetricKey.messages);
  }

  @Override public void incrementMessagesFailed(Throwable cause) {
    messagesFailed.computeIfAbsent(cause.getClass(), k -> new AtomicLong()).incrementAndGet();
  }

  public Map<Class<? extends Throwable>, Long> messagesFailedByCause() {
    Map<Class<? extends Throwable>, Long> result = new LinkedHashMap<>(messagesFailed.size());
    for (Map.Entry<Class<? extends Throwable>, AtomicLong> kv : messagesFailed.entrySet()) {
      result.put(kv.getKey(), kv.getValue().longValue());
    }
    return result;
  }

  public long messagesFailed() {
    long result = 0L;
    for (AtomicLong count : messagesFailed.values()) {
      result += count.longValue();
    }
    return result;
  }

  @Override public void incrementMessageBytes(int quantity) {
    increment(MetricKey.messageBytes, quantity);
  }

  public long messageBytes() {
    return get(MetricKey.messageBytes);
  }

  @Override public void incrementRecords(int quantity) {
    increment(MetricKey.records, quantity);
  }

  public long records() {
    return get(MetricKey.records);
  }

  @Override public void incrementRecordsDropped(int quantity) {
    increment(MetricKey.recordsDropped, quantity);
  }

  public long recordsDropped() {
    return get(MetricKey.recordsDropped);
  }

  @Override public void updateQueuedRecords(int update) {
    update(MetricKey.recordsQueued, update);
  }

  public long queuedRecords() {
    return get(MetricKey.recordsQueued);
  }

  @Override public void updatePendingRecords(int update) {
    update(MetricKey.recordsPending, update);
  }

  public long pendingRecords() {
    return get(MetricKey.recordsPending);
  }

  public void clear() {
    metrics.clear();
    messagesFailed.clear();
  }

  private long get(MetricKey key) {
    AtomicLong atomic = metrics.get(key);
    return atomic == null ? 0 : atomic.get();
  }

  private void increment(MetricKey key, int quantity) {
    if (quantity == 0) return;
    metrics.computeIfAbsent(key, k -> new AtomicLong()).addAndGet(quantity);
  }

  private void update(MetricKey key, int update) {
    metrics.computeIfAbsent(key, k -> new AtomicLong()).set(update);
  }

  @Override public String toString() {
    return "InMemoryIngestMetrics{" + metrics + ", messagesFailed=" + messagesFailed + "}";
  }
}
