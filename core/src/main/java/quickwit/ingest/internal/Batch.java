/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest.internal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Records pending delivery, in the order they were ingested. Only the worker thread touches this
 * type, so it has no locking.
 *
 * <p>The batch stops accepting records once it holds {@code maxSize} of them. When a flush fails,
 * the batch is retained as-is and is sent again on the next trigger. Only while closing can it
 * grow past {@code maxSize}.
 */
public final class Batch<R> implements RecordConsumer<R> {
  final int maxSize;
  final ArrayList<R> records;

  public Batch(int maxSize) {
    if (maxSize <= 0) throw new IllegalArgumentException("maxSize <= 0: " + maxSize);
    this.maxSize = maxSize;
    this.records = new ArrayList<>(maxSize);
  }

  @Override public boolean offer(R next) {
    if (records.size() >= maxSize) return false;
    records.add(next);
    return true;
  }

  /** Accepts every record regardless of {@code maxSize}. Used to hold what is left at close. */
  RecordConsumer<R> ignoringMaxSize() {
    return next -> {
      records.add(next);
      return true;
    };
  }

  /** Count of records that can be accepted before the batch is full. */
  public int remaining() {
    return Math.max(0, maxSize - records.size());
  }

  public boolean isFull() {
    return records.size() >= maxSize;
  }

  public boolean isEmpty() {
    return records.isEmpty();
  }

  public int count() {
    return records.size();
  }

  public int maxSize() {
    return maxSize;
  }

  /** Read-only view in ingest order. */
  public List<R> records() {
    return Collections.unmodifiableList(records);
  }

  /** Removes the record at the current position of the iterator, used to evict unencodable data. */
  Iterator<R> iterator() {
    return records.iterator();
  }

  /** Drains the batch, returning the count of records removed. */
  public int clear() {
    int result = records.size();
    records.clear();
    return result;
  }

  @Override public String toString() {
    return "Batch{count=" + records.size() + ", maxSize=" + maxSize + "}";
  }
}
