package com.databricks.batcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The open batch of a {@link Batcher}: the records accumulated so far and their summed size.
 *
 * <p>Not thread-safe. Owned by a single batcher.
 *
 * @param <T> The record type
 */
final class BatchWindow<T> {

  private final Optional<Integer> maxBatchLen;
  private final Optional<Long> maxBatchSize;

  private List<T> records = new ArrayList<>();
  private long size = 0;

  BatchWindow(BatcherOptions options) {
    this.maxBatchLen = options.maxBatchLen();
    this.maxBatchSize = options.maxBatchSize();
  }

  boolean isEmpty() {
    return records.isEmpty();
  }

  /**
   * Returns true if adding a record of the given size would break either limit.
   *
   * <p>Limits are checked independently: breaking one of them is enough. The size check is
   * written without addition since {@code size} never exceeds the batch size limit.
   */
  boolean wouldOverflow(long recordSize) {
    boolean lenExceeded = maxBatchLen.isPresent() && records.size() + 1 > maxBatchLen.get();
    boolean sizeExceeded = maxBatchSize.isPresent() && recordSize > maxBatchSize.get() - size;
    return lenExceeded || sizeExceeded;
  }

  /** Returns true if the window holds as many records as a batch may have. */
  boolean isFull() {
    return maxBatchLen.isPresent() && records.size() >= maxBatchLen.get();
  }

  void add(T record, long recordSize) {
    records.add(record);
    size += recordSize;
  }

  /** Hands out the accumulated records as an unmodifiable batch and empties the window. */
  List<T> close() {
    List<T> batch = Collections.unmodifiableList(records);
    records = new ArrayList<>();
    size = 0;
    return batch;
  }

  /** Drops the accumulated records without emitting them. */
  void discard() {
    records = new ArrayList<>();
    size = 0;
  }
}
