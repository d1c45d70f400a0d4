package com.databricks.batcher;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.ToLongFunction;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups a sequence of records into batches bounded by a record count and a summed record size.
 *
 * <p>Records are pulled from the source one at a time. Each record is measured once with the size
 * function and then either appended to the open batch, or placed at the start of a new batch after
 * the open one is emitted, or, if it is larger than the record size limit, handled according to the
 * {@link OversizedRecordPolicy}. Records keep their order within and across batches, and every
 * emitted batch is non-empty and within both limits.
 *
 * <p>A batcher makes a single pass over its source. Batches can be consumed lazily through {@link
 * #iterator()} or {@link #stream()}, which hold at most one open batch in memory and work with
 * unbounded sources, or collected with {@link #batches()}. All of them share the same state: once
 * the source is drained, iterating again yields nothing.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Batcher<String> batcher = Batcher.builder(records)
 *     .maxBatchLen(500)
 *     .maxBatchSize(4 * 1024 * 1024)
 *     .sizeCalculator(RecordSizes.utf8Length())
 *     .whenRecordSizeExceeded(OversizedRecordPolicy.SKIP)
 *     .build();
 *
 * for (List<String> batch : batcher) {
 *     sink.write(batch);
 * }
 * }</pre>
 *
 * <p>Instances are not thread-safe.
 *
 * @param <T> The record type
 * @see BatcherBuilder
 */
public final class Batcher<T> implements Iterable<List<T>> {

  private static final Logger logger = LoggerFactory.getLogger(Batcher.class);

  private enum State {
    ACTIVE,
    EXHAUSTED,
    FAILED
  }

  private final Iterator<? extends T> source;
  private final BatcherOptions options;
  private final ToLongFunction<? super T> sizeCalculator;
  private final Optional<Long> maxRecordSize;
  private final BatchWindow<T> window;
  private final BatchIterator batchIterator = new BatchIterator();

  private State state = State.ACTIVE;
  @Nullable private List<T> pending;
  private long emittedBatches = 0;
  private long skippedRecords = 0;

  /**
   * Creates a batcher that counts every record as size 1.
   *
   * @param records The records to batch, iterated once
   * @param options The batch limits
   * @throws ConfigurationException if an argument is null
   */
  public Batcher(@Nonnull Iterable<? extends T> records, @Nonnull BatcherOptions options) {
    this(iteratorOf(records), options, RecordSizes.one());
  }

  /**
   * Creates a batcher.
   *
   * @param records The records to batch, iterated once
   * @param options The batch limits
   * @param sizeCalculator Measures each record
   * @throws ConfigurationException if an argument is null
   */
  public Batcher(
      @Nonnull Iterable<? extends T> records,
      @Nonnull BatcherOptions options,
      @Nonnull ToLongFunction<? super T> sizeCalculator) {
    this(iteratorOf(records), options, sizeCalculator);
  }

  Batcher(
      @Nonnull Iterator<? extends T> source,
      @Nonnull BatcherOptions options,
      @Nonnull ToLongFunction<? super T> sizeCalculator) {
    if (source == null) {
      throw new ConfigurationException("records cannot be null");
    }
    if (options == null) {
      throw new ConfigurationException("options cannot be null");
    }
    if (sizeCalculator == null) {
      throw new ConfigurationException("sizeCalculator cannot be null");
    }
    this.source = source;
    this.options = options;
    this.sizeCalculator = sizeCalculator;
    this.maxRecordSize = options.effectiveMaxRecordSize();
    this.window = new BatchWindow<>(options);
    logger.debug("Batcher created with {}", options);
  }

  /**
   * Returns a builder for a batcher over the given records.
   *
   * @param records The records to batch, iterated once
   * @param <T> The record type
   * @return a new builder
   */
  @Nonnull
  public static <T> BatcherBuilder<T> builder(@Nonnull Iterable<? extends T> records) {
    return new BatcherBuilder<>(iteratorOf(records));
  }

  /**
   * Returns a builder for a batcher that takes ownership of the given iterator.
   *
   * @param records The records to batch
   * @param <T> The record type
   * @return a new builder
   */
  @Nonnull
  public static <T> BatcherBuilder<T> builder(@Nonnull Iterator<? extends T> records) {
    return new BatcherBuilder<>(records);
  }

  /**
   * Returns a builder for a batcher over the given stream.
   *
   * <p>The stream is consumed through its iterator and is not closed by the batcher.
   *
   * @param records The records to batch
   * @param <T> The record type
   * @return a new builder
   */
  @Nonnull
  public static <T> BatcherBuilder<T> builder(@Nonnull Stream<? extends T> records) {
    if (records == null) {
      throw new ConfigurationException("records cannot be null");
    }
    return new BatcherBuilder<>(records.iterator());
  }

  /**
   * Collects all remaining batches.
   *
   * <p>This drains the source, so it never returns for an unbounded source. Prefer {@link
   * #iterator()} or {@link #stream()} for large inputs.
   *
   * @return the remaining batches in order; empty if the source is already drained
   * @throws RecordTooLargeException if a record is too large and the policy is {@link
   *     OversizedRecordPolicy#ERROR}
   */
  @Nonnull
  public List<List<T>> batches() {
    List<List<T>> batches = new ArrayList<>();
    batchIterator.forEachRemaining(batches::add);
    return batches;
  }

  /**
   * Returns a lazy iterator over the remaining batches.
   *
   * <p>Every call returns a view of the same single-pass state. A batch is assembled when {@link
   * Iterator#hasNext()} is called, pulling records only until the batch is complete. Errors are
   * thrown from {@code hasNext()} or {@code next()}, after which the iterator is empty.
   *
   * @return an iterator over the remaining batches
   */
  @Override
  @Nonnull
  public Iterator<List<T>> iterator() {
    return batchIterator;
  }

  /**
   * Returns the remaining batches as a lazy, sequential, ordered stream.
   *
   * @return a stream over the remaining batches
   */
  @Nonnull
  public Stream<List<T>> stream() {
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(
            batchIterator, Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  /** Returns the options this batcher was built with. */
  @Nonnull
  public BatcherOptions options() {
    return options;
  }

  /** Returns how many oversized records were dropped so far under the skip policy. */
  public long skippedRecords() {
    return skippedRecords;
  }

  /**
   * Assembles the next batch.
   *
   * @return the next batch, or null if the source is drained and nothing is left open
   */
  @Nullable private List<T> nextBatch() {
    while (source.hasNext()) {
      T record = source.next();
      long recordSize = measure(record);

      if (maxRecordSize.isPresent() && recordSize > maxRecordSize.get()) {
        rejectOversized(record, recordSize, maxRecordSize.get());
        continue;
      }

      if (!window.isEmpty() && window.wouldOverflow(recordSize)) {
        List<T> batch = window.close();
        window.add(record, recordSize);
        return batch;
      }

      window.add(record, recordSize);
      if (window.isFull()) {
        return window.close();
      }
    }
    return window.isEmpty() ? null : window.close();
  }

  private long measure(T record) {
    long recordSize = sizeCalculator.applyAsLong(record);
    if (recordSize < 0) {
      throw new BatcherException(
          "Size function returned a negative size (" + recordSize + ") for record: " + record);
    }
    return recordSize;
  }

  private void rejectOversized(T record, long recordSize, long limit) {
    switch (options.whenRecordSizeExceeded()) {
      case SKIP:
        skippedRecords++;
        logger.debug("Skipping record of size {} above the limit of {}", recordSize, limit);
        return;
      case ERROR:
      default:
        throw new RecordTooLargeException(record, recordSize, limit);
    }
  }

  private void fail(RuntimeException e) {
    state = State.FAILED;
    window.discard();
    logger.warn("Batcher stopped after {} batches", emittedBatches, e);
  }

  private static <T> Iterator<? extends T> iteratorOf(Iterable<? extends T> records) {
    if (records == null) {
      throw new ConfigurationException("records cannot be null");
    }
    return records.iterator();
  }

  /** Pulls batches out of the shared windowing state. */
  private final class BatchIterator implements Iterator<List<T>> {

    @Override
    public boolean hasNext() {
      if (pending != null) {
        return true;
      }
      if (state != State.ACTIVE) {
        return false;
      }
      try {
        pending = nextBatch();
      } catch (RuntimeException e) {
        fail(e);
        throw e;
      }
      if (pending == null) {
        state = State.EXHAUSTED;
        logger.debug(
            "Source drained after {} batches, {} records skipped", emittedBatches, skippedRecords);
        return false;
      }
      emittedBatches++;
      logger.debug("Emitting batch {} with {} records", emittedBatches, pending.size());
      return true;
    }

    @Override
    public List<T> next() {
      if (!hasNext()) {
        throw new NoSuchElementException("No more batches");
      }
      List<T> batch = pending;
      pending = null;
      return batch;
    }
  }
}
