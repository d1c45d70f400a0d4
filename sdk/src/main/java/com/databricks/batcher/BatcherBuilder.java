package com.databricks.batcher;

import java.util.Iterator;
import java.util.function.ToLongFunction;
import javax.annotation.Nonnull;

/**
 * Builder for creating a {@link Batcher} with a fluent API.
 *
 * <p>Obtain one with {@link Batcher#builder(Iterable)}, {@link Batcher#builder(Iterator)} or
 * {@link Batcher#builder(java.util.stream.Stream)}. At least one of {@link #maxBatchLen(int)} and
 * {@link #maxBatchSize(long)} must be set before {@link #build()}.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Batcher<byte[]> batcher = Batcher.builder(payloads)
 *     .maxBatchLen(3)
 *     .maxBatchSize(5)
 *     .sizeCalculator(RecordSizes.byteArrayLength())
 *     .whenRecordSizeExceeded(OversizedRecordPolicy.SKIP)
 *     .build();
 * }</pre>
 *
 * @param <T> The record type
 */
public class BatcherBuilder<T> {

  private final Iterator<? extends T> records;
  private BatcherOptions.BatcherOptionsBuilder optionsBuilder = BatcherOptions.builder();
  private ToLongFunction<? super T> sizeCalculator = RecordSizes.one();

  BatcherBuilder(Iterator<? extends T> records) {
    if (records == null) {
      throw new ConfigurationException("records cannot be null");
    }
    this.records = records;
  }

  /**
   * Sets the maximum number of records in one batch.
   *
   * @param maxBatchLen the record count limit, must be positive
   * @return this builder for method chaining
   */
  @Nonnull
  public BatcherBuilder<T> maxBatchLen(int maxBatchLen) {
    optionsBuilder.setMaxBatchLen(maxBatchLen);
    return this;
  }

  /**
   * Sets the maximum summed size of the records in one batch.
   *
   * @param maxBatchSize the batch size limit, must be positive
   * @return this builder for method chaining
   */
  @Nonnull
  public BatcherBuilder<T> maxBatchSize(long maxBatchSize) {
    optionsBuilder.setMaxBatchSize(maxBatchSize);
    return this;
  }

  /**
   * Sets the maximum size of a single record. Defaults to the batch size limit.
   *
   * @param maxRecordSize the record size limit, must be positive
   * @return this builder for method chaining
   */
  @Nonnull
  public BatcherBuilder<T> maxRecordSize(long maxRecordSize) {
    optionsBuilder.setMaxRecordSize(maxRecordSize);
    return this;
  }

  /**
   * Sets the function that measures each record. Defaults to {@link RecordSizes#one()}.
   *
   * <p>The function is called exactly once per record and must not return a negative size.
   * Exceptions it throws reach the caller unchanged.
   *
   * @param sizeCalculator the size function
   * @return this builder for method chaining
   */
  @Nonnull
  public BatcherBuilder<T> sizeCalculator(@Nonnull ToLongFunction<? super T> sizeCalculator) {
    if (sizeCalculator == null) {
      throw new ConfigurationException("sizeCalculator cannot be null");
    }
    this.sizeCalculator = sizeCalculator;
    return this;
  }

  /**
   * Sets what happens to a record above the record size limit. Defaults to {@link
   * OversizedRecordPolicy#ERROR}.
   *
   * @param policy the oversized record policy
   * @return this builder for method chaining
   */
  @Nonnull
  public BatcherBuilder<T> whenRecordSizeExceeded(@Nonnull OversizedRecordPolicy policy) {
    if (policy == null) {
      throw new ConfigurationException("whenRecordSizeExceeded cannot be null");
    }
    optionsBuilder.setWhenRecordSizeExceeded(policy);
    return this;
  }

  /**
   * Replaces all limits and the policy with the given options.
   *
   * @param options the options to start from
   * @return this builder for method chaining
   */
  @Nonnull
  public BatcherBuilder<T> options(@Nonnull BatcherOptions options) {
    if (options == null) {
      throw new ConfigurationException("options cannot be null");
    }
    this.optionsBuilder = options.toBuilder();
    return this;
  }

  /**
   * Builds the batcher. No records are pulled until batches are requested.
   *
   * @return a new batcher
   * @throws ConfigurationException if the configured limits are invalid
   */
  @Nonnull
  public Batcher<T> build() {
    return new Batcher<>(records, optionsBuilder.build(), sizeCalculator);
  }
}
