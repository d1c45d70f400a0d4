package com.databricks.batcher;

import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * Limits and policies for a {@link Batcher}.
 *
 * <p>At least one of {@link #maxBatchLen()} and {@link #maxBatchSize()} must be set. All limits
 * must be positive. Instances are immutable and validated when built.
 *
 * <p>Use the builder pattern to create instances:
 *
 * <pre>{@code
 * BatcherOptions options = BatcherOptions.builder()
 *     .setMaxBatchLen(500)
 *     .setMaxBatchSize(4 * 1024 * 1024)
 *     .setWhenRecordSizeExceeded(OversizedRecordPolicy.SKIP)
 *     .build();
 * }</pre>
 */
public class BatcherOptions {

  private final Optional<Integer> maxBatchLen;
  private final Optional<Long> maxBatchSize;
  private final Optional<Long> maxRecordSize;
  private final OversizedRecordPolicy whenRecordSizeExceeded;

  private BatcherOptions(
      Optional<Integer> maxBatchLen,
      Optional<Long> maxBatchSize,
      Optional<Long> maxRecordSize,
      OversizedRecordPolicy whenRecordSizeExceeded) {
    this.maxBatchLen = maxBatchLen;
    this.maxBatchSize = maxBatchSize;
    this.maxRecordSize = maxRecordSize;
    this.whenRecordSizeExceeded = whenRecordSizeExceeded;
  }

  /**
   * Returns the maximum number of records in one batch.
   *
   * @return the record count limit, or empty if batches are not limited by count
   */
  public Optional<Integer> maxBatchLen() {
    return this.maxBatchLen;
  }

  /**
   * Returns the maximum summed size of the records in one batch.
   *
   * <p>Sizes are measured by the batcher's size function, in whatever unit it reports.
   *
   * @return the batch size limit, or empty if batches are not limited by size
   */
  public Optional<Long> maxBatchSize() {
    return this.maxBatchSize;
  }

  /**
   * Returns the explicitly configured maximum size of a single record.
   *
   * @return the record size limit, or empty if none was configured
   * @see #effectiveMaxRecordSize()
   */
  public Optional<Long> maxRecordSize() {
    return this.maxRecordSize;
  }

  /**
   * Returns the size above which a record is treated as oversized.
   *
   * <p>This is {@link #maxRecordSize()} when configured, otherwise {@link #maxBatchSize()}, since a
   * record larger than a whole batch can never be placed in one.
   *
   * @return the effective record size limit, or empty if records are never oversized
   */
  public Optional<Long> effectiveMaxRecordSize() {
    return this.maxRecordSize.isPresent() ? this.maxRecordSize : this.maxBatchSize;
  }

  /**
   * Returns what the batcher does with a record above the record size limit.
   *
   * @return the oversized record policy, {@link OversizedRecordPolicy#ERROR} by default
   */
  public OversizedRecordPolicy whenRecordSizeExceeded() {
    return this.whenRecordSizeExceeded;
  }

  /**
   * Returns a new builder for creating BatcherOptions.
   *
   * @return a new BatcherOptionsBuilder
   */
  public static BatcherOptionsBuilder builder() {
    return new BatcherOptionsBuilder();
  }

  /**
   * Returns a builder initialized with this instance's values.
   *
   * @return a new builder pre-populated with this instance's values
   */
  public BatcherOptionsBuilder toBuilder() {
    BatcherOptionsBuilder builder =
        new BatcherOptionsBuilder().setWhenRecordSizeExceeded(this.whenRecordSizeExceeded);
    this.maxBatchLen.ifPresent(builder::setMaxBatchLen);
    this.maxBatchSize.ifPresent(builder::setMaxBatchSize);
    this.maxRecordSize.ifPresent(builder::setMaxRecordSize);
    return builder;
  }

  @Override
  public String toString() {
    return "BatcherOptions{maxBatchLen="
        + maxBatchLen.map(String::valueOf).orElse("unbounded")
        + ", maxBatchSize="
        + maxBatchSize.map(String::valueOf).orElse("unbounded")
        + ", maxRecordSize="
        + effectiveMaxRecordSize().map(String::valueOf).orElse("unbounded")
        + ", whenRecordSizeExceeded="
        + whenRecordSizeExceeded
        + "}";
  }

  /**
   * Builder for creating BatcherOptions instances.
   *
   * <p>Limits left unset are unbounded. {@link #build()} rejects configurations that cannot
   * produce bounded batches.
   *
   * @see BatcherOptions
   */
  public static class BatcherOptionsBuilder {
    private Optional<Integer> maxBatchLen = Optional.empty();
    private Optional<Long> maxBatchSize = Optional.empty();
    private Optional<Long> maxRecordSize = Optional.empty();
    private OversizedRecordPolicy whenRecordSizeExceeded = OversizedRecordPolicy.ERROR;

    private BatcherOptionsBuilder() {}

    /**
     * Sets the maximum number of records in one batch.
     *
     * @param maxBatchLen the record count limit, must be positive
     * @return this builder for method chaining
     */
    public BatcherOptionsBuilder setMaxBatchLen(int maxBatchLen) {
      this.maxBatchLen = Optional.of(maxBatchLen);
      return this;
    }

    /**
     * Sets the maximum summed size of the records in one batch.
     *
     * @param maxBatchSize the batch size limit, must be positive
     * @return this builder for method chaining
     */
    public BatcherOptionsBuilder setMaxBatchSize(long maxBatchSize) {
      this.maxBatchSize = Optional.of(maxBatchSize);
      return this;
    }

    /**
     * Sets the maximum size of a single record.
     *
     * <p>Records above this size are handled according to {@link
     * #setWhenRecordSizeExceeded(OversizedRecordPolicy)}. When unset, the batch size limit is used.
     *
     * @param maxRecordSize the record size limit, must be positive and not above the batch size
     *     limit
     * @return this builder for method chaining
     */
    public BatcherOptionsBuilder setMaxRecordSize(long maxRecordSize) {
      this.maxRecordSize = Optional.of(maxRecordSize);
      return this;
    }

    /**
     * Sets what happens to a record above the record size limit.
     *
     * @param whenRecordSizeExceeded the oversized record policy
     * @return this builder for method chaining
     */
    public BatcherOptionsBuilder setWhenRecordSizeExceeded(
        @Nonnull OversizedRecordPolicy whenRecordSizeExceeded) {
      this.whenRecordSizeExceeded =
          Objects.requireNonNull(whenRecordSizeExceeded, "whenRecordSizeExceeded cannot be null");
      return this;
    }

    /**
     * Builds a new BatcherOptions instance.
     *
     * @return a new BatcherOptions with the configured settings
     * @throws ConfigurationException if no batch limit is set, a limit is not positive, or the
     *     record size limit exceeds the batch size limit
     */
    public BatcherOptions build() {
      if (!maxBatchLen.isPresent() && !maxBatchSize.isPresent()) {
        throw new ConfigurationException(
            "At least one of maxBatchLen or maxBatchSize must be set");
      }
      if (maxBatchLen.isPresent() && maxBatchLen.get() <= 0) {
        throw new ConfigurationException(
            "maxBatchLen must be positive, got " + maxBatchLen.get());
      }
      if (maxBatchSize.isPresent() && maxBatchSize.get() <= 0) {
        throw new ConfigurationException(
            "maxBatchSize must be positive, got " + maxBatchSize.get());
      }
      if (maxRecordSize.isPresent()) {
        if (maxRecordSize.get() <= 0) {
          throw new ConfigurationException(
              "maxRecordSize must be positive, got " + maxRecordSize.get());
        }
        if (maxBatchSize.isPresent() && maxRecordSize.get() > maxBatchSize.get()) {
          throw new ConfigurationException(
              "maxRecordSize ("
                  + maxRecordSize.get()
                  + ") cannot exceed maxBatchSize ("
                  + maxBatchSize.get()
                  + ")");
        }
      }
      return new BatcherOptions(maxBatchLen, maxBatchSize, maxRecordSize, whenRecordSizeExceeded);
    }
  }
}
