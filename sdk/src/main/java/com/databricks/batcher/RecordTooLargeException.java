package com.databricks.batcher;

import javax.annotation.Nullable;

/**
 * Thrown while batching when a record's size exceeds the record size limit and the batcher uses
 * {@link OversizedRecordPolicy#ERROR}.
 *
 * <p>The batcher that threw it is terminated: the batch it was assembling is discarded and it
 * produces no further batches.
 *
 * @see BatcherOptions#effectiveMaxRecordSize()
 */
public class RecordTooLargeException extends BatcherException {

  private final transient Object record;
  private final long recordSize;
  private final long maxRecordSize;

  /**
   * Constructs a new RecordTooLargeException.
   *
   * @param record the offending record
   * @param recordSize the size reported for the record
   * @param maxRecordSize the limit it exceeded
   */
  public RecordTooLargeException(@Nullable Object record, long recordSize, long maxRecordSize) {
    super(
        "Record of size "
            + recordSize
            + " exceeds the size limit of "
            + maxRecordSize
            + ": "
            + record);
    this.record = record;
    this.recordSize = recordSize;
    this.maxRecordSize = maxRecordSize;
  }

  /** Returns the record that did not fit. */
  @Nullable public Object getRecord() {
    return record;
  }

  /** Returns the size the size function reported for the record. */
  public long getRecordSize() {
    return recordSize;
  }

  /** Returns the record size limit that was exceeded. */
  public long getMaxRecordSize() {
    return maxRecordSize;
  }
}
