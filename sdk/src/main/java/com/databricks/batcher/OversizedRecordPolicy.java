package com.databricks.batcher;

/** What a {@link Batcher} does with a record that is larger than the record size limit. */
public enum OversizedRecordPolicy {
  /** Drop the record. It appears in no batch and the batch being assembled is unaffected. */
  SKIP,
  /** Throw {@link RecordTooLargeException} and stop producing batches. */
  ERROR
}
