package com.databricks.batcher;

/**
 * Base exception class for all batcher errors.
 *
 * <p>This is an unchecked exception (extends {@link RuntimeException}). The batcher throws:
 *
 * <ul>
 *   <li>{@link ConfigurationException} - invalid limits or missing collaborators at construction
 *   <li>{@link RecordTooLargeException} - a record above the size limit under {@link
 *       OversizedRecordPolicy#ERROR}
 *   <li>{@link BatcherException} - a size function that reported a negative size
 * </ul>
 *
 * <p>Exceptions thrown by the record source or the size function are not wrapped.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * try {
 *     for (List<String> batch : batcher) {
 *         sink.write(batch);
 *     }
 * } catch (RecordTooLargeException e) {
 *     logger.error("Record of size {} does not fit", e.getRecordSize(), e);
 *     throw e;
 * }
 * }</pre>
 */
public class BatcherException extends RuntimeException {

  /**
   * Constructs a new BatcherException with the specified detail message.
   *
   * @param message the detail message
   */
  public BatcherException(String message) {
    super(message);
  }
}
