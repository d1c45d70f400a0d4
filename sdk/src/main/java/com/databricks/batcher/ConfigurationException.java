package com.databricks.batcher;

/**
 * Thrown when a {@link Batcher} or its {@link BatcherOptions} cannot be built.
 *
 * <p>Common causes include:
 *
 * <ul>
 *   <li>Neither a record count limit nor a batch size limit is set
 *   <li>A limit that is zero or negative
 *   <li>A record size limit above the batch size limit
 *   <li>A null record source or size function
 * </ul>
 *
 * <p>No batcher is created when this exception is thrown.
 */
public class ConfigurationException extends BatcherException {

  /**
   * Constructs a new ConfigurationException with the specified detail message.
   *
   * @param message the detail message
   */
  public ConfigurationException(String message) {
    super(message);
  }
}
