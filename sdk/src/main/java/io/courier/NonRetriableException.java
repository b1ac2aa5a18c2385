package io.courier;

/**
 * An exception that indicates a non-retriable error has occurred.
 *
 * <p>This exception is thrown when the error is permanent and cannot be resolved by retrying.
 * Common causes include:
 *
 * <ul>
 *   <li>Invalid configuration parameters
 *   <li>Missing subscription or topic while auto-creation is disabled
 *   <li>An existing subscription bound to a different topic than requested
 *   <li>Using a subscriber that has been closed
 * </ul>
 *
 * <p>When this exception is thrown, the operation should not be retried without first fixing the
 * underlying issue. Contrast with {@link CourierException} which indicates a retriable error.
 *
 * @see CourierException
 */
public class NonRetriableException extends CourierException {

  /**
   * Constructs a new NonRetriableException with the specified detail message.
   *
   * @param message the detail message
   */
  public NonRetriableException(String message) {
    super(message);
  }

  /**
   * Constructs a new NonRetriableException with the specified detail message and cause.
   *
   * @param message the detail message
   * @param cause the cause of the exception
   */
  public NonRetriableException(String message, Throwable cause) {
    super(message, cause);
  }
}
