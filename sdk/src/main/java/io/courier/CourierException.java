package io.courier;

/**
 * Base exception class for all Courier SDK errors.
 *
 * <p>This is an unchecked exception (extends {@link RuntimeException}). Callers can catch this
 * exception or let it propagate up the call stack.
 *
 * <p>The SDK throws two kinds of exceptions:
 *
 * <ul>
 *   <li>{@link CourierException} - Transient errors (network issues, temporary server errors)
 *   <li>{@link NonRetriableException} - Permanent errors (invalid configuration, missing
 *       subscription or topic, subscription bound to another topic, closed subscriber)
 * </ul>
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * try {
 *     MessageStream messages = subscriber.subscribe("orders");
 * } catch (NonRetriableException e) {
 *     // Fix the configuration or the remote resources before trying again
 *     logger.error("Cannot subscribe", e);
 *     throw e;
 * } catch (CourierException e) {
 *     // Resolution hit a transient failure, subscribe can be called again
 *     logger.warn("Subscribe failed, will retry", e);
 * }
 * }</pre>
 */
public class CourierException extends RuntimeException {

  /**
   * Constructs a new CourierException with the specified detail message.
   *
   * @param message the detail message
   */
  public CourierException(String message) {
    super(message);
  }

  /**
   * Constructs a new CourierException with the specified detail message and cause.
   *
   * @param message the detail message
   * @param cause the cause of the exception
   */
  public CourierException(String message, Throwable cause) {
    super(message, cause);
  }
}
