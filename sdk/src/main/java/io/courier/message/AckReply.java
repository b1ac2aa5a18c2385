package io.courier.message;

/**
 * Reports the outcome of one delivery back to the service.
 *
 * <p>Exactly one of {@link #ack()} or {@link #nack()} is called per delivery.
 */
public interface AckReply {

  /** Tells the service the delivery was processed and must not be redelivered. */
  void ack();

  /** Tells the service the delivery was not processed and should be redelivered. */
  void nack();
}
