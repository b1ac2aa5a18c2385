package io.courier.message;

import io.courier.CourierException;
import java.util.Objects;
import javax.annotation.Nonnull;

/** Decodes like {@link DefaultMarshalerUnmarshaler} and hands the ordering key to a callback. */
public class OrderingUnmarshaler implements Unmarshaler {
  private final DefaultMarshalerUnmarshaler delegate = new DefaultMarshalerUnmarshaler();
  private final OrderingKeyHandler handler;

  public OrderingUnmarshaler(@Nonnull OrderingKeyHandler handler) {
    this.handler = Objects.requireNonNull(handler, "handler cannot be null");
  }

  @Nonnull
  @Override
  public Message unmarshal(@Nonnull Envelope envelope) {
    Message message = delegate.unmarshal(envelope);
    try {
      handler.handle(envelope.getOrderingKey(), message);
    } catch (RuntimeException e) {
      throw new CourierException(
          "Cannot handle ordering key of message " + envelope.getMessageId(), e);
    }
    return message;
  }

  /** Receives the ordering key of every decoded message, for example to store it in metadata. */
  @FunctionalInterface
  public interface OrderingKeyHandler {
    void handle(@Nonnull String orderingKey, @Nonnull Message message);
  }
}
