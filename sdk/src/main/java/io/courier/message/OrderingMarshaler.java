package io.courier.message;

import com.google.pubsub.v1.PubsubMessage;
import io.courier.CourierException;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Codec that sets an ordering key on every encoded message. Requires a subscription with message
 * ordering enabled to have any effect on delivery order.
 */
public class OrderingMarshaler implements Marshaler {
  private final DefaultMarshalerUnmarshaler delegate = new DefaultMarshalerUnmarshaler();
  private final OrderingKeyGenerator generator;

  public OrderingMarshaler(@Nonnull OrderingKeyGenerator generator) {
    this.generator = Objects.requireNonNull(generator, "generator cannot be null");
  }

  @Nonnull
  @Override
  public PubsubMessage marshal(@Nonnull String topic, @Nonnull Message message) {
    PubsubMessage encoded = delegate.marshal(topic, message);
    String orderingKey;
    try {
      orderingKey = generator.orderingKey(topic, message);
    } catch (RuntimeException e) {
      throw new CourierException(
          "Cannot generate ordering key for message " + message.getUuid(), e);
    }
    return encoded.toBuilder().setOrderingKey(orderingKey).build();
  }

  /** Chooses the ordering key of a message. */
  @FunctionalInterface
  public interface OrderingKeyGenerator {
    @Nonnull
    String orderingKey(@Nonnull String topic, @Nonnull Message message);
  }
}
