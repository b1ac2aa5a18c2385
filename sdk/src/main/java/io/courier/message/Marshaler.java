package io.courier.message;

import com.google.pubsub.v1.PubsubMessage;
import io.courier.CourierException;
import javax.annotation.Nonnull;

/** Encodes a {@link Message} into the service's publish format. */
@FunctionalInterface
public interface Marshaler {

  /**
   * Encodes a message for publishing on {@code topic}.
   *
   * @param topic the short topic name the message is published on
   * @param message the message to encode
   * @return the encoded message
   * @throws CourierException if the message cannot be encoded
   */
  @Nonnull
  PubsubMessage marshal(@Nonnull String topic, @Nonnull Message message);
}
