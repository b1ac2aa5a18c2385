package io.courier.message;

import io.courier.CourierException;
import javax.annotation.Nonnull;

/** Decodes a delivered {@link Envelope} into a {@link Message}. */
@FunctionalInterface
public interface Unmarshaler {

  /**
   * Decodes an envelope.
   *
   * @param envelope the delivered envelope
   * @return the decoded message
   * @throws CourierException if the envelope cannot be decoded
   */
  @Nonnull
  Message unmarshal(@Nonnull Envelope envelope);
}
