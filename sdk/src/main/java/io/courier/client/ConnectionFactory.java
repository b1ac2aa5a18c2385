package io.courier.client;

import io.courier.CourierException;
import javax.annotation.Nonnull;

/** Opens connections to the pub/sub service. */
@FunctionalInterface
public interface ConnectionFactory {

  /**
   * Opens a new connection.
   *
   * @return the connection, owned by the caller
   * @throws CourierException if the connection cannot be established
   */
  @Nonnull
  ResourceClient connect();
}
