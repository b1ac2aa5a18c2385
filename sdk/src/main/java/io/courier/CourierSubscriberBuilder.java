package io.courier;

import io.courier.client.ConnectionFactory;
import io.courier.client.GcpConnectionFactory;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import javax.annotation.Nonnull;

/**
 * Builder for creating {@link CourierSubscriber} instances with custom configuration.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * CourierSubscriber subscriber = CourierSubscriber.builder(config)
 *     .connectionFactory(GcpConnectionFactory.builder().endpoint("localhost:8085")
 *         .tlsConfig(new InsecureTlsConfig()).build())
 *     .executor(myExecutor)
 *     .build();
 * }</pre>
 *
 * @see CourierSubscriber
 */
public final class CourierSubscriberBuilder {
  private final SubscriberConfig config;
  private Optional<ExecutorService> executor = Optional.empty();
  private Optional<ConnectionFactory> connectionFactory = Optional.empty();

  /**
   * Creates a new CourierSubscriberBuilder.
   *
   * <p>Use {@link CourierSubscriber#builder(SubscriberConfig)} instead of calling this constructor
   * directly.
   *
   * @param config The subscriber configuration
   */
  CourierSubscriberBuilder(@Nonnull SubscriberConfig config) {
    this.config = Objects.requireNonNull(config, "config cannot be null");
  }

  /**
   * Sets a custom executor service for the subscriber.
   *
   * <p>Every active stream occupies one thread of the executor until it stops. If not set, the
   * subscriber creates a cached thread pool of daemon threads. When providing a custom executor,
   * the caller is responsible for shutting it down.
   *
   * @param executor The executor service to use
   * @return This builder for method chaining
   */
  @Nonnull
  public CourierSubscriberBuilder executor(@Nonnull ExecutorService executor) {
    this.executor = Optional.of(Objects.requireNonNull(executor, "executor cannot be null"));
    return this;
  }

  /**
   * Sets how connections to the service are opened.
   *
   * <p>Defaults to a {@link GcpConnectionFactory} with Application Default Credentials, or the
   * emulator named by {@code PUBSUB_EMULATOR_HOST}.
   *
   * @param connectionFactory The connection factory to use
   * @return This builder for method chaining
   */
  @Nonnull
  public CourierSubscriberBuilder connectionFactory(@Nonnull ConnectionFactory connectionFactory) {
    this.connectionFactory =
        Optional.of(Objects.requireNonNull(connectionFactory, "connectionFactory cannot be null"));
    return this;
  }

  /**
   * Builds the CourierSubscriber instance.
   *
   * @return A new CourierSubscriber instance
   */
  @Nonnull
  public CourierSubscriber build() {
    return new CourierSubscriber(
        config,
        executor.orElseGet(CourierSubscriber::createDefaultExecutor),
        !executor.isPresent(),
        connectionFactory.orElseGet(() -> GcpConnectionFactory.builder().build()));
  }
}
