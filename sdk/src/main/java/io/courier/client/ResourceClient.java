package io.courier.client;

import io.courier.Context;
import io.courier.CourierException;
import io.courier.ResourceAlreadyExistsException;
import io.courier.message.Envelope;
import io.courier.subscription.PushConfig;
import io.courier.subscription.ReceiveSettings;
import io.courier.subscription.SubscriptionDescriptor;
import java.util.function.Consumer;
import javax.annotation.Nonnull;

/**
 * One connection to the pub/sub service.
 *
 * <p>All names are fully qualified resource paths ({@code projects/p/topics/t}, {@code
 * projects/p/subscriptions/s}). Failures of remote calls are reported as {@link CourierException}
 * unless stated otherwise.
 */
public interface ResourceClient extends AutoCloseable {

  boolean subscriptionExists(@Nonnull String subscription);

  /**
   * Creates a subscription bound to {@code topic}.
   *
   * @throws ResourceAlreadyExistsException if the subscription already exists
   */
  void createSubscription(
      @Nonnull String subscription,
      @Nonnull String topic,
      @Nonnull SubscriptionDescriptor descriptor);

  /**
   * Returns the remote descriptor of an existing subscription. The descriptor's topic is the fully
   * qualified path of the topic the subscription is bound to.
   */
  @Nonnull
  SubscriptionDescriptor fetchSubscriptionConfig(@Nonnull String subscription);

  /**
   * Replaces the push configuration of a subscription. No other field is modified.
   *
   * @return the updated remote descriptor
   */
  @Nonnull
  SubscriptionDescriptor updateSubscriptionPushConfig(
      @Nonnull String subscription, @Nonnull PushConfig pushConfig);

  void deleteSubscription(@Nonnull String subscription);

  boolean topicExists(@Nonnull String topic);

  /**
   * Creates a topic.
   *
   * @throws ResourceAlreadyExistsException if the topic already exists
   */
  void createTopic(@Nonnull String topic);

  /**
   * Streams messages of a subscription into {@code handler}.
   *
   * <p>The handler may be invoked concurrently, bounded by the flow-control limits of {@code
   * settings}. Each envelope must be acked or nacked through its reply. The call blocks until
   * {@code ctx} is done, in which case it returns normally, or until the stream fails.
   *
   * @throws CourierException if the stream fails
   */
  void receive(
      @Nonnull String subscription,
      @Nonnull ReceiveSettings settings,
      @Nonnull Context ctx,
      @Nonnull Consumer<Envelope> handler);

  /** Releases the connection. */
  @Override
  void close();
}
