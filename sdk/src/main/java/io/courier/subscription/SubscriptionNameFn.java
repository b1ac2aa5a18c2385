package io.courier.subscription;

import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Generates the subscription name used for a topic.
 *
 * <p>Subscribers that share a generated name share one subscription and compete for its messages.
 * Give each consumer group its own suffix to let every group receive every message.
 */
@FunctionalInterface
public interface SubscriptionNameFn {

  /**
   * Returns the short subscription name for {@code topic}.
   *
   * @param topic the short topic name
   * @return the short subscription name
   */
  @Nonnull
  String subscriptionName(@Nonnull String topic);

  /** Uses the topic name as the subscription name. This is the default. */
  @Nonnull
  static SubscriptionNameFn topicName() {
    return topic -> topic;
  }

  /**
   * Appends {@code _<suffix>} to the topic name.
   *
   * @param suffix the suffix, typically the name of the consumer group
   * @return the naming function
   */
  @Nonnull
  static SubscriptionNameFn withSuffix(@Nonnull String suffix) {
    Objects.requireNonNull(suffix, "suffix cannot be null");
    return topic -> topic + "_" + suffix;
  }
}
