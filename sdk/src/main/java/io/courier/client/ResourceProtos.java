package io.courier.client;

import com.google.protobuf.Duration;
import com.google.protobuf.FieldMask;
import com.google.pubsub.v1.Subscription;
import com.google.pubsub.v1.UpdateSubscriptionRequest;
import io.courier.subscription.PushConfig;
import io.courier.subscription.SubscriptionDescriptor;
import javax.annotation.Nonnull;

/** Conversions between SDK descriptors and Pub/Sub admin protos. */
final class ResourceProtos {
  static final String PUSH_CONFIG_FIELD = "push_config";

  private ResourceProtos() {}

  @Nonnull
  static Subscription toSubscription(
      @Nonnull String name, @Nonnull String topic, @Nonnull SubscriptionDescriptor descriptor) {
    java.time.Duration retention = descriptor.getMessageRetentionDuration();
    return Subscription.newBuilder()
        .setName(name)
        .setTopic(topic)
        .setFilter(descriptor.getFilter())
        .setPushConfig(toPushConfig(descriptor.getPushConfig()))
        .setAckDeadlineSeconds(descriptor.getAckDeadlineSeconds())
        .setEnableMessageOrdering(descriptor.isEnableMessageOrdering())
        .setRetainAckedMessages(descriptor.isRetainAckedMessages())
        .setMessageRetentionDuration(
            Duration.newBuilder()
                .setSeconds(retention.getSeconds())
                .setNanos(retention.getNano())
                .build())
        .putAllLabels(descriptor.getLabels())
        .build();
  }

  @Nonnull
  static SubscriptionDescriptor fromSubscription(@Nonnull Subscription subscription) {
    SubscriptionDescriptor.Builder builder =
        SubscriptionDescriptor.builder()
            .topic(subscription.getTopic())
            .filter(subscription.getFilter())
            .pushConfig(fromPushConfig(subscription.getPushConfig()))
            .enableMessageOrdering(subscription.getEnableMessageOrdering())
            .retainAckedMessages(subscription.getRetainAckedMessages())
            .labels(subscription.getLabelsMap());
    // Zero and unset fields mean the service default.
    if (subscription.getAckDeadlineSeconds() > 0) {
      builder.ackDeadlineSeconds(subscription.getAckDeadlineSeconds());
    }
    if (subscription.hasMessageRetentionDuration()) {
      Duration retention = subscription.getMessageRetentionDuration();
      java.time.Duration converted =
          java.time.Duration.ofSeconds(retention.getSeconds(), retention.getNanos());
      if (!converted.isZero()) {
        builder.messageRetentionDuration(converted);
      }
    }
    return builder.build();
  }

  @Nonnull
  static com.google.pubsub.v1.PushConfig toPushConfig(@Nonnull PushConfig pushConfig) {
    return com.google.pubsub.v1.PushConfig.newBuilder()
        .setPushEndpoint(pushConfig.getEndpoint())
        .putAllAttributes(pushConfig.getAttributes())
        .build();
  }

  @Nonnull
  static PushConfig fromPushConfig(@Nonnull com.google.pubsub.v1.PushConfig pushConfig) {
    return PushConfig.of(pushConfig.getPushEndpoint(), pushConfig.getAttributesMap());
  }

  /** Builds an update that touches only the push configuration. */
  @Nonnull
  static UpdateSubscriptionRequest pushConfigUpdate(
      @Nonnull String subscription, @Nonnull PushConfig pushConfig) {
    return UpdateSubscriptionRequest.newBuilder()
        .setSubscription(
            Subscription.newBuilder()
                .setName(subscription)
                .setPushConfig(toPushConfig(pushConfig))
                .build())
        .setUpdateMask(FieldMask.newBuilder().addPaths(PUSH_CONFIG_FIELD).build())
        .build();
  }
}
