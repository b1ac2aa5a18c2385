package io.courier.subscription;

import io.courier.NonRetriableException;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The shape of a subscription: its filter, push settings, ordering, retention and labels.
 *
 * <p>Configured on {@link io.courier.SubscriberConfig} this is the desired shape used when a
 * subscription is created or reconciled. Returned by {@link io.courier.client.ResourceClient} it
 * is the actual remote shape, and {@link #getTopic()} holds the fully qualified topic the
 * subscription is bound to.
 *
 * <p>Default values:
 *
 * <ul>
 *   <li>filter: none
 *   <li>pushConfig: pull
 *   <li>ackDeadlineSeconds: 10
 *   <li>enableMessageOrdering: false
 *   <li>retainAckedMessages: false
 *   <li>messageRetentionDuration: 7 days
 *   <li>labels: none
 * </ul>
 */
public final class SubscriptionDescriptor {
  public static final int DEFAULT_ACK_DEADLINE_SECONDS = 10;
  public static final Duration DEFAULT_MESSAGE_RETENTION = Duration.ofDays(7);

  @Nullable private final String topic;
  private final String filter;
  private final PushConfig pushConfig;
  private final int ackDeadlineSeconds;
  private final boolean enableMessageOrdering;
  private final boolean retainAckedMessages;
  private final Duration messageRetentionDuration;
  private final Map<String, String> labels;

  private SubscriptionDescriptor(Builder builder) {
    this.topic = builder.topic;
    this.filter = builder.filter;
    this.pushConfig = builder.pushConfig;
    this.ackDeadlineSeconds = builder.ackDeadlineSeconds;
    this.enableMessageOrdering = builder.enableMessageOrdering;
    this.retainAckedMessages = builder.retainAckedMessages;
    this.messageRetentionDuration = builder.messageRetentionDuration;
    this.labels = Collections.unmodifiableMap(new HashMap<>(builder.labels));
  }

  @Nonnull
  public static Builder builder() {
    return new Builder();
  }

  /** Returns a descriptor with all default values. */
  @Nonnull
  public static SubscriptionDescriptor defaults() {
    return builder().build();
  }

  @Nonnull
  public Builder toBuilder() {
    return new Builder(this);
  }

  /** Returns the fully qualified topic path, or null on a desired descriptor. */
  @Nullable
  public String getTopic() {
    return topic;
  }

  @Nonnull
  public String getFilter() {
    return filter;
  }

  @Nonnull
  public PushConfig getPushConfig() {
    return pushConfig;
  }

  public int getAckDeadlineSeconds() {
    return ackDeadlineSeconds;
  }

  public boolean isEnableMessageOrdering() {
    return enableMessageOrdering;
  }

  public boolean isRetainAckedMessages() {
    return retainAckedMessages;
  }

  @Nonnull
  public Duration getMessageRetentionDuration() {
    return messageRetentionDuration;
  }

  @Nonnull
  public Map<String, String> getLabels() {
    return labels;
  }

  /**
   * Returns true if the filters differ once all whitespace is removed.
   *
   * @param other the descriptor to compare with
   * @return whether the filters differ
   */
  public boolean filterDiffers(@Nonnull SubscriptionDescriptor other) {
    return !stripWhitespace(filter).equals(stripWhitespace(other.filter));
  }

  private static String stripWhitespace(String value) {
    return value.replaceAll("\\s+", "");
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SubscriptionDescriptor)) {
      return false;
    }
    SubscriptionDescriptor that = (SubscriptionDescriptor) o;
    return ackDeadlineSeconds == that.ackDeadlineSeconds
        && enableMessageOrdering == that.enableMessageOrdering
        && retainAckedMessages == that.retainAckedMessages
        && Objects.equals(topic, that.topic)
        && filter.equals(that.filter)
        && pushConfig.equals(that.pushConfig)
        && messageRetentionDuration.equals(that.messageRetentionDuration)
        && labels.equals(that.labels);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        topic,
        filter,
        pushConfig,
        ackDeadlineSeconds,
        enableMessageOrdering,
        retainAckedMessages,
        messageRetentionDuration,
        labels);
  }

  @Override
  public String toString() {
    return "SubscriptionDescriptor{topic="
        + topic
        + ", filter="
        + filter
        + ", pushConfig="
        + pushConfig
        + ", ackDeadlineSeconds="
        + ackDeadlineSeconds
        + ", enableMessageOrdering="
        + enableMessageOrdering
        + ", retainAckedMessages="
        + retainAckedMessages
        + ", messageRetentionDuration="
        + messageRetentionDuration
        + ", labels="
        + labels
        + "}";
  }

  /** Builder for {@link SubscriptionDescriptor}. */
  public static final class Builder {
    private String topic;
    private String filter = "";
    private PushConfig pushConfig = PushConfig.pull();
    private int ackDeadlineSeconds = DEFAULT_ACK_DEADLINE_SECONDS;
    private boolean enableMessageOrdering = false;
    private boolean retainAckedMessages = false;
    private Duration messageRetentionDuration = DEFAULT_MESSAGE_RETENTION;
    private Map<String, String> labels = Collections.emptyMap();

    private Builder() {}

    private Builder(SubscriptionDescriptor descriptor) {
      this.topic = descriptor.topic;
      this.filter = descriptor.filter;
      this.pushConfig = descriptor.pushConfig;
      this.ackDeadlineSeconds = descriptor.ackDeadlineSeconds;
      this.enableMessageOrdering = descriptor.enableMessageOrdering;
      this.retainAckedMessages = descriptor.retainAckedMessages;
      this.messageRetentionDuration = descriptor.messageRetentionDuration;
      this.labels = descriptor.labels;
    }

    public Builder topic(@Nullable String topic) {
      this.topic = topic;
      return this;
    }

    public Builder filter(@Nonnull String filter) {
      this.filter = Objects.requireNonNull(filter, "filter cannot be null");
      return this;
    }

    public Builder pushConfig(@Nonnull PushConfig pushConfig) {
      this.pushConfig = Objects.requireNonNull(pushConfig, "pushConfig cannot be null");
      return this;
    }

    public Builder ackDeadlineSeconds(int ackDeadlineSeconds) {
      this.ackDeadlineSeconds = ackDeadlineSeconds;
      return this;
    }

    public Builder enableMessageOrdering(boolean enableMessageOrdering) {
      this.enableMessageOrdering = enableMessageOrdering;
      return this;
    }

    public Builder retainAckedMessages(boolean retainAckedMessages) {
      this.retainAckedMessages = retainAckedMessages;
      return this;
    }

    public Builder messageRetentionDuration(@Nonnull Duration messageRetentionDuration) {
      this.messageRetentionDuration =
          Objects.requireNonNull(
              messageRetentionDuration, "messageRetentionDuration cannot be null");
      return this;
    }

    public Builder labels(@Nonnull Map<String, String> labels) {
      this.labels = Objects.requireNonNull(labels, "labels cannot be null");
      return this;
    }

    /**
     * Builds the descriptor.
     *
     * @return the descriptor
     * @throws NonRetriableException if the ack deadline or retention duration is not positive
     */
    @Nonnull
    public SubscriptionDescriptor build() {
      if (ackDeadlineSeconds <= 0) {
        throw new NonRetriableException("ackDeadlineSeconds must be positive");
      }
      if (messageRetentionDuration.isNegative() || messageRetentionDuration.isZero()) {
        throw new NonRetriableException("messageRetentionDuration must be positive");
      }
      return new SubscriptionDescriptor(this);
    }
  }
}
