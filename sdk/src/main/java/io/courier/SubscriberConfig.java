package io.courier;

import io.courier.message.DefaultMarshalerUnmarshaler;
import io.courier.message.Unmarshaler;
import io.courier.subscription.ReceiveSettings;
import io.courier.subscription.SubscriptionDescriptor;
import io.courier.subscription.SubscriptionNameFn;
import java.time.Duration;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Configuration of a {@link CourierSubscriber}.
 *
 * <p>Use the builder pattern to create instances:
 *
 * <pre>{@code
 * SubscriberConfig config =
 *     SubscriberConfig.builder()
 *         .setProjectId("my-project")
 *         .setSubscriptionNameFn(SubscriptionNameFn.withSuffix("billing"))
 *         .setDoNotCreateTopicIfMissing(true)
 *         .build();
 * }</pre>
 *
 * <p>Only {@code projectId} is required.
 */
public class SubscriberConfig {

  public static final Duration DEFAULT_INITIALIZE_TIMEOUT = Duration.ofSeconds(10);
  public static final Duration DEFAULT_RETRY_INITIAL_INTERVAL = Duration.ofMillis(500);
  public static final Duration DEFAULT_RETRY_MAX_INTERVAL = Duration.ofSeconds(60);

  private final SubscriptionNameFn subscriptionNameFn;
  private final String projectId;
  @Nullable private final String topicProjectId;
  private final boolean doNotCreateSubscriptionIfMissing;
  private final boolean doNotCreateTopicIfMissing;
  private final boolean doNotUpdateSubscriptionIfEndpointChanged;
  private final boolean recreateSubscriptionIfFilterChanged;
  private final Duration initializeTimeout;
  private final SubscriptionDescriptor subscriptionDescriptor;
  private final ReceiveSettings receiveSettings;
  private final Unmarshaler unmarshaler;
  private final Duration retryInitialInterval;
  private final Duration retryMaxInterval;

  private SubscriberConfig(Builder builder) {
    this.subscriptionNameFn = builder.subscriptionNameFn;
    this.projectId = builder.projectId;
    this.topicProjectId = builder.topicProjectId;
    this.doNotCreateSubscriptionIfMissing = builder.doNotCreateSubscriptionIfMissing;
    this.doNotCreateTopicIfMissing = builder.doNotCreateTopicIfMissing;
    this.doNotUpdateSubscriptionIfEndpointChanged =
        builder.doNotUpdateSubscriptionIfEndpointChanged;
    this.recreateSubscriptionIfFilterChanged = builder.recreateSubscriptionIfFilterChanged;
    this.initializeTimeout = builder.initializeTimeout;
    this.subscriptionDescriptor = builder.subscriptionDescriptor;
    this.receiveSettings = builder.receiveSettings;
    this.unmarshaler = builder.unmarshaler;
    this.retryInitialInterval = builder.retryInitialInterval;
    this.retryMaxInterval = builder.retryMaxInterval;
  }

  /**
   * Returns a new builder with default values.
   *
   * @return a new Builder
   */
  @Nonnull
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a builder initialized with the values of this configuration.
   *
   * @return a new Builder
   */
  @Nonnull
  public Builder toBuilder() {
    return new Builder(this);
  }

  /**
   * Returns the function that generates subscription names from topic names.
   *
   * <p>Defaults to {@link SubscriptionNameFn#topicName()}.
   *
   * @return the naming function
   */
  @Nonnull
  public SubscriptionNameFn subscriptionNameFn() {
    return this.subscriptionNameFn;
  }

  /**
   * Returns the project that owns the subscriptions.
   *
   * @return the project id
   */
  @Nonnull
  public String projectId() {
    return this.projectId;
  }

  /**
   * Returns the project that owns the topics. Defaults to {@link #projectId()}.
   *
   * @return the topic project id
   */
  @Nonnull
  public String topicProjectId() {
    return this.topicProjectId != null ? this.topicProjectId : this.projectId;
  }

  /**
   * Returns whether a missing subscription is an error instead of being created.
   *
   * @return true if subscriptions are never created
   */
  public boolean doNotCreateSubscriptionIfMissing() {
    return this.doNotCreateSubscriptionIfMissing;
  }

  /**
   * Returns whether a missing topic is an error instead of being created.
   *
   * @return true if topics are never created
   */
  public boolean doNotCreateTopicIfMissing() {
    return this.doNotCreateTopicIfMissing;
  }

  /**
   * Returns whether an existing subscription keeps its push endpoint when it differs from the
   * configured one.
   *
   * @return true if push endpoints are never updated
   */
  public boolean doNotUpdateSubscriptionIfEndpointChanged() {
    return this.doNotUpdateSubscriptionIfEndpointChanged;
  }

  /**
   * Returns whether an existing subscription whose filter differs from the configured one is
   * deleted and created again. Deleting a subscription drops its backlog.
   *
   * @return true if subscriptions are recreated on filter change
   */
  public boolean recreateSubscriptionIfFilterChanged() {
    return this.recreateSubscriptionIfFilterChanged;
  }

  /**
   * Returns the time limit of {@link CourierSubscriber#initialize(String)}.
   *
   * @return the initialization timeout
   */
  @Nonnull
  public Duration initializeTimeout() {
    return this.initializeTimeout;
  }

  /**
   * Returns the desired shape of created and reconciled subscriptions.
   *
   * @return the subscription descriptor
   */
  @Nonnull
  public SubscriptionDescriptor subscriptionDescriptor() {
    return this.subscriptionDescriptor;
  }

  @Nonnull
  public ReceiveSettings receiveSettings() {
    return this.receiveSettings;
  }

  /**
   * Returns the decoder of received messages. Defaults to {@link DefaultMarshalerUnmarshaler}.
   *
   * @return the unmarshaler
   */
  @Nonnull
  public Unmarshaler unmarshaler() {
    return this.unmarshaler;
  }

  /**
   * Returns the first wait after a streaming failure.
   *
   * @return the initial retry interval
   */
  @Nonnull
  public Duration retryInitialInterval() {
    return this.retryInitialInterval;
  }

  /**
   * Returns the longest wait between two streaming attempts.
   *
   * @return the maximum retry interval
   */
  @Nonnull
  public Duration retryMaxInterval() {
    return this.retryMaxInterval;
  }

  /** Builder for {@link SubscriberConfig}. */
  public static class Builder {
    private SubscriptionNameFn subscriptionNameFn = SubscriptionNameFn.topicName();
    private String projectId;
    private String topicProjectId;
    private boolean doNotCreateSubscriptionIfMissing = false;
    private boolean doNotCreateTopicIfMissing = false;
    private boolean doNotUpdateSubscriptionIfEndpointChanged = false;
    private boolean recreateSubscriptionIfFilterChanged = false;
    private Duration initializeTimeout = DEFAULT_INITIALIZE_TIMEOUT;
    private SubscriptionDescriptor subscriptionDescriptor = SubscriptionDescriptor.defaults();
    private ReceiveSettings receiveSettings = ReceiveSettings.defaults();
    private Unmarshaler unmarshaler = new DefaultMarshalerUnmarshaler();
    private Duration retryInitialInterval = DEFAULT_RETRY_INITIAL_INTERVAL;
    private Duration retryMaxInterval = DEFAULT_RETRY_MAX_INTERVAL;

    private Builder() {}

    private Builder(SubscriberConfig config) {
      this.subscriptionNameFn = config.subscriptionNameFn;
      this.projectId = config.projectId;
      this.topicProjectId = config.topicProjectId;
      this.doNotCreateSubscriptionIfMissing = config.doNotCreateSubscriptionIfMissing;
      this.doNotCreateTopicIfMissing = config.doNotCreateTopicIfMissing;
      this.doNotUpdateSubscriptionIfEndpointChanged =
          config.doNotUpdateSubscriptionIfEndpointChanged;
      this.recreateSubscriptionIfFilterChanged = config.recreateSubscriptionIfFilterChanged;
      this.initializeTimeout = config.initializeTimeout;
      this.subscriptionDescriptor = config.subscriptionDescriptor;
      this.receiveSettings = config.receiveSettings;
      this.unmarshaler = config.unmarshaler;
      this.retryInitialInterval = config.retryInitialInterval;
      this.retryMaxInterval = config.retryMaxInterval;
    }

    public Builder setSubscriptionNameFn(@Nonnull SubscriptionNameFn subscriptionNameFn) {
      this.subscriptionNameFn =
          Objects.requireNonNull(subscriptionNameFn, "subscriptionNameFn cannot be null");
      return this;
    }

    public Builder setProjectId(@Nonnull String projectId) {
      this.projectId = projectId;
      return this;
    }

    /**
     * Sets the project that owns the topics, when it differs from the subscription project.
     *
     * @param topicProjectId the topic project id, or null to use the subscription project
     * @return this builder for method chaining
     */
    public Builder setTopicProjectId(@Nullable String topicProjectId) {
      this.topicProjectId = topicProjectId;
      return this;
    }

    public Builder setDoNotCreateSubscriptionIfMissing(boolean doNotCreateSubscriptionIfMissing) {
      this.doNotCreateSubscriptionIfMissing = doNotCreateSubscriptionIfMissing;
      return this;
    }

    public Builder setDoNotCreateTopicIfMissing(boolean doNotCreateTopicIfMissing) {
      this.doNotCreateTopicIfMissing = doNotCreateTopicIfMissing;
      return this;
    }

    public Builder setDoNotUpdateSubscriptionIfEndpointChanged(
        boolean doNotUpdateSubscriptionIfEndpointChanged) {
      this.doNotUpdateSubscriptionIfEndpointChanged = doNotUpdateSubscriptionIfEndpointChanged;
      return this;
    }

    public Builder setRecreateSubscriptionIfFilterChanged(
        boolean recreateSubscriptionIfFilterChanged) {
      this.recreateSubscriptionIfFilterChanged = recreateSubscriptionIfFilterChanged;
      return this;
    }

    public Builder setInitializeTimeout(@Nonnull Duration initializeTimeout) {
      this.initializeTimeout = initializeTimeout;
      return this;
    }

    public Builder setSubscriptionDescriptor(
        @Nonnull SubscriptionDescriptor subscriptionDescriptor) {
      this.subscriptionDescriptor =
          Objects.requireNonNull(subscriptionDescriptor, "subscriptionDescriptor cannot be null");
      return this;
    }

    public Builder setReceiveSettings(@Nonnull ReceiveSettings receiveSettings) {
      this.receiveSettings =
          Objects.requireNonNull(receiveSettings, "receiveSettings cannot be null");
      return this;
    }

    public Builder setUnmarshaler(@Nonnull Unmarshaler unmarshaler) {
      this.unmarshaler = Objects.requireNonNull(unmarshaler, "unmarshaler cannot be null");
      return this;
    }

    public Builder setRetryInitialInterval(@Nonnull Duration retryInitialInterval) {
      this.retryInitialInterval = retryInitialInterval;
      return this;
    }

    public Builder setRetryMaxInterval(@Nonnull Duration retryMaxInterval) {
      this.retryMaxInterval = retryMaxInterval;
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return the configuration
     * @throws NonRetriableException if the project id is missing or a duration is invalid
     */
    @Nonnull
    public SubscriberConfig build() {
      if (projectId == null || projectId.trim().isEmpty()) {
        throw new NonRetriableException("projectId is required");
      }
      if (topicProjectId != null && topicProjectId.trim().isEmpty()) {
        throw new NonRetriableException("topicProjectId cannot be blank");
      }
      requirePositive(initializeTimeout, "initializeTimeout");
      requireWholeMillis(retryInitialInterval, "retryInitialInterval");
      requireWholeMillis(retryMaxInterval, "retryMaxInterval");
      if (retryInitialInterval.compareTo(retryMaxInterval) > 0) {
        throw new NonRetriableException("retryInitialInterval cannot exceed retryMaxInterval");
      }
      return new SubscriberConfig(this);
    }

    private static void requirePositive(Duration value, String name) {
      if (value == null || value.isNegative() || value.isZero()) {
        throw new NonRetriableException(name + " must be positive");
      }
    }

    // Backoff works in milliseconds.
    private static void requireWholeMillis(Duration value, String name) {
      requirePositive(value, name);
      if (value.toMillis() < 1) {
        throw new NonRetriableException(name + " must be at least 1ms");
      }
    }
  }
}
