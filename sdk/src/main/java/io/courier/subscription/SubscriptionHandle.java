package io.courier.subscription;

import io.courier.client.ResourceClient;
import javax.annotation.Nonnull;

/**
 * A resolved subscription: it exists, is bound to the expected topic and has been reconciled with
 * the desired descriptor. Handles are cached by {@link SubscriptionResolver} and shared by every
 * stream of the same subscription.
 */
public final class SubscriptionHandle {
  private final String path;
  private final String name;
  private final String topicPath;
  private final SubscriptionDescriptor descriptor;
  private final ReceiveSettings receiveSettings;
  private final ResourceClient client;

  SubscriptionHandle(
      String path,
      String name,
      String topicPath,
      SubscriptionDescriptor descriptor,
      ReceiveSettings receiveSettings,
      ResourceClient client) {
    this.path = path;
    this.name = name;
    this.topicPath = topicPath;
    this.descriptor = descriptor;
    this.receiveSettings = receiveSettings;
    this.client = client;
  }

  /** Returns the fully qualified subscription path. */
  @Nonnull
  public String getPath() {
    return path;
  }

  /** Returns the short subscription name. */
  @Nonnull
  public String getName() {
    return name;
  }

  /** Returns the fully qualified path of the topic the subscription is bound to. */
  @Nonnull
  public String getTopicPath() {
    return topicPath;
  }

  /** Returns the remote descriptor as observed at the end of resolution. */
  @Nonnull
  public SubscriptionDescriptor getDescriptor() {
    return descriptor;
  }

  @Nonnull
  public ReceiveSettings getReceiveSettings() {
    return receiveSettings;
  }

  /** Returns the connection the subscription was resolved on. */
  @Nonnull
  public ResourceClient getClient() {
    return client;
  }

  @Override
  public String toString() {
    return "SubscriptionHandle{path=" + path + ", topic=" + topicPath + "}";
  }
}
