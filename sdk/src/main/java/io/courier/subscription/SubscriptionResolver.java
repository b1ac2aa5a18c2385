package io.courier.subscription;

import com.google.pubsub.v1.ProjectSubscriptionName;
import com.google.pubsub.v1.TopicName;
import io.courier.Context;
import io.courier.CourierException;
import io.courier.ResourceAlreadyExistsException;
import io.courier.SubscriberConfig;
import io.courier.SubscriptionDoesNotExistException;
import io.courier.TopicDoesNotExistException;
import io.courier.UnexpectedTopicException;
import io.courier.client.ConnectionRegistry;
import io.courier.client.ResourceClient;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a (subscription name, topic name) pair into a {@link SubscriptionHandle}, creating and
 * reconciling the remote resources on the way.
 *
 * <p>Each subscription name is resolved against the service at most once per resolver. Concurrent
 * callers for the same name wait for the first one and then share its handle. A failed resolution
 * is not cached, so the next caller tries again.
 *
 * <p>Resolution of an existing subscription:
 *
 * <ol>
 *   <li>The subscription must be bound to the requested topic, otherwise {@link
 *       UnexpectedTopicException} is thrown and nothing is modified.
 *   <li>If filter recreation is enabled and the filter differs (ignoring whitespace), the
 *       subscription is deleted and created again.
 *   <li>Otherwise, unless endpoint updates are disabled, a differing push endpoint is updated.
 * </ol>
 *
 * <p>A missing subscription is created, along with its topic if that is missing too, unless
 * creation is disabled in the {@link SubscriberConfig}.
 */
public class SubscriptionResolver {
  private static final Logger logger = LoggerFactory.getLogger(SubscriptionResolver.class);

  private final SubscriberConfig config;
  private final ConnectionRegistry connections;

  private final ReentrantReadWriteLock cacheLock = new ReentrantReadWriteLock();
  private final Map<String, SubscriptionHandle> cache = new HashMap<>();

  public SubscriptionResolver(
      @Nonnull SubscriberConfig config, @Nonnull ConnectionRegistry connections) {
    this.config = config;
    this.connections = connections;
  }

  /**
   * Resolves a subscription.
   *
   * @param ctx aborts the resolution between remote calls when done
   * @param subscriptionName the short subscription name
   * @param topicName the short topic name
   * @return the cached or newly resolved handle
   * @throws io.courier.NonRetriableException if the subscription or topic is missing and may not be
   *     created, or the subscription is bound to another topic
   * @throws CourierException if a remote call fails
   */
  @Nonnull
  public SubscriptionHandle resolve(
      @Nonnull Context ctx, @Nonnull String subscriptionName, @Nonnull String topicName) {
    String topicPath = TopicName.format(config.topicProjectId(), topicName);

    SubscriptionHandle handle;
    cacheLock.readLock().lock();
    try {
      handle = cache.get(subscriptionName);
    } finally {
      cacheLock.readLock().unlock();
    }
    if (handle != null) {
      return checkCachedTopic(handle, topicPath);
    }

    cacheLock.writeLock().lock();
    try {
      handle = cache.get(subscriptionName);
      if (handle != null) {
        return checkCachedTopic(handle, topicPath);
      }
      handle = resolveRemote(ctx, subscriptionName, topicPath);
      cache.put(subscriptionName, handle);
      return handle;
    } finally {
      cacheLock.writeLock().unlock();
    }
  }

  /** Returns the number of cached handles. */
  public int cachedCount() {
    cacheLock.readLock().lock();
    try {
      return cache.size();
    } finally {
      cacheLock.readLock().unlock();
    }
  }

  private SubscriptionHandle resolveRemote(
      Context ctx, String subscriptionName, String topicPath) {
    checkNotDone(ctx, subscriptionName);
    ResourceClient client = connections.open();
    String subscriptionPath = ProjectSubscriptionName.format(config.projectId(), subscriptionName);

    boolean exists;
    try {
      exists = client.subscriptionExists(subscriptionPath);
    } catch (CourierException e) {
      throw new CourierException(
          "could not check if subscription " + subscriptionPath + " exists", e);
    }

    SubscriptionDescriptor remote;
    if (exists) {
      remote = existingSubscription(ctx, client, subscriptionPath, topicPath);
    } else if (config.doNotCreateSubscriptionIfMissing()) {
      throw new SubscriptionDoesNotExistException(subscriptionPath);
    } else {
      remote = createSubscription(ctx, client, subscriptionPath, topicPath);
    }

    return new SubscriptionHandle(
        subscriptionPath, subscriptionName, topicPath, remote, config.receiveSettings(), client);
  }

  private SubscriptionDescriptor existingSubscription(
      Context ctx, ResourceClient client, String subscriptionPath, String topicPath) {
    SubscriptionDescriptor remote = fetchConfig(client, subscriptionPath);
    checkBoundTopic(subscriptionPath, remote, topicPath);

    SubscriptionDescriptor desired = config.subscriptionDescriptor();
    if (config.recreateSubscriptionIfFilterChanged() && desired.filterDiffers(remote)) {
      logger.debug(
          "Filter changed on {}: old filter '{}', new filter '{}'",
          subscriptionPath,
          remote.getFilter(),
          desired.getFilter());
      checkNotDone(ctx, subscriptionPath);
      try {
        client.deleteSubscription(subscriptionPath);
      } catch (CourierException e) {
        throw new CourierException("could not delete subscription " + subscriptionPath, e);
      }
      logger.debug("Deleted subscription {}", subscriptionPath);
      return createSubscription(ctx, client, subscriptionPath, topicPath);
    }

    if (config.doNotUpdateSubscriptionIfEndpointChanged()) {
      return remote;
    }

    String oldEndpoint = remote.getPushConfig().getEndpoint();
    String newEndpoint = desired.getPushConfig().getEndpoint();
    if (oldEndpoint.equals(newEndpoint)) {
      return remote;
    }

    checkNotDone(ctx, subscriptionPath);
    SubscriptionDescriptor updated;
    try {
      updated = client.updateSubscriptionPushConfig(subscriptionPath, desired.getPushConfig());
    } catch (CourierException e) {
      throw new CourierException("could not update subscription " + subscriptionPath, e);
    }
    logger.info(
        "Updated subscription endpoint of {}: old endpoint '{}', new endpoint '{}'",
        subscriptionPath,
        oldEndpoint,
        updated.getPushConfig().getEndpoint());
    logger.debug("Updated subscription config: old {}, new {}", remote, updated);
    return updated;
  }

  private SubscriptionDescriptor createSubscription(
      Context ctx, ResourceClient client, String subscriptionPath, String topicPath) {
    checkNotDone(ctx, subscriptionPath);
    boolean topicExists;
    try {
      topicExists = client.topicExists(topicPath);
    } catch (CourierException e) {
      throw new CourierException("could not check if topic " + topicPath + " exists", e);
    }

    if (!topicExists && config.doNotCreateTopicIfMissing()) {
      throw new TopicDoesNotExistException(topicPath);
    }

    if (!topicExists) {
      checkNotDone(ctx, subscriptionPath);
      try {
        client.createTopic(topicPath);
        logger.info("Created topic {}", topicPath);
      } catch (ResourceAlreadyExistsException e) {
        logger.debug("Topic {} already exists", topicPath);
      } catch (CourierException e) {
        throw new CourierException(
            "could not create topic for subscription " + subscriptionPath, e);
      }
    }

    checkNotDone(ctx, subscriptionPath);
    SubscriptionDescriptor desired = config.subscriptionDescriptor();
    try {
      client.createSubscription(subscriptionPath, topicPath, desired);
      logger.info("Created subscription {} for topic {}", subscriptionPath, topicPath);
      return desired.toBuilder().topic(topicPath).build();
    } catch (ResourceAlreadyExistsException e) {
      logger.debug("Subscription {} already exists", subscriptionPath);
    } catch (CourierException e) {
      throw new CourierException("cannot create subscription " + subscriptionPath, e);
    }

    // Created concurrently by someone else; it must still be bound to our topic.
    SubscriptionDescriptor remote = fetchConfig(client, subscriptionPath);
    checkBoundTopic(subscriptionPath, remote, topicPath);
    return remote;
  }

  private static SubscriptionDescriptor fetchConfig(
      ResourceClient client, String subscriptionPath) {
    try {
      return client.fetchSubscriptionConfig(subscriptionPath);
    } catch (CourierException e) {
      throw new CourierException(
          "could not fetch config for existing subscription " + subscriptionPath, e);
    }
  }

  private static void checkBoundTopic(
      String subscriptionPath, SubscriptionDescriptor remote, String topicPath) {
    if (!topicPath.equals(remote.getTopic())) {
      throw new UnexpectedTopicException(subscriptionPath, remote.getTopic(), topicPath);
    }
  }

  private static SubscriptionHandle checkCachedTopic(SubscriptionHandle handle, String topicPath) {
    if (!handle.getTopicPath().equals(topicPath)) {
      throw new UnexpectedTopicException(handle.getPath(), handle.getTopicPath(), topicPath);
    }
    return handle;
  }

  private static void checkNotDone(Context ctx, String subscription) {
    if (ctx.isDone()) {
      throw new CourierException("resolution of subscription " + subscription + " was canceled");
    }
  }
}
