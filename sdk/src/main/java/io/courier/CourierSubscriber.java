package io.courier;

import io.courier.client.ConnectionFactory;
import io.courier.client.ConnectionRegistry;
import io.courier.common.concurrent.NamedThreadFactory;
import io.courier.stream.MessageStream;
import io.courier.stream.SubscriptionTask;
import io.courier.subscription.SubscriptionHandle;
import io.courier.subscription.SubscriptionResolver;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subscribes to Pub/Sub topics and delivers their messages as {@link MessageStream}s.
 *
 * <p>This is the main entry point of the SDK. One instance can serve any number of topics. For each
 * topic a subscription name is generated with the configured {@link
 * io.courier.subscription.SubscriptionNameFn}; the subscription (and its topic) is created or
 * reconciled on first use and reused afterwards.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * SubscriberConfig config = SubscriberConfig.builder().setProjectId("my-project").build();
 * try (CourierSubscriber subscriber = CourierSubscriber.builder(config).build()) {
 *   MessageStream messages = subscriber.subscribe("orders");
 *   Message message;
 *   while ((message = messages.receive()) != null) {
 *     handle(message);
 *     message.ack();
 *   }
 * }
 * }</pre>
 *
 * <p>Streaming failures are retried with exponential backoff for as long as the subscriber is
 * open; they are only visible in the logs.
 *
 * @see CourierSubscriberBuilder
 */
public class CourierSubscriber implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(CourierSubscriber.class);

  private final SubscriberConfig config;
  private final ExecutorService executor;
  private final boolean ownsExecutor;
  private final ConnectionRegistry connections;
  private final SubscriptionResolver resolver;
  private final Context closing = Context.background();

  // Guards closed and activeStreams.
  private final Object closedLock = new Object();
  private boolean closed = false;
  private int activeStreams = 0;

  /**
   * Creates a new CourierSubscriber.
   *
   * <p>This constructor is package-private and intended for use by {@link
   * CourierSubscriberBuilder}.
   *
   * @param config Subscriber configuration
   * @param executor Executor running one task per active stream
   * @param ownsExecutor Whether {@link #close()} shuts the executor down
   * @param connectionFactory Factory for connections to the service
   */
  CourierSubscriber(
      @Nonnull SubscriberConfig config,
      @Nonnull ExecutorService executor,
      boolean ownsExecutor,
      @Nonnull ConnectionFactory connectionFactory) {
    this.config = config;
    this.executor = executor;
    this.ownsExecutor = ownsExecutor;
    this.connections = new ConnectionRegistry(connectionFactory);
    this.resolver = new SubscriptionResolver(config, connections);
  }

  /**
   * Creates a new builder for configuring a CourierSubscriber.
   *
   * @param config Subscriber configuration
   * @return A new CourierSubscriberBuilder instance
   */
  @Nonnull
  public static CourierSubscriberBuilder builder(@Nonnull SubscriberConfig config) {
    return new CourierSubscriberBuilder(config);
  }

  /** Creates the default executor service. Package-private for use by the builder. */
  static ExecutorService createDefaultExecutor() {
    return Executors.newCachedThreadPool(new NamedThreadFactory("CourierSubscriber-worker"));
  }

  /**
   * Subscribes to a topic.
   *
   * <p>The subscription is resolved synchronously, so configuration and resolution problems are
   * thrown here. Messages are then delivered in the background until {@code ctx} is canceled or
   * the subscriber is closed, after which the returned stream is closed.
   *
   * @param ctx Cancels this subscription only
   * @param topic Short topic name
   * @return The message stream of the subscription
   * @throws SubscriberClosedException if the subscriber is closed
   * @throws NonRetriableException if the subscription cannot be used (see {@link
   *     SubscriptionResolver})
   * @throws CourierException if a remote call fails during resolution
   */
  @Nonnull
  public MessageStream subscribe(@Nonnull Context ctx, @Nonnull String topic) {
    Objects.requireNonNull(ctx, "ctx cannot be null");
    Objects.requireNonNull(topic, "topic cannot be null");
    if (isClosed()) {
      throw new SubscriberClosedException();
    }

    String subscriptionName = config.subscriptionNameFn().subscriptionName(topic);
    logger.info("Subscribing to topic {} with subscription {}", topic, subscriptionName);
    SubscriptionHandle handle = resolver.resolve(ctx, subscriptionName, topic);

    Context subscriptionCtx = ctx.withCancel();
    Context.Registration relay = closing.onDone(subscriptionCtx::cancel);
    SubscriptionTask task;
    try {
      task =
          new SubscriptionTask(
              handle,
              config,
              subscriptionCtx,
              closing,
              () -> {
                relay.remove();
                streamFinished();
              });
    } catch (RuntimeException e) {
      relay.remove();
      subscriptionCtx.cancel();
      throw e;
    }

    synchronized (closedLock) {
      if (closed) {
        relay.remove();
        subscriptionCtx.cancel();
        throw new SubscriberClosedException();
      }
      activeStreams++;
    }
    // Only task.run() or task.abort() lowers the count again.
    try {
      executor.execute(task);
    } catch (RuntimeException e) {
      task.abort();
      throw new CourierException("Cannot start receiving from " + handle.getPath(), e);
    }
    logger.info("Subscribed to {}", handle.getPath());
    return task.getOutput();
  }

  /**
   * Subscribes to a topic until the subscriber is closed.
   *
   * @param topic Short topic name
   * @return The message stream of the subscription
   * @see #subscribe(Context, String)
   */
  @Nonnull
  public MessageStream subscribe(@Nonnull String topic) {
    return subscribe(Context.background(), topic);
  }

  /**
   * Creates and reconciles the subscription of a topic without receiving from it.
   *
   * <p>Useful to make sure a subscription exists before anything is published to its topic. The
   * call is bounded by {@link SubscriberConfig#initializeTimeout()}.
   *
   * @param topic Short topic name
   * @throws SubscriberClosedException if the subscriber is closed
   * @throws CourierException if resolution fails or times out
   */
  public void initialize(@Nonnull String topic) {
    Objects.requireNonNull(topic, "topic cannot be null");
    if (isClosed()) {
      throw new SubscriberClosedException();
    }

    String subscriptionName = config.subscriptionNameFn().subscriptionName(topic);
    logger.info("Initializing subscription {} for topic {}", subscriptionName, topic);
    long timeoutMs = config.initializeTimeout().toMillis();
    Context ctx = closing.withTimeout(config.initializeTimeout());
    Future<SubscriptionHandle> resolution;
    try {
      resolution = executor.submit(() -> resolver.resolve(ctx, subscriptionName, topic));
    } catch (RejectedExecutionException e) {
      ctx.cancel();
      throw new CourierException("Cannot initialize subscription " + subscriptionName, e);
    }

    try {
      SubscriptionHandle handle = resolution.get(timeoutMs, TimeUnit.MILLISECONDS);
      logger.info("Initialized subscription {}", handle.getPath());
    } catch (TimeoutException e) {
      throw new CourierException(
          "Initializing subscription " + subscriptionName + " timed out after " + timeoutMs + "ms",
          e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof CourierException) {
        throw (CourierException) cause;
      }
      throw new CourierException("Cannot initialize subscription " + subscriptionName, cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CourierException(
          "Interrupted while initializing subscription " + subscriptionName, e);
    } finally {
      ctx.cancel();
    }
  }

  /** Returns true once {@link #close()} has been called. */
  public boolean isClosed() {
    synchronized (closedLock) {
      return closed;
    }
  }

  /**
   * Closes the subscriber.
   *
   * <p>This method:
   *
   * <ol>
   *   <li>Stops every subscription; messages awaiting an outcome are nacked
   *   <li>Waits for every stream to be closed
   *   <li>Closes every connection opened by the subscriber
   *   <li>Shuts down the executor, unless it was supplied through the builder
   * </ol>
   *
   * <p>Calling it again has no effect.
   *
   * @throws CourierException if some connections failed to close; each failure is attached as a
   *     suppressed exception
   */
  @Override
  public void close() {
    synchronized (closedLock) {
      if (closed) {
        return;
      }
      closed = true;
    }
    logger.debug("Closing CourierSubscriber");
    closing.cancel();
    awaitStreams();

    List<Exception> failures = connections.closeAll();
    if (ownsExecutor) {
      shutdownExecutor();
    }
    if (!failures.isEmpty()) {
      CourierException error =
          new CourierException("Failed to close " + failures.size() + " connection(s)");
      failures.forEach(error::addSuppressed);
      throw error;
    }
    logger.debug("CourierSubscriber closed");
  }

  private void streamFinished() {
    synchronized (closedLock) {
      activeStreams--;
      closedLock.notifyAll();
    }
  }

  private void awaitStreams() {
    synchronized (closedLock) {
      while (activeStreams > 0) {
        logger.debug("Waiting for {} subscription(s) to stop", activeStreams);
        try {
          closedLock.wait();
        } catch (InterruptedException e) {
          logger.warn("Interrupted while waiting for {} subscription(s) to stop", activeStreams);
          Thread.currentThread().interrupt();
          return;
        }
      }
    }
  }

  private void shutdownExecutor() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        logger.warn("Executor did not terminate gracefully, forcing shutdown");
        executor.shutdownNow();
        if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
          logger.error("Executor did not terminate after forced shutdown");
        }
      }
    } catch (InterruptedException e) {
      logger.warn("Interrupted while waiting for executor shutdown");
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  int activeStreamCount() {
    synchronized (closedLock) {
      return activeStreams;
    }
  }
}
