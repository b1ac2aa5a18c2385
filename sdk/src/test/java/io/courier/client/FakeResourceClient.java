package io.courier.client;

import com.google.pubsub.v1.PubsubMessage;
import io.courier.Context;
import io.courier.CourierException;
import io.courier.ResourceAlreadyExistsException;
import io.courier.message.AckReply;
import io.courier.message.Envelope;
import io.courier.subscription.PushConfig;
import io.courier.subscription.ReceiveSettings;
import io.courier.subscription.SubscriptionDescriptor;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import javax.annotation.Nonnull;

/** One connection to a {@link FakePubSubService}. */
public class FakeResourceClient implements ResourceClient {
  private final FakePubSubService service;
  private volatile boolean closed;

  public FakeResourceClient(FakePubSubService service) {
    this.service = service;
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public boolean subscriptionExists(@Nonnull String subscription) {
    service.record(FakePubSubService.SUBSCRIPTION_EXISTS, subscription);
    return service.subscriptionExists(subscription);
  }

  @Override
  public void createSubscription(
      @Nonnull String subscription,
      @Nonnull String topic,
      @Nonnull SubscriptionDescriptor descriptor) {
    service.record(FakePubSubService.CREATE_SUBSCRIPTION, subscription);
    if (service.takeConcurrentSubscription(subscription)
        || service.subscriptionExists(subscription)) {
      throw new ResourceAlreadyExistsException(subscription, null);
    }
    if (!service.hasTopic(topic)) {
      throw new CourierException("topic not found: " + topic);
    }
    service.addSubscription(subscription, descriptor.toBuilder().topic(topic).build());
  }

  @Nonnull
  @Override
  public SubscriptionDescriptor fetchSubscriptionConfig(@Nonnull String subscription) {
    service.record(FakePubSubService.FETCH_SUBSCRIPTION_CONFIG, subscription);
    return existing(subscription);
  }

  @Nonnull
  @Override
  public SubscriptionDescriptor updateSubscriptionPushConfig(
      @Nonnull String subscription, @Nonnull PushConfig pushConfig) {
    service.record(FakePubSubService.UPDATE_PUSH_CONFIG, subscription);
    SubscriptionDescriptor updated =
        existing(subscription).toBuilder().pushConfig(pushConfig).build();
    service.addSubscription(subscription, updated);
    return updated;
  }

  @Override
  public void deleteSubscription(@Nonnull String subscription) {
    service.record(FakePubSubService.DELETE_SUBSCRIPTION, subscription);
    existing(subscription);
    service.removeSubscription(subscription);
  }

  @Override
  public boolean topicExists(@Nonnull String topic) {
    service.record(FakePubSubService.TOPIC_EXISTS, topic);
    return service.hasTopic(topic);
  }

  @Override
  public void createTopic(@Nonnull String topic) {
    service.record(FakePubSubService.CREATE_TOPIC, topic);
    if (service.takeConcurrentTopic(topic) || service.hasTopic(topic)) {
      throw new ResourceAlreadyExistsException(topic, null);
    }
    service.addTopic(topic);
  }

  @Override
  public void receive(
      @Nonnull String subscription,
      @Nonnull ReceiveSettings settings,
      @Nonnull Context ctx,
      @Nonnull Consumer<Envelope> handler) {
    service.record(FakePubSubService.RECEIVE, subscription);
    if (service.takeReceiveFailure()) {
      throw new CourierException("stream broken: " + subscription);
    }

    BlockingQueue<PubsubMessage> backlog = service.backlog(subscription);
    Semaphore outstanding = new Semaphore((int) settings.getMaxOutstandingMessages());
    ExecutorService dispatcher = Executors.newCachedThreadPool();
    boolean broken = false;
    try {
      while (!ctx.isDone()) {
        if (service.takeStreamBreak()) {
          broken = true;
          throw new CourierException("stream broken: " + subscription);
        }
        PubsubMessage message = backlog.poll(10, TimeUnit.MILLISECONDS);
        if (message == null) {
          continue;
        }
        outstanding.acquire();
        dispatcher.execute(
            () -> {
              try {
                handler.accept(Envelope.fromPubsubMessage(message, 1, reply(message)));
              } finally {
                outstanding.release();
              }
            });
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CourierException("interrupted while receiving from " + subscription, e);
    } finally {
      dispatcher.shutdown();
      if (!broken) {
        try {
          dispatcher.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }
    }
  }

  @Override
  public void close() {
    closed = true;
    service.record(FakePubSubService.CLOSE, "connection");
  }

  private AckReply reply(PubsubMessage message) {
    return new AckReply() {
      @Override
      public void ack() {
        service.recordOutcome(message.getMessageId(), "ack");
      }

      @Override
      public void nack() {
        service.recordOutcome(message.getMessageId(), "nack");
      }
    };
  }

  private SubscriptionDescriptor existing(String subscription) {
    SubscriptionDescriptor descriptor = service.getSubscription(subscription);
    if (descriptor == null) {
      throw new CourierException("subscription not found: " + subscription);
    }
    return descriptor;
  }
}
