package io.courier.client;

import com.google.api.core.ApiService;
import com.google.api.gax.batching.FlowControlSettings;
import com.google.api.gax.core.CredentialsProvider;
import com.google.api.gax.core.InstantiatingExecutorProvider;
import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.TransportChannelProvider;
import com.google.cloud.pubsub.v1.AckReplyConsumer;
import com.google.cloud.pubsub.v1.MessageReceiver;
import com.google.cloud.pubsub.v1.Subscriber;
import com.google.cloud.pubsub.v1.SubscriptionAdminClient;
import com.google.cloud.pubsub.v1.TopicAdminClient;
import com.google.pubsub.v1.PubsubMessage;
import io.courier.Context;
import io.courier.CourierException;
import io.courier.ResourceAlreadyExistsException;
import io.courier.message.AckReply;
import io.courier.message.Envelope;
import io.courier.subscription.PushConfig;
import io.courier.subscription.ReceiveSettings;
import io.courier.subscription.SubscriptionDescriptor;
import io.grpc.ManagedChannel;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ResourceClient} backed by the Google Cloud Pub/Sub admin clients and a streaming-pull
 * {@link Subscriber} per {@link #receive} call.
 *
 * <p>Instances are created by {@link GcpConnectionFactory}.
 */
public class GcpResourceClient implements ResourceClient {
  private static final Logger logger = LoggerFactory.getLogger(GcpResourceClient.class);

  private static final long SUBSCRIBER_STOP_TIMEOUT_SECONDS = 30;

  private final SubscriptionAdminClient subscriptionAdmin;
  private final TopicAdminClient topicAdmin;
  @Nullable private final TransportChannelProvider channelProvider;
  @Nullable private final CredentialsProvider credentialsProvider;
  @Nullable private final ManagedChannel ownedChannel;

  GcpResourceClient(
      SubscriptionAdminClient subscriptionAdmin,
      TopicAdminClient topicAdmin,
      @Nullable TransportChannelProvider channelProvider,
      @Nullable CredentialsProvider credentialsProvider,
      @Nullable ManagedChannel ownedChannel) {
    this.subscriptionAdmin = subscriptionAdmin;
    this.topicAdmin = topicAdmin;
    this.channelProvider = channelProvider;
    this.credentialsProvider = credentialsProvider;
    this.ownedChannel = ownedChannel;
  }

  @Override
  public boolean subscriptionExists(@Nonnull String subscription) {
    try {
      subscriptionAdmin.getSubscription(subscription);
      return true;
    } catch (ApiException e) {
      if (GrpcErrorHandling.isNotFound(e)) {
        return false;
      }
      throw new CourierException("Failed to get subscription " + subscription, e);
    }
  }

  @Override
  public void createSubscription(
      @Nonnull String subscription,
      @Nonnull String topic,
      @Nonnull SubscriptionDescriptor descriptor) {
    try {
      subscriptionAdmin.createSubscription(
          ResourceProtos.toSubscription(subscription, topic, descriptor));
    } catch (ApiException e) {
      if (GrpcErrorHandling.isAlreadyExists(e)) {
        throw new ResourceAlreadyExistsException(subscription, e);
      }
      throw new CourierException("Failed to create subscription " + subscription, e);
    }
  }

  @Nonnull
  @Override
  public SubscriptionDescriptor fetchSubscriptionConfig(@Nonnull String subscription) {
    try {
      return ResourceProtos.fromSubscription(subscriptionAdmin.getSubscription(subscription));
    } catch (ApiException e) {
      throw new CourierException("Failed to get subscription " + subscription, e);
    }
  }

  @Nonnull
  @Override
  public SubscriptionDescriptor updateSubscriptionPushConfig(
      @Nonnull String subscription, @Nonnull PushConfig pushConfig) {
    try {
      return ResourceProtos.fromSubscription(
          subscriptionAdmin.updateSubscription(
              ResourceProtos.pushConfigUpdate(subscription, pushConfig)));
    } catch (ApiException e) {
      throw new CourierException("Failed to update subscription " + subscription, e);
    }
  }

  @Override
  public void deleteSubscription(@Nonnull String subscription) {
    try {
      subscriptionAdmin.deleteSubscription(subscription);
    } catch (ApiException e) {
      throw new CourierException("Failed to delete subscription " + subscription, e);
    }
  }

  @Override
  public boolean topicExists(@Nonnull String topic) {
    try {
      topicAdmin.getTopic(topic);
      return true;
    } catch (ApiException e) {
      if (GrpcErrorHandling.isNotFound(e)) {
        return false;
      }
      throw new CourierException("Failed to get topic " + topic, e);
    }
  }

  @Override
  public void createTopic(@Nonnull String topic) {
    try {
      topicAdmin.createTopic(topic);
    } catch (ApiException e) {
      if (GrpcErrorHandling.isAlreadyExists(e)) {
        throw new ResourceAlreadyExistsException(topic, e);
      }
      throw new CourierException("Failed to create topic " + topic, e);
    }
  }

  @Override
  public void receive(
      @Nonnull String subscription,
      @Nonnull ReceiveSettings settings,
      @Nonnull Context ctx,
      @Nonnull Consumer<Envelope> handler) {
    MessageReceiver receiver =
        (PubsubMessage message, AckReplyConsumer consumer) -> {
          Integer attempt = Subscriber.getDeliveryAttempt(message);
          handler.accept(
              Envelope.fromPubsubMessage(
                  message, attempt == null ? 0 : attempt, new ConsumerAckReply(consumer)));
        };
    Subscriber subscriber = newSubscriber(subscription, settings, receiver);

    // Completes with null when ctx is done, or with the failure of the stream.
    CompletableFuture<Throwable> outcome = new CompletableFuture<>();
    subscriber.addListener(
        new ApiService.Listener() {
          @Override
          public void failed(ApiService.State from, Throwable failure) {
            outcome.complete(failure);
          }
        },
        Runnable::run);
    Context.Registration registration = ctx.onDone(() -> outcome.complete(null));

    logger.debug("Starting streaming pull on {}", subscription);
    subscriber.startAsync();
    Throwable failure;
    try {
      failure = outcome.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CourierException("Interrupted while receiving from " + subscription, e);
    } catch (ExecutionException e) {
      throw new CourierException("Streaming pull failed on " + subscription, e.getCause());
    } finally {
      registration.remove();
      stop(subscriber, subscription);
    }
    if (failure != null) {
      throw new CourierException("Streaming pull failed on " + subscription, failure);
    }
  }

  private Subscriber newSubscriber(
      String subscription, ReceiveSettings settings, MessageReceiver receiver) {
    Subscriber.Builder builder =
        Subscriber.newBuilder(subscription, receiver)
            .setFlowControlSettings(
                FlowControlSettings.newBuilder()
                    .setMaxOutstandingElementCount(settings.getMaxOutstandingMessages())
                    .setMaxOutstandingRequestBytes(settings.getMaxOutstandingBytes())
                    .build())
            .setParallelPullCount(settings.getParallelPullCount())
            .setExecutorProvider(
                InstantiatingExecutorProvider.newBuilder()
                    .setExecutorThreadCount(settings.getExecutorThreadCount())
                    .build());
    if (channelProvider != null) {
      builder.setChannelProvider(channelProvider);
    }
    if (credentialsProvider != null) {
      builder.setCredentialsProvider(credentialsProvider);
    }
    return builder.build();
  }

  // A failed subscriber does not wait for its receivers; the caller cancels their context.
  private void stop(Subscriber subscriber, String subscription) {
    if (subscriber.state() == ApiService.State.FAILED) {
      return;
    }
    try {
      subscriber.stopAsync().awaitTerminated(SUBSCRIBER_STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
      logger.debug("Stopped streaming pull on {}", subscription);
    } catch (TimeoutException e) {
      logger.warn("Streaming pull on {} did not stop in time", subscription, e);
    } catch (IllegalStateException e) {
      logger.warn("Streaming pull on {} failed while stopping", subscription, e);
    }
  }

  @Override
  public void close() {
    subscriptionAdmin.close();
    topicAdmin.close();
    if (ownedChannel != null) {
      ownedChannel.shutdown();
    }
  }

  private static final class ConsumerAckReply implements AckReply {
    private final AckReplyConsumer consumer;

    ConsumerAckReply(AckReplyConsumer consumer) {
      this.consumer = consumer;
    }

    @Override
    public void ack() {
      consumer.ack();
    }

    @Override
    public void nack() {
      consumer.nack();
    }
  }
}
