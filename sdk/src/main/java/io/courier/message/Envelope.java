package io.courier.message;

import com.google.protobuf.ByteString;
import com.google.pubsub.v1.PubsubMessage;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A message as delivered by the service, before decoding.
 *
 * <p>Besides the service-level fields an envelope carries the {@link AckReply} through which its
 * outcome is reported upstream.
 */
public final class Envelope {
  private final String messageId;
  private final ByteString data;
  private final Map<String, String> attributes;
  @Nullable private final Instant publishTime;
  private final String orderingKey;
  private final int deliveryAttempt;
  private final AckReply reply;

  private Envelope(Builder builder) {
    this.messageId = builder.messageId;
    this.data = builder.data;
    this.attributes = Collections.unmodifiableMap(new HashMap<>(builder.attributes));
    this.publishTime = builder.publishTime;
    this.orderingKey = builder.orderingKey;
    this.deliveryAttempt = builder.deliveryAttempt;
    this.reply = builder.reply;
  }

  /**
   * Wraps a received {@link PubsubMessage}.
   *
   * @param message the received message
   * @param deliveryAttempt the delivery attempt, or 0 when the service does not report it
   * @param reply the reply used to ack or nack this delivery
   * @return the envelope
   */
  @Nonnull
  public static Envelope fromPubsubMessage(
      @Nonnull PubsubMessage message, int deliveryAttempt, @Nonnull AckReply reply) {
    Builder builder =
        builder()
            .messageId(message.getMessageId())
            .data(message.getData())
            .attributes(message.getAttributesMap())
            .orderingKey(message.getOrderingKey())
            .deliveryAttempt(deliveryAttempt)
            .reply(reply);
    if (message.hasPublishTime()) {
      builder.publishTime(
          Instant.ofEpochSecond(
              message.getPublishTime().getSeconds(), message.getPublishTime().getNanos()));
    }
    return builder.build();
  }

  @Nonnull
  public static Builder builder() {
    return new Builder();
  }

  @Nonnull
  public String getMessageId() {
    return messageId;
  }

  @Nonnull
  public ByteString getData() {
    return data;
  }

  @Nonnull
  public Map<String, String> getAttributes() {
    return attributes;
  }

  @Nullable
  public Instant getPublishTime() {
    return publishTime;
  }

  /** Returns the ordering key, or an empty string when the message was published without one. */
  @Nonnull
  public String getOrderingKey() {
    return orderingKey;
  }

  public int getDeliveryAttempt() {
    return deliveryAttempt;
  }

  public void ack() {
    reply.ack();
  }

  public void nack() {
    reply.nack();
  }

  /** Builder for {@link Envelope}. */
  public static final class Builder {
    private String messageId = "";
    private ByteString data = ByteString.EMPTY;
    private Map<String, String> attributes = Collections.emptyMap();
    private Instant publishTime;
    private String orderingKey = "";
    private int deliveryAttempt;
    private AckReply reply;

    private Builder() {}

    public Builder messageId(@Nonnull String messageId) {
      this.messageId = Objects.requireNonNull(messageId, "messageId cannot be null");
      return this;
    }

    public Builder data(@Nonnull ByteString data) {
      this.data = Objects.requireNonNull(data, "data cannot be null");
      return this;
    }

    public Builder attributes(@Nonnull Map<String, String> attributes) {
      this.attributes = Objects.requireNonNull(attributes, "attributes cannot be null");
      return this;
    }

    public Builder publishTime(@Nullable Instant publishTime) {
      this.publishTime = publishTime;
      return this;
    }

    public Builder orderingKey(@Nonnull String orderingKey) {
      this.orderingKey = Objects.requireNonNull(orderingKey, "orderingKey cannot be null");
      return this;
    }

    public Builder deliveryAttempt(int deliveryAttempt) {
      this.deliveryAttempt = deliveryAttempt;
      return this;
    }

    public Builder reply(@Nonnull AckReply reply) {
      this.reply = Objects.requireNonNull(reply, "reply cannot be null");
      return this;
    }

    @Nonnull
    public Envelope build() {
      if (reply == null) {
        throw new IllegalStateException("reply must be set");
      }
      return new Envelope(this);
    }
  }
}
