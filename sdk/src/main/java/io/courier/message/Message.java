package io.courier.message;

import io.courier.Context;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import javax.annotation.Nonnull;

/**
 * A message handed to the application by a subscription stream.
 *
 * <p>Every message must be resolved exactly once by calling {@link #ack()} or {@link #nack()}. The
 * first decision is final: acking a nacked message (or the reverse) returns false and has no
 * effect, while repeating the same decision is a no-op that returns true.
 *
 * <p>Messages received from a subscription carry a {@link Context} that is canceled when the
 * subscription stops or the subscriber closes. Once that happens the outcome has already been
 * reported upstream as a nack and later calls to {@link #ack()} are ignored.
 */
public class Message {
  private final String uuid;
  private final Map<String, String> metadata;
  private final byte[] payload;

  private final Object lock = new Object();
  private final CompletableFuture<Void> ackFuture = new CompletableFuture<>();
  private final CompletableFuture<Void> nackFuture = new CompletableFuture<>();
  private Outcome outcome = Outcome.PENDING;
  private Context context = Context.background();

  public Message(@Nonnull String uuid, @Nonnull byte[] payload) {
    this(uuid, new HashMap<>(), payload);
  }

  public Message(
      @Nonnull String uuid, @Nonnull Map<String, String> metadata, @Nonnull byte[] payload) {
    this.uuid = Objects.requireNonNull(uuid, "uuid cannot be null");
    this.metadata = new HashMap<>(Objects.requireNonNull(metadata, "metadata cannot be null"));
    this.payload = Objects.requireNonNull(payload, "payload cannot be null");
  }

  @Nonnull
  public String getUuid() {
    return uuid;
  }

  /** Returns the mutable metadata map of this message. */
  @Nonnull
  public Map<String, String> getMetadata() {
    return metadata;
  }

  @Nonnull
  public byte[] getPayload() {
    return payload;
  }

  @Nonnull
  public Context getContext() {
    synchronized (lock) {
      return context;
    }
  }

  public void setContext(@Nonnull Context context) {
    synchronized (lock) {
      this.context = Objects.requireNonNull(context, "context cannot be null");
    }
  }

  /**
   * Acknowledges the message.
   *
   * @return false if the message was already nacked
   */
  public boolean ack() {
    synchronized (lock) {
      if (outcome == Outcome.NACKED) {
        return false;
      }
      outcome = Outcome.ACKED;
    }
    ackFuture.complete(null);
    return true;
  }

  /**
   * Negatively acknowledges the message so that it is redelivered.
   *
   * @return false if the message was already acked
   */
  public boolean nack() {
    synchronized (lock) {
      if (outcome == Outcome.ACKED) {
        return false;
      }
      outcome = Outcome.NACKED;
    }
    nackFuture.complete(null);
    return true;
  }

  public boolean isAcked() {
    synchronized (lock) {
      return outcome == Outcome.ACKED;
    }
  }

  public boolean isNacked() {
    synchronized (lock) {
      return outcome == Outcome.NACKED;
    }
  }

  /** Completes when the message is acked. Never completes for a nacked message. */
  @Nonnull
  public CompletionStage<Void> acked() {
    return ackFuture.minimalCompletionStage();
  }

  /** Completes when the message is nacked. Never completes for an acked message. */
  @Nonnull
  public CompletionStage<Void> nacked() {
    return nackFuture.minimalCompletionStage();
  }

  /**
   * Returns true if the other message has the same uuid, metadata and payload. Outcome and context
   * are not compared.
   */
  public boolean sameContentAs(@Nonnull Message other) {
    return uuid.equals(other.uuid)
        && metadata.equals(other.metadata)
        && Arrays.equals(payload, other.payload);
  }

  @Override
  public String toString() {
    return "Message{uuid=" + uuid + ", metadata=" + metadata + "}";
  }

  private enum Outcome {
    PENDING,
    ACKED,
    NACKED
  }
}
