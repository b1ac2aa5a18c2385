package io.courier.stream;

import io.courier.Context;
import io.courier.CourierException;
import io.courier.message.Envelope;
import io.courier.message.Message;
import io.courier.message.Unmarshaler;
import io.courier.subscription.SubscriptionHandle;
import java.util.concurrent.CountDownLatch;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves envelopes from a streaming receive into a {@link MessageStream} and reports each
 * message's outcome upstream.
 *
 * <p>Every envelope is acked or nacked exactly once:
 *
 * <ul>
 *   <li>undecodable envelopes are nacked
 *   <li>messages the application did not take before the subscription stopped are nacked
 *   <li>messages the application acked are acked
 *   <li>everything else is nacked: an explicit nack, cancellation of the message context or
 *       shutdown of the subscriber, whichever comes first
 * </ul>
 *
 * <p>An ack that was already given when a competing event is observed still counts as an ack.
 */
public class DeliveryLoop {
  private static final Logger logger = LoggerFactory.getLogger(DeliveryLoop.class);

  private final SubscriptionHandle handle;
  private final Unmarshaler unmarshaler;
  private final MessageStream output;
  private final Context closing;

  public DeliveryLoop(
      @Nonnull SubscriptionHandle handle,
      @Nonnull Unmarshaler unmarshaler,
      @Nonnull MessageStream output,
      @Nonnull Context closing) {
    this.handle = handle;
    this.unmarshaler = unmarshaler;
    this.output = output;
    this.closing = closing;
  }

  /**
   * Receives until {@code ctx} is done.
   *
   * <p>Messages of this attempt that are still awaiting an outcome when it ends are nacked, so no
   * handler outlives the stream its envelope came from.
   *
   * @param ctx the subscription context
   * @throws CourierException if the streaming receive fails
   */
  public void run(@Nonnull Context ctx) {
    Context attemptCtx = ctx.withCancel();
    try {
      handle
          .getClient()
          .receive(
              handle.getPath(),
              handle.getReceiveSettings(),
              attemptCtx,
              envelope -> deliver(attemptCtx, envelope));
    } finally {
      attemptCtx.cancel();
    }
  }

  void deliver(Context ctx, Envelope envelope) {
    Message message;
    try {
      message = unmarshaler.unmarshal(envelope);
    } catch (RuntimeException e) {
      logger.error(
          "Could not unmarshal message {} from {}",
          envelope.getMessageId(),
          handle.getPath(),
          e);
      envelope.nack();
      return;
    }

    Context messageCtx = ctx.withCancel();
    message.setContext(messageCtx);
    try {
      if (!offer(ctx, message)) {
        logger.trace(
            "Message {} was not taken before {} stopped", message.getUuid(), handle.getPath());
        envelope.nack();
        return;
      }
      if (awaitOutcome(message, messageCtx)) {
        envelope.ack();
        logger.trace("Message {} acked", message.getUuid());
      } else {
        envelope.nack();
        logger.trace("Message {} nacked", message.getUuid());
      }
    } finally {
      messageCtx.cancel();
    }
  }

  private boolean offer(Context ctx, Message message) {
    try {
      return output.send(message, ctx, closing);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /** Waits for the first deciding event and returns whether the message counts as acked. */
  private boolean awaitOutcome(Message message, Context messageCtx) {
    CountDownLatch decided = new CountDownLatch(1);
    Context.Registration onClosing = closing.onDone(decided::countDown);
    Context.Registration onCancel = messageCtx.onDone(decided::countDown);
    message.acked().thenRun(decided::countDown);
    message.nacked().thenRun(decided::countDown);
    try {
      decided.await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      onClosing.remove();
      onCancel.remove();
    }
    // Nacking fails only if the application acked first.
    return message.isAcked() || !message.nack();
  }
}
