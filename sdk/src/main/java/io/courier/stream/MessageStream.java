package io.courier.stream;

import io.courier.Context;
import io.courier.message.Message;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The messages of one subscription, as seen by the application.
 *
 * <p>The stream has no buffer: a message is handed over only when the application takes it, and
 * the pipeline waits for that hand-over before it looks at the message's outcome. The number of
 * messages waiting to be taken is therefore bounded by the receive flow-control settings.
 *
 * <pre>{@code
 * MessageStream messages = subscriber.subscribe("orders");
 * Message message;
 * while ((message = messages.receive()) != null) {
 *   process(message);
 *   message.ack();
 * }
 * // the stream was closed: the subscription stopped or the subscriber closed
 * }</pre>
 */
public final class MessageStream {
  private final String subscription;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private final Deque<Offer> offers = new ArrayDeque<>();
  private boolean closed;

  MessageStream(@Nonnull String subscription) {
    this.subscription = subscription;
  }

  /**
   * Waits for the next message.
   *
   * @return the next message, or null once the stream is closed
   * @throws InterruptedException if interrupted while waiting
   */
  @Nullable
  public Message receive() throws InterruptedException {
    lock.lock();
    try {
      while (true) {
        Message message = take();
        if (message != null || closed) {
          return message;
        }
        changed.await();
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits up to {@code timeout} for the next message.
   *
   * @param timeout maximum time to wait
   * @param unit unit of {@code timeout}
   * @return the next message, or null if none arrived in time or the stream is closed
   * @throws InterruptedException if interrupted while waiting
   */
  @Nullable
  public Message poll(long timeout, @Nonnull TimeUnit unit) throws InterruptedException {
    long remainingNanos = unit.toNanos(timeout);
    lock.lock();
    try {
      while (true) {
        Message message = take();
        if (message != null || closed || remainingNanos <= 0) {
          return message;
        }
        remainingNanos = changed.awaitNanos(remainingNanos);
      }
    } finally {
      lock.unlock();
    }
  }

  /** Returns true once the stream is closed. A closed stream never yields another message. */
  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  @Nonnull
  public String getSubscription() {
    return subscription;
  }

  /**
   * Offers a message and waits until the application takes it.
   *
   * @return true if the message was taken, false if {@code ctx} or {@code closing} became done or
   *     the stream was closed first
   * @throws InterruptedException if interrupted before the message was taken
   */
  boolean send(@Nonnull Message message, @Nonnull Context ctx, @Nonnull Context closing)
      throws InterruptedException {
    Offer offer = new Offer(message);
    Context.Registration onCancel = ctx.onDone(this::wakeUp);
    Context.Registration onClosing = closing.onDone(this::wakeUp);
    lock.lock();
    try {
      if (closed) {
        return false;
      }
      offers.addLast(offer);
      changed.signalAll();
      while (!offer.taken) {
        if (closed || ctx.isDone() || closing.isDone()) {
          offers.remove(offer);
          return false;
        }
        changed.await();
      }
      return true;
    } catch (InterruptedException e) {
      if (offer.taken) {
        Thread.currentThread().interrupt();
        return true;
      }
      offers.remove(offer);
      throw e;
    } finally {
      lock.unlock();
      onCancel.remove();
      onClosing.remove();
    }
  }

  /** Closes the stream. Messages not yet taken are withdrawn. */
  void close() {
    lock.lock();
    try {
      closed = true;
      offers.clear();
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  // Caller holds the lock.
  private Message take() {
    Offer offer = offers.pollFirst();
    if (offer == null) {
      return null;
    }
    offer.taken = true;
    changed.signalAll();
    return offer.message;
  }

  private void wakeUp() {
    lock.lock();
    try {
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return "MessageStream{subscription=" + subscription + "}";
  }

  private static final class Offer {
    final Message message;
    boolean taken;

    Offer(Message message) {
      this.message = message;
    }
  }
}
