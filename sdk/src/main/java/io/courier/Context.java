package io.courier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A cancellation scope shared between the SDK and the application.
 *
 * <p>Contexts form a tree. Canceling a context cancels all of its descendants; canceling a child
 * never affects its parent. Cancellation is permanent and idempotent.
 *
 * <pre>{@code
 * Context ctx = Context.background().withCancel();
 * MessageStream messages = subscriber.subscribe(ctx, "orders");
 * ...
 * ctx.cancel(); // stops this subscription only
 * }</pre>
 *
 * <p>Every {@link io.courier.message.Message} delivered by the SDK carries its own child context,
 * which is canceled when the subscription stops or the subscriber closes.
 *
 * <p>A child removes itself from its parent when it is canceled, so short-lived children (one per
 * message) can be derived from a long-lived parent without growing it.
 */
public final class Context {
  private static final Logger logger = LoggerFactory.getLogger(Context.class);

  @Nullable private final Context parent;
  private final Object lock = new Object();
  private final Set<Listener> listeners = new LinkedHashSet<>();
  private boolean done;
  @Nullable private Registration parentRegistration;

  private Context(@Nullable Context parent) {
    this.parent = parent;
  }

  /**
   * Returns a new root context. It is only ever done if {@link #cancel()} is called on it.
   *
   * @return a new root context
   */
  @Nonnull
  public static Context background() {
    return new Context(null);
  }

  /**
   * Derives a child context that is canceled when this one is.
   *
   * @return a new child context
   */
  @Nonnull
  public Context withCancel() {
    Context child = new Context(this);
    Registration registration = onDone(child::cancel);
    synchronized (child.lock) {
      if (!child.done) {
        child.parentRegistration = registration;
        return child;
      }
    }
    registration.remove();
    return child;
  }

  /**
   * Derives a child context that is canceled after {@code timeout}, or earlier if this one is.
   *
   * @param timeout time until the child is canceled
   * @return a new child context
   */
  @Nonnull
  public Context withTimeout(@Nonnull Duration timeout) {
    Objects.requireNonNull(timeout, "timeout cannot be null");
    Context child = withCancel();
    CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS)
        .execute(child::cancel);
    return child;
  }

  /** Cancels this context and all of its descendants. Subsequent calls have no effect. */
  public void cancel() {
    List<Listener> toRun;
    Registration fromParent;
    synchronized (lock) {
      if (done) {
        return;
      }
      done = true;
      toRun = new ArrayList<>(listeners);
      listeners.clear();
      fromParent = parentRegistration;
      parentRegistration = null;
      lock.notifyAll();
    }
    if (fromParent != null) {
      fromParent.remove();
    }
    for (Listener listener : toRun) {
      listener.run();
    }
  }

  /** Returns true once this context has been canceled. */
  public boolean isDone() {
    synchronized (lock) {
      return done;
    }
  }

  /**
   * Blocks until this context is done or the timeout elapses.
   *
   * @param timeout maximum time to wait
   * @param unit unit of {@code timeout}
   * @return true if the context is done
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean await(long timeout, @Nonnull TimeUnit unit) throws InterruptedException {
    long deadline = System.nanoTime() + unit.toNanos(timeout);
    synchronized (lock) {
      while (!done) {
        long remainingNanos = deadline - System.nanoTime();
        if (remainingNanos <= 0) {
          return false;
        }
        TimeUnit.NANOSECONDS.timedWait(lock, remainingNanos);
      }
      return true;
    }
  }

  /**
   * Registers a callback to run once this context is done.
   *
   * <p>If the context is already done the callback runs immediately on the calling thread.
   * Otherwise it runs on the thread that calls {@link #cancel()}. Callbacks must not block.
   *
   * @param callback the callback to run
   * @return a registration that detaches the callback when it is no longer needed
   */
  @Nonnull
  public Registration onDone(@Nonnull Runnable callback) {
    Objects.requireNonNull(callback, "callback cannot be null");
    Listener listener = new Listener(callback);
    synchronized (lock) {
      if (!done) {
        listeners.add(listener);
        return () -> {
          synchronized (lock) {
            listeners.remove(listener);
          }
        };
      }
    }
    listener.run();
    return () -> {};
  }

  /** Returns the parent context, or null for a root context. */
  @Nullable
  Context getParent() {
    return parent;
  }

  int listenerCount() {
    synchronized (lock) {
      return listeners.size();
    }
  }

  /** Handle returned by {@link #onDone(Runnable)}. */
  @FunctionalInterface
  public interface Registration {
    /** Detaches the callback. Has no effect if it already ran. */
    void remove();
  }

  // Identity-compared wrapper so the same Runnable can be registered twice.
  private static final class Listener {
    private final Runnable callback;

    Listener(Runnable callback) {
      this.callback = callback;
    }

    void run() {
      try {
        callback.run();
      } catch (RuntimeException e) {
        logger.error("Context callback failed", e);
      }
    }
  }
}
