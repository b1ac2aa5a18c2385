package io.courier.stream;

import io.courier.Context;
import io.courier.common.retry.ExponentialBackoff;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a streaming attempt again and again until it returns normally.
 *
 * <p>Failures are retried with unbounded exponential backoff. Once the subscriber is closing a
 * failure is final and rethrown. Waits between attempts end early when the subscription context
 * is done.
 */
public class RetrySupervisor {
  private static final Logger logger = LoggerFactory.getLogger(RetrySupervisor.class);

  private final String subscription;
  private final Context closing;
  private final ExponentialBackoff backoff;

  public RetrySupervisor(
      @Nonnull String subscription,
      @Nonnull Context closing,
      @Nonnull Duration initialInterval,
      @Nonnull Duration maxInterval) {
    this(
        subscription,
        closing,
        ExponentialBackoff.builder()
            .initialIntervalMillis(initialInterval.toMillis())
            .maxIntervalMillis(maxInterval.toMillis())
            .maxElapsedMillis(0)
            .build());
  }

  RetrySupervisor(
      @Nonnull String subscription, @Nonnull Context closing, @Nonnull ExponentialBackoff backoff) {
    this.subscription = subscription;
    this.closing = closing;
    this.backoff = backoff;
  }

  /**
   * Runs {@code attempt} until it returns normally or {@code ctx} is done.
   *
   * @param ctx the subscription context
   * @param attempt one streaming attempt
   * @throws RuntimeException the last failure, if the subscriber started closing
   */
  public void run(@Nonnull Context ctx, @Nonnull Runnable attempt) {
    int failures = 0;
    while (true) {
      try {
        attempt.run();
        return;
      } catch (RuntimeException e) {
        failures++;
        if (closing.isDone()) {
          throw e;
        }
        if (ctx.isDone()) {
          logger.debug("Subscription {} stopped after a receive failure", subscription, e);
          return;
        }
        long delay = backoff.nextBackoffMillis();
        if (delay == ExponentialBackoff.STOP) {
          throw e;
        }
        logger.error(
            "Receiving messages from {} failed (attempt {}), retrying in {} ms",
            subscription,
            failures,
            delay,
            e);
        if (await(ctx, delay, e)) {
          if (closing.isDone()) {
            throw e;
          }
          return;
        }
      }
    }
  }

  private boolean await(Context ctx, long delayMillis, RuntimeException failure) {
    try {
      return ctx.await(delayMillis, TimeUnit.MILLISECONDS);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      failure.addSuppressed(ie);
      throw failure;
    }
  }
}
