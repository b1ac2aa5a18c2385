package io.courier.common.retry;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.LongSupplier;
import javax.annotation.Nonnull;

/**
 * Exponential backoff policy with randomization.
 *
 * <p>Each call to {@link #nextBackoffMillis()} returns a randomized interval around the current
 * interval and then grows the current interval by the multiplier, capped at the max interval:
 *
 * <pre>
 * randomized = current * (1 + randomizationFactor * random[-1, 1])
 * current    = min(current * multiplier, maxInterval)
 * </pre>
 *
 * <p>With the defaults (500ms initial, 1.5 multiplier, 0.5 randomization, 60s max) successive
 * intervals are roughly 0.5s, 0.75s, 1.1s, 1.7s, ... until they settle around one minute.
 *
 * <p>When {@code maxElapsedMillis} is greater than zero and that much time has passed since the
 * last {@link #reset()}, {@link #STOP} is returned. A {@code maxElapsedMillis} of zero means the
 * policy never expires.
 *
 * <p>Instances are stateful and not thread-safe. Use one per retry loop.
 */
public class ExponentialBackoff {

  /** Returned by {@link #nextBackoffMillis()} once the policy has expired. */
  public static final long STOP = -1;

  public static final long DEFAULT_INITIAL_INTERVAL_MS = 500;
  public static final double DEFAULT_RANDOMIZATION_FACTOR = 0.5;
  public static final double DEFAULT_MULTIPLIER = 1.5;
  public static final long DEFAULT_MAX_INTERVAL_MS = 60_000;
  public static final long DEFAULT_MAX_ELAPSED_MS = 15 * 60_000;

  private final long initialIntervalMs;
  private final double randomizationFactor;
  private final double multiplier;
  private final long maxIntervalMs;
  private final long maxElapsedMs;
  private final LongSupplier clock;
  private final DoubleSupplier random;

  private long currentIntervalMs;
  private long startTimeMs;

  private ExponentialBackoff(Builder builder) {
    this.initialIntervalMs = builder.initialIntervalMs;
    this.randomizationFactor = builder.randomizationFactor;
    this.multiplier = builder.multiplier;
    this.maxIntervalMs = builder.maxIntervalMs;
    this.maxElapsedMs = builder.maxElapsedMs;
    this.clock = builder.clock;
    this.random = builder.random;
    reset();
  }

  /**
   * Returns a new builder with the default settings.
   *
   * @return a new Builder
   */
  @Nonnull
  public static Builder builder() {
    return new Builder();
  }

  /** Restarts the interval sequence and the elapsed-time clock. */
  public void reset() {
    currentIntervalMs = initialIntervalMs;
    startTimeMs = clock.getAsLong();
  }

  /**
   * Returns how long to wait before the next attempt.
   *
   * @return the backoff in milliseconds, or {@link #STOP} if the policy has expired
   */
  public long nextBackoffMillis() {
    if (maxElapsedMs > 0 && getElapsedMillis() > maxElapsedMs) {
      return STOP;
    }
    long next = randomize(currentIntervalMs);
    incrementCurrentInterval();
    return next;
  }

  /** Returns the milliseconds elapsed since the last {@link #reset()}. */
  public long getElapsedMillis() {
    return clock.getAsLong() - startTimeMs;
  }

  long getCurrentIntervalMillis() {
    return currentIntervalMs;
  }

  private long randomize(long interval) {
    double delta = randomizationFactor * interval;
    double min = interval - delta;
    double max = interval + delta;
    // random in [0, 1) spread across [min, max]
    return (long) (min + random.getAsDouble() * (max - min + 1));
  }

  private void incrementCurrentInterval() {
    if (currentIntervalMs >= maxIntervalMs / multiplier) {
      currentIntervalMs = maxIntervalMs;
    } else {
      currentIntervalMs = (long) (currentIntervalMs * multiplier);
    }
  }

  /** Builder for {@link ExponentialBackoff}. */
  public static final class Builder {
    private long initialIntervalMs = DEFAULT_INITIAL_INTERVAL_MS;
    private double randomizationFactor = DEFAULT_RANDOMIZATION_FACTOR;
    private double multiplier = DEFAULT_MULTIPLIER;
    private long maxIntervalMs = DEFAULT_MAX_INTERVAL_MS;
    private long maxElapsedMs = DEFAULT_MAX_ELAPSED_MS;
    private LongSupplier clock = System::currentTimeMillis;
    private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();

    private Builder() {}

    public Builder initialIntervalMillis(long initialIntervalMs) {
      if (initialIntervalMs <= 0) {
        throw new IllegalArgumentException("initialIntervalMs must be positive");
      }
      this.initialIntervalMs = initialIntervalMs;
      return this;
    }

    public Builder randomizationFactor(double randomizationFactor) {
      if (randomizationFactor < 0 || randomizationFactor >= 1) {
        throw new IllegalArgumentException("randomizationFactor must be in [0, 1)");
      }
      this.randomizationFactor = randomizationFactor;
      return this;
    }

    public Builder multiplier(double multiplier) {
      if (multiplier < 1) {
        throw new IllegalArgumentException("multiplier must be at least 1");
      }
      this.multiplier = multiplier;
      return this;
    }

    public Builder maxIntervalMillis(long maxIntervalMs) {
      if (maxIntervalMs <= 0) {
        throw new IllegalArgumentException("maxIntervalMs must be positive");
      }
      this.maxIntervalMs = maxIntervalMs;
      return this;
    }

    /**
     * Sets the total time after which the policy returns {@link #STOP}.
     *
     * @param maxElapsedMs the limit in milliseconds, or 0 to retry forever
     * @return this builder for method chaining
     */
    public Builder maxElapsedMillis(long maxElapsedMs) {
      if (maxElapsedMs < 0) {
        throw new IllegalArgumentException("maxElapsedMs cannot be negative");
      }
      this.maxElapsedMs = maxElapsedMs;
      return this;
    }

    Builder clock(@Nonnull LongSupplier clock) {
      this.clock = clock;
      return this;
    }

    Builder random(@Nonnull DoubleSupplier random) {
      this.random = random;
      return this;
    }

    @Nonnull
    public ExponentialBackoff build() {
      if (initialIntervalMs > maxIntervalMs) {
        throw new IllegalArgumentException("initialIntervalMs cannot exceed maxIntervalMs");
      }
      return new ExponentialBackoff(this);
    }
  }
}
