package io.courier.subscription;

import io.courier.NonRetriableException;
import javax.annotation.Nonnull;

/**
 * Client-side tuning of the streaming receive. These settings are never sent to the service.
 *
 * <p>Flow control bounds how many messages are handed to the application at once: the transport
 * stops pulling while {@code maxOutstandingMessages} deliveries (or {@code maxOutstandingBytes}
 * bytes) await an ack or nack.
 *
 * <p>Default values:
 *
 * <ul>
 *   <li>maxOutstandingMessages: 1000
 *   <li>maxOutstandingBytes: 1000000000 (1GB)
 *   <li>parallelPullCount: 1
 *   <li>executorThreadCount: 5
 * </ul>
 */
public final class ReceiveSettings {
  public static final long DEFAULT_MAX_OUTSTANDING_MESSAGES = 1000;
  public static final long DEFAULT_MAX_OUTSTANDING_BYTES = 1_000_000_000L;
  public static final int DEFAULT_PARALLEL_PULL_COUNT = 1;
  public static final int DEFAULT_EXECUTOR_THREAD_COUNT = 5;

  private final long maxOutstandingMessages;
  private final long maxOutstandingBytes;
  private final int parallelPullCount;
  private final int executorThreadCount;

  private ReceiveSettings(Builder builder) {
    this.maxOutstandingMessages = builder.maxOutstandingMessages;
    this.maxOutstandingBytes = builder.maxOutstandingBytes;
    this.parallelPullCount = builder.parallelPullCount;
    this.executorThreadCount = builder.executorThreadCount;
  }

  @Nonnull
  public static Builder builder() {
    return new Builder();
  }

  @Nonnull
  public static ReceiveSettings defaults() {
    return builder().build();
  }

  @Nonnull
  public Builder toBuilder() {
    return new Builder(this);
  }

  public long getMaxOutstandingMessages() {
    return maxOutstandingMessages;
  }

  public long getMaxOutstandingBytes() {
    return maxOutstandingBytes;
  }

  public int getParallelPullCount() {
    return parallelPullCount;
  }

  public int getExecutorThreadCount() {
    return executorThreadCount;
  }

  @Override
  public String toString() {
    return "ReceiveSettings{maxOutstandingMessages="
        + maxOutstandingMessages
        + ", maxOutstandingBytes="
        + maxOutstandingBytes
        + ", parallelPullCount="
        + parallelPullCount
        + ", executorThreadCount="
        + executorThreadCount
        + "}";
  }

  /** Builder for {@link ReceiveSettings}. */
  public static final class Builder {
    private long maxOutstandingMessages = DEFAULT_MAX_OUTSTANDING_MESSAGES;
    private long maxOutstandingBytes = DEFAULT_MAX_OUTSTANDING_BYTES;
    private int parallelPullCount = DEFAULT_PARALLEL_PULL_COUNT;
    private int executorThreadCount = DEFAULT_EXECUTOR_THREAD_COUNT;

    private Builder() {}

    private Builder(ReceiveSettings settings) {
      this.maxOutstandingMessages = settings.maxOutstandingMessages;
      this.maxOutstandingBytes = settings.maxOutstandingBytes;
      this.parallelPullCount = settings.parallelPullCount;
      this.executorThreadCount = settings.executorThreadCount;
    }

    public Builder maxOutstandingMessages(long maxOutstandingMessages) {
      this.maxOutstandingMessages = maxOutstandingMessages;
      return this;
    }

    public Builder maxOutstandingBytes(long maxOutstandingBytes) {
      this.maxOutstandingBytes = maxOutstandingBytes;
      return this;
    }

    public Builder parallelPullCount(int parallelPullCount) {
      this.parallelPullCount = parallelPullCount;
      return this;
    }

    public Builder executorThreadCount(int executorThreadCount) {
      this.executorThreadCount = executorThreadCount;
      return this;
    }

    /**
     * Builds the settings.
     *
     * @return the settings
     * @throws NonRetriableException if a limit or count is not positive
     */
    @Nonnull
    public ReceiveSettings build() {
      if (maxOutstandingMessages <= 0) {
        throw new NonRetriableException("maxOutstandingMessages must be positive");
      }
      if (maxOutstandingBytes <= 0) {
        throw new NonRetriableException("maxOutstandingBytes must be positive");
      }
      if (parallelPullCount <= 0) {
        throw new NonRetriableException("parallelPullCount must be positive");
      }
      if (executorThreadCount <= 0) {
        throw new NonRetriableException("executorThreadCount must be positive");
      }
      return new ReceiveSettings(this);
    }
  }
}
