package io.courier.stream;

import io.courier.Context;
import io.courier.SubscriberConfig;
import io.courier.subscription.SubscriptionHandle;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The background work of one {@code subscribe} call: retry-supervised delivery into a fresh
 * {@link MessageStream}.
 *
 * <p>When the task ends, for whatever reason, the subscription context is canceled, the stream is
 * closed and the {@code onFinished} callback runs, in that order and exactly once.
 */
public final class SubscriptionTask implements Runnable {
  private static final Logger logger = LoggerFactory.getLogger(SubscriptionTask.class);

  private final SubscriptionHandle handle;
  private final Context ctx;
  private final MessageStream output;
  private final DeliveryLoop loop;
  private final RetrySupervisor supervisor;
  private final Runnable onFinished;
  private final AtomicBoolean finished = new AtomicBoolean(false);

  public SubscriptionTask(
      @Nonnull SubscriptionHandle handle,
      @Nonnull SubscriberConfig config,
      @Nonnull Context ctx,
      @Nonnull Context closing,
      @Nonnull Runnable onFinished) {
    this.handle = handle;
    this.ctx = ctx;
    this.output = new MessageStream(handle.getPath());
    this.loop = new DeliveryLoop(handle, config.unmarshaler(), output, closing);
    this.supervisor =
        new RetrySupervisor(
            handle.getPath(), closing, config.retryInitialInterval(), config.retryMaxInterval());
    this.onFinished = onFinished;
  }

  /** Returns the stream this task delivers into. */
  @Nonnull
  public MessageStream getOutput() {
    return output;
  }

  @Override
  public void run() {
    try {
      supervisor.run(ctx, () -> loop.run(ctx));
      logger.info("Receiving messages from {} finished", handle.getPath());
    } catch (RuntimeException e) {
      logger.error("Receiving messages from {} failed permanently", handle.getPath(), e);
    } finally {
      finish();
    }
  }

  /** Finishes a task that will never run, for example because its executor rejected it. */
  public void abort() {
    finish();
  }

  private void finish() {
    if (!finished.compareAndSet(false, true)) {
      return;
    }
    ctx.cancel();
    output.close();
    onFinished.run();
  }
}
