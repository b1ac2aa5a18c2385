package io.courier.common.concurrent;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nonnull;

/** Thread factory producing daemon threads named {@code <prefix>-<n>}. */
public final class NamedThreadFactory implements ThreadFactory {
  private final String prefix;
  private final AtomicInteger counter = new AtomicInteger(0);

  public NamedThreadFactory(@Nonnull String prefix) {
    this.prefix = prefix;
  }

  @Override
  public Thread newThread(@Nonnull Runnable r) {
    Thread t = new Thread(r);
    t.setDaemon(true);
    t.setName(prefix + "-" + counter.getAndIncrement());
    return t;
  }
}
