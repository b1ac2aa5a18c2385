package io.courier;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

/** Tests for the Context cancellation tree. */
public class ContextTest {

  @Test
  public void testCancelPropagatesToDescendants() {
    Context root = Context.background();
    Context child = root.withCancel();
    Context grandchild = child.withCancel();

    root.cancel();

    assertTrue(child.isDone());
    assertTrue(grandchild.isDone());
  }

  @Test
  public void testChildCancelDoesNotAffectParent() {
    Context root = Context.background();
    Context child = root.withCancel();
    Context sibling = root.withCancel();

    child.cancel();

    assertFalse(root.isDone());
    assertFalse(sibling.isDone());
  }

  @Test
  public void testCanceledChildDetachesFromParent() {
    Context root = Context.background();
    for (int i = 0; i < 100; i++) {
      root.withCancel().cancel();
    }

    assertEquals(0, root.listenerCount());
  }

  @Test
  public void testCallbacksRunOnce() {
    Context ctx = Context.background();
    AtomicInteger calls = new AtomicInteger();
    ctx.onDone(calls::incrementAndGet);

    ctx.cancel();
    ctx.cancel();

    assertEquals(1, calls.get());
  }

  @Test
  public void testOnDoneAfterCancelRunsImmediately() {
    Context ctx = Context.background();
    ctx.cancel();
    AtomicInteger calls = new AtomicInteger();

    ctx.onDone(calls::incrementAndGet);

    assertEquals(1, calls.get());
  }

  @Test
  public void testRemovedCallbackDoesNotRun() {
    Context ctx = Context.background();
    AtomicInteger calls = new AtomicInteger();
    Context.Registration registration = ctx.onDone(calls::incrementAndGet);

    registration.remove();
    ctx.cancel();

    assertEquals(0, calls.get());
  }

  @Test
  public void testFailingCallbackDoesNotStopOthers() {
    Context ctx = Context.background();
    AtomicInteger calls = new AtomicInteger();
    ctx.onDone(
        () -> {
          throw new IllegalStateException("boom");
        });
    ctx.onDone(calls::incrementAndGet);

    ctx.cancel();

    assertEquals(1, calls.get());
  }

  @Test
  public void testChildOfCanceledParentIsDone() {
    Context root = Context.background();
    root.cancel();

    Context child = root.withCancel();

    assertTrue(child.isDone());
    assertEquals(0, root.listenerCount());
  }

  @Test
  public void testWithTimeoutCancelsAfterTimeout() throws Exception {
    Context root = Context.background();
    Context timed = root.withTimeout(Duration.ofMillis(50));

    assertTrue(timed.await(5, TimeUnit.SECONDS));
    assertFalse(root.isDone());
  }

  @Test
  public void testAwaitReturnsFalseOnTimeout() throws Exception {
    Context ctx = Context.background();

    assertFalse(ctx.await(20, TimeUnit.MILLISECONDS));
  }
}
