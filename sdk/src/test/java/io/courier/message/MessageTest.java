package io.courier.message;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

public class MessageTest {

  private static Message message() {
    return new Message("uuid-1", "payload".getBytes(StandardCharsets.UTF_8));
  }

  @Test
  public void testFirstDecisionIsFinal() {
    Message acked = message();
    assertTrue(acked.ack());
    assertTrue(acked.ack());
    assertFalse(acked.nack());
    assertTrue(acked.isAcked());
    assertFalse(acked.isNacked());

    Message nacked = message();
    assertTrue(nacked.nack());
    assertTrue(nacked.nack());
    assertFalse(nacked.ack());
    assertTrue(nacked.isNacked());
  }

  @Test
  public void testOutcomeStagesComplete() {
    Message message = message();
    AtomicBoolean ackSeen = new AtomicBoolean();
    AtomicBoolean nackSeen = new AtomicBoolean();
    message.acked().thenRun(() -> ackSeen.set(true));
    message.nacked().thenRun(() -> nackSeen.set(true));

    message.ack();
    message.nack();

    assertTrue(ackSeen.get());
    assertFalse(nackSeen.get());
  }

  @Test
  public void testSameContentIgnoresOutcome() {
    Message first = message();
    Message second = message();
    first.getMetadata().put("k", "v");
    second.getMetadata().put("k", "v");
    first.ack();

    assertTrue(first.sameContentAs(second));

    second.getMetadata().put("k", "other");
    assertFalse(first.sameContentAs(second));
  }

  @Test
  public void testDefaultContextIsNotDone() {
    assertFalse(message().getContext().isDone());
  }
}
