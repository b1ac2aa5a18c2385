package io.courier.message;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.google.pubsub.v1.PubsubMessage;
import io.courier.CourierException;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

public class OrderingCodecTest {

  @Test
  public void testOrderingKeyIsSetAndHandedBack() {
    OrderingMarshaler marshaler =
        new OrderingMarshaler((topic, message) -> topic + "/" + message.getMetadata().get("user"));
    AtomicReference<String> seenKey = new AtomicReference<>();
    OrderingUnmarshaler unmarshaler =
        new OrderingUnmarshaler((key, message) -> seenKey.set(key));
    Message message = new Message("uuid-1", new byte[] {1});
    message.getMetadata().put("user", "42");

    PubsubMessage encoded = marshaler.marshal("orders", message);
    Message decoded =
        unmarshaler.unmarshal(Envelope.fromPubsubMessage(encoded, 0, mock(AckReply.class)));

    assertEquals("orders/42", encoded.getOrderingKey());
    assertEquals("orders/42", seenKey.get());
    assertTrue(decoded.sameContentAs(message));
  }

  @Test
  public void testGeneratorFailureIsWrapped() {
    IllegalStateException cause = new IllegalStateException("no key");
    OrderingMarshaler marshaler =
        new OrderingMarshaler(
            (topic, message) -> {
              throw cause;
            });

    Message message = new Message("u", new byte[0]);

    CourierException e =
        assertThrows(CourierException.class, () -> marshaler.marshal("orders", message));
    assertSame(cause, e.getCause());
  }

  @Test
  public void testHandlerFailureIsWrapped() {
    OrderingUnmarshaler unmarshaler =
        new OrderingUnmarshaler(
            (key, message) -> {
              throw new IllegalArgumentException("bad key");
            });
    PubsubMessage encoded =
        new DefaultMarshalerUnmarshaler().marshal("orders", new Message("u", new byte[0]));

    assertThrows(
        CourierException.class,
        () -> unmarshaler.unmarshal(Envelope.fromPubsubMessage(encoded, 0, mock(AckReply.class))));
  }
}
