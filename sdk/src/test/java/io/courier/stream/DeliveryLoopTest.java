package io.courier.stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.google.protobuf.ByteString;
import io.courier.Context;
import io.courier.CourierException;
import io.courier.SubscriberConfig;
import io.courier.client.ConnectionRegistry;
import io.courier.client.FakeConnectionFactory;
import io.courier.client.FakePubSubService;
import io.courier.message.AckReply;
import io.courier.message.DefaultMarshalerUnmarshaler;
import io.courier.message.Envelope;
import io.courier.message.Message;
import io.courier.message.Unmarshaler;
import io.courier.subscription.SubscriptionHandle;
import io.courier.subscription.SubscriptionResolver;
import java.util.Collections;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Tests for per-envelope outcomes of the DeliveryLoop. */
@ExtendWith(MockitoExtension.class)
public class DeliveryLoopTest {

  @Mock private AckReply reply;

  private FakePubSubService service;
  private SubscriptionHandle handle;
  private MessageStream output;
  private Context ctx;
  private Context closing;

  @BeforeEach
  public void setUp() {
    service = new FakePubSubService();
    SubscriberConfig config = SubscriberConfig.builder().setProjectId("test-project").build();
    SubscriptionResolver resolver =
        new SubscriptionResolver(
            config, new ConnectionRegistry(new FakeConnectionFactory(service)));
    handle = resolver.resolve(Context.background(), "orders", "orders");
    output = new MessageStream(handle.getPath());
    closing = Context.background().withCancel();
    ctx = closing.withCancel();
  }

  private DeliveryLoop loop(Unmarshaler unmarshaler) {
    return new DeliveryLoop(handle, unmarshaler, output, closing);
  }

  private Envelope envelope(String messageId, AckReply reply) {
    return Envelope.builder()
        .messageId(messageId)
        .data(ByteString.copyFromUtf8("payload"))
        .reply(reply)
        .build();
  }

  private CompletableFuture<Void> deliverAsync(DeliveryLoop loop, Envelope envelope) {
    return CompletableFuture.runAsync(() -> loop.deliver(ctx, envelope));
  }

  @Test
  public void testAckedMessageIsAckedUpstream() throws Exception {
    CompletableFuture<Void> delivery =
        deliverAsync(loop(new DefaultMarshalerUnmarshaler()), envelope("m1", reply));

    Message message = output.poll(5, TimeUnit.SECONDS);
    assertNotNull(message);
    message.ack();
    delivery.get(5, TimeUnit.SECONDS);

    verify(reply).ack();
    verify(reply, never()).nack();
    assertTrue(message.getContext().isDone());
  }

  @Test
  public void testNackedMessageIsNackedUpstream() throws Exception {
    CompletableFuture<Void> delivery =
        deliverAsync(loop(new DefaultMarshalerUnmarshaler()), envelope("m1", reply));

    Message message = output.poll(5, TimeUnit.SECONDS);
    message.nack();
    delivery.get(5, TimeUnit.SECONDS);

    verify(reply).nack();
    verify(reply, never()).ack();
    assertFalse(message.ack());
  }

  @Test
  public void testUndecodableEnvelopeIsNackedAndLoopContinues() throws Exception {
    AckReply secondReply = mock(AckReply.class);
    Unmarshaler unmarshaler =
        envelope -> {
          if (envelope.getMessageId().equals("bad")) {
            throw new CourierException("cannot decode");
          }
          return new DefaultMarshalerUnmarshaler().unmarshal(envelope);
        };
    DeliveryLoop loop = loop(unmarshaler);

    loop.deliver(ctx, envelope("bad", reply));
    CompletableFuture<Void> delivery = deliverAsync(loop, envelope("good", secondReply));
    Message message = output.poll(5, TimeUnit.SECONDS);
    message.ack();
    delivery.get(5, TimeUnit.SECONDS);

    verify(reply).nack();
    verify(reply, never()).ack();
    verify(secondReply).ack();
  }

  @Test
  public void testCanceledMessageContextNacksAndLoopContinues() throws Exception {
    AckReply secondReply = mock(AckReply.class);
    DeliveryLoop loop = loop(new DefaultMarshalerUnmarshaler());

    CompletableFuture<Void> first = deliverAsync(loop, envelope("m1", reply));
    Message ignored = output.poll(5, TimeUnit.SECONDS);
    ignored.getContext().cancel();
    first.get(5, TimeUnit.SECONDS);

    CompletableFuture<Void> second = deliverAsync(loop, envelope("m2", secondReply));
    output.poll(5, TimeUnit.SECONDS).ack();
    second.get(5, TimeUnit.SECONDS);

    verify(reply).nack();
    verify(reply, never()).ack();
    verify(secondReply).ack();
    assertFalse(ctx.isDone());
  }

  @Test
  public void testShutdownNacksMessageAwaitingOutcome() throws Exception {
    CompletableFuture<Void> delivery =
        deliverAsync(loop(new DefaultMarshalerUnmarshaler()), envelope("m1", reply));
    Message message = output.poll(5, TimeUnit.SECONDS);

    closing.cancel();
    delivery.get(5, TimeUnit.SECONDS);

    verify(reply).nack();
    verify(reply, never()).ack();
    assertTrue(message.isNacked());
  }

  @Test
  public void testMessageNotTakenBeforeShutdownIsNacked() throws Exception {
    closing.cancel();

    loop(new DefaultMarshalerUnmarshaler()).deliver(ctx, envelope("m1", reply));

    verify(reply).nack();
    verify(reply, never()).ack();
    assertNull(output.poll(10, TimeUnit.MILLISECONDS));
  }

  @Test
  public void testAckGivenBeforeCancellationWins() throws Exception {
    CompletableFuture<Void> delivery =
        deliverAsync(loop(new DefaultMarshalerUnmarshaler()), envelope("m1", reply));
    Message message = output.poll(5, TimeUnit.SECONDS);

    message.ack();
    closing.cancel();
    delivery.get(5, TimeUnit.SECONDS);

    verify(reply).ack();
    verify(reply, never()).nack();
  }

  @Test
  public void testRunPropagatesReceiveFailure() {
    service.failNextReceives(1);

    assertThrows(
        CourierException.class, () -> loop(new DefaultMarshalerUnmarshaler()).run(ctx));
  }

  @Test
  public void testRunReturnsWhenContextDone() throws Exception {
    CompletableFuture<Void> run =
        CompletableFuture.runAsync(() -> loop(new DefaultMarshalerUnmarshaler()).run(ctx));

    ctx.cancel();

    run.get(5, TimeUnit.SECONDS);
  }

  @Test
  public void testPendingMessageIsNackedWhenStreamBreaks() throws Exception {
    String messageId = service.publish(handle.getPath(), "payload", Collections.emptyMap());
    CompletableFuture<Void> run =
        CompletableFuture.runAsync(() -> loop(new DefaultMarshalerUnmarshaler()).run(ctx));
    Message message = output.poll(5, TimeUnit.SECONDS);
    assertNotNull(message);

    service.breakStream();

    ExecutionException error =
        assertThrows(ExecutionException.class, () -> run.get(5, TimeUnit.SECONDS));
    assertTrue(error.getCause() instanceof CourierException, String.valueOf(error));
    assertTrue(message.getContext().await(5, TimeUnit.SECONDS));
    long deadline = System.currentTimeMillis() + 5000;
    while (service.outcomes(messageId).isEmpty() && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }
    assertEquals(Collections.singletonList("nack"), service.outcomes(messageId));
    assertFalse(ctx.isDone());
  }
}
