package io.courier.client;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import io.courier.CourierException;
import io.courier.SubscriberClosedException;
import java.util.List;
import org.junit.jupiter.api.Test;

public class ConnectionRegistryTest {

  @Test
  public void testCloseAllContinuesPastFailures() {
    ResourceClient first = mock(ResourceClient.class);
    ResourceClient second = mock(ResourceClient.class);
    ResourceClient third = mock(ResourceClient.class);
    CourierException failure = new CourierException("connection reset");
    doThrow(failure).when(second).close();
    ConnectionFactory factory = mock(ConnectionFactory.class);
    when(factory.connect()).thenReturn(first, second, third);
    ConnectionRegistry registry = new ConnectionRegistry(factory);

    registry.open();
    registry.open();
    registry.open();
    List<Exception> failures = registry.closeAll();

    assertEquals(1, failures.size());
    assertSame(failure, failures.get(0));
    verify(first).close();
    verify(third).close();
    assertEquals(0, registry.size());
    assertTrue(registry.closeAll().isEmpty());
  }

  @Test
  public void testFailedConnectIsNotRecorded() {
    ConnectionFactory factory = mock(ConnectionFactory.class);
    when(factory.connect()).thenThrow(new CourierException("unreachable"));
    ConnectionRegistry registry = new ConnectionRegistry(factory);

    assertThrows(CourierException.class, registry::open);
    assertEquals(0, registry.size());
  }

  @Test
  public void testConnectionOpenedAfterCloseAllIsClosed() {
    ResourceClient late = mock(ResourceClient.class);
    ConnectionFactory factory = mock(ConnectionFactory.class);
    ConnectionRegistry registry = new ConnectionRegistry(factory);
    when(factory.connect())
        .thenAnswer(
            invocation -> {
              registry.closeAll();
              return late;
            });

    assertThrows(SubscriberClosedException.class, registry::open);

    verify(late).close();
    assertEquals(0, registry.size());
  }

  @Test
  public void testOpenAfterCloseAllDoesNotConnect() {
    ConnectionFactory factory = mock(ConnectionFactory.class);
    ConnectionRegistry registry = new ConnectionRegistry(factory);
    registry.closeAll();

    assertThrows(SubscriberClosedException.class, registry::open);
    verify(factory, never()).connect();
  }
}
