package io.courier.client;

import io.courier.CourierException;
import io.courier.SubscriberClosedException;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Every connection opened by one subscriber. Connections are added as subscriptions are resolved
 * and only released all at once by {@link #closeAll()}. After that the registry stays closed: a
 * connection that finishes opening later is closed right away.
 */
public class ConnectionRegistry {
  private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

  private final ConnectionFactory factory;
  private final List<ResourceClient> connections = new ArrayList<>();
  private boolean closed = false;

  public ConnectionRegistry(@Nonnull ConnectionFactory factory) {
    this.factory = factory;
  }

  /**
   * Opens a new connection and records it.
   *
   * @return the connection
   * @throws SubscriberClosedException if {@link #closeAll()} has run
   * @throws CourierException if the connection cannot be established
   */
  @Nonnull
  public ResourceClient open() {
    synchronized (connections) {
      if (closed) {
        throw new SubscriberClosedException();
      }
    }
    ResourceClient client = factory.connect();
    synchronized (connections) {
      if (!closed) {
        connections.add(client);
        logger.debug("Opened connection #{}", connections.size());
        return client;
      }
    }

    logger.debug("Connection opened after the registry was closed, closing it");
    SubscriberClosedException error = new SubscriberClosedException();
    try {
      client.close();
    } catch (Exception e) {
      logger.warn("Failed to close connection", e);
      error.addSuppressed(e);
    }
    throw error;
  }

  /** Returns the number of connections opened and not yet closed. */
  public int size() {
    synchronized (connections) {
      return connections.size();
    }
  }

  /**
   * Closes every recorded connection, continuing past failures, and closes the registry.
   *
   * @return the failures, empty if every connection closed cleanly
   */
  @Nonnull
  public List<Exception> closeAll() {
    List<ResourceClient> toClose;
    synchronized (connections) {
      closed = true;
      toClose = new ArrayList<>(connections);
      connections.clear();
    }
    List<Exception> failures = new ArrayList<>();
    for (ResourceClient client : toClose) {
      try {
        client.close();
      } catch (Exception e) {
        logger.warn("Failed to close connection", e);
        failures.add(e);
      }
    }
    return failures;
  }
}
