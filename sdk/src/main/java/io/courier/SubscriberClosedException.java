package io.courier;

/** Thrown when subscribing to a topic while the subscriber is closed or closing. */
public class SubscriberClosedException extends NonRetriableException {

  public SubscriberClosedException() {
    super("subscriber is closed");
  }
}
