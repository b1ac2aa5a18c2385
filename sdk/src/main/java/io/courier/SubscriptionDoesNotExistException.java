package io.courier;

/**
 * Thrown when a subscription is missing and the subscriber is configured not to create it.
 *
 * @see SubscriberConfig#doNotCreateSubscriptionIfMissing()
 */
public class SubscriptionDoesNotExistException extends NonRetriableException {
  private final String subscription;

  public SubscriptionDoesNotExistException(String subscription) {
    super("subscription does not exist: " + subscription);
    this.subscription = subscription;
  }

  /** Returns the fully qualified name of the missing subscription. */
  public String getSubscription() {
    return subscription;
  }
}
