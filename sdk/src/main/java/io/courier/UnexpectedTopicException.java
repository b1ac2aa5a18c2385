package io.courier;

/**
 * Thrown when the subscription generated for a topic already exists, but is bound to another
 * topic than the one requested.
 *
 * <p>Nothing is deleted or modified when this happens. Choose a different {@link
 * io.courier.subscription.SubscriptionNameFn} or remove the conflicting subscription.
 */
public class UnexpectedTopicException extends NonRetriableException {
  private final String subscription;
  private final String actualTopic;
  private final String expectedTopic;

  public UnexpectedTopicException(String subscription, String actualTopic, String expectedTopic) {
    super(
        "requested subscription already exists, but for other topic than expected: subscription "
            + subscription
            + "; topic of existing sub: "
            + actualTopic
            + "; expecting: "
            + expectedTopic);
    this.subscription = subscription;
    this.actualTopic = actualTopic;
    this.expectedTopic = expectedTopic;
  }

  public String getSubscription() {
    return subscription;
  }

  public String getActualTopic() {
    return actualTopic;
  }

  public String getExpectedTopic() {
    return expectedTopic;
  }
}
