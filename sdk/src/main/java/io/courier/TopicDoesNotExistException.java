package io.courier;

/**
 * Thrown when a subscription has to be created for a missing topic and the subscriber is
 * configured not to create topics.
 *
 * @see SubscriberConfig#doNotCreateTopicIfMissing()
 */
public class TopicDoesNotExistException extends NonRetriableException {
  private final String topic;

  public TopicDoesNotExistException(String topic) {
    super("topic does not exist: " + topic);
    this.topic = topic;
  }

  /** Returns the fully qualified name of the missing topic. */
  public String getTopic() {
    return topic;
  }
}
