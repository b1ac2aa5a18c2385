package io.courier;

/**
 * Signals that a create call lost a race: the topic or subscription was created by someone else.
 *
 * <p>The subscription resolver treats this as success and re-fetches the resource.
 */
public class ResourceAlreadyExistsException extends CourierException {

  public ResourceAlreadyExistsException(String resource, Throwable cause) {
    super("resource already exists: " + resource, cause);
  }
}
