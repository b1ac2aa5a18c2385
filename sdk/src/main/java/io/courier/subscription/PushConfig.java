package io.courier.subscription;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Push delivery settings of a subscription. An empty endpoint means the subscription is pulled.
 */
public final class PushConfig {
  private static final PushConfig PULL = new PushConfig("", Collections.emptyMap());

  private final String endpoint;
  private final Map<String, String> attributes;

  private PushConfig(String endpoint, Map<String, String> attributes) {
    this.endpoint = endpoint;
    this.attributes = Collections.unmodifiableMap(new HashMap<>(attributes));
  }

  /** Returns the configuration of a pull subscription. */
  @Nonnull
  public static PushConfig pull() {
    return PULL;
  }

  @Nonnull
  public static PushConfig of(@Nonnull String endpoint) {
    return of(endpoint, Collections.emptyMap());
  }

  @Nonnull
  public static PushConfig of(@Nonnull String endpoint, @Nonnull Map<String, String> attributes) {
    return new PushConfig(
        Objects.requireNonNull(endpoint, "endpoint cannot be null"),
        Objects.requireNonNull(attributes, "attributes cannot be null"));
  }

  @Nonnull
  public String getEndpoint() {
    return endpoint;
  }

  @Nonnull
  public Map<String, String> getAttributes() {
    return attributes;
  }

  public boolean isPush() {
    return !endpoint.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PushConfig)) {
      return false;
    }
    PushConfig that = (PushConfig) o;
    return endpoint.equals(that.endpoint) && attributes.equals(that.attributes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(endpoint, attributes);
  }

  @Override
  public String toString() {
    return "PushConfig{endpoint=" + endpoint + ", attributes=" + attributes + "}";
  }
}
