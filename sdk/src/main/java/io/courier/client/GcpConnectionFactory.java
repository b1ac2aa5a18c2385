package io.courier.client;

import com.google.api.gax.core.CredentialsProvider;
import com.google.api.gax.core.NoCredentialsProvider;
import com.google.api.gax.grpc.GrpcTransportChannel;
import com.google.api.gax.rpc.FixedTransportChannelProvider;
import com.google.api.gax.rpc.TransportChannelProvider;
import com.google.cloud.pubsub.v1.SubscriptionAdminClient;
import com.google.cloud.pubsub.v1.SubscriptionAdminSettings;
import com.google.cloud.pubsub.v1.TopicAdminClient;
import com.google.cloud.pubsub.v1.TopicAdminSettings;
import io.courier.CourierException;
import io.courier.tls.InsecureTlsConfig;
import io.courier.tls.SecureTlsConfig;
import io.courier.tls.TlsConfig;
import io.grpc.ChannelCredentials;
import io.grpc.Grpc;
import io.grpc.ManagedChannel;
import java.io.IOException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens {@link GcpResourceClient} connections.
 *
 * <p>Without an explicit endpoint the factory connects to the production service with the client
 * library defaults. When an endpoint is set, or the {@value #EMULATOR_HOST_ENV} environment
 * variable is present, it builds its own gRPC channel to that endpoint. The emulator is reached in
 * plaintext without credentials.
 *
 * <pre>{@code
 * ConnectionFactory factory =
 *     GcpConnectionFactory.builder()
 *         .endpoint("localhost:8085")
 *         .tlsConfig(new InsecureTlsConfig())
 *         .build();
 * }</pre>
 */
public class GcpConnectionFactory implements ConnectionFactory {
  private static final Logger logger = LoggerFactory.getLogger(GcpConnectionFactory.class);

  public static final String EMULATOR_HOST_ENV = "PUBSUB_EMULATOR_HOST";

  // gRPC channel configuration constants
  private static final int DEFAULT_TLS_PORT = 443;
  private static final long KEEP_ALIVE_TIME_SECONDS = 30;
  private static final long KEEP_ALIVE_TIMEOUT_SECONDS = 10;

  // Protocol prefixes
  private static final String HTTPS_PREFIX = "https://";
  private static final String HTTP_PREFIX = "http://";

  @Nullable private final String endpoint;
  private final TlsConfig tlsConfig;
  @Nullable private final CredentialsProvider credentialsProvider;

  private GcpConnectionFactory(Builder builder) {
    this.endpoint = builder.endpoint;
    this.tlsConfig = builder.tlsConfig;
    this.credentialsProvider = builder.credentialsProvider;
  }

  /**
   * Returns a new builder. The emulator host is read from the environment at this point.
   *
   * @return a new Builder
   */
  @Nonnull
  public static Builder builder() {
    return builder(System::getenv);
  }

  @Nonnull
  static Builder builder(@Nonnull Function<String, String> environment) {
    Builder builder = new Builder();
    String emulatorHost = environment.apply(EMULATOR_HOST_ENV);
    if (emulatorHost != null && !emulatorHost.isEmpty()) {
      builder.endpoint(emulatorHost).tlsConfig(new InsecureTlsConfig());
    }
    return builder;
  }

  @Nullable
  String getEndpoint() {
    return endpoint;
  }

  @Nonnull
  TlsConfig getTlsConfig() {
    return tlsConfig;
  }

  @Nonnull
  @Override
  public ResourceClient connect() {
    ManagedChannel channel = null;
    TransportChannelProvider channelProvider = null;
    CredentialsProvider credentials = credentialsProvider;
    if (endpoint != null) {
      channel = createChannel(endpoint, tlsConfig);
      channelProvider = FixedTransportChannelProvider.create(GrpcTransportChannel.create(channel));
      if (!tlsConfig.carriesCallCredentials()) {
        credentials = NoCredentialsProvider.create();
      }
      logger.debug("Connecting to Pub/Sub at {}", endpoint);
    }

    SubscriptionAdminSettings.Builder subscriptionSettings = SubscriptionAdminSettings.newBuilder();
    TopicAdminSettings.Builder topicSettings = TopicAdminSettings.newBuilder();
    if (channelProvider != null) {
      subscriptionSettings.setTransportChannelProvider(channelProvider);
      topicSettings.setTransportChannelProvider(channelProvider);
    }
    if (credentials != null) {
      subscriptionSettings.setCredentialsProvider(credentials);
      topicSettings.setCredentialsProvider(credentials);
    }

    SubscriptionAdminClient subscriptionAdmin = null;
    try {
      subscriptionAdmin = SubscriptionAdminClient.create(subscriptionSettings.build());
      TopicAdminClient topicAdmin = TopicAdminClient.create(topicSettings.build());
      return new GcpResourceClient(
          subscriptionAdmin, topicAdmin, channelProvider, credentials, channel);
    } catch (IOException e) {
      if (subscriptionAdmin != null) {
        subscriptionAdmin.close();
      }
      if (channel != null) {
        channel.shutdown();
      }
      throw new CourierException("Failed to connect to Pub/Sub", e);
    }
  }

  /**
   * Creates a new gRPC channel configured for long-lived streaming.
   *
   * @param endpoint The endpoint URL
   * @param tlsConfig The TLS configuration
   * @return A new ManagedChannel
   */
  private ManagedChannel createChannel(String endpoint, TlsConfig tlsConfig) {
    EndpointInfo endpointInfo = parseEndpoint(endpoint);
    ChannelCredentials credentials = tlsConfig.toChannelCredentials();

    return Grpc.newChannelBuilder(endpointInfo.host + ":" + endpointInfo.port, credentials)
        .keepAliveTime(KEEP_ALIVE_TIME_SECONDS, TimeUnit.SECONDS)
        .keepAliveTimeout(KEEP_ALIVE_TIMEOUT_SECONDS, TimeUnit.SECONDS)
        .keepAliveWithoutCalls(true)
        .maxInboundMessageSize(Integer.MAX_VALUE)
        .build();
  }

  /** Container for parsed endpoint information. */
  static class EndpointInfo {
    final String host;
    final int port;

    EndpointInfo(String host, int port) {
      this.host = host;
      this.port = port;
    }
  }

  /**
   * Parses an endpoint string to extract host and port information.
   *
   * @param endpoint The endpoint string (may include https:// or http:// prefix)
   * @return Parsed endpoint information
   */
  static EndpointInfo parseEndpoint(String endpoint) {
    String cleanEndpoint = endpoint;
    if (cleanEndpoint.startsWith(HTTPS_PREFIX)) {
      cleanEndpoint = cleanEndpoint.substring(HTTPS_PREFIX.length());
    } else if (cleanEndpoint.startsWith(HTTP_PREFIX)) {
      cleanEndpoint = cleanEndpoint.substring(HTTP_PREFIX.length());
    }

    String[] parts = cleanEndpoint.split(":", 2);
    String host = parts[0];
    int port = parts.length > 1 ? Integer.parseInt(parts[1]) : DEFAULT_TLS_PORT;

    return new EndpointInfo(host, port);
  }

  /** Builder for {@link GcpConnectionFactory}. */
  public static final class Builder {
    private String endpoint;
    private TlsConfig tlsConfig = new SecureTlsConfig();
    private CredentialsProvider credentialsProvider;

    private Builder() {}

    /**
     * Sets the endpoint to connect to, for example {@code localhost:8085} for an emulator.
     *
     * @param endpoint host and optional port, with an optional http(s):// prefix
     * @return this builder for method chaining
     */
    public Builder endpoint(@Nullable String endpoint) {
      this.endpoint = endpoint;
      return this;
    }

    /**
     * Sets how the channel to an explicit endpoint is secured. Defaults to {@link SecureTlsConfig}.
     *
     * @param tlsConfig the TLS configuration
     * @return this builder for method chaining
     */
    public Builder tlsConfig(@Nonnull TlsConfig tlsConfig) {
      this.tlsConfig = tlsConfig;
      return this;
    }

    /**
     * Sets the credentials. Defaults to Application Default Credentials.
     *
     * @param credentialsProvider the credentials provider
     * @return this builder for method chaining
     */
    public Builder credentialsProvider(@Nullable CredentialsProvider credentialsProvider) {
      this.credentialsProvider = credentialsProvider;
      return this;
    }

    @Nonnull
    public GcpConnectionFactory build() {
      return new GcpConnectionFactory(this);
    }
  }
}
