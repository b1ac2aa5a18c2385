package io.courier.tls;

import io.grpc.ChannelCredentials;

/**
 * Abstract base class for TLS configuration strategies.
 *
 * <p>Implementations define how the gRPC channel to the Pub/Sub endpoint is secured. By default the
 * SDK uses {@link SecureTlsConfig}. Emulators and local test servers speak plaintext and are
 * reached with {@link InsecureTlsConfig}.
 *
 * <pre>{@code
 * GcpConnectionFactory factory =
 *     GcpConnectionFactory.builder()
 *         .endpoint("localhost:8085")
 *         .tlsConfig(new InsecureTlsConfig())
 *         .build();
 * }</pre>
 *
 * @see io.courier.client.GcpConnectionFactory
 */
public abstract class TlsConfig {

  /**
   * Converts the TLS configuration to gRPC ChannelCredentials.
   *
   * @return channel credentials for the connection
   */
  public abstract ChannelCredentials toChannelCredentials();

  /**
   * Returns whether call credentials (OAuth tokens) should be attached to this channel.
   *
   * @return true when the channel is encrypted
   */
  public boolean carriesCallCredentials() {
    return true;
  }
}
