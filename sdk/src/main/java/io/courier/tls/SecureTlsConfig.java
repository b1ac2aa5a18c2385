package io.courier.tls;

import io.grpc.ChannelCredentials;
import io.grpc.TlsChannelCredentials;

/**
 * Secure TLS configuration using system CA certificates.
 *
 * <p>This is the default configuration for connections to the managed service.
 *
 * @see TlsConfig
 */
public class SecureTlsConfig extends TlsConfig {

  /**
   * Returns secure TLS credentials using system CA certificates.
   *
   * @return TLS channel credentials with system CAs
   */
  @Override
  public ChannelCredentials toChannelCredentials() {
    return TlsChannelCredentials.create();
  }
}
