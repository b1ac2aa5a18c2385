package io.courier.tls;

import io.grpc.ChannelCredentials;
import io.grpc.InsecureChannelCredentials;

/** Plaintext configuration for the Pub/Sub emulator and local test servers. */
public class InsecureTlsConfig extends TlsConfig {

  @Override
  public ChannelCredentials toChannelCredentials() {
    return InsecureChannelCredentials.create();
  }

  @Override
  public boolean carriesCallCredentials() {
    return false;
  }
}
