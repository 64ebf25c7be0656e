// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer.provider;

import io.vcp.security.authorizer.Authorizer;

/**
 * Authorizer implementation that can be created by an {@link AuthorizerRegistry}.
 */
public interface AuthorizerDriver extends Authorizer {

  void init(String driverName);

  /**
   * Loads the driver using the provided options. Drivers may start background tasks here,
   * which are stopped by {@link #stopService()}.
   *
   * @throws org.apache.kafka.common.config.ConfigException if a required option is missing or invalid
   */
  void load(AuthorizerOptions options);
}
