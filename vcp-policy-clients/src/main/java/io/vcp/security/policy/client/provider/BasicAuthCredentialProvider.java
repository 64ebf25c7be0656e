// (Copyright) The vcp-security authors.

package io.vcp.security.policy.client.provider;

import org.apache.kafka.common.Configurable;

/**
 * Supplies user credentials for HTTP basic authentication against the policy server.
 */
public interface BasicAuthCredentialProvider extends Configurable {

  /**
   * Returns the name of this provider.
   * @return provider name
   */
  String providerName();

  /**
   * Returns user credentials in the format user:password, or null if basic authentication is disabled.
   * @return user credentials
   */
  String getUserInfo();
}
