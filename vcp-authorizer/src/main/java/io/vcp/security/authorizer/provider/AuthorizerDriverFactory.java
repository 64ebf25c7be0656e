// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer.provider;

/**
 * Service provider interface for drivers. Implementations are registered in
 * {@code META-INF/services/io.vcp.security.authorizer.provider.AuthorizerDriverFactory}.
 */
public interface AuthorizerDriverFactory {

  String driverName();

  AuthorizerDriver create();
}
