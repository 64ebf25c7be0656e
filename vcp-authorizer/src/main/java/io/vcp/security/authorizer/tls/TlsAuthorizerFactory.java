// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer.tls;

import io.vcp.security.authorizer.provider.AuthorizerDriver;
import io.vcp.security.authorizer.provider.AuthorizerDriverFactory;
import io.vcp.security.authorizer.provider.AuthorizerRegistry.BuiltInDrivers;

public class TlsAuthorizerFactory implements AuthorizerDriverFactory {

  @Override
  public String driverName() {
    return BuiltInDrivers.TLS.driverName();
  }

  @Override
  public AuthorizerDriver create() {
    return new TlsAuthorizer();
  }
}
