// (Copyright) The vcp-security authors.

package io.vcp.security.auth.provider.openfga;

import io.vcp.security.authorizer.provider.AuthorizerDriver;
import io.vcp.security.authorizer.provider.AuthorizerDriverFactory;
import io.vcp.security.authorizer.provider.AuthorizerRegistry.BuiltInDrivers;

public class OpenFgaAuthorizerFactory implements AuthorizerDriverFactory {

  @Override
  public String driverName() {
    return BuiltInDrivers.OPENFGA.driverName();
  }

  @Override
  public AuthorizerDriver create() {
    return new OpenFgaAuthorizer();
  }
}
