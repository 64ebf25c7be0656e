// (Copyright) The vcp-security authors.

package io.vcp.security.auth.provider.rbac;

import io.vcp.security.authorizer.provider.AuthorizerDriver;
import io.vcp.security.authorizer.provider.AuthorizerDriverFactory;
import io.vcp.security.authorizer.provider.AuthorizerRegistry.BuiltInDrivers;

public class RbacAuthorizerFactory implements AuthorizerDriverFactory {

  @Override
  public String driverName() {
    return BuiltInDrivers.RBAC.driverName();
  }

  @Override
  public AuthorizerDriver create() {
    return new RbacAuthorizer();
  }
}
