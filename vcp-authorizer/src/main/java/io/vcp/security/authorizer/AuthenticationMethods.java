// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer;

/**
 * Authentication protocols reported in a {@link RequestContext}.
 */
public final class AuthenticationMethods {

  public static final String TLS = "tls";
  public static final String CANDID = "candid";
  public static final String OIDC = "oidc";

  private AuthenticationMethods() {
  }
}
