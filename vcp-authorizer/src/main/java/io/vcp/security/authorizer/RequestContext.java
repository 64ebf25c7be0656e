// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer;

import java.util.Objects;

/**
 * Caller details extracted from an inbound request. Created per request and never mutated.
 * For TLS authenticated requests, the username is the fingerprint of the client certificate.
 */
public class RequestContext {

  private final String authenticationProtocol;
  private final String username;
  private final String projectName;
  private final boolean allProjectsRequest;
  private final boolean internalOrUnix;

  public RequestContext(String authenticationProtocol,
                        String username,
                        String projectName,
                        boolean allProjectsRequest,
                        boolean internalOrUnix) {
    this.authenticationProtocol = authenticationProtocol == null ? "" : authenticationProtocol;
    this.username = username == null ? "" : username;
    this.projectName = projectName == null ? "" : projectName;
    this.allProjectsRequest = allProjectsRequest;
    this.internalOrUnix = internalOrUnix;
  }

  /**
   * Context of a request received over the unix socket or from another cluster member.
   */
  public static RequestContext internal() {
    return new RequestContext("", "", "", false, true);
  }

  public static RequestContext tls(String fingerprint, String projectName) {
    return new RequestContext(AuthenticationMethods.TLS, fingerprint, projectName, false, false);
  }

  public String authenticationProtocol() {
    return authenticationProtocol;
  }

  public String username() {
    return username;
  }

  public String projectName() {
    return projectName;
  }

  public boolean isAllProjectsRequest() {
    return allProjectsRequest;
  }

  public boolean isInternalOrUnix() {
    return internalOrUnix;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RequestContext)) {
      return false;
    }

    RequestContext that = (RequestContext) o;
    return Objects.equals(authenticationProtocol, that.authenticationProtocol) &&
        Objects.equals(username, that.username) &&
        Objects.equals(projectName, that.projectName) &&
        allProjectsRequest == that.allProjectsRequest &&
        internalOrUnix == that.internalOrUnix;
  }

  @Override
  public int hashCode() {
    return Objects.hash(authenticationProtocol, username, projectName, allProjectsRequest, internalOrUnix);
  }

  @Override
  public String toString() {
    return "RequestContext(" +
        "protocol='" + authenticationProtocol + '\'' +
        ", username='" + username + '\'' +
        ", project='" + projectName + '\'' +
        ", allProjects=" + allProjectsRequest +
        ", internal=" + internalOrUnix +
        ')';
  }
}
