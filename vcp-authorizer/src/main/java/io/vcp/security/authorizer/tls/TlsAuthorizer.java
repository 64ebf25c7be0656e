// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer.tls;

import io.vcp.security.authorizer.AuthenticationMethods;
import io.vcp.security.authorizer.AuthorizerConfig;
import io.vcp.security.authorizer.ForbiddenException;
import io.vcp.security.authorizer.PermissionChecker;
import io.vcp.security.authorizer.RequestContext;
import io.vcp.security.authorizer.certificate.CertificateCache;
import io.vcp.security.authorizer.certificate.CertificateDetails;
import io.vcp.security.authorizer.certificate.CertificateType;
import io.vcp.security.authorizer.entitlement.AuthObject;
import io.vcp.security.authorizer.entitlement.ObjectType;
import io.vcp.security.authorizer.entitlement.Relation;
import io.vcp.security.authorizer.provider.AbstractAuthorizer;
import io.vcp.security.authorizer.provider.AuthorizerOptions;
import io.vcp.security.authorizer.utils.AccessRules;
import java.util.List;
import org.apache.kafka.common.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authorizes TLS authenticated callers using the project restrictions of their client
 * certificate. Callers using other authentication methods are trusted, since no policy is
 * available for them when this driver is active.
 */
public class TlsAuthorizer extends AbstractAuthorizer {

  private static final Logger log = LoggerFactory.getLogger(TlsAuthorizer.class);

  private CertificateCache certificates;
  private boolean trustCaCertificates;

  @Override
  public void load(AuthorizerOptions options) {
    if (options.certificateCache() == null)
      throw new ConfigException("TLS authorization driver requires a certificate cache");

    this.certificates = options.certificateCache();
    this.trustCaCertificates = new AuthorizerConfig(options.config()).trustCaCertificates;
  }

  @Override
  public void checkPermission(RequestContext requestContext,
                              Relation relation,
                              ObjectType objectType,
                              String projectName,
                              String location,
                              String... pathArgs) {
    AuthObject object = AuthObject.fromEntity(objectType, projectName, location, pathArgs);
    objectType.validateRelation(relation);

    if (requestContext.isInternalOrUnix())
      return;

    String protocol = requestContext.authenticationProtocol();
    if (!protocol.equals(AuthenticationMethods.TLS)) {
      log.warn("Authentication protocol {} is not compatible with authorization driver {}", protocol, driver());
      return;
    }

    CertificateDetails details = certificateDetails(requestContext.username());
    if (details.unrestricted() || isMetricsAccess(details, relation))
      return;

    if (requestContext.isAllProjectsRequest())
      throw new ForbiddenException("Certificate is restricted");

    if (AccessRules.isServerLevel(objectType)) {
      if (AccessRules.restrictedCallerAllowed(objectType, relation))
        return;
      throw new ForbiddenException("Certificate is restricted");
    }

    if (!details.projects().contains(object.project()))
      throw new ForbiddenException(String.format("User does not have permission for project \"%s\"", object.project()));
  }

  @Override
  public PermissionChecker getPermissionChecker(RequestContext requestContext,
                                                Relation relation,
                                                ObjectType objectType) {
    objectType.validateRelation(relation);

    if (requestContext.isInternalOrUnix())
      return PermissionChecker.ALLOW_ALL;

    String protocol = requestContext.authenticationProtocol();
    if (!protocol.equals(AuthenticationMethods.TLS)) {
      log.warn("Authentication protocol {} is not compatible with authorization driver {}", protocol, driver());
      return PermissionChecker.ALLOW_ALL;
    }

    CertificateDetails details = certificateDetails(requestContext.username());
    if (details.unrestricted() || isMetricsAccess(details, relation))
      return PermissionChecker.ALLOW_ALL;

    if (requestContext.isAllProjectsRequest())
      throw new ForbiddenException("Certificate is restricted");

    if (AccessRules.isServerLevel(objectType)) {
      if (AccessRules.restrictedCallerAllowed(objectType, relation))
        return PermissionChecker.ALLOW_ALL;
      throw new ForbiddenException("Certificate is restricted");
    }

    // Projects are filtered rather than rejected when listing projects
    List<String> projects = details.projects();
    if (!projects.contains(requestContext.projectName()) && objectType != ObjectType.PROJECT)
      throw new ForbiddenException(String.format("User does not have permissions for project \"%s\"",
          requestContext.projectName()));

    return object -> projects.contains(object.project());
  }

  private CertificateDetails certificateDetails(String fingerprint) {
    return CertificateDetails.resolve(certificates, fingerprint, trustCaCertificates);
  }

  private static boolean isMetricsAccess(CertificateDetails details, Relation relation) {
    return details.type() == CertificateType.METRICS && relation == Relation.CAN_VIEW_METRICS;
  }
}
