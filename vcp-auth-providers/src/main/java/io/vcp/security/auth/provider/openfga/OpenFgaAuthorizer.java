// (Copyright) The vcp-security authors.

package io.vcp.security.auth.provider.openfga;

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
import io.vcp.security.authorizer.provider.ProviderFailedException;
import io.vcp.security.authorizer.rebac.RebacEngine;
import io.vcp.security.authorizer.rebac.TupleKey;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authorizes TLS authenticated callers using a relationship-based access control engine.
 * Group and project memberships of the caller's certificate are passed to the engine as
 * contextual tuples with each request, so they are never persisted by the engine.
 */
public class OpenFgaAuthorizer extends AbstractAuthorizer {

  private static final Logger log = LoggerFactory.getLogger(OpenFgaAuthorizer.class);

  static final String AUTHORIZATION_MODEL_RESOURCE = "authorization_model.fga";

  private CertificateCache certificates;
  private boolean trustCaCertificates;
  private RebacEngine engine;
  private String storeId;

  @Override
  public void load(AuthorizerOptions options) {
    if (options.certificateCache() == null)
      throw new ConfigException("Must provide certificate cache");
    if (options.rebacEngine() == null)
      throw new ConfigException("The ReBAC engine option must be set");

    this.certificates = options.certificateCache();
    this.trustCaCertificates = new AuthorizerConfig(options.config()).trustCaCertificates;
    this.engine = options.rebacEngine();

    String model = authorizationModel();
    this.storeId = UUID.randomUUID().toString();
    engine.writeAuthorizationModel(storeId, model);
    log.info("Wrote built-in authorization model to store {}", storeId);
  }

  static String authorizationModel() {
    try (InputStream in = OpenFgaAuthorizer.class.getResourceAsStream(AUTHORIZATION_MODEL_RESOURCE)) {
      if (in == null)
        throw new KafkaException("Built-in authorization model " + AUTHORIZATION_MODEL_RESOURCE + " not found");
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new KafkaException("Failed to read built-in authorization model", e);
    }
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

    if (!requestContext.authenticationProtocol().equals(AuthenticationMethods.TLS))
      throw new ForbiddenException("Only TLS supported");

    CertificateDetails details = certificateDetails(requestContext.username());
    if (details.unrestricted() || isMetricsAccess(details, relation))
      return;

    String user = AuthObject.user(requestContext.username()).toString();
    TupleKey tuple = new TupleKey(user, relation.value(), object.toString());
    List<TupleKey> contextualTuples = contextualTuples(user, details);

    log.debug("Checking relation {} of user {} on object {} using protocol {}",
        relation, requestContext.username(), object, requestContext.authenticationProtocol());
    boolean allowed;
    try {
      allowed = engine.check(storeId, tuple, contextualTuples);
    } catch (ForbiddenException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ProviderFailedException("Failed to check OpenFGA relation", e);
    }

    if (!allowed)
      throw new ForbiddenException(String.format("User does not have entitlement \"%s\" on object \"%s\"",
          relation, object));
  }

  @Override
  public PermissionChecker getPermissionChecker(RequestContext requestContext,
                                                Relation relation,
                                                ObjectType objectType) {
    objectType.validateRelation(relation);

    if (requestContext.isInternalOrUnix())
      return PermissionChecker.ALLOW_ALL;

    if (!requestContext.authenticationProtocol().equals(AuthenticationMethods.TLS))
      throw new ForbiddenException("Only TLS supported");

    CertificateDetails details = certificateDetails(requestContext.username());
    if (details.unrestricted() || isMetricsAccess(details, relation))
      return PermissionChecker.ALLOW_ALL;

    String user = AuthObject.user(requestContext.username()).toString();
    List<TupleKey> contextualTuples = contextualTuples(user, details);

    log.debug("Listing objects of type {} with relation {} for user {}", objectType, relation, requestContext.username());
    Set<String> objects;
    try {
      objects = new HashSet<>(engine.listObjects(storeId, objectType.value(), relation.value(), user, contextualTuples));
    } catch (RuntimeException e) {
      throw new ProviderFailedException(String.format(
          "Failed to list OpenFGA objects of type \"%s\" with relation \"%s\" for user \"%s\"",
          objectType, relation, requestContext.username()), e);
    }

    return object -> objects.contains(object.toString());
  }

  /**
   * Callers are members of the groups and operators of the projects listed in their certificate.
   */
  private static List<TupleKey> contextualTuples(String user, CertificateDetails details) {
    List<TupleKey> tuples = new ArrayList<>();
    for (String group : details.groups())
      tuples.add(new TupleKey(user, Relation.MEMBER.value(), AuthObject.group(group).toString()));
    for (String project : details.projects())
      tuples.add(new TupleKey(user, Relation.OPERATOR.value(), AuthObject.project(project).toString()));
    return tuples;
  }

  private CertificateDetails certificateDetails(String fingerprint) {
    return CertificateDetails.resolve(certificates, fingerprint, trustCaCertificates);
  }

  private static boolean isMetricsAccess(CertificateDetails details, Relation relation) {
    return details.type() == CertificateType.METRICS && relation == Relation.CAN_VIEW_METRICS;
  }

  // Visible for testing
  String storeId() {
    return storeId;
  }
}
