// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer.tls;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import io.vcp.security.authorizer.AuthenticationMethods;
import io.vcp.security.authorizer.AuthorizerConfig;
import io.vcp.security.authorizer.ForbiddenException;
import io.vcp.security.authorizer.InvalidArgumentException;
import io.vcp.security.authorizer.PermissionChecker;
import io.vcp.security.authorizer.RequestContext;
import io.vcp.security.authorizer.certificate.CertificateCache;
import io.vcp.security.authorizer.certificate.CertificateRecord;
import io.vcp.security.authorizer.certificate.CertificateType;
import io.vcp.security.authorizer.entitlement.AuthObject;
import io.vcp.security.authorizer.entitlement.ObjectType;
import io.vcp.security.authorizer.entitlement.Relation;
import io.vcp.security.authorizer.provider.AuthorizerOptions;
import java.util.Arrays;
import java.util.Collections;
import org.apache.kafka.common.config.ConfigException;
import org.junit.Before;
import org.junit.Test;

public class TlsAuthorizerTest {

  private CertificateCache certificateCache;
  private TlsAuthorizer authorizer;

  @Before
  public void setUp() {
    certificateCache = new CertificateCache();
    certificateCache.setCertificates(Arrays.asList(
        CertificateRecord.unrestricted("admin", CertificateType.CLIENT),
        CertificateRecord.restricted("fp1", Collections.singletonList("default")),
        CertificateRecord.restricted("fp2", Arrays.asList("proj-a", "proj-b")),
        CertificateRecord.unrestricted("metrics", CertificateType.METRICS)));
    authorizer = createAuthorizer(false);
  }

  @Test
  public void testUnrestrictedCertificateAllowedEverything() {
    RequestContext admin = RequestContext.tls("admin", "default");
    for (ObjectType type : ObjectType.values()) {
      for (Relation relation : type.relations()) {
        authorizer.checkPermission(admin, relation, type, "default", "node1", pathArgs(type));
        assertTrue(authorizer.getPermissionChecker(admin, relation, type).allows(AuthObject.instance("other", "c1")));
      }
    }
    RequestContext allProjects = new RequestContext(AuthenticationMethods.TLS, "admin", "", true, false);
    authorizer.checkPermission(allProjects, Relation.CAN_VIEW, ObjectType.INSTANCE, "other", "", "c1");
  }

  @Test
  public void testProjectScoping() {
    RequestContext fp1 = RequestContext.tls("fp1", "default");
    authorizer.checkPermission(fp1, Relation.CAN_VIEW, ObjectType.INSTANCE, "default", "", "c1");
    authorizer.checkPermission(fp1, Relation.CAN_EXEC, ObjectType.INSTANCE, "default", "", "c1");
    verifyForbidden(fp1, Relation.CAN_VIEW, ObjectType.INSTANCE, "other", "c1");

    RequestContext fp2 = RequestContext.tls("fp2", "proj-a");
    authorizer.checkPermission(fp2, Relation.CAN_VIEW, ObjectType.INSTANCE, "proj-a", "", "c1");
    authorizer.checkPermission(fp2, Relation.CAN_EDIT, ObjectType.PROJECT, "proj-b", "");
    verifyForbidden(fp2, Relation.CAN_VIEW, ObjectType.INSTANCE, "proj-c", "c1");
    verifyForbidden(fp2, Relation.CAN_VIEW, ObjectType.INSTANCE, "", "c1");
  }

  @Test
  public void testServerLevelObjects() {
    RequestContext fp1 = RequestContext.tls("fp1", "default");
    authorizer.checkPermission(fp1, Relation.CAN_VIEW, ObjectType.SERVER, "", "");
    authorizer.checkPermission(fp1, Relation.CAN_VIEW_RESOURCES, ObjectType.SERVER, "", "");
    authorizer.checkPermission(fp1, Relation.CAN_VIEW_METRICS, ObjectType.SERVER, "", "");
    authorizer.checkPermission(fp1, Relation.CAN_VIEW, ObjectType.STORAGE_POOL, "", "", "local");
    authorizer.checkPermission(fp1, Relation.CAN_VIEW, ObjectType.CERTIFICATE, "", "", "fp1");

    verifyForbidden(fp1, Relation.CAN_EDIT, ObjectType.SERVER);
    verifyForbidden(fp1, Relation.CAN_MANAGE_PROJECTS, ObjectType.SERVER);
    verifyForbidden(fp1, Relation.CAN_VIEW_WARNINGS, ObjectType.SERVER);
    verifyForbidden(fp1, Relation.CAN_EDIT, ObjectType.STORAGE_POOL, "", "local");
    verifyForbidden(fp1, Relation.CAN_EDIT, ObjectType.CERTIFICATE, "", "fp1");
  }

  @Test
  public void testAllProjectsRequestRequiresUnrestrictedCertificate() {
    RequestContext fp1 = new RequestContext(AuthenticationMethods.TLS, "fp1", "default", true, false);
    verifyForbidden(fp1, Relation.CAN_VIEW, ObjectType.INSTANCE, "default", "c1");
    try {
      authorizer.getPermissionChecker(fp1, Relation.CAN_VIEW, ObjectType.INSTANCE);
      fail("should have failed");
    } catch (ForbiddenException e) {
      assertEquals("Certificate is restricted", e.getMessage());
    }
  }

  @Test
  public void testMetricsCertificate() {
    RequestContext metrics = RequestContext.tls("metrics", "");
    authorizer.checkPermission(metrics, Relation.CAN_VIEW_METRICS, ObjectType.SERVER, "", "");
    verifyForbidden(metrics, Relation.CAN_EDIT, ObjectType.SERVER);
    verifyForbidden(metrics, Relation.CAN_VIEW, ObjectType.INSTANCE, "default", "c1");
  }

  @Test
  public void testUnknownCertificate() {
    RequestContext unknown = RequestContext.tls("unknown", "default");
    verifyForbidden(unknown, Relation.CAN_VIEW, ObjectType.INSTANCE, "default", "c1");

    TlsAuthorizer trustingAuthorizer = createAuthorizer(true);
    trustingAuthorizer.checkPermission(unknown, Relation.CAN_EDIT, ObjectType.SERVER, "", "");
  }

  @Test
  public void testInternalAndOtherProtocolsAreAllowed() {
    authorizer.checkPermission(RequestContext.internal(), Relation.CAN_EDIT, ObjectType.SERVER, "", "");
    assertTrue(authorizer.getPermissionChecker(RequestContext.internal(), Relation.CAN_VIEW, ObjectType.INSTANCE)
        .allows(AuthObject.instance("any", "c1")));

    RequestContext oidc = new RequestContext(AuthenticationMethods.OIDC, "alice", "default", true, false);
    authorizer.checkPermission(oidc, Relation.CAN_EDIT, ObjectType.SERVER, "", "");
    assertTrue(authorizer.getPermissionChecker(oidc, Relation.CAN_EDIT, ObjectType.PROFILE)
        .allows(AuthObject.profile("any", "default")));
  }

  @Test
  public void testPermissionChecker() {
    RequestContext fp2 = RequestContext.tls("fp2", "proj-a");
    PermissionChecker checker = authorizer.getPermissionChecker(fp2, Relation.CAN_VIEW, ObjectType.INSTANCE);
    assertTrue(checker.allows(AuthObject.instance("proj-a", "c1")));
    assertTrue(checker.allows(AuthObject.instance("proj-b", "c1")));
    assertFalse(checker.allows(AuthObject.instance("proj-c", "c1")));

    PermissionChecker poolChecker = authorizer.getPermissionChecker(fp2, Relation.CAN_VIEW, ObjectType.STORAGE_POOL);
    assertTrue(poolChecker.allows(AuthObject.storagePool("local")));
    try {
      authorizer.getPermissionChecker(fp2, Relation.CAN_EDIT, ObjectType.STORAGE_POOL);
      fail("should have failed");
    } catch (ForbiddenException e) {
      // Expected
    }
  }

  @Test
  public void testPermissionCheckerFailsForInaccessibleProject() {
    RequestContext fp1 = RequestContext.tls("fp1", "other");
    try {
      authorizer.getPermissionChecker(fp1, Relation.CAN_VIEW, ObjectType.INSTANCE);
      fail("should have failed");
    } catch (ForbiddenException e) {
      assertEquals("User does not have permissions for project \"other\"", e.getMessage());
    }

    PermissionChecker projects = authorizer.getPermissionChecker(fp1, Relation.CAN_VIEW, ObjectType.PROJECT);
    assertTrue(projects.allows(AuthObject.project("default")));
    assertFalse(projects.allows(AuthObject.project("other")));
  }

  @Test(expected = InvalidArgumentException.class)
  public void testInvalidRelation() {
    authorizer.checkPermission(RequestContext.tls("admin", ""), Relation.CAN_EXEC, ObjectType.PROFILE, "default", "", "p1");
  }

  @Test(expected = ConfigException.class)
  public void testCertificateCacheRequired() {
    TlsAuthorizer authorizer = new TlsAuthorizer();
    authorizer.init("tls");
    authorizer.load(new AuthorizerOptions());
  }

  private TlsAuthorizer createAuthorizer(boolean trustCa) {
    TlsAuthorizer authorizer = new TlsAuthorizer();
    authorizer.init("tls");
    authorizer.load(new AuthorizerOptions()
        .withCertificateCache(certificateCache)
        .withConfig(Collections.singletonMap(AuthorizerConfig.TLS_TRUST_CA_CERTIFICATES_PROP, String.valueOf(trustCa))));
    assertEquals("tls", authorizer.driver());
    return authorizer;
  }

  private void verifyForbidden(RequestContext requestContext, Relation relation, ObjectType type, String... args) {
    String project = args.length > 0 ? args[0] : "";
    String[] pathArgs = args.length > 1 ? Arrays.copyOfRange(args, 1, args.length) : new String[0];
    try {
      authorizer.checkPermission(requestContext, relation, type, project, "", pathArgs);
      fail("should have failed");
    } catch (ForbiddenException e) {
      // Expected
    }
  }

  private static String[] pathArgs(ObjectType type) {
    switch (type) {
      case SERVER:
      case PROJECT:
        return new String[0];
      case STORAGE_BUCKET:
        return new String[] {"pool", "bucket"};
      case STORAGE_VOLUME:
        return new String[] {"pool", "custom", "vol"};
      default:
        return new String[] {"name"};
    }
  }
}
