// (Copyright) The vcp-security authors.

package io.vcp.security.auth.provider.openfga;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.anyString;
import static org.easymock.EasyMock.capture;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.mock;
import static org.easymock.EasyMock.newCapture;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import io.vcp.security.authorizer.AuthenticationMethods;
import io.vcp.security.authorizer.ForbiddenException;
import io.vcp.security.authorizer.PermissionChecker;
import io.vcp.security.authorizer.RequestContext;
import io.vcp.security.authorizer.certificate.CertificateCache;
import io.vcp.security.authorizer.certificate.CertificateRecord;
import io.vcp.security.authorizer.certificate.CertificateType;
import io.vcp.security.authorizer.entitlement.AuthObject;
import io.vcp.security.authorizer.entitlement.ObjectType;
import io.vcp.security.authorizer.entitlement.Relation;
import io.vcp.security.authorizer.provider.AuthorizerOptions;
import io.vcp.security.authorizer.provider.AuthorizerRegistry.BuiltInDrivers;
import io.vcp.security.authorizer.provider.ProviderFailedException;
import io.vcp.security.authorizer.rebac.RebacEngine;
import io.vcp.security.authorizer.rebac.TupleKey;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import org.apache.kafka.common.config.ConfigException;
import org.easymock.Capture;
import org.junit.Before;
import org.junit.Test;

public class OpenFgaAuthorizerTest {

  private CertificateCache certificateCache;
  private RebacEngine engine;
  private Capture<String> storeId;
  private Capture<String> model;
  private OpenFgaAuthorizer authorizer;

  @Before
  public void setUp() {
    certificateCache = new CertificateCache();
    certificateCache.setCertificates(Arrays.asList(
        CertificateRecord.unrestricted("admin", CertificateType.CLIENT),
        new CertificateRecord("fp1", CertificateType.CLIENT, Arrays.asList("default", "p2"),
            Collections.singletonList("ops")),
        CertificateRecord.unrestricted("metrics", CertificateType.METRICS)));

    engine = mock(RebacEngine.class);
    storeId = newCapture();
    model = newCapture();
    engine.writeAuthorizationModel(capture(storeId), capture(model));
    expectLastCall();

    authorizer = new OpenFgaAuthorizer();
    authorizer.init(BuiltInDrivers.OPENFGA.driverName());
  }

  @Test
  public void testLoadWritesBuiltInModel() {
    replay(engine);
    load();

    verify(engine);
    assertEquals(storeId.getValue(), authorizer.storeId());
    UUID.fromString(storeId.getValue());
    assertTrue(model.getValue().startsWith("model"));
    for (ObjectType type : ObjectType.values())
      assertTrue("Model does not define " + type, model.getValue().contains("type " + type.value() + "\n"));
  }

  @Test
  public void testRestrictedCertificateUsesContextualTuples() {
    List<TupleKey> contextual = Arrays.asList(
        new TupleKey("user:fp1", "member", "group:ops"),
        new TupleKey("user:fp1", "operator", "project:default"),
        new TupleKey("user:fp1", "operator", "project:p2"));
    expect(engine.check(anyString(), eq(new TupleKey("user:fp1", "can_exec", "instance:default/c1")), eq(contextual)))
        .andReturn(true);
    expect(engine.check(anyString(), eq(new TupleKey("user:fp1", "can_edit", "server:vcp")), eq(contextual)))
        .andReturn(false);
    replay(engine);
    load();

    RequestContext fp1 = RequestContext.tls("fp1", "default");
    authorizer.checkPermission(fp1, Relation.CAN_EXEC, ObjectType.INSTANCE, "default", "", "c1");
    try {
      authorizer.checkPermission(fp1, Relation.CAN_EDIT, ObjectType.SERVER, "", "");
      fail("should have failed");
    } catch (ForbiddenException e) {
      assertEquals("User does not have entitlement \"can_edit\" on object \"server:vcp\"", e.getMessage());
    }
    verify(engine);
  }

  @Test
  public void testPrivilegedCertificateIsAllowedWithoutEngine() {
    replay(engine);
    load();

    RequestContext admin = RequestContext.tls("admin", "p2");
    authorizer.checkPermission(admin, Relation.CAN_EDIT, ObjectType.PROJECT, "p2", "");
    authorizer.checkPermission(admin, Relation.CAN_EDIT, ObjectType.SERVER, "", "");
    PermissionChecker checker = authorizer.getPermissionChecker(admin, Relation.CAN_EDIT, ObjectType.INSTANCE);
    assertTrue(checker.allows(AuthObject.instance("p3", "c1")));
    verify(engine);
  }

  @Test
  public void testPermissionCheckerUsesListedObjects() {
    expect(engine.listObjects(anyString(), eq("instance"), eq("can_view"), eq("user:fp1"), anyObject()))
        .andReturn(Arrays.asList("instance:default/c1", "instance:p2/c2"));
    replay(engine);
    load();

    PermissionChecker checker = authorizer.getPermissionChecker(RequestContext.tls("fp1", "default"),
        Relation.CAN_VIEW, ObjectType.INSTANCE);
    assertTrue(checker.allows(AuthObject.instance("default", "c1")));
    assertTrue(checker.allows(AuthObject.instance("p2", "c2")));
    assertFalse(checker.allows(AuthObject.instance("default", "c2")));
    verify(engine);
  }

  @Test
  public void testBypasses() {
    replay(engine);
    load();

    authorizer.checkPermission(RequestContext.internal(), Relation.CAN_EDIT, ObjectType.SERVER, "", "");
    assertTrue(authorizer.getPermissionChecker(RequestContext.internal(), Relation.CAN_EDIT, ObjectType.INSTANCE)
        .allows(AuthObject.instance("default", "c1")));

    RequestContext metrics = RequestContext.tls("metrics", "default");
    authorizer.checkPermission(metrics, Relation.CAN_VIEW_METRICS, ObjectType.SERVER, "", "");
    assertTrue(authorizer.getPermissionChecker(metrics, Relation.CAN_VIEW_METRICS, ObjectType.SERVER)
        .allows(AuthObject.server()));
    verify(engine);
  }

  @Test
  public void testOnlyTlsSupported() {
    replay(engine);
    load();

    RequestContext oidc = new RequestContext(AuthenticationMethods.OIDC, "alice", "default", false, false);
    try {
      authorizer.checkPermission(oidc, Relation.CAN_VIEW, ObjectType.INSTANCE, "default", "", "c1");
      fail("should have failed");
    } catch (ForbiddenException e) {
      assertEquals("Only TLS supported", e.getMessage());
    }
    try {
      authorizer.getPermissionChecker(oidc, Relation.CAN_VIEW, ObjectType.INSTANCE);
      fail("should have failed");
    } catch (ForbiddenException e) {
      assertEquals("Only TLS supported", e.getMessage());
    }
  }

  @Test
  public void testUnknownCertificate() {
    replay(engine);
    load();
    try {
      authorizer.checkPermission(RequestContext.tls("unknown", "default"), Relation.CAN_VIEW, ObjectType.INSTANCE,
          "default", "", "c1");
      fail("should have failed");
    } catch (ForbiddenException e) {
      assertEquals("Client certificate not found", e.getMessage());
    }
  }

  @Test
  public void testEngineFailure() {
    expect(engine.check(anyString(), anyObject(), anyObject())).andThrow(new IllegalStateException("store not found"));
    expect(engine.listObjects(anyString(), anyString(), anyString(), anyString(), anyObject()))
        .andThrow(new IllegalStateException("store not found"));
    replay(engine);
    load();

    RequestContext fp1 = RequestContext.tls("fp1", "default");
    try {
      authorizer.checkPermission(fp1, Relation.CAN_VIEW, ObjectType.INSTANCE, "default", "", "c1");
      fail("should have failed");
    } catch (ProviderFailedException e) {
      assertEquals("Failed to check OpenFGA relation", e.getMessage());
    }
    try {
      authorizer.getPermissionChecker(fp1, Relation.CAN_VIEW, ObjectType.INSTANCE);
      fail("should have failed");
    } catch (ProviderFailedException e) {
      assertTrue(e.getMessage().startsWith("Failed to list OpenFGA objects of type \"instance\""));
    }
  }

  @Test
  public void testRequiredOptions() {
    try {
      authorizer.load(new AuthorizerOptions().withRebacEngine(engine));
      fail("should have failed");
    } catch (ConfigException e) {
      assertEquals("Must provide certificate cache", e.getMessage());
    }
    try {
      authorizer.load(new AuthorizerOptions().withCertificateCache(certificateCache));
      fail("should have failed");
    } catch (ConfigException e) {
      assertEquals("The ReBAC engine option must be set", e.getMessage());
    }
  }

  private void load() {
    authorizer.load(new AuthorizerOptions()
        .withCertificateCache(certificateCache)
        .withRebacEngine(engine));
  }
}
