// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.mock;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import io.vcp.security.authorizer.certificate.CertificateCache;
import io.vcp.security.authorizer.entitlement.AuthObject;
import io.vcp.security.authorizer.entitlement.ObjectType;
import io.vcp.security.authorizer.entitlement.Relation;
import io.vcp.security.authorizer.provider.AuthorizerDriver;
import io.vcp.security.authorizer.provider.AuthorizerOptions;
import io.vcp.security.authorizer.provider.AuthorizerRegistry;
import io.vcp.security.authorizer.provider.ProviderFailedException;
import io.vcp.security.authorizer.provider.UnknownDriverException;
import io.vcp.security.authorizer.tls.TlsAuthorizer;
import java.util.Collections;
import org.apache.kafka.common.KafkaException;
import org.junit.Before;
import org.junit.Test;

public class EmbeddedAuthorizerTest {

  private final RequestContext requestContext = new RequestContext(AuthenticationMethods.OIDC, "alice", "default", false, false);
  private AuthorizerDriver driver;
  private EmbeddedAuthorizer authorizer;

  @Before
  public void setUp() {
    driver = mock(AuthorizerDriver.class);
    authorizer = new EmbeddedAuthorizer(new AuthorizerRegistry().register("mock", () -> driver));

    driver.init("mock");
    expectLastCall();
    driver.load(anyObject(AuthorizerOptions.class));
    expectLastCall();
  }

  @Test
  public void testAllowed() {
    driver.checkPermission(requestContext, Relation.CAN_VIEW, ObjectType.INSTANCE, "default", "", "c1");
    expectLastCall();
    driver.stopService();
    expectLastCall();
    replay(driver);

    configure();
    authorizer.checkPermission(requestContext, Relation.CAN_VIEW, ObjectType.INSTANCE, "default", "", "c1");
    authorizer.close();
    verify(driver);
  }

  @Test
  public void testDenied() {
    ForbiddenException denied = new ForbiddenException("User does not have permission");
    driver.checkPermission(requestContext, Relation.CAN_EDIT, ObjectType.INSTANCE, "default", "", "c1");
    expectLastCall().andThrow(denied);
    replay(driver);

    configure();
    try {
      authorizer.checkPermission(requestContext, Relation.CAN_EDIT, ObjectType.INSTANCE, "default", "", "c1");
      fail("should have failed");
    } catch (ForbiddenException e) {
      assertSame(denied, e);
    }
    verify(driver);
  }

  @Test
  public void testDriverFailureIsReportedAsForbidden() {
    driver.checkPermission(requestContext, Relation.CAN_VIEW, ObjectType.INSTANCE, "default", "", "c1");
    expectLastCall().andThrow(new ProviderFailedException("Failed to sync user permissions: connection refused"));
    driver.checkPermission(requestContext, Relation.CAN_VIEW, ObjectType.PROFILE, "default", "", "p1");
    expectLastCall().andThrow(new KafkaException("Could not map object"));
    expect(driver.getPermissionChecker(requestContext, Relation.CAN_VIEW, ObjectType.NETWORK))
        .andThrow(new ProviderFailedException("Policy server unavailable"));
    replay(driver);

    configure();
    verifyOpaqueForbidden(() ->
        authorizer.checkPermission(requestContext, Relation.CAN_VIEW, ObjectType.INSTANCE, "default", "", "c1"));
    verifyOpaqueForbidden(() ->
        authorizer.checkPermission(requestContext, Relation.CAN_VIEW, ObjectType.PROFILE, "default", "", "p1"));
    verifyOpaqueForbidden(() ->
        authorizer.getPermissionChecker(requestContext, Relation.CAN_VIEW, ObjectType.NETWORK));
    verify(driver);
  }

  @Test(expected = InvalidArgumentException.class)
  public void testInvalidArgumentIsNotConverted() {
    driver.checkPermission(requestContext, Relation.CAN_EXEC, ObjectType.PROFILE, "default", "", "p1");
    expectLastCall().andThrow(new InvalidArgumentException("No such relation"));
    replay(driver);

    configure();
    authorizer.checkPermission(requestContext, Relation.CAN_EXEC, ObjectType.PROFILE, "default", "", "p1");
  }

  @Test
  public void testPermissionChecker() {
    PermissionChecker checker = object -> object.project().equals("default");
    expect(driver.getPermissionChecker(requestContext, Relation.CAN_VIEW, ObjectType.INSTANCE)).andReturn(checker);
    replay(driver);

    configure();
    assertSame(checker, authorizer.getPermissionChecker(requestContext, Relation.CAN_VIEW, ObjectType.INSTANCE));
    verify(driver);
  }

  @Test
  public void testEntityHooksAreDelegated() {
    driver.addProject(1L, "p1");
    expectLastCall();
    driver.renameProject(1L, "p1", "p2");
    expectLastCall();
    driver.deleteProject(1L, "p2");
    expectLastCall();
    driver.renameStoragePoolVolume("p1", "pool", "custom", "v1", "v2", "node1");
    expectLastCall();
    driver.addStorageBucket("p1", "pool", "b1", "");
    expectLastCall();
    expect(driver.driver()).andReturn("mock");
    replay(driver);

    configure();
    authorizer.addProject(1L, "p1");
    authorizer.renameProject(1L, "p1", "p2");
    authorizer.deleteProject(1L, "p2");
    authorizer.renameStoragePoolVolume("p1", "pool", "custom", "v1", "v2", "node1");
    authorizer.addStorageBucket("p1", "pool", "b1", "");
    assertEquals("mock", authorizer.driver());
    verify(driver);
  }

  @Test
  public void testStopFailureDoesNotPropagate() {
    driver.stopService();
    expectLastCall().andThrow(new IllegalStateException("Test exception"));
    expect(driver.driver()).andReturn("mock");
    replay(driver);

    configure();
    authorizer.close();
    verify(driver);
  }

  @Test
  public void testDefaultDriver() {
    EmbeddedAuthorizer tlsAuthorizer = new EmbeddedAuthorizer();
    tlsAuthorizer.configure(new AuthorizerOptions().withCertificateCache(new CertificateCache()));
    assertTrue(tlsAuthorizer.activeDriver() instanceof TlsAuthorizer);
    assertEquals("tls", tlsAuthorizer.driver());

    RequestContext unknown = RequestContext.tls("unknown", "default");
    try {
      tlsAuthorizer.checkPermission(unknown, Relation.CAN_VIEW, ObjectType.INSTANCE, "default", "", "c1");
      fail("should have failed");
    } catch (ForbiddenException e) {
      assertEquals("Client certificate not found", e.getMessage());
    }
    assertTrue(tlsAuthorizer.getPermissionChecker(RequestContext.internal(), Relation.CAN_VIEW, ObjectType.INSTANCE)
        .allows(AuthObject.instance("default", "c1")));
    tlsAuthorizer.close();
  }

  @Test(expected = UnknownDriverException.class)
  public void testUnknownDriver() {
    new EmbeddedAuthorizer(new AuthorizerRegistry())
        .configure(new AuthorizerOptions().withConfig(Collections.singletonMap(AuthorizerConfig.DRIVER_PROP, "rbac")));
  }

  @Test(expected = IllegalStateException.class)
  public void testNotConfigured() {
    new EmbeddedAuthorizer(new AuthorizerRegistry()).addProject(1L, "p1");
  }

  private void configure() {
    authorizer.configure(new AuthorizerOptions()
        .withConfig(Collections.singletonMap(AuthorizerConfig.DRIVER_PROP, "mock")));
  }

  private void verifyOpaqueForbidden(Runnable runnable) {
    try {
      runnable.run();
      fail("should have failed");
    } catch (ForbiddenException e) {
      assertEquals("Forbidden", e.getMessage());
    }
  }
}
