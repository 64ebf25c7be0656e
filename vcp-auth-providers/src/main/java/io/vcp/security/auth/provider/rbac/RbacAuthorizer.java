// (Copyright) The vcp-security authors.

package io.vcp.security.auth.provider.rbac;

import io.vcp.security.authorizer.AuthenticationMethods;
import io.vcp.security.authorizer.ForbiddenException;
import io.vcp.security.authorizer.PermissionChecker;
import io.vcp.security.authorizer.RequestContext;
import io.vcp.security.authorizer.entitlement.AuthObject;
import io.vcp.security.authorizer.entitlement.ObjectType;
import io.vcp.security.authorizer.entitlement.Relation;
import io.vcp.security.authorizer.provider.AbstractAuthorizer;
import io.vcp.security.authorizer.provider.AuthorizerOptions;
import io.vcp.security.authorizer.provider.AuthorizerRegistry.BuiltInDrivers;
import io.vcp.security.authorizer.provider.ProjectLister;
import io.vcp.security.authorizer.provider.ProviderFailedException;
import io.vcp.security.authorizer.tls.TlsAuthorizer;
import io.vcp.security.authorizer.utils.AccessRules;
import io.vcp.security.policy.client.rest.PolicyRestClient;
import io.vcp.security.policy.client.rest.entities.ChangeStatus;
import io.vcp.security.policy.client.rest.entities.ProjectResource;
import io.vcp.security.policy.client.rest.entities.ResourcePost;
import io.vcp.security.policy.client.rest.entities.ResourcePostResponse;
import io.vcp.security.policy.client.rest.exceptions.RestClientException;
import java.io.EOFException;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.apache.kafka.common.config.ConfigException;
import org.apache.kafka.common.utils.ThreadUtils;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authorizes callers using coarse per-project permissions held by a remote policy server.
 * Projects are mirrored to the server as resources, permissions are fetched per user on
 * first use and the whole permission cache is flushed whenever the server reports a change.
 * TLS authenticated callers are authorized using their certificate restrictions.
 */
public class RbacAuthorizer extends AbstractAuthorizer {

  private static final Logger log = LoggerFactory.getLogger(RbacAuthorizer.class);

  private static final int HTTP_CONFLICT = 409;
  private static final int HTTP_GATEWAY_TIMEOUT = 504;
  private static final long CLOSE_TIMEOUT_MS = 30 * 1000L;

  private final Time time;
  private final AtomicBoolean alive;
  private final TlsAuthorizer tls;
  private final Object syncLock;

  // project name to resource identifier
  private final ReadWriteLock resourcesLock;
  private Map<String, String> resources;

  // user to project name to permissions, server-wide permissions are under ""
  private final ReadWriteLock permissionsLock;
  private final Map<String, Map<String, Set<RbacPermission>>> permissions;
  // incremented on every flush, fetches started before a flush are not cached
  private final AtomicLong cacheGeneration;

  private PolicyRestClient restClient;
  private ProjectLister projectLister;
  private ExecutorService executor;
  private long syncRetryBackoffMs;
  private long changesRetryBackoffMs;
  private String lastSyncId;
  private volatile String lastChange;

  public RbacAuthorizer() {
    this(Time.SYSTEM);
  }

  public RbacAuthorizer(Time time) {
    this.time = time;
    this.alive = new AtomicBoolean(false);
    this.tls = new TlsAuthorizer();
    this.syncLock = new Object();
    this.resourcesLock = new ReentrantReadWriteLock();
    this.resources = new HashMap<>();
    this.permissionsLock = new ReentrantReadWriteLock();
    this.permissions = new HashMap<>();
    this.cacheGeneration = new AtomicLong();
  }

  @Override
  public void load(AuthorizerOptions options) {
    if (options.projectLister() == null)
      throw new ConfigException("Missing projects hook for RBAC driver");
    this.projectLister = options.projectLister();

    RbacAuthorizerConfig config = new RbacAuthorizerConfig(options.config());
    this.syncRetryBackoffMs = config.syncRetryBackoffMs;
    this.changesRetryBackoffMs = config.changesRetryBackoffMs;

    tls.init(BuiltInDrivers.TLS.driverName());
    tls.load(options);

    this.restClient = createRestClient(options.config());

    alive.set(true);
    executor = Executors.newFixedThreadPool(2, ThreadUtils.createThreadFactory("vcp-rbac-%d", true));
    executor.submit(this::fullSync);
    executor.submit(this::watchChanges);
  }

  // Visible for testing
  protected PolicyRestClient createRestClient(Map<String, ?> configs) {
    return new PolicyRestClient(configs, time);
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

    if (requestContext.authenticationProtocol().equals(AuthenticationMethods.TLS)) {
      tls.checkPermission(requestContext, relation, objectType, projectName, location, pathArgs);
      return;
    }

    String username = requestContext.username();
    Map<String, Set<RbacPermission>> userPermissions = userPermissions(username);
    if (isAdmin(userPermissions))
      return;

    if (requestContext.isAllProjectsRequest())
      throw new ForbiddenException("User is not an administrator");

    if (AccessRules.isServerLevel(objectType)) {
      if (AccessRules.restrictedCallerAllowed(objectType, relation))
        return;
      throw new ForbiddenException("User is not an administrator");
    }

    RbacPermission permission = RbacPermissionMapper.permission(object, relation);
    if (!userPermissions.getOrDefault(object.project(), Collections.emptySet()).contains(permission))
      throw new ForbiddenException(String.format("User \"%s\" does not have permission \"%s\" on project \"%s\"",
          username, permission, object.project()));
  }

  @Override
  public PermissionChecker getPermissionChecker(RequestContext requestContext,
                                                Relation relation,
                                                ObjectType objectType) {
    objectType.validateRelation(relation);

    if (requestContext.isInternalOrUnix())
      return PermissionChecker.ALLOW_ALL;

    if (requestContext.authenticationProtocol().equals(AuthenticationMethods.TLS))
      return tls.getPermissionChecker(requestContext, relation, objectType);

    Map<String, Set<RbacPermission>> userPermissions = userPermissions(requestContext.username());
    if (isAdmin(userPermissions))
      return PermissionChecker.ALLOW_ALL;

    if (requestContext.isAllProjectsRequest())
      throw new ForbiddenException("User is not an administrator");

    if (AccessRules.isServerLevel(objectType)) {
      if (AccessRules.restrictedCallerAllowed(objectType, relation))
        return PermissionChecker.ALLOW_ALL;
      throw new ForbiddenException("User is not an administrator");
    }

    // Projects are filtered rather than rejected when listing projects
    if (!userPermissions.containsKey(requestContext.projectName()) && objectType != ObjectType.PROJECT)
      throw new ForbiddenException(String.format("User does not have permissions for project \"%s\"",
          requestContext.projectName()));

    return object -> {
      try {
        RbacPermission permission = RbacPermissionMapper.permission(object, relation);
        return userPermissions.getOrDefault(object.project(), Collections.emptySet()).contains(permission);
      } catch (PermissionMappingException e) {
        log.error("Could not convert object {} and entitlement {} to RBAC permission", object, relation, e);
        return false;
      }
    };
  }

  @Override
  public void addProject(long projectId, String projectName) {
    String identifier = String.valueOf(projectId);
    postResourcesOrFail(Collections.singletonList(new ProjectResource(identifier, projectName)),
        Collections.emptyList());

    resourcesLock.writeLock().lock();
    try {
      resources.put(projectName, identifier);
    } finally {
      resourcesLock.writeLock().unlock();
    }
  }

  @Override
  public void deleteProject(long projectId, String projectName) {
    String identifier = String.valueOf(projectId);
    postResourcesOrFail(Collections.emptyList(), Collections.singletonList(identifier));

    resourcesLock.writeLock().lock();
    try {
      resources.values().remove(identifier);
    } finally {
      resourcesLock.writeLock().unlock();
    }
  }

  @Override
  public void renameProject(long projectId, String oldName, String newName) {
    String identifier = String.valueOf(projectId);
    postResourcesOrFail(Collections.singletonList(new ProjectResource(identifier, newName)),
        Collections.emptyList());

    resourcesLock.writeLock().lock();
    try {
      resources.remove(oldName, identifier);
      resources.put(newName, identifier);
    } finally {
      resourcesLock.writeLock().unlock();
    }
  }

  @Override
  public void stopService() {
    if (!alive.getAndSet(false))
      return;

    executor.shutdownNow();
    try {
      if (!executor.awaitTermination(CLOSE_TIMEOUT_MS, TimeUnit.MILLISECONDS))
        log.warn("RBAC background tasks did not terminate within {} ms", CLOSE_TIMEOUT_MS);
    } catch (InterruptedException e) {
      log.debug("RBAC authorizer was interrupted while waiting to stop");
      Thread.currentThread().interrupt();
    } finally {
      restClient.close();
    }
  }

  private Map<String, Set<RbacPermission>> userPermissions(String username) {
    permissionsLock.readLock().lock();
    try {
      Map<String, Set<RbacPermission>> userPermissions = permissions.get(username);
      if (userPermissions != null)
        return userPermissions;
    } finally {
      permissionsLock.readLock().unlock();
    }

    try {
      return syncPermissions(username);
    } catch (IOException | RestClientException e) {
      throw new ProviderFailedException("Failed to sync user permissions with RBAC server", e);
    }
  }

  private static boolean isAdmin(Map<String, Set<RbacPermission>> userPermissions) {
    return userPermissions.getOrDefault("", Collections.emptySet()).contains(RbacPermission.ADMIN);
  }

  /**
   * Fetches the permissions of `username` and replaces the cached entry of the user.
   * Permissions of projects that are not known locally are dropped. If the cache is flushed
   * while the fetch is in progress, the result is returned without being cached.
   */
  Map<String, Set<RbacPermission>> syncPermissions(String username) throws IOException, RestClientException {
    long generation = cacheGeneration.get();
    Map<String, List<String>> remotePermissions = restClient.projectPermissionsForUser(username);
    if (remotePermissions == null)
      remotePermissions = Collections.emptyMap();
    boolean admin = syncAdmin(username);

    Map<String, Set<RbacPermission>> projectPermissions = new HashMap<>();
    resourcesLock.readLock().lock();
    try {
      for (Map.Entry<String, List<String>> entry : remotePermissions.entrySet()) {
        String resourceId = entry.getKey();
        String projectName = resourceId.isEmpty() ? "" : projectName(resourceId);
        if (projectName == null) {
          log.debug("Ignoring permissions of user {} on unknown project resource {}", username, resourceId);
          continue;
        }
        projectPermissions.put(projectName, toPermissions(entry.getValue()));
      }
    } finally {
      resourcesLock.readLock().unlock();
    }
    if (admin)
      projectPermissions.put("", EnumSet.of(RbacPermission.ADMIN));

    Map<String, Set<RbacPermission>> userPermissions = Collections.unmodifiableMap(projectPermissions);
    permissionsLock.writeLock().lock();
    try {
      if (cacheGeneration.get() == generation)
        permissions.put(username, userPermissions);
      else
        log.debug("Permissions cache was flushed while fetching permissions of user {}, not caching", username);
    } finally {
      permissionsLock.writeLock().unlock();
    }
    return userPermissions;
  }

  private String projectName(String resourceId) {
    for (Map.Entry<String, String> resource : resources.entrySet()) {
      if (resource.getValue().equals(resourceId))
        return resource.getKey();
    }
    return null;
  }

  private static Set<RbacPermission> toPermissions(List<String> permissionNames) {
    Set<RbacPermission> result = EnumSet.noneOf(RbacPermission.class);
    if (permissionNames != null) {
      for (String permissionName : permissionNames) {
        RbacPermission.fromName(permissionName).ifPresent(result::add);
      }
    }
    return result;
  }

  private boolean syncAdmin(String username) {
    try {
      Map<String, List<String>> serverPermissions = restClient.serverPermissionsForUser(username);
      return serverPermissions != null
          && serverPermissions.getOrDefault("", Collections.emptyList()).contains(RbacPermission.ADMIN.permissionName());
    } catch (Exception e) {
      log.debug("Failed to check admin permission of user {}", username, e);
      return false;
    }
  }

  /**
   * Mirrors all local projects to the policy server and replaces the local resource map.
   */
  void syncProjects() throws IOException, RestClientException {
    synchronized (syncLock) {
      List<ProjectResource> updates = new ArrayList<>();
      Map<String, String> resourcesMap = new HashMap<>();
      for (Map.Entry<Long, String> project : projectLister.projects().entrySet()) {
        String identifier = String.valueOf(project.getKey());
        updates.add(new ProjectResource(identifier, project.getValue()));
        resourcesMap.put(project.getValue(), identifier);
      }

      postResources(updates, Collections.emptyList(), true);

      resourcesLock.writeLock().lock();
      try {
        resources = resourcesMap;
      } finally {
        resourcesLock.writeLock().unlock();
      }
    }
  }

  /**
   * Posts a resource delta using the last sync id. Without a sync id, or if the server
   * rejects it as stale, a full sync is performed instead.
   */
  void postResources(List<ProjectResource> updates, List<String> removals, boolean force)
      throws IOException, RestClientException {
    synchronized (syncLock) {
      if (!force && (lastSyncId == null || lastSyncId.isEmpty())) {
        syncProjects();
        return;
      }

      ResourcePost resourcePost = new ResourcePost(force ? null : lastSyncId, updates, removals);
      ResourcePostResponse response;
      try {
        response = restClient.postProjectResources(resourcePost);
      } catch (RestClientException e) {
        if (e.status() == HTTP_CONFLICT && !force) {
          log.info("Resource sync id {} is out of date, synchronizing all projects", lastSyncId);
          syncProjects();
          return;
        }
        throw e;
      }
      lastSyncId = response == null ? null : response.syncId();
    }
  }

  private void postResourcesOrFail(List<ProjectResource> updates, List<String> removals) {
    try {
      postResources(updates, removals, false);
    } catch (IOException | RestClientException e) {
      throw new ProviderFailedException("Failed to update project resources on RBAC server", e);
    }
  }

  private void fullSync() {
    while (alive.get()) {
      try {
        syncProjects();
        log.info("Synchronized projects with RBAC server");
        return;
      } catch (Throwable e) {
        if (!alive.get())
          return;
        log.error("Failed to synchronize projects with RBAC server, retrying in {} ms", syncRetryBackoffMs, e);
        time.sleep(syncRetryBackoffMs);
      }
    }
  }

  private void watchChanges() {
    while (alive.get()) {
      try {
        ChangeStatus status = restClient.changes(lastChange);
        if (status == null) {
          log.error("RBAC server returned an empty change status, retrying");
          backoff();
          continue;
        }
        lastChange = status.lastChange();
        log.debug("RBAC change detected, flushing cache");
        flushCache();
      } catch (RestClientException e) {
        // The server or a load balancer timed out the long poll
        if (e.status() == HTTP_GATEWAY_TIMEOUT)
          continue;
        log.debug("RBAC server disconnected, re-connecting (status={})", e.status());
        backoff();
      } catch (IOException e) {
        if (!alive.get())
          return;
        if (isConnectionDrop(e))
          continue;
        log.error("Failed to connect to RBAC server, retrying", e);
        backoff();
      } catch (Throwable e) {
        if (!alive.get())
          return;
        log.error("Unexpected exception while watching RBAC changes, retrying", e);
        backoff();
      }
    }
  }

  private void backoff() {
    if (alive.get())
      time.sleep(changesRetryBackoffMs);
  }

  private static boolean isConnectionDrop(IOException e) {
    String message = e.getMessage();
    return e instanceof EOFException
        || e instanceof SocketTimeoutException
        || (message != null && (message.endsWith("EOF") || message.contains("end of file")));
  }

  void flushCache() {
    permissionsLock.writeLock().lock();
    try {
      log.info("Flushing RBAC permissions cache");
      cacheGeneration.incrementAndGet();
      permissions.clear();
    } finally {
      permissionsLock.writeLock().unlock();
    }
  }

  // Visible for testing
  Map<String, String> resources() {
    resourcesLock.readLock().lock();
    try {
      return new HashMap<>(resources);
    } finally {
      resourcesLock.readLock().unlock();
    }
  }

  // Visible for testing
  String lastSyncId() {
    synchronized (syncLock) {
      return lastSyncId;
    }
  }

  // Visible for testing
  String lastChange() {
    return lastChange;
  }

  // Visible for testing
  boolean isCached(String username) {
    permissionsLock.readLock().lock();
    try {
      return permissions.containsKey(username);
    } finally {
      permissionsLock.readLock().unlock();
    }
  }
}
