// (Copyright) The vcp-security authors.

package io.vcp.security.auth.provider.rbac;

import io.vcp.security.policy.client.PolicyRestClientConfig;
import io.vcp.security.policy.client.rest.PolicyRestClient;
import io.vcp.security.policy.client.rest.entities.ChangeStatus;
import io.vcp.security.policy.client.rest.entities.ResourcePost;
import io.vcp.security.policy.client.rest.entities.ResourcePostResponse;
import io.vcp.security.policy.client.rest.exceptions.RestClientException;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Policy server client that keeps resources and permissions in memory. Long polls for
 * changes time out with a 504 after a short wait unless a change is queued.
 */
class MockPolicyRestClient extends PolicyRestClient {

  final List<ResourcePost> posts = new CopyOnWriteArrayList<>();
  final Map<String, Map<String, List<String>>> projectPermissions = new ConcurrentHashMap<>();
  final Map<String, Map<String, List<String>>> serverPermissions = new ConcurrentHashMap<>();
  final AtomicInteger projectPermissionRequests = new AtomicInteger();
  final AtomicInteger serverPermissionRequests = new AtomicInteger();
  final AtomicInteger pendingConflicts = new AtomicInteger();
  final BlockingQueue<String> changes = new LinkedBlockingQueue<>();
  final List<String> changeRequests = new CopyOnWriteArrayList<>();
  private final AtomicInteger syncIds = new AtomicInteger();

  volatile boolean projectPermissionsUnavailable;
  volatile boolean serverPermissionsUnavailable;
  volatile boolean closed;
  volatile boolean emptyChanges;
  // when set, permission fetches count down `fetchStarted` and block until released
  volatile CountDownLatch fetchStarted;
  volatile CountDownLatch fetchReleased;

  MockPolicyRestClient() {
    super(Collections.singletonMap(PolicyRestClientConfig.API_URLS_PROP, "http://localhost:8443"));
  }

  @Override
  public ResourcePostResponse postProjectResources(ResourcePost resourcePost) throws RestClientException {
    posts.add(resourcePost);
    if (resourcePost.lastSyncId() != null && pendingConflicts.getAndUpdate(n -> Math.max(0, n - 1)) > 0)
      throw new RestClientException("Sync id mismatch", 409, 40901);
    return new ResourcePostResponse("sync-" + syncIds.incrementAndGet());
  }

  @Override
  public Map<String, List<String>> projectPermissionsForUser(String username) throws IOException {
    projectPermissionRequests.incrementAndGet();
    if (projectPermissionsUnavailable)
      throw new IOException("Connection refused");
    CountDownLatch released = fetchReleased;
    if (released != null) {
      fetchStarted.countDown();
      try {
        if (!released.await(10, TimeUnit.SECONDS))
          throw new IOException("Permission fetch was not released");
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IOException("Interrupted while fetching permissions", e);
      }
    }
    return projectPermissions.getOrDefault(username, Collections.emptyMap());
  }

  @Override
  public Map<String, List<String>> serverPermissionsForUser(String username) throws IOException {
    serverPermissionRequests.incrementAndGet();
    if (serverPermissionsUnavailable)
      throw new IOException("Connection refused");
    return serverPermissions.getOrDefault(username, Collections.emptyMap());
  }

  @Override
  public ChangeStatus changes(String lastChange) throws IOException, RestClientException {
    changeRequests.add(String.valueOf(lastChange));
    if (emptyChanges)
      return null;
    try {
      String change = changes.poll(50, TimeUnit.MILLISECONDS);
      if (change == null)
        throw new RestClientException("Gateway Timeout", 504, 504);
      return new ChangeStatus(change);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while waiting for changes", e);
    }
  }

  @Override
  public void close() {
    closed = true;
    super.close();
  }

  long forcedPosts() {
    return posts.stream().filter(p -> p.lastSyncId() == null).count();
  }
}
