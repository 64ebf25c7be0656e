// (Copyright) The vcp-security authors.

package io.vcp.security.policy.client.rest.entities;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.List;

/**
 * Incremental or full project resource update. A null sync id asks the server to replace
 * its whole project view with the updates of this request.
 */
public class ResourcePost {

  private final String lastSyncId;
  private final List<ProjectResource> updates;
  private final List<String> removals;

  @JsonCreator
  public ResourcePost(@JsonProperty("last-sync-id") String lastSyncId,
                      @JsonProperty("updates") List<ProjectResource> updates,
                      @JsonProperty("removals") List<String> removals) {
    this.lastSyncId = lastSyncId;
    this.updates = updates == null ? Collections.emptyList() : updates;
    this.removals = removals == null ? Collections.emptyList() : removals;
  }

  @JsonProperty("last-sync-id")
  @JsonInclude(JsonInclude.Include.ALWAYS)
  public String lastSyncId() {
    return lastSyncId;
  }

  @JsonProperty
  public List<ProjectResource> updates() {
    return updates;
  }

  @JsonProperty
  public List<String> removals() {
    return removals;
  }

  @Override
  public String toString() {
    return "ResourcePost(lastSyncId=" + lastSyncId + ", updates=" + updates + ", removals=" + removals + ")";
  }
}
