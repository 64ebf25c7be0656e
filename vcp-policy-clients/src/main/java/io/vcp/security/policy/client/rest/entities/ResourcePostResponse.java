// (Copyright) The vcp-security authors.

package io.vcp.security.policy.client.rest.entities;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class ResourcePostResponse {

  private final String syncId;

  @JsonCreator
  public ResourcePostResponse(@JsonProperty("sync-id") String syncId) {
    this.syncId = syncId;
  }

  @JsonProperty("sync-id")
  public String syncId() {
    return syncId;
  }
}
