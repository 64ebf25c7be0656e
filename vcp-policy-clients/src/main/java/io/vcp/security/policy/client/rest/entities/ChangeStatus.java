// (Copyright) The vcp-security authors.

package io.vcp.security.policy.client.rest.entities;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response of the long-poll change endpoint. The token is passed back on the next poll.
 */
public class ChangeStatus {

  private final String lastChange;

  @JsonCreator
  public ChangeStatus(@JsonProperty("last-change") String lastChange) {
    this.lastChange = lastChange;
  }

  @JsonProperty("last-change")
  public String lastChange() {
    return lastChange;
  }
}
