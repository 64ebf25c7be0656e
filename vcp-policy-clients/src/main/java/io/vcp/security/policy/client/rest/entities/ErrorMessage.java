// (Copyright) The vcp-security authors.

package io.vcp.security.policy.client.rest.entities;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generic JSON error message returned by the policy server.
 */
public class ErrorMessage {

  private final int errorCode;
  private final String message;

  public ErrorMessage(@JsonProperty("error_code") int errorCode,
                      @JsonProperty("message") String message) {
    this.errorCode = errorCode;
    this.message = message;
  }

  @JsonProperty("error_code")
  public int errorCode() {
    return errorCode;
  }

  @JsonProperty
  public String message() {
    return message;
  }
}
