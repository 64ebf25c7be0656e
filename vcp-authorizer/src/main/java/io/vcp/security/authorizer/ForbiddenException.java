// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer;

import org.apache.kafka.common.errors.ApiException;

public class ForbiddenException extends ApiException {

  public ForbiddenException(String message) {
    super(message);
  }

  public ForbiddenException(String message, Throwable cause) {
    super(message, cause);
  }
}
