// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer;

import org.apache.kafka.common.errors.ApiException;

/**
 * Malformed authorization object, unknown object type or relation that is not valid
 * for an object type. Never retried.
 */
public class InvalidArgumentException extends ApiException {

  public InvalidArgumentException(String message) {
    super(message);
  }
}
