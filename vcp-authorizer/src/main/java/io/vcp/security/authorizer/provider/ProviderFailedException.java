// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer.provider;

import org.apache.kafka.common.errors.ApiException;

/**
 * An authorization backend could not be reached or failed to evaluate a request.
 */
public class ProviderFailedException extends ApiException {

  public ProviderFailedException(String message) {
    super(message);
  }

  public ProviderFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
