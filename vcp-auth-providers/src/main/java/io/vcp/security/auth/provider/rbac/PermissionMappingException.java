// (Copyright) The vcp-security authors.

package io.vcp.security.auth.provider.rbac;

import org.apache.kafka.common.KafkaException;

/**
 * Thrown when an object and relation have no coarse permission equivalent. Requests that
 * need such a check are not expected to reach the RBAC driver.
 */
public class PermissionMappingException extends KafkaException {

  public PermissionMappingException(String message) {
    super(message);
  }
}
