// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer.provider;

import org.apache.kafka.common.config.ConfigException;

public class UnknownDriverException extends ConfigException {

  public UnknownDriverException(String driverName) {
    super("Unknown driver " + driverName);
  }
}
