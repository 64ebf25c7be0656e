// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer.provider;

import java.util.Map;

/**
 * Enumerates the projects that currently exist.
 */
@FunctionalInterface
public interface ProjectLister {

  /**
   * Returns project names keyed by project id.
   */
  Map<Long, String> projects();
}
