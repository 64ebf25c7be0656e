// (Copyright) The vcp-security authors.

package io.vcp.security.auth.provider.rbac;

import java.util.Optional;

/**
 * Coarse permissions granted by the policy server. Server-wide permissions are reported
 * under the empty resource identifier, all others per project.
 */
public enum RbacPermission {
  ADMIN("admin"),
  VIEW("view"),
  MANAGE_PROJECTS("manage-projects"),
  MANAGE_INSTANCES("manage-containers"),
  MANAGE_IMAGES("manage-images"),
  MANAGE_NETWORKS("manage-networks"),
  MANAGE_PROFILES("manage-profiles"),
  MANAGE_STORAGE_VOLUMES("manage-storage-volumes"),
  OPERATE_INSTANCES("operate-containers");

  private final String permissionName;

  RbacPermission(String permissionName) {
    this.permissionName = permissionName;
  }

  public String permissionName() {
    return permissionName;
  }

  /**
   * Returns the permission with the given wire name, or empty if this version does not know it.
   */
  public static Optional<RbacPermission> fromName(String permissionName) {
    for (RbacPermission permission : values()) {
      if (permission.permissionName.equals(permissionName))
        return Optional.of(permission);
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return permissionName;
  }
}
