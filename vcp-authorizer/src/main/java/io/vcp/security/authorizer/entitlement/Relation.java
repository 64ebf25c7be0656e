// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer.entitlement;

import io.vcp.security.authorizer.InvalidArgumentException;

/**
 * Entitlement that a caller may hold on an authorization object. Each relation is serialized
 * using its lower-case value, e.g. {@code can_view}.
 */
public enum Relation {
  // Relations that apply to all resources
  CAN_EDIT("can_edit"),
  CAN_VIEW("can_view"),

  // Server entitlements
  ADMIN("admin"),
  OPERATOR("operator"),
  VIEWER("viewer"),
  CAN_MANAGE_PERMISSIONS("can_manage_permissions"),
  CAN_MANAGE_STORAGE_POOLS("can_manage_storage_pools"),
  CAN_MANAGE_PROJECTS("can_manage_projects"),
  CAN_VIEW_RESOURCES("can_view_resources"),
  CAN_MANAGE_CERTIFICATES("can_manage_certificates"),
  CAN_VIEW_METRICS("can_view_metrics"),
  CAN_OVERRIDE_CLUSTER_TARGET_RESTRICTION("can_override_cluster_target_restriction"),
  CAN_VIEW_PRIVILEGED_EVENTS("can_view_privileged_events"),
  CAN_VIEW_WARNINGS("can_view_warnings"),

  // Project entitlements
  MANAGER("manager"),
  CAN_MANAGE_IMAGES("can_manage_images"),
  CAN_MANAGE_IMAGE_ALIASES("can_manage_image_aliases"),
  CAN_MANAGE_INSTANCES("can_manage_instances"),
  CAN_MANAGE_NETWORKS("can_manage_networks"),
  CAN_MANAGE_NETWORK_ACLS("can_manage_network_acls"),
  CAN_MANAGE_NETWORK_ZONES("can_manage_network_zones"),
  CAN_MANAGE_PROFILES("can_manage_profiles"),
  CAN_MANAGE_STORAGE_VOLUMES("can_manage_storage_volumes"),
  CAN_MANAGE_STORAGE_BUCKETS("can_manage_storage_buckets"),
  CAN_VIEW_OPERATIONS("can_view_operations"),
  CAN_VIEW_EVENTS("can_view_events"),

  // Instance entitlements
  USER("user"),
  CAN_UPDATE_STATE("can_update_state"),
  CAN_CONNECT_SFTP("can_connect_sftp"),
  CAN_ACCESS_FILES("can_access_files"),
  CAN_ACCESS_CONSOLE("can_access_console"),
  CAN_EXEC("can_exec"),

  // Instance and storage volume entitlements
  CAN_MANAGE_SNAPSHOTS("can_manage_snapshots"),
  CAN_MANAGE_BACKUPS("can_manage_backups"),

  // Relations between objects, only used in relationship tuples
  SERVER("server"),
  PROJECT("project"),
  MEMBER("member");

  private final String value;

  Relation(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static Relation fromValue(String value) {
    for (Relation relation : values()) {
      if (relation.value.equals(value))
        return relation;
    }
    throw new InvalidArgumentException("Unknown relation \"" + value + "\"");
  }

  @Override
  public String toString() {
    return value;
  }
}
