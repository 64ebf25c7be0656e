// (Copyright) The vcp-security authors.

package io.vcp.security.auth.provider.rbac;

import static io.vcp.security.auth.provider.rbac.RbacPermission.ADMIN;
import static io.vcp.security.auth.provider.rbac.RbacPermission.MANAGE_IMAGES;
import static io.vcp.security.auth.provider.rbac.RbacPermission.MANAGE_INSTANCES;
import static io.vcp.security.auth.provider.rbac.RbacPermission.MANAGE_NETWORKS;
import static io.vcp.security.auth.provider.rbac.RbacPermission.MANAGE_PROFILES;
import static io.vcp.security.auth.provider.rbac.RbacPermission.MANAGE_PROJECTS;
import static io.vcp.security.auth.provider.rbac.RbacPermission.MANAGE_STORAGE_VOLUMES;
import static io.vcp.security.auth.provider.rbac.RbacPermission.OPERATE_INSTANCES;
import static io.vcp.security.auth.provider.rbac.RbacPermission.VIEW;

import io.vcp.security.authorizer.entitlement.AuthObject;
import io.vcp.security.authorizer.entitlement.ObjectType;
import io.vcp.security.authorizer.entitlement.Relation;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Maps fine-grained relations to the coarse permission that grants them.
 */
public class RbacPermissionMapper {

  private static final Map<ObjectType, Map<Relation, RbacPermission>> PERMISSIONS = new EnumMap<>(ObjectType.class);

  static {
    map(ObjectType.SERVER, Relation.CAN_EDIT, ADMIN);
    map(ObjectType.SERVER, Relation.CAN_MANAGE_PERMISSIONS, ADMIN);
    map(ObjectType.SERVER, Relation.CAN_MANAGE_STORAGE_POOLS, ADMIN);
    map(ObjectType.SERVER, Relation.CAN_MANAGE_PROJECTS, ADMIN);
    map(ObjectType.SERVER, Relation.CAN_MANAGE_CERTIFICATES, ADMIN);
    map(ObjectType.SERVER, Relation.CAN_OVERRIDE_CLUSTER_TARGET_RESTRICTION, ADMIN);
    map(ObjectType.SERVER, Relation.CAN_VIEW_PRIVILEGED_EVENTS, ADMIN);
    map(ObjectType.SERVER, Relation.CAN_VIEW_WARNINGS, ADMIN);

    map(ObjectType.CERTIFICATE, Relation.CAN_EDIT, ADMIN);
    map(ObjectType.STORAGE_POOL, Relation.CAN_EDIT, ADMIN);

    // Identities and groups are managed by the policy server itself
    map(ObjectType.USER, Relation.CAN_VIEW, ADMIN);
    map(ObjectType.USER, Relation.CAN_EDIT, ADMIN);
    map(ObjectType.GROUP, Relation.CAN_VIEW, ADMIN);
    map(ObjectType.GROUP, Relation.CAN_EDIT, ADMIN);

    map(ObjectType.PROJECT, Relation.CAN_EDIT, MANAGE_PROJECTS);
    map(ObjectType.PROJECT, Relation.CAN_VIEW, VIEW);
    map(ObjectType.PROJECT, Relation.CAN_MANAGE_INSTANCES, MANAGE_INSTANCES);
    map(ObjectType.PROJECT, Relation.CAN_MANAGE_IMAGES, MANAGE_IMAGES);
    map(ObjectType.PROJECT, Relation.CAN_MANAGE_IMAGE_ALIASES, MANAGE_IMAGES);
    map(ObjectType.PROJECT, Relation.CAN_MANAGE_NETWORKS, MANAGE_NETWORKS);
    map(ObjectType.PROJECT, Relation.CAN_MANAGE_NETWORK_ACLS, MANAGE_NETWORKS);
    map(ObjectType.PROJECT, Relation.CAN_MANAGE_NETWORK_ZONES, MANAGE_NETWORKS);
    map(ObjectType.PROJECT, Relation.CAN_MANAGE_PROFILES, MANAGE_PROFILES);
    map(ObjectType.PROJECT, Relation.CAN_MANAGE_STORAGE_VOLUMES, MANAGE_STORAGE_VOLUMES);
    map(ObjectType.PROJECT, Relation.CAN_MANAGE_STORAGE_BUCKETS, MANAGE_STORAGE_VOLUMES);
    map(ObjectType.PROJECT, Relation.CAN_VIEW_OPERATIONS, VIEW);
    map(ObjectType.PROJECT, Relation.CAN_VIEW_EVENTS, VIEW);

    map(ObjectType.IMAGE, Relation.CAN_EDIT, MANAGE_IMAGES);
    map(ObjectType.IMAGE, Relation.CAN_VIEW, VIEW);
    map(ObjectType.IMAGE_ALIAS, Relation.CAN_EDIT, MANAGE_IMAGES);
    map(ObjectType.IMAGE_ALIAS, Relation.CAN_VIEW, VIEW);

    map(ObjectType.INSTANCE, Relation.CAN_EDIT, MANAGE_INSTANCES);
    map(ObjectType.INSTANCE, Relation.CAN_VIEW, VIEW);
    map(ObjectType.INSTANCE, Relation.CAN_UPDATE_STATE, OPERATE_INSTANCES);
    map(ObjectType.INSTANCE, Relation.CAN_MANAGE_BACKUPS, OPERATE_INSTANCES);
    map(ObjectType.INSTANCE, Relation.CAN_MANAGE_SNAPSHOTS, OPERATE_INSTANCES);
    map(ObjectType.INSTANCE, Relation.CAN_CONNECT_SFTP, OPERATE_INSTANCES);
    map(ObjectType.INSTANCE, Relation.CAN_ACCESS_FILES, OPERATE_INSTANCES);
    map(ObjectType.INSTANCE, Relation.CAN_ACCESS_CONSOLE, OPERATE_INSTANCES);
    map(ObjectType.INSTANCE, Relation.CAN_EXEC, OPERATE_INSTANCES);

    map(ObjectType.NETWORK, Relation.CAN_EDIT, MANAGE_NETWORKS);
    map(ObjectType.NETWORK, Relation.CAN_VIEW, VIEW);
    map(ObjectType.NETWORK_ACL, Relation.CAN_EDIT, MANAGE_NETWORKS);
    map(ObjectType.NETWORK_ACL, Relation.CAN_VIEW, VIEW);
    map(ObjectType.NETWORK_ZONE, Relation.CAN_EDIT, MANAGE_NETWORKS);
    map(ObjectType.NETWORK_ZONE, Relation.CAN_VIEW, VIEW);

    map(ObjectType.PROFILE, Relation.CAN_EDIT, MANAGE_PROFILES);
    map(ObjectType.PROFILE, Relation.CAN_VIEW, VIEW);

    map(ObjectType.STORAGE_BUCKET, Relation.CAN_EDIT, MANAGE_STORAGE_VOLUMES);
    map(ObjectType.STORAGE_BUCKET, Relation.CAN_VIEW, VIEW);
    map(ObjectType.STORAGE_VOLUME, Relation.CAN_EDIT, MANAGE_STORAGE_VOLUMES);
    map(ObjectType.STORAGE_VOLUME, Relation.CAN_MANAGE_BACKUPS, MANAGE_STORAGE_VOLUMES);
    map(ObjectType.STORAGE_VOLUME, Relation.CAN_MANAGE_SNAPSHOTS, MANAGE_STORAGE_VOLUMES);
    map(ObjectType.STORAGE_VOLUME, Relation.CAN_VIEW, VIEW);
  }

  private static void map(ObjectType objectType, Relation relation, RbacPermission permission) {
    PERMISSIONS.computeIfAbsent(objectType, t -> new EnumMap<>(Relation.class)).put(relation, permission);
  }

  /**
   * Returns the coarse permission required for `relation` on `object`.
   *
   * @throws PermissionMappingException if the pair has no equivalent permission
   */
  public static RbacPermission permission(AuthObject object, Relation relation) {
    RbacPermission permission = PERMISSIONS.getOrDefault(object.type(), Collections.emptyMap()).get(relation);
    if (permission == null)
      throw new PermissionMappingException(String.format(
          "Could not map object \"%s\" and entitlement \"%s\" to an RBAC permission", object, relation));
    return permission;
  }
}
