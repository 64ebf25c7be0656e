// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer.entitlement;

import static io.vcp.security.authorizer.entitlement.Relation.ADMIN;
import static io.vcp.security.authorizer.entitlement.Relation.CAN_ACCESS_CONSOLE;
import static io.vcp.security.authorizer.entitlement.Relation.CAN_ACCESS_FILES;
import static io.vcp.security.authorizer.entitlement.Relation.CAN_CONNECT_SFTP;
import static io.vcp.security.authorizer.entitlement.Relation.CAN_EDIT;
import static io.vcp.security.authorizer.entitlement.Relation.CAN_EXEC;
import static io.vcp.security.authorizer.entitlement.Relation.CAN_MANAGE_BACKUPS;
import static io.vcp.security.authorizer.entitlement.Relation.CAN_MANAGE_CERTIFICATES;
import static io.vcp.security.authorizer.entitlement.Relation.CAN_MANAGE_IMAGES;
import static io.vcp.security.authorizer.entitlement.Relation.CAN_MANAGE_IMAGE_ALIASES;
import static io.vcp.security.authorizer.entitlement.Relation.CAN_MANAGE_INSTANCES;
import static io.vcp.security.authorizer.entitlement.Relation.CAN_MANAGE_NETWORKS;
import static io.vcp.security.authorizer.entitlement.Relation.CAN_MANAGE_NETWORK_ACLS;
import static io.vcp.security.authorizer.entitlement.Relation.CAN_MANAGE_NETWORK_ZONES;
import static io.vcp.security.authorizer.entitlement.Relation.CAN_MANAGE_PERMISSIONS;
import static io.vcp.security.authorizer.entitlement.Relation.CAN_MANAGE_PROFILES;
import static io.vcp.security.authorizer.entitlement.Relation.CAN_MANAGE_PROJECTS;
import static io.vcp.security.authorizer.entitlement.Relation.CAN_MANAGE_SNAPSHOTS;
import static io.vcp.security.authorizer.entitlement.Relation.CAN_MANAGE_STORAGE_BUCKETS;
import static io.vcp.security.authorizer.entitlement.Relation.CAN_MANAGE_STORAGE_POOLS;
import static io.vcp.security.authorizer.entitlement.Relation.CAN_MANAGE_STORAGE_VOLUMES;
import static io.vcp.security.authorizer.entitlement.Relation.CAN_OVERRIDE_CLUSTER_TARGET_RESTRICTION;
import static io.vcp.security.authorizer.entitlement.Relation.CAN_UPDATE_STATE;
import static io.vcp.security.authorizer.entitlement.Relation.CAN_VIEW;
import static io.vcp.security.authorizer.entitlement.Relation.CAN_VIEW_EVENTS;
import static io.vcp.security.authorizer.entitlement.Relation.CAN_VIEW_METRICS;
import static io.vcp.security.authorizer.entitlement.Relation.CAN_VIEW_OPERATIONS;
import static io.vcp.security.authorizer.entitlement.Relation.CAN_VIEW_PRIVILEGED_EVENTS;
import static io.vcp.security.authorizer.entitlement.Relation.CAN_VIEW_RESOURCES;
import static io.vcp.security.authorizer.entitlement.Relation.CAN_VIEW_WARNINGS;
import static io.vcp.security.authorizer.entitlement.Relation.MANAGER;
import static io.vcp.security.authorizer.entitlement.Relation.OPERATOR;
import static io.vcp.security.authorizer.entitlement.Relation.VIEWER;

import io.vcp.security.authorizer.InvalidArgumentException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Type of resource that may be the target of an authorization decision. Each type declares
 * the number of path elements that uniquely identify an object of the type, whether the
 * first element is a project name and the relations that are valid for the type.
 */
public enum ObjectType {
  USER("user", 1, false, CAN_VIEW, CAN_EDIT),
  GROUP("group", 1, false, CAN_VIEW, CAN_EDIT),
  SERVER("server", 1, false,
      ADMIN, OPERATOR, VIEWER, CAN_EDIT, CAN_VIEW, CAN_MANAGE_PERMISSIONS, CAN_MANAGE_STORAGE_POOLS,
      CAN_MANAGE_PROJECTS, CAN_VIEW_RESOURCES, CAN_MANAGE_CERTIFICATES, CAN_VIEW_METRICS,
      CAN_OVERRIDE_CLUSTER_TARGET_RESTRICTION, CAN_VIEW_PRIVILEGED_EVENTS, CAN_VIEW_WARNINGS),
  CERTIFICATE("certificate", 1, false, CAN_VIEW, CAN_EDIT),
  STORAGE_POOL("storage_pool", 1, false, CAN_VIEW, CAN_EDIT),
  PROJECT("project", 0, true,
      MANAGER, OPERATOR, VIEWER, CAN_VIEW, CAN_EDIT, CAN_MANAGE_IMAGES, CAN_MANAGE_IMAGE_ALIASES, CAN_MANAGE_INSTANCES,
      CAN_MANAGE_NETWORKS, CAN_MANAGE_NETWORK_ACLS, CAN_MANAGE_NETWORK_ZONES, CAN_MANAGE_PROFILES,
      CAN_MANAGE_STORAGE_VOLUMES, CAN_MANAGE_STORAGE_BUCKETS, CAN_VIEW_OPERATIONS, CAN_VIEW_EVENTS),
  IMAGE("image", 1, true, CAN_VIEW, CAN_EDIT),
  IMAGE_ALIAS("image_alias", 1, true, CAN_VIEW, CAN_EDIT),
  INSTANCE("instance", 1, true,
      MANAGER, OPERATOR, Relation.USER, VIEWER, CAN_EDIT, CAN_VIEW, CAN_UPDATE_STATE, CAN_MANAGE_SNAPSHOTS,
      CAN_MANAGE_BACKUPS, CAN_CONNECT_SFTP, CAN_ACCESS_FILES, CAN_ACCESS_CONSOLE, CAN_EXEC),
  NETWORK("network", 1, true, CAN_VIEW, CAN_EDIT),
  NETWORK_ACL("network_acl", 1, true, CAN_VIEW, CAN_EDIT),
  NETWORK_ZONE("network_zone", 1, true, CAN_VIEW, CAN_EDIT),
  PROFILE("profile", 1, true, CAN_VIEW, CAN_EDIT),
  // pool, bucket, location
  STORAGE_BUCKET("storage_bucket", 3, true, CAN_VIEW, CAN_EDIT),
  // pool, volume type, volume, location
  STORAGE_VOLUME("storage_volume", 4, true,
      CAN_VIEW, CAN_EDIT, CAN_MANAGE_SNAPSHOTS, CAN_MANAGE_BACKUPS);

  private final String value;
  private final int elementCount;
  private final boolean requiresProject;
  private final List<Relation> relations;

  ObjectType(String value, int elementCount, boolean requiresProject, Relation... relations) {
    this.value = value;
    this.elementCount = elementCount;
    this.requiresProject = requiresProject;
    this.relations = Collections.unmodifiableList(Arrays.asList(relations));
  }

  public String value() {
    return value;
  }

  /**
   * Number of identifier elements, excluding the project, of objects of this type.
   */
  public int elementCount() {
    return elementCount;
  }

  public boolean requiresProject() {
    return requiresProject;
  }

  public List<Relation> relations() {
    return relations;
  }

  public void validateRelation(Relation relation) {
    if (!relations.contains(relation))
      throw new InvalidArgumentException(String.format("No such relation \"%s\" for objects of type \"%s\"",
          relation, value));
  }

  public static ObjectType fromValue(String value) {
    for (ObjectType type : values()) {
      if (type.value.equals(value))
        return type;
    }
    throw new InvalidArgumentException("Invalid object type \"" + value + "\"");
  }

  @Override
  public String toString() {
    return value;
  }
}
