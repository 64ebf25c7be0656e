// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer.utils;

import io.vcp.security.authorizer.entitlement.ObjectType;
import io.vcp.security.authorizer.entitlement.Relation;

/**
 * Access to server level objects for callers that are not administrators. These objects are not
 * scoped to a project, so restricted callers may only view them.
 */
public final class AccessRules {

  private AccessRules() {
  }

  public static boolean isServerLevel(ObjectType objectType) {
    return objectType == ObjectType.SERVER
        || objectType == ObjectType.STORAGE_POOL
        || objectType == ObjectType.CERTIFICATE;
  }

  /**
   * Returns true if a restricted caller is granted `relation` on server level objects of the type.
   */
  public static boolean restrictedCallerAllowed(ObjectType objectType, Relation relation) {
    switch (objectType) {
      case SERVER:
        return relation == Relation.CAN_VIEW
            || relation == Relation.CAN_VIEW_RESOURCES
            || relation == Relation.CAN_VIEW_METRICS;
      case STORAGE_POOL:
      case CERTIFICATE:
        return relation == Relation.CAN_VIEW;
      default:
        return false;
    }
  }
}
