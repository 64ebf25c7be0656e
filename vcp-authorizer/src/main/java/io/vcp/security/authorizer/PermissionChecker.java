// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer;

import io.vcp.security.authorizer.entitlement.AuthObject;

/**
 * Filter returned by {@link Authorizer#getPermissionChecker(RequestContext, io.vcp.security.authorizer.entitlement.Relation,
 * io.vcp.security.authorizer.entitlement.ObjectType)} for a single list operation. Checkers evaluate
 * against a snapshot of permission state and must not be reused across requests.
 */
public interface PermissionChecker {

  PermissionChecker ALLOW_ALL = object -> true;

  /**
   * Returns true if the caller holds the checked relation on the object.
   */
  boolean allows(AuthObject object);
}
