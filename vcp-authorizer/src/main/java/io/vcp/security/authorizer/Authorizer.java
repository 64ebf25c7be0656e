// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer;

import io.vcp.security.authorizer.entitlement.ObjectType;
import io.vcp.security.authorizer.entitlement.Relation;

/**
 * Authorization API used by the control plane. A single driver implementing this interface
 * is active in a running daemon.
 * <p>
 * The entity hooks are invoked after an entity has been created, deleted or renamed elsewhere
 * in the system, so that drivers that keep state about entities can stay consistent with it.
 */
public interface Authorizer {

  /**
   * Returns the name of the driver.
   */
  String driver();

  /**
   * Releases any background resources held by the driver.
   */
  void stopService();

  /**
   * Checks that the caller of a request holds `relation` on the object identified by the
   * remaining arguments.
   *
   * @param requestContext Details of the caller
   * @param relation       Entitlement required for the request
   * @param objectType     Type of the entity being accessed
   * @param projectName    Project of the request, the default project is used if empty
   * @param location       Cluster member of the entity, used by storage volumes and buckets
   * @param pathArgs       Path elements identifying the entity, in resource path order
   * @throws ForbiddenException if the caller does not hold the relation
   * @throws InvalidArgumentException if the object cannot be constructed or the relation is
   *         not valid for the type
   */
  void checkPermission(RequestContext requestContext,
                       Relation relation,
                       ObjectType objectType,
                       String projectName,
                       String location,
                       String... pathArgs);

  /**
   * Returns a checker that can be used to filter a list of objects of `objectType` by whether
   * the caller holds `relation` on them.
   *
   * @throws ForbiddenException if the caller cannot list objects of the type at all
   */
  PermissionChecker getPermissionChecker(RequestContext requestContext, Relation relation, ObjectType objectType);

  void addProject(long projectId, String projectName);

  void deleteProject(long projectId, String projectName);

  void renameProject(long projectId, String oldName, String newName);

  void addCertificate(String fingerprint);

  void deleteCertificate(String fingerprint);

  void addStoragePool(String storagePoolName);

  void deleteStoragePool(String storagePoolName);

  void addImage(String projectName, String fingerprint);

  void deleteImage(String projectName, String fingerprint);

  void addImageAlias(String projectName, String imageAliasName);

  void deleteImageAlias(String projectName, String imageAliasName);

  void renameImageAlias(String projectName, String oldAliasName, String newAliasName);

  void addInstance(String projectName, String instanceName);

  void deleteInstance(String projectName, String instanceName);

  void renameInstance(String projectName, String oldInstanceName, String newInstanceName);

  void addNetwork(String projectName, String networkName);

  void deleteNetwork(String projectName, String networkName);

  void renameNetwork(String projectName, String oldNetworkName, String newNetworkName);

  void addNetworkZone(String projectName, String networkZoneName);

  void deleteNetworkZone(String projectName, String networkZoneName);

  void addNetworkAcl(String projectName, String networkAclName);

  void deleteNetworkAcl(String projectName, String networkAclName);

  void renameNetworkAcl(String projectName, String oldNetworkAclName, String newNetworkAclName);

  void addProfile(String projectName, String profileName);

  void deleteProfile(String projectName, String profileName);

  void renameProfile(String projectName, String oldProfileName, String newProfileName);

  void addStoragePoolVolume(String projectName, String storagePoolName, String volumeType,
                            String volumeName, String location);

  void deleteStoragePoolVolume(String projectName, String storagePoolName, String volumeType,
                               String volumeName, String location);

  void renameStoragePoolVolume(String projectName, String storagePoolName, String volumeType,
                               String oldVolumeName, String newVolumeName, String location);

  void addStorageBucket(String projectName, String storagePoolName, String bucketName, String location);

  void deleteStorageBucket(String projectName, String storagePoolName, String bucketName, String location);
}
