// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer.provider;

/**
 * Base class for drivers that keep no state about entities. All entity hooks are no-ops.
 */
public abstract class AbstractAuthorizer implements AuthorizerDriver {

  private String driverName;

  @Override
  public void init(String driverName) {
    this.driverName = driverName;
  }

  @Override
  public String driver() {
    return driverName;
  }

  @Override
  public void stopService() {
  }

  @Override
  public void addProject(long projectId, String projectName) {
  }

  @Override
  public void deleteProject(long projectId, String projectName) {
  }

  @Override
  public void renameProject(long projectId, String oldName, String newName) {
  }

  @Override
  public void addCertificate(String fingerprint) {
  }

  @Override
  public void deleteCertificate(String fingerprint) {
  }

  @Override
  public void addStoragePool(String storagePoolName) {
  }

  @Override
  public void deleteStoragePool(String storagePoolName) {
  }

  @Override
  public void addImage(String projectName, String fingerprint) {
  }

  @Override
  public void deleteImage(String projectName, String fingerprint) {
  }

  @Override
  public void addImageAlias(String projectName, String imageAliasName) {
  }

  @Override
  public void deleteImageAlias(String projectName, String imageAliasName) {
  }

  @Override
  public void renameImageAlias(String projectName, String oldAliasName, String newAliasName) {
  }

  @Override
  public void addInstance(String projectName, String instanceName) {
  }

  @Override
  public void deleteInstance(String projectName, String instanceName) {
  }

  @Override
  public void renameInstance(String projectName, String oldInstanceName, String newInstanceName) {
  }

  @Override
  public void addNetwork(String projectName, String networkName) {
  }

  @Override
  public void deleteNetwork(String projectName, String networkName) {
  }

  @Override
  public void renameNetwork(String projectName, String oldNetworkName, String newNetworkName) {
  }

  @Override
  public void addNetworkZone(String projectName, String networkZoneName) {
  }

  @Override
  public void deleteNetworkZone(String projectName, String networkZoneName) {
  }

  @Override
  public void addNetworkAcl(String projectName, String networkAclName) {
  }

  @Override
  public void deleteNetworkAcl(String projectName, String networkAclName) {
  }

  @Override
  public void renameNetworkAcl(String projectName, String oldNetworkAclName, String newNetworkAclName) {
  }

  @Override
  public void addProfile(String projectName, String profileName) {
  }

  @Override
  public void deleteProfile(String projectName, String profileName) {
  }

  @Override
  public void renameProfile(String projectName, String oldProfileName, String newProfileName) {
  }

  @Override
  public void addStoragePoolVolume(String projectName, String storagePoolName, String volumeType,
                                   String volumeName, String location) {
  }

  @Override
  public void deleteStoragePoolVolume(String projectName, String storagePoolName, String volumeType,
                                      String volumeName, String location) {
  }

  @Override
  public void renameStoragePoolVolume(String projectName, String storagePoolName, String volumeType,
                                      String oldVolumeName, String newVolumeName, String location) {
  }

  @Override
  public void addStorageBucket(String projectName, String storagePoolName, String bucketName, String location) {
  }

  @Override
  public void deleteStorageBucket(String projectName, String storagePoolName, String bucketName, String location) {
  }
}
