// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer;

import io.vcp.security.authorizer.entitlement.ObjectType;
import io.vcp.security.authorizer.entitlement.Relation;
import io.vcp.security.authorizer.provider.AuthorizerDriver;
import io.vcp.security.authorizer.provider.AuthorizerOptions;
import io.vcp.security.authorizer.provider.AuthorizerRegistry;
import io.vcp.security.authorizer.provider.ProviderFailedException;
import java.io.Closeable;
import java.util.Arrays;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authorizer used by the control plane. Loads the configured driver and delegates to it. Failures
 * of the driver other than denials are logged and reported to callers as denials, so that no
 * internal details are returned to clients.
 */
public class EmbeddedAuthorizer implements Authorizer, Closeable {

  protected static final Logger log = LoggerFactory.getLogger("vcp.authorizer.logger");

  private static final String FORBIDDEN_MESSAGE = "Forbidden";

  private final AuthorizerRegistry registry;
  private AuthorizerDriver driver;

  public EmbeddedAuthorizer() {
    this(AuthorizerRegistry.builtIn());
  }

  public EmbeddedAuthorizer(AuthorizerRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  public void configure(AuthorizerOptions options) {
    AuthorizerConfig authorizerConfig = new AuthorizerConfig(options.config());
    log.debug("Loading authorizer with config {}", authorizerConfig);
    driver = registry.load(authorizerConfig.driver, options);
  }

  // Visibility for testing
  AuthorizerDriver activeDriver() {
    return driver;
  }

  @Override
  public String driver() {
    return loadedDriver().driver();
  }

  @Override
  public void stopService() {
    loadedDriver().stopService();
  }

  @Override
  public void checkPermission(RequestContext requestContext,
                              Relation relation,
                              ObjectType objectType,
                              String projectName,
                              String location,
                              String... pathArgs) {
    try {
      loadedDriver().checkPermission(requestContext, relation, objectType, projectName, location, pathArgs);
      logAuditMessage(requestContext, true, relation, objectType, projectName, pathArgs);
    } catch (ForbiddenException e) {
      logAuditMessage(requestContext, false, relation, objectType, projectName, pathArgs);
      throw e;
    } catch (InvalidArgumentException e) {
      log.error("Invalid permission check of relation = {} on {} {} {} with protocol = {}",
          relation, objectType, projectName, Arrays.toString(pathArgs), requestContext.authenticationProtocol(), e);
      throw e;
    } catch (ProviderFailedException e) {
      log.error("Authorization driver has failed checking relation = {} on {} {} {} with protocol = {}",
          relation, objectType, projectName, Arrays.toString(pathArgs), requestContext.authenticationProtocol(), e);
      throw new ForbiddenException(FORBIDDEN_MESSAGE);
    } catch (Throwable t) {
      log.error("Authorization failed with unexpected exception checking relation = {} on {} {} {} with protocol = {}",
          relation, objectType, projectName, Arrays.toString(pathArgs), requestContext.authenticationProtocol(), t);
      throw new ForbiddenException(FORBIDDEN_MESSAGE);
    }
  }

  @Override
  public PermissionChecker getPermissionChecker(RequestContext requestContext,
                                                Relation relation,
                                                ObjectType objectType) {
    try {
      return loadedDriver().getPermissionChecker(requestContext, relation, objectType);
    } catch (ForbiddenException e) {
      log.info("Principal = {} is Denied listing objects of type = {} with relation = {}",
          requestContext.username(), objectType, relation);
      throw e;
    } catch (InvalidArgumentException e) {
      log.error("Invalid permission checker request of relation = {} on type = {} with protocol = {}",
          relation, objectType, requestContext.authenticationProtocol(), e);
      throw e;
    } catch (ProviderFailedException e) {
      log.error("Authorization driver has failed creating checker for relation = {} on type = {} with protocol = {}",
          relation, objectType, requestContext.authenticationProtocol(), e);
      throw new ForbiddenException(FORBIDDEN_MESSAGE);
    } catch (Throwable t) {
      log.error("Authorization failed with unexpected exception for relation = {} on type = {} with protocol = {}",
          relation, objectType, requestContext.authenticationProtocol(), t);
      throw new ForbiddenException(FORBIDDEN_MESSAGE);
    }
  }

  @Override
  public void addProject(long projectId, String projectName) {
    loadedDriver().addProject(projectId, projectName);
  }

  @Override
  public void deleteProject(long projectId, String projectName) {
    loadedDriver().deleteProject(projectId, projectName);
  }

  @Override
  public void renameProject(long projectId, String oldName, String newName) {
    loadedDriver().renameProject(projectId, oldName, newName);
  }

  @Override
  public void addCertificate(String fingerprint) {
    loadedDriver().addCertificate(fingerprint);
  }

  @Override
  public void deleteCertificate(String fingerprint) {
    loadedDriver().deleteCertificate(fingerprint);
  }

  @Override
  public void addStoragePool(String storagePoolName) {
    loadedDriver().addStoragePool(storagePoolName);
  }

  @Override
  public void deleteStoragePool(String storagePoolName) {
    loadedDriver().deleteStoragePool(storagePoolName);
  }

  @Override
  public void addImage(String projectName, String fingerprint) {
    loadedDriver().addImage(projectName, fingerprint);
  }

  @Override
  public void deleteImage(String projectName, String fingerprint) {
    loadedDriver().deleteImage(projectName, fingerprint);
  }

  @Override
  public void addImageAlias(String projectName, String imageAliasName) {
    loadedDriver().addImageAlias(projectName, imageAliasName);
  }

  @Override
  public void deleteImageAlias(String projectName, String imageAliasName) {
    loadedDriver().deleteImageAlias(projectName, imageAliasName);
  }

  @Override
  public void renameImageAlias(String projectName, String oldAliasName, String newAliasName) {
    loadedDriver().renameImageAlias(projectName, oldAliasName, newAliasName);
  }

  @Override
  public void addInstance(String projectName, String instanceName) {
    loadedDriver().addInstance(projectName, instanceName);
  }

  @Override
  public void deleteInstance(String projectName, String instanceName) {
    loadedDriver().deleteInstance(projectName, instanceName);
  }

  @Override
  public void renameInstance(String projectName, String oldInstanceName, String newInstanceName) {
    loadedDriver().renameInstance(projectName, oldInstanceName, newInstanceName);
  }

  @Override
  public void addNetwork(String projectName, String networkName) {
    loadedDriver().addNetwork(projectName, networkName);
  }

  @Override
  public void deleteNetwork(String projectName, String networkName) {
    loadedDriver().deleteNetwork(projectName, networkName);
  }

  @Override
  public void renameNetwork(String projectName, String oldNetworkName, String newNetworkName) {
    loadedDriver().renameNetwork(projectName, oldNetworkName, newNetworkName);
  }

  @Override
  public void addNetworkZone(String projectName, String networkZoneName) {
    loadedDriver().addNetworkZone(projectName, networkZoneName);
  }

  @Override
  public void deleteNetworkZone(String projectName, String networkZoneName) {
    loadedDriver().deleteNetworkZone(projectName, networkZoneName);
  }

  @Override
  public void addNetworkAcl(String projectName, String networkAclName) {
    loadedDriver().addNetworkAcl(projectName, networkAclName);
  }

  @Override
  public void deleteNetworkAcl(String projectName, String networkAclName) {
    loadedDriver().deleteNetworkAcl(projectName, networkAclName);
  }

  @Override
  public void renameNetworkAcl(String projectName, String oldNetworkAclName, String newNetworkAclName) {
    loadedDriver().renameNetworkAcl(projectName, oldNetworkAclName, newNetworkAclName);
  }

  @Override
  public void addProfile(String projectName, String profileName) {
    loadedDriver().addProfile(projectName, profileName);
  }

  @Override
  public void deleteProfile(String projectName, String profileName) {
    loadedDriver().deleteProfile(projectName, profileName);
  }

  @Override
  public void renameProfile(String projectName, String oldProfileName, String newProfileName) {
    loadedDriver().renameProfile(projectName, oldProfileName, newProfileName);
  }

  @Override
  public void addStoragePoolVolume(String projectName, String storagePoolName, String volumeType,
                                   String volumeName, String location) {
    loadedDriver().addStoragePoolVolume(projectName, storagePoolName, volumeType, volumeName, location);
  }

  @Override
  public void deleteStoragePoolVolume(String projectName, String storagePoolName, String volumeType,
                                      String volumeName, String location) {
    loadedDriver().deleteStoragePoolVolume(projectName, storagePoolName, volumeType, volumeName, location);
  }

  @Override
  public void renameStoragePoolVolume(String projectName, String storagePoolName, String volumeType,
                                      String oldVolumeName, String newVolumeName, String location) {
    loadedDriver().renameStoragePoolVolume(projectName, storagePoolName, volumeType, oldVolumeName, newVolumeName, location);
  }

  @Override
  public void addStorageBucket(String projectName, String storagePoolName, String bucketName, String location) {
    loadedDriver().addStorageBucket(projectName, storagePoolName, bucketName, location);
  }

  @Override
  public void deleteStorageBucket(String projectName, String storagePoolName, String bucketName, String location) {
    loadedDriver().deleteStorageBucket(projectName, storagePoolName, bucketName, location);
  }

  @Override
  public void close() {
    if (driver == null)
      return;
    try {
      driver.stopService();
    } catch (Throwable t) {
      // Don't block daemon shutdown if the driver fails to stop
      log.error("Failed to stop authorization driver {} cleanly", driver.driver(), t);
    }
  }

  private AuthorizerDriver loadedDriver() {
    if (driver == null)
      throw new IllegalStateException("Authorizer has not been configured");
    return driver;
  }

  /**
   * Log using a format similar to the audit messages of request handlers:
   * <pre>
   *  Principal = $username is $result Relation = $relation using protocol = $protocol on object = $type $project $path
   * </pre>
   */
  private void logAuditMessage(RequestContext requestContext, boolean authorized, Relation relation,
                               ObjectType objectType, String projectName, String... pathArgs) {
    String logMessage = "Principal = {} is {} Relation = {} using protocol = {} on object = {} {} {}";
    Object[] args = {requestContext.username(), authorized ? "Allowed" : "Denied", relation,
        requestContext.authenticationProtocol(), objectType, projectName, Arrays.toString(pathArgs)};
    if (authorized) {
      log.debug(logMessage, args);
    } else {
      log.info(logMessage, args);
    }
  }
}
