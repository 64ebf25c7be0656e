// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer.entitlement;

import io.vcp.security.authorizer.InvalidArgumentException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Authorization object of the form {@code <type>:<identifier>}, where the identifier is a
 * '/' delimited path of elements that uniquely identify a resource. For project-scoped types,
 * the first element is the project name. '%' and '/' within an element are escaped as
 * {@code %25} and {@code %2F}.
 * <p>
 * Examples:
 * <ul>
 *   <li>{@code instance:default/c1}</li>
 *   <li>{@code storage_pool:local}</li>
 *   <li>{@code storage_volume:default/local/custom/vol1/node1}</li>
 * </ul>
 * Instances can only be created through the validating factory methods.
 */
public class AuthObject {

  public static final String DEFAULT_PROJECT = "default";
  public static final String SERVER_NAME = "vcp";

  private static final String TYPE_DELIMITER = ":";
  private static final String ELEMENT_DELIMITER = "/";
  private static final String ESCAPED_DELIMITER = "%2F";
  private static final String ESCAPE = "%";
  private static final String ESCAPED_ESCAPE = "%25";

  private final ObjectType type;
  private final String project;
  private final List<String> elements;
  private final String value;

  private AuthObject(ObjectType type, String project, List<String> elements, String value) {
    this.type = type;
    this.project = project;
    this.elements = Collections.unmodifiableList(elements);
    this.value = value;
  }

  /**
   * Creates an object of the given type. Elements must be provided in the order in which they
   * appear in the resource path.
   *
   * @throws InvalidArgumentException if the number of elements does not match the type or a
   *         required project is missing
   */
  public static AuthObject of(ObjectType type, String project, String... elements) {
    Objects.requireNonNull(type, "type");
    List<String> escaped = new ArrayList<>(elements.length + 1);
    if (type.requiresProject())
      escaped.add(escape(project == null ? "" : project));
    for (String element : elements)
      escaped.add(escape(Objects.requireNonNull(element, "element")));

    String value = type.value() + TYPE_DELIMITER + String.join(ELEMENT_DELIMITER, escaped);
    return parse(value);
  }

  /**
   * Parses the string form of an object.
   *
   * @throws InvalidArgumentException if the type is unknown or the identifier is not valid for the type
   */
  public static AuthObject parse(String value) {
    if (value == null)
      throw new InvalidArgumentException("Authorization object must not be null");
    int index = value.indexOf(TYPE_DELIMITER);
    String typeName = index < 0 ? value : value.substring(0, index);
    String identifier = index < 0 ? "" : value.substring(index + 1);
    ObjectType type = ObjectType.fromValue(typeName);

    String project = "";
    List<String> elements = new ArrayList<>();
    String[] components = identifier.isEmpty() ? new String[0] : identifier.split(ELEMENT_DELIMITER, -1);
    for (int i = 0; i < components.length; i++) {
      if (type.requiresProject() && i == 0)
        project = unescape(components[i]);
      else
        elements.add(unescape(components[i]));
    }

    if (type.requiresProject() && project.isEmpty())
      throw new InvalidArgumentException(String.format("Authorization objects of type \"%s\" require a project", type));
    if (elements.size() != type.elementCount())
      throw new InvalidArgumentException(String.format(
          "Authorization objects of type \"%s\" require %d components to be uniquely identifiable",
          type, type.elementCount()));

    return new AuthObject(type, project, elements, value);
  }

  /**
   * Creates the object named by a permission check on an entity. The server object takes no
   * arguments, the project object is named by its first path argument if one is given and the
   * location of storage volumes and buckets is appended as their last element.
   */
  public static AuthObject fromEntity(ObjectType type, String project, String location, String... pathArgs) {
    String projectName = project == null || project.isEmpty() ? DEFAULT_PROJECT : project;
    switch (type) {
      case SERVER:
        return server();
      case PROJECT:
        return project(pathArgs.length > 0 ? pathArgs[0] : projectName);
      case STORAGE_BUCKET:
      case STORAGE_VOLUME:
        String[] elements = Arrays.copyOf(pathArgs, pathArgs.length + 1);
        elements[pathArgs.length] = location == null ? "" : location;
        return of(type, projectName, elements);
      default:
        return of(type, projectName, pathArgs);
    }
  }

  public static AuthObject server() {
    return of(ObjectType.SERVER, null, SERVER_NAME);
  }

  public static AuthObject user(String userName) {
    return of(ObjectType.USER, null, userName);
  }

  public static AuthObject group(String groupName) {
    return of(ObjectType.GROUP, null, groupName);
  }

  public static AuthObject certificate(String fingerprint) {
    return of(ObjectType.CERTIFICATE, null, fingerprint);
  }

  public static AuthObject storagePool(String poolName) {
    return of(ObjectType.STORAGE_POOL, null, poolName);
  }

  public static AuthObject project(String projectName) {
    return of(ObjectType.PROJECT, projectName);
  }

  public static AuthObject image(String projectName, String fingerprint) {
    return of(ObjectType.IMAGE, projectName, fingerprint);
  }

  public static AuthObject imageAlias(String projectName, String aliasName) {
    return of(ObjectType.IMAGE_ALIAS, projectName, aliasName);
  }

  public static AuthObject instance(String projectName, String instanceName) {
    return of(ObjectType.INSTANCE, projectName, instanceName);
  }

  public static AuthObject network(String projectName, String networkName) {
    return of(ObjectType.NETWORK, projectName, networkName);
  }

  public static AuthObject networkAcl(String projectName, String aclName) {
    return of(ObjectType.NETWORK_ACL, projectName, aclName);
  }

  public static AuthObject networkZone(String projectName, String zoneName) {
    return of(ObjectType.NETWORK_ZONE, projectName, zoneName);
  }

  public static AuthObject profile(String projectName, String profileName) {
    return of(ObjectType.PROFILE, projectName, profileName);
  }

  public static AuthObject storageBucket(String projectName, String poolName, String bucketName, String location) {
    return of(ObjectType.STORAGE_BUCKET, projectName, poolName, bucketName, location);
  }

  public static AuthObject storageVolume(String projectName, String poolName, String volumeType,
                                         String volumeName, String location) {
    return of(ObjectType.STORAGE_VOLUME, projectName, poolName, volumeType, volumeName, location);
  }

  public ObjectType type() {
    return type;
  }

  /**
   * Returns the project of this object or an empty string if the type is not project-scoped.
   */
  public String project() {
    return project;
  }

  public List<String> elements() {
    return elements;
  }

  /**
   * Returns the identifier of this object without the type prefix.
   */
  public String ref() {
    return value.substring(value.indexOf(TYPE_DELIMITER) + 1);
  }

  private static String escape(String s) {
    return s.replace(ESCAPE, ESCAPED_ESCAPE).replace(ELEMENT_DELIMITER, ESCAPED_DELIMITER);
  }

  private static String unescape(String s) {
    return s.replace(ESCAPED_DELIMITER, ELEMENT_DELIMITER).replace(ESCAPED_ESCAPE, ESCAPE);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AuthObject)) {
      return false;
    }

    AuthObject that = (AuthObject) o;
    return value.equals(that.value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return value;
  }
}
