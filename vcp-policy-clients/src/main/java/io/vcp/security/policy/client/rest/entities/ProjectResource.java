// (Copyright) The vcp-security authors.

package io.vcp.security.policy.client.rest.entities;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * A project as known to the policy server: its numeric identifier and its current name.
 */
public class ProjectResource {

  private final String identifier;
  private final String name;

  @JsonCreator
  public ProjectResource(@JsonProperty("identifier") String identifier,
                         @JsonProperty("name") String name) {
    this.identifier = identifier;
    this.name = name;
  }

  public ProjectResource(long id, String name) {
    this(String.valueOf(id), name);
  }

  @JsonProperty
  public String identifier() {
    return identifier;
  }

  @JsonProperty
  public String name() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ProjectResource)) {
      return false;
    }
    ProjectResource that = (ProjectResource) o;
    return Objects.equals(identifier, that.identifier) && Objects.equals(name, that.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(identifier, name);
  }

  @Override
  public String toString() {
    return "ProjectResource(identifier=" + identifier + ", name=" + name + ")";
  }
}
