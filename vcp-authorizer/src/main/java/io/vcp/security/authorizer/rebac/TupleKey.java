// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer.rebac;

import java.util.Objects;

/**
 * Relationship tuple {@code (user, relation, object)}. Users and objects are in
 * {@code <type>:<identifier>} form.
 */
public class TupleKey {

  private final String user;
  private final String relation;
  private final String object;

  public TupleKey(String user, String relation, String object) {
    this.user = Objects.requireNonNull(user, "user");
    this.relation = Objects.requireNonNull(relation, "relation");
    this.object = Objects.requireNonNull(object, "object");
  }

  public String user() {
    return user;
  }

  public String relation() {
    return relation;
  }

  public String object() {
    return object;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TupleKey)) {
      return false;
    }

    TupleKey that = (TupleKey) o;
    return Objects.equals(user, that.user) &&
        Objects.equals(relation, that.relation) &&
        Objects.equals(object, that.object);
  }

  @Override
  public int hashCode() {
    return Objects.hash(user, relation, object);
  }

  @Override
  public String toString() {
    return "TupleKey(" + user + " " + relation + " " + object + ")";
  }
}
