// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer.rebac;

import java.util.List;

/**
 * Relationship-based access control engine that evaluates relationship tuples against an
 * authorization model. Tuples persisted by the engine are combined with the contextual tuples
 * passed in with each request. Implementations report failures with unchecked exceptions.
 */
public interface RebacEngine {

  /**
   * Registers an authorization model, in the engine's modelling language, under `storeId`.
   */
  void writeAuthorizationModel(String storeId, String model);

  /**
   * Returns true if `tuple.user` holds `tuple.relation` on `tuple.object`.
   */
  boolean check(String storeId, TupleKey tuple, List<TupleKey> contextualTuples);

  /**
   * Returns all objects of `objectType`, in {@code <type>:<identifier>} form, on which `user`
   * holds `relation`.
   */
  List<String> listObjects(String storeId, String objectType, String relation, String user,
                           List<TupleKey> contextualTuples);
}
