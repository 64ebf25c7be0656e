// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer.certificate;

import io.vcp.security.authorizer.ForbiddenException;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Restrictions of the client certificate used by a TLS authenticated caller.
 */
public class CertificateDetails {

  private final CertificateType type;
  private final boolean unrestricted;
  private final List<String> projects;
  private final List<String> groups;

  CertificateDetails(CertificateType type, boolean unrestricted, List<String> projects, List<String> groups) {
    this.type = type;
    this.unrestricted = unrestricted;
    this.projects = projects;
    this.groups = groups;
  }

  /**
   * Looks up the certificate with the given fingerprint. Only client and metrics certificates
   * may be used by callers.
   *
   * @param trustCaCertificates If true, a certificate that is not in the trust store is assumed to
   *                            have been validated against the CA and is treated as unrestricted
   * @throws ForbiddenException if the certificate is not found
   */
  public static CertificateDetails resolve(CertificateCache cache, String fingerprint, boolean trustCaCertificates) {
    Optional<CertificateRecord> record = cache.certificate(fingerprint);
    if (record.isPresent() && record.get().type() == CertificateType.CLIENT) {
      CertificateRecord client = record.get();
      if (!client.restricted())
        return new CertificateDetails(CertificateType.CLIENT, true, Collections.emptyList(), Collections.emptyList());
      return new CertificateDetails(CertificateType.CLIENT, false, client.projects(), client.groups());
    }

    if (record.isPresent() && record.get().type() == CertificateType.METRICS)
      return new CertificateDetails(CertificateType.METRICS, false, Collections.emptyList(), Collections.emptyList());

    if (trustCaCertificates)
      return new CertificateDetails(CertificateType.CLIENT, true, Collections.emptyList(), Collections.emptyList());

    throw new ForbiddenException("Client certificate not found");
  }

  public CertificateType type() {
    return type;
  }

  public boolean unrestricted() {
    return unrestricted;
  }

  public List<String> projects() {
    return projects;
  }

  public List<String> groups() {
    return groups;
  }

  @Override
  public String toString() {
    return "CertificateDetails(" +
        "type=" + type +
        ", unrestricted=" + unrestricted +
        ", projects=" + projects +
        ", groups=" + groups +
        ')';
  }
}
