// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer.certificate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Trust store entry of a certificate. A certificate with neither a project list nor a group
 * list is unrestricted. An empty list is a restriction that grants nothing.
 */
public class CertificateRecord {

  private final String fingerprint;
  private final CertificateType type;
  private final List<String> projects;
  private final List<String> groups;

  public CertificateRecord(String fingerprint,
                           CertificateType type,
                           Collection<String> projects,
                           Collection<String> groups) {
    this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint");
    this.type = Objects.requireNonNull(type, "type");
    this.projects = projects == null ? null : Collections.unmodifiableList(new ArrayList<>(projects));
    this.groups = groups == null ? null : Collections.unmodifiableList(new ArrayList<>(groups));
  }

  public static CertificateRecord unrestricted(String fingerprint, CertificateType type) {
    return new CertificateRecord(fingerprint, type, null, null);
  }

  public static CertificateRecord restricted(String fingerprint, Collection<String> projects) {
    return new CertificateRecord(fingerprint, CertificateType.CLIENT, projects, null);
  }

  public String fingerprint() {
    return fingerprint;
  }

  public CertificateType type() {
    return type;
  }

  public boolean restricted() {
    return projects != null || groups != null;
  }

  public List<String> projects() {
    return projects == null ? Collections.emptyList() : projects;
  }

  public List<String> groups() {
    return groups == null ? Collections.emptyList() : groups;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CertificateRecord)) {
      return false;
    }

    CertificateRecord that = (CertificateRecord) o;
    return Objects.equals(fingerprint, that.fingerprint) &&
        type == that.type &&
        Objects.equals(projects, that.projects) &&
        Objects.equals(groups, that.groups);
  }

  @Override
  public int hashCode() {
    return Objects.hash(fingerprint, type, projects, groups);
  }

  @Override
  public String toString() {
    return "CertificateRecord(" +
        "fingerprint='" + fingerprint + '\'' +
        ", type=" + type +
        ", projects=" + projects +
        ", groups=" + groups +
        ')';
  }
}
