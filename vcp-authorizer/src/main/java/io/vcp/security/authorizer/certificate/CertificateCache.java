// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer.certificate;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe in-memory view of the trust store. The owner of the trust store replaces the
 * contents whenever certificates change, drivers only read from it.
 */
public class CertificateCache {

  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private Map<String, CertificateRecord> certificates = Collections.emptyMap();

  public void setCertificates(Collection<CertificateRecord> records) {
    Map<String, CertificateRecord> newCertificates = new HashMap<>(records.size());
    records.forEach(record -> newCertificates.put(record.fingerprint(), record));

    lock.writeLock().lock();
    try {
      certificates = newCertificates;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Returns a copy of all certificates keyed by fingerprint.
   */
  public Map<String, CertificateRecord> certificates() {
    lock.readLock().lock();
    try {
      return new HashMap<>(certificates);
    } finally {
      lock.readLock().unlock();
    }
  }

  public Optional<CertificateRecord> certificate(String fingerprint) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(certificates.get(fingerprint));
    } finally {
      lock.readLock().unlock();
    }
  }
}
