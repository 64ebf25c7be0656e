// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer.provider;

import io.vcp.security.authorizer.certificate.CertificateCache;
import io.vcp.security.authorizer.rebac.RebacEngine;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Options passed to a driver when it is loaded. Each driver only uses the options it needs.
 */
public class AuthorizerOptions {

  private Map<String, ?> config = Collections.emptyMap();
  private ProjectLister projectLister;
  private CertificateCache certificateCache;
  private RebacEngine rebacEngine;

  public AuthorizerOptions withConfig(Map<String, ?> config) {
    this.config = Collections.unmodifiableMap(new HashMap<>(config));
    return this;
  }

  /**
   * Required by drivers that mirror projects to a remote authority.
   */
  public AuthorizerOptions withProjectLister(ProjectLister projectLister) {
    this.projectLister = projectLister;
    return this;
  }

  public AuthorizerOptions withCertificateCache(CertificateCache certificateCache) {
    this.certificateCache = certificateCache;
    return this;
  }

  /**
   * Required by drivers that delegate to a relationship-based access control engine.
   */
  public AuthorizerOptions withRebacEngine(RebacEngine rebacEngine) {
    this.rebacEngine = rebacEngine;
    return this;
  }

  public Map<String, ?> config() {
    return config;
  }

  public ProjectLister projectLister() {
    return projectLister;
  }

  public CertificateCache certificateCache() {
    return certificateCache;
  }

  public RebacEngine rebacEngine() {
    return rebacEngine;
  }
}
