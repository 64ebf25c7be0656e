// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer.certificate;

public enum CertificateType {
  CLIENT(1, "client"),
  SERVER(2, "server"),
  METRICS(3, "metrics");

  private final int code;
  private final String apiName;

  CertificateType(int code, String apiName) {
    this.code = code;
    this.apiName = apiName;
  }

  public int code() {
    return code;
  }

  public String apiName() {
    return apiName;
  }

  public static CertificateType fromApiName(String apiName) {
    for (CertificateType type : values()) {
      if (type.apiName.equals(apiName))
        return type;
    }
    throw new IllegalArgumentException("Unknown certificate type " + apiName);
  }

  @Override
  public String toString() {
    return apiName;
  }
}
