// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer;

import io.vcp.security.authorizer.provider.AuthorizerRegistry;
import io.vcp.security.authorizer.provider.AuthorizerRegistry.BuiltInDrivers;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.apache.kafka.common.config.AbstractConfig;
import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigException;
import org.apache.kafka.common.utils.Utils;

public class AuthorizerConfig extends AbstractConfig {

  private static final ConfigDef CONFIG;

  public static final String DRIVER_PROP = "vcp.authorizer.driver";
  private static final String DRIVER_DEFAULT = BuiltInDrivers.TLS.driverName();
  private static final String DRIVER_DOC = "Authorization driver used to authorize requests."
      + " Built-in drivers are " + AuthorizerRegistry.builtInDrivers()
      + ". Certificate restrictions from the trust store are used by default.";

  public static final String TLS_TRUST_CA_CERTIFICATES_PROP = "vcp.authorizer.tls.trust.ca.certificates";
  private static final boolean TLS_TRUST_CA_CERTIFICATES_DEFAULT = false;
  private static final String TLS_TRUST_CA_CERTIFICATES_DOC = "Boolean flag that indicates if client"
      + " certificates that are not in the trust store are trusted without restrictions. Enable this"
      + " when clients are authenticated using certificates signed by a trusted CA.";

  static {
    CONFIG = new ConfigDef()
        .define(DRIVER_PROP, Type.STRING, DRIVER_DEFAULT,
            Importance.HIGH, DRIVER_DOC)
        .define(TLS_TRUST_CA_CERTIFICATES_PROP, Type.BOOLEAN, TLS_TRUST_CA_CERTIFICATES_DEFAULT,
            Importance.MEDIUM, TLS_TRUST_CA_CERTIFICATES_DOC);
  }

  public final String driver;
  public final boolean trustCaCertificates;

  public AuthorizerConfig(Map<?, ?> props) {
    super(CONFIG, props);

    driver = getString(DRIVER_PROP);
    if (driver == null || driver.trim().isEmpty())
      throw new ConfigException("No authorization driver specified");
    trustCaCertificates = getBoolean(TLS_TRUST_CA_CERTIFICATES_PROP);
  }

  @Override
  public String toString() {
    return Utils.mkString(values(), "", "", "=", "%n\t");
  }

  public static void main(String[] args) throws Exception {
    try (PrintStream out = args.length == 0 ? System.out
        : new PrintStream(new FileOutputStream(args[0]), false, StandardCharsets.UTF_8.name())) {
      out.println(CONFIG.toHtmlTable());
      if (out != System.out) {
        out.close();
      }
    }
  }
}
