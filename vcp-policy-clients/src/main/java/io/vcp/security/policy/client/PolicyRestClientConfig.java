// (Copyright) The vcp-security authors.

package io.vcp.security.policy.client;

import static org.apache.kafka.common.config.ConfigDef.Range.atLeast;

import io.vcp.security.policy.client.provider.BuiltInAuthProviders;
import io.vcp.security.policy.client.provider.BuiltInAuthProviders.BasicAuthCredentialProviders;
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

public class PolicyRestClientConfig extends AbstractConfig {

  private static final ConfigDef CONFIG;

  public static final String API_URLS_PROP = "rbac.api.urls";
  private static final String API_URLS_DOC = "Comma separated list of policy server urls to"
      + " which this client connects. Requests fail over to the next url if a server cannot be reached."
      + " For ex: https://rbac1.example.com,https://rbac2.example.com";

  public static final String BASIC_AUTH_CREDENTIALS_PROVIDER_PROP = "basic.auth.credentials.provider";
  public static final String BASIC_AUTH_CREDENTIALS_PROVIDER_DEFAULT = BasicAuthCredentialProviders.NONE.name();
  private static final String BASIC_AUTH_CREDENTIALS_PROVIDER_PROP_DOC = "User credentials provider for the HTTP"
      + " basic authentication. Supported providers are " + BuiltInAuthProviders.builtInBasicAuthCredentialProviders()
      + ". Basic access authentication is disabled by default.";

  public static final String BASIC_AUTH_USER_INFO_PROP = "basic.auth.user.info";
  private static final String BASIC_AUTH_USER_INFO_PROP_DOC = "Basic user credentials info in the format user:password."
      + " This is required for " + BasicAuthCredentialProviders.USER_INFO.name() + " provider.";

  public static final String REQUEST_TIMEOUT_MS_CONFIG = "request.timeout.ms";
  private static final String REQUEST_TIMEOUT_MS_DOC = "The configuration controls the maximum amount of time the client"
      + " will wait for the response of each request to the policy server, across all urls.";

  public static final String HTTP_REQUEST_TIMEOUT_MS_CONFIG = "http.request.timeout.ms";
  private static final String HTTP_REQUEST_TIMEOUT_MS_DOC = "The configuration controls the maximum amount of time the"
      + " client will wait for the response of a http request. If the response is not received before the timeout"
      + " elapses the client will resend the request to the next url or fail the request if all urls are exhausted."
      + " This value should be less than or equal to " + REQUEST_TIMEOUT_MS_CONFIG + " config";

  public static final String CHANGES_TIMEOUT_MS_CONFIG = "rbac.changes.timeout.ms";
  private static final String CHANGES_TIMEOUT_MS_DOC = "The maximum amount of time the client waits for the"
      + " policy server to report a change on the long-poll change notification endpoint.";

  static {
    CONFIG = new ConfigDef()
        .define(API_URLS_PROP, Type.LIST, Importance.HIGH,
            API_URLS_DOC)
        .define(BASIC_AUTH_CREDENTIALS_PROVIDER_PROP, Type.STRING, BASIC_AUTH_CREDENTIALS_PROVIDER_DEFAULT,
            Importance.HIGH, BASIC_AUTH_CREDENTIALS_PROVIDER_PROP_DOC)
        .define(BASIC_AUTH_USER_INFO_PROP, Type.PASSWORD, "", Importance.MEDIUM, BASIC_AUTH_USER_INFO_PROP_DOC)
        .define(REQUEST_TIMEOUT_MS_CONFIG, Type.INT, 30 * 1000, atLeast(0), Importance.MEDIUM,
            REQUEST_TIMEOUT_MS_DOC)
        .define(HTTP_REQUEST_TIMEOUT_MS_CONFIG, Type.INT, 10 * 1000, atLeast(0), Importance.MEDIUM,
            HTTP_REQUEST_TIMEOUT_MS_DOC)
        .define(CHANGES_TIMEOUT_MS_CONFIG, Type.INT, 10 * 60 * 1000, atLeast(0), Importance.LOW,
            CHANGES_TIMEOUT_MS_DOC);
  }

  public PolicyRestClientConfig(Map<?, ?> props) {
    super(CONFIG, props);
    validate();
  }

  private void validate() {
    if (getList(API_URLS_PROP).isEmpty())
      throw new ConfigException("Missing required policy server url list " + API_URLS_PROP);
    if (getInt(HTTP_REQUEST_TIMEOUT_MS_CONFIG) > getInt(REQUEST_TIMEOUT_MS_CONFIG))
      throw new ConfigException(HTTP_REQUEST_TIMEOUT_MS_CONFIG +
          " config value should be less than or equal to " + REQUEST_TIMEOUT_MS_CONFIG);
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
