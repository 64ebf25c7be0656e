// (Copyright) The vcp-security authors.

package io.vcp.security.policy.client.provider;

import io.vcp.security.policy.client.PolicyRestClientConfig;
import java.util.Map;
import org.apache.kafka.common.config.ConfigException;
import org.apache.kafka.common.config.types.Password;

public class UserInfoCredentialProvider implements BasicAuthCredentialProvider {

  private String userInfo;

  @Override
  public String providerName() {
    return BuiltInAuthProviders.BasicAuthCredentialProviders.USER_INFO.name();
  }

  @Override
  public void configure(Map<String, ?> configs) {
    Object value = configs.get(PolicyRestClientConfig.BASIC_AUTH_USER_INFO_PROP);
    userInfo = value instanceof Password ? ((Password) value).value() : (String) value;
    if (userInfo != null && !userInfo.isEmpty()) {
      return;
    }

    throw new ConfigException(PolicyRestClientConfig.BASIC_AUTH_USER_INFO_PROP + " must be provided when " +
        PolicyRestClientConfig.BASIC_AUTH_CREDENTIALS_PROVIDER_PROP + " is set to " + providerName());
  }

  @Override
  public String getUserInfo() {
    return userInfo;
  }
}
