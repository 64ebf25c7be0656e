// (Copyright) The vcp-security authors.

package io.vcp.security.policy.client.provider;

import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.apache.kafka.common.config.ConfigException;

public class BuiltInAuthProviders {

  public enum BasicAuthCredentialProviders {
    USER_INFO, // user:password from client configs
    NONE       // basic authentication is disabled
  }

  public static Set<String> builtInBasicAuthCredentialProviders() {
    return Stream.of(BasicAuthCredentialProviders.values())
        .map(BasicAuthCredentialProviders::name)
        .collect(Collectors.toCollection(TreeSet::new));
  }

  public static BasicAuthCredentialProvider loadBasicAuthCredentialProvider(String name) {
    if (name.equals(BasicAuthCredentialProviders.NONE.name()))
      return new EmptyBasicAuthCredentialProvider();

    ServiceLoader<BasicAuthCredentialProvider> providers = ServiceLoader.load(BasicAuthCredentialProvider.class);
    for (BasicAuthCredentialProvider provider : providers) {
      if (provider.providerName().equals(name))
        return provider;
    }
    throw new ConfigException("BasicAuthCredentialProvider not found for " + name);
  }

  private static class EmptyBasicAuthCredentialProvider implements BasicAuthCredentialProvider {

    @Override
    public void configure(Map<String, ?> configs) {
    }

    @Override
    public String providerName() {
      return BasicAuthCredentialProviders.NONE.name();
    }

    @Override
    public String getUserInfo() {
      return null;
    }
  }
}
