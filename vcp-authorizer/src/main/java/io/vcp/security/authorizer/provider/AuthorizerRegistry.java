// (Copyright) The vcp-security authors.

package io.vcp.security.authorizer.provider;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.config.ConfigException;
import org.apache.kafka.common.utils.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps driver names to driver constructors. A registry is created once at startup and used
 * to load the single active driver.
 */
public class AuthorizerRegistry {

  private static final Logger log = LoggerFactory.getLogger(AuthorizerRegistry.class);

  public enum BuiltInDrivers {
    TLS("tls"),          // Restrictions of client certificates in the trust store
    RBAC("rbac"),        // Roles managed by a remote policy server
    OPENFGA("openfga");  // Relationship-based access control engine

    private final String driverName;

    BuiltInDrivers(String driverName) {
      this.driverName = driverName;
    }

    public String driverName() {
      return driverName;
    }
  }

  private final Map<String, Supplier<AuthorizerDriver>> drivers;

  public AuthorizerRegistry() {
    this.drivers = new HashMap<>();
  }

  public static Set<String> builtInDrivers() {
    return Utils.mkSet(BuiltInDrivers.values()).stream()
        .map(BuiltInDrivers::driverName).collect(Collectors.toCollection(TreeSet::new));
  }

  /**
   * Returns a registry containing every driver registered on the class path through
   * {@link AuthorizerDriverFactory}.
   */
  public static AuthorizerRegistry builtIn() {
    AuthorizerRegistry registry = new AuthorizerRegistry();
    ServiceLoader<AuthorizerDriverFactory> factories = ServiceLoader.load(AuthorizerDriverFactory.class);
    for (AuthorizerDriverFactory factory : factories) {
      registry.register(factory.driverName(), factory::create);
    }
    return registry;
  }

  public AuthorizerRegistry register(String driverName, Supplier<AuthorizerDriver> constructor) {
    if (drivers.putIfAbsent(driverName, constructor) != null)
      throw new IllegalStateException("Driver already registered: " + driverName);
    return this;
  }

  public Set<String> drivers() {
    return Collections.unmodifiableSet(new TreeSet<>(drivers.keySet()));
  }

  /**
   * Creates, initializes and loads the driver registered with `driverName`.
   *
   * @throws UnknownDriverException if no driver is registered with the name
   * @throws ConfigException if the driver options are invalid
   * @throws KafkaException if the driver failed to load
   */
  public AuthorizerDriver load(String driverName, AuthorizerOptions options) {
    Supplier<AuthorizerDriver> constructor = drivers.get(driverName);
    if (constructor == null)
      throw new UnknownDriverException(driverName);

    AuthorizerDriver driver = constructor.get();
    try {
      driver.init(driverName);
    } catch (ConfigException e) {
      throw e;
    } catch (Exception e) {
      throw new KafkaException("Failed to initialize authorizer " + driverName, e);
    }

    try {
      driver.load(options);
    } catch (ConfigException e) {
      throw e;
    } catch (Exception e) {
      throw new KafkaException("Failed to load authorizer " + driverName, e);
    }
    log.info("Loaded authorization driver {}", driverName);
    return driver;
  }
}
