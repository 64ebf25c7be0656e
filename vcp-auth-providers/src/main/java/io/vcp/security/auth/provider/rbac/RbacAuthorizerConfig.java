// (Copyright) The vcp-security authors.

package io.vcp.security.auth.provider.rbac;

import static org.apache.kafka.common.config.ConfigDef.Range.atLeast;

import java.io.FileOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.apache.kafka.common.config.AbstractConfig;
import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.utils.Utils;

public class RbacAuthorizerConfig extends AbstractConfig {

  private static final ConfigDef CONFIG;

  public static final String SYNC_RETRY_BACKOFF_MS_PROP = "rbac.sync.retry.backoff.ms";
  private static final long SYNC_RETRY_BACKOFF_MS_DEFAULT = 60 * 1000L;
  private static final String SYNC_RETRY_BACKOFF_MS_DOC = "Time to wait before retrying a failed full"
      + " synchronization of projects with the policy server.";

  public static final String CHANGES_RETRY_BACKOFF_MS_PROP = "rbac.changes.retry.backoff.ms";
  private static final long CHANGES_RETRY_BACKOFF_MS_DEFAULT = 5 * 1000L;
  private static final String CHANGES_RETRY_BACKOFF_MS_DOC = "Time to wait before polling the policy server"
      + " for changes again after the server disconnected or returned an error.";

  static {
    CONFIG = new ConfigDef()
        .define(SYNC_RETRY_BACKOFF_MS_PROP, Type.LONG, SYNC_RETRY_BACKOFF_MS_DEFAULT, atLeast(0),
            Importance.LOW, SYNC_RETRY_BACKOFF_MS_DOC)
        .define(CHANGES_RETRY_BACKOFF_MS_PROP, Type.LONG, CHANGES_RETRY_BACKOFF_MS_DEFAULT, atLeast(0),
            Importance.LOW, CHANGES_RETRY_BACKOFF_MS_DOC);
  }

  public final long syncRetryBackoffMs;
  public final long changesRetryBackoffMs;

  public RbacAuthorizerConfig(Map<?, ?> props) {
    super(CONFIG, props);
    syncRetryBackoffMs = getLong(SYNC_RETRY_BACKOFF_MS_PROP);
    changesRetryBackoffMs = getLong(CHANGES_RETRY_BACKOFF_MS_PROP);
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
