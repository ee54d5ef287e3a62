package com.codeheadsystems.sauth.middleware;

import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MiddlewareSpec} for the {@value #TYPE} middleware.
 */
public class SauthMiddlewareSpec implements MiddlewareSpec<SauthMiddleware> {

  /**
   * The middleware type identifier.
   */
  public static final String TYPE = "sauth";

  /**
   * The credentials flag.
   */
  public static final CliFlag CREDENTIALS_FLAG = new CliFlag("credentials", List.of("c"),
      "List of auth key pairs in CSV format, e.g. \"foo,bar\\nusername,password\\nus3r,p@ssw0rd1\". "
          + "Every literal \\n separates entries, so it cannot appear in a password.");

  private static final Logger log = LoggerFactory.getLogger(SauthMiddlewareSpec.class);

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public Class<SauthMiddleware> middlewareClass() {
    return SauthMiddleware.class;
  }

  @Override
  public SauthMiddleware fromConfig(String config) {
    SauthMiddleware middleware = new SauthMiddleware(config);
    log.info("Configured {} middleware with {} credential(s)",
        TYPE, middleware.getCredentialStore().size());
    return middleware;
  }

  @Override
  public SauthMiddleware fromOther(SauthMiddleware other) {
    Objects.requireNonNull(other, "other");
    return fromConfig(other.getCredentials());
  }

  /**
   * Accepts {@code --credentials value}, {@code --credentials=value}, {@code -c value} and
   * {@code -c=value}. A literal {@code \n} in the value separates entries. A missing flag is
   * treated as an empty configuration.
   */
  @Override
  public SauthMiddleware fromCli(String... args) {
    String credentials = "";
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      int eq = arg.indexOf('=');
      if (eq > 0 && CREDENTIALS_FLAG.matches(arg.substring(0, eq))) {
        credentials = arg.substring(eq + 1);
      } else if (CREDENTIALS_FLAG.matches(arg) && i + 1 < args.length) {
        credentials = args[++i];
      }
    }
    return fromConfig(credentials.replace("\\n", "\n"));
  }

  @Override
  public List<CliFlag> cliFlags() {
    return List.of(CREDENTIALS_FLAG);
  }

  @Override
  public String describe(SauthMiddleware middleware) {
    return middleware.getCredentialStore().describe();
  }
}
