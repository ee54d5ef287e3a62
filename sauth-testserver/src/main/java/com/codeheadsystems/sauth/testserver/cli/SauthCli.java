package com.codeheadsystems.sauth.testserver.cli;

import com.codeheadsystems.sauth.credential.InvalidConfigurationException;
import com.codeheadsystems.sauth.middleware.CliFlag;
import com.codeheadsystems.sauth.middleware.SauthMiddleware;
import com.codeheadsystems.sauth.middleware.SauthMiddlewareSpec;
import java.io.PrintStream;

/**
 * Command-line check for a credentials list. Parses it the way the server would and prints
 * the resulting entries with passwords masked.
 *
 * <pre>
 * Usage:
 *   java -cp sauth-testserver.jar com.codeheadsystems.sauth.testserver.cli.SauthCli \
 *       --credentials "foo,bar\nusername,password"
 * </pre>
 */
public class SauthCli {

  private final SauthMiddlewareSpec spec;

  /**
   * Instantiates a new Sauth cli.
   */
  public SauthCli() {
    this(new SauthMiddlewareSpec());
  }

  /**
   * Instantiates a new Sauth cli.
   *
   * @param spec the middleware spec
   */
  public SauthCli(SauthMiddlewareSpec spec) {
    this.spec = spec;
  }

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    System.exit(new SauthCli().run(args, System.out, System.err));
  }

  /**
   * Runs the check.
   *
   * @param args the arguments
   * @param out  standard output
   * @param err  error output
   * @return the exit code
   */
  public int run(String[] args, PrintStream out, PrintStream err) {
    for (String arg : args) {
      if ("--help".equals(arg) || "-h".equals(arg)) {
        usage(out);
        return 0;
      }
    }
    try {
      SauthMiddleware middleware = spec.fromCli(args);
      out.println("Type        : " + spec.type());
      out.println("Credentials : " + middleware.getCredentialStore().size());
      out.println(spec.describe(middleware));
      return 0;
    } catch (InvalidConfigurationException e) {
      err.println("Error: " + e.getMessage());
      err.println();
      usage(err);
      return 1;
    }
  }

  private void usage(PrintStream stream) {
    stream.println("Usage: SauthCli --credentials <list>");
    stream.println();
    for (CliFlag flag : spec.cliFlags()) {
      stream.println("  " + flag.helpLine());
    }
  }
}
