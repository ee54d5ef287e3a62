package com.codeheadsystems.sauth.middleware;

import java.util.List;

/**
 * Describes a command-line flag accepted by {@link MiddlewareSpec#fromCli(String...)}.
 *
 * @param name    long flag name, without dashes
 * @param aliases short aliases, without dashes
 * @param usage   help text
 */
public record CliFlag(String name, List<String> aliases, String usage) {

  /**
   * Instantiates a new Cli flag.
   */
  public CliFlag {
    aliases = List.copyOf(aliases);
  }

  /**
   * Whether the given argument (with its leading dashes) names this flag.
   *
   * @param arg the argument, e.g. {@code --credentials} or {@code -c}
   * @return true when it matches the name or an alias
   */
  public boolean matches(String arg) {
    if (arg.startsWith("--")) {
      return name.equals(arg.substring(2));
    }
    if (arg.startsWith("-")) {
      return aliases.contains(arg.substring(1));
    }
    return false;
  }

  /**
   * Help line, e.g. {@code --credentials, -c  <usage>}.
   *
   * @return the help line
   */
  public String helpLine() {
    StringBuilder line = new StringBuilder("--").append(name);
    aliases.forEach(alias -> line.append(", -").append(alias));
    return line.append("  ").append(usage).toString();
  }
}
