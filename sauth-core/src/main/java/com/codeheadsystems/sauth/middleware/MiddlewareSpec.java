package com.codeheadsystems.sauth.middleware;

import java.util.List;

/**
 * Contract a host pipeline uses to construct, rebuild and describe a middleware type.
 *
 * @param <M> the configured middleware type
 */
public interface MiddlewareSpec<M> {

  /**
   * Short, unique type identifier.
   *
   * @return the type
   */
  String type();

  /**
   * The class Jackson reads a serialized instance into before {@link #fromOther} is applied.
   *
   * @return the middleware class
   */
  Class<M> middlewareClass();

  /**
   * Builds a middleware from its raw configuration string.
   *
   * @param config the configuration
   * @return the middleware
   */
  M fromConfig(String config);

  /**
   * Rebuilds a middleware from a previously serialized instance.
   *
   * @param other the prior instance
   * @return an equivalent, fully validated middleware
   */
  M fromOther(M other);

  /**
   * Builds a middleware from command-line arguments.
   *
   * @param args the arguments
   * @return the middleware
   */
  M fromCli(String... args);

  /**
   * Flags understood by {@link #fromCli(String...)}.
   *
   * @return the flags
   */
  List<CliFlag> cliFlags();

  /**
   * Human readable description suitable for logs. Must never contain secrets.
   *
   * @param middleware the middleware
   * @return the description
   */
  String describe(M middleware);
}
