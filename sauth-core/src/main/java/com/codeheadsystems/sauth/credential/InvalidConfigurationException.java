package com.codeheadsystems.sauth.credential;

/**
 * Thrown when a credential configuration string yields no usable entries.
 */
public class InvalidConfigurationException extends RuntimeException {

  /**
   * Instantiates a new Invalid configuration exception.
   *
   * @param message the message
   */
  public InvalidConfigurationException(final String message) {
    super(message);
  }
}
