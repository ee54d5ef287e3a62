package com.codeheadsystems.sauth.session;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings for the session cookie written by {@link SessionCookieManager}.
 *
 * @param cookieName the cookie name
 * @param maxAge     lifetime of an issued session, also used as the cookie Max-Age
 * @param secure     whether the cookie carries the {@code Secure} attribute
 */
public record SessionCookieConfig(String cookieName, Duration maxAge, boolean secure) {

  /**
   * Default cookie name.
   */
  public static final String DEFAULT_COOKIE_NAME = "session";

  /**
   * Default session lifetime: one day.
   */
  public static final Duration DEFAULT_MAX_AGE = Duration.ofSeconds(86400);

  /**
   * Longest accepted session lifetime, the largest value a cookie Max-Age can carry.
   */
  public static final Duration MAX_MAX_AGE = Duration.ofSeconds(Integer.MAX_VALUE);

  /**
   * Validates the settings.
   */
  public SessionCookieConfig {
    Objects.requireNonNull(cookieName, "cookieName");
    Objects.requireNonNull(maxAge, "maxAge");
    if (cookieName.isBlank()) {
      throw new IllegalArgumentException("cookieName must not be blank");
    }
    if (maxAge.isNegative() || maxAge.isZero()) {
      throw new IllegalArgumentException("maxAge must be positive");
    }
    if (maxAge.compareTo(MAX_MAX_AGE) > 0) {
      throw new IllegalArgumentException("maxAge must not exceed " + MAX_MAX_AGE.toSeconds() + " seconds");
    }
  }

  /**
   * Instantiates the default config: cookie {@code session}, one day, not secure-only.
   */
  public SessionCookieConfig() {
    this(DEFAULT_COOKIE_NAME, DEFAULT_MAX_AGE, false);
  }
}
