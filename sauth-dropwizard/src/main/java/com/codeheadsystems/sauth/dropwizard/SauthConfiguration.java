package com.codeheadsystems.sauth.dropwizard;

import com.codeheadsystems.sauth.session.SessionCookieConfig;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

/**
 * Dropwizard configuration for the session-auth gate.
 * <p>
 * {@code credentials} holds one {@code username,password} pair per line; use a YAML block
 * scalar for several users:
 * <pre>{@code
 *   credentials: |-
 *     alice,s3cr3t
 *     bob,hunter2
 * }</pre>
 * Leaving {@code sessionSecretHex} empty generates a random secret at startup, so sessions
 * do not survive a restart. Generate a fixed one with: {@code openssl rand -hex 32}
 */
public class SauthConfiguration extends Configuration {

  /**
   * Newline separated {@code username,password} pairs.
   */
  @NotEmpty
  private String credentials;

  /**
   * Hex-encoded HMAC-SHA256 key for session cookies, at least 16 bytes.
   * Leave empty for a random key per process.
   */
  private String sessionSecretHex = "";

  /**
   * Session lifetime in seconds, up to the largest cookie Max-Age.
   */
  @Min(1)
  @Max(Integer.MAX_VALUE)
  private long sessionMaxAgeSeconds = SessionCookieConfig.DEFAULT_MAX_AGE.toSeconds();

  /**
   * Session cookie name.
   */
  @NotEmpty
  private String sessionCookieName = SessionCookieConfig.DEFAULT_COOKIE_NAME;

  /**
   * Whether the session cookie is marked {@code Secure}. Enable behind TLS.
   */
  private boolean secureCookie = false;

  /**
   * Servlet URL pattern the gate is mapped to.
   */
  @NotEmpty
  private String urlPattern = "/*";

  /**
   * Gets credentials.
   *
   * @return the credentials
   */
  @JsonProperty
  public String getCredentials() {
    return credentials;
  }

  /**
   * Sets credentials.
   *
   * @param credentials the credentials
   */
  @JsonProperty
  public void setCredentials(String credentials) {
    this.credentials = credentials;
  }

  /**
   * Gets session secret hex.
   *
   * @return the session secret hex
   */
  @JsonProperty
  public String getSessionSecretHex() {
    return sessionSecretHex;
  }

  /**
   * Sets session secret hex.
   *
   * @param sessionSecretHex the session secret hex
   */
  @JsonProperty
  public void setSessionSecretHex(String sessionSecretHex) {
    this.sessionSecretHex = sessionSecretHex;
  }

  /**
   * Gets session max age seconds.
   *
   * @return the session max age seconds
   */
  @JsonProperty
  public long getSessionMaxAgeSeconds() {
    return sessionMaxAgeSeconds;
  }

  /**
   * Sets session max age seconds.
   *
   * @param sessionMaxAgeSeconds the session max age seconds
   */
  @JsonProperty
  public void setSessionMaxAgeSeconds(long sessionMaxAgeSeconds) {
    this.sessionMaxAgeSeconds = sessionMaxAgeSeconds;
  }

  /**
   * Gets session cookie name.
   *
   * @return the session cookie name
   */
  @JsonProperty
  public String getSessionCookieName() {
    return sessionCookieName;
  }

  /**
   * Sets session cookie name.
   *
   * @param sessionCookieName the session cookie name
   */
  @JsonProperty
  public void setSessionCookieName(String sessionCookieName) {
    this.sessionCookieName = sessionCookieName;
  }

  /**
   * Is secure cookie.
   *
   * @return the boolean
   */
  @JsonProperty
  public boolean isSecureCookie() {
    return secureCookie;
  }

  /**
   * Sets secure cookie.
   *
   * @param secureCookie the secure cookie
   */
  @JsonProperty
  public void setSecureCookie(boolean secureCookie) {
    this.secureCookie = secureCookie;
  }

  /**
   * Gets url pattern.
   *
   * @return the url pattern
   */
  @JsonProperty
  public String getUrlPattern() {
    return urlPattern;
  }

  /**
   * Sets url pattern.
   *
   * @param urlPattern the url pattern
   */
  @JsonProperty
  public void setUrlPattern(String urlPattern) {
    this.urlPattern = urlPattern;
  }
}
