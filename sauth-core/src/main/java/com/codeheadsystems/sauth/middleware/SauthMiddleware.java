package com.codeheadsystems.sauth.middleware;

import com.codeheadsystems.sauth.credential.CredentialStore;
import com.codeheadsystems.sauth.filter.SessionAuthFilter;
import com.codeheadsystems.sauth.session.SessionCookieManager;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * A configured session-auth middleware: the raw credential string and the store parsed from it.
 * <p>
 * Serializes to {@code {"credentials": "..."}}. Note that the serialized form carries the
 * passwords in plain text; only {@link #toString()} masks them.
 */
public final class SauthMiddleware {

  private final String credentials;
  private final CredentialStore credentialStore;

  /**
   * Parses and validates the credential string.
   *
   * @param credentials newline separated {@code username,password} lines
   * @throws com.codeheadsystems.sauth.credential.InvalidConfigurationException if no valid entry remains
   */
  @JsonCreator
  public SauthMiddleware(@JsonProperty("credentials") String credentials) {
    this.credentialStore = CredentialStore.parse(credentials);
    this.credentials = credentials;
  }

  /**
   * Builds the gate for this configuration.
   *
   * @param sessionCookieManager session cache shared by the gate
   * @return a new filter
   */
  public SessionAuthFilter newFilter(SessionCookieManager sessionCookieManager) {
    return new SessionAuthFilter(credentialStore, sessionCookieManager);
  }

  /**
   * Gets the raw credential string.
   *
   * @return the credentials
   */
  @JsonProperty
  public String getCredentials() {
    return credentials;
  }

  /**
   * Gets the parsed credential store.
   *
   * @return the credential store
   */
  @JsonIgnore
  public CredentialStore getCredentialStore() {
    return credentialStore;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof SauthMiddleware other && credentials.equals(other.credentials);
  }

  @Override
  public int hashCode() {
    return Objects.hash(credentials);
  }

  @Override
  public String toString() {
    return credentialStore.describe();
  }
}
