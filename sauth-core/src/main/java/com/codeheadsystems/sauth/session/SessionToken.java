package com.codeheadsystems.sauth.session;

import java.time.Instant;

/**
 * Decoded contents of a verified session cookie.
 *
 * @param authenticated whether the client passed a credential check
 * @param issuedAt      when the token was signed
 * @param expiresAt     absolute expiry embedded in the token
 */
public record SessionToken(boolean authenticated, Instant issuedAt, Instant expiresAt) {

  /**
   * Whether the embedded expiry has been reached.
   *
   * @param now the current time
   * @return true once {@code now} is at or past {@link #expiresAt()}
   */
  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }
}
