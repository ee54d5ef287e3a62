package com.codeheadsystems.sauth.session;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and verifies the signed tokens carried in the session cookie.
 * <p>
 * Tokens are JWTs signed with HMAC-SHA256 under the process {@link SessionSecret}. Each token
 * carries an {@code authenticated} claim and an absolute {@code exp}. Nothing is kept on the
 * server: a token is valid exactly when its signature verifies and its expiry has not passed.
 */
public class SessionTokenManager {

  /**
   * Issuer claim written into and required from every token.
   */
  public static final String ISSUER = "sauth";

  /**
   * Name of the boolean claim holding the authentication flag.
   */
  public static final String AUTHENTICATED_CLAIM = "authenticated";

  private static final Logger log = LoggerFactory.getLogger(SessionTokenManager.class);

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final Duration maxAge;
  private final Clock clock;

  /**
   * Creates a manager using the system clock.
   *
   * @param secret the signing secret
   * @param maxAge lifetime of issued tokens
   */
  public SessionTokenManager(SessionSecret secret, Duration maxAge) {
    this(secret, maxAge, Clock.systemUTC());
  }

  /**
   * Creates a new SessionTokenManager.
   *
   * @param secret the signing secret
   * @param maxAge lifetime of issued tokens
   * @param clock  clock used for issuance time and the expiry check
   */
  public SessionTokenManager(SessionSecret secret, Duration maxAge, Clock clock) {
    Objects.requireNonNull(secret, "secret");
    this.maxAge = Objects.requireNonNull(maxAge, "maxAge");
    if (maxAge.isNegative() || maxAge.isZero() || maxAge.compareTo(SessionCookieConfig.MAX_MAX_AGE) > 0) {
      throw new IllegalArgumentException("maxAge must be between 1 and "
          + SessionCookieConfig.MAX_MAX_AGE.toSeconds() + " seconds");
    }
    this.clock = Objects.requireNonNull(clock, "clock");
    this.algorithm = Algorithm.HMAC256(secret.bytes());
    this.verifier = JWT.require(algorithm)
        .withIssuer(ISSUER)
        .withClaimPresence(AUTHENTICATED_CLAIM)
        .build();
  }

  /**
   * Signs a new token expiring {@code maxAge} from now.
   *
   * @param authenticated the authentication flag to embed
   * @return signed JWT string
   */
  public String issue(boolean authenticated) {
    Instant now = clock.instant();
    Instant expiresAt = now.plus(maxAge);
    String token = JWT.create()
        .withIssuer(ISSUER)
        .withClaim(AUTHENTICATED_CLAIM, authenticated)
        .withIssuedAt(now)
        .withExpiresAt(expiresAt)
        .sign(algorithm);
    log.debug("Issued session token expiring at {}", expiresAt);
    return token;
  }

  /**
   * Verifies a token and decodes it.
   * <p>
   * Never throws for bad input: forged, corrupted, foreign or expired tokens all come back empty.
   *
   * @param token the token from the cookie, may be null
   * @return the decoded session, or empty if the token cannot be trusted
   */
  public Optional<SessionToken> verify(String token) {
    if (token == null || token.isEmpty()) {
      return Optional.empty();
    }
    try {
      DecodedJWT decoded = verifier.verify(token);
      Boolean authenticated = decoded.getClaim(AUTHENTICATED_CLAIM).asBoolean();
      Instant expiresAt = decoded.getExpiresAtAsInstant();
      if (authenticated == null || expiresAt == null) {
        log.debug("Session token missing authenticated flag or expiry");
        return Optional.empty();
      }
      SessionToken session = new SessionToken(authenticated, decoded.getIssuedAtAsInstant(), expiresAt);
      // The library checks exp against system time; the injected clock is the authority here.
      if (session.isExpired(clock.instant())) {
        log.debug("Session token expired at {}", expiresAt);
        return Optional.empty();
      }
      return Optional.of(session);
    } catch (JWTVerificationException | IllegalArgumentException e) {
      log.debug("Session token rejected: {}", e.getMessage());
      return Optional.empty();
    }
  }
}
