package com.codeheadsystems.sauth.session;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Objects;
import java.util.Optional;

/**
 * Client-held session cache: reads and writes the signed session cookie.
 * <p>
 * There is no server-side session table. Every read re-verifies the cookie, and any failure
 * degrades to "no session" so the caller falls back to a full credential check.
 */
public class SessionCookieManager {

  private final SessionTokenManager tokenManager;
  private final SessionCookieConfig config;

  /**
   * Creates a cookie manager signing with the given secret.
   *
   * @param secret the session secret
   * @param config the cookie settings
   */
  public SessionCookieManager(SessionSecret secret, SessionCookieConfig config) {
    this(new SessionTokenManager(secret, config.maxAge()), config);
  }

  /**
   * Creates a cookie manager around an existing token manager.
   *
   * @param tokenManager the token manager
   * @param config       the cookie settings
   */
  public SessionCookieManager(SessionTokenManager tokenManager, SessionCookieConfig config) {
    this.tokenManager = Objects.requireNonNull(tokenManager, "tokenManager");
    this.config = Objects.requireNonNull(config, "config");
  }

  /**
   * Writes a freshly signed session cookie, replacing any previous one on the client.
   *
   * @param response      the response to add the cookie to
   * @param authenticated the flag to store
   */
  public void issue(HttpServletResponse response, boolean authenticated) {
    Cookie cookie = new Cookie(config.cookieName(), tokenManager.issue(authenticated));
    cookie.setPath("/");
    cookie.setHttpOnly(true);
    cookie.setSecure(config.secure());
    cookie.setMaxAge((int) config.maxAge().toSeconds());
    response.addCookie(cookie);
  }

  /**
   * Reads and verifies the session cookie.
   * <p>
   * If the client sent several cookies with the session name, the first one that verifies wins.
   *
   * @param request the request
   * @return the verified session, or empty
   */
  public Optional<SessionToken> read(HttpServletRequest request) {
    Cookie[] cookies = request.getCookies();
    if (cookies == null) {
      return Optional.empty();
    }
    for (Cookie cookie : cookies) {
      if (config.cookieName().equals(cookie.getName())) {
        Optional<SessionToken> session = tokenManager.verify(cookie.getValue());
        if (session.isPresent()) {
          return session;
        }
      }
    }
    return Optional.empty();
  }

  /**
   * The cookie settings.
   *
   * @return the config
   */
  public SessionCookieConfig config() {
    return config;
  }
}
