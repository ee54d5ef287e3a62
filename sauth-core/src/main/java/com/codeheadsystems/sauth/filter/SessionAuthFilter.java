package com.codeheadsystems.sauth.filter;

import com.codeheadsystems.sauth.auth.BasicCredentials;
import com.codeheadsystems.sauth.credential.CredentialStore;
import com.codeheadsystems.sauth.session.SessionCookieManager;
import com.codeheadsystems.sauth.session.SessionToken;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Servlet filter that only lets authenticated requests through to the rest of the chain.
 * <p>
 * A request is authenticated when it carries a valid session cookie, or failing that, a
 * Basic Auth header matching the {@link CredentialStore}. A successful credential check
 * issues a new session cookie so later requests skip the credential check until the session
 * expires. Anything else gets a {@code 401} with a Basic challenge and is not forwarded.
 * <p>
 * The filter holds no per-request state and can serve concurrent requests.
 */
public class SessionAuthFilter implements Filter {

  /**
   * Challenge sent with every rejection.
   */
  public static final String CHALLENGE = "Basic realm=\"Please log in\"";

  /**
   * Challenge response header name.
   */
  public static final String WWW_AUTHENTICATE = "WWW-Authenticate";

  /**
   * Credentials request header name.
   */
  public static final String AUTHORIZATION = "Authorization";

  private static final Logger log = LoggerFactory.getLogger(SessionAuthFilter.class);

  private final CredentialStore credentialStore;
  private final SessionCookieManager sessionCookieManager;

  /**
   * Instantiates a new Session auth filter.
   *
   * @param credentialStore      the accepted credentials
   * @param sessionCookieManager the session cookie cache
   */
  public SessionAuthFilter(CredentialStore credentialStore, SessionCookieManager sessionCookieManager) {
    this.credentialStore = Objects.requireNonNull(credentialStore, "credentialStore");
    this.sessionCookieManager = Objects.requireNonNull(sessionCookieManager, "sessionCookieManager");
  }

  @Override
  public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
      throws IOException, ServletException {
    if (!(request instanceof HttpServletRequest httpRequest)
        || !(response instanceof HttpServletResponse httpResponse)) {
      throw new ServletException("SessionAuthFilter only handles HTTP requests");
    }

    if (hasAuthenticatedSession(httpRequest)) {
      chain.doFilter(request, response);
      return;
    }

    Optional<BasicCredentials> credentials =
        BasicCredentials.fromAuthorizationHeader(httpRequest.getHeader(AUTHORIZATION));
    if (credentials.isEmpty()) {
      log.debug("Rejecting {} {}: missing or malformed Authorization header",
          httpRequest.getMethod(), httpRequest.getRequestURI());
      reject(httpResponse);
      return;
    }
    if (!credentialStore.lookup(credentials.get().username(), credentials.get().password())) {
      log.debug("Rejecting {} {}: bad credentials for username={}",
          httpRequest.getMethod(), httpRequest.getRequestURI(), credentials.get().username());
      reject(httpResponse);
      return;
    }

    sessionCookieManager.issue(httpResponse, true);
    log.debug("Issued session for username={}", credentials.get().username());
    chain.doFilter(request, response);
  }

  private boolean hasAuthenticatedSession(HttpServletRequest request) {
    return sessionCookieManager.read(request)
        .map(SessionToken::authenticated)
        .orElse(false);
  }

  private void reject(HttpServletResponse response) {
    response.setHeader(WWW_AUTHENTICATE, CHALLENGE);
    response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
  }

  /**
   * The credential store this filter checks against.
   *
   * @return the credential store
   */
  public CredentialStore credentialStore() {
    return credentialStore;
  }
}
