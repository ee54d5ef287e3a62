package com.codeheadsystems.sauth.dropwizard;

import com.codeheadsystems.sauth.dropwizard.health.CredentialStoreHealthCheck;
import com.codeheadsystems.sauth.filter.SessionAuthFilter;
import com.codeheadsystems.sauth.middleware.SauthMiddleware;
import com.codeheadsystems.sauth.middleware.SauthMiddlewareSpec;
import com.codeheadsystems.sauth.session.SessionCookieConfig;
import com.codeheadsystems.sauth.session.SessionCookieManager;
import com.codeheadsystems.sauth.session.SessionSecret;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.servlet.DispatcherType;
import jakarta.servlet.FilterRegistration;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.EnumSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that puts the session-auth gate in front of an application.
 * <p>
 * Registers {@link SessionAuthFilter} as a servlet filter on the configured URL pattern and a
 * {@code sauth-credentials} health check. Requires a {@link SauthConfiguration} in the
 * application's YAML config.
 * <pre>{@code
 *   bootstrap.addBundle(new SauthBundle<>());
 * }</pre>
 * The session secret is created once per {@link #run} and shared by every request the filter
 * serves.
 */
@Singleton
public class SauthBundle<C extends SauthConfiguration> implements ConfiguredBundle<C> {

  /**
   * Name the filter is registered under.
   */
  public static final String FILTER_NAME = SauthMiddlewareSpec.TYPE;

  private static final Logger log = LoggerFactory.getLogger(SauthBundle.class);

  private final SauthMiddlewareSpec spec;
  private final SecureRandom secureRandom;

  /**
   * Creates a bundle using a default {@link SecureRandom} for secret generation.
   */
  public SauthBundle() {
    this(new SecureRandom());
  }

  /**
   * Creates a bundle using the supplied randomness source for secret generation.
   *
   * @param secureRandom the secure random
   */
  @Inject
  public SauthBundle(SecureRandom secureRandom) {
    this.spec = new SauthMiddlewareSpec();
    this.secureRandom = secureRandom;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    SauthMiddleware middleware = spec.fromConfig(configuration.getCredentials());
    log.info("Session auth enabled on {} for:\n{}", configuration.getUrlPattern(), spec.describe(middleware));

    SessionCookieConfig cookieConfig = new SessionCookieConfig(
        configuration.getSessionCookieName(),
        Duration.ofSeconds(configuration.getSessionMaxAgeSeconds()),
        configuration.isSecureCookie());
    SessionCookieManager sessionCookieManager =
        new SessionCookieManager(buildSessionSecret(configuration), cookieConfig);

    FilterRegistration.Dynamic registration =
        environment.servlets().addFilter(FILTER_NAME, middleware.newFilter(sessionCookieManager));
    registration.addMappingForUrlPatterns(
        EnumSet.of(DispatcherType.REQUEST), true, configuration.getUrlPattern());

    environment.healthChecks().register("sauth-credentials",
        new CredentialStoreHealthCheck(middleware.getCredentialStore()));
  }

  private SessionSecret buildSessionSecret(C configuration) {
    String secretHex = configuration.getSessionSecretHex();
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No session secret configured. Generating one randomly; "
          + "sessions will be invalidated on restart.");
      return SessionSecret.generate(secureRandom);
    }
    return SessionSecret.fromHex(secretHex);
  }
}
