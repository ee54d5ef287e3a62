package com.codeheadsystems.sauth.springboot.config;

import com.codeheadsystems.sauth.filter.SessionAuthFilter;
import com.codeheadsystems.sauth.middleware.SauthMiddleware;
import com.codeheadsystems.sauth.middleware.SauthMiddlewareSpec;
import com.codeheadsystems.sauth.session.SessionCookieConfig;
import com.codeheadsystems.sauth.session.SessionCookieManager;
import com.codeheadsystems.sauth.session.SessionSecret;
import com.codeheadsystems.sauth.springboot.health.CredentialStoreHealthIndicator;
import java.security.SecureRandom;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.core.Ordered;

@AutoConfiguration
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@EnableConfigurationProperties(SauthProperties.class)
public class SauthAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(SauthAutoConfiguration.class);

  /**
   * Default {@link SecureRandom} instance used to generate the session secret.
   */
  @Bean
  @ConditionalOnMissingBean
  public SecureRandom secureRandom() {
    return new SecureRandom();
  }

  /**
   * Process-wide session secret. Random unless {@code sauth.session-secret-hex} is set.
   */
  @Bean
  @ConditionalOnMissingBean
  public SessionSecret sessionSecret(SauthProperties props, SecureRandom secureRandom) {
    String secretHex = props.getSessionSecretHex();
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No session secret configured. Generating one randomly; "
          + "sessions will be invalidated on restart.");
      return SessionSecret.generate(secureRandom);
    }
    return SessionSecret.fromHex(secretHex);
  }

  @Bean
  @ConditionalOnMissingBean
  public SauthMiddleware sauthMiddleware(SauthProperties props) {
    SauthMiddlewareSpec spec = new SauthMiddlewareSpec();
    SauthMiddleware middleware = spec.fromConfig(props.getCredentials());
    log.info("Session auth enabled on {} for:\n{}", props.getUrlPattern(), spec.describe(middleware));
    return middleware;
  }

  @Bean
  @ConditionalOnMissingBean
  public SessionCookieManager sessionCookieManager(SauthProperties props, SessionSecret sessionSecret) {
    SessionCookieConfig config = new SessionCookieConfig(
        props.getSessionCookieName(),
        Duration.ofSeconds(props.getSessionMaxAgeSeconds()),
        props.isSecureCookie());
    return new SessionCookieManager(sessionSecret, config);
  }

  @Bean
  @ConditionalOnMissingBean(name = "sauthFilterRegistration")
  public FilterRegistrationBean<SessionAuthFilter> sauthFilterRegistration(
      SauthProperties props, SauthMiddleware middleware, SessionCookieManager sessionCookieManager) {
    FilterRegistrationBean<SessionAuthFilter> registration =
        new FilterRegistrationBean<>(middleware.newFilter(sessionCookieManager));
    registration.setName(SauthMiddlewareSpec.TYPE);
    registration.addUrlPatterns(props.getUrlPattern());
    registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
    return registration;
  }

  @Bean
  @ConditionalOnMissingBean
  public CredentialStoreHealthIndicator credentialStoreHealthIndicator(SauthMiddleware middleware) {
    return new CredentialStoreHealthIndicator(middleware);
  }
}
