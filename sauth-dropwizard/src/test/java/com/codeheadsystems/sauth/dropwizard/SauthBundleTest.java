package com.codeheadsystems.sauth.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.codahale.metrics.health.HealthCheck;
import com.codahale.metrics.health.HealthCheckRegistry;
import com.codeheadsystems.sauth.credential.InvalidConfigurationException;
import com.codeheadsystems.sauth.filter.SessionAuthFilter;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.jersey.validation.Validators;
import io.dropwizard.jetty.setup.ServletEnvironment;
import jakarta.servlet.DispatcherType;
import jakarta.servlet.FilterRegistration;
import jakarta.validation.ConstraintViolation;
import java.security.SecureRandom;
import java.util.EnumSet;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

@ExtendWith(MockitoExtension.class)
class SauthBundleTest {

  @Mock private Environment environment;
  @Mock private ServletEnvironment servletEnvironment;
  @Mock private FilterRegistration.Dynamic registration;
  @Mock private HealthCheckRegistry healthChecks;

  private SauthConfiguration configuration;
  private SauthBundle<SauthConfiguration> bundle;

  @BeforeEach
  void setUp() {
    configuration = new SauthConfiguration();
    bundle = new SauthBundle<>(new SecureRandom());
  }

  @Test
  void run_registersFilterAndHealthCheck() {
    configuration.setCredentials("user,pass");
    configuration.setUrlPattern("/api/*");
    when(environment.servlets()).thenReturn(servletEnvironment);
    when(environment.healthChecks()).thenReturn(healthChecks);
    when(servletEnvironment.addFilter(eq("sauth"), any(SessionAuthFilter.class))).thenReturn(registration);

    bundle.run(configuration, environment);

    verify(registration).addMappingForUrlPatterns(EnumSet.of(DispatcherType.REQUEST), true, "/api/*");
    ArgumentCaptor<HealthCheck> captor = ArgumentCaptor.forClass(HealthCheck.class);
    verify(healthChecks).register(eq("sauth-credentials"), captor.capture());
    HealthCheck.Result result = captor.getValue().execute();
    assertThat(result.isHealthy()).isTrue();
    assertThat(result.getMessage()).isEqualTo("credential entries=1");
  }

  @Test
  void run_configuredSecret_isUsed() {
    configuration.setCredentials("user,pass");
    configuration.setSessionSecretHex("00112233445566778899aabbccddeeff");
    when(environment.servlets()).thenReturn(servletEnvironment);
    when(environment.healthChecks()).thenReturn(healthChecks);
    when(servletEnvironment.addFilter(eq("sauth"), any(SessionAuthFilter.class))).thenReturn(registration);

    bundle.run(configuration, environment);

    verify(servletEnvironment).addFilter(eq("sauth"), any(SessionAuthFilter.class));
  }

  @Test
  void run_invalidCredentials_failsStartup() {
    configuration.setCredentials("user,");

    assertThatThrownBy(() -> bundle.run(configuration, environment))
        .isInstanceOf(InvalidConfigurationException.class);
  }

  @Test
  void run_shortSecret_failsStartup() {
    configuration.setCredentials("user,pass");
    configuration.setSessionSecretHex("0011");

    assertThatThrownBy(() -> bundle.run(configuration, environment))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void run_maxAgeBeyondCookieRange_failsStartup() {
    configuration.setCredentials("user,pass");
    configuration.setSessionMaxAgeSeconds(Long.MAX_VALUE);

    assertThatThrownBy(() -> bundle.run(configuration, environment))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("maxAge");
  }

  @Test
  void configuration_maxAgeBeyondCookieRange_failsValidation() {
    configuration.setCredentials("user,pass");
    configuration.setSessionMaxAgeSeconds(Integer.MAX_VALUE + 1L);

    Set<ConstraintViolation<SauthConfiguration>> violations =
        Validators.newValidator().validate(configuration);

    assertThat(violations)
        .extracting(violation -> violation.getPropertyPath().toString())
        .contains("sessionMaxAgeSeconds");
  }

  @Test
  void run_noSecret_warnsSessionsDoNotSurviveRestart() {
    configuration.setCredentials("user,pass");
    when(environment.servlets()).thenReturn(servletEnvironment);
    when(environment.healthChecks()).thenReturn(healthChecks);
    when(servletEnvironment.addFilter(eq("sauth"), any(SessionAuthFilter.class))).thenReturn(registration);
    Logger logger = (Logger) LoggerFactory.getLogger(SauthBundle.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    try {
      bundle.run(configuration, environment);
    } finally {
      logger.detachAppender(appender);
    }

    assertThat(appender.list)
        .filteredOn(event -> event.getLevel() == Level.WARN)
        .extracting(ILoggingEvent::getFormattedMessage)
        .containsExactly("No session secret configured. Generating one randomly; "
            + "sessions will be invalidated on restart.");
  }
}
