package com.codeheadsystems.sauth.springboot;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.sauth.credential.InvalidConfigurationException;
import com.codeheadsystems.sauth.session.SessionCookieManager;
import com.codeheadsystems.sauth.session.SessionSecret;
import com.codeheadsystems.sauth.springboot.config.SauthAutoConfiguration;
import com.codeheadsystems.sauth.springboot.health.CredentialStoreHealthIndicator;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.WebApplicationContextRunner;
import org.springframework.boot.web.servlet.FilterRegistrationBean;

class SauthAutoConfigurationTest {

  private final WebApplicationContextRunner runner = new WebApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(SauthAutoConfiguration.class));

  @Test
  void configuredSecretAndCookie_areApplied() {
    runner.withPropertyValues(
            "sauth.credentials=user,pass",
            "sauth.session-secret-hex=00112233445566778899aabbccddeeff",
            "sauth.session-cookie-name=sid",
            "sauth.session-max-age-seconds=600",
            "sauth.url-pattern=/api/*")
        .run(context -> {
          assertThat(context).hasNotFailed();
          assertThat(context.getBean(SessionSecret.class))
              .isEqualTo(SessionSecret.fromHex("00112233445566778899aabbccddeeff"));
          SessionCookieManager cookies = context.getBean(SessionCookieManager.class);
          assertThat(cookies.config().cookieName()).isEqualTo("sid");
          assertThat(cookies.config().maxAge().toSeconds()).isEqualTo(600);
          FilterRegistrationBean<?> registration = context.getBean(FilterRegistrationBean.class);
          assertThat(registration.getUrlPatterns()).containsExactly("/api/*");
        });
  }

  @Test
  void healthIndicator_reportsEntryCount() {
    runner.withPropertyValues("sauth.credentials=user,pass\nother,secret")
        .run(context -> {
          Health health = context.getBean(CredentialStoreHealthIndicator.class).health();
          assertThat(health.getStatus()).isEqualTo(Status.UP);
          assertThat(health.getDetails()).containsEntry("credentialEntries", 2);
        });
  }

  @Test
  void maxAgeBeyondCookieRange_failsContext() {
    runner.withPropertyValues("sauth.credentials=user,pass",
            "sauth.session-max-age-seconds=9223372036854775807")
        .run(context -> {
          assertThat(context).hasFailed();
          assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(IllegalArgumentException.class);
        });
  }

  @Test
  void missingCredentials_failsContext() {
    runner.run(context -> {
      assertThat(context).hasFailed();
      assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(InvalidConfigurationException.class);
    });
  }

  @Test
  void customSecretBean_takesPrecedence() {
    SessionSecret custom = SessionSecret.fromHex("ffeeddccbbaa99887766554433221100");
    runner.withPropertyValues("sauth.credentials=user,pass")
        .withBean(SessionSecret.class, () -> custom)
        .run(context -> assertThat(context.getBean(SessionSecret.class)).isSameAs(custom));
  }
}
