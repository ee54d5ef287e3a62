package com.codeheadsystems.sauth.springboot.health;

import com.codeheadsystems.sauth.middleware.SauthMiddleware;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

public class CredentialStoreHealthIndicator implements HealthIndicator {

  private final SauthMiddleware middleware;

  public CredentialStoreHealthIndicator(SauthMiddleware middleware) {
    this.middleware = middleware;
  }

  @Override
  public Health health() {
    int size = middleware.getCredentialStore().size();
    if (size == 0) {
      return Health.down().withDetail("reason", "No credential entries configured").build();
    }
    return Health.up().withDetail("credentialEntries", size).build();
  }
}
