package com.codeheadsystems.sauth.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.sauth.credential.CredentialStore;

/**
 * Health check reporting how many credential entries the gate accepts.
 */
public class CredentialStoreHealthCheck extends HealthCheck {

  private final CredentialStore credentialStore;

  /**
   * Instantiates a new Credential store health check.
   *
   * @param credentialStore the credential store
   */
  public CredentialStoreHealthCheck(CredentialStore credentialStore) {
    this.credentialStore = credentialStore;
  }

  @Override
  protected Result check() {
    int size = credentialStore.size();
    if (size == 0) {
      return Result.unhealthy("No credentials configured");
    }
    return Result.healthy("credential entries=%d", size);
  }
}
