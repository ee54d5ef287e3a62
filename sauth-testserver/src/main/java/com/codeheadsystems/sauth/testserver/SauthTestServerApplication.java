package com.codeheadsystems.sauth.testserver;

import com.codeheadsystems.sauth.dropwizard.SauthBundle;
import com.codeheadsystems.sauth.dropwizard.SauthConfiguration;
import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Runnable Dropwizard application for local testing of the session-auth gate.
 * Credentials are read from {@code config/config.yml}, which takes them from the
 * {@code SAUTH_CREDENTIALS} environment variable when set. Unless a session secret is
 * configured, issued cookies stop working on restart.
 */
public class SauthTestServerApplication extends Application<SauthConfiguration> {

  /**
   * The entry point of application.
   *
   * @param args the input arguments
   * @throws Exception the exception
   */
  public static void main(String[] args) throws Exception {
    new SauthTestServerApplication().run(args);
  }

  @Override
  public String getName() {
    return "sauth-testserver";
  }

  @Override
  public void initialize(Bootstrap<SauthConfiguration> bootstrap) {
    // ${ENV_VAR:-default} substitution so credentials can come from the environment.
    bootstrap.setConfigurationSourceProvider(
        new SubstitutingSourceProvider(
            bootstrap.getConfigurationSourceProvider(),
            new EnvironmentVariableSubstitutor(false)
        )
    );
    bootstrap.addBundle(new SauthBundle<>());
  }

  @Override
  public void run(SauthConfiguration configuration, Environment environment) {
    environment.jersey().register(new TreasureResource());
  }
}
