package com.codeheadsystems.sauth.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.sauth.auth.BasicCredentials;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * End-to-end tests of the gate in front of a Jersey resource.
 * Covers: credentials → session cookie → cookie-only access, and every rejection path.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class SauthBundleIntegrationTest {

  static final DropwizardAppExtension<SauthConfiguration> APP =
      new DropwizardAppExtension<>(
          SauthApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"));

  private HttpClient httpClient;

  @BeforeEach
  void setUp() {
    httpClient = HttpClient.newHttpClient();
  }

  @Test
  void validCredentials_returnsDownstreamBodyAndSessionCookie() throws Exception {
    HttpResponse<String> response = get(new BasicCredentials("aladdin", "open sesame").toAuthorizationHeader(), null);

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.body()).isEqualTo("treasure");
    assertThat(sessionCookie(response)).isPresent();
  }

  @Test
  void sessionCookie_grantsAccessWithoutCredentials() throws Exception {
    HttpResponse<String> login = get(new BasicCredentials("user2", "pass2").toAuthorizationHeader(), null);
    String cookie = sessionCookie(login).orElseThrow();

    HttpResponse<String> response = get(null, cookie);

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.body()).isEqualTo("treasure");
    assertThat(response.headers().allValues("Set-Cookie")).isEmpty();
  }

  @Test
  void wrongPassword_returns401WithChallenge() throws Exception {
    HttpResponse<String> response = get(new BasicCredentials("aladdin", "wrong").toAuthorizationHeader(), null);

    assertUnauthorized(response);
  }

  @Test
  void noCredentialsNoCookie_returns401() throws Exception {
    assertUnauthorized(get(null, null));
  }

  @Test
  void malformedAuthorization_returns401() throws Exception {
    assertUnauthorized(get("blablabla=", null));
  }

  @Test
  void tamperedCookie_returns401() throws Exception {
    HttpResponse<String> login = get(new BasicCredentials("aladdin", "open sesame").toAuthorizationHeader(), null);
    String cookie = sessionCookie(login).orElseThrow();
    String tampered = cookie.substring(0, cookie.length() - 4) + (cookie.endsWith("AAAA") ? "BBBB" : "AAAA");

    assertUnauthorized(get(null, tampered));
  }

  private void assertUnauthorized(HttpResponse<String> response) {
    assertThat(response.statusCode()).isEqualTo(401);
    assertThat(response.headers().firstValue("WWW-Authenticate")).contains("Basic realm=\"Please log in\"");
    assertThat(response.body()).doesNotContain("treasure");
  }

  private HttpResponse<String> get(String authorization, String cookie) throws IOException, InterruptedException {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/api/treasure"))
        .GET();
    if (authorization != null) {
      builder.header("Authorization", authorization);
    }
    if (cookie != null) {
      builder.header("Cookie", cookie);
    }
    return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
  }

  // Returns "session=<token>" from the Set-Cookie header, ready to send back.
  private Optional<String> sessionCookie(HttpResponse<?> response) {
    return response.headers().allValues("Set-Cookie").stream()
        .filter(value -> value.startsWith("session="))
        .map(value -> value.split(";", 2)[0])
        .findFirst();
  }

  private String baseUrl() {
    return String.format("http://localhost:%d", APP.getLocalPort());
  }
}
