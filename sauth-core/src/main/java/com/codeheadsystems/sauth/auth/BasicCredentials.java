package com.codeheadsystems.sauth.auth;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * Username and password carried by an {@code Authorization: Basic ...} request header.
 *
 * @param username the decoded username
 * @param password the decoded password
 */
public record BasicCredentials(String username, String password) {

  /**
   * Authentication scheme name, matched case-insensitively.
   */
  public static final String SCHEME = "Basic";

  /**
   * Extracts credentials from an {@code Authorization} header value.
   * <p>
   * The payload is standard Base64 of {@code username:password} in UTF-8 and is split at the
   * first colon, so passwords may contain colons.
   *
   * @param header the raw header value, may be null
   * @return the credentials, or empty if the header is missing or malformed
   */
  public static Optional<BasicCredentials> fromAuthorizationHeader(String header) {
    if (header == null) {
      return Optional.empty();
    }
    int space = header.indexOf(' ');
    if (space <= 0 || !SCHEME.equalsIgnoreCase(header.substring(0, space))) {
      return Optional.empty();
    }
    String decoded;
    try {
      byte[] bytes = Base64.getDecoder().decode(header.substring(space + 1).trim());
      decoded = new String(bytes, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
    int colon = decoded.indexOf(':');
    if (colon < 0) {
      return Optional.empty();
    }
    return Optional.of(new BasicCredentials(decoded.substring(0, colon), decoded.substring(colon + 1)));
  }

  /**
   * Builds the header value for these credentials.
   *
   * @return {@code Basic base64(username:password)}
   */
  public String toAuthorizationHeader() {
    String pair = username + ":" + password;
    return SCHEME + " " + Base64.getEncoder().encodeToString(pair.getBytes(StandardCharsets.UTF_8));
  }

  @Override
  public String toString() {
    return "BasicCredentials[username=" + username + "]";
  }
}
