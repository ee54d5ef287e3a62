package com.codeheadsystems.sauth.springboot.config;

import com.codeheadsystems.sauth.session.SessionCookieConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "sauth")
public class SauthProperties {

  private String credentials = "";
  private String sessionSecretHex = "";
  private long sessionMaxAgeSeconds = SessionCookieConfig.DEFAULT_MAX_AGE.toSeconds();
  private String sessionCookieName = SessionCookieConfig.DEFAULT_COOKIE_NAME;
  private boolean secureCookie = false;
  private String urlPattern = "/*";

  public String getCredentials() {
    return credentials;
  }

  public void setCredentials(String credentials) {
    this.credentials = credentials;
  }

  public String getSessionSecretHex() {
    return sessionSecretHex;
  }

  public void setSessionSecretHex(String sessionSecretHex) {
    this.sessionSecretHex = sessionSecretHex;
  }

  public long getSessionMaxAgeSeconds() {
    return sessionMaxAgeSeconds;
  }

  public void setSessionMaxAgeSeconds(long sessionMaxAgeSeconds) {
    this.sessionMaxAgeSeconds = sessionMaxAgeSeconds;
  }

  public String getSessionCookieName() {
    return sessionCookieName;
  }

  public void setSessionCookieName(String sessionCookieName) {
    this.sessionCookieName = sessionCookieName;
  }

  public boolean isSecureCookie() {
    return secureCookie;
  }

  public void setSecureCookie(boolean secureCookie) {
    this.secureCookie = secureCookie;
  }

  public String getUrlPattern() {
    return urlPattern;
  }

  public void setUrlPattern(String urlPattern) {
    this.urlPattern = urlPattern;
  }
}
