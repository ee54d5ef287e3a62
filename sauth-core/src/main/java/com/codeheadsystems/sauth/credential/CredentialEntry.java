package com.codeheadsystems.sauth.credential;

/**
 * A single configured username/password pair.
 *
 * @param username the username, never empty
 * @param password the password, never empty
 */
public record CredentialEntry(String username, String password) {

  /**
   * Returns true when both fields match exactly (case-sensitive).
   *
   * @param username the presented username
   * @param password the presented password
   * @return whether this entry matches
   */
  public boolean matches(String username, String password) {
    return this.username.equals(username) && this.password.equals(password);
  }

  @Override
  public String toString() {
    return "CredentialEntry[username=" + username + ", password=" + CredentialStore.MASK + "]";
  }
}
