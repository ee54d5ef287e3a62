package com.codeheadsystems.sauth.credential;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable, ordered list of username/password pairs parsed from a configuration string.
 * <p>
 * The configuration format is one {@code username,password} pair per line, e.g.
 * <pre>{@code
 *   foo,bar
 *   username,password
 *   us3r,p@ssw0rd1
 * }</pre>
 * Lines that do not split into exactly two non-empty fields are skipped with a warning.
 * Usernames are not required to be unique; the first matching entry wins.
 * <p>
 * Instances are safe to share between request threads without locking.
 * <p>
 * Passwords are compared with {@link String#equals}, so comparison time is not constant.
 */
public final class CredentialStore {

  /**
   * Replacement text used wherever a password would otherwise be printed.
   */
  public static final String MASK = "********";

  private static final Logger log = LoggerFactory.getLogger(CredentialStore.class);

  private final List<CredentialEntry> entries;

  private CredentialStore(List<CredentialEntry> entries) {
    this.entries = List.copyOf(entries);
  }

  /**
   * Parses the raw configuration string.
   *
   * @param raw newline separated {@code username,password} lines
   * @return the credential store
   * @throws InvalidConfigurationException if no valid entry remains after parsing
   */
  public static CredentialStore parse(String raw) {
    if (raw == null) {
      throw new InvalidConfigurationException("No credentials were provided");
    }
    List<CredentialEntry> entries = new ArrayList<>();
    String[] lines = raw.split("\n", -1);
    for (int i = 0; i < lines.length; i++) {
      String[] fields = lines[i].split(",", -1);
      if (fields.length != 2 || fields[0].isEmpty() || fields[1].isEmpty()) {
        // The raw line may hold a password, so only its position is reported.
        log.warn("Ignoring malformed credential entry on line {} ({} field(s))", i + 1, fields.length);
        continue;
      }
      entries.add(new CredentialEntry(fields[0], fields[1]));
    }
    if (entries.isEmpty()) {
      throw new InvalidConfigurationException("No valid credential was provided");
    }
    return new CredentialStore(entries);
  }

  /**
   * Checks a presented username/password pair against the configured entries.
   *
   * @param username the username
   * @param password the password
   * @return true on the first exact match of both fields
   */
  public boolean lookup(String username, String password) {
    if (username == null || password == null) {
      return false;
    }
    for (CredentialEntry entry : entries) {
      if (entry.matches(username, password)) {
        return true;
      }
    }
    return false;
  }

  /**
   * The parsed entries, in configuration order.
   *
   * @return an unmodifiable list
   */
  public List<CredentialEntry> entries() {
    return entries;
  }

  /**
   * Number of valid entries.
   *
   * @return the size
   */
  public int size() {
    return entries.size();
  }

  /**
   * Human readable description with every password masked.
   *
   * @return one {@code username=..., pass=********} line per entry
   */
  public String describe() {
    StringBuilder desc = new StringBuilder();
    for (CredentialEntry entry : entries) {
      desc.append("username=").append(entry.username())
          .append(", pass=").append(MASK)
          .append('\n');
    }
    return desc.toString();
  }

  @Override
  public String toString() {
    return describe();
  }
}
