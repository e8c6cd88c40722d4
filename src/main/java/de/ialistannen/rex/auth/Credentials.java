package de.ialistannen.rex.auth;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Credentials sent to a registry with every request. Anonymous access is modelled by not having credentials at all.
 */
public sealed interface Credentials permits Credentials.Basic, Credentials.Bearer {

  /**
   * @return the value of the {@code Authorization} header
   */
  String headerValue();

  static Credentials basic(String username, String password) {
    return new Basic(username, password);
  }

  static Credentials bearer(String token) {
    return new Bearer(token);
  }

  record Basic(String username, String password) implements Credentials {

    @Override
    public String headerValue() {
      String joined = username + ":" + password;
      return "Basic " + Base64.getEncoder().encodeToString(joined.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
      return "Basic[username=" + username + ", password=***]";
    }
  }

  record Bearer(String token) implements Credentials {

    @Override
    public String headerValue() {
      return "Bearer " + token;
    }

    @Override
    public String toString() {
      return "Bearer[token=***]";
    }
  }
}
