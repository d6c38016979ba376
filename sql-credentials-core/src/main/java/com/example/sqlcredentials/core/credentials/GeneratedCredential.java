package com.example.sqlcredentials.core.credentials;

/**
 * Values produced once for a single account creation.
 *
 * @param username generated account name
 * @param password generated password
 * @param expiration expiration rendered as a SQL literal
 */
public record GeneratedCredential(String username, String password, String expiration) {

  @Override
  public String toString() {
    return "GeneratedCredential[username=" + username + ", expiration=" + expiration + "]";
  }
}
