package com.example.sqlcredentials.core.credentials;

/**
 * Account returned to the caller after a successful creation.
 *
 * @param username account name
 * @param password account password
 */
public record DatabaseUser(String username, String password) {

  @Override
  public String toString() {
    return "DatabaseUser[username=" + username + "]";
  }
}
