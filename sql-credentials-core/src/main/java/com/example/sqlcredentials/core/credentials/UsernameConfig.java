package com.example.sqlcredentials.core.credentials;

/**
 * Caller-provided naming hints for a generated account.
 *
 * @param displayName display name of the requesting identity, may be empty
 * @param roleName name of the role the account is created for, may be empty
 */
public record UsernameConfig(String displayName, String roleName) {

  public UsernameConfig {
    displayName = displayName == null ? "" : displayName;
    roleName = roleName == null ? "" : roleName;
  }
}
