package com.example.sqlcredentials.core.credentials;

import java.util.Objects;

/**
 * Length limits applied when building usernames.
 *
 * <p>Two profiles are provided. {@link #CURRENT} fits engines that accept 32 character account
 * names (MySQL 5.7.8 and later). {@link #LEGACY} keeps names within the 16 characters older
 * engines allow.
 *
 * @param displayNameLength maximum characters kept from the display name
 * @param roleNameLength maximum characters kept from the role name
 * @param maxUsernameLength maximum length of the whole username
 * @param separator text placed between name segments
 */
public record UsernamePolicy(
    int displayNameLength, int roleNameLength, int maxUsernameLength, String separator) {

  /** Profile for engines that accept 32 character usernames. */
  public static final UsernamePolicy CURRENT = new UsernamePolicy(10, 10, 32, "-");

  /** Profile for engines limited to 16 character usernames. */
  public static final UsernamePolicy LEGACY = new UsernamePolicy(4, 4, 16, "-");

  public UsernamePolicy {
    Objects.requireNonNull(separator, "separator");
  }
}
