package com.example.sqlcredentials.core.credentials;

import com.example.sqlcredentials.core.GenerationException;
import java.time.Instant;

/** Produces the values templated into account management statements. */
public interface CredentialGenerator {

  /**
   * Builds a fresh username.
   *
   * @param config display and role name hints
   * @return a username no longer than the policy allows
   * @throws GenerationException if the length policy cannot produce a name
   */
  String generateUsername(final UsernameConfig config) throws GenerationException;

  /**
   * Builds a fresh random password.
   *
   * @return password
   * @throws GenerationException if no password can be produced
   */
  String generatePassword() throws GenerationException;

  /**
   * Renders an expiration time as a SQL literal.
   *
   * @param expiration expiration instant
   * @return formatted timestamp
   * @throws GenerationException if the instant is missing
   */
  String generateExpiration(final Instant expiration) throws GenerationException;

  /**
   * Generates username, password and expiration in one go.
   *
   * @param config naming hints
   * @param expiration expiration instant
   * @return the generated values
   * @throws GenerationException if any part cannot be generated
   */
  default GeneratedCredential generate(final UsernameConfig config, final Instant expiration)
      throws GenerationException {
    return new GeneratedCredential(
        generateUsername(config), generatePassword(), generateExpiration(expiration));
  }
}
