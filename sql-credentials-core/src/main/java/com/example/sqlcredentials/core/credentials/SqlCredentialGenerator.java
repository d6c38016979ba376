package com.example.sqlcredentials.core.credentials;

import com.example.sqlcredentials.core.GenerationException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * {@link CredentialGenerator} for SQL engines.
 *
 * <p>Usernames look like {@code v-<display>-<role>-<random>-<epochSeconds>}, with the display and
 * role segments truncated to the policy's lengths and the whole name cut to the maximum username
 * length. Passwords are {@code A1a-} followed by twenty random alphanumerics, so every password
 * holds an upper case letter, a lower case letter, a digit and a symbol.
 */
public final class SqlCredentialGenerator implements CredentialGenerator {

  private static final String PREFIX = "v";
  private static final String PASSWORD_PREFIX = "A1a-";
  private static final int RANDOM_LENGTH = 20;
  private static final char[] ALPHANUMERIC =
      "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789".toCharArray();
  private static final DateTimeFormatter EXPIRATION_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ssZ");

  private final UsernamePolicy policy;
  private final Clock clock;
  private final ZoneId zone;
  private final SecureRandom random;

  public SqlCredentialGenerator(final UsernamePolicy policy) {
    this(policy, Clock.systemUTC(), ZoneOffset.UTC, new SecureRandom());
  }

  public SqlCredentialGenerator(
      final UsernamePolicy policy, final Clock clock, final ZoneId zone, final SecureRandom random) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.zone = Objects.requireNonNull(zone, "zone");
    this.random = Objects.requireNonNull(random, "random");
  }

  public UsernamePolicy policy() {
    return policy;
  }

  @Override
  public String generateUsername(final UsernameConfig config) throws GenerationException {
    validatePolicy();

    final var separator = policy.separator();
    final var username = new StringBuilder(PREFIX);

    final var displayName = truncate(config.displayName(), policy.displayNameLength());
    if (!displayName.isEmpty()) username.append(separator).append(displayName);

    final var roleName = truncate(config.roleName(), policy.roleNameLength());
    if (!roleName.isEmpty()) username.append(separator).append(roleName);

    username.append(separator).append(randomAlphanumeric(RANDOM_LENGTH));
    username.append(separator).append(clock.instant().getEpochSecond());

    return truncate(username.toString(), policy.maxUsernameLength());
  }

  @Override
  public String generatePassword() {
    return PASSWORD_PREFIX + randomAlphanumeric(RANDOM_LENGTH);
  }

  @Override
  public String generateExpiration(final Instant expiration) throws GenerationException {
    if (expiration == null) throw new GenerationException("expiration is required");
    return EXPIRATION_FORMAT.format(expiration.atZone(zone));
  }

  private void validatePolicy() throws GenerationException {
    if (policy.displayNameLength() < 1)
      throw new GenerationException("display name length must be >= 1");
    if (policy.roleNameLength() < 1) throw new GenerationException("role name length must be >= 1");
    if (policy.maxUsernameLength() < 1)
      throw new GenerationException("maximum username length must be >= 1");
  }

  private String randomAlphanumeric(final int length) {
    final var chars = new char[length];
    for (var i = 0; i < length; i++) chars[i] = ALPHANUMERIC[random.nextInt(ALPHANUMERIC.length)];
    return new String(chars);
  }

  // Cuts on code points so a surrogate pair is never split.
  private static String truncate(final String value, final int length) {
    if (value.codePointCount(0, value.length()) <= length) return value;
    return value.substring(0, value.offsetByCodePoints(0, length));
  }
}
