package com.example.sqlcredentials.core.credentials;

import static org.junit.jupiter.api.Assertions.*;

import com.example.sqlcredentials.core.GenerationException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.HashSet;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class SqlCredentialGeneratorTest {

  private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");

  private SqlCredentialGenerator generator(final UsernamePolicy policy) {
    return new SqlCredentialGenerator(
        policy, Clock.fixed(NOW, ZoneOffset.UTC), ZoneOffset.UTC, new SecureRandom());
  }

  @Nested
  @DisplayName("Usernames")
  class Usernames {

    @Test
    @DisplayName("Should build prefix, truncated names, random part and timestamp")
    void shouldBuildUsernameFromSegments() throws GenerationException {
      final var policy = new UsernamePolicy(10, 10, 100, "-");

      final var username =
          generator(policy).generateUsername(new UsernameConfig("token-display", "readonly-role"));

      assertTrue(username.startsWith("v-token-disp-readonly-r-"));
      assertTrue(username.endsWith("-" + NOW.getEpochSecond()));
    }

    @Test
    @DisplayName("Should skip empty display and role names")
    void shouldSkipEmptyNames() throws GenerationException {
      final var username =
          generator(new UsernamePolicy(10, 10, 100, "_"))
              .generateUsername(new UsernameConfig("", null));

      assertTrue(username.matches("v_[A-Za-z0-9]{20}_" + NOW.getEpochSecond()), username);
    }

    @Test
    @DisplayName("Should respect the current profile maximum length")
    void shouldRespectCurrentMaximum() throws GenerationException {
      final var username =
          generator(UsernamePolicy.CURRENT)
              .generateUsername(new UsernameConfig("a-very-long-display-name", "a-long-role"));

      assertEquals(32, username.length());
      assertTrue(username.startsWith("v-a-very-lon-a-long-rol-"));
    }

    @Test
    @DisplayName("Should never split a surrogate pair when truncating")
    void shouldTruncateOnCodePoints() throws GenerationException {
      final var username =
          generator(new UsernamePolicy(3, 3, 100, "-"))
              .generateUsername(new UsernameConfig("\uD83D\uDE00\uD83D\uDE00", "r\uD83D\uDE80xyz"));

      assertTrue(username.startsWith("v-\uD83D\uDE00\uD83D\uDE00-r\uD83D\uDE80x-"), username);
      assertTrue(
          username.codePoints().noneMatch(cp -> Character.getType(cp) == Character.SURROGATE),
          username);
    }

    @Test
    @DisplayName("Should count the maximum length in characters, not code units")
    void shouldCapMaximumOnCodePoints() throws GenerationException {
      final var username =
          generator(new UsernamePolicy(10, 10, 4, "-"))
              .generateUsername(new UsernameConfig("\uD83D\uDE00\uD83D\uDE00", ""));

      assertEquals("v-\uD83D\uDE00\uD83D\uDE00", username);
      assertEquals(4, username.codePointCount(0, username.length()));
    }

    @Test
    @DisplayName("Should respect the legacy profile maximum length")
    void shouldRespectLegacyMaximum() throws GenerationException {
      final var username =
          generator(UsernamePolicy.LEGACY)
              .generateUsername(new UsernameConfig("display", "role-name"));

      assertEquals(16, username.length());
      assertTrue(username.startsWith("v-disp-role-"));
    }

    @Test
    @DisplayName("Should never exceed the maximum for any small maximum")
    void shouldNeverExceedMaximum() throws GenerationException {
      for (var max = 1; max <= 40; max++) {
        final var username =
            generator(new UsernamePolicy(3, 3, max, "-"))
                .generateUsername(new UsernameConfig("display", "role"));
        assertTrue(username.length() <= max, "length " + username.length() + " > " + max);
        assertFalse(username.isEmpty());
      }
    }

    @Test
    @DisplayName("Should generate distinct usernames")
    void shouldGenerateDistinctUsernames() throws GenerationException {
      final var gen = generator(UsernamePolicy.CURRENT);
      final var seen = new HashSet<String>();
      for (var i = 0; i < 100; i++) seen.add(gen.generateUsername(new UsernameConfig("d", "r")));
      assertEquals(100, seen.size());
    }

    @Test
    @DisplayName("Should reject non-positive lengths")
    void shouldRejectNonPositiveLengths() {
      final var config = new UsernameConfig("display", "role");
      assertThrows(
          GenerationException.class,
          () -> generator(new UsernamePolicy(0, 10, 32, "-")).generateUsername(config));
      assertThrows(
          GenerationException.class,
          () -> generator(new UsernamePolicy(10, -1, 32, "-")).generateUsername(config));
      assertThrows(
          GenerationException.class,
          () -> generator(new UsernamePolicy(10, 10, 0, "-")).generateUsername(config));
    }

    @Test
    @DisplayName("Should require a separator")
    void shouldRequireSeparator() {
      assertThrows(NullPointerException.class, () -> new UsernamePolicy(1, 1, 1, null));
    }
  }

  @Nested
  @DisplayName("Passwords")
  class Passwords {

    @Test
    @DisplayName("Should prefix twenty alphanumerics with A1a-")
    void shouldHaveExpectedShape() {
      final var password = generator(UsernamePolicy.CURRENT).generatePassword();
      assertTrue(password.matches("A1a-[A-Za-z0-9]{20}"), password);
    }

    @Test
    @DisplayName("Should not repeat passwords")
    void shouldNotRepeat() {
      final var gen = generator(UsernamePolicy.CURRENT);
      assertNotEquals(gen.generatePassword(), gen.generatePassword());
    }
  }

  @Nested
  @DisplayName("Expiration")
  class Expiration {

    @Test
    @DisplayName("Should format in UTC with numeric offset")
    void shouldFormatUtc() throws GenerationException {
      assertEquals(
          "2026-10-19 13:00:00+0000",
          generator(UsernamePolicy.CURRENT)
              .generateExpiration(Instant.parse("2026-10-19T13:00:00Z")));
    }

    @Test
    @DisplayName("Should format in the configured zone")
    void shouldFormatInZone() throws GenerationException {
      final var gen =
          new SqlCredentialGenerator(
              UsernamePolicy.CURRENT,
              Clock.systemUTC(),
              ZoneId.of("Europe/Berlin"),
              new SecureRandom());

      assertEquals(
          "2026-01-15 13:30:00+0100", gen.generateExpiration(Instant.parse("2026-01-15T12:30:00Z")));
    }

    @Test
    @DisplayName("Should be deterministic")
    void shouldBeDeterministic() throws GenerationException {
      final var gen = generator(UsernamePolicy.CURRENT);
      assertEquals(gen.generateExpiration(NOW), gen.generateExpiration(NOW));
    }

    @Test
    @DisplayName("Should reject a missing expiration")
    void shouldRejectNull() {
      assertThrows(
          GenerationException.class, () -> generator(UsernamePolicy.CURRENT).generateExpiration(null));
    }
  }

  @Test
  @DisplayName("Should generate all values together")
  void shouldGenerateAll() throws GenerationException {
    final var credential =
        generator(UsernamePolicy.CURRENT)
            .generate(new UsernameConfig("d", "r"), Instant.parse("2026-10-19T13:00:00Z"));

    assertTrue(credential.username().startsWith("v-d-r-"));
    assertTrue(credential.password().startsWith("A1a-"));
    assertEquals("2026-10-19 13:00:00+0000", credential.expiration());
    assertFalse(credential.toString().contains(credential.password()));
  }
}
