package com.example.sqlcredentials.core.template;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Splits raw statement text into individual statements and fills in {@code {{key}}} placeholders.
 *
 * <p>Substitution is plain text replacement without SQL escaping: templates come from the
 * administrator configuring a role, not from end users. Placeholders without a value in the context
 * are left untouched.
 *
 * <pre>{@code
 * var statements = StatementTemplate.render(
 *     "CREATE USER '{{name}}'@'%' IDENTIFIED BY '{{password}}'; GRANT SELECT ON *.* TO '{{name}}'@'%'",
 *     Map.of("name", "v-app-x1", "password", "secret"));
 * // [CREATE USER 'v-app-x1'@'%' IDENTIFIED BY 'secret', GRANT SELECT ON *.* TO 'v-app-x1'@'%']
 * }</pre>
 */
public final class StatementTemplate {

  /** Account name placeholder used by creation and revocation. */
  public static final String NAME = "name";

  /** Password placeholder used by creation and root rotation. */
  public static final String PASSWORD = "password";

  /** Expiration placeholder used by creation. */
  public static final String EXPIRATION = "expiration";

  /** Root account name placeholder used by root rotation. */
  public static final String USERNAME = "username";

  private static final String DELIMITER = ";";

  private StatementTemplate() {}

  /**
   * Renders one raw statement string.
   *
   * @param raw text holding one or more {@code ;}-delimited statements
   * @param context placeholder values keyed by name
   * @return non-empty rendered statements in source order
   */
  public static List<String> render(final String raw, final Map<String, String> context) {
    final var rendered = new ArrayList<String>();
    if (raw == null) return rendered;

    for (final var piece : raw.split(DELIMITER, -1)) {
      final var statement = piece.strip();
      if (statement.isEmpty()) continue;
      rendered.add(substitute(statement, context));
    }
    return rendered;
  }

  /**
   * Renders every entry of a batch, keeping batch order and the order within each entry.
   *
   * @param batch raw statement strings
   * @param context placeholder values keyed by name
   * @return all non-empty rendered statements
   */
  public static List<String> renderAll(final List<String> batch, final Map<String, String> context) {
    final var rendered = new ArrayList<String>();
    for (final var raw : batch) rendered.addAll(render(raw, context));
    return List.copyOf(rendered);
  }

  private static String substitute(final String statement, final Map<String, String> context) {
    var result = statement;
    for (final var entry : context.entrySet()) {
      result = result.replace("{{" + entry.getKey() + "}}", entry.getValue());
    }
    return result;
  }
}
