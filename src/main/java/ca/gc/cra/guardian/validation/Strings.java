package ca.gc.cra.guardian.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Checks for identifiers and free text reaching GUARDIAN from the CLI and configuration
 * files.
 * <p><strong>Why:</strong> Session ids, child ids and stage names end up in NDJSON records, metric keys and log
 * lines, so they must be short and printable before any adapter touches them. A child's question may span
 * several lines, so free text keeps tabs and line breaks.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 1.0.0
 * @see Numbers
 */
public final class Strings {
  /** Longest identifier accepted; a UUID plus a short prefix fits. */
  public static final int MAX_IDENTIFIER_LENGTH = 64;

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9._-]+");

  private Strings() {
    // Utility
  }

  /**
   * Trims free text and rejects it when blank or carrying control characters other than tab, CR and LF.
   *
   * @param name parameter name used in messages
   * @param value candidate text
   * @return trimmed text
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed text is blank or contains other control characters
   */
  public static String requireNonBlank(String name, String value) {
    String trimmed = Objects.requireNonNull(value, label(name)).trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      if (Character.isISOControl(c) && c != '\t' && c != '\n' && c != '\r') {
        throw new IllegalArgumentException(label(name) + " must not contain control characters");
      }
    }
    return trimmed;
  }

  /**
   * Validates a session id, child id or stage name.
   *
   * @param name parameter name used in messages
   * @param value candidate identifier
   * @return trimmed identifier matching {@code [A-Za-z0-9._-]+}, at most {@value #MAX_IDENTIFIER_LENGTH} chars
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the identifier is blank, too long or uses other characters
   */
  public static String requireIdentifier(String name, String value) {
    String id = requireNonBlank(name, value);
    if (id.length() > MAX_IDENTIFIER_LENGTH) {
      throw new IllegalArgumentException(
          label(name) + " must be at most " + MAX_IDENTIFIER_LENGTH + " characters");
    }
    if (!IDENTIFIER.matcher(id).matches()) {
      throw new IllegalArgumentException(
          label(name) + " must only contain letters, digits, dot, underscore or hyphen");
    }
    return id;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
