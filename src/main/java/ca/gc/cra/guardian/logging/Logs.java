package ca.gc.cra.guardian.logging;

/**
 * <strong>What:</strong> Log hygiene helpers for child-authored text.
 * <p><strong>Why:</strong> Children's messages and names must not land in operator logs in full.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 1.0.0
 * @see LoggingConfigurator
 */
public final class Logs {
  /** Default excerpt length for child text in log lines. */
  public static final int EXCERPT_CHARS = 120;

  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";

  private Logs() {
    // Utility
  }

  /**
   * Shortens text to at most {@code maxChars} characters, never splitting a surrogate pair.
   *
   * @param value text to shorten; {@code null} yields {@code "<null>"}
   * @param maxChars maximum characters kept; must be positive
   * @return original text when short enough, otherwise the prefix followed by {@code "… (N chars)"}
   * @throws IllegalArgumentException if {@code maxChars} is not positive
   */
  public static String truncate(String value, int maxChars) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    if (value.length() <= maxChars) {
      return value;
    }
    int end = maxChars;
    if (Character.isHighSurrogate(value.charAt(end - 1))) {
      end--;
    }
    return value.substring(0, end) + "… (" + value.length() + " chars)";
  }

  /**
   * Shortens text to {@link #EXCERPT_CHARS}.
   *
   * @param value text to shorten
   * @return excerpt
   */
  public static String excerpt(String value) {
    return truncate(value, EXCERPT_CHARS);
  }

  /**
   * Returns a placeholder in place of a sensitive value such as a child's name.
   *
   * @param value ignored
   * @return {@code "[REDACTED]"}, or {@code "<null>"} when there was nothing to hide
   */
  public static String redact(String value) {
    return value == null ? NULL_PLACEHOLDER : REDACTED_PLACEHOLDER;
  }
}
