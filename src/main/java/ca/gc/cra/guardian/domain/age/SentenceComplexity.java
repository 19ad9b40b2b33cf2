package ca.gc.cra.guardian.domain.age;

import java.util.Locale;

/**
 * Sentence-structure tier a band's responses are rewritten towards.
 *
 * @since 1.0.0
 */
public enum SentenceComplexity {
  /** One clause per sentence. */
  SIMPLE,
  /** At most two clauses per sentence. */
  COMPOUND,
  /** Passed through unchanged. */
  COMPLEX,
  /** Passed through unchanged. */
  SOPHISTICATED;

  /**
   * Parses a configuration literal such as {@code compound}.
   *
   * @param raw literal, case-insensitive
   * @return matching tier
   * @throws IllegalArgumentException if the literal is blank or unknown
   */
  public static SentenceComplexity parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("sentence complexity must not be blank");
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown sentence complexity: " + raw, ex);
    }
  }
}
