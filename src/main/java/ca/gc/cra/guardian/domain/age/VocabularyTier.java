package ca.gc.cra.guardian.domain.age;

import java.util.Locale;

/**
 * Vocabulary table used when substituting complex terms.
 *
 * @since 1.0.0
 */
public enum VocabularyTier {
  BASIC,
  INTERMEDIATE,
  ADVANCED,
  /** No substitution is performed. */
  UNRESTRICTED;

  /**
   * Parses a configuration literal such as {@code basic}.
   *
   * @param raw literal, case-insensitive
   * @return matching tier
   * @throws IllegalArgumentException if the literal is blank or unknown
   */
  public static VocabularyTier parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("vocabulary tier must not be blank");
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown vocabulary tier: " + raw, ex);
    }
  }
}
