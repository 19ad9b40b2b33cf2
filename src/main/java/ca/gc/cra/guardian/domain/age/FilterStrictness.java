package ca.gc.cra.guardian.domain.age;

import java.util.Locale;

/**
 * How aggressively a band's input is screened. The two strict levels also enable context analysis
 * (overlong input, keyboard mashing, shouting).
 *
 * @since 1.0.0
 */
public enum FilterStrictness {
  MAXIMUM,
  HIGH,
  MODERATE,
  STANDARD;

  /**
   * Indicates whether context analysis applies at this level.
   *
   * @return {@code true} for {@link #MAXIMUM} and {@link #HIGH}
   */
  public boolean strict() {
    return this == MAXIMUM || this == HIGH;
  }

  /**
   * Parses a configuration literal such as {@code maximum}.
   *
   * @param raw literal, case-insensitive
   * @return matching level
   * @throws IllegalArgumentException if the literal is blank or unknown
   */
  public static FilterStrictness parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("filter strictness must not be blank");
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown filter strictness: " + raw, ex);
    }
  }
}
