package ca.gc.cra.guardian.domain.age;

import java.util.Locale;
import java.util.Optional;

/**
 * <strong>What:</strong> Closed, ordered partition of the supported age domain {@code [2, 18]}.
 * <p><strong>Why:</strong> Every safety and adaptation decision is keyed by band; a single table keeps the
 * boundaries from drifting between components.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Own one disjoint inclusive sub-range per band.</li>
 *   <li>Expose the configuration key used in {@code guardian.yaml}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 1.0.0
 * @see AgeClassifier
 */
public enum AgeBand {
  /** Ages 2 to 4. */
  TODDLER("toddler", 2, 4),
  /** Ages 5 to 6. */
  PRESCHOOL("preschool", 5, 6),
  /** Ages 7 to 8. */
  EARLY_ELEMENTARY("early_elementary", 7, 8),
  /** Ages 9 to 10. */
  LATE_ELEMENTARY("late_elementary", 9, 10),
  /** Ages 11 to 13. */
  MIDDLE("middle", 11, 13),
  /** Ages 14 to 17. */
  HIGH("high", 14, 17),
  /** Age 18. */
  ADULT("adult", 18, 18);

  private final String key;
  private final AgeRange range;

  AgeBand(String key, int min, int max) {
    this.key = key;
    this.range = new AgeRange(min, max);
  }

  /**
   * Returns the lower-case configuration key (e.g., {@code early_elementary}).
   *
   * @return stable configuration key
   */
  public String key() {
    return key;
  }

  /**
   * Returns the inclusive bounds owned by this band.
   *
   * @return immutable range
   */
  public AgeRange range() {
    return range;
  }

  /**
   * Indicates whether the band claims the supplied age.
   *
   * @param age age in whole years
   * @return {@code true} when {@code age} lies inside this band's inclusive range
   */
  public boolean contains(int age) {
    return range.contains(age);
  }

  /**
   * Indicates whether this band is strictly younger than {@code other}.
   *
   * @param other band to compare against; must not be {@code null}
   * @return {@code true} when this band's range lies below {@code other}'s
   */
  public boolean isYoungerThan(AgeBand other) {
    return compareTo(other) < 0;
  }

  /**
   * Resolves a band from its configuration key, ignoring case and treating hyphens as underscores.
   *
   * @param raw key such as {@code late_elementary}
   * @return matching band, or empty when the key is unknown
   */
  public static Optional<AgeBand> fromKey(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    for (AgeBand band : values()) {
      if (band.key.equals(normalized)) {
        return Optional.of(band);
      }
    }
    return Optional.empty();
  }
}
