package ca.gc.cra.guardian.domain.safety;

/**
 * Ordinal severity scale from {@code 0} (safe) to {@code 4} (critical).
 *
 * @since 1.0.0
 */
public enum SeverityLevel {
  SAFE(0),
  MINOR(1),
  MODERATE(2),
  SEVERE(3),
  CRITICAL(4);

  private final int level;

  SeverityLevel(int level) {
    this.level = level;
  }

  /**
   * Returns the numeric level.
   *
   * @return value in {@code [0, 4]}
   */
  public int level() {
    return level;
  }

  /**
   * Raises the severity one level, saturating at {@link #CRITICAL}.
   *
   * @return next level up, or {@code CRITICAL}
   */
  public SeverityLevel amplified() {
    return of(Math.min(CRITICAL.level, level + 1));
  }

  /**
   * Indicates whether this level is at or above {@code threshold}.
   *
   * @param threshold level to compare against
   * @return {@code true} when {@code level() >= threshold.level()}
   */
  public boolean atLeast(SeverityLevel threshold) {
    return level >= threshold.level;
  }

  /**
   * Returns the higher of two levels.
   *
   * @param a first level
   * @param b second level
   * @return the more severe level
   */
  public static SeverityLevel max(SeverityLevel a, SeverityLevel b) {
    return a.level >= b.level ? a : b;
  }

  /**
   * Resolves a numeric level.
   *
   * @param level value in {@code [0, 4]}
   * @return matching severity
   * @throws IllegalArgumentException when {@code level} is out of range
   */
  public static SeverityLevel of(int level) {
    for (SeverityLevel candidate : values()) {
      if (candidate.level == level) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("severity must be between 0 and 4 (was " + level + ")");
  }
}
