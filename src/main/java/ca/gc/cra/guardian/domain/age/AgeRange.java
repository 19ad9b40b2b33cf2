package ca.gc.cra.guardian.domain.age;

/**
 * Inclusive age bounds owned by an {@link AgeBand}.
 *
 * @param min lowest age in the band, inclusive
 * @param max highest age in the band, inclusive
 * @since 1.0.0
 */
public record AgeRange(int min, int max) {

  /**
   * Validates that the bounds are ordered.
   *
   * @param min lowest age, inclusive
   * @param max highest age, inclusive
   */
  public AgeRange {
    if (min > max) {
      throw new IllegalArgumentException("min must be <= max (was " + min + ".." + max + ")");
    }
  }

  /**
   * Indicates whether {@code age} lies within the range.
   *
   * @param age candidate age
   * @return {@code true} when {@code min <= age <= max}
   */
  public boolean contains(int age) {
    return age >= min && age <= max;
  }

  /**
   * Number of whole ages covered by the range.
   *
   * @return width of the range
   */
  public int size() {
    return max - min + 1;
  }

  @Override
  public String toString() {
    return min + ".." + max;
  }
}
