package ca.gc.cra.guardian.domain.age;

import java.util.ArrayList;
import java.util.List;

/**
 * <strong>What:</strong> Maps a whole-year age to exactly one {@link AgeBand}.
 * <p><strong>Why:</strong> Centralizes the boundary table that both the safety engine and the adapter
 * depend on, so there is only one place an off-by-one can live.</p>
 * <p><strong>Role:</strong> Stateless domain service; the foundation of every per-band lookup.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Linear scan over seven bands.</p>
 *
 * @since 1.0.0
 */
public final class AgeClassifier {
  /** Lowest supported age, inclusive. */
  public static final int MIN_AGE = 2;
  /** Highest supported age, inclusive. */
  public static final int MAX_AGE = 18;

  private AgeClassifier() {
    // Utility
  }

  /**
   * Classifies an age into its band.
   *
   * @param age age in whole years
   * @return the single band whose range contains {@code age}
   * @throws InvalidAgeException if {@code age} is below {@link #MIN_AGE} or above {@link #MAX_AGE}
   */
  public static AgeBand classify(int age) {
    if (!isSupported(age)) {
      throw new InvalidAgeException(age);
    }
    for (AgeBand band : AgeBand.values()) {
      if (band.contains(age)) {
        return band;
      }
    }
    // Unreachable while the band table covers the supported domain.
    throw new IllegalStateException("no age band covers age " + age);
  }

  /**
   * Returns the inclusive bounds for {@code band}.
   *
   * @param band band to describe; must not be {@code null}
   * @return immutable inclusive range
   */
  public static AgeRange rangeOf(AgeBand band) {
    return band.range();
  }

  /**
   * Indicates whether {@code age} lies in the supported domain.
   *
   * @param age candidate age
   * @return {@code true} when {@code MIN_AGE <= age <= MAX_AGE}
   */
  public static boolean isSupported(int age) {
    return age >= MIN_AGE && age <= MAX_AGE;
  }

  /**
   * Lists every band that claims {@code age}. For a well-formed table the result has at most one entry.
   *
   * @param age age to check, supported or not
   * @return bands containing the age, in band order
   */
  public static List<AgeBand> bandsClaiming(int age) {
    List<AgeBand> claims = new ArrayList<>(1);
    for (AgeBand band : AgeBand.values()) {
      if (band.contains(age)) {
        claims.add(band);
      }
    }
    return List.copyOf(claims);
  }
}
