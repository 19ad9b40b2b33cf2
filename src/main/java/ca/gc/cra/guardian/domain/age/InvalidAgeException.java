package ca.gc.cra.guardian.domain.age;

/**
 * Raised when an age falls outside the supported domain. Callers must fail closed; no nearest band is
 * ever substituted.
 *
 * @since 1.0.0
 */
public final class InvalidAgeException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final int age;

  /**
   * Creates an exception describing the rejected age.
   *
   * @param age rejected age
   */
  public InvalidAgeException(int age) {
    super("age must be between " + AgeClassifier.MIN_AGE + " and " + AgeClassifier.MAX_AGE
        + " (was " + age + ")");
    this.age = age;
  }

  /**
   * Returns the age that failed validation.
   *
   * @return rejected age
   */
  public int age() {
    return age;
  }
}
