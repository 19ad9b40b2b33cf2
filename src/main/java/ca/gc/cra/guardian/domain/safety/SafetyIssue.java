package ca.gc.cra.guardian.domain.safety;

import java.util.Objects;

/**
 * One pattern match found during a safety evaluation. Repeated matches produce repeated issues.
 *
 * @param category category of the pattern that matched
 * @param matched matched text as it appeared in the normalized input
 * @param severity base severity before age weighting
 * @since 1.0.0
 */
public record SafetyIssue(SafetyCategory category, String matched, SeverityLevel severity) {

  /**
   * Validates required fields.
   */
  public SafetyIssue {
    category = Objects.requireNonNull(category, "category");
    matched = Objects.requireNonNull(matched, "matched");
    severity = Objects.requireNonNull(severity, "severity");
    if (category == SafetyCategory.SAFE) {
      throw new IllegalArgumentException("an issue cannot be categorized as safe");
    }
  }

  /**
   * Returns the flag recorded on the pipeline context, e.g. {@code violence:knife}.
   *
   * @return {@code category:matched}
   */
  public String flag() {
    return category.key() + ":" + matched;
  }
}
