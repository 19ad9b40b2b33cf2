package ca.gc.cra.guardian.domain.safety;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one safety evaluation. Built fresh per call and never mutated.
 *
 * @param safe whether the text may continue through the pipeline
 * @param score confidence the text is safe, in {@code [0.0, 1.0]}
 * @param flags matched flags, one per issue occurrence
 * @param category primary category chosen by priority
 * @param severity age-weighted overall severity
 * @param ageAppropriate whether the band's tolerance rule accepts the issues found
 * @param suggestedRedirect positive replacement message; {@code null} when safe
 * @param educationalRedirect learning prompt offered with the redirect; {@code null} when safe
 * @param parentAlertRequired whether the parent dashboard must be alerted
 * @param details diagnostic values (band, issue count, origin, off-topic marker)
 * @since 1.0.0
 */
public record SafetyResult(
    boolean safe,
    double score,
    List<String> flags,
    SafetyCategory category,
    SeverityLevel severity,
    boolean ageAppropriate,
    String suggestedRedirect,
    String educationalRedirect,
    boolean parentAlertRequired,
    Map<String, Object> details) {

  /**
   * Validates the score range and protects collections from external mutation.
   */
  public SafetyResult {
    if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
      throw new IllegalArgumentException("score must be within [0, 1] (was " + score + ")");
    }
    flags = flags == null ? List.of() : List.copyOf(flags);
    category = Objects.requireNonNull(category, "category");
    severity = Objects.requireNonNull(severity, "severity");
    details = details == null ? Map.of() : Map.copyOf(details);
    if (safe && category != SafetyCategory.SAFE) {
      throw new IllegalArgumentException("a safe result must carry the SAFE category");
    }
  }

  /**
   * Builds a passing result.
   *
   * @param details diagnostic values
   * @return safe result with score {@code 1.0}
   */
  public static SafetyResult pass(Map<String, Object> details) {
    return new SafetyResult(
        true, 1.0, List.of(), SafetyCategory.SAFE, SeverityLevel.SAFE, true, null, null, false, details);
  }

  /**
   * Returns the redirect text when present.
   *
   * @return optional suggested redirect
   */
  public Optional<String> redirect() {
    return Optional.ofNullable(suggestedRedirect);
  }

  /**
   * Number of issues that contributed to the verdict.
   *
   * @return flag count
   */
  public int issueCount() {
    return flags.size();
  }
}
