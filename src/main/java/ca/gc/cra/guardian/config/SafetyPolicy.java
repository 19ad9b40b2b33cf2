package ca.gc.cra.guardian.config;

import ca.gc.cra.guardian.domain.safety.SeverityLevel;
import ca.gc.cra.guardian.validation.Numbers;
import java.util.Objects;

/**
 * Tunable thresholds of the safety engine.
 *
 * @param scorePenaltyPerIssue score deducted per issue occurrence
 * @param parentAlertSeverity severity at or above which parents are alerted
 * @param maxInputChars input length above which strict profiles flag the turn
 * @param maxSymbolRatio share of symbol characters above which strict profiles flag the turn
 * @param incidentExcerptChars characters of child input kept in an incident
 * @since 1.0.0
 */
public record SafetyPolicy(
    double scorePenaltyPerIssue,
    SeverityLevel parentAlertSeverity,
    int maxInputChars,
    double maxSymbolRatio,
    int incidentExcerptChars) {

  /**
   * Validates the thresholds.
   */
  public SafetyPolicy {
    Numbers.requireRange("policy.scorePenaltyPerIssue", scorePenaltyPerIssue, 0.01, 1.0);
    parentAlertSeverity = Objects.requireNonNull(parentAlertSeverity, "parentAlertSeverity");
    Numbers.requireRange("policy.maxInputChars", maxInputChars, 1, 16_384);
    Numbers.requireRange("policy.maxSymbolRatio", maxSymbolRatio, 0.0, 1.0);
    Numbers.requireRange("policy.incidentExcerptChars", incidentExcerptChars, 1, 500);
  }

  /**
   * Returns the shipped defaults.
   *
   * @return default policy
   */
  public static SafetyPolicy defaults() {
    return new SafetyPolicy(0.2, SeverityLevel.MODERATE, 500, 0.3, 500);
  }
}
