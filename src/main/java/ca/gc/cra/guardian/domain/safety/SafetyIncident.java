package ca.gc.cra.guardian.domain.safety;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted record of one blocked turn, consumed by the parent dashboard.
 *
 * @param id unique incident identifier
 * @param timestamp time the turn was blocked
 * @param childId profile identifier of the child
 * @param childAge age of the child at the time of the incident
 * @param sessionId session the turn belonged to
 * @param inputExcerpt child input, truncated to {@link #MAX_EXCERPT_CHARS} characters
 * @param category primary category of the verdict
 * @param severity age-weighted severity of the verdict
 * @param action action taken by the pipeline
 * @param parentNotified whether a parent alert was raised
 * @since 1.0.0
 */
public record SafetyIncident(
    String id,
    Instant timestamp,
    String childId,
    int childAge,
    String sessionId,
    String inputExcerpt,
    SafetyCategory category,
    SeverityLevel severity,
    IncidentAction action,
    boolean parentNotified) {

  /** Upper bound on the stored input excerpt. */
  public static final int MAX_EXCERPT_CHARS = 500;

  /**
   * Validates required fields and truncates the excerpt.
   */
  public SafetyIncident {
    id = Objects.requireNonNull(id, "id");
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
    childId = Objects.requireNonNull(childId, "childId");
    sessionId = Objects.requireNonNull(sessionId, "sessionId");
    inputExcerpt = excerpt(inputExcerpt, MAX_EXCERPT_CHARS);
    category = Objects.requireNonNull(category, "category");
    severity = Objects.requireNonNull(severity, "severity");
    action = Objects.requireNonNull(action, "action");
  }

  /**
   * Truncates {@code text} to at most {@code maxChars} characters without splitting a surrogate pair.
   *
   * @param text source text; {@code null} yields an empty string
   * @param maxChars maximum length
   * @return truncated text
   */
  public static String excerpt(String text, int maxChars) {
    if (text == null) {
      return "";
    }
    if (text.length() <= maxChars) {
      return text;
    }
    int end = maxChars;
    if (Character.isHighSurrogate(text.charAt(end - 1))) {
      end--;
    }
    return text.substring(0, end);
  }
}
