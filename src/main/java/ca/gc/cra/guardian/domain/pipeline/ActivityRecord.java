package ca.gc.cra.guardian.domain.pipeline;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Conversation activity entry written for the parent dashboard after a completed turn.
 *
 * @param timestamp time the turn completed
 * @param sessionId session identifier
 * @param childId child profile identifier
 * @param ageBand band key of the child
 * @param inputExcerpt truncated child input
 * @param responseWords word count of the final response
 * @param offTopic whether the input matched no allowed topic
 * @param alerts parent alert types raised for the turn
 * @since 1.0.0
 */
public record ActivityRecord(
    Instant timestamp,
    String sessionId,
    String childId,
    String ageBand,
    String inputExcerpt,
    int responseWords,
    boolean offTopic,
    List<String> alerts) {

  /**
   * Validates required fields and copies the alert list.
   */
  public ActivityRecord {
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
    sessionId = Objects.requireNonNull(sessionId, "sessionId");
    childId = Objects.requireNonNull(childId, "childId");
    ageBand = Objects.requireNonNull(ageBand, "ageBand");
    inputExcerpt = inputExcerpt == null ? "" : inputExcerpt;
    alerts = alerts == null ? List.of() : List.copyOf(alerts);
  }
}
