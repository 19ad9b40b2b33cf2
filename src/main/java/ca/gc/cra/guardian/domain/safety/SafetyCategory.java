package ca.gc.cra.guardian.domain.safety;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;

/**
 * <strong>What:</strong> Closed set of content categories a safety evaluation can assign.
 * <p><strong>Why:</strong> A single primary category drives the redirect text, the incident record, and the
 * parent dashboard; an enum keeps the dispatch exhaustive.</p>
 * <p><strong>Priority:</strong> When several categories match, the one with the lowest {@link #priority()}
 * wins: Violence, Inappropriate, PersonalInfo, Dangerous, Scary, Bullying, Profanity, Medical,
 * Commercial, OffTopic. {@link #SAFE} never competes.</p>
 *
 * @since 1.0.0
 */
public enum SafetyCategory {
  SAFE("safe", Integer.MAX_VALUE),
  VIOLENCE("violence", 1),
  INAPPROPRIATE("inappropriate", 2),
  PERSONAL_INFO("personal_info", 3),
  DANGEROUS("dangerous", 4),
  SCARY("scary", 5),
  BULLYING("bullying", 6),
  PROFANITY("profanity", 7),
  MEDICAL("medical", 8),
  COMMERCIAL("commercial", 9),
  OFF_TOPIC("off_topic", 10);

  private final String key;
  private final int priority;

  SafetyCategory(String key, int priority) {
    this.key = key;
    this.priority = priority;
  }

  /**
   * Returns the stable lower-case key used in flags, metrics and persisted incidents.
   *
   * @return category key
   */
  public String key() {
    return key;
  }

  /**
   * Returns the tie-break rank; lower values take precedence.
   *
   * @return priority rank
   */
  public int priority() {
    return priority;
  }

  /**
   * Picks the highest-priority category among {@code matched}.
   *
   * @param matched categories detected in one evaluation
   * @return winning category, or {@link #SAFE} when {@code matched} is empty
   */
  public static SafetyCategory highestPriority(Collection<SafetyCategory> matched) {
    SafetyCategory winner = SAFE;
    if (matched == null) {
      return winner;
    }
    for (SafetyCategory candidate : matched) {
      if (candidate != null && candidate.priority < winner.priority) {
        winner = candidate;
      }
    }
    return winner;
  }

  /**
   * Resolves a category from its key, ignoring case.
   *
   * @param raw key such as {@code personal_info}
   * @return matching category, or empty when unknown
   */
  public static Optional<SafetyCategory> fromKey(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    for (SafetyCategory category : values()) {
      if (category.key.equals(normalized)) {
        return Optional.of(category);
      }
    }
    return Optional.empty();
  }
}
