package ca.gc.cra.guardian.config;

import ca.gc.cra.guardian.validation.Numbers;
import java.util.List;
import java.util.Locale;

/**
 * Conditions under which the parent logger raises alerts beyond safety incidents.
 *
 * @param keywords words in the child's input that trigger a keyword alert
 * @param extendedSessionSeconds session duration above which an extended-session alert is raised
 * @since 1.0.0
 */
public record ParentAlertPolicy(List<String> keywords, long extendedSessionSeconds) {

  /**
   * Normalizes keywords and validates the duration.
   */
  public ParentAlertPolicy {
    keywords = keywords == null
        ? List.of()
        : keywords.stream()
            .map(keyword -> keyword.trim().toLowerCase(Locale.ROOT))
            .filter(keyword -> !keyword.isEmpty())
            .distinct()
            .toList();
    Numbers.requireRange("parentAlerts.extendedSessionSeconds", extendedSessionSeconds, 60, 86_400);
  }

  /**
   * Returns the shipped defaults: no keywords, two hours.
   *
   * @return default policy
   */
  public static ParentAlertPolicy defaults() {
    return new ParentAlertPolicy(List.of(), 7_200);
  }
}
