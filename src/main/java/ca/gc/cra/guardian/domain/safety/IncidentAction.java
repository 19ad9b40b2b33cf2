package ca.gc.cra.guardian.domain.safety;

import java.util.Locale;

/**
 * Action recorded against a persisted safety incident.
 *
 * @since 1.0.0
 */
public enum IncidentAction {
  /** Content matched a pattern and the child received a redirect. */
  BLOCKED_AND_REDIRECTED("blocked_and_redirected"),
  /** Evaluation could not complete (invalid age, internal error) and the turn failed closed. */
  BLOCKED_ON_ERROR("blocked_on_error");

  private final String key;

  IncidentAction(String key) {
    this.key = key;
  }

  /**
   * Returns the persisted key.
   *
   * @return lower-case action key
   */
  public String key() {
    return key;
  }

  /**
   * Resolves an action from its persisted key.
   *
   * @param raw key such as {@code blocked_and_redirected}
   * @return matching action
   * @throws IllegalArgumentException when the key is unknown
   */
  public static IncidentAction fromKey(String raw) {
    String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    for (IncidentAction action : values()) {
      if (action.key.equals(normalized)) {
        return action;
      }
    }
    throw new IllegalArgumentException("Unknown incident action: " + raw);
  }
}
