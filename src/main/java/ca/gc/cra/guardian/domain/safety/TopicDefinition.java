package ca.gc.cra.guardian.domain.safety;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A named topic tag and the terms that signal it. Profiles reference tags as allowed or blocked topics.
 *
 * @param tag configuration tag, e.g. {@code medical}
 * @param category category assigned when the tag is blocked and a term matches
 * @param severity base severity assigned when the tag is blocked and a term matches
 * @param terms lower-case words or phrases matched on word boundaries
 * @since 1.0.0
 */
public record TopicDefinition(String tag, SafetyCategory category, SeverityLevel severity, List<String> terms) {

  /**
   * Normalizes the tag and terms.
   */
  public TopicDefinition {
    tag = Objects.requireNonNull(tag, "tag").trim().toLowerCase(Locale.ROOT);
    category = Objects.requireNonNull(category, "category");
    severity = Objects.requireNonNull(severity, "severity");
    terms = terms == null
        ? List.of()
        : terms.stream().map(term -> term.trim().toLowerCase(Locale.ROOT)).filter(term -> !term.isEmpty()).toList();
    if (tag.isEmpty()) {
      throw new IllegalArgumentException("topic tag must not be blank");
    }
    if (terms.isEmpty()) {
      throw new IllegalArgumentException("topic " + tag + " must declare at least one term");
    }
  }

  /**
   * Indicates whether the tag can be used as a blocked topic.
   *
   * @return {@code true} when the category is not {@link SafetyCategory#SAFE}
   */
  public boolean blockable() {
    return category != SafetyCategory.SAFE;
  }
}
