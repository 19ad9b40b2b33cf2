package ca.gc.cra.guardian.domain.safety;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable lookup of topic tags to their definitions.
 *
 * @since 1.0.0
 */
public final class TopicLexicon {
  private final Map<String, TopicDefinition> topics;

  /**
   * Creates a lexicon from definitions keyed by tag.
   *
   * @param definitions topic definitions; duplicate tags are rejected
   */
  public TopicLexicon(Collection<TopicDefinition> definitions) {
    Map<String, TopicDefinition> map = new LinkedHashMap<>();
    if (definitions != null) {
      for (TopicDefinition definition : definitions) {
        if (map.putIfAbsent(definition.tag(), definition) != null) {
          throw new IllegalArgumentException("Duplicate topic tag: " + definition.tag());
        }
      }
    }
    this.topics = Map.copyOf(map);
  }

  /**
   * Looks up a tag.
   *
   * @param tag topic tag, case-insensitive
   * @return definition when known
   */
  public Optional<TopicDefinition> find(String tag) {
    if (tag == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(topics.get(tag.trim().toLowerCase(Locale.ROOT)));
  }

  /**
   * Returns every known tag.
   *
   * @return immutable tag set
   */
  public Set<String> tags() {
    return topics.keySet();
  }

  /**
   * Returns the number of tags.
   *
   * @return tag count
   */
  public int size() {
    return topics.size();
  }
}
