package ca.gc.cra.guardian.config;

import ca.gc.cra.guardian.domain.age.AgeBand;
import ca.gc.cra.guardian.domain.age.AgeProfile;
import ca.gc.cra.guardian.domain.safety.TopicDefinition;
import ca.gc.cra.guardian.domain.safety.TopicLexicon;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable application configuration built once at startup.
 * <p><strong>Role:</strong> Passed by reference into every component constructor; there is no ambient global
 * configuration.</p>
 * <p><strong>Invariants:</strong> exactly one profile per {@link AgeBand}; every topic tag a profile references
 * exists in the lexicon; blocked tags carry a non-safe category.</p>
 * <p><strong>Thread-safety:</strong> Immutable; share freely.</p>
 *
 * @param pipeline stage ordering
 * @param policy safety thresholds
 * @param parentAlerts parent alert triggers
 * @param topics topic lexicon
 * @param profiles profile per band
 * @since 1.0.0
 */
public record AppConfig(
    PipelineConfig pipeline,
    SafetyPolicy policy,
    ParentAlertPolicy parentAlerts,
    TopicLexicon topics,
    Map<AgeBand, AgeProfile> profiles) {

  /**
   * Validates completeness of the profile table and topic references.
   */
  public AppConfig {
    pipeline = Objects.requireNonNull(pipeline, "pipeline");
    policy = Objects.requireNonNull(policy, "policy");
    parentAlerts = Objects.requireNonNull(parentAlerts, "parentAlerts");
    topics = Objects.requireNonNull(topics, "topics");
    Objects.requireNonNull(profiles, "profiles");
    EnumMap<AgeBand, AgeProfile> copy = new EnumMap<>(AgeBand.class);
    for (AgeBand band : AgeBand.values()) {
      AgeProfile profile = profiles.get(band);
      if (profile == null) {
        throw new IllegalArgumentException("Missing age profile for band " + band.key());
      }
      if (profile.band() != band) {
        throw new IllegalArgumentException(
            "Profile registered for " + band.key() + " describes " + profile.band().key());
      }
      validateTopics(profile, topics);
      copy.put(band, profile);
    }
    profiles = Collections.unmodifiableMap(copy);
  }

  /**
   * Returns the profile for {@code band}.
   *
   * @param band age band
   * @return profile; never {@code null}
   */
  public AgeProfile profile(AgeBand band) {
    return profiles.get(Objects.requireNonNull(band, "band"));
  }

  private static void validateTopics(AgeProfile profile, TopicLexicon topics) {
    for (String tag : profile.allowedTopics()) {
      if (topics.find(tag).isEmpty()) {
        throw new IllegalArgumentException(
            "Profile " + profile.band().key() + " references unknown allowed topic " + tag);
      }
    }
    for (String tag : profile.blockedTopics()) {
      TopicDefinition definition = topics.find(tag).orElseThrow(() -> new IllegalArgumentException(
          "Profile " + profile.band().key() + " references unknown blocked topic " + tag));
      if (!definition.blockable()) {
        throw new IllegalArgumentException(
            "Topic " + tag + " has category safe and cannot be blocked by " + profile.band().key());
      }
    }
  }
}
