package ca.gc.cra.guardian.domain.age;

import java.util.Objects;
import java.util.Set;

/**
 * Immutable per-band reading and screening profile, loaded once at startup.
 *
 * @param band band the profile applies to
 * @param gradeLevel human-readable grade label (e.g., {@code K-2})
 * @param maxWords maximum response word count
 * @param complexity sentence-structure tier
 * @param vocabularyTier vocabulary substitution table
 * @param strictness screening strictness
 * @param allowedTopics topic tags considered on-topic
 * @param blockedTopics topic tags whose terms are blocked
 * @param scaryTolerated whether scary content passes
 * @param violenceTolerated whether violent vocabulary passes
 * @param romanceTolerated whether romance vocabulary passes
 * @param toleratedIssues non-critical issue count still considered age-appropriate
 * @param amplifySeverity whether issue severity is raised one level for this band
 * @param engagement whether greetings and follow-up questions are injected
 * @param maxNumber numbers above this are replaced by a vague quantity; {@code 0} disables
 * @since 1.0.0
 */
public record AgeProfile(
    AgeBand band,
    String gradeLevel,
    int maxWords,
    SentenceComplexity complexity,
    VocabularyTier vocabularyTier,
    FilterStrictness strictness,
    Set<String> allowedTopics,
    Set<String> blockedTopics,
    boolean scaryTolerated,
    boolean violenceTolerated,
    boolean romanceTolerated,
    int toleratedIssues,
    boolean amplifySeverity,
    boolean engagement,
    long maxNumber) {

  /**
   * Validates required fields and copies the topic sets.
   */
  public AgeProfile {
    band = Objects.requireNonNull(band, "band");
    gradeLevel = gradeLevel == null ? "" : gradeLevel.trim();
    complexity = Objects.requireNonNull(complexity, "complexity");
    vocabularyTier = Objects.requireNonNull(vocabularyTier, "vocabularyTier");
    strictness = Objects.requireNonNull(strictness, "strictness");
    allowedTopics = allowedTopics == null ? Set.of() : Set.copyOf(allowedTopics);
    blockedTopics = blockedTopics == null ? Set.of() : Set.copyOf(blockedTopics);
    if (maxWords <= 0) {
      throw new IllegalArgumentException(band.key() + ".maxWords must be positive (was " + maxWords + ")");
    }
    if (toleratedIssues < 0) {
      throw new IllegalArgumentException(band.key() + ".toleratedIssues must not be negative");
    }
    if (maxNumber < 0) {
      throw new IllegalArgumentException(band.key() + ".maxNumber must not be negative");
    }
  }
}
