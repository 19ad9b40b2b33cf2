package ca.gc.cra.guardian.application.adapt;

import ca.gc.cra.guardian.application.port.PhraseSelector;
import ca.gc.cra.guardian.config.AppConfig;
import ca.gc.cra.guardian.domain.age.AgeBand;
import ca.gc.cra.guardian.domain.age.AgeProfile;
import java.util.Objects;

/**
 * <strong>What:</strong> Rewrites a response that already passed safety screening so it matches a band's reading
 * profile.
 * <p><strong>Steps:</strong> vocabulary substitution, sentence restructuring, an analogy for short answers to
 * science questions, length enforcement, engagement
 * (greeting and follow-up question) and a residual redaction scrub, in that order. A greeting or follow-up left
 * by an earlier pass is detached first so that {@code adapt(adapt(t, b), b)} equals {@code adapt(t, b)}.</p>
 * <p><strong>Word budget:</strong> When engagement applies, the greeting and the longest follow-up are reserved
 * from the band's {@code maxWords}, so the final response never exceeds it.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable tables; safe for concurrent use.</p>
 *
 * @since 1.0.0
 */
public final class AgeAdapter {
  private final AppConfig config;
  private final PhraseSelector selector;
  private final VocabularyTable vocabulary = new VocabularyTable();
  private final SentenceRestructurer restructurer = new SentenceRestructurer();
  private final ExampleInjector examples = new ExampleInjector();
  private final LengthLimiter limiter = new LengthLimiter();
  private final EngagementInjector engagement = new EngagementInjector();
  private final ResidualScrubber scrubber = new ResidualScrubber();
  private final ReadabilityAnalyzer readability = new ReadabilityAnalyzer();

  /**
   * Creates an adapter with deterministic follow-up selection.
   *
   * @param config application configuration
   */
  public AgeAdapter(AppConfig config) {
    this(config, PhraseSelector.DETERMINISTIC);
  }

  /**
   * Creates an adapter.
   *
   * @param config application configuration
   * @param selector picks follow-up questions
   */
  public AgeAdapter(AppConfig config, PhraseSelector selector) {
    this.config = Objects.requireNonNull(config, "config");
    this.selector = Objects.requireNonNull(selector, "selector");
  }

  /**
   * Adapts text for a band without a greeting.
   *
   * @param text safe text
   * @param band target band
   * @return adapted text
   */
  public String adapt(String text, AgeBand band) {
    return adapt(text, band, "");
  }

  /**
   * Adapts text for a band, greeting the child by name when the band enables engagement.
   *
   * @param text safe text; blank text is returned unchanged
   * @param band target band
   * @param childName child's name; {@code null} or blank skips the greeting
   * @return adapted text
   */
  public String adapt(String text, AgeBand band, String childName) {
    return adapt(text, band, childName, null);
  }

  /**
   * Adapts text for a band, adding an analogy when the child's question asks about science.
   *
   * @param text safe text; blank text is returned unchanged
   * @param band target band
   * @param childName child's name; {@code null} or blank skips the greeting
   * @param question child's question; {@code null} skips the analogy
   * @return adapted text
   */
  public String adapt(String text, AgeBand band, String childName, String question) {
    Objects.requireNonNull(band, "band");
    if (text == null || text.isBlank()) {
      return text == null ? "" : text;
    }
    AgeProfile profile = config.profile(band);
    String name = childName == null ? "" : childName.trim();
    boolean engage = profile.engagement();

    String core = engage ? engagement.detach(text, name) : text.trim();
    core = vocabulary.apply(core, profile.vocabularyTier());
    core = restructurer.restructure(core, profile.complexity());
    int budget = engage
        ? Math.max(1, profile.maxWords() - engagement.overhead(name))
        : profile.maxWords();
    core = examples.inject(core, band, question, budget);
    core = limiter.limit(core, budget);
    // scrub before the follow-up is seeded so a second pass picks the same one
    core = scrubber.scrub(core, profile.maxNumber());
    String adapted = engage ? engagement.attach(core, name, selector) : core;
    return scrubber.scrub(adapted, profile.maxNumber());
  }

  /** @return readability analyzer shared with the pipeline stage */
  public ReadabilityAnalyzer readability() {
    return readability;
  }
}
