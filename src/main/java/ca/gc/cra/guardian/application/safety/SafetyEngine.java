package ca.gc.cra.guardian.application.safety;

import ca.gc.cra.guardian.application.port.MetricsPort;
import ca.gc.cra.guardian.application.port.PhraseSelector;
import ca.gc.cra.guardian.config.AppConfig;
import ca.gc.cra.guardian.config.SafetyPolicy;
import ca.gc.cra.guardian.domain.age.AgeBand;
import ca.gc.cra.guardian.domain.age.AgeClassifier;
import ca.gc.cra.guardian.domain.age.AgeProfile;
import ca.gc.cra.guardian.domain.age.InvalidAgeException;
import ca.gc.cra.guardian.domain.safety.SafetyCategory;
import ca.gc.cra.guardian.domain.safety.SafetyIssue;
import ca.gc.cra.guardian.domain.safety.SafetyResult;
import ca.gc.cra.guardian.domain.safety.SeverityLevel;
import ca.gc.cra.guardian.domain.safety.TopicDefinition;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Scores a piece of text for a child's age and decides whether it may pass.
 * <p><strong>Why:</strong> Every turn is gated here before any adaptation or downstream collaborator runs.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Classify the age; unsupported ages fail closed with the {@code invalid_age} flag.</li>
 *   <li>Scan the built-in pattern table, the profile's blocked topics and, for strict profiles, the shape
 *   of the child's input.</li>
 *   <li>Derive score, primary category, age-weighted severity, age appropriateness and the parent-alert
 *   decision, then attach a redirect.</li>
 * </ul>
 * <p><strong>Failure model:</strong> Any runtime failure or stack overflow while scanning is caught once, at
 * the outer boundary of {@link #evaluate(String, int, TextOrigin)}, and turned into an unsafe result flagged
 * {@code evaluation_error}. Text longer than {@value #MAX_SCAN_CHARS} characters is blocked unscanned as
 * {@code oversized_text}. No failure reads as safe.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction apart from the thread-safe statistics; one
 * engine serves all sessions.</p>
 * <p><strong>Observability:</strong> Emits {@code safety.evaluations}, {@code safety.blocked},
 * {@code safety.blocked.<category>}, {@code safety.errors} and {@code safety.score.pct}; logs one WARN line
 * per blocked evaluation.</p>
 *
 * @since 1.0.0
 */
public final class SafetyEngine {
  private static final Logger log = LoggerFactory.getLogger(SafetyEngine.class);

  /** Flag recorded when the supplied age is outside the supported domain. */
  public static final String INVALID_AGE_FLAG = "invalid_age";
  /** Flag recorded when the evaluation itself failed. */
  public static final String EVALUATION_ERROR_FLAG = "evaluation_error";
  /** Flag recorded when the text is longer than {@link #MAX_SCAN_CHARS}; such text is never scanned. */
  public static final String OVERSIZED_TEXT_FLAG = "oversized_text";
  /** Longest text the pattern table is run against. */
  public static final int MAX_SCAN_CHARS = 16_384;

  private final AppConfig config;
  private final PhraseSelector selector;
  private final MetricsPort metrics;
  private final RedirectCatalog redirects = new RedirectCatalog();
  private final SafetyStatistics statistics = new SafetyStatistics();
  private final Map<String, List<TermPattern>> topicPatterns;

  /**
   * Creates an engine with deterministic phrasing and no metrics.
   *
   * @param config application configuration
   */
  public SafetyEngine(AppConfig config) {
    this(config, PhraseSelector.DETERMINISTIC, MetricsPort.NO_OP);
  }

  /**
   * Creates an engine.
   *
   * @param config application configuration
   * @param selector chooses among educational prompts
   * @param metrics metrics sink
   */
  public SafetyEngine(AppConfig config, PhraseSelector selector, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.selector = Objects.requireNonNull(selector, "selector");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    Map<String, List<TermPattern>> patterns = new LinkedHashMap<>();
    for (String tag : config.topics().tags()) {
      TopicDefinition definition = config.topics().find(tag).orElseThrow();
      List<TermPattern> terms = new ArrayList<>(definition.terms().size());
      for (String term : definition.terms()) {
        terms.add(new TermPattern(term, SafetyPatterns.termPattern(term)));
      }
      patterns.put(tag, List.copyOf(terms));
    }
    this.topicPatterns = Map.copyOf(patterns);
  }

  /**
   * Evaluates text typed by a child.
   *
   * @param text text to screen
   * @param age child's age in whole years
   * @return verdict; never {@code null}
   */
  public SafetyResult evaluate(String text, int age) {
    return evaluate(text, age, TextOrigin.CHILD_INPUT);
  }

  /**
   * Evaluates text from the given origin.
   *
   * @param text text to screen; {@code null} fails closed
   * @param age child's age in whole years
   * @param origin where the text came from
   * @return verdict; never {@code null}
   */
  public SafetyResult evaluate(String text, int age, TextOrigin origin) {
    metrics.increment("safety.evaluations");
    statistics.recordEvaluation();
    AgeBand band;
    try {
      band = AgeClassifier.classify(age);
    } catch (InvalidAgeException ex) {
      log.warn("Rejecting evaluation: {}", ex.getMessage());
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("reason", INVALID_AGE_FLAG);
      details.put("age", ex.age());
      SafetyResult result = failClosed(INVALID_AGE_FLAG, details);
      recordBlocked(result, "unknown");
      return result;
    }
    if (text != null && text.length() > MAX_SCAN_CHARS) {
      log.warn("Rejecting {} chars of text for band {}; limit is {}", text.length(), band.key(), MAX_SCAN_CHARS);
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("reason", OVERSIZED_TEXT_FLAG);
      details.put("chars", text.length());
      SafetyResult result = failClosed(OVERSIZED_TEXT_FLAG, details);
      recordBlocked(result, band.key());
      return result;
    }
    try {
      SafetyResult result = scan(Objects.requireNonNull(text, "text"), band,
          origin == null ? TextOrigin.CHILD_INPUT : origin);
      metrics.observe("safety.score.pct", Math.round(result.score() * 100));
      if (!result.safe()) {
        recordBlocked(result, band.key());
      }
      return result;
    } catch (RuntimeException | StackOverflowError ex) {
      // deep regex backtracking surfaces as StackOverflowError; it must block like any other failure
      metrics.increment("safety.errors");
      statistics.recordError();
      log.error("Safety evaluation failed for band {}; treating text as unsafe", band.key(), ex);
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("reason", EVALUATION_ERROR_FLAG);
      details.put("band", band.key());
      SafetyResult result = failClosed(EVALUATION_ERROR_FLAG, details);
      recordBlocked(result, band.key());
      return result;
    }
  }

  /**
   * Returns the running counters.
   *
   * @return statistics view
   */
  public SafetyStatistics statistics() {
    return statistics;
  }

  private SafetyResult scan(String text, AgeBand band, TextOrigin origin) {
    AgeProfile profile = config.profile(band);
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("band", band.key());
    details.put("origin", origin.key());
    details.put("strictness", profile.strictness().name().toLowerCase(Locale.ROOT));
    if (text.isBlank()) {
      details.put("issueCount", 0);
      details.put("offTopic", false);
      return SafetyResult.pass(details);
    }

    String normalized = SafetyPatterns.normalize(text);
    String folded = SafetyPatterns.fold(normalized);
    List<SafetyIssue> issues = new ArrayList<>();
    SafetyPatterns.scanRules(folded, profile, issues);
    SafetyPatterns.scanLiterals(normalized, issues);
    scanBlockedTopics(folded, profile, issues);
    if (origin == TextOrigin.CHILD_INPUT && profile.strictness().strict()) {
      SafetyPatterns.scanContext(text, normalized, config.policy(), issues);
    }

    details.put("issueCount", issues.size());
    details.put("offTopic", isOffTopic(folded, profile));
    if (issues.isEmpty()) {
      return SafetyResult.pass(details);
    }
    return assess(text, band, profile, issues, details);
  }

  private SafetyResult assess(
      String text, AgeBand band, AgeProfile profile, List<SafetyIssue> issues, Map<String, Object> details) {
    SafetyPolicy policy = config.policy();
    List<String> flags = new ArrayList<>(issues.size());
    List<SafetyCategory> categories = new ArrayList<>(issues.size());
    SeverityLevel base = SeverityLevel.SAFE;
    boolean critical = false;
    for (SafetyIssue issue : issues) {
      flags.add(issue.flag());
      categories.add(issue.category());
      base = SeverityLevel.max(base, issue.severity());
      critical |= issue.severity() == SeverityLevel.CRITICAL;
    }
    SafetyCategory category = SafetyCategory.highestPriority(categories);
    SeverityLevel severity = profile.amplifySeverity() ? base.amplified() : base;
    double score = Math.max(0.0, 1.0 - policy.scorePenaltyPerIssue() * issues.size());
    boolean ageAppropriate = !critical && issues.size() <= profile.toleratedIssues();
    boolean parentAlert = severity.atLeast(policy.parentAlertSeverity()) || !ageAppropriate;
    details.put("baseSeverity", base.level());
    return new SafetyResult(
        false,
        score,
        flags,
        category,
        severity,
        ageAppropriate,
        redirects.suggested(category, band),
        redirects.educational(band, selector, text),
        parentAlert,
        details);
  }

  private void scanBlockedTopics(String folded, AgeProfile profile, List<SafetyIssue> issues) {
    for (String tag : profile.blockedTopics()) {
      TopicDefinition definition = config.topics().find(tag).orElseThrow(
          () -> new IllegalStateException("Blocked topic missing from lexicon: " + tag));
      for (TermPattern term : topicPatterns.getOrDefault(definition.tag(), List.of())) {
        Matcher matcher = term.pattern().matcher(folded);
        while (matcher.find()) {
          issues.add(new SafetyIssue(definition.category(), term.term(), definition.severity()));
        }
      }
    }
  }

  private boolean isOffTopic(String folded, AgeProfile profile) {
    if (profile.allowedTopics().isEmpty()) {
      return false;
    }
    for (String tag : profile.allowedTopics()) {
      for (TermPattern term : topicPatterns.getOrDefault(tag, List.of())) {
        if (term.pattern().matcher(folded).find()) {
          return false;
        }
      }
    }
    return true;
  }

  private SafetyResult failClosed(String flag, Map<String, Object> details) {
    return new SafetyResult(
        false,
        0.0,
        List.of(flag),
        SafetyCategory.OFF_TOPIC,
        SeverityLevel.MODERATE,
        false,
        RedirectCatalog.FALLBACK,
        null,
        true,
        details);
  }

  private void recordBlocked(SafetyResult result, String band) {
    statistics.recordBlocked(result.category());
    metrics.increment("safety.blocked");
    metrics.increment("safety.blocked." + result.category().key());
    String session = MDC.get("sessionId");
    log.warn("safety.blocked session={} band={} category={} severity={} score={} flags={}",
        session == null ? "-" : session,
        band,
        result.category().key(),
        result.severity().level(),
        String.format(Locale.ROOT, "%.2f", result.score()),
        result.flags());
  }

  private record TermPattern(String term, Pattern pattern) {}
}
