package ca.gc.cra.guardian.application.pipeline;

import ca.gc.cra.guardian.application.adapt.ReadabilityAnalyzer;
import ca.gc.cra.guardian.application.port.ActivityLogPort;
import ca.gc.cra.guardian.application.port.ClockPort;
import ca.gc.cra.guardian.application.port.MetricsPort;
import ca.gc.cra.guardian.application.port.PipelineStage;
import ca.gc.cra.guardian.config.ParentAlertPolicy;
import ca.gc.cra.guardian.config.PipelineConfig;
import ca.gc.cra.guardian.domain.age.AgeClassifier;
import ca.gc.cra.guardian.domain.pipeline.ActivityRecord;
import ca.gc.cra.guardian.domain.pipeline.PipelineContext;
import ca.gc.cra.guardian.logging.Logs;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Parent logger collaborator ({@code parent_logger}): records one activity entry per
 * completed turn and raises parent alerts.
 * <p><strong>Alerts:</strong> {@code keyword_<kw>} for each configured keyword found in the child's input, and
 * {@code extended_session} once {@value #SESSION_DURATION_KEY} exceeds the configured threshold.</p>
 * <p><strong>Failure model:</strong> Activity log failures propagate; the orchestrator turns them into a
 * {@link StageExecutionException}.</p>
 * <p><strong>Observability:</strong> Increments {@code parent.alerts} per alert raised.</p>
 *
 * @since 1.0.0
 */
public final class ParentActivityStage implements PipelineStage {
  private static final Logger log = LoggerFactory.getLogger(ParentActivityStage.class);

  /** Metadata key carrying the session's elapsed time in whole seconds. */
  public static final String SESSION_DURATION_KEY = "sessionDurationSeconds";
  /** Alert raised when a session runs past the configured threshold. */
  public static final String EXTENDED_SESSION_ALERT = "extended_session";

  private final ParentAlertPolicy policy;
  private final ActivityLogPort activityLog;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final Map<String, Pattern> keywordPatterns;

  /**
   * Creates the stage.
   *
   * @param policy alert keywords and session threshold
   * @param activityLog activity sink
   * @param metrics metrics sink
   * @param clock clock used for record timestamps
   */
  public ParentActivityStage(
      ParentAlertPolicy policy, ActivityLogPort activityLog, MetricsPort metrics, ClockPort clock) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.activityLog = Objects.requireNonNull(activityLog, "activityLog");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    Map<String, Pattern> patterns = new LinkedHashMap<>();
    for (String keyword : policy.keywords()) {
      patterns.put(keyword, Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b",
          Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
    }
    this.keywordPatterns = patterns;
  }

  @Override
  public String name() {
    return PipelineConfig.PARENT_LOGGER;
  }

  @Override
  public PipelineContext apply(PipelineContext context) throws IOException {
    List<String> alerts = new ArrayList<>();
    keywordPatterns.forEach((keyword, pattern) -> {
      if (pattern.matcher(context.inputText()).find()) {
        alerts.add("keyword_" + keyword);
      }
    });
    Optional<Long> duration = sessionDuration(context);
    if (duration.isPresent() && duration.get() > policy.extendedSessionSeconds()) {
      alerts.add(EXTENDED_SESSION_ALERT);
    }

    String band = AgeClassifier.isSupported(context.childAge())
        ? AgeClassifier.classify(context.childAge()).key()
        : "unknown";
    ActivityRecord record = new ActivityRecord(
        clock.now(),
        context.sessionId(),
        context.profileId(),
        band,
        Logs.excerpt(context.inputText()),
        ReadabilityAnalyzer.countWords(context.responseText()),
        Boolean.TRUE.equals(context.metadataValue("offTopic").orElse(Boolean.FALSE)),
        alerts);
    activityLog.append(record);

    if (!alerts.isEmpty()) {
      for (int i = 0; i < alerts.size(); i++) {
        metrics.increment("parent.alerts");
      }
      log.info("parent.alert session={} band={} types={}", context.sessionId(), band, alerts);
    }
    context.putStageDetail(name(), "logged", true);
    context.putStageDetail(name(), "alertsTriggered", !alerts.isEmpty());
    context.putStageDetail(name(), "alertTypes", List.copyOf(alerts));
    return context;
  }

  private static Optional<Long> sessionDuration(PipelineContext context) {
    return context.metadataValue(SESSION_DURATION_KEY)
        .filter(Number.class::isInstance)
        .map(value -> ((Number) value).longValue());
  }
}
