package ca.gc.cra.guardian.application.pipeline;

import ca.gc.cra.guardian.application.port.ClockPort;
import ca.gc.cra.guardian.application.port.IncidentStorePort;
import ca.gc.cra.guardian.application.port.MetricsPort;
import ca.gc.cra.guardian.application.port.SafetyStage;
import ca.gc.cra.guardian.application.port.SafetyVerdict;
import ca.gc.cra.guardian.application.safety.RedirectCatalog;
import ca.gc.cra.guardian.application.safety.SafetyEngine;
import ca.gc.cra.guardian.application.safety.TextOrigin;
import ca.gc.cra.guardian.config.PipelineConfig;
import ca.gc.cra.guardian.config.SafetyPolicy;
import ca.gc.cra.guardian.domain.pipeline.PipelineContext;
import ca.gc.cra.guardian.domain.safety.IncidentAction;
import ca.gc.cra.guardian.domain.safety.SafetyIncident;
import ca.gc.cra.guardian.domain.safety.SafetyResult;
import java.io.IOException;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> The safety gate of the pipeline ({@code content_filter}).
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Evaluate the child's input and, when present and the input passed, the model's response.</li>
 *   <li>On a block: append the verdict's flags, replace the response with the redirect and persist a
 *   {@link SafetyIncident}.</li>
 *   <li>On a pass: expose the advisory {@code offTopic} marker in the context metadata and, when no response
 *   exists yet, seed a gentle nudge back toward STEM.</li>
 * </ul>
 * <p>A failed incident write is logged and counted ({@code incident.persist.failed}); the turn stays blocked.</p>
 *
 * @since 1.0.0
 */
public final class ContentSafetyStage implements SafetyStage {
  private static final Logger log = LoggerFactory.getLogger(ContentSafetyStage.class);

  private final SafetyEngine engine;
  private final IncidentStorePort incidents;
  private final SafetyPolicy policy;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates the stage.
   *
   * @param engine safety engine
   * @param incidents incident store
   * @param policy policy providing the excerpt length
   * @param metrics metrics sink
   * @param clock clock used for incident timestamps
   */
  public ContentSafetyStage(
      SafetyEngine engine, IncidentStorePort incidents, SafetyPolicy policy, MetricsPort metrics, ClockPort clock) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.incidents = Objects.requireNonNull(incidents, "incidents");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public String name() {
    return PipelineConfig.CONTENT_FILTER;
  }

  @Override
  public SafetyVerdict inspect(PipelineContext context) {
    SafetyResult verdict = engine.evaluate(context.inputText(), context.childAge(), TextOrigin.CHILD_INPUT);
    String screened = TextOrigin.CHILD_INPUT.key();
    if (verdict.safe() && !context.responseText().isBlank()) {
      SafetyResult response =
          engine.evaluate(context.responseText(), context.childAge(), TextOrigin.MODEL_OUTPUT);
      if (!response.safe()) {
        verdict = response;
        screened = TextOrigin.MODEL_OUTPUT.key();
      }
    }

    if (verdict.safe()) {
      if (Boolean.TRUE.equals(verdict.details().get("offTopic"))) {
        context.putMetadata("offTopic", true);
        if (context.responseText().isBlank()) {
          context.setResponseText(RedirectCatalog.offTopicNudge(context.childName()));
          context.putStageDetail(name(), "nudged", true);
        }
      }
      return SafetyVerdict.of(verdict, context);
    }

    context.addSafetyFlags(verdict.flags());
    context.setResponseText(verdict.redirect().orElse(RedirectCatalog.FALLBACK));
    context.putMetadata("parentAlertRequired", verdict.parentAlertRequired());
    if (verdict.educationalRedirect() != null) {
      context.putMetadata("educationalRedirect", verdict.educationalRedirect());
    }
    context.putStageDetail(name(), "blockedOn", screened);
    context.putStageDetail(name(), "incidentPersisted", recordIncident(context, verdict));
    return SafetyVerdict.of(verdict, context);
  }

  private boolean recordIncident(PipelineContext context, SafetyResult verdict) {
    boolean failed = verdict.flags().contains(SafetyEngine.INVALID_AGE_FLAG)
        || verdict.flags().contains(SafetyEngine.EVALUATION_ERROR_FLAG);
    SafetyIncident incident = new SafetyIncident(
        UUID.randomUUID().toString(),
        clock.now(),
        context.profileId(),
        context.childAge(),
        context.sessionId(),
        SafetyIncident.excerpt(context.inputText(), policy.incidentExcerptChars()),
        verdict.category(),
        verdict.severity(),
        failed ? IncidentAction.BLOCKED_ON_ERROR : IncidentAction.BLOCKED_AND_REDIRECTED,
        verdict.parentAlertRequired());
    try {
      incidents.record(incident);
      metrics.increment("incident.persisted");
      log.debug("Recorded safety incident {} ({})", incident.id(), incident.category().key());
      return true;
    } catch (IOException ex) {
      metrics.increment("incident.persist.failed");
      log.error("Failed to persist safety incident {} for session {}; turn remains blocked",
          incident.id(), context.sessionId(), ex);
      return false;
    }
  }
}
