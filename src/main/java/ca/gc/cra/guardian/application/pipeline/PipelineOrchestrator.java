package ca.gc.cra.guardian.application.pipeline;

import ca.gc.cra.guardian.application.port.ClockPort;
import ca.gc.cra.guardian.application.port.MetricsPort;
import ca.gc.cra.guardian.application.port.PipelineStage;
import ca.gc.cra.guardian.application.port.SafetyStage;
import ca.gc.cra.guardian.application.port.SafetyVerdict;
import ca.gc.cra.guardian.application.safety.RedirectCatalog;
import ca.gc.cra.guardian.domain.pipeline.PipelineContext;
import ca.gc.cra.guardian.domain.pipeline.PipelineOutcome;
import ca.gc.cra.guardian.domain.pipeline.PipelineStatus;
import ca.gc.cra.guardian.domain.safety.SafetyCategory;
import ca.gc.cra.guardian.domain.safety.SafetyResult;
import ca.gc.cra.guardian.domain.safety.SeverityLevel;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs one conversational turn through the safety gate and the configured stages.
 * <p><strong>State machine (per session):</strong> {@code IDLE -> PROCESSING}, then
 * {@code SAFETY_BLOCKED} when the safety stage vetoes the turn (no later stage runs), {@code COMPLETED} when every
 * stage returns, or {@code ERROR} when a stage raises.</p>
 * <p><strong>Failure model:</strong>
 * <ul>
 *   <li>The safety stage fails closed: an exception or a missing verdict blocks the turn with the
 *   {@value #SAFETY_ERROR_FLAG} flag and the generic redirect.</li>
 *   <li>Any other stage failure marks the session {@code ERROR}, discards the partial response and surfaces as a
 *   {@link StageExecutionException} whose cause is the stage's exception. A stack overflow is handled the
 *   same way; any other {@link Error} propagates unchanged but still leaves the session {@code ERROR}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Turns for different sessions may run concurrently; the per-session status map
 * is a {@link ConcurrentHashMap}. A {@link PipelineContext} belongs to exactly one call.</p>
 * <p><strong>Observability:</strong> Places {@code sessionId} in the MDC; wraps each stage in a
 * {@code guardian.stage.<name>} span; emits {@code pipeline.turns}, {@code pipeline.completed},
 * {@code pipeline.blocked}, {@code pipeline.error} and {@code pipeline.stage.<name>.latencyMillis}.</p>
 *
 * @since 1.0.0
 */
public final class PipelineOrchestrator implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

  /** Flag recorded when the safety stage itself failed. */
  public static final String SAFETY_ERROR_FLAG = "safety_stage_error";
  /** MDC key holding the session identifier during {@link #process}. */
  public static final String MDC_SESSION_KEY = "sessionId";
  /** Instrumentation scope used for stage spans. */
  public static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.guardian";

  private final SafetyStage safetyStage;
  private final List<PipelineStage> stages;
  private final List<AutoCloseable> resources;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final Tracer tracer;
  private final ConcurrentHashMap<String, SessionEntry> sessions = new ConcurrentHashMap<>();

  private PipelineOrchestrator(Builder builder) {
    this.safetyStage = builder.safetyStage;
    this.stages = List.copyOf(builder.stages);
    this.resources = List.copyOf(builder.resources);
    this.metrics = builder.metrics;
    this.clock = builder.clock;
    this.tracer = builder.tracer != null ? builder.tracer : GlobalOpenTelemetry.getTracer(INSTRUMENTATION_SCOPE);
  }

  /**
   * Processes one turn.
   *
   * @param context turn context; owned by this call until it returns
   * @return response text, per-stage metadata and final status
   * @throws StageExecutionException if a stage after the safety gate raises
   */
  public PipelineOutcome process(PipelineContext context) throws StageExecutionException {
    Objects.requireNonNull(context, "context");
    String sessionId = context.sessionId();
    SessionEntry entry = sessions.computeIfAbsent(sessionId, id -> new SessionEntry(clock.nowMillis()));
    entry.status = PipelineStatus.PROCESSING;
    metrics.increment("pipeline.turns");

    String previousSession = MDC.get(MDC_SESSION_KEY);
    MDC.put(MDC_SESSION_KEY, sessionId);
    boolean settled = false;
    try {
      if (context.metadataValue(ParentActivityStage.SESSION_DURATION_KEY).isEmpty()) {
        long elapsedSeconds = Math.max(0L, (clock.nowMillis() - entry.startedMillis) / 1000L);
        context.putMetadata(ParentActivityStage.SESSION_DURATION_KEY, elapsedSeconds);
      }
      String originalResponse = context.responseText();
      Map<String, Map<String, Object>> stageMetadata = new LinkedHashMap<>();

      SafetyVerdict verdict = runSafetyStage(context, stageMetadata);
      if (!verdict.safe()) {
        entry.status = PipelineStatus.SAFETY_BLOCKED;
        settled = true;
        metrics.increment("pipeline.blocked");
        String redirect = verdict.result().redirect().orElse(RedirectCatalog.FALLBACK);
        verdict.context().setResponseText(redirect);
        log.info("Turn blocked by {} (category={}, severity={})",
            safetyStage.name(), verdict.result().category().key(), verdict.result().severity().level());
        return new PipelineOutcome(redirect, stageMetadata, PipelineStatus.SAFETY_BLOCKED);
      }

      PipelineContext current = verdict.context();
      for (PipelineStage stage : stages) {
        current = runStage(stage, current, stageMetadata, entry, originalResponse);
      }
      entry.status = PipelineStatus.COMPLETED;
      settled = true;
      metrics.increment("pipeline.completed");
      log.debug("Turn received at {} completed through {} stages", context.timestamp(), stages.size() + 1);
      return new PipelineOutcome(current.responseText(), stageMetadata, PipelineStatus.COMPLETED);
    } catch (StageExecutionException ex) {
      settled = true;
      throw ex;
    } finally {
      if (!settled) {
        // an Error escaped a stage; the session must not look busy forever
        entry.status = PipelineStatus.ERROR;
        metrics.increment("pipeline.error");
        log.error("Turn for session {} aborted by an unrecoverable error", sessionId);
      }
      if (previousSession == null) {
        MDC.remove(MDC_SESSION_KEY);
      } else {
        MDC.put(MDC_SESSION_KEY, previousSession);
      }
    }
  }

  /**
   * Returns the last known status of a session.
   *
   * @param sessionId session identifier
   * @return status; {@link PipelineStatus#IDLE} for unknown sessions
   */
  public PipelineStatus getSessionStatus(String sessionId) {
    SessionEntry entry = sessions.get(sessionId);
    return entry == null ? PipelineStatus.IDLE : entry.status;
  }

  /**
   * Forgets a session.
   *
   * @param sessionId session identifier
   * @return {@code true} when the session was tracked
   */
  public boolean cleanupSession(String sessionId) {
    boolean removed = sessions.remove(sessionId) != null;
    if (removed) {
      log.debug("Session {} cleaned up", sessionId);
    }
    return removed;
  }

  /**
   * Lists the sessions currently tracked.
   *
   * @return snapshot of session identifiers
   */
  public Set<String> activeSessions() {
    return Set.copyOf(new HashSet<>(sessions.keySet()));
  }

  /**
   * Stage names in execution order, starting with the safety stage.
   *
   * @return stage names
   */
  public List<String> stageNames() {
    List<String> names = new ArrayList<>(stages.size() + 1);
    names.add(safetyStage.name());
    stages.forEach(stage -> names.add(stage.name()));
    return List.copyOf(names);
  }

  /**
   * Clears session state and closes the registered resources (incident store, activity log).
   *
   * @throws Exception the first close failure; later failures are attached as suppressed
   */
  public void shutdown() throws Exception {
    sessions.clear();
    Exception closeFailure = null;
    for (AutoCloseable resource : resources) {
      try {
        resource.close();
      } catch (Exception ex) {
        log.error("Failed to close pipeline resource {}", resource.getClass().getSimpleName(), ex);
        if (closeFailure == null) {
          closeFailure = ex;
        } else {
          closeFailure.addSuppressed(ex);
        }
      }
    }
    if (closeFailure != null) {
      throw closeFailure;
    }
    log.info("Pipeline orchestrator shut down");
  }

  @Override
  public void close() throws Exception {
    shutdown();
  }

  private SafetyVerdict runSafetyStage(PipelineContext context, Map<String, Map<String, Object>> stageMetadata) {
    String name = safetyStage.name();
    long start = clock.nowMillis();
    SafetyVerdict verdict;
    Span span = tracer.spanBuilder("guardian.stage." + name).startSpan();
    try (Scope ignored = span.makeCurrent()) {
      verdict = safetyStage.inspect(context);
      if (verdict == null) {
        throw new IllegalStateException("safety stage " + name + " returned no verdict");
      }
      span.setAttribute("guardian.safe", verdict.safe());
    } catch (Exception | StackOverflowError ex) {
      span.recordException(ex);
      span.setStatus(StatusCode.ERROR, "safety stage failed");
      metrics.increment("safety.errors");
      log.error("Safety stage {} failed; blocking turn", name, ex);
      verdict = failClosed(context);
    } finally {
      span.end();
    }
    long elapsed = clock.nowMillis() - start;
    metrics.observe("pipeline.stage." + name + ".latencyMillis", elapsed);

    SafetyResult result = verdict.result();
    Map<String, Object> metadata = baseMetadata(elapsed);
    metadata.put("safe", verdict.safe());
    metadata.put("category", result.category().key());
    metadata.put("severity", result.severity().level());
    metadata.put("score", result.score());
    metadata.put("parentAlert", result.parentAlertRequired());
    metadata.put("flags", result.flags());
    metadata.putAll(verdict.context().stageDetails(name));
    stageMetadata.put(name, metadata);
    return verdict;
  }

  private PipelineContext runStage(
      PipelineStage stage,
      PipelineContext context,
      Map<String, Map<String, Object>> stageMetadata,
      SessionEntry entry,
      String originalResponse) throws StageExecutionException {
    String name = stage.name();
    long start = clock.nowMillis();
    PipelineContext next;
    Span span = tracer.spanBuilder("guardian.stage." + name).startSpan();
    try (Scope ignored = span.makeCurrent()) {
      next = stage.apply(context);
      if (next == null) {
        throw new IllegalStateException("stage " + name + " returned no context");
      }
    } catch (Exception | StackOverflowError ex) {
      span.recordException(ex);
      span.setStatus(StatusCode.ERROR, "stage failed");
      entry.status = PipelineStatus.ERROR;
      context.setResponseText(originalResponse);
      metrics.increment("pipeline.error");
      log.error("Pipeline stage {} failed; discarding partial response", name, ex);
      throw new StageExecutionException(name, ex);
    } finally {
      span.end();
    }
    long elapsed = clock.nowMillis() - start;
    metrics.observe("pipeline.stage." + name + ".latencyMillis", elapsed);
    Map<String, Object> metadata = baseMetadata(elapsed);
    metadata.putAll(next.stageDetails(name));
    stageMetadata.put(name, metadata);
    return next;
  }

  private static Map<String, Object> baseMetadata(long elapsedMillis) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("processed", true);
    metadata.put("elapsedMillis", elapsedMillis);
    return metadata;
  }

  private static SafetyVerdict failClosed(PipelineContext context) {
    context.addSafetyFlag(SAFETY_ERROR_FLAG);
    context.setResponseText(RedirectCatalog.FALLBACK);
    SafetyResult result = new SafetyResult(
        false,
        0.0,
        List.of(SAFETY_ERROR_FLAG),
        SafetyCategory.OFF_TOPIC,
        SeverityLevel.MODERATE,
        false,
        RedirectCatalog.FALLBACK,
        null,
        true,
        Map.of("reason", SAFETY_ERROR_FLAG));
    return SafetyVerdict.of(result, context);
  }

  /** Mutable per-session state. */
  private static final class SessionEntry {
    private final long startedMillis;
    private volatile PipelineStatus status = PipelineStatus.IDLE;

    private SessionEntry(long startedMillis) {
      this.startedMillis = startedMillis;
    }
  }

  /** Builder for {@link PipelineOrchestrator}. */
  public static final class Builder {
    private final SafetyStage safetyStage;
    private final List<PipelineStage> stages = new ArrayList<>();
    private final List<AutoCloseable> resources = new ArrayList<>();
    private MetricsPort metrics = MetricsPort.NO_OP;
    private ClockPort clock = ClockPort.SYSTEM;
    private Tracer tracer;

    private Builder(SafetyStage safetyStage) {
      this.safetyStage = Objects.requireNonNull(safetyStage, "safetyStage");
    }

    /**
     * Starts a builder around the safety gate.
     *
     * @param safetyStage the only stage allowed to halt a turn
     * @return builder
     */
    public static Builder create(SafetyStage safetyStage) {
      return new Builder(safetyStage);
    }

    /**
     * Appends a stage; stages run in registration order after the safety stage.
     *
     * @param stage stage, including external collaborators
     * @return this builder
     */
    public Builder stage(PipelineStage stage) {
      Objects.requireNonNull(stage, "stage");
      String name = stage.name();
      if (name.equals(safetyStage.name()) || stages.stream().anyMatch(s -> s.name().equals(name))) {
        throw new IllegalArgumentException("Duplicate pipeline stage name: " + name);
      }
      stages.add(stage);
      return this;
    }

    /**
     * Registers a resource closed by {@link PipelineOrchestrator#shutdown()}.
     *
     * @param resource resource such as a store
     * @return this builder
     */
    public Builder closeOnShutdown(AutoCloseable resource) {
      resources.add(Objects.requireNonNull(resource, "resource"));
      return this;
    }

    /**
     * Sets the metrics sink.
     *
     * @param metrics metrics sink
     * @return this builder
     */
    public Builder metrics(MetricsPort metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    /**
     * Sets the clock.
     *
     * @param clock clock
     * @return this builder
     */
    public Builder clock(ClockPort clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    /**
     * Overrides the tracer; defaults to the global OpenTelemetry tracer.
     *
     * @param tracer tracer
     * @return this builder
     */
    public Builder tracer(Tracer tracer) {
      this.tracer = Objects.requireNonNull(tracer, "tracer");
      return this;
    }

    /**
     * Builds the orchestrator.
     *
     * @return orchestrator
     */
    public PipelineOrchestrator build() {
      return new PipelineOrchestrator(this);
    }
  }
}
