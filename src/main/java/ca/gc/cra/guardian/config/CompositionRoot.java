package ca.gc.cra.guardian.config;

import ca.gc.cra.guardian.application.adapt.AgeAdapter;
import ca.gc.cra.guardian.application.pipeline.AgeAdaptationStage;
import ca.gc.cra.guardian.application.pipeline.ContentSafetyStage;
import ca.gc.cra.guardian.application.pipeline.ParentActivityStage;
import ca.gc.cra.guardian.application.pipeline.PipelineOrchestrator;
import ca.gc.cra.guardian.application.port.ActivityLogPort;
import ca.gc.cra.guardian.application.port.ClockPort;
import ca.gc.cra.guardian.application.port.IncidentStorePort;
import ca.gc.cra.guardian.application.port.MetricsPort;
import ca.gc.cra.guardian.application.port.PhraseSelector;
import ca.gc.cra.guardian.application.port.PipelineStage;
import ca.gc.cra.guardian.application.safety.SafetyEngine;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the safety engine, the age adapter and the stages into a
 * {@link PipelineOrchestrator} according to {@link AppConfig#pipeline()}.
 * <p><strong>Why:</strong> One place translates configuration into a runnable pipeline; no component reads global
 * state.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Share one {@link SafetyEngine} and one {@link AgeAdapter} across all turns.</li>
 *   <li>Resolve stage names: the built-ins, then external collaborators supplied by the caller.</li>
 *   <li>Reject a configuration naming a stage nobody provides.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct on the startup thread; the resulting graph is thread-safe.</p>
 *
 * @since 1.0.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final AppConfig config;
  private final IncidentStorePort incidents;
  private final ActivityLogPort activityLog;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final SafetyEngine safetyEngine;
  private final AgeAdapter ageAdapter;

  /**
   * Creates a composition root.
   *
   * @param config application configuration
   * @param incidents incident store
   * @param activityLog activity log
   * @param metrics metrics sink
   * @param clock clock
   * @param selector phrase selector for redirects and follow-up questions
   */
  public CompositionRoot(
      AppConfig config,
      IncidentStorePort incidents,
      ActivityLogPort activityLog,
      MetricsPort metrics,
      ClockPort clock,
      PhraseSelector selector) {
    this.config = Objects.requireNonNull(config, "config");
    this.incidents = Objects.requireNonNull(incidents, "incidents");
    this.activityLog = Objects.requireNonNull(activityLog, "activityLog");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    Objects.requireNonNull(selector, "selector");
    this.safetyEngine = new SafetyEngine(config, selector, metrics);
    this.ageAdapter = new AgeAdapter(config, selector);
  }

  /** @return shared safety engine */
  public SafetyEngine safetyEngine() {
    return safetyEngine;
  }

  /** @return shared age adapter */
  public AgeAdapter ageAdapter() {
    return ageAdapter;
  }

  /**
   * Builds an orchestrator with the built-in stages only.
   *
   * @return orchestrator
   * @throws ConfigurationException if the configured order names an unknown stage
   */
  public PipelineOrchestrator orchestrator() throws ConfigurationException {
    return orchestrator(List.of());
  }

  /**
   * Builds an orchestrator.
   *
   * <p>External stages named in {@code pipeline.order} run at that position; the others run last, in the order
   * given.</p>
   *
   * @param externalStages collaborators such as a tutor or a progress tracker
   * @return orchestrator
   * @throws ConfigurationException if a stage name is unknown, duplicated or the safety stage is not the built-in
   */
  public PipelineOrchestrator orchestrator(List<PipelineStage> externalStages) throws ConfigurationException {
    PipelineConfig pipeline = config.pipeline();
    if (!PipelineConfig.CONTENT_FILTER.equals(pipeline.safetyStage())) {
      throw new ConfigurationException("Unknown safety stage: " + pipeline.safetyStage());
    }

    Map<String, PipelineStage> available = new LinkedHashMap<>();
    available.put(PipelineConfig.AGE_ADAPTER, new AgeAdaptationStage(ageAdapter, metrics));
    available.put(PipelineConfig.PARENT_LOGGER,
        new ParentActivityStage(config.parentAlerts(), activityLog, metrics, clock));
    Map<String, PipelineStage> external = new LinkedHashMap<>();
    for (PipelineStage stage : Objects.requireNonNull(externalStages, "externalStages")) {
      String name = stage.name();
      if (available.containsKey(name) || external.containsKey(name) || name.equals(pipeline.safetyStage())) {
        throw new ConfigurationException("Duplicate pipeline stage name: " + name);
      }
      external.put(name, stage);
    }

    ContentSafetyStage safety =
        new ContentSafetyStage(safetyEngine, incidents, config.policy(), metrics, clock);
    PipelineOrchestrator.Builder builder = PipelineOrchestrator.Builder.create(safety)
        .metrics(metrics)
        .clock(clock)
        .closeOnShutdown(incidents)
        .closeOnShutdown(activityLog);
    for (String name : pipeline.downstreamStages()) {
      PipelineStage stage = available.containsKey(name) ? available.get(name) : external.remove(name);
      if (stage == null) {
        throw new ConfigurationException("Unknown pipeline stage in pipeline.order: " + name);
      }
      builder.stage(stage);
    }
    external.values().forEach(builder::stage);

    PipelineOrchestrator orchestrator = builder.build();
    log.info("Pipeline assembled: {}", orchestrator.stageNames());
    return orchestrator;
  }
}
