package ca.gc.cra.guardian.api;

import ca.gc.cra.guardian.application.pipeline.PipelineOrchestrator;
import ca.gc.cra.guardian.application.pipeline.StageExecutionException;
import ca.gc.cra.guardian.application.port.ActivityLogPort;
import ca.gc.cra.guardian.application.port.IncidentStorePort;
import ca.gc.cra.guardian.application.port.PhraseSelector;
import ca.gc.cra.guardian.config.AppConfig;
import ca.gc.cra.guardian.config.CompositionRoot;
import ca.gc.cra.guardian.config.ConfigurationException;
import ca.gc.cra.guardian.domain.pipeline.PipelineContext;
import ca.gc.cra.guardian.domain.pipeline.PipelineOutcome;
import ca.gc.cra.guardian.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.guardian.infrastructure.persistence.InMemoryActivityLogAdapter;
import ca.gc.cra.guardian.infrastructure.persistence.InMemoryIncidentStoreAdapter;
import ca.gc.cra.guardian.infrastructure.persistence.NdjsonActivityLogAdapter;
import ca.gc.cra.guardian.infrastructure.persistence.NdjsonIncidentStoreAdapter;
import ca.gc.cra.guardian.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.guardian.logging.LoggingConfigurator;
import ca.gc.cra.guardian.logging.Logs;
import ca.gc.cra.guardian.validation.Strings;
import java.io.IOException;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one conversation turn through the configured pipeline and prints the outcome.
 *
 * @since 1.0.0
 */
public final class EvaluateCli {
  private static final Logger log = LoggerFactory.getLogger(EvaluateCli.class);

  /** Shown to the child when a stage after the safety gate fails. */
  static final String ERROR_RESPONSE = "I had trouble with that. Let's try again with a different question!";

  private static final String SUMMARY_USAGE =
      "usage: evaluate text=TEXT age=N [response=TEXT] [name=NAME] [session=ID] [child=ID] "
          + "[config=PATH] [incidents=DIR] [--random]";
  private static final String HELP_TEXT = """
      GUARDIAN evaluate

      Usage:
        evaluate text="How do plants grow?" age=8 [options]

      Required:
        text=TEXT          Child input for the turn
        age=N              Child age in years

      Optional:
        response=TEXT      Model response to screen and adapt
        name=NAME          Child name used in the greeting
        session=ID         Session identifier (default: random UUID)
        child=ID           Child profile identifier (default: cli-child)
        config=PATH        YAML configuration (default: bundled guardian.yaml)
        incidents=DIR      Write incidents.ndjson and activity.ndjson under DIR (default: in memory)
        --random           Pick redirect and follow-up phrases at random
        --verbose          Enable DEBUG logging
        --help             Show this message
      """;

  private EvaluateCli() {}

  /**
   * Executes the evaluate command.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Map<String, String> kv;
    String text;
    int age;
    String sessionId;
    String childId;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      text = CliArgsParser.require(kv, "text");
      age = CliArgsParser.requireInt(kv, "age");
      sessionId = Strings.requireIdentifier("session", kv.getOrDefault("session", UUID.randomUUID().toString()));
      childId = Strings.requireIdentifier("child", kv.getOrDefault("child", "cli-child"));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    AppConfig config;
    try {
      config = ConfigCliUtils.loadConfig(kv);
    } catch (ConfigurationException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    PhraseSelector selector = input.randomPhrases()
        ? PhraseSelector.random(new SecureRandom())
        : PhraseSelector.DETERMINISTIC;
    String storeDir = kv.get("incidents");
    SystemClockAdapter clock = new SystemClockAdapter();
    PipelineContext context = PipelineContext.Builder.create(sessionId, childId, age, text)
        .childName(kv.get("name"))
        .responseText(kv.getOrDefault("response", ""))
        .timestamp(clock.now())
        .build();
    log.debug("Evaluating turn for child {} (name {}): {}",
        childId, Logs.redact(kv.get("name")), Logs.excerpt(text));

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter();
        IncidentStorePort incidents = storeDir == null
            ? new InMemoryIncidentStoreAdapter()
            : new NdjsonIncidentStoreAdapter(Path.of(storeDir));
        ActivityLogPort activity = storeDir == null
            ? new InMemoryActivityLogAdapter()
            : new NdjsonActivityLogAdapter(Path.of(storeDir));
        PipelineOrchestrator orchestrator = new CompositionRoot(
            config, incidents, activity, metrics, clock, selector).orchestrator(List.of())) {
      PipelineOutcome outcome = orchestrator.process(context);
      print(outcome);
      return ExitCode.SUCCESS;
    } catch (StageExecutionException ex) {
      log.error("Stage {} failed for session {}", ex.stageName(), sessionId, ex);
      CliPrinter.field("status", "ERROR");
      CliPrinter.field("response", ERROR_RESPONSE);
      return ExitCode.RUNTIME_FAILURE;
    } catch (ConfigurationException ex) {
      log.error("Invalid pipeline configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to open or write stores under {}", storeDir, ex);
      return ExitCode.IO_ERROR;
    } catch (Exception ex) {
      log.error("Unexpected failure while evaluating turn", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void print(PipelineOutcome outcome) {
    CliPrinter.field("status", outcome.status());
    CliPrinter.field("response", outcome.responseText());
    outcome.stageMetadata().forEach((stage, values) ->
        CliPrinter.field("stage " + stage, new TreeMap<>(values)));
  }
}
