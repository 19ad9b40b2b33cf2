package ca.gc.cra.guardian.api;

import ca.gc.cra.guardian.domain.safety.SafetyIncident;
import ca.gc.cra.guardian.infrastructure.persistence.NdjsonIncidentStoreAdapter;
import ca.gc.cra.guardian.logging.LoggingConfigurator;
import ca.gc.cra.guardian.validation.Strings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the safety incidents stored for one child, oldest first.
 *
 * @since 1.0.0
 */
public final class IncidentsCli {
  private static final Logger log = LoggerFactory.getLogger(IncidentsCli.class);
  private static final String SUMMARY_USAGE =
      "usage: incidents child=ID incidents=DIR [since=ISO-INSTANT] [until=ISO-INSTANT]";
  private static final String HELP_TEXT = """
      GUARDIAN incidents

      Usage:
        incidents child=ID incidents=DIR [options]

      Required:
        child=ID           Child profile identifier
        incidents=DIR      Directory holding incidents.ndjson

      Optional:
        since=INSTANT      Inclusive lower bound, e.g. 2024-05-01T00:00:00Z (default: epoch)
        until=INSTANT      Exclusive upper bound (default: unbounded)
        --verbose          Enable DEBUG logging
        --help             Show this message
      """;

  private IncidentsCli() {}

  /**
   * Executes the incidents command.
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

    String childId;
    Path directory;
    Instant since;
    Instant until;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      childId = Strings.requireIdentifier("child", CliArgsParser.require(kv, "child"));
      directory = Path.of(CliArgsParser.require(kv, "incidents"));
      since = kv.containsKey("since") ? Instant.parse(kv.get("since")) : Instant.EPOCH;
      until = kv.containsKey("until") ? Instant.parse(kv.get("until")) : Instant.MAX;
    } catch (IllegalArgumentException | DateTimeParseException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (!Files.isDirectory(directory)) {
      log.error("Incident directory does not exist: {}", directory);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (NdjsonIncidentStoreAdapter store = new NdjsonIncidentStoreAdapter(directory)) {
      List<SafetyIncident> incidents = store.findByChild(childId, since, until);
      if (incidents.isEmpty()) {
        CliPrinter.println("No incidents for " + childId);
      }
      for (SafetyIncident incident : incidents) {
        CliPrinter.println(format(incident));
      }
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to read incidents under {}: {}", directory, ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    }
  }

  static String format(SafetyIncident incident) {
    return incident.timestamp()
        + " category=" + incident.category().key()
        + " severity=" + incident.severity().level()
        + " action=" + incident.action().key()
        + " parentNotified=" + incident.parentNotified()
        + " session=" + incident.sessionId()
        + " input=\"" + incident.inputExcerpt().replace('\n', ' ') + '"';
  }
}
