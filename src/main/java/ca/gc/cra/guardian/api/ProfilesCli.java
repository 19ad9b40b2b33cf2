package ca.gc.cra.guardian.api;

import ca.gc.cra.guardian.config.AppConfig;
import ca.gc.cra.guardian.config.ConfigurationException;
import ca.gc.cra.guardian.domain.age.AgeBand;
import ca.gc.cra.guardian.domain.age.AgeProfile;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the configured age profiles as a table.
 *
 * @since 1.0.0
 */
public final class ProfilesCli {
  private static final Logger log = LoggerFactory.getLogger(ProfilesCli.class);
  private static final String SUMMARY_USAGE = "usage: profiles [config=PATH]";
  private static final String ROW = "%-17s %-6s %-6s %5s  %-13s %-12s %-8s %s";

  private ProfilesCli() {}

  /**
   * Executes the profiles command.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.SUCCESS;
    }
    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
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

    CliPrinter.row(ROW,
        "band", "ages", "grade", "words", "complexity", "vocabulary", "filter", "blocked topics");
    for (AgeBand band : AgeBand.values()) {
      AgeProfile profile = config.profile(band);
      CliPrinter.row(ROW,
          band.key(),
          band.range().min() + "-" + band.range().max(),
          profile.gradeLevel(),
          profile.maxWords(),
          lower(profile.complexity()),
          lower(profile.vocabularyTier()),
          lower(profile.strictness()),
          profile.blockedTopics().isEmpty() ? "-" : String.join(",", new TreeSet<>(profile.blockedTopics())));
    }
    return ExitCode.SUCCESS;
  }

  private static String lower(Enum<?> value) {
    return value.name().toLowerCase(Locale.ROOT);
  }
}
