package ca.gc.cra.guardian.api;

import ca.gc.cra.guardian.config.AppConfig;
import ca.gc.cra.guardian.config.AppConfigLoader;
import ca.gc.cra.guardian.config.ConfigurationException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Shared helpers for resolving {@code config=PATH} across subcommands.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Loads the configuration named by {@code config=PATH}, or the bundled {@code guardian.yaml}.
   *
   * @param args parsed arguments; the {@code config} entry is consumed
   * @return configuration
   * @throws ConfigurationException when the file is missing or invalid
   */
  static AppConfig loadConfig(Map<String, String> args) throws ConfigurationException {
    String path = args.remove("config");
    return path == null ? AppConfigLoader.loadDefault() : AppConfigLoader.load(Path.of(path));
  }
}
