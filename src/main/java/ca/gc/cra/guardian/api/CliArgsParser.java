package ca.gc.cra.guardian.api;

import ca.gc.cra.guardian.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} CLI arguments into a lookup map.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 1.0.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9_-]*$");

  private CliArgsParser() {}

  /**
   * Splits each argument on its first {@code '='}.
   *
   * @param args raw arguments; {@code null} returns an empty map
   * @return mutable map in argument order; a repeated key keeps the last value
   * @throws IllegalArgumentException when an argument is not {@code key=value}, the key is malformed or the value
   *     contains control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int idx = arg.indexOf('=');
      if (idx <= 0 || idx == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      map.put(key, Strings.requireNonBlank(key, arg.substring(idx + 1)));
    }
    return map;
  }

  /**
   * Parses an integer argument.
   *
   * @param args parsed arguments
   * @param key argument name
   * @return parsed value
   * @throws IllegalArgumentException when the argument is missing or not an integer
   */
  static int requireInt(Map<String, String> args, String key) {
    String value = require(args, key);
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + value + "')", ex);
    }
  }

  /**
   * Returns a required argument.
   *
   * @param args parsed arguments
   * @param key argument name
   * @return value
   * @throws IllegalArgumentException when the argument is missing
   */
  static String require(Map<String, String> args, String key) {
    String value = args.get(key);
    if (value == null) {
      throw new IllegalArgumentException("missing required argument " + key + "=...");
    }
    return value;
  }
}
