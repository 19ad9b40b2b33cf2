package ca.gc.cra.guardian.config;

import ca.gc.cra.guardian.domain.age.AgeBand;
import ca.gc.cra.guardian.domain.age.AgeProfile;
import ca.gc.cra.guardian.domain.age.FilterStrictness;
import ca.gc.cra.guardian.domain.age.SentenceComplexity;
import ca.gc.cra.guardian.domain.age.VocabularyTier;
import ca.gc.cra.guardian.domain.safety.SafetyCategory;
import ca.gc.cra.guardian.domain.safety.SeverityLevel;
import ca.gc.cra.guardian.domain.safety.TopicDefinition;
import ca.gc.cra.guardian.domain.safety.TopicLexicon;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads the GUARDIAN configuration document ({@code guardian.yaml}) into an {@link AppConfig}.
 *
 * <p>The document must declare {@code version: 1} and contain {@code pipeline}, {@code topics} and
 * {@code profiles} sections; {@code policy} and {@code parentAlerts} fall back to their defaults when absent.
 * Every band needs a profile. Any structural problem is reported as a {@link ConfigurationException}.</p>
 *
 * @since 1.0.0
 */
public final class AppConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(AppConfigLoader.class);

  /** Classpath location of the shipped configuration. */
  public static final String DEFAULT_RESOURCE = "/guardian.yaml";

  private AppConfigLoader() {}

  /**
   * Loads the configuration shipped on the classpath.
   *
   * @return parsed configuration
   * @throws ConfigurationException when the resource is missing or invalid
   */
  public static AppConfig loadDefault() throws ConfigurationException {
    try (InputStream in = AppConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) {
        throw new ConfigurationException("Configuration resource not found: " + DEFAULT_RESOURCE);
      }
      return load(new InputStreamReader(in, StandardCharsets.UTF_8), "classpath:" + DEFAULT_RESOURCE);
    } catch (IOException ex) {
      throw new ConfigurationException("Failed to read " + DEFAULT_RESOURCE, ex);
    }
  }

  /**
   * Loads a configuration file from disk.
   *
   * @param path YAML document
   * @return parsed configuration
   * @throws ConfigurationException when the file is missing, unreadable or invalid
   */
  public static AppConfig load(Path path) throws ConfigurationException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      throw new ConfigurationException("Configuration file not found: " + path);
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return load(reader, path.toString());
    } catch (IOException ex) {
      throw new ConfigurationException("Failed to read configuration at " + path, ex);
    }
  }

  /**
   * Parses a configuration document.
   *
   * @param reader document source; not closed by this method
   * @param source label used in diagnostics
   * @return parsed configuration
   * @throws ConfigurationException when the document is invalid
   */
  public static AppConfig load(Reader reader, String source) throws ConfigurationException {
    Objects.requireNonNull(reader, "reader");
    try {
      Object rootObj = new Yaml().load(reader);
      if (rootObj == null) {
        throw new ConfigurationException("Configuration " + source + " is empty");
      }
      Map<String, Object> root = asMap(rootObj, "root");

      int version = toInt(root.get("version"), "version");
      if (version != 1) {
        throw new ConfigurationException("Unsupported configuration version " + version + " in " + source);
      }

      PipelineConfig pipeline = parsePipeline(asMap(root.get("pipeline"), "pipeline"));
      SafetyPolicy policy = root.containsKey("policy")
          ? parsePolicy(asMap(root.get("policy"), "policy"))
          : SafetyPolicy.defaults();
      ParentAlertPolicy parentAlerts = root.containsKey("parentAlerts")
          ? parseParentAlerts(asMap(root.get("parentAlerts"), "parentAlerts"))
          : ParentAlertPolicy.defaults();
      TopicLexicon topics = parseTopics(asMap(root.get("topics"), "topics"));
      Map<AgeBand, AgeProfile> profiles = parseProfiles(asMap(root.get("profiles"), "profiles"));

      AppConfig config = new AppConfig(pipeline, policy, parentAlerts, topics, profiles);
      log.info("Loaded configuration from {} ({} topics, {} profiles, stages {})",
          source, topics.size(), profiles.size(), pipeline.order());
      return config;
    } catch (YAMLException ex) {
      throw new ConfigurationException("Failed to parse YAML configuration at " + source, ex);
    } catch (IllegalArgumentException ex) {
      throw new ConfigurationException("Invalid configuration in " + source + ": " + ex.getMessage(), ex);
    }
  }

  private static PipelineConfig parsePipeline(Map<String, Object> map) {
    List<String> order = toStringList(map.get("order"), "pipeline.order");
    String safetyStage = toString(map.getOrDefault("safetyStage", PipelineConfig.CONTENT_FILTER));
    return new PipelineConfig(order, safetyStage);
  }

  private static SafetyPolicy parsePolicy(Map<String, Object> map) {
    SafetyPolicy defaults = SafetyPolicy.defaults();
    return new SafetyPolicy(
        map.containsKey("scorePenaltyPerIssue")
            ? toDouble(map.get("scorePenaltyPerIssue"), "policy.scorePenaltyPerIssue")
            : defaults.scorePenaltyPerIssue(),
        map.containsKey("parentAlertSeverity")
            ? toSeverity(map.get("parentAlertSeverity"), "policy.parentAlertSeverity")
            : defaults.parentAlertSeverity(),
        map.containsKey("maxInputChars")
            ? toInt(map.get("maxInputChars"), "policy.maxInputChars")
            : defaults.maxInputChars(),
        map.containsKey("maxSymbolRatio")
            ? toDouble(map.get("maxSymbolRatio"), "policy.maxSymbolRatio")
            : defaults.maxSymbolRatio(),
        map.containsKey("incidentExcerptChars")
            ? toInt(map.get("incidentExcerptChars"), "policy.incidentExcerptChars")
            : defaults.incidentExcerptChars());
  }

  private static ParentAlertPolicy parseParentAlerts(Map<String, Object> map) {
    ParentAlertPolicy defaults = ParentAlertPolicy.defaults();
    List<String> keywords = map.containsKey("keywords")
        ? toStringList(map.get("keywords"), "parentAlerts.keywords")
        : defaults.keywords();
    long seconds = map.containsKey("extendedSessionSeconds")
        ? toInt(map.get("extendedSessionSeconds"), "parentAlerts.extendedSessionSeconds")
        : defaults.extendedSessionSeconds();
    return new ParentAlertPolicy(keywords, seconds);
  }

  private static TopicLexicon parseTopics(Map<String, Object> map) {
    List<TopicDefinition> definitions = new ArrayList<>();
    for (Map.Entry<String, Object> entry : map.entrySet()) {
      String tag = entry.getKey();
      Map<String, Object> topic = asMap(entry.getValue(), "topics." + tag);
      SafetyCategory category = SafetyCategory.fromKey(requireString(topic, "category", "topics." + tag))
          .orElseThrow(() -> new IllegalArgumentException(
              "Unknown category for topic " + tag + ": " + topic.get("category")));
      SeverityLevel severity = topic.containsKey("severity")
          ? toSeverity(topic.get("severity"), "topics." + tag + ".severity")
          : SeverityLevel.SAFE;
      List<String> terms = toStringList(topic.get("terms"), "topics." + tag + ".terms");
      definitions.add(new TopicDefinition(tag, category, severity, terms));
    }
    return new TopicLexicon(definitions);
  }

  private static Map<AgeBand, AgeProfile> parseProfiles(Map<String, Object> map) {
    Map<AgeBand, AgeProfile> profiles = new EnumMap<>(AgeBand.class);
    for (Map.Entry<String, Object> entry : map.entrySet()) {
      AgeBand band = AgeBand.fromKey(entry.getKey())
          .orElseThrow(() -> new IllegalArgumentException("Unknown age band: " + entry.getKey()));
      if (profiles.containsKey(band)) {
        throw new IllegalArgumentException("Duplicate profile for band " + band.key());
      }
      profiles.put(band, parseProfile(band, asMap(entry.getValue(), "profiles." + band.key())));
    }
    return profiles;
  }

  private static AgeProfile parseProfile(AgeBand band, Map<String, Object> map) {
    String ctx = "profiles." + band.key();
    return new AgeProfile(
        band,
        toString(map.getOrDefault("gradeLevel", "")),
        toInt(map.get("maxWords"), ctx + ".maxWords"),
        SentenceComplexity.parse(requireString(map, "complexity", ctx)),
        VocabularyTier.parse(requireString(map, "vocabulary", ctx)),
        FilterStrictness.parse(requireString(map, "strictness", ctx)),
        toStringSet(map.get("allowedTopics"), ctx + ".allowedTopics"),
        toStringSet(map.get("blockedTopics"), ctx + ".blockedTopics"),
        toBoolean(map.get("scaryTolerated"), ctx + ".scaryTolerated"),
        toBoolean(map.get("violenceTolerated"), ctx + ".violenceTolerated"),
        toBoolean(map.get("romanceTolerated"), ctx + ".romanceTolerated"),
        toInt(map.getOrDefault("toleratedIssues", 0), ctx + ".toleratedIssues"),
        toBoolean(map.getOrDefault("amplifySeverity", Boolean.FALSE), ctx + ".amplifySeverity"),
        toBoolean(map.getOrDefault("engagement", Boolean.FALSE), ctx + ".engagement"),
        toInt(map.getOrDefault("maxNumber", 0), ctx + ".maxNumber"));
  }

  private static SeverityLevel toSeverity(Object value, String context) {
    if (value instanceof Number number) {
      return SeverityLevel.of(number.intValue());
    }
    String raw = toString(value).trim().toUpperCase(Locale.ROOT);
    try {
      return SeverityLevel.valueOf(raw);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Invalid severity for " + context + ": " + value, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (node == null) {
      throw new IllegalArgumentException(context + " section is missing");
    }
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      Object keyObj = entry.getKey();
      if (!(keyObj instanceof String key)) {
        throw new IllegalArgumentException(context + " contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static String requireString(Map<String, Object> map, String key, String context) {
    Object value = map.get(key);
    if (value == null) {
      throw new IllegalArgumentException("Missing required field: " + context + "." + key);
    }
    return toString(value);
  }

  private static String toString(Object value) {
    if (value == null) {
      return "";
    }
    return value.toString();
  }

  private static List<String> toStringList(Object node, String context) {
    if (node == null) {
      return List.of();
    }
    if (!(node instanceof Iterable<?> iterable)) {
      throw new IllegalArgumentException(context + " must be a list");
    }
    List<String> values = new ArrayList<>();
    for (Object value : iterable) {
      if (value == null) {
        throw new IllegalArgumentException(context + " contains an empty entry");
      }
      values.add(toString(value).trim());
    }
    return List.copyOf(values);
  }

  private static Set<String> toStringSet(Object node, String context) {
    return new LinkedHashSet<>(toStringList(node, context));
  }

  private static int toInt(Object value, String context) {
    if (value instanceof Number number) {
      return number.intValue();
    }
    if (value instanceof String str && !str.isBlank()) {
      try {
        return Integer.parseInt(str.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid integer for " + context + ": '" + str + "'");
      }
    }
    throw new IllegalArgumentException("Invalid integer for " + context + ": " + value);
  }

  private static double toDouble(Object value, String context) {
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    if (value instanceof String str && !str.isBlank()) {
      try {
        return Double.parseDouble(str.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid number for " + context + ": '" + str + "'");
      }
    }
    throw new IllegalArgumentException("Invalid number for " + context + ": " + value);
  }

  private static boolean toBoolean(Object value, String context) {
    if (value instanceof Boolean bool) {
      return bool;
    }
    if (value instanceof String str) {
      String normalized = str.trim().toLowerCase(Locale.ROOT);
      if (normalized.equals("true") || normalized.equals("false")) {
        return Boolean.parseBoolean(normalized);
      }
    }
    throw new IllegalArgumentException("Invalid boolean for " + context + ": " + value);
  }
}
