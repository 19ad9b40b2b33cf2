package ca.gc.cra.guardian.application.adapt;

import ca.gc.cra.guardian.domain.age.VocabularyTier;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Three-tier substitution table for complex vocabulary.
 *
 * <p>Terms match case-insensitively on word boundaries. The replacement keeps the capitalization of the
 * original: an all-caps term yields an all-caps replacement, a capitalized term a capitalized one. No
 * replacement contains a term of its own tier, so a second pass is a no-op.</p>
 *
 * @since 1.0.0
 */
final class VocabularyTable {
  private final Map<VocabularyTier, Map<String, String>> tables = new EnumMap<>(VocabularyTier.class);
  private final Map<VocabularyTier, Pattern> patterns = new EnumMap<>(VocabularyTier.class);

  VocabularyTable() {
    Map<String, String> basic = new LinkedHashMap<>();
    basic.put("scientific method", "testing ideas");
    basic.put("hypothesis", "guess");
    basic.put("hypotheses", "guesses");
    basic.put("experiment", "test");
    basic.put("experiments", "tests");
    basic.put("molecule", "tiny piece");
    basic.put("molecules", "tiny pieces");
    basic.put("ecosystem", "nature community");
    basic.put("ecosystems", "nature communities");
    basic.put("algorithm", "step by step instructions");
    basic.put("algorithms", "step by step instructions");
    basic.put("variable", "thing that changes");
    basic.put("variables", "things that change");
    basic.put("energy", "power");
    basic.put("gravity", "Earth's pull");
    basic.put("circuit", "path for electricity");
    basic.put("circuits", "paths for electricity");
    basic.put("utilize", "use");
    basic.put("demonstrate", "show");
    basic.put("investigate", "look at");
    basic.put("approximately", "about");
    basic.put("therefore", "so");
    basic.put("however", "but");
    basic.put("furthermore", "also");
    basic.put("subsequently", "then");
    basic.put("initiate", "start");
    basic.put("terminate", "end");
    register(VocabularyTier.BASIC, basic);

    Map<String, String> intermediate = new LinkedHashMap<>();
    intermediate.put("scientific method", "systematic investigation");
    intermediate.put("hypothesis", "educated guess");
    intermediate.put("experiment", "controlled test");
    intermediate.put("molecule", "group of atoms");
    intermediate.put("ecosystem", "biological community");
    intermediate.put("algorithm", "problem-solving steps");
    intermediate.put("variable", "changeable factor");
    intermediate.put("energy", "capacity to do work");
    intermediate.put("gravity", "gravitational pull");
    intermediate.put("circuit", "electrical pathway");
    register(VocabularyTier.INTERMEDIATE, intermediate);

    Map<String, String> advanced = new LinkedHashMap<>();
    advanced.put("scientific method", "empirical methodology");
    advanced.put("hypothesis", "testable prediction");
    advanced.put("experiment", "controlled investigation");
    advanced.put("molecule", "covalently bonded atoms");
    advanced.put("ecosystem", "ecological system");
    advanced.put("algorithm", "computational procedure");
    advanced.put("variable", "experimental parameter");
    advanced.put("energy", "capacity for work");
    advanced.put("gravity", "gravitational field");
    advanced.put("circuit", "closed conducting path");
    register(VocabularyTier.ADVANCED, advanced);
  }

  /**
   * Rewrites {@code text} with the tier's substitutions.
   *
   * @param text text to rewrite
   * @param tier vocabulary tier; {@link VocabularyTier#UNRESTRICTED} leaves the text untouched
   * @return rewritten text
   */
  String apply(String text, VocabularyTier tier) {
    Pattern pattern = patterns.get(tier);
    if (pattern == null) {
      return text;
    }
    Map<String, String> table = tables.get(tier);
    Matcher matcher = pattern.matcher(text);
    StringBuilder out = new StringBuilder(text.length());
    while (matcher.find()) {
      String original = matcher.group();
      String replacement = table.get(original.toLowerCase(Locale.ROOT).replaceAll("\\s+", " "));
      matcher.appendReplacement(out, Matcher.quoteReplacement(matchCase(original, replacement)));
    }
    matcher.appendTail(out);
    return out.toString();
  }

  /**
   * Lists the terms a tier rewrites.
   *
   * @param tier vocabulary tier
   * @return lower-case terms; empty for tiers without substitutions
   */
  List<String> terms(VocabularyTier tier) {
    Map<String, String> table = tables.get(tier);
    return table == null ? List.of() : List.copyOf(table.keySet());
  }

  private void register(VocabularyTier tier, Map<String, String> table) {
    tables.put(tier, Map.copyOf(table));
    List<String> keys = new ArrayList<>(table.keySet());
    // longest first so multi-word terms win
    keys.sort(Comparator.comparingInt(String::length).reversed());
    StringBuilder alternation = new StringBuilder();
    for (String key : keys) {
      if (alternation.length() > 0) {
        alternation.append('|');
      }
      alternation.append(Pattern.quote(key).replace(" ", "\\E\\s+\\Q"));
    }
    patterns.put(tier, Pattern.compile("\\b(?:" + alternation + ")\\b",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
  }

  private static String matchCase(String original, String replacement) {
    if (original.length() > 1 && original.equals(original.toUpperCase(Locale.ROOT))) {
      return replacement.toUpperCase(Locale.ROOT);
    }
    if (Character.isUpperCase(original.charAt(0))) {
      return Character.toUpperCase(replacement.charAt(0)) + replacement.substring(1);
    }
    return replacement;
  }
}
