package ca.gc.cra.guardian.application.safety;

import ca.gc.cra.guardian.config.SafetyPolicy;
import ca.gc.cra.guardian.domain.age.AgeProfile;
import ca.gc.cra.guardian.domain.safety.SafetyCategory;
import ca.gc.cra.guardian.domain.safety.SafetyIssue;
import ca.gc.cra.guardian.domain.safety.SeverityLevel;
import java.text.Normalizer;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Built-in pattern table and text normalization used by {@link SafetyEngine}.
 *
 * <p>Patterns run against folded text: NFKD-decomposed, accents stripped, lower-cased, common digit and
 * symbol substitutions undone (so {@code k1ll} reads as {@code kill}) and punctuation collapsed to spaces.
 * Every pattern is anchored on word boundaries; {@code class} never matches {@code ass}.</p>
 *
 * @since 1.0.0
 */
final class SafetyPatterns {
  static final String OVERLONG_INPUT = "overlong_input";
  static final String KEYBOARD_MASHING = "keyboard_mashing";
  static final String SHOUTING = "shouting";

  private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");
  private static final Pattern CONSONANT_RUN = Pattern.compile("[bcdfghjklmnpqrstvwxz]{7,}");
  private static final int SHOUTING_MIN_LETTERS = 12;
  private static final int MASHING_MIN_CHARS = 5;

  private static final Pattern PHONE = Pattern.compile("\\b\\d{3}[-.\\s]?\\d{3}[-.\\s]?\\d{4}\\b");
  private static final Pattern EMAIL = Pattern.compile("\\b[\\w.+-]+@[\\w-]+\\.[\\w.-]*\\w\\b");

  private static final List<PatternRule> RULES = List.of(
      rule(SafetyCategory.VIOLENCE, SeverityLevel.SEVERE, Gate.VIOLENCE,
          "\\b(kill(?:s|ed|ing)?|murder\\w*|stab\\w*|shoot(?:s|ing)?|weapons?|guns?|knife|knives|punch\\w*"
              + "|attack\\w*|assault\\w*|blood\\w*|gore|violent|violence)\\b"),
      rule(SafetyCategory.INAPPROPRIATE, SeverityLevel.MODERATE, Gate.ROMANCE,
          "\\b(kiss(?:es|ing)?|dating|boyfriends?|girlfriends?|romance|romantic)\\b"),
      rule(SafetyCategory.SCARY, SeverityLevel.MINOR, Gate.SCARY,
          "\\b(monsters?|ghosts?|zombies?|demons?|vampires?|horror|nightmares?|creepy|haunted)\\b"),
      rule(SafetyCategory.INAPPROPRIATE, SeverityLevel.SEVERE, Gate.ALWAYS,
          "\\b(sex|sexy|porn\\w*|nudes?|naked|drugs?|alcohol|beer|cocaine|marijuana|vap(?:e|es|ing))\\b"),
      rule(SafetyCategory.BULLYING, SeverityLevel.MODERATE, Gate.ALWAYS,
          "\\b(stupid|dumb|idiot|loser|ugly|nobody likes (?:you|me)|everyone hates (?:you|me))\\b"),
      rule(SafetyCategory.PROFANITY, SeverityLevel.MINOR, Gate.ALWAYS,
          "\\b(damn|crap|hell|ass|shut up|wtf)\\b"),
      // self-harm, including coded phrasing
      rule(SafetyCategory.DANGEROUS, SeverityLevel.CRITICAL, Gate.ALWAYS,
          "\\b((?:kill|hurt|cut|harm) (?:myself|yourself|himself|herself)"
              + "|how (?:to|do i|can i) \\w+ (?:myself|yourself)|suicide|suicidal)\\b"),
      rule(SafetyCategory.DANGEROUS, SeverityLevel.CRITICAL, Gate.ALWAYS,
          "\\b(unalive|self delete|forever sleep|kms)\\b"),
      // explosives; building instructions escalate
      rule(SafetyCategory.DANGEROUS, SeverityLevel.SEVERE, Gate.ALWAYS,
          "\\b(bombs?|explosives?|dynamite|grenades?|detonat\\w*)\\b"),
      rule(SafetyCategory.DANGEROUS, SeverityLevel.CRITICAL, Gate.ALWAYS,
          "\\b((?:make|build|create|assemble)\\b.{0,30}\\b(?:bomb|explosive|grenade)s?)\\b"),
      rule(SafetyCategory.DANGEROUS, SeverityLevel.MODERATE, Gate.ALWAYS,
          "\\b((?:set|start)\\b.{0,20}\\bfire)\\b"),
      // attempts to talk the tutor out of its rules
      rule(SafetyCategory.DANGEROUS, SeverityLevel.MODERATE, Gate.ALWAYS,
          "\\b(how (?:do i|can i|to) (?:get around|bypass|avoid|trick|hack)"
              + "|(?:ignore|forget) (?:your|all|the) (?:rules|instructions))\\b"),
      rule(SafetyCategory.INAPPROPRIATE, SeverityLevel.MODERATE, Gate.ALWAYS,
          "\\b((?:tell|show|give) me\\b.{0,30}\\b(?:adult|mature|grown up))\\b"),
      rule(SafetyCategory.INAPPROPRIATE, SeverityLevel.MODERATE, Gate.ALWAYS,
          "\\b((?:pretend|imagine|act like)\\b.{0,30}\\b(?:boyfriend|girlfriend|dating))\\b"),
      // location, financial and meeting solicitation
      rule(SafetyCategory.PERSONAL_INFO, SeverityLevel.SEVERE, Gate.ALWAYS,
          "\\b(where (?:do|does) (?:you|u|he|she|they) live|(?:home|street|house|your|my) address(?:es)?"
              + "|what school do (?:you|u) go to)\\b"),
      rule(SafetyCategory.PERSONAL_INFO, SeverityLevel.SEVERE, Gate.ALWAYS,
          "\\b((?:send|give) (?:me )?money|credit cards?|passwords?|social security|bank account)\\b"),
      rule(SafetyCategory.PERSONAL_INFO, SeverityLevel.SEVERE, Gate.ALWAYS,
          "\\b(meet\\b.{0,30}\\b(?:strangers?|in person|someone|somebody))\\b"));

  private SafetyPatterns() {
    // Utility
  }

  /**
   * Decomposes, strips accents, lower-cases and collapses whitespace.
   *
   * @param text raw text
   * @return normalized text
   */
  static String normalize(String text) {
    String decomposed = Normalizer.normalize(text, Normalizer.Form.NFKD);
    String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
    return WHITESPACE.matcher(stripped.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
  }

  /**
   * Undoes look-alike substitutions in tokens that contain a letter, then replaces punctuation with spaces.
   *
   * @param normalized output of {@link #normalize(String)}
   * @return folded text, single-spaced
   */
  static String fold(String normalized) {
    StringBuilder out = new StringBuilder(normalized.length());
    for (String token : normalized.split(" ")) {
      if (out.length() > 0) {
        out.append(' ');
      }
      out.append(hasLetter(token) ? unleet(token) : token);
    }
    return WHITESPACE.matcher(NON_WORD.matcher(out).replaceAll(" ")).replaceAll(" ").trim();
  }

  /**
   * Runs the built-in rule table, skipping rules the profile tolerates.
   *
   * @param folded folded text
   * @param profile band profile
   * @param issues sink; one issue per occurrence
   */
  static void scanRules(String folded, AgeProfile profile, List<SafetyIssue> issues) {
    for (PatternRule rule : RULES) {
      if (rule.gate().open(profile)) {
        collect(rule.pattern(), folded, rule.category(), rule.severity(), issues);
      }
    }
  }

  /**
   * Finds phone numbers and e-mail addresses in the normalized (unfolded) text.
   *
   * @param normalized normalized text
   * @param issues sink
   */
  static void scanLiterals(String normalized, List<SafetyIssue> issues) {
    collect(PHONE, normalized, SafetyCategory.PERSONAL_INFO, SeverityLevel.MODERATE, issues);
    collect(EMAIL, normalized, SafetyCategory.PERSONAL_INFO, SeverityLevel.MODERATE, issues);
  }

  /**
   * Flags overlong input, keyboard mashing and shouting.
   *
   * @param raw text as typed
   * @param normalized normalized text
   * @param policy limits
   * @param issues sink
   */
  static void scanContext(String raw, String normalized, SafetyPolicy policy, List<SafetyIssue> issues) {
    if (raw.length() > policy.maxInputChars()) {
      issues.add(new SafetyIssue(SafetyCategory.OFF_TOPIC, OVERLONG_INPUT, SeverityLevel.MINOR));
    }
    if (symbolRatio(raw) > policy.maxSymbolRatio() || CONSONANT_RUN.matcher(normalized).find()) {
      issues.add(new SafetyIssue(SafetyCategory.OFF_TOPIC, KEYBOARD_MASHING, SeverityLevel.MINOR));
    }
    if (isShouting(raw)) {
      issues.add(new SafetyIssue(SafetyCategory.OFF_TOPIC, SHOUTING, SeverityLevel.MINOR));
    }
  }

  /**
   * Compiles a word-bounded, case-insensitive pattern for a lexicon term.
   *
   * @param term lexicon term, lower-case
   * @return pattern matching the folded form of the term
   */
  static Pattern termPattern(String term) {
    return Pattern.compile("\\b" + Pattern.quote(fold(normalize(term))) + "\\b");
  }

  static double symbolRatio(String raw) {
    int visible = 0;
    int symbols = 0;
    for (int i = 0; i < raw.length(); i++) {
      char c = raw.charAt(i);
      if (Character.isWhitespace(c)) {
        continue;
      }
      visible++;
      if (!Character.isLetterOrDigit(c)) {
        symbols++;
      }
    }
    if (visible < MASHING_MIN_CHARS) {
      return 0.0;
    }
    return (double) symbols / visible;
  }

  static boolean isShouting(String raw) {
    int letters = 0;
    for (int i = 0; i < raw.length(); i++) {
      char c = raw.charAt(i);
      if (Character.isLowerCase(c)) {
        return false;
      }
      if (Character.isUpperCase(c)) {
        letters++;
      }
    }
    return letters > SHOUTING_MIN_LETTERS;
  }

  private static void collect(
      Pattern pattern, String text, SafetyCategory category, SeverityLevel severity, List<SafetyIssue> issues) {
    Matcher matcher = pattern.matcher(text);
    while (matcher.find()) {
      issues.add(new SafetyIssue(category, matcher.group(), severity));
    }
  }

  private static boolean hasLetter(String token) {
    for (int i = 0; i < token.length(); i++) {
      if (Character.isLetter(token.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String unleet(String token) {
    StringBuilder sb = new StringBuilder(token.length());
    for (int i = 0; i < token.length(); i++) {
      char c = token.charAt(i);
      sb.append(switch (c) {
        case '0' -> 'o';
        case '1' -> 'i';
        case '3' -> 'e';
        case '4', '@' -> 'a';
        case '5', '$' -> 's';
        case '7' -> 't';
        case '8' -> 'b';
        default -> c;
      });
    }
    return sb.toString();
  }

  private static PatternRule rule(SafetyCategory category, SeverityLevel severity, Gate gate, String regex) {
    return new PatternRule(category, severity, gate, Pattern.compile(regex));
  }

  /** Tolerance flag that switches a rule off for a profile. */
  enum Gate {
    ALWAYS,
    VIOLENCE,
    SCARY,
    ROMANCE;

    boolean open(AgeProfile profile) {
      return switch (this) {
        case ALWAYS -> true;
        case VIOLENCE -> !profile.violenceTolerated();
        case SCARY -> !profile.scaryTolerated();
        case ROMANCE -> !profile.romanceTolerated();
      };
    }
  }

  record PatternRule(SafetyCategory category, SeverityLevel severity, Gate gate, Pattern pattern) {
    PatternRule {
      Objects.requireNonNull(category, "category");
      Objects.requireNonNull(severity, "severity");
      Objects.requireNonNull(gate, "gate");
      Objects.requireNonNull(pattern, "pattern");
    }
  }
}
