package ca.gc.cra.guardian.application.adapt;

import ca.gc.cra.guardian.application.port.PhraseSelector;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Adds a personalized greeting and a follow-up question for bands with engagement enabled.
 *
 * <p>{@link #detach(String, String)} removes a greeting for the same child and any known follow-up before the
 * other steps run, so the greeting appears once and a second adaptation reproduces the first.</p>
 *
 * @since 1.0.0
 */
final class EngagementInjector {
  static final List<String> FOLLOW_UPS = List.of(
      "What do you think about that?",
      "Can you think of an example?",
      "What would you like to explore next?");

  private static final int MAX_FOLLOW_UP_WORDS = FOLLOW_UPS.stream()
      .mapToInt(ReadabilityAnalyzer::countWords)
      .max()
      .orElse(0);

  /**
   * Returns the number of words {@link #attach} may add.
   *
   * @param childName child's name; blank for no greeting
   * @return greeting plus longest follow-up word count
   */
  int overhead(String childName) {
    return greetingWords(childName) + MAX_FOLLOW_UP_WORDS;
  }

  /**
   * Strips a leading greeting for {@code childName} and a trailing known follow-up.
   *
   * @param text text to strip
   * @param childName child's name; blank skips greeting removal
   * @return core text, trimmed
   */
  String detach(String text, String childName) {
    String core = text.trim();
    if (!childName.isBlank()) {
      Matcher greeting = greetingPattern(childName).matcher(core);
      if (greeting.find()) {
        core = core.substring(greeting.end()).trim();
      }
    }
    for (String followUp : FOLLOW_UPS) {
      if (core.equals(followUp)) {
        return "";
      }
      if (core.endsWith(" " + followUp)) {
        return core.substring(0, core.length() - followUp.length()).trim();
      }
    }
    return core;
  }

  /**
   * Wraps the core text with the greeting and, unless it already asks one, a follow-up question.
   *
   * @param core adapted core text
   * @param childName child's name; blank for no greeting
   * @param selector picks the follow-up, seeded by the core text
   * @return engaged text
   */
  String attach(String core, String childName, PhraseSelector selector) {
    StringBuilder out = new StringBuilder();
    if (!childName.isBlank()) {
      out.append("Hi ").append(childName).append('!');
    }
    if (!core.isEmpty()) {
      appendSpaced(out, core);
    }
    if (!core.endsWith("?")) {
      appendSpaced(out, selector.select(FOLLOW_UPS, core));
    }
    return out.toString();
  }

  private static void appendSpaced(StringBuilder out, String text) {
    if (out.length() > 0) {
      out.append(' ');
    }
    out.append(text);
  }

  private static int greetingWords(String childName) {
    return childName.isBlank() ? 0 : 1 + ReadabilityAnalyzer.countWords(childName);
  }

  private static Pattern greetingPattern(String childName) {
    return Pattern.compile("^(?:hi|hello|hey)\\s+" + Pattern.quote(childName) + "\\s*[!,.]\\s*",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
  }
}
