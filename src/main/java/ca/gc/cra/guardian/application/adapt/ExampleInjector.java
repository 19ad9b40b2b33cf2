package ca.gc.cra.guardian.application.adapt;

import ca.gc.cra.guardian.domain.age.AgeBand;
import java.util.regex.Pattern;

/**
 * Appends a band-tiered analogy to short answers about science.
 *
 * <p>Only fires when the child's question mentions science, the answer has no example of its own and the
 * answer uses less than 70% of the word budget with room left for the analogy. An answer already carrying the
 * band's analogy is left alone.</p>
 *
 * @since 1.0.0
 */
final class ExampleInjector {
  private static final Pattern SCIENCE_QUESTION = Pattern.compile("\\bscien\\w*", Pattern.CASE_INSENSITIVE);
  private static final Pattern HAS_EXAMPLE =
      Pattern.compile("\\b(?:for example|such as|like)\\b", Pattern.CASE_INSENSITIVE);
  private static final double MAX_BUDGET_SHARE = 0.7;

  /**
   * Returns the analogy used for a band.
   *
   * @param band target band
   * @return one sentence
   */
  static String analogy(AgeBand band) {
    return switch (band) {
      case TODDLER, PRESCHOOL, EARLY_ELEMENTARY -> "It's like when you mix colors to make new ones!";
      case LATE_ELEMENTARY -> "Think of it like a recipe where ingredients combine to make something new.";
      case MIDDLE -> "This is similar to how apps on your phone work together.";
      case HIGH, ADULT -> "This principle applies to many real-world applications.";
    };
  }

  /**
   * Appends the band's analogy when it helps.
   *
   * @param text restructured answer
   * @param band target band
   * @param question child's question; {@code null} disables injection
   * @param budget word budget the answer must stay within
   * @return {@code text}, possibly followed by one analogy sentence
   */
  String inject(String text, AgeBand band, String question, int budget) {
    if (text.isBlank() || question == null || !SCIENCE_QUESTION.matcher(question).find()) {
      return text;
    }
    String analogy = analogy(band);
    if (text.contains(analogy) || HAS_EXAMPLE.matcher(text).find()) {
      return text;
    }
    int words = ReadabilityAnalyzer.countWords(text);
    if (words >= budget * MAX_BUDGET_SHARE || words + ReadabilityAnalyzer.countWords(analogy) > budget) {
      return text;
    }
    String trimmed = text.trim();
    return trimmed + (endsSentence(trimmed) ? " " : ". ") + analogy;
  }

  private static boolean endsSentence(String text) {
    char last = text.charAt(text.length() - 1);
    return last == '.' || last == '!' || last == '?' || last == '…';
  }
}
