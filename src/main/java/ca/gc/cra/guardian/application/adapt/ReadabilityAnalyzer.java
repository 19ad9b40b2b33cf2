package ca.gc.cra.guardian.application.adapt;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flesch-Kincaid grade estimate used to report how far an adaptation moved a response.
 *
 * <p>Syllables are approximated by counting vowel groups, dropping a silent trailing {@code e}. The grade is
 * clamped to {@code [0, 18]}.</p>
 *
 * @since 1.0.0
 */
public final class ReadabilityAnalyzer {
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern SENTENCE_END = Pattern.compile("[.!?…]+");
  private static final Pattern NON_LETTER = Pattern.compile("[^a-z]");
  private static final double MAX_GRADE = 18.0;

  /**
   * Estimates the reading grade of {@code text}.
   *
   * @param text text to analyze
   * @return grade in {@code [0, 18]}; {@code 0} for blank text
   */
  public double gradeLevel(String text) {
    int words = countWords(text);
    if (words == 0) {
      return 0.0;
    }
    int sentences = Math.max(1, countSentences(text));
    int syllables = 0;
    for (String word : WHITESPACE.split(text.trim())) {
      syllables += syllables(word);
    }
    double grade = 0.39 * ((double) words / sentences) + 11.8 * ((double) syllables / words) - 15.59;
    return Math.max(0.0, Math.min(MAX_GRADE, grade));
  }

  /**
   * Counts whitespace-separated words.
   *
   * @param text text; {@code null} counts as empty
   * @return word count
   */
  public static int countWords(String text) {
    if (text == null || text.isBlank()) {
      return 0;
    }
    return WHITESPACE.split(text.trim()).length;
  }

  static int countSentences(String text) {
    int count = 0;
    Matcher matcher = SENTENCE_END.matcher(text);
    while (matcher.find()) {
      count++;
    }
    return count;
  }

  static int syllables(String word) {
    String letters = NON_LETTER.matcher(word.toLowerCase(Locale.ROOT)).replaceAll("");
    if (letters.isEmpty()) {
      return 0;
    }
    int count = 0;
    boolean previousVowel = false;
    for (int i = 0; i < letters.length(); i++) {
      boolean vowel = "aeiouy".indexOf(letters.charAt(i)) >= 0;
      if (vowel && !previousVowel) {
        count++;
      }
      previousVowel = vowel;
    }
    if (letters.endsWith("e") && !letters.endsWith("le") && count > 1) {
      count--;
    }
    return Math.max(1, count);
  }
}
