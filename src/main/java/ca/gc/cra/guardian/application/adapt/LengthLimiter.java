package ca.gc.cra.guardian.application.adapt;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Enforces a word budget.
 *
 * <p>Whole sentences are kept while they fit. When the kept sentences cover less than 70% of the budget the
 * text is cut mid-sentence instead, an ellipsis is attached to the last kept word and {@link #CONTINUATION}
 * is appended; the result never exceeds the budget.</p>
 *
 * @since 1.0.0
 */
final class LengthLimiter {
  /** Prompt appended after a hard cut. */
  static final String CONTINUATION = "Want to hear more?";
  static final String ELLIPSIS = "…";

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[,;:.!?…]+$");
  private static final double MIN_SENTENCE_COVERAGE = 0.7;
  private static final int CONTINUATION_WORDS = ReadabilityAnalyzer.countWords(CONTINUATION);

  /**
   * Trims {@code text} to at most {@code budget} words.
   *
   * @param text text to trim
   * @param budget maximum word count, at least one
   * @return text within budget
   */
  String limit(String text, int budget) {
    if (ReadabilityAnalyzer.countWords(text) <= budget) {
      return text;
    }
    List<String> kept = new ArrayList<>();
    int keptWords = 0;
    for (String sentence : SentenceRestructurer.SENTENCE_BOUNDARY.split(text.trim())) {
      int words = ReadabilityAnalyzer.countWords(sentence);
      if (keptWords + words > budget) {
        break;
      }
      kept.add(sentence);
      keptWords += words;
    }
    if (!kept.isEmpty() && keptWords >= MIN_SENTENCE_COVERAGE * budget) {
      return String.join(" ", kept);
    }
    return hardCut(text, budget);
  }

  private static String hardCut(String text, int budget) {
    String[] tokens = WHITESPACE.split(text.trim());
    int keep = Math.max(1, budget - CONTINUATION_WORDS);
    if (keep + CONTINUATION_WORDS > budget) {
      // budget too small for the prompt; cut without it
      return String.join(" ", List.of(tokens).subList(0, Math.min(budget, tokens.length)));
    }
    List<String> words = new ArrayList<>(List.of(tokens).subList(0, keep));
    int lastIndex = words.size() - 1;
    String last = TRAILING_PUNCTUATION.matcher(words.get(lastIndex)).replaceAll("");
    words.set(lastIndex, (last.isEmpty() ? words.get(lastIndex) : last) + ELLIPSIS);
    return String.join(" ", words) + " " + CONTINUATION;
  }
}
