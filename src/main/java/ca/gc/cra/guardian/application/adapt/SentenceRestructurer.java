package ca.gc.cra.guardian.application.adapt;

import ca.gc.cra.guardian.domain.age.SentenceComplexity;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits long sentences for the simpler complexity tiers.
 *
 * <p>Clauses are separated by commas, semicolons, {@code and} or {@code but}; a comma between two digits
 * groups thousands and never splits. A split only happens where both sides carry at least three words;
 * shorter fragments (list items, interjections) stay glued to their neighbour with their original separator. {@link SentenceComplexity#SIMPLE} emits one clause per sentence,
 * {@link SentenceComplexity#COMPOUND} at most two. Other tiers pass through.</p>
 *
 * @since 1.0.0
 */
final class SentenceRestructurer {
  static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?…])\\s+");
  private static final Pattern CLAUSE_SEPARATOR =
      Pattern.compile("\\s*(?:;|(?<!\\d),|,(?!\\d))\\s*|\\s+(?:and|but)\\s+", Pattern.CASE_INSENSITIVE);
  private static final Pattern TERMINAL = Pattern.compile("[.!?…]+$");
  private static final int MIN_CLAUSE_WORDS = 3;

  /**
   * Restructures {@code text} for the given tier.
   *
   * @param text text to restructure
   * @param complexity target tier
   * @return restructured text
   */
  String restructure(String text, SentenceComplexity complexity) {
    int maxClauses = switch (complexity) {
      case SIMPLE -> 1;
      case COMPOUND -> 2;
      case COMPLEX, SOPHISTICATED -> 0;
    };
    if (maxClauses == 0 || text.isBlank()) {
      return text;
    }
    List<String> sentences = new ArrayList<>();
    for (String sentence : SENTENCE_BOUNDARY.split(text.trim())) {
      sentences.addAll(split(sentence, maxClauses));
    }
    return String.join(" ", sentences);
  }

  private List<String> split(String sentence, int maxClauses) {
    Matcher terminalMatcher = TERMINAL.matcher(sentence);
    String terminal = terminalMatcher.find() ? terminalMatcher.group() : "";
    String body = sentence.substring(0, sentence.length() - terminal.length());

    List<String> pieces = new ArrayList<>();
    List<String> separators = new ArrayList<>();
    Matcher matcher = CLAUSE_SEPARATOR.matcher(body);
    int start = 0;
    while (matcher.find()) {
      pieces.add(body.substring(start, matcher.start()));
      separators.add(matcher.group());
      start = matcher.end();
    }
    pieces.add(body.substring(start));
    if (pieces.size() == 1) {
      return List.of(sentence);
    }

    List<String> clauses = new ArrayList<>();
    List<String> joins = new ArrayList<>();
    StringBuilder current = new StringBuilder(pieces.get(0));
    for (int i = 1; i < pieces.size(); i++) {
      String next = pieces.get(i);
      if (words(current) >= MIN_CLAUSE_WORDS && words(next) >= MIN_CLAUSE_WORDS) {
        clauses.add(current.toString());
        joins.add(separators.get(i - 1));
        current = new StringBuilder(next);
      } else {
        current.append(separators.get(i - 1)).append(next);
      }
    }
    clauses.add(current.toString());
    if (clauses.size() <= maxClauses) {
      return List.of(sentence);
    }

    List<String> out = new ArrayList<>();
    for (int i = 0; i < clauses.size(); i += maxClauses) {
      StringBuilder group = new StringBuilder(clauses.get(i));
      for (int j = i + 1; j < Math.min(i + maxClauses, clauses.size()); j++) {
        group.append(joins.get(j - 1)).append(clauses.get(j));
      }
      boolean last = i + maxClauses >= clauses.size();
      String text = i == 0 ? group.toString() : capitalize(group.toString());
      out.add(text + (last ? terminal : "."));
    }
    return out;
  }

  private static int words(CharSequence text) {
    return ReadabilityAnalyzer.countWords(text.toString());
  }

  private static String capitalize(String text) {
    if (text.isEmpty() || !Character.isLowerCase(text.charAt(0))) {
      return text;
    }
    return Character.toUpperCase(text.charAt(0)) + text.substring(1);
  }
}
