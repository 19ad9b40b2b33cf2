package ca.gc.cra.guardian.application.adapt;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last-line redaction of contact details and large numbers in adapted text.
 *
 * <p>E-mail addresses become {@code [email]}, links {@code [link]} and phone numbers {@code [phone]}. When a
 * band sets a number ceiling, any number above it becomes {@code many}. Placeholders never match again, so the
 * scrub is idempotent.</p>
 *
 * @since 1.0.0
 */
final class ResidualScrubber {
  static final String EMAIL_PLACEHOLDER = "[email]";
  static final String LINK_PLACEHOLDER = "[link]";
  static final String PHONE_PLACEHOLDER = "[phone]";
  static final String VAGUE_QUANTITY = "many";

  private static final Pattern EMAIL = Pattern.compile("\\b[\\w.+-]+@[\\w-]+\\.[\\w.-]*\\w\\b");
  private static final Pattern URL =
      Pattern.compile("(?i)\\b(?:https?://|www\\.)[^\\s<>\"]*[^\\s<>\".,;:!?)\\]]");
  private static final Pattern PHONE = Pattern.compile("\\b\\d{3}[-.\\s]?\\d{3}[-.\\s]?\\d{4}\\b");
  private static final Pattern NUMBER = Pattern.compile("(?<![\\w.])\\d{1,3}(?:,\\d{3}){1,12}(?:\\.\\d+)?\\b|(?<![\\w.])\\d+(?:\\.\\d+)?\\b");

  /**
   * Scrubs {@code text}.
   *
   * @param text adapted text
   * @param maxNumber largest number left as is; {@code 0} disables the number rule
   * @return scrubbed text
   */
  String scrub(String text, long maxNumber) {
    String out = EMAIL.matcher(text).replaceAll(Matcher.quoteReplacement(EMAIL_PLACEHOLDER));
    out = URL.matcher(out).replaceAll(Matcher.quoteReplacement(LINK_PLACEHOLDER));
    out = PHONE.matcher(out).replaceAll(Matcher.quoteReplacement(PHONE_PLACEHOLDER));
    if (maxNumber > 0) {
      out = replaceLargeNumbers(out, maxNumber);
    }
    return out;
  }

  private static String replaceLargeNumbers(String text, long maxNumber) {
    Matcher matcher = NUMBER.matcher(text);
    StringBuilder out = new StringBuilder(text.length());
    BigDecimal ceiling = BigDecimal.valueOf(maxNumber);
    while (matcher.find()) {
      BigDecimal value = new BigDecimal(matcher.group().replace(",", ""));
      String replacement = value.compareTo(ceiling) > 0 ? VAGUE_QUANTITY : matcher.group();
      matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(out);
    return out.toString();
  }
}
