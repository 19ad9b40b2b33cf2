package ca.gc.cra.guardian.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Console output for command results: plain lines, {@code label: value} fields and table rows.
 *
 * <p>Results go to the stdout descriptor in UTF-8 so children's text with accents or emoji survives, and so
 * they never mix with Logback's console appender. Tests swap the writer to capture output.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter captured;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints a single line.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    PrintWriter out = captured != null ? captured : STDOUT;
    out.println(message);
    out.flush();
  }

  /**
   * Prints {@code label: value}, the shape scripts grep for in {@code evaluate} output.
   *
   * @param label field name such as {@code status}
   * @param value field value; {@code null} prints as an empty value
   */
  public static void field(String label, Object value) {
    println(label + ": " + (value == null ? "" : value));
  }

  /**
   * Prints one table row using a {@link java.util.Formatter} pattern in the root locale.
   *
   * @param pattern row pattern
   * @param cells cell values
   */
  public static void row(String pattern, Object... cells) {
    println(String.format(Locale.ROOT, pattern, cells));
  }

  static void setWriterForTesting(PrintWriter writer) {
    captured = writer;
  }

  static void clearTestWriter() {
    captured = null;
  }
}
