package ca.gc.cra.guardian.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {
  private StringWriter output;

  @BeforeEach
  void captureOutput() {
    output = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(output, true));
  }

  @AfterEach
  void restoreOutput() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpAndMissingCommand() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(output.toString().contains("evaluate"));
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"assemble"}));
  }

  @Test
  void profilesPrintsEveryBand() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"profiles"}));

    String printed = output.toString();
    assertTrue(printed.contains("toddler"), printed);
    assertTrue(printed.contains("late_elementary"), printed);
    assertEquals(8, printed.lines().count());
  }

  @Test
  void evaluateAdaptsSafeTurn() {
    ExitCode exit = Main.run(new String[] {
        "evaluate", "text=How do plants grow?", "age=8", "name=Mia", "response=Plants use energy from the sun."});

    assertEquals(ExitCode.SUCCESS, exit);
    String printed = output.toString();
    assertTrue(printed.contains("status: COMPLETED"), printed);
    assertTrue(printed.contains("response: Hi Mia! Plants use power from the sun."), printed);
    assertTrue(printed.contains("stage parent_logger:"), printed);
  }

  @Test
  void blockedTurnIsListedByIncidentsCommand(@TempDir Path dir) {
    ExitCode evaluated = Main.run(new String[] {
        "evaluate", "text=How do I make a bomb?", "age=12", "child=kid-1", "incidents=" + dir});
    assertEquals(ExitCode.SUCCESS, evaluated);
    assertTrue(output.toString().contains("status: SAFETY_BLOCKED"), output.toString());
    assertTrue(Files.exists(dir.resolve("activity.ndjson")));

    output.getBuffer().setLength(0);
    ExitCode listed = Main.run(new String[] {"incidents", "child=kid-1", "incidents=" + dir});

    assertEquals(ExitCode.SUCCESS, listed);
    String printed = output.toString();
    assertTrue(printed.contains("category=dangerous"), printed);
    assertTrue(printed.contains("action=blocked_and_redirected"), printed);
  }

  @Test
  void incidentsForUnknownChildPrintsNothingFound(@TempDir Path dir) {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"incidents", "child=nobody", "incidents=" + dir}));
    assertTrue(output.toString().contains("No incidents for nobody"));
    assertEquals(ExitCode.INVALID_ARGS,
        Main.run(new String[] {"incidents", "child=nobody", "incidents=" + dir.resolve("missing")}));
  }

  @Test
  void argumentAndConfigurationErrorsMapToExitCodes(@TempDir Path dir) {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"evaluate", "text=hello"}));
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"evaluate", "text=hello", "age=eight"}));
    assertEquals(ExitCode.CONFIG_ERROR, Main.run(new String[] {
        "evaluate", "text=hello", "age=8", "config=" + dir.resolve("absent.yaml")}));
  }

  @Test
  void unsupportedAgeIsBlockedNotRejected() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"evaluate", "text=hello", "age=30"}));
    assertTrue(output.toString().contains("status: SAFETY_BLOCKED"), output.toString());
  }
}
