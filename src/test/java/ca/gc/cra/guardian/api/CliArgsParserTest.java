package ca.gc.cra.guardian.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void splitsOnFirstEqualsAndKeepsOrder() {
    Map<String, String> args = CliArgsParser.toMap(new String[] {"text=what is 2+2=4?", "age=9", " ", "age=10"});

    assertEquals("what is 2+2=4?", args.get("text"));
    assertEquals("10", args.get("age"));
    assertEquals(10, CliArgsParser.requireInt(args, "age"));
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"text"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"age="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"1age=3"}));
    assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.requireInt(Map.of("age", "nine"), "age"));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.require(Map.of(), "text"));
  }

  @Test
  void inputSeparatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"--verbose", "text=hi", "--RANDOM", "--colour"});

    assertTrue(input.verbose());
    assertTrue(input.randomPhrases());
    assertFalse(input.help());
    assertArrayEquals(new String[] {"text=hi"}, input.keyValueArgs());
  }
}
