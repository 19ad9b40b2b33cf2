package ca.gc.cra.guardian.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("How do plants grow?", Strings.requireNonBlank("text", "  How do plants grow?  "));
  }

  @Test
  void requireNonBlankKeepsLineBreaksInsideText() {
    assertEquals("Why?\nBecause!", Strings.requireNonBlank("text", "Why?\nBecause!\n"));
  }

  @Test
  void requireNonBlankRejectsOtherControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("text", "bad\u0001"));
  }

  @Test
  void identifiersAllowSessionStyleValues() {
    assertEquals("3f2a-session.1_b", Strings.requireIdentifier("session", "3f2a-session.1_b"));
  }

  @Test
  void identifiersRejectSpacesAndNewlines() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireIdentifier("child", "child one"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireIdentifier("child", "child\none"));
  }

  @Test
  void identifiersRejectOverlongValues() {
    String tooLong = "c".repeat(Strings.MAX_IDENTIFIER_LENGTH + 1);
    assertThrows(IllegalArgumentException.class, () -> Strings.requireIdentifier("child", tooLong));
  }
}
