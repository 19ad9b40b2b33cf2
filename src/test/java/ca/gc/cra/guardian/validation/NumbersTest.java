package ca.gc.cra.guardian.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(7200, Numbers.requireRange("extendedSessionSeconds", 7200, 60, 86_400));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("extendedSessionSeconds", 59, 60, 86_400));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("maxSymbolRatio", 1.5, 0.0, 1.0));
  }

  @Test
  void fractionalRangeRejectsNaN() {
    assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("scorePenaltyPerIssue", Double.NaN, 0.01, 1.0));
  }
}
