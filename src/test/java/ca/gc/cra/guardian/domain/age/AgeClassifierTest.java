package ca.gc.cra.guardian.domain.age;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class AgeClassifierTest {

  @Test
  void everySupportedAgeBelongsToExactlyOneBand() {
    for (int age = AgeClassifier.MIN_AGE; age <= AgeClassifier.MAX_AGE; age++) {
      List<AgeBand> claiming = AgeClassifier.bandsClaiming(age);
      assertEquals(1, claiming.size(), "age " + age + " claimed by " + claiming);
      assertEquals(claiming.get(0), AgeClassifier.classify(age));
    }
  }

  @Test
  void rangesTileTheSupportedDomainWithoutGaps() {
    int expectedMin = AgeClassifier.MIN_AGE;
    int covered = 0;
    for (AgeBand band : AgeBand.values()) {
      AgeRange range = AgeClassifier.rangeOf(band);
      assertEquals(expectedMin, range.min(), band + " should start where the previous band ended");
      expectedMin = range.max() + 1;
      covered += range.size();
    }
    assertEquals(AgeClassifier.MAX_AGE + 1, expectedMin);
    assertEquals(AgeClassifier.MAX_AGE - AgeClassifier.MIN_AGE + 1, covered);
    assertTrue(AgeClassifier.bandsClaiming(AgeClassifier.MIN_AGE - 1).isEmpty());
    assertTrue(AgeClassifier.bandsClaiming(AgeClassifier.MAX_AGE + 1).isEmpty());
  }

  @Test
  void boundariesFallIntoExpectedBands() {
    assertEquals(AgeBand.TODDLER, AgeClassifier.classify(2));
    assertEquals(AgeBand.TODDLER, AgeClassifier.classify(4));
    assertEquals(AgeBand.PRESCHOOL, AgeClassifier.classify(5));
    assertEquals(AgeBand.EARLY_ELEMENTARY, AgeClassifier.classify(8));
    assertEquals(AgeBand.LATE_ELEMENTARY, AgeClassifier.classify(9));
    assertEquals(AgeBand.MIDDLE, AgeClassifier.classify(13));
    assertEquals(AgeBand.HIGH, AgeClassifier.classify(14));
    assertEquals(AgeBand.HIGH, AgeClassifier.classify(17));
    assertEquals(AgeBand.ADULT, AgeClassifier.classify(18));
  }

  @Test
  void agesOutsideTheDomainAreRejected() {
    InvalidAgeException low = assertThrows(InvalidAgeException.class, () -> AgeClassifier.classify(1));
    assertEquals(1, low.age());
    InvalidAgeException high = assertThrows(InvalidAgeException.class, () -> AgeClassifier.classify(19));
    assertEquals(19, high.age());
    assertThrows(InvalidAgeException.class, () -> AgeClassifier.classify(-3));
    assertFalse(AgeClassifier.isSupported(0));
    assertTrue(AgeClassifier.isSupported(18));
  }

  @Test
  void bandsAreOrderedYoungestFirst() {
    assertTrue(AgeBand.TODDLER.isYoungerThan(AgeBand.ADULT));
    assertFalse(AgeBand.HIGH.isYoungerThan(AgeBand.MIDDLE));
    assertEquals(AgeBand.MIDDLE, AgeBand.fromKey("MIDDLE").orElseThrow());
    assertTrue(AgeBand.fromKey("teen").isEmpty());
  }
}
