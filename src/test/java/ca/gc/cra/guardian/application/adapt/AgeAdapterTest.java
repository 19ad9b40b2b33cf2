package ca.gc.cra.guardian.application.adapt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.guardian.application.port.PhraseSelector;
import ca.gc.cra.guardian.domain.age.AgeBand;
import ca.gc.cra.guardian.testutil.TestConfigs;
import org.junit.jupiter.api.Test;

class AgeAdapterTest {
  private final AgeAdapter adapter = new AgeAdapter(TestConfigs.bundled(), PhraseSelector.FIRST);

  @Test
  void toddlerResponseIsSimplifiedAndEngaging() {
    String adapted = adapter.adapt("The experiment shows gravity.", AgeBand.TODDLER, "Ava");

    assertEquals("Hi Ava! The test shows Earth's pull. What do you think about that?", adapted);
  }

  @Test
  void adaptingTwiceChangesNothing() {
    String once = adapter.adapt("The experiment shows gravity.", AgeBand.TODDLER, "Ava");
    String twice = adapter.adapt(once, AgeBand.TODDLER, "Ava");

    assertEquals(once, twice);
    assertEquals(once.indexOf("Hi Ava!"), once.lastIndexOf("Hi Ava!"));
  }

  @Test
  void olderBandsKeepVocabularyAtTheirTier() {
    assertEquals("Gravitational field is capacity for work.",
        adapter.adapt("Gravity is energy.", AgeBand.MIDDLE));
    assertEquals("The hypothesis was tested.", adapter.adapt("  The hypothesis was tested.  ", AgeBand.HIGH));
  }

  @Test
  void greetingAndFollowUpFitInsideWordBudget() {
    String text = "Plants need light. ".repeat(20);
    String adapted = adapter.adapt(text, AgeBand.PRESCHOOL, "Sam");

    assertTrue(adapted.startsWith("Hi Sam! Plants need light."), adapted);
    assertTrue(ReadabilityAnalyzer.countWords(adapted) <= 40, adapted);
    assertTrue(adapted.endsWith("?"));
  }

  @Test
  void hardCutOffersToContinueAndStaysStable() {
    String text = "count ".repeat(100).trim();
    String adapted = adapter.adapt(text, AgeBand.EARLY_ELEMENTARY);

    assertTrue(adapted.endsWith("count… " + LengthLimiter.CONTINUATION), adapted);
    assertTrue(ReadabilityAnalyzer.countWords(adapted) <= 50);
    assertEquals(adapted, adapter.adapt(adapted, AgeBand.EARLY_ELEMENTARY));
  }

  @Test
  void groupedNumbersSurviveSentenceSplitting() {
    String text = "The sun is about 1,000 times wider than our planet Earth.";

    String early = adapter.adapt(text, AgeBand.EARLY_ELEMENTARY);
    assertTrue(early.contains("1,000 times"), early);

    String toddler = adapter.adapt(text, AgeBand.TODDLER);
    assertTrue(toddler.contains("many times"), toddler);
    assertFalse(toddler.contains("1. 000"), toddler);
    assertFalse(toddler.contains("000"), toddler);
  }

  @Test
  void shortScienceAnswersGainAnAnalogyOnce() {
    String question = "Why is science fun?";
    String once = adapter.adapt("Plants drink water.", AgeBand.LATE_ELEMENTARY, "", question);

    assertTrue(once.startsWith("Plants drink water. " + ExampleInjector.analogy(AgeBand.LATE_ELEMENTARY)), once);
    assertEquals(once, adapter.adapt(once, AgeBand.LATE_ELEMENTARY, "", question));

    String middle = adapter.adapt("Plants drink water.", AgeBand.MIDDLE, "", question);
    assertEquals("Plants drink water. " + ExampleInjector.analogy(AgeBand.MIDDLE), middle);
    assertEquals(middle, adapter.adapt(middle, AgeBand.MIDDLE, "", question));
  }

  @Test
  void analogyNeedsAScienceQuestionAndNoExistingExample() {
    assertEquals("Plants drink water.",
        adapter.adapt("Plants drink water.", AgeBand.MIDDLE, "", "Why do plants drink?"));
    assertEquals("Plants drink things such as water.",
        adapter.adapt("Plants drink things such as water.", AgeBand.MIDDLE, "", "Is this science?"));
    String longAnswer = "Plants drink water every day. ".repeat(18).trim();
    assertEquals(longAnswer, adapter.adapt(longAnswer, AgeBand.MIDDLE, "", "Is this science?"));
  }

  @Test
  void contactDetailsAndLargeNumbersAreScrubbed() {
    String adapted = adapter.adapt(
        "Email me at kid@example.com or visit https://example.com/page today.", AgeBand.LATE_ELEMENTARY);
    assertTrue(adapted.contains(ResidualScrubber.EMAIL_PLACEHOLDER), adapted);
    assertTrue(adapted.contains(ResidualScrubber.LINK_PLACEHOLDER), adapted);
    assertFalse(adapted.contains("@"));

    String counted = adapter.adapt("There are 3 apples and 5000 seeds.", AgeBand.TODDLER);
    assertTrue(counted.contains("3 apples and many seeds"), counted);
  }

  @Test
  void missingOrBlankTextPassesThrough() {
    assertEquals("", adapter.adapt(null, AgeBand.MIDDLE));
    assertEquals("  ", adapter.adapt("  ", AgeBand.TODDLER, "Ava"));
  }

  @Test
  void sameInputGivesSameOutputWithDefaultSelector() {
    AgeAdapter deterministic = new AgeAdapter(TestConfigs.bundled());
    String text = "Rain falls from clouds when drops get heavy.";
    assertEquals(deterministic.adapt(text, AgeBand.PRESCHOOL, "Noor"),
        deterministic.adapt(text, AgeBand.PRESCHOOL, "Noor"));
  }
}
