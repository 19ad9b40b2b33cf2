package ca.gc.cra.guardian.application.adapt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.guardian.domain.age.SentenceComplexity;
import ca.gc.cra.guardian.domain.age.VocabularyTier;
import org.junit.jupiter.api.Test;

class TextShapingTest {
  private final VocabularyTable vocabulary = new VocabularyTable();
  private final SentenceRestructurer restructurer = new SentenceRestructurer();
  private final ReadabilityAnalyzer readability = new ReadabilityAnalyzer();

  @Test
  void vocabularyKeepsCaseAndIsStable() {
    String once = vocabulary.apply("Experiments need energy. The Scientific Method starts with a HYPOTHESIS.",
        VocabularyTier.BASIC);

    assertEquals("Tests need power. The Testing ideas starts with a GUESS.", once);
    assertEquals(once, vocabulary.apply(once, VocabularyTier.BASIC));
    assertEquals("Energy.", vocabulary.apply("Energy.", VocabularyTier.UNRESTRICTED));
    assertTrue(vocabulary.terms(VocabularyTier.UNRESTRICTED).isEmpty());
  }

  @Test
  void simpleTierSplitsLongClauses() {
    assertEquals("Plants need sunlight to grow. Roots pull water from the soil.",
        restructurer.restructure("Plants need sunlight to grow, roots pull water from the soil.",
            SentenceComplexity.SIMPLE));
  }

  @Test
  void shortFragmentsStayTogether() {
    String list = "Apples, pears, and plums are fruit.";
    assertEquals(list, restructurer.restructure(list, SentenceComplexity.SIMPLE));
  }

  @Test
  void digitGroupingCommasNeverSplit() {
    String text = "The sun is about 1,000 times wider than our planet Earth.";
    assertEquals(text, restructurer.restructure(text, SentenceComplexity.SIMPLE));
    assertEquals("A whale weighs 150,000 kilograms. Its calf drinks 200 litres of milk.",
        restructurer.restructure("A whale weighs 150,000 kilograms, its calf drinks 200 litres of milk.",
            SentenceComplexity.SIMPLE));
  }

  @Test
  void compoundTierAllowsTwoClauses() {
    assertEquals("One two three, four five six. Seven eight nine.",
        restructurer.restructure("One two three, four five six, seven eight nine.", SentenceComplexity.COMPOUND));
    String text = "One two three, four five six, seven eight nine.";
    assertEquals(text, restructurer.restructure(text, SentenceComplexity.COMPLEX));
  }

  @Test
  void readabilityCountsWordsAndSyllables() {
    assertEquals(0, ReadabilityAnalyzer.countWords(null));
    assertEquals(3, ReadabilityAnalyzer.countWords("  a b\n c "));
    assertEquals(1, ReadabilityAnalyzer.syllables("cake"));
    assertEquals(2, ReadabilityAnalyzer.syllables("table"));
    assertEquals(0.0, readability.gradeLevel(""));
    assertTrue(readability.gradeLevel("The cat sat.")
        < readability.gradeLevel("Photosynthesis transforms electromagnetic radiation into chemical energy."));
  }
}
