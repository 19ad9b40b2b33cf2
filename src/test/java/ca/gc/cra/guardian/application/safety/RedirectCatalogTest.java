package ca.gc.cra.guardian.application.safety;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.guardian.application.port.PhraseSelector;
import ca.gc.cra.guardian.domain.age.AgeBand;
import ca.gc.cra.guardian.domain.safety.SafetyCategory;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class RedirectCatalogTest {
  private final RedirectCatalog catalog = new RedirectCatalog();

  @Test
  void categoriesWithoutPhrasingFallBack() {
    assertEquals(RedirectCatalog.FALLBACK, catalog.suggested(SafetyCategory.OFF_TOPIC, AgeBand.PRESCHOOL));
    assertEquals(RedirectCatalog.FALLBACK, catalog.suggested(SafetyCategory.SAFE, AgeBand.HIGH));
  }

  @Test
  void bandsInTheSameTierShareAPhrase() {
    assertEquals(catalog.suggested(SafetyCategory.SCARY, AgeBand.TODDLER),
        catalog.suggested(SafetyCategory.SCARY, AgeBand.EARLY_ELEMENTARY));
    assertEquals(catalog.suggested(SafetyCategory.VIOLENCE, AgeBand.MIDDLE),
        catalog.suggested(SafetyCategory.VIOLENCE, AgeBand.ADULT));
    assertNotEquals(catalog.suggested(SafetyCategory.VIOLENCE, AgeBand.TODDLER),
        catalog.suggested(SafetyCategory.VIOLENCE, AgeBand.LATE_ELEMENTARY));
  }

  @Test
  void educationalPromptFollowsSelector() {
    assertEquals("Want to learn why the sky is blue?",
        catalog.educational(AgeBand.PRESCHOOL, PhraseSelector.FIRST, "anything"));
    assertEquals(catalog.educational(AgeBand.MIDDLE, PhraseSelector.DETERMINISTIC, "same seed"),
        catalog.educational(AgeBand.MIDDLE, PhraseSelector.DETERMINISTIC, "same seed"));

    List<String> elementary = List.of(
        "Want to find out how volcanoes work?",
        "Shall we explore how robots follow instructions?",
        "Do you want to learn how bridges hold up heavy trucks?");
    PhraseSelector random = PhraseSelector.random(new Random(7));
    for (int i = 0; i < 10; i++) {
      assertTrue(elementary.contains(catalog.educational(AgeBand.LATE_ELEMENTARY, random, null)));
    }
  }
}
