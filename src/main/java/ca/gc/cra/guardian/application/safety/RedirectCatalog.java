package ca.gc.cra.guardian.application.safety;

import ca.gc.cra.guardian.application.port.PhraseSelector;
import ca.gc.cra.guardian.domain.age.AgeBand;
import ca.gc.cra.guardian.domain.safety.SafetyCategory;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Positive, age-appropriate replacement messages for blocked turns.
 *
 * <p>Suggested redirects are keyed by {@code (category, band)}; bands share phrasing within three reading
 * tiers. Categories without an entry fall back to {@link #FALLBACK}. Educational prompts are picked per tier
 * through a {@link PhraseSelector} so tests can pin the choice.</p>
 *
 * @since 1.0.0
 */
public final class RedirectCatalog {
  /** Generic redirect used when no category-specific phrase exists. */
  public static final String FALLBACK =
      "Let's talk about something else! What STEM topic would you like to explore today?";

  private final Map<SafetyCategory, Map<Tier, String>> suggestions = new EnumMap<>(SafetyCategory.class);
  private final Map<Tier, List<String>> educational = new EnumMap<>(Tier.class);

  /** Creates the catalog with the built-in phrasing. */
  public RedirectCatalog() {
    suggest(SafetyCategory.VIOLENCE,
        "Let's think about something happy instead! Do you want to learn how animals take care of their babies?",
        "Let's focus on something positive! How about we explore how engineers design safety equipment?",
        "Let's explore the world of physics and motion instead! Want to learn about forces, energy, or how things move?");
    suggest(SafetyCategory.INAPPROPRIATE,
        "That's a grown-up topic. Let's learn about something fun, like how plants grow!",
        "That's not something I can help with. Would you like to learn how the human body works instead?",
        "That's not something I can help with. Would you like to explore biology or human health from a scientific perspective?");
    suggest(SafetyCategory.PERSONAL_INFO,
        "Let's keep our private things private! Want to count the colors of the rainbow with me?",
        "Safety first! Let's keep personal information private. Want to learn how secret codes work?",
        "Safety first! Let's learn about digital citizenship, or explore how encryption protects information.");
    suggest(SafetyCategory.DANGEROUS,
        "Let's stay safe! Want to learn about how firefighters keep people safe?",
        "Safety first! Let's learn about how scientists stay safe in their labs. Want to try a safe experiment idea?",
        "Safety first! Instead of dangerous things, let's learn how scientists and engineers work safely in laboratories.");
    suggest(SafetyCategory.SCARY,
        "Let's explore something amazing instead! Did you know some ocean animals glow in the dark?",
        "Let's explore something fascinating instead! Did you know there are glow-in-the-dark animals in the ocean?",
        "Let's explore something fascinating instead! Want to learn how bioluminescence works in deep-sea animals?");
    suggest(SafetyCategory.BULLYING,
        "Let's use kind words! Want to learn how animals help each other?",
        "Let's focus on kindness and teamwork! Want to learn how engineers work together to build bridges?",
        "Let's focus on positive learning! How about we explore teamwork in engineering or collaborative problem-solving?");
    suggest(SafetyCategory.PROFANITY,
        "Let's use nice words! Can you think of a word that describes the sky?",
        "Let's use respectful words. There are so many amazing words to describe the world. Want to explore a science topic?",
        "Let's keep our language respectful. How about we explore a new science topic instead?");
    suggest(SafetyCategory.MEDICAL,
        "That's a question for a grown-up you trust. Want to learn how our bodies grow strong?",
        "A doctor or a grown-up you trust is the best person to ask about that. Want to learn how the heart pumps blood?",
        "A doctor or trusted adult is the right person for that. Would you like to learn how vaccines train the immune system?");
    suggest(SafetyCategory.COMMERCIAL,
        "Let's learn instead of shopping! Want to count some shapes with me?",
        "Let's learn something new instead! Want to find out how money was invented?",
        "Let's focus on learning. Want to explore how economists and mathematicians model prices?");

    educational.put(Tier.YOUNG, List.of(
        "Want to learn why the sky is blue?",
        "Shall we count the legs on a spider together?",
        "Do you want to find out how seeds turn into flowers?"));
    educational.put(Tier.ELEMENTARY, List.of(
        "Want to find out how volcanoes work?",
        "Shall we explore how robots follow instructions?",
        "Do you want to learn how bridges hold up heavy trucks?"));
    educational.put(Tier.OLDER, List.of(
        "Would you like to explore how computers store information in binary?",
        "Want to dig into how renewable energy is generated?",
        "Shall we look at the math behind encryption?"));
  }

  /**
   * Returns the redirect for a blocked category.
   *
   * @param category primary category of the verdict
   * @param band child's band
   * @return category- and tier-specific phrase, or {@link #FALLBACK}
   */
  public String suggested(SafetyCategory category, AgeBand band) {
    Map<Tier, String> byTier = suggestions.get(category);
    if (byTier == null) {
      return FALLBACK;
    }
    return byTier.getOrDefault(Tier.of(band), FALLBACK);
  }

  /**
   * Picks an educational prompt for the band's tier.
   *
   * @param band child's band
   * @param selector phrase selector
   * @param seed seed passed to the selector
   * @return prompt
   */
  public String educational(AgeBand band, PhraseSelector selector, String seed) {
    return Objects.requireNonNull(selector, "selector").select(educational.get(Tier.of(band)), seed);
  }

  /**
   * Builds the gentle STEM nudge used when an off-topic question has no answer yet.
   *
   * @param childName child's name; {@code null} or blank omits it
   * @return nudge text
   */
  public static String offTopicNudge(String childName) {
    String name = childName == null || childName.isBlank() ? "" : ", " + childName.trim();
    return "I can help with that" + name + "! Did you know there's fascinating science behind that? "
        + "Would you like to explore the STEM connections?";
  }

  private void suggest(SafetyCategory category, String young, String elementary, String older) {
    Map<Tier, String> byTier = new EnumMap<>(Tier.class);
    byTier.put(Tier.YOUNG, young);
    byTier.put(Tier.ELEMENTARY, elementary);
    byTier.put(Tier.OLDER, older);
    suggestions.put(category, byTier);
  }

  /** Reading tier sharing one set of phrases. */
  enum Tier {
    YOUNG,
    ELEMENTARY,
    OLDER;

    static Tier of(AgeBand band) {
      return switch (Objects.requireNonNull(band, "band")) {
        case TODDLER, PRESCHOOL, EARLY_ELEMENTARY -> YOUNG;
        case LATE_ELEMENTARY -> ELEMENTARY;
        case MIDDLE, HIGH, ADULT -> OLDER;
      };
    }
  }
}
