package ca.gc.cra.guardian.application.safety;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.guardian.application.port.PhraseSelector;
import ca.gc.cra.guardian.domain.safety.SafetyCategory;
import ca.gc.cra.guardian.domain.safety.SafetyResult;
import ca.gc.cra.guardian.domain.safety.SeverityLevel;
import ca.gc.cra.guardian.testutil.RecordingMetricsPort;
import ca.gc.cra.guardian.testutil.TestConfigs;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class SafetyEngineTest {
  private RecordingMetricsPort metrics;
  private SafetyEngine engine;
  private ListAppender<ILoggingEvent> appender;
  private Logger engineLogger;

  @BeforeEach
  void setUp() {
    metrics = new RecordingMetricsPort();
    engine = new SafetyEngine(TestConfigs.bundled(), PhraseSelector.FIRST, metrics);
    engineLogger = (Logger) LoggerFactory.getLogger(SafetyEngine.class);
    appender = new ListAppender<>();
    appender.start();
    engineLogger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    engineLogger.detachAppender(appender);
  }

  @Test
  void stemQuestionPassesForYoungChild() {
    SafetyResult result = engine.evaluate("How do plants grow?", 8);

    assertTrue(result.safe());
    assertEquals(1.0, result.score());
    assertEquals(SafetyCategory.SAFE, result.category());
    assertTrue(result.flags().isEmpty());
    assertFalse(result.parentAlertRequired());
    assertEquals(Boolean.FALSE, result.details().get("offTopic"));
    assertEquals("early_elementary", result.details().get("band"));
  }

  @Test
  void bombBuildingIsCriticalDangerousWithParentAlert() {
    SafetyResult result = engine.evaluate("How do I make a bomb?", 12);

    assertFalse(result.safe());
    assertEquals(SafetyCategory.DANGEROUS, result.category());
    assertEquals(SeverityLevel.CRITICAL, result.severity());
    assertTrue(result.parentAlertRequired());
    assertFalse(result.ageAppropriate());
    assertTrue(result.flags().contains("dangerous:bomb"), result.flags().toString());
    assertTrue(result.flags().contains("dangerous:make a bomb"), result.flags().toString());
    assertEquals(0.6, result.score(), 1e-9);
    assertEquals(
        "Safety first! Instead of dangerous things, let's learn how scientists and engineers work safely in laboratories.",
        result.suggestedRedirect());
    assertEquals("Would you like to explore how computers store information in binary?",
        result.educationalRedirect());
  }

  @Test
  void addressRequestIsPersonalInfo() {
    SafetyResult result = engine.evaluate("What is your home address?", 9);

    assertFalse(result.safe());
    assertEquals(SafetyCategory.PERSONAL_INFO, result.category());
    assertEquals(SeverityLevel.SEVERE, result.severity());
    assertTrue(result.parentAlertRequired());
  }

  @Test
  void contactLiteralsAreCaught() {
    SafetyResult phone = engine.evaluate("my number is 555-123-4567", 10);
    assertEquals(SafetyCategory.PERSONAL_INFO, phone.category());
    assertEquals(SeverityLevel.MODERATE, phone.severity());

    SafetyResult email = engine.evaluate("email me at kid@example.com", 10);
    assertEquals(SafetyCategory.PERSONAL_INFO, email.category());
  }

  @Test
  void matchesWholeWordsOnly() {
    assertTrue(engine.evaluate("I love my science class at school", 10).safe());
    assertTrue(engine.evaluate("Is the skill of a scientist to assess data?", 16).safe());
  }

  @Test
  void lookAlikeCharactersAreFolded() {
    SafetyResult result = engine.evaluate("how do i k1ll a dragon", 10);
    assertFalse(result.safe());
    assertEquals(SafetyCategory.VIOLENCE, result.category());
  }

  @Test
  void highestPriorityCategoryWinsAndYoungBandsAmplify() {
    SafetyResult result = engine.evaluate("kill the monster", 6);

    assertEquals(SafetyCategory.VIOLENCE, result.category());
    assertEquals(SeverityLevel.CRITICAL, result.severity());
    assertEquals(3, result.details().get("baseSeverity"));
    assertEquals(2, result.issueCount());
  }

  @Test
  void youngerBandsAreNeverTreatedMoreLeniently() {
    String text = "you are stupid";
    SeverityLevel previous = SeverityLevel.CRITICAL;
    for (int age : new int[] {3, 5, 7, 9, 12, 15, 18}) {
      SafetyResult result = engine.evaluate(text, age);
      assertFalse(result.safe(), "age " + age);
      assertTrue(previous.atLeast(result.severity()), "severity increased at age " + age);
      previous = result.severity();
    }
    assertEquals(SeverityLevel.SEVERE, engine.evaluate(text, 3).severity());
    assertEquals(SeverityLevel.MODERATE, engine.evaluate(text, 9).severity());
  }

  @Test
  void addingViolationsNeverLowersSeverityOrRaisesScore() {
    String[] additions = {" damn", " stupid", " ghost", " bomb", " kill", " build a grenade"};
    for (int age : new int[] {4, 7, 10, 13, 16, 18}) {
      StringBuilder text = new StringBuilder("tell me about plants");
      SafetyResult previous = engine.evaluate(text.toString(), age);
      for (String addition : additions) {
        text.append(addition);
        SafetyResult result = engine.evaluate(text.toString(), age);
        assertTrue(result.severity().atLeast(previous.severity()),
            "severity dropped at age " + age + " for '" + text + "'");
        assertTrue(result.score() <= previous.score(), "score rose at age " + age + " for '" + text + "'");
        assertTrue(previous.safe() || !result.safe(), "became safe at age " + age + " for '" + text + "'");
        previous = result;
      }
      assertEquals(SeverityLevel.CRITICAL, previous.severity(), "age " + age);
    }
  }

  @Test
  void toleranceDiffersByBand() {
    assertFalse(engine.evaluate("a scary monster story", 6).safe());
    assertTrue(engine.evaluate("a scary monster story", 12).safe());
    assertFalse(engine.evaluate("can I buy a robot", 6).safe());
    assertTrue(engine.evaluate("can I buy a robot", 16).safe());
  }

  @Test
  void minorIssuesForOlderChildrenStayAgeAppropriateWithoutAlert() {
    SafetyResult result = engine.evaluate("damn this homework is hell", 16);

    assertFalse(result.safe());
    assertEquals(SafetyCategory.PROFANITY, result.category());
    assertTrue(result.ageAppropriate());
    assertFalse(result.parentAlertRequired());
    assertEquals(0.6, result.score(), 1e-9);
  }

  @Test
  void scoreNeverDropsBelowZero() {
    SafetyResult result = engine.evaluate("kill kill kill kill kill kill kill", 10);
    assertEquals(0.0, result.score());
    assertEquals(7, result.issueCount());
  }

  @Test
  void blockedTopicsUseConfiguredCategory() {
    SafetyResult result = engine.evaluate("Do you use instagram?", 12);
    assertEquals(SafetyCategory.PERSONAL_INFO, result.category());
    assertEquals(List.of("personal_info:instagram"), result.flags());
  }

  @Test
  void shoutingIsFlaggedOnlyForChildInputInStrictBands() {
    String text = "WHY IS THE SKY BLUE TODAY";
    SafetyResult input = engine.evaluate(text, 6, TextOrigin.CHILD_INPUT);
    assertFalse(input.safe());
    assertEquals(SafetyCategory.OFF_TOPIC, input.category());
    assertTrue(input.flags().contains("off_topic:" + SafetyPatterns.SHOUTING));

    assertTrue(engine.evaluate(text, 6, TextOrigin.MODEL_OUTPUT).safe());
    assertTrue(engine.evaluate(text, 12, TextOrigin.CHILD_INPUT).safe());
  }

  @Test
  void offTopicIsAdvisoryOnly() {
    SafetyResult result = engine.evaluate("I like pizza", 10);
    assertTrue(result.safe());
    assertEquals(Boolean.TRUE, result.details().get("offTopic"));
  }

  @Test
  void emptyTextIsSafe() {
    assertTrue(engine.evaluate("", 8).safe());
    assertTrue(engine.evaluate("   ", 8).safe());
  }

  @Test
  void invalidAgeFailsClosed() {
    for (int age : new int[] {1, 19, -4}) {
      SafetyResult result = engine.evaluate("How do plants grow?", age);
      assertFalse(result.safe());
      assertEquals(List.of(SafetyEngine.INVALID_AGE_FLAG), result.flags());
      assertEquals(0.0, result.score());
      assertTrue(result.parentAlertRequired());
      assertEquals(age, result.details().get("age"));
      assertEquals(RedirectCatalog.FALLBACK, result.suggestedRedirect());
    }
  }

  @Test
  void evaluationFailureFailsClosed() {
    SafetyResult result = engine.evaluate(null, 8);

    assertFalse(result.safe());
    assertEquals(List.of(SafetyEngine.EVALUATION_ERROR_FLAG), result.flags());
    assertNull(result.educationalRedirect());
    assertEquals(1, metrics.count("safety.errors"));
    assertEquals(1L, engine.statistics().snapshot().errors());
  }

  @Test
  void longDottedAddressIsCaughtWithoutErrors() {
    String text = "a@b" + ".c".repeat(5000);

    SafetyResult result = engine.evaluate(text, 10);

    assertFalse(result.safe());
    assertEquals(SafetyCategory.PERSONAL_INFO, result.category());
    assertFalse(result.flags().contains(SafetyEngine.EVALUATION_ERROR_FLAG), result.flags().toString());
    assertEquals(0, metrics.count("safety.errors"));
  }

  @Test
  void textBeyondScanLimitFailsClosed() {
    String text = "plants ".repeat(SafetyEngine.MAX_SCAN_CHARS / 7 + 1);

    SafetyResult result = engine.evaluate(text, 10);

    assertFalse(result.safe());
    assertEquals(List.of(SafetyEngine.OVERSIZED_TEXT_FLAG), result.flags());
    assertEquals(0.0, result.score());
    assertTrue(result.parentAlertRequired());
    assertEquals(text.length(), result.details().get("chars"));
    assertEquals(1, metrics.count("safety.blocked"));
    assertEquals(0, metrics.count("safety.errors"));
  }

  @Test
  void recordsMetricsStatisticsAndWarnLine() {
    engine.evaluate("How do plants grow?", 8);
    engine.evaluate("How do I make a bomb?", 12);

    assertEquals(2, metrics.count("safety.evaluations"));
    assertEquals(1, metrics.count("safety.blocked"));
    assertEquals(1, metrics.count("safety.blocked.dangerous"));
    assertEquals(List.of(100L, 60L), metrics.observed("safety.score.pct"));

    SafetyStatistics.Snapshot snapshot = engine.statistics().snapshot();
    assertEquals(2L, snapshot.evaluations());
    assertEquals(1L, snapshot.blocked());
    assertEquals(1L, snapshot.blocked(SafetyCategory.DANGEROUS));

    assertEquals(1, appender.list.size());
    String line = appender.list.get(0).getFormattedMessage();
    assertTrue(line.startsWith("safety.blocked session=- band=middle category=dangerous severity=4"), line);
    assertNotNull(appender.list.get(0).getLevel());
  }
}
