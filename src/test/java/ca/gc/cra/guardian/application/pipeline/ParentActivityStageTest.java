package ca.gc.cra.guardian.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.guardian.application.port.ActivityLogPort;
import ca.gc.cra.guardian.config.ParentAlertPolicy;
import ca.gc.cra.guardian.domain.pipeline.ActivityRecord;
import ca.gc.cra.guardian.domain.pipeline.PipelineContext;
import ca.gc.cra.guardian.infrastructure.persistence.InMemoryActivityLogAdapter;
import ca.gc.cra.guardian.testutil.FixedClock;
import ca.gc.cra.guardian.testutil.RecordingMetricsPort;
import ca.gc.cra.guardian.testutil.TestConfigs;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class ParentActivityStageTest {
  private static final Instant NOW = Instant.parse("2026-04-02T08:00:00Z");

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final InMemoryActivityLogAdapter log = new InMemoryActivityLogAdapter();
  private final ParentAlertPolicy policy = TestConfigs.bundled().parentAlerts();

  @Test
  void keywordsRaiseAlertsAndTurnIsLogged() throws Exception {
    PipelineContext context = PipelineContext.Builder.create("s-1", "child-3", 9, "I feel lonely and scared")
        .responseText("It is okay to feel that way.")
        .build();

    PipelineContext result = stage(log).apply(context);

    assertSame(context, result);
    ActivityRecord record = log.snapshot().get(0);
    assertEquals(List.of("keyword_lonely", "keyword_scared"), record.alerts());
    assertEquals("late_elementary", record.ageBand());
    assertEquals("child-3", record.childId());
    assertEquals(7, record.responseWords());
    assertEquals(NOW, record.timestamp());
    assertEquals(2, metrics.count("parent.alerts"));
    assertEquals(true, context.stageDetails("parent_logger").get("alertsTriggered"));
  }

  @Test
  void multiWordKeywordsMatch() throws Exception {
    PipelineContext context = PipelineContext.Builder.create("s-2", "child-3", 12, "Sometimes I want to run away")
        .build();

    stage(log).apply(context);

    assertEquals(List.of("keyword_run away"), log.snapshot().get(0).alerts());
  }

  @Test
  void longSessionsRaiseExtendedSessionAlert() throws Exception {
    long threshold = policy.extendedSessionSeconds();
    PipelineContext atLimit = PipelineContext.Builder.create("s-3", "child-3", 12, "What is a fraction?")
        .metadata(ParentActivityStage.SESSION_DURATION_KEY, threshold)
        .build();
    PipelineContext past = PipelineContext.Builder.create("s-3", "child-3", 12, "What is a fraction?")
        .metadata(ParentActivityStage.SESSION_DURATION_KEY, threshold + 1)
        .build();

    stage(log).apply(atLimit);
    stage(log).apply(past);

    assertTrue(log.snapshot().get(0).alerts().isEmpty());
    assertEquals(List.of(ParentActivityStage.EXTENDED_SESSION_ALERT), log.snapshot().get(1).alerts());
    assertEquals(false, atLimit.stageDetails("parent_logger").get("alertsTriggered"));
  }

  @Test
  void offTopicMarkerIsCarriedIntoTheRecord() throws Exception {
    PipelineContext context = PipelineContext.Builder.create("s-4", "child-3", 10, "I like pizza")
        .metadata("offTopic", true)
        .build();

    stage(log).apply(context);

    assertTrue(log.snapshot().get(0).offTopic());
  }

  @Test
  void activityLogFailurePropagates() {
    ActivityLogPort failing = entry -> {
      throw new IOException("read-only filesystem");
    };
    PipelineContext context = PipelineContext.Builder.create("s-5", "child-3", 10, "Hi").build();

    assertThrows(IOException.class, () -> stage(failing).apply(context));
  }

  private ParentActivityStage stage(ActivityLogPort activityLog) {
    return new ParentActivityStage(policy, activityLog, metrics, new FixedClock(NOW));
  }
}
