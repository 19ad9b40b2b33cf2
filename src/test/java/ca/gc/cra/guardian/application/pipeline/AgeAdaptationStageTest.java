package ca.gc.cra.guardian.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.guardian.application.adapt.AgeAdapter;
import ca.gc.cra.guardian.application.port.PhraseSelector;
import ca.gc.cra.guardian.domain.pipeline.PipelineContext;
import ca.gc.cra.guardian.testutil.RecordingMetricsPort;
import ca.gc.cra.guardian.testutil.TestConfigs;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AgeAdaptationStageTest {
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final AgeAdaptationStage stage =
      new AgeAdaptationStage(new AgeAdapter(TestConfigs.bundled(), PhraseSelector.FIRST), metrics);

  @Test
  void rewritesResponseForBand() {
    PipelineContext context = PipelineContext.Builder.create("s-1", "child-1", 4, "Why do apples fall?")
        .childName("Ava")
        .responseText("Gravity pulls the apple down.")
        .build();

    stage.apply(context);

    assertEquals("Hi Ava! Earth's pull pulls the apple down. What do you think about that?",
        context.responseText());
    Map<String, Object> details = context.stageDetails("age_adapter");
    assertEquals("toddler", details.get("band"));
    assertEquals(true, details.get("adapted"));
    assertEquals(5, details.get("wordsBefore"));
    assertEquals(true, context.metadataValue("adaptationApplied").orElseThrow());
    assertEquals(1, metrics.count("adapt.applied"));
  }

  @Test
  void blankResponseIsLeftAlone() {
    PipelineContext context = PipelineContext.Builder.create("s-2", "child-1", 12, "Hello").build();

    stage.apply(context);

    assertEquals("", context.responseText());
    assertEquals(false, context.stageDetails("age_adapter").get("adapted"));
    assertTrue(metrics.observed("adapt.words").isEmpty());
  }

  @Test
  void refusesFlaggedContent() {
    PipelineContext context = PipelineContext.Builder.create("s-3", "child-1", 12, "Hello")
        .responseText("Anything")
        .build();
    context.addSafetyFlag("violence:kill");

    assertThrows(IllegalStateException.class, () -> stage.apply(context));
  }
}
