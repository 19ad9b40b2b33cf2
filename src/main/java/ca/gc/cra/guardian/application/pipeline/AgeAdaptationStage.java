package ca.gc.cra.guardian.application.pipeline;

import ca.gc.cra.guardian.application.adapt.AgeAdapter;
import ca.gc.cra.guardian.application.adapt.ReadabilityAnalyzer;
import ca.gc.cra.guardian.application.port.MetricsPort;
import ca.gc.cra.guardian.application.port.PipelineStage;
import ca.gc.cra.guardian.config.PipelineConfig;
import ca.gc.cra.guardian.domain.age.AgeBand;
import ca.gc.cra.guardian.domain.age.AgeClassifier;
import ca.gc.cra.guardian.domain.pipeline.PipelineContext;
import java.util.Objects;

/**
 * Pipeline stage ({@code age_adapter}) that rewrites the model response for the child's band.
 *
 * <p>Refuses to run on a context that carries safety flags; the orchestrator never routes one here, so
 * reaching that branch is a wiring error.</p>
 *
 * @since 1.0.0
 */
public final class AgeAdaptationStage implements PipelineStage {
  private final AgeAdapter adapter;
  private final MetricsPort metrics;

  /**
   * Creates the stage.
   *
   * @param adapter age adapter
   * @param metrics metrics sink
   */
  public AgeAdaptationStage(AgeAdapter adapter, MetricsPort metrics) {
    this.adapter = Objects.requireNonNull(adapter, "adapter");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public String name() {
    return PipelineConfig.AGE_ADAPTER;
  }

  @Override
  public PipelineContext apply(PipelineContext context) {
    if (!context.safetyFlags().isEmpty()) {
      throw new IllegalStateException("age adaptation reached flagged content " + context.safetyFlags());
    }
    AgeBand band = AgeClassifier.classify(context.childAge());
    context.putStageDetail(name(), "band", band.key());
    String before = context.responseText();
    if (before.isBlank()) {
      context.putStageDetail(name(), "adapted", false);
      return context;
    }

    ReadabilityAnalyzer readability = adapter.readability();
    String after = adapter.adapt(before, band, context.childName(), context.inputText());
    context.setResponseText(after);

    int words = ReadabilityAnalyzer.countWords(after);
    context.putStageDetail(name(), "adapted", true);
    context.putStageDetail(name(), "wordsBefore", ReadabilityAnalyzer.countWords(before));
    context.putStageDetail(name(), "wordsAfter", words);
    context.putStageDetail(name(), "readingGradeBefore", round(readability.gradeLevel(before)));
    context.putStageDetail(name(), "readingGradeAfter", round(readability.gradeLevel(after)));
    context.putMetadata("adaptationApplied", true);
    metrics.increment("adapt.applied");
    metrics.observe("adapt.words", words);
    return context;
  }

  private static double round(double grade) {
    return Math.round(grade * 10.0) / 10.0;
  }
}
