package ca.gc.cra.guardian.application.port;

import ca.gc.cra.guardian.domain.pipeline.PipelineContext;

/**
 * Contract for the single stage permitted to halt the pipeline.
 *
 * <p>An exception thrown from {@link #inspect(PipelineContext)} is treated by the orchestrator as an unsafe
 * verdict.</p>
 *
 * @since 1.0.0
 */
public interface SafetyStage {
  /**
   * Returns the name the stage is registered under in the pipeline order.
   *
   * @return stage name, e.g. {@code content_filter}
   */
  String name();

  /**
   * Screens the turn.
   *
   * @param context turn context; exclusively owned by the caller
   * @return verdict together with the (possibly updated) context
   * @throws Exception when screening fails; callers fail closed
   */
  SafetyVerdict inspect(PipelineContext context) throws Exception;
}
