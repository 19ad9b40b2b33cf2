package ca.gc.cra.guardian.application.port;

import ca.gc.cra.guardian.domain.pipeline.PipelineContext;

/**
 * <strong>What:</strong> Contract for every non-safety stage (age adaptation, parent logging, external
 * collaborators such as tutoring or progress tracking).
 * <p><strong>Rules:</strong>
 * <ul>
 *   <li>Stages may rewrite {@link PipelineContext#responseText()} and add metadata.</li>
 *   <li>Stages must not alter the input text and may only append safety flags.</li>
 *   <li>Failures are raised, never swallowed; the orchestrator marks the session as errored.</li>
 *   <li>No reference to the context may be kept after {@link #apply(PipelineContext)} returns.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public interface PipelineStage {
  /**
   * Returns the name the stage is registered under in the pipeline order.
   *
   * @return stage name, e.g. {@code age_adapter}
   */
  String name();

  /**
   * Transforms the context.
   *
   * @param context turn context; exclusively owned by the caller
   * @return the context to pass to the next stage (normally the same instance)
   * @throws Exception when the stage cannot complete
   */
  PipelineContext apply(PipelineContext context) throws Exception;
}
