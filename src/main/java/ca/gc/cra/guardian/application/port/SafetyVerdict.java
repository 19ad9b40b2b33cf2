package ca.gc.cra.guardian.application.port;

import ca.gc.cra.guardian.domain.pipeline.PipelineContext;
import ca.gc.cra.guardian.domain.safety.SafetyResult;
import java.util.Objects;

/**
 * Verdict returned by a {@link SafetyStage}.
 *
 * @param safe whether the turn may continue
 * @param result evaluation behind the verdict
 * @param context context to continue with
 * @since 1.0.0
 */
public record SafetyVerdict(boolean safe, SafetyResult result, PipelineContext context) {

  /**
   * Validates required fields.
   */
  public SafetyVerdict {
    result = Objects.requireNonNull(result, "result");
    context = Objects.requireNonNull(context, "context");
  }

  /**
   * Creates a verdict mirroring {@code result.safe()}.
   *
   * @param result evaluation
   * @param context context to continue with
   * @return verdict
   */
  public static SafetyVerdict of(SafetyResult result, PipelineContext context) {
    return new SafetyVerdict(result.safe(), result, context);
  }
}
