package ca.gc.cra.guardian.application.pipeline;

import java.util.Objects;

/**
 * Raised by {@link PipelineOrchestrator#process} when a stage after the safety gate fails. The turn's partial
 * response is discarded; the cause is the stage's own exception, unchanged.
 *
 * @since 1.0.0
 */
public final class StageExecutionException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String stageName;

  /**
   * Creates an exception for a failed stage.
   *
   * @param stageName name of the stage that raised
   * @param cause exception raised by the stage
   */
  public StageExecutionException(String stageName, Throwable cause) {
    super("Pipeline stage '" + stageName + "' failed: " + (cause == null ? "unknown" : cause.getMessage()), cause);
    this.stageName = Objects.requireNonNull(stageName, "stageName");
  }

  /**
   * Returns the failing stage's name.
   *
   * @return stage name
   */
  public String stageName() {
    return stageName;
  }
}
