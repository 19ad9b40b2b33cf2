package ca.gc.cra.guardian.domain.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one orchestrated turn.
 *
 * @param responseText text returned to the child
 * @param stageMetadata per-stage diagnostics keyed by stage name, in execution order
 * @param status terminal status of the turn
 * @since 1.0.0
 */
public record PipelineOutcome(
    String responseText,
    Map<String, Map<String, Object>> stageMetadata,
    PipelineStatus status) {

  /**
   * Copies the metadata while preserving stage order.
   */
  public PipelineOutcome {
    responseText = responseText == null ? "" : responseText;
    status = Objects.requireNonNull(status, "status");
    Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
    if (stageMetadata != null) {
      stageMetadata.forEach((stage, values) -> copy.put(stage, Map.copyOf(values)));
    }
    stageMetadata = Collections.unmodifiableMap(copy);
  }

  /**
   * Indicates whether the safety stage vetoed the turn.
   *
   * @return {@code true} when {@link #status()} is {@link PipelineStatus#SAFETY_BLOCKED}
   */
  public boolean blocked() {
    return status == PipelineStatus.SAFETY_BLOCKED;
  }
}
