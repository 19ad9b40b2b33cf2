package ca.gc.cra.guardian.domain.pipeline;

/**
 * Per-session pipeline state.
 *
 * <pre>
 * IDLE -> PROCESSING -> COMPLETED | SAFETY_BLOCKED | ERROR
 * </pre>
 *
 * @since 1.0.0
 */
public enum PipelineStatus {
  /** No turn has run, or the session was cleaned up. */
  IDLE,
  /** A turn is executing. */
  PROCESSING,
  /** Every configured stage ran. */
  COMPLETED,
  /** A stage raised; the turn's partial response was discarded. */
  ERROR,
  /** The safety stage vetoed the turn; the redirect became the response. */
  SAFETY_BLOCKED
}
