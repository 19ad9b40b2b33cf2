package ca.gc.cra.guardian.api;

/**
 * Process exit codes of the {@code guardian} command.
 *
 * <p>A blocked turn is a normal result and exits {@link #SUCCESS}; scripts read the {@code status:} line to
 * tell blocked from completed turns.</p>
 *
 * @since 1.0.0
 */
public enum ExitCode {
  SUCCESS(0),
  /** Unknown command, missing {@code text=} or {@code age=}, malformed timestamp or identifier. */
  INVALID_ARGS(2),
  /** {@code incidents.ndjson} or {@code activity.ndjson} could not be opened, read or written. */
  IO_ERROR(3),
  /** {@code guardian.yaml} (or the file passed as {@code config=}) is missing or invalid. */
  CONFIG_ERROR(4),
  /** A pipeline stage failed; the friendly error response was printed instead of a partial one. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /** @return value handed to {@link System#exit(int)} */
  public int code() {
    return code;
  }
}
