package ca.gc.cra.guardian.application.port;

/**
 * <strong>What:</strong> Counters and histograms for safety verdicts, adaptation and stage timing.
 * <p><strong>Why:</strong> The engines count what they block and how long each stage takes without binding to a
 * vendor SDK; {@code OpenTelemetryMetricsAdapter} is the production implementation.</p>
 * <p><strong>Names:</strong> dotted, lower case, category keys appended as the last segment, for example
 * {@code safety.blocked.violence} or {@code pipeline.stage.age_adapter.latencyMillis}. Adapters may normalize
 * them further.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from every turn.</p>
 *
 * @since 1.0.0
 */
public interface MetricsPort {
  /**
   * Adds one to a counter such as {@code pipeline.blocked}.
   *
   * @param key metric name; never {@code null}
   */
  void increment(String key);

  /**
   * Records one histogram sample: milliseconds, words or a score percentage, depending on the metric.
   *
   * @param key metric name; never {@code null}
   * @param value sample
   */
  void observe(String key, long value);

  /** Discards everything; used for dry runs and by components built without metrics. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
