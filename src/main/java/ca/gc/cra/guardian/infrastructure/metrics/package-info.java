/**
 * Metrics adapters bridging {@link ca.gc.cra.guardian.application.port.MetricsPort} to OpenTelemetry.
 * <p><strong>Concurrency:</strong> Instruments are cached and safe for concurrent updates.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code safety.*}, {@code pipeline.*}, {@code adapt.*},
 * {@code incident.*} and {@code parent.*} namespaces.</p>
 * <p><strong>Security:</strong> Only metric keys are exported; child text never becomes an attribute.</p>
 */
package ca.gc.cra.guardian.infrastructure.metrics;
