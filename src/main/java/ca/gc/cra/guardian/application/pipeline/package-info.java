/**
 * Turn orchestration: the safety gate, the age adaptation stage, the parent activity logger and the orchestrator
 * that runs them.
 * <p>The safety stage is the only stage that may halt a turn. Every other stage either returns the context or
 * raises; the orchestrator surfaces failures as
 * {@link ca.gc.cra.guardian.application.pipeline.StageExecutionException} and never returns a half-adapted
 * response.</p>
 * <p>Stage metrics are published through {@link ca.gc.cra.guardian.application.port.MetricsPort}; spans use the
 * global OpenTelemetry tracer unless one is injected.</p>
 *
 * @since 1.0.0
 */
package ca.gc.cra.guardian.application.pipeline;
