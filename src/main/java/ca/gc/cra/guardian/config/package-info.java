/**
 * Configuration model, YAML loading and the composition root.
 * <p><strong>Role:</strong> Turns {@code guardian.yaml} into an immutable {@link ca.gc.cra.guardian.config.AppConfig}
 * and wires it into a {@link ca.gc.cra.guardian.application.pipeline.PipelineOrchestrator}.</p>
 * <p><strong>Failure model:</strong> Every structural problem surfaces as a checked
 * {@link ca.gc.cra.guardian.config.ConfigurationException}; safety tables are never defaulted.</p>
 * <p><strong>Concurrency:</strong> Loading happens once at startup; the resulting records are immutable.</p>
 */
package ca.gc.cra.guardian.config;
