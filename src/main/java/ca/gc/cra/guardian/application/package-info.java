/**
 * Application layer of GUARDIAN.
 * <p><strong>Role:</strong> Hosts the safety engine, the age adapter and the pipeline orchestrator together with the
 * ports they depend on.</p>
 * <p><strong>Concurrency:</strong> Engines are shared across sessions; each turn owns its own context.</p>
 * <p><strong>Metrics:</strong> Emits namespaces {@code safety.*}, {@code adapt.*}, {@code pipeline.*},
 * {@code incident.*} and {@code parent.*}.</p>
 * <p><strong>Security:</strong> Any failure on the safety path is converted into an unsafe verdict.</p>
 */
package ca.gc.cra.guardian.application;
