/**
 * Per-turn pipeline state: the mutable context, per-session status and the turn outcome.
 * <p><strong>Role:</strong> Domain types exchanged between the orchestrator and its stages.</p>
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.guardian.domain.pipeline.PipelineContext} is confined to one
 * turn; outcomes and activity records are immutable.</p>
 *
 * @since 1.0.0
 */
package ca.gc.cra.guardian.domain.pipeline;
