/**
 * <strong>Purpose:</strong> Domain model for the GUARDIAN safety pipeline: age partition, safety verdicts and
 * per-turn pipeline state.
 * <p><strong>Pipeline role:</strong> Pure types with no I/O; shared by the application and infrastructure layers.</p>
 * <p><strong>Concurrency:</strong> Immutable except for the per-turn pipeline context.</p>
 *
 * @since 1.0.0
 */
package ca.gc.cra.guardian.domain;
