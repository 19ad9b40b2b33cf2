/**
 * Safety verdict types: categories, severities, issues, results and persisted incidents.
 * <p><strong>Role:</strong> Domain outputs of the safety engine consumed by the orchestrator, the incident store
 * and the parent dashboard.</p>
 * <p><strong>Concurrency:</strong> Records are immutable; safe to share across threads.</p>
 * <p><strong>Security:</strong> Incidents carry child input; the excerpt is capped at 500 characters.</p>
 *
 * @since 1.0.0
 */
package ca.gc.cra.guardian.domain.safety;
