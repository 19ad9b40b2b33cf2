/**
 * Infrastructure adapters implementing GUARDIAN ports: incident and activity persistence, OpenTelemetry metrics
 * and the system clock.
 * <p><strong>Role:</strong> Adapter layer in the hexagonal architecture; nothing here holds safety policy.</p>
 * <p><strong>Security:</strong> Persisted records carry truncated input excerpts only; model responses are never
 * written.</p>
 */
package ca.gc.cra.guardian.infrastructure;
