/**
 * <strong>Purpose:</strong> Ports defining the GUARDIAN pipeline contracts: stages, storage, metrics, time and
 * phrase selection.
 * <p><strong>Pipeline role:</strong> Application layer; infrastructure adapters and external collaborators implement
 * these interfaces.</p>
 * <p><strong>Concurrency:</strong> Storage and metrics ports must be thread-safe; stages are invoked with a
 * context confined to one turn.</p>
 * <p><strong>Security:</strong> Storage ports receive child text; excerpts are truncated before they get here.</p>
 *
 * @since 1.0.0
 */
package ca.gc.cra.guardian.application.port;
