/**
 * Clock adapters implementing {@link ca.gc.cra.guardian.application.port.ClockPort}.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 */
package ca.gc.cra.guardian.infrastructure.time;
