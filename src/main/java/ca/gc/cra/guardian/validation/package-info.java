/**
 * Input validation helpers shared by configuration loading and the CLI.
 * <p><strong>Concurrency:</strong> Stateless; thread-safe.</p>
 * <p><strong>Security:</strong> Rejects control characters before values reach file names or log lines.</p>
 *
 * @since 1.0.0
 */
package ca.gc.cra.guardian.validation;
