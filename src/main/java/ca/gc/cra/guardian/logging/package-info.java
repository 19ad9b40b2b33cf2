/**
 * <strong>Purpose:</strong> Logging helpers that tune verbosity and keep child text out of logs.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Security:</strong> Child input is truncated and names are redacted before reaching an appender.
 *
 * @since 1.0.0
 */
package ca.gc.cra.guardian.logging;
