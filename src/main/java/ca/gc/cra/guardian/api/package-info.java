/**
 * Command-line entry points: {@code evaluate}, {@code incidents} and {@code profiles}.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses {@code key=value} arguments, loads the
 * configuration and invokes the pipeline.</p>
 * <p><strong>Security:</strong> Child input and names are only logged truncated or redacted.</p>
 */
package ca.gc.cra.guardian.api;
