/**
 * Content screening: normalization, the built-in pattern table, topic matching, redirects and counters.
 * <p>{@link ca.gc.cra.guardian.application.safety.SafetyEngine} is the entry point. It never throws for bad input
 * or internal failure; it fails closed instead.</p>
 *
 * @since 1.0.0
 */
package ca.gc.cra.guardian.application.safety;
