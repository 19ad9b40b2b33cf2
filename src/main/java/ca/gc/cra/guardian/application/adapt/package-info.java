/**
 * Age adaptation: vocabulary substitution, sentence restructuring, length limits, engagement and a final
 * redaction scrub.
 * <p>Every step is deterministic; the only stylistic choice (the follow-up question) goes through an injected
 * {@link ca.gc.cra.guardian.application.port.PhraseSelector}. Adapting an adapted text returns it unchanged.</p>
 * <p>The adapter has no safety authority and must only receive text the safety engine passed.</p>
 *
 * @since 1.0.0
 */
package ca.gc.cra.guardian.application.adapt;
