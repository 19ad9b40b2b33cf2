/**
 * Age partition and per-band profiles.
 * <p><strong>Role:</strong> Domain layer foundation; every safety and adaptation lookup is keyed by {@link
 * ca.gc.cra.guardian.domain.age.AgeBand}.</p>
 * <p><strong>Concurrency:</strong> Enums and records are immutable; safe to share across threads.</p>
 * <p><strong>Security:</strong> Out-of-range ages raise {@link ca.gc.cra.guardian.domain.age.InvalidAgeException};
 * nothing is clamped.</p>
 *
 * @since 1.0.0
 */
package ca.gc.cra.guardian.domain.age;
