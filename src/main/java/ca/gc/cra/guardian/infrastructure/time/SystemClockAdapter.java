package ca.gc.cra.guardian.infrastructure.time;

import ca.gc.cra.guardian.application.port.ClockPort;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * {@link ClockPort} over a {@link java.time.Clock}; stamps incidents, activity records and turns received by
 * the command line.
 *
 * <p>Incident and activity files are written in UTC regardless of the device's zone, so the adapter only ever
 * exposes instants.</p>
 *
 * @since 1.0.0
 */
public final class SystemClockAdapter implements ClockPort {
  private final Clock clock;

  /** Creates an adapter over the UTC system clock. */
  public SystemClockAdapter() {
    this(Clock.systemUTC());
  }

  /**
   * Creates an adapter over the given clock, typically {@link Clock#fixed} in tests.
   *
   * @param clock source of time
   */
  public SystemClockAdapter(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public long nowMillis() {
    return clock.millis();
  }

  @Override
  public Instant now() {
    return Instant.ofEpochMilli(clock.millis());
  }
}
