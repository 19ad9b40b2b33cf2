package ca.gc.cra.guardian.testutil;

import ca.gc.cra.guardian.application.port.ClockPort;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Clock pinned to a settable instant.
 */
public final class FixedClock implements ClockPort {
  private final AtomicLong millis;

  public FixedClock(Instant start) {
    this.millis = new AtomicLong(start.toEpochMilli());
  }

  @Override
  public long nowMillis() {
    return millis.get();
  }

  public void advance(Duration duration) {
    millis.addAndGet(duration.toMillis());
  }
}
