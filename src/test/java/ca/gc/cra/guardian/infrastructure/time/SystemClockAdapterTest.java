package ca.gc.cra.guardian.infrastructure.time;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

class SystemClockAdapterTest {

  @Test
  void reportsInstantOfUnderlyingClockAtMillisecondPrecision() {
    Instant fixed = Instant.parse("2026-04-02T08:00:00.123456Z");
    SystemClockAdapter adapter = new SystemClockAdapter(Clock.fixed(fixed, ZoneId.of("America/Toronto")));

    assertEquals(fixed.toEpochMilli(), adapter.nowMillis());
    assertEquals(Instant.parse("2026-04-02T08:00:00.123Z"), adapter.now());
  }

  @Test
  void defaultAdapterFollowsWallClock() {
    long before = System.currentTimeMillis();
    long now = new SystemClockAdapter().nowMillis();
    assertTrue(now >= before);
  }
}
