package dev.podflow.testutil;

import dev.podflow.application.port.ClockPort;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/** Manually advanced clock. */
public final class FixedClock implements ClockPort {
  private final AtomicLong millis;

  public FixedClock(Instant instant) {
    this.millis = new AtomicLong(instant.toEpochMilli());
  }

  public static FixedClock at(String isoInstant) {
    return new FixedClock(Instant.parse(isoInstant));
  }

  @Override
  public long nowMillis() {
    return millis.get();
  }

  public void advance(long deltaMillis) {
    millis.addAndGet(deltaMillis);
  }
}
