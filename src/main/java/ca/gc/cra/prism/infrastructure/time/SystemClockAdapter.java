package ca.gc.cra.prism.infrastructure.time;

import ca.gc.cra.prism.application.port.ClockPort;

/**
 * Wall-clock {@link ClockPort} used in production wiring.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
