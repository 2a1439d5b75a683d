package com.skyrelay.bridge.link;

import com.skyrelay.bridge.model.TelemetryUpdate;
import java.io.InterruptedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Random;

/**
 * Synthetic vehicle for dashboard development without a flight controller.
 *
 * <p>Performs a slow random walk around a fixed start point, emitting one complete update per
 * interval.
 */
class SimulatedTelemetryLink implements TelemetryLink {
  static final double START_LAT = 33.7490;
  static final double START_LON = -84.3880;
  private static final long BATTERY_CYCLE_SECONDS = 600L;

  private final Clock clock;
  private final Duration interval;
  private final Random random;
  private double lat = START_LAT;
  private double lon = START_LON;
  private double alt = 0.0;
  private double yaw = 0.0;
  private volatile boolean closed;

  SimulatedTelemetryLink(Clock clock, Duration interval, Random random) {
    this.clock = clock;
    this.interval = interval;
    this.random = random;
  }

  @Override
  public List<TelemetryUpdate> read() throws InterruptedIOException {
    if (closed) {
      throw new InterruptedIOException("simulated link closed");
    }
    try {
      Thread.sleep(interval.toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("simulated link interrupted");
    }
    return List.of(next());
  }

  TelemetryUpdate next() {
    lat += uniform(-0.00005, 0.00005);
    lon += uniform(-0.00005, 0.00005);
    alt = Math.max(0.0, alt + uniform(-0.5, 0.5));
    yaw = ((yaw + uniform(-2.0, 2.0)) % 360.0 + 360.0) % 360.0;
    long cycle = clock.instant().getEpochSecond() % BATTERY_CYCLE_SECONDS;
    double voltage = Math.round(uniform(11.8, 12.6) * 100.0) / 100.0;
    double current = Math.round(uniform(7.0, 15.0) * 100.0) / 100.0;
    return TelemetryUpdate.builder()
        .position(lat, lon, alt)
        .attitude(uniform(-5.0, 5.0), uniform(-5.0, 5.0), yaw)
        .battery((int) (90 - cycle / 10))
        .voltage(voltage)
        .current(current)
        .fixType(6)
        .satellites(10 + random.nextInt(6))
        .armed(true)
        .mode("GUIDED")
        .build();
  }

  private double uniform(double min, double max) {
    return min + (max - min) * random.nextDouble();
  }

  @Override
  public void close() {
    closed = true;
  }
}
