package com.skyrelay.bridge.link;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.skyrelay.bridge.MutableClock;
import com.skyrelay.bridge.model.TelemetryUpdate;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class SimulatedTelemetryLinkTest {

  @Test
  void next_producesCompleteUpdateNearStartPoint() {
    MutableClock clock = new MutableClock(Instant.ofEpochSecond(1_800_000_000L));
    SimulatedTelemetryLink link = new SimulatedTelemetryLink(clock, Duration.ofMillis(1), new Random(7));

    TelemetryUpdate update = link.next();

    assertEquals(SimulatedTelemetryLink.START_LAT, update.lat(), 0.001);
    assertEquals(SimulatedTelemetryLink.START_LON, update.lon(), 0.001);
    assertTrue(update.alt() >= 0.0);
    assertTrue(update.satellites() >= 10 && update.satellites() <= 15);
    assertEquals(6, update.fixType());
    assertEquals("GUIDED", update.mode());
    assertTrue(update.armed());
    assertFalse(update.isEmpty());
  }

  @Test
  void next_batteryDrainsOverTenMinuteCycle() {
    MutableClock clock = new MutableClock(Instant.ofEpochSecond(600L * 3_000_000L));
    SimulatedTelemetryLink link = new SimulatedTelemetryLink(clock, Duration.ofMillis(1), new Random(7));

    assertEquals(90, link.next().battery());
    clock.advance(Duration.ofSeconds(300));
    assertEquals(60, link.next().battery());
  }

  @Test
  void read_returnsOneUpdatePerInterval() throws Exception {
    SimulatedTelemetryLink link =
        new SimulatedTelemetryLink(new MutableClock(Instant.EPOCH), Duration.ofMillis(1), new Random(1));

    List<TelemetryUpdate> updates = link.read();

    assertEquals(1, updates.size());
  }

  @Test
  void read_afterCloseFails() {
    SimulatedTelemetryLink link =
        new SimulatedTelemetryLink(new MutableClock(Instant.EPOCH), Duration.ofMillis(1), new Random(1));

    link.close();

    assertThrows(InterruptedIOException.class, link::read);
  }
}
