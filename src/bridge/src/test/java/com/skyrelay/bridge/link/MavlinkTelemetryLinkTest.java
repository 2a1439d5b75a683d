package com.skyrelay.bridge.link;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.skyrelay.bridge.MutableClock;
import com.skyrelay.bridge.link.transport.LinkTransport;
import com.skyrelay.bridge.mavlink.MavlinkFrames;
import com.skyrelay.bridge.mavlink.MavlinkMessage;
import com.skyrelay.bridge.mavlink.MavlinkMessageDecoder;
import com.skyrelay.bridge.model.TelemetryUpdate;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MavlinkTelemetryLinkTest {
  private static final Duration SILENCE_TIMEOUT = Duration.ofSeconds(5);

  private MutableClock clock;
  private LinkStatistics statistics;
  private QueueTransport transport;
  private MavlinkTelemetryLink link;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
    statistics = new LinkStatistics(new SimpleMeterRegistry());
    transport = new QueueTransport();
    link = new MavlinkTelemetryLink(
        transport, new MavlinkMessageDecoder("msl"), statistics, clock, SILENCE_TIMEOUT);
  }

  @Test
  void read_decodesValidFramesAndDiscardsMalformedOnes() throws Exception {
    byte[] corrupted = MavlinkFrames.v1(MavlinkMessage.BATTERY_STATUS, 1, MavlinkFrames.batteryStatus(10));
    corrupted[corrupted.length - 1] ^= 0x01;
    byte[] valid = MavlinkFrames.v1(MavlinkMessage.GLOBAL_POSITION_INT, 2,
        MavlinkFrames.globalPosition(337490000, -843880000, 100000, 0));
    transport.chunks.add(MavlinkFrames.concat(new byte[] {0x00, 0x42}, corrupted, valid));

    List<TelemetryUpdate> updates = link.read();

    assertEquals(1, updates.size());
    assertEquals(33.749, updates.get(0).lat(), 1e-6);
    assertEquals(null, updates.get(0).battery());
    assertEquals(1L, statistics.framesDecoded());
    assertTrue(statistics.framesDiscarded() >= 2);
  }

  @Test
  void read_returnsNothingOnQuietTransportWithinSilenceWindow() throws Exception {
    clock.advance(Duration.ofSeconds(4));

    assertTrue(link.read().isEmpty());
  }

  @Test
  void read_reportsLinkLostAfterSilenceTimeout() {
    clock.advance(Duration.ofSeconds(6));

    LinkException ex = assertThrows(LinkException.class, link::read);
    assertTrue(ex.getMessage().contains("no valid frame"));
  }

  @Test
  void read_garbageDoesNotCountAsLinkActivity() {
    clock.advance(Duration.ofSeconds(6));
    transport.chunks.add(new byte[] {0x01, 0x02, 0x03});

    assertThrows(LinkException.class, link::read);
  }

  @Test
  void read_groundStationHeartbeatKeepsLinkAlive() throws Exception {
    clock.advance(Duration.ofSeconds(6));
    transport.chunks.add(MavlinkFrames.v2(MavlinkMessage.HEARTBEAT, 0, MavlinkFrames.heartbeat(0, 6, 8, 0)));

    assertTrue(link.read().isEmpty());
    assertEquals(1L, statistics.framesDecoded());
  }

  @Test
  void read_endOfStreamIsLinkLoss() {
    transport.endOfStream = true;

    assertThrows(LinkException.class, link::read);
  }

  @Test
  void close_closesTransport() throws Exception {
    link.close();

    assertTrue(transport.closed);
  }

  private static final class QueueTransport implements LinkTransport {
    private final Deque<byte[]> chunks = new ArrayDeque<>();
    private boolean endOfStream;
    private boolean closed;

    @Override
    public int read(byte[] buffer) {
      if (endOfStream) {
        return -1;
      }
      byte[] next = chunks.poll();
      if (next == null) {
        return 0;
      }
      System.arraycopy(next, 0, buffer, 0, next.length);
      return next.length;
    }

    @Override
    public void close() {
      closed = true;
    }
  }
}
