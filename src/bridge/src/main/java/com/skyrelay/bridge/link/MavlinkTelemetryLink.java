package com.skyrelay.bridge.link;

import com.skyrelay.bridge.link.transport.LinkTransport;
import com.skyrelay.bridge.mavlink.MavlinkFrame;
import com.skyrelay.bridge.mavlink.MavlinkFrameParser;
import com.skyrelay.bridge.mavlink.MavlinkMessageDecoder;
import com.skyrelay.bridge.model.TelemetryUpdate;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * MAVLink link over a byte transport.
 *
 * <p>The link counts as lost when the peer closes the stream or when no verified frame arrives for
 * the silence timeout; datagram transports have no other way to notice a vanished vehicle.
 */
class MavlinkTelemetryLink implements TelemetryLink {
  private static final Logger log = LoggerFactory.getLogger(MavlinkTelemetryLink.class);
  private static final int READ_BUFFER_SIZE = 2048;

  private final LinkTransport transport;
  private final MavlinkFrameParser parser = new MavlinkFrameParser();
  private final MavlinkMessageDecoder decoder;
  private final LinkStatistics statistics;
  private final Clock clock;
  private final Duration silenceTimeout;
  private final byte[] readBuffer = new byte[READ_BUFFER_SIZE];
  private Instant lastFrameAt;
  private long reportedDiscards;

  MavlinkTelemetryLink(
      LinkTransport transport,
      MavlinkMessageDecoder decoder,
      LinkStatistics statistics,
      Clock clock,
      Duration silenceTimeout) {
    this.transport = transport;
    this.decoder = decoder;
    this.statistics = statistics;
    this.clock = clock;
    this.silenceTimeout = silenceTimeout;
    this.lastFrameAt = clock.instant();
  }

  @Override
  public List<TelemetryUpdate> read() throws IOException {
    int read = transport.read(readBuffer);
    if (read < 0) {
      throw new LinkException("link closed by peer");
    }

    List<TelemetryUpdate> updates = new ArrayList<>();
    if (read > 0) {
      for (MavlinkFrame frame : parser.feed(readBuffer, 0, read)) {
        lastFrameAt = clock.instant();
        statistics.frameDecoded();
        decoder.decode(frame).ifPresent(updates::add);
      }
      long discarded = parser.discardedFrames() - reportedDiscards;
      if (discarded > 0) {
        reportedDiscards += discarded;
        statistics.framesDiscarded(discarded);
        log.debug("Discarded {} malformed or unrecognized frames", discarded);
      }
    }

    if (updates.isEmpty()) {
      Duration silence = Duration.between(lastFrameAt, clock.instant());
      if (silence.compareTo(silenceTimeout) > 0) {
        throw new LinkException("no valid frame for " + silence.toMillis() + " ms");
      }
    }
    return updates;
  }

  @Override
  public void close() throws IOException {
    transport.close();
  }
}
