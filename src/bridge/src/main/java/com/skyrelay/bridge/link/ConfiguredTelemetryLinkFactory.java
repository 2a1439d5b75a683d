package com.skyrelay.bridge.link;

import com.skyrelay.bridge.config.BridgeProperties;
import com.skyrelay.bridge.link.transport.LinkTransport;
import com.skyrelay.bridge.link.transport.SerialLinkTransport;
import com.skyrelay.bridge.link.transport.TcpLinkTransport;
import com.skyrelay.bridge.link.transport.UdpLinkTransport;
import com.skyrelay.bridge.mavlink.MavlinkMessageDecoder;
import java.io.IOException;
import java.time.Clock;
import java.util.Random;
import org.springframework.stereotype.Component;

/** Builds telemetry links from {@code bridge.link.*}. The address is validated at start-up. */
@Component
public class ConfiguredTelemetryLinkFactory implements TelemetryLinkFactory {
  private final BridgeProperties.Link properties;
  private final LinkAddress address;
  private final MavlinkMessageDecoder decoder;
  private final LinkStatistics statistics;
  private final Clock clock;

  public ConfiguredTelemetryLinkFactory(
      BridgeProperties properties, LinkStatistics statistics, Clock clock) {
    this.properties = properties.getLink();
    this.address = LinkAddress.parse(this.properties.getAddress());
    this.decoder = new MavlinkMessageDecoder(this.properties.getAltitudeReference());
    this.statistics = statistics;
    this.clock = clock;
  }

  @Override
  public TelemetryLink open() throws IOException {
    if (address.kind() == LinkAddress.Kind.SIMULATED) {
      return new SimulatedTelemetryLink(clock, properties.getSimulationInterval(), new Random());
    }
    return new MavlinkTelemetryLink(
        openTransport(), decoder, statistics, clock, properties.getSilenceTimeout());
  }

  @Override
  public String address() {
    return address.toString();
  }

  private LinkTransport openTransport() throws IOException {
    return switch (address.kind()) {
      case UDP -> new UdpLinkTransport(address.host(), address.port(), properties.getReadTimeout());
      case TCP -> new TcpLinkTransport(address.host(), address.port(), properties.getReadTimeout());
      case SERIAL -> new SerialLinkTransport(address.device(), properties.getBaudRate(), properties.getReadTimeout());
      case SIMULATED -> throw new IllegalStateException("simulated link has no transport");
    };
  }
}
