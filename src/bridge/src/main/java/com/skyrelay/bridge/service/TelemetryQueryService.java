package com.skyrelay.bridge.service;

import com.skyrelay.bridge.api.TelemetryUnavailableException;
import com.skyrelay.bridge.config.BridgeProperties;
import com.skyrelay.bridge.link.LinkConnection;
import com.skyrelay.bridge.link.LinkStatistics;
import com.skyrelay.bridge.link.TelemetryLinkFactory;
import com.skyrelay.bridge.model.LinkStatusResponse;
import com.skyrelay.bridge.model.TelemetryResponse;
import com.skyrelay.bridge.model.TelemetrySnapshot;
import com.skyrelay.bridge.store.TelemetryStateStore;
import com.skyrelay.bridge.stream.BroadcastHub;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import org.springframework.stereotype.Service;

/**
 * Read side of the bridge: renders the stored snapshot and link diagnostics.
 *
 * <p>Stateless apart from its collaborators; safe for any number of concurrent requests.
 */
@Service
public class TelemetryQueryService {
  private final TelemetryStateStore store;
  private final LinkConnection connection;
  private final LinkStatistics statistics;
  private final TelemetryLinkFactory linkFactory;
  private final BroadcastHub hub;
  private final Clock clock;
  private final Duration staleAfter;

  public TelemetryQueryService(
      TelemetryStateStore store,
      LinkConnection connection,
      LinkStatistics statistics,
      TelemetryLinkFactory linkFactory,
      BroadcastHub hub,
      Clock clock,
      BridgeProperties properties,
      MeterRegistry meterRegistry) {
    this.store = store;
    this.connection = connection;
    this.statistics = statistics;
    this.linkFactory = linkFactory;
    this.hub = hub;
    this.clock = clock;
    this.staleAfter = properties.getSnapshot().getStaleAfter();
    meterRegistry.gauge("bridge.snapshot.age.ms", store,
        s -> s.age().map(age -> (double) age.toMillis()).orElse(Double.NaN));
  }

  /**
   * Returns the current snapshot.
   *
   * @return rendered snapshot
   * @throws TelemetryUnavailableException when no snapshot has been produced since start-up
   */
  public TelemetryResponse currentTelemetry() {
    return store.get()
        .map(this::render)
        .orElseThrow(() -> new TelemetryUnavailableException("no telemetry received since start-up"));
  }

  /**
   * Renders a snapshot with its age relative to now.
   *
   * @param snapshot snapshot to render
   * @return response payload
   */
  public TelemetryResponse render(TelemetrySnapshot snapshot) {
    long ageMs = snapshot.ageAt(clock.instant()).toMillis();
    return new TelemetryResponse(
        snapshot.lat(),
        snapshot.lon(),
        snapshot.alt(),
        snapshot.roll(),
        snapshot.pitch(),
        snapshot.yaw(),
        snapshot.battery(),
        snapshot.voltage(),
        snapshot.current(),
        snapshot.fixType(),
        snapshot.satellites(),
        snapshot.armed(),
        snapshot.mode(),
        snapshot.sequence(),
        snapshot.timestamp().toString(),
        ageMs,
        ageMs > staleAfter.toMillis(),
        connection.state().name());
  }

  public LinkStatusResponse linkStatus() {
    LinkConnection.Status status = connection.status();
    return new LinkStatusResponse(
        status.state().name(),
        linkFactory.address(),
        status.reconnectAttempts(),
        status.lastError(),
        status.lastConnectedAt() == null ? null : status.lastConnectedAt().toString(),
        store.age().map(Duration::toMillis).orElse(null),
        hub.subscriberCount(),
        statistics.framesDecoded(),
        statistics.framesDiscarded());
  }
}
