package com.skyrelay.bridge.service;

import com.skyrelay.bridge.stream.BroadcastHub;
import com.skyrelay.bridge.stream.Subscriber;
import java.time.Clock;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Server-Sent Events entry point of the push stream.
 *
 * <p>Each opened stream becomes one {@link BroadcastHub} subscriber. The first event is the current
 * snapshot, or an {@code unavailable} event when none exists yet; every later telemetry update
 * follows as a {@code telemetry} event.
 */
@Service
public class TelemetryStreamService {
  private static final long STREAM_TIMEOUT_MS = 0L;

  private final BroadcastHub hub;
  private final TelemetryQueryService queryService;
  private final Clock clock;

  public TelemetryStreamService(BroadcastHub hub, TelemetryQueryService queryService, Clock clock) {
    this.hub = hub;
    this.queryService = queryService;
    this.clock = clock;
  }

  /**
   * Opens an SSE stream and registers it with the hub.
   *
   * @return emitter streaming telemetry events until the client goes away
   */
  public SseEmitter openStream() {
    SseEmitter emitter = createEmitter();
    Subscriber subscriber = hub.subscribe(new SseSnapshotSink(emitter, queryService::render, clock));

    emitter.onCompletion(() -> hub.unsubscribe(subscriber));
    emitter.onTimeout(() -> hub.unsubscribe(subscriber));
    emitter.onError(ex -> hub.unsubscribe(subscriber));
    return emitter;
  }

  SseEmitter createEmitter() {
    return new SseEmitter(STREAM_TIMEOUT_MS);
  }
}
