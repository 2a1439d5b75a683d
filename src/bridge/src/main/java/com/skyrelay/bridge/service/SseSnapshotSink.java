package com.skyrelay.bridge.service;

import com.skyrelay.bridge.model.TelemetryResponse;
import com.skyrelay.bridge.model.TelemetrySnapshot;
import com.skyrelay.bridge.stream.SnapshotSink;
import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/** Writes hub deliveries to one SSE connection. */
class SseSnapshotSink implements SnapshotSink {
  static final String TELEMETRY_EVENT = "telemetry";
  static final String UNAVAILABLE_EVENT = "unavailable";

  private final SseEmitter emitter;
  private final Function<TelemetrySnapshot, TelemetryResponse> renderer;
  private final Clock clock;

  SseSnapshotSink(
      SseEmitter emitter, Function<TelemetrySnapshot, TelemetryResponse> renderer, Clock clock) {
    this.emitter = emitter;
    this.renderer = renderer;
    this.clock = clock;
  }

  @Override
  public void send(TelemetrySnapshot snapshot) throws IOException {
    emitter.send(SseEmitter.event()
        .id(Long.toString(snapshot.sequence()))
        .name(TELEMETRY_EVENT)
        .data(renderer.apply(snapshot), MediaType.APPLICATION_JSON));
  }

  @Override
  public void unavailable() throws IOException {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("error", "unavailable");
    payload.put("message", "no telemetry received since start-up");
    payload.put("timestamp", clock.instant().toString());
    emitter.send(SseEmitter.event().name(UNAVAILABLE_EVENT).data(payload, MediaType.APPLICATION_JSON));
  }

  @Override
  public void heartbeat() throws IOException {
    emitter.send(SseEmitter.event().comment("heartbeat"));
  }

  @Override
  public void close() {
    emitter.complete();
  }

  @Override
  public void fail(Exception error) {
    emitter.completeWithError(error);
  }
}
