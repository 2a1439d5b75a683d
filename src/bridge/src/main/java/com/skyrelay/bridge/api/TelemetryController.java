package com.skyrelay.bridge.api;

import com.skyrelay.bridge.model.LinkStatusResponse;
import com.skyrelay.bridge.model.TelemetryResponse;
import com.skyrelay.bridge.service.TelemetryQueryService;
import com.skyrelay.bridge.service.TelemetryStreamService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * REST controller exposing the telemetry read endpoints used by dashboards.
 *
 * <p>Route design:
 * <ul>
 *   <li>{@code GET /api/telemetry}: latest snapshot, 503 before the first update</li>
 *   <li>{@code GET /api/telemetry/stream}: SSE push of every snapshot</li>
 *   <li>{@code GET /api/telemetry/link}: link connection diagnostics</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/telemetry")
public class TelemetryController {
  private final TelemetryQueryService queryService;
  private final TelemetryStreamService streamService;

  public TelemetryController(TelemetryQueryService queryService, TelemetryStreamService streamService) {
    this.queryService = queryService;
    this.streamService = streamService;
  }

  /**
   * Returns the latest telemetry snapshot.
   *
   * @return snapshot with unknown fields as {@code null}
   */
  @GetMapping
  public TelemetryResponse latest() {
    return queryService.currentTelemetry();
  }

  /**
   * Opens the push stream.
   *
   * @return emitter sending {@code telemetry} events
   */
  @GetMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public SseEmitter stream() {
    return streamService.openStream();
  }

  @GetMapping("/link")
  public LinkStatusResponse link() {
    return queryService.linkStatus();
  }
}
