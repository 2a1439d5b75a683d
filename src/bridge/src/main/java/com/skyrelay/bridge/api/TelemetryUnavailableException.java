package com.skyrelay.bridge.api;

/**
 * Raised when no telemetry snapshot has been produced since start-up.
 *
 * <p>Mapped to HTTP 503 by {@link ApiExceptionHandler}, so callers can tell "no data yet" apart
 * from a snapshot whose fields are all unknown.
 */
public class TelemetryUnavailableException extends RuntimeException {
  public TelemetryUnavailableException(String message) {
    super(message);
  }
}
