package com.skyrelay.bridge.link;

import java.io.IOException;

/** Opens connections to the configured telemetry source. */
public interface TelemetryLinkFactory {

  /**
   * Opens a new connection.
   *
   * @return open link
   * @throws IOException when the source cannot be reached
   */
  TelemetryLink open() throws IOException;

  /**
   * Returns the address this factory connects to, for diagnostics.
   *
   * @return link address as configured
   */
  String address();
}
