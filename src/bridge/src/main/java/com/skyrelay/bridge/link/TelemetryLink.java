package com.skyrelay.bridge.link;

import com.skyrelay.bridge.model.TelemetryUpdate;
import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/** One open connection to a telemetry source. Used by the link reader thread only. */
public interface TelemetryLink extends Closeable {

  /**
   * Reads and decodes whatever arrives within the transport read timeout.
   *
   * @return decoded updates in arrival order, possibly empty
   * @throws IOException when the link is lost
   */
  List<TelemetryUpdate> read() throws IOException;
}
