package com.skyrelay.bridge.link.transport;

import java.io.Closeable;
import java.io.IOException;

/** Raw byte source underneath a telemetry link. */
public interface LinkTransport extends Closeable {

  /**
   * Reads the next chunk of bytes, waiting at most the configured read timeout.
   *
   * @param buffer destination buffer
   * @return bytes read, {@code 0} on read timeout, {@code -1} when the peer closed the stream
   * @throws IOException when the transport fails
   */
  int read(byte[] buffer) throws IOException;
}
