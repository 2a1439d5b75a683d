package com.skyrelay.bridge.stream;

import com.skyrelay.bridge.model.TelemetrySnapshot;
import java.io.IOException;

/**
 * Outbound side of one push subscriber.
 *
 * <p>All methods are called from the subscriber's own delivery task, one at a time, except
 * {@link #close()} and {@link #fail(Exception)} which may run on another thread once the subscriber
 * has been released.
 */
public interface SnapshotSink {

  /**
   * Writes one snapshot to the client.
   *
   * @param snapshot snapshot to deliver
   * @throws IOException when the client connection is broken
   */
  void send(TelemetrySnapshot snapshot) throws IOException;

  /**
   * Signals that no snapshot existed when the subscriber connected.
   *
   * @throws IOException when the client connection is broken
   */
  default void unavailable() throws IOException {}

  /**
   * Keeps an idle connection alive through proxies.
   *
   * @throws IOException when the client connection is broken
   */
  default void heartbeat() throws IOException {}

  /** Closes the client connection normally. */
  void close();

  /**
   * Closes the client connection after an unexpected failure.
   *
   * @param error failure that ended delivery
   */
  default void fail(Exception error) {
    close();
  }
}
