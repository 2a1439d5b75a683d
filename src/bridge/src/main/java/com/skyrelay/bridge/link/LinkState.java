package com.skyrelay.bridge.link;

/** Connection state of the flight-controller link. */
public enum LinkState {
  /** No connection and no snapshot retained. */
  DISCONNECTED,
  /** A connection attempt is in progress. */
  CONNECTING,
  /** The link is open and delivering frames. */
  CONNECTED,
  /** The link was lost; the last snapshot is retained and served as stale. */
  DEGRADED
}
