package com.skyrelay.bridge.link;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Explicit state machine of the flight-controller link.
 *
 * <p>Transitions are driven by link I/O outcomes only:
 * <ul>
 *   <li>{@code DISCONNECTED|DEGRADED -> CONNECTING} on {@link #connectAttempt()}</li>
 *   <li>{@code CONNECTING -> CONNECTED} on {@link #connectSucceeded()}</li>
 *   <li>{@code CONNECTING -> DEGRADED|DISCONNECTED} on {@link #connectFailed(Throwable, boolean)}</li>
 *   <li>{@code CONNECTED -> DEGRADED|DISCONNECTED} on {@link #linkLost(Throwable, boolean)}</li>
 *   <li>any state {@code -> DISCONNECTED} on {@link #shutdown()}</li>
 * </ul>
 * A failure leads to {@code DEGRADED} when a snapshot is retained, {@code DISCONNECTED} otherwise.
 */
@Component
public class LinkConnection {
  private static final Logger log = LoggerFactory.getLogger(LinkConnection.class);

  private final Clock clock;
  private LinkState state = LinkState.DISCONNECTED;
  private int reconnectAttempts;
  private String lastError;
  private Instant lastConnectedAt;

  public LinkConnection(Clock clock) {
    this.clock = clock;
  }

  public synchronized LinkState state() {
    return state;
  }

  public synchronized Status status() {
    return new Status(state, reconnectAttempts, lastError, lastConnectedAt);
  }

  public synchronized void connectAttempt() {
    require(EnumSet.of(LinkState.DISCONNECTED, LinkState.DEGRADED), "connect attempt");
    moveTo(LinkState.CONNECTING);
  }

  public synchronized void connectSucceeded() {
    require(EnumSet.of(LinkState.CONNECTING), "connect success");
    reconnectAttempts = 0;
    lastConnectedAt = clock.instant();
    moveTo(LinkState.CONNECTED);
  }

  /**
   * Records a failed connection attempt.
   *
   * @param cause failure reported by the transport
   * @param snapshotRetained whether a last-known-good snapshot exists
   */
  public synchronized void connectFailed(Throwable cause, boolean snapshotRetained) {
    require(EnumSet.of(LinkState.CONNECTING), "connect failure");
    reconnectAttempts++;
    lastError = describe(cause);
    moveTo(snapshotRetained ? LinkState.DEGRADED : LinkState.DISCONNECTED);
  }

  /**
   * Records the loss of an established connection.
   *
   * @param cause failure reported by the transport
   * @param snapshotRetained whether a last-known-good snapshot exists
   */
  public synchronized void linkLost(Throwable cause, boolean snapshotRetained) {
    require(EnumSet.of(LinkState.CONNECTED), "link loss");
    lastError = describe(cause);
    moveTo(snapshotRetained ? LinkState.DEGRADED : LinkState.DISCONNECTED);
  }

  public synchronized void shutdown() {
    moveTo(LinkState.DISCONNECTED);
  }

  private void require(Set<LinkState> allowed, String event) {
    if (!allowed.contains(state)) {
      throw new IllegalStateException("illegal link transition: " + event + " in state " + state);
    }
  }

  private void moveTo(LinkState next) {
    if (next == state) {
      return;
    }
    if (next == LinkState.CONNECTED || next == LinkState.DISCONNECTED) {
      log.info("Link state {} -> {}", state, next);
    } else if (next == LinkState.DEGRADED) {
      log.warn("Link state {} -> {} ({})", state, next, lastError);
    } else {
      log.debug("Link state {} -> {}", state, next);
    }
    state = next;
  }

  private static String describe(Throwable cause) {
    if (cause == null) {
      return null;
    }
    String message = cause.getMessage();
    if (message == null || message.isBlank()) {
      return cause.getClass().getSimpleName();
    }
    return cause.getClass().getSimpleName() + ": " + message;
  }

  /**
   * Point-in-time copy of the connection bookkeeping.
   *
   * @param state current state
   * @param reconnectAttempts failed attempts since the last successful connect
   * @param lastError last failure description, when any
   * @param lastConnectedAt last successful connect, when any
   */
  public record Status(LinkState state, int reconnectAttempts, String lastError, Instant lastConnectedAt) {}
}
