package com.skyrelay.bridge.link;

import java.time.Duration;

/** Bounded exponential backoff between link reconnect attempts. Not thread-safe. */
public final class ReconnectBackoff {
  private final Duration initial;
  private final Duration max;
  private final double multiplier;
  private Duration next;

  public ReconnectBackoff(Duration initial, Duration max, double multiplier) {
    if (initial.isNegative() || initial.isZero()) {
      throw new IllegalArgumentException("initial backoff must be positive");
    }
    this.initial = initial;
    this.max = max.compareTo(initial) < 0 ? initial : max;
    this.multiplier = Math.max(1.0, multiplier);
    this.next = initial;
  }

  /**
   * Returns the delay before the next attempt and grows the following one.
   *
   * @return delay, never above the configured maximum
   */
  public Duration nextDelay() {
    Duration delay = next;
    double grown = next.toMillis() * multiplier;
    next = grown >= max.toMillis() ? max : Duration.ofMillis((long) grown);
    return delay;
  }

  /** Restarts from the initial delay after a successful connect. */
  public void reset() {
    next = initial;
  }
}
