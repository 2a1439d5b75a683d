package com.skyrelay.bridge.link;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/** Link counters shared by the link reader, the transports and the status endpoint. */
@Component
public class LinkStatistics {
  private final Counter framesDecoded;
  private final Counter framesDiscarded;
  private final Counter reconnects;

  public LinkStatistics(MeterRegistry meterRegistry) {
    this.framesDecoded = meterRegistry.counter("bridge.link.frames.decoded");
    this.framesDiscarded = meterRegistry.counter("bridge.link.frames.discarded");
    this.reconnects = meterRegistry.counter("bridge.link.reconnects");
  }

  public void frameDecoded() {
    framesDecoded.increment();
  }

  public void framesDiscarded(long count) {
    if (count > 0) {
      framesDiscarded.increment(count);
    }
  }

  public void reconnectScheduled() {
    reconnects.increment();
  }

  public long framesDecoded() {
    return (long) framesDecoded.count();
  }

  public long framesDiscarded() {
    return (long) framesDiscarded.count();
  }

  public long reconnects() {
    return (long) reconnects.count();
  }
}
