package com.skyrelay.bridge.stream;

import com.skyrelay.bridge.model.TelemetrySnapshot;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One registered push client: its sink, its bounded delivery queue and its liveness flag.
 *
 * <p>Instances are created and released by {@link BroadcastHub} only.
 */
public final class Subscriber {
  private final long id;
  private final SnapshotSink sink;
  private final BlockingQueue<TelemetrySnapshot> queue;
  private final AtomicBoolean alive = new AtomicBoolean(true);
  private volatile boolean primed;
  private volatile Future<?> deliveryTask;

  Subscriber(long id, SnapshotSink sink, int queueCapacity) {
    this.id = id;
    this.sink = sink;
    this.queue = new ArrayBlockingQueue<>(Math.max(1, queueCapacity));
  }

  public boolean isAlive() {
    return alive.get();
  }

  /**
   * Returns whether a snapshot was queued at registration time.
   *
   * @return {@code false} when the subscriber connected before any telemetry existed
   */
  public boolean isPrimed() {
    return primed;
  }

  SnapshotSink sink() {
    return sink;
  }

  void prime(TelemetrySnapshot snapshot) {
    primed = queue.offer(snapshot);
  }

  boolean offer(TelemetrySnapshot snapshot) {
    return queue.offer(snapshot);
  }

  TelemetrySnapshot poll(long timeoutMs) throws InterruptedException {
    return queue.poll(timeoutMs, TimeUnit.MILLISECONDS);
  }

  void attach(Future<?> task) {
    deliveryTask = task;
    if (!alive.get()) {
      task.cancel(true);
    }
  }

  /**
   * Marks the subscriber dead and cancels its delivery task.
   *
   * @return {@code true} for the first caller only
   */
  boolean release() {
    if (!alive.compareAndSet(true, false)) {
      return false;
    }
    queue.clear();
    Future<?> task = deliveryTask;
    if (task != null) {
      task.cancel(true);
    }
    return true;
  }

  @Override
  public String toString() {
    return "Subscriber#" + id;
  }
}
