package com.skyrelay.bridge.stream;

import com.skyrelay.bridge.config.BridgeProperties;
import com.skyrelay.bridge.model.TelemetrySnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Fans out published snapshots to every live push subscriber.
 *
 * <p>Backpressure policy: each subscriber owns a bounded queue drained by its own delivery task.
 * {@link #publish(TelemetrySnapshot)} only offers to those queues and never waits on a client; a
 * subscriber whose queue is full is dropped and its connection closed, so one slow client cannot
 * stall the producer or its peers.
 *
 * <p>Registration and publication share one short lock that covers queue offers only. A new
 * subscriber is therefore primed with exactly the last published snapshot and then receives every
 * later one, in the same order as every other subscriber.
 */
@Component
public class BroadcastHub {
  private static final Logger log = LoggerFactory.getLogger(BroadcastHub.class);
  private static final long SHUTDOWN_GRACE_MS = 2_000L;

  private final Object lock = new Object();
  private final Set<Subscriber> subscribers = ConcurrentHashMap.newKeySet();
  private final AtomicLong ids = new AtomicLong();
  private final AtomicLong threadIds = new AtomicLong();
  private final int queueCapacity;
  private final long heartbeatIntervalMs;
  private final Counter droppedCounter;
  private final ExecutorService deliveryExecutor =
      Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "telemetry-subscriber-" + threadIds.incrementAndGet());
        thread.setDaemon(true);
        return thread;
      });

  private TelemetrySnapshot lastPublished;
  private boolean shutdown;

  @Autowired
  public BroadcastHub(BridgeProperties properties, MeterRegistry meterRegistry) {
    this(
        properties.getStream().getQueueCapacity(),
        properties.getStream().getHeartbeatInterval(),
        meterRegistry);
  }

  BroadcastHub(int queueCapacity, Duration heartbeatInterval, MeterRegistry meterRegistry) {
    this.queueCapacity = Math.max(1, queueCapacity);
    this.heartbeatIntervalMs = Math.max(1L, heartbeatInterval.toMillis());
    this.droppedCounter = meterRegistry.counter("bridge.stream.dropped");
    meterRegistry.gauge("bridge.stream.subscribers", subscribers, Set::size);
  }

  /**
   * Registers a subscriber and starts its delivery task.
   *
   * <p>The last published snapshot, if any, is queued as the subscriber's first item.
   *
   * @param sink outbound side of the client connection
   * @return registered subscriber handle
   */
  public Subscriber subscribe(SnapshotSink sink) {
    Subscriber subscriber = new Subscriber(ids.incrementAndGet(), sink, queueCapacity);
    synchronized (lock) {
      if (shutdown) {
        sink.close();
        throw new IllegalStateException("broadcast hub is shut down");
      }
      if (lastPublished != null) {
        subscriber.prime(lastPublished);
      }
      subscribers.add(subscriber);
    }
    try {
      subscriber.attach(deliveryExecutor.submit(() -> deliver(subscriber)));
    } catch (RejectedExecutionException ex) {
      unsubscribe(subscriber);
      throw new IllegalStateException("broadcast hub is shut down", ex);
    }
    log.info("{} connected (primed={}, subscribers={})", subscriber, subscriber.isPrimed(), subscribers.size());
    return subscriber;
  }

  /**
   * Enqueues a snapshot for every registered subscriber without blocking on any of them.
   *
   * @param snapshot newly produced snapshot
   */
  public void publish(TelemetrySnapshot snapshot) {
    List<Subscriber> overflowed = null;
    synchronized (lock) {
      lastPublished = snapshot;
      for (Subscriber subscriber : subscribers) {
        if (!subscriber.offer(snapshot)) {
          if (overflowed == null) {
            overflowed = new ArrayList<>();
          }
          overflowed.add(subscriber);
        }
      }
      if (overflowed != null) {
        overflowed.forEach(subscribers::remove);
      }
    }
    if (overflowed == null) {
      return;
    }
    for (Subscriber subscriber : overflowed) {
      droppedCounter.increment();
      log.warn("{} dropped: delivery queue full ({} pending)", subscriber, queueCapacity);
      release(subscriber, null);
    }
  }

  /**
   * Removes a subscriber, cancels its delivery task and closes its connection.
   *
   * <p>Safe to call concurrently with {@link #publish(TelemetrySnapshot)} and more than once.
   *
   * @param subscriber subscriber to remove
   */
  public void unsubscribe(Subscriber subscriber) {
    synchronized (lock) {
      subscribers.remove(subscriber);
    }
    if (release(subscriber, null)) {
      log.info("{} disconnected (subscribers={})", subscriber, subscribers.size());
    }
  }

  public int subscriberCount() {
    return subscribers.size();
  }

  /** Closes every subscriber and stops the delivery tasks. */
  @PreDestroy
  public void shutdown() {
    List<Subscriber> remaining;
    synchronized (lock) {
      if (shutdown) {
        return;
      }
      shutdown = true;
      remaining = new ArrayList<>(subscribers);
      subscribers.clear();
    }
    remaining.forEach(subscriber -> release(subscriber, null));
    deliveryExecutor.shutdown();
    try {
      if (!deliveryExecutor.awaitTermination(SHUTDOWN_GRACE_MS, TimeUnit.MILLISECONDS)) {
        deliveryExecutor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      deliveryExecutor.shutdownNow();
    }
    log.info("Broadcast hub stopped, closed {} subscribers", remaining.size());
  }

  private void deliver(Subscriber subscriber) {
    SnapshotSink sink = subscriber.sink();
    try {
      if (!subscriber.isPrimed()) {
        sink.unavailable();
      }
      while (subscriber.isAlive()) {
        TelemetrySnapshot next = subscriber.poll(heartbeatIntervalMs);
        if (!subscriber.isAlive()) {
          return;
        }
        if (next == null) {
          sink.heartbeat();
        } else {
          sink.send(next);
        }
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    } catch (Exception ex) {
      if (!subscriber.isAlive()) {
        return;
      }
      synchronized (lock) {
        subscribers.remove(subscriber);
      }
      if (ClientDisconnects.isClientGone(ex)) {
        log.debug("{} disconnected during delivery: {}",
            subscriber, ClientDisconnects.describe(ex));
        release(subscriber, null);
        return;
      }
      log.warn("{} delivery failed", subscriber, ex);
      release(subscriber, ex);
    }
  }

  private boolean release(Subscriber subscriber, Exception error) {
    if (!subscriber.release()) {
      return false;
    }
    // The sink may still be held by a delivery task blocked in a write, so close it off this thread.
    Runnable closer = () -> closeSink(subscriber, error);
    try {
      deliveryExecutor.execute(closer);
    } catch (RejectedExecutionException ex) {
      closer.run();
    }
    return true;
  }

  private static void closeSink(Subscriber subscriber, Exception error) {
    try {
      if (error == null) {
        subscriber.sink().close();
      } else {
        subscriber.sink().fail(error);
      }
    } catch (Exception ex) {
      log.debug("{} close failed: {}", subscriber, ClientDisconnects.describe(ex));
    }
  }
}
