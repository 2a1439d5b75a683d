package com.skyrelay.bridge.link;

import com.skyrelay.bridge.config.BridgeProperties;
import com.skyrelay.bridge.model.TelemetrySnapshot;
import com.skyrelay.bridge.model.TelemetryUpdate;
import com.skyrelay.bridge.store.TelemetryStateStore;
import com.skyrelay.bridge.stream.BroadcastHub;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Owns the flight-controller connection loop.
 *
 * <p>Every decoded update is merged into a copy of the stored snapshot, stamped with the next
 * sequence number, written to the {@link TelemetryStateStore} and then published to the
 * {@link BroadcastHub}. Connection failures degrade the {@link LinkConnection} and are retried with
 * bounded exponential backoff. The backoff and the attempt count only reset once a newly opened
 * link delivers its first update; the stored snapshot is left untouched so it stays servable.
 */
@Component
public class LinkReader {
  private static final Logger log = LoggerFactory.getLogger(LinkReader.class);
  private static final long STOP_GRACE_MS = 2_000L;

  private final TelemetryLinkFactory linkFactory;
  private final TelemetryStateStore store;
  private final BroadcastHub hub;
  private final LinkConnection connection;
  private final LinkStatistics statistics;
  private final Clock clock;
  private final BridgeProperties.Link properties;
  private final ExecutorService executor =
      Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "telemetry-link");
        thread.setDaemon(true);
        return thread;
      });

  private volatile boolean running = false;
  private volatile Future<?> loopHandle;
  private volatile TelemetryLink activeLink;
  private long nextSequence = 1L;

  public LinkReader(
      TelemetryLinkFactory linkFactory,
      TelemetryStateStore store,
      BroadcastHub hub,
      LinkConnection connection,
      LinkStatistics statistics,
      Clock clock,
      BridgeProperties properties) {
    this.linkFactory = linkFactory;
    this.store = store;
    this.hub = hub;
    this.connection = connection;
    this.statistics = statistics;
    this.clock = clock;
    this.properties = properties.getLink();
  }

  /** Starts the connection loop unless the link is disabled. */
  @PostConstruct
  public synchronized void start() {
    if (!properties.isEnabled()) {
      log.info("Telemetry link disabled (bridge.link.enabled=false)");
      return;
    }
    if (running) {
      return;
    }
    running = true;
    log.info("Starting telemetry link reader on {}", linkFactory.address());
    loopHandle = executor.submit(this::runLoop);
  }

  /** Cancels the connection loop and closes the open link. */
  @PreDestroy
  public synchronized void stop() {
    running = false;
    closeQuietly(activeLink);
    Future<?> handle = loopHandle;
    if (handle != null) {
      handle.cancel(true);
    }
    executor.shutdownNow();
    try {
      if (!executor.awaitTermination(STOP_GRACE_MS, TimeUnit.MILLISECONDS)) {
        log.warn("Telemetry link reader did not stop within {} ms", STOP_GRACE_MS);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    connection.shutdown();
  }

  public boolean isRunning() {
    return running;
  }

  void runLoop() {
    ReconnectBackoff backoff = new ReconnectBackoff(
        properties.getInitialBackoff(), properties.getMaxBackoff(), properties.getBackoffMultiplier());

    while (running && !Thread.currentThread().isInterrupted()) {
      connection.connectAttempt();
      TelemetryLink link;
      try {
        link = linkFactory.open();
      } catch (IOException | RuntimeException ex) {
        if (!running) {
          break;
        }
        connection.connectFailed(ex, store.get().isPresent());
        if (!retryAfter(backoff.nextDelay(), ex)) {
          break;
        }
        continue;
      }

      // An open transport is not yet a connection: UDP only binds locally and a TCP peer may
      // accept and drop. The link counts as up once it has delivered telemetry.
      activeLink = link;
      boolean established = false;
      try {
        while (running) {
          List<TelemetryUpdate> updates = link.read();
          if (!established && !updates.isEmpty()) {
            established = true;
            connection.connectSucceeded();
            backoff.reset();
          }
          for (TelemetryUpdate update : updates) {
            apply(update);
          }
        }
      } catch (IOException | RuntimeException ex) {
        // Keep the loop alive: a lost link is retried, never fatal to the service.
        if (running) {
          if (established) {
            connection.linkLost(ex, store.get().isPresent());
          } else {
            connection.connectFailed(ex, store.get().isPresent());
          }
          if (!retryAfter(backoff.nextDelay(), ex)) {
            break;
          }
        }
      } finally {
        activeLink = null;
        closeQuietly(link);
      }
    }
    connection.shutdown();
    log.info("Telemetry link reader stopped");
  }

  void apply(TelemetryUpdate update) {
    if (update.isEmpty()) {
      return;
    }
    TelemetrySnapshot previous = store.get().orElse(null);
    TelemetrySnapshot next = TelemetrySnapshot.merge(previous, update, nextSequence++, clock.instant());
    store.replace(next);
    hub.publish(next);
  }

  private boolean retryAfter(Duration delay, Exception cause) {
    statistics.reconnectScheduled();
    log.warn("Telemetry link {} unavailable ({}), retrying in {} ms",
        linkFactory.address(), cause.toString(), delay.toMillis());
    try {
      Thread.sleep(delay.toMillis());
      return running;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static void closeQuietly(TelemetryLink link) {
    if (link == null) {
      return;
    }
    try {
      link.close();
    } catch (IOException ex) {
      log.debug("Closing telemetry link failed: {}", ex.toString());
    }
  }
}
