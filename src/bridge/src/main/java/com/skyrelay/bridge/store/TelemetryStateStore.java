package com.skyrelay.bridge.store;

import com.skyrelay.bridge.model.TelemetrySnapshot;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

/**
 * Holds the single latest telemetry snapshot.
 *
 * <p>Replacement is a whole-object reference swap, so readers see either the previous or the new
 * snapshot and never a partially updated one. Only the link reader writes; any number of request
 * threads read. The stored value never expires; its age is reported instead.
 */
@Component
public class TelemetryStateStore {
  private final AtomicReference<TelemetrySnapshot> current = new AtomicReference<>();
  private final Clock clock;

  public TelemetryStateStore(Clock clock) {
    this.clock = clock;
  }

  /**
   * Returns the most recently stored snapshot.
   *
   * @return latest snapshot, empty when none has been produced since start-up
   */
  public Optional<TelemetrySnapshot> get() {
    return Optional.ofNullable(current.get());
  }

  /**
   * Installs a new snapshot.
   *
   * @param snapshot replacement snapshot, must have a higher sequence than the stored one
   */
  public void replace(TelemetrySnapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot");
    // Single writer: check-then-set cannot interleave with another replace.
    TelemetrySnapshot previous = current.get();
    if (previous != null && previous.sequence() >= snapshot.sequence()) {
      throw new IllegalArgumentException(
          "snapshot sequence " + snapshot.sequence() + " does not follow " + previous.sequence());
    }
    current.set(snapshot);
  }

  /**
   * Returns the age of the stored snapshot.
   *
   * @return now minus the snapshot timestamp, empty before the first update
   */
  public Optional<Duration> age() {
    return get().map(snapshot -> snapshot.ageAt(clock.instant()));
  }
}
