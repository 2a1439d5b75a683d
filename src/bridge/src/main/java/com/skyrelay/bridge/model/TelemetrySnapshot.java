package com.skyrelay.bridge.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable bundle of the latest known telemetry values.
 *
 * <p>Every telemetry field is nullable: {@code null} means the value has never been received, which
 * is distinct from a genuine zero.
 *
 * @param sequence monotonically increasing production sequence number
 * @param timestamp capture time of the message that produced this snapshot
 * @param lat latitude in degrees
 * @param lon longitude in degrees
 * @param alt altitude in metres
 * @param roll roll in degrees
 * @param pitch pitch in degrees
 * @param yaw yaw in degrees
 * @param battery remaining battery percentage
 * @param voltage battery voltage in volts
 * @param current battery current in amperes
 * @param fixType GPS fix type as reported by the receiver
 * @param satellites visible satellite count
 * @param armed whether the vehicle is armed
 * @param mode flight mode name
 */
public record TelemetrySnapshot(
    long sequence,
    Instant timestamp,
    Double lat,
    Double lon,
    Double alt,
    Double roll,
    Double pitch,
    Double yaw,
    Integer battery,
    Double voltage,
    Double current,
    Integer fixType,
    Integer satellites,
    Boolean armed,
    String mode) {

  public TelemetrySnapshot {
    Objects.requireNonNull(timestamp, "timestamp");
  }

  /**
   * Merges an update into the previous snapshot.
   *
   * <p>Fields carried by {@code update} replace the previous values; all other fields keep their
   * previous value, or stay unknown when there is no previous snapshot.
   *
   * @param previous last stored snapshot, or {@code null} before the first update
   * @param update partial update to apply
   * @param sequence sequence number of the merged snapshot
   * @param timestamp capture time of the merged snapshot
   * @return new snapshot
   */
  public static TelemetrySnapshot merge(
      TelemetrySnapshot previous, TelemetryUpdate update, long sequence, Instant timestamp) {
    Objects.requireNonNull(update, "update");
    TelemetrySnapshot base = previous != null ? previous : unknown(timestamp);
    return new TelemetrySnapshot(
        sequence,
        timestamp,
        pick(update.lat(), base.lat),
        pick(update.lon(), base.lon),
        pick(update.alt(), base.alt),
        pick(update.roll(), base.roll),
        pick(update.pitch(), base.pitch),
        pick(update.yaw(), base.yaw),
        pick(update.battery(), base.battery),
        pick(update.voltage(), base.voltage),
        pick(update.current(), base.current),
        pick(update.fixType(), base.fixType),
        pick(update.satellites(), base.satellites),
        pick(update.armed(), base.armed),
        pick(update.mode(), base.mode));
  }

  /**
   * Returns the snapshot age relative to {@code now}, never negative.
   *
   * @param now reference instant
   * @return elapsed time since capture
   */
  public Duration ageAt(Instant now) {
    Duration age = Duration.between(timestamp, now);
    return age.isNegative() ? Duration.ZERO : age;
  }

  private static TelemetrySnapshot unknown(Instant timestamp) {
    return new TelemetrySnapshot(
        0L, timestamp, null, null, null, null, null, null, null, null, null, null, null, null, null);
  }

  private static <T> T pick(T incoming, T previous) {
    return incoming != null ? incoming : previous;
  }
}
