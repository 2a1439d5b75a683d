package com.skyrelay.bridge.model;

/**
 * JSON payload returned by {@code GET /api/telemetry} and pushed on the telemetry stream.
 *
 * <p>Unknown telemetry values are serialized as explicit {@code null}.
 *
 * @param lat latitude in degrees
 * @param lon longitude in degrees
 * @param alt altitude in metres
 * @param roll roll in degrees
 * @param pitch pitch in degrees
 * @param yaw yaw in degrees
 * @param battery remaining battery percentage
 * @param voltage battery voltage in volts
 * @param current battery current in amperes
 * @param fixType GPS fix type
 * @param satellites visible satellites
 * @param armed armed flag
 * @param mode flight mode name
 * @param sequence snapshot sequence number
 * @param timestamp snapshot capture time (ISO-8601)
 * @param ageMs snapshot age at render time
 * @param stale whether the age exceeds the configured staleness threshold
 * @param link link connection state at render time
 */
public record TelemetryResponse(
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
    String mode,
    long sequence,
    String timestamp,
    long ageMs,
    boolean stale,
    String link) {}
