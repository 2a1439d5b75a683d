package com.skyrelay.bridge.model;

/**
 * Link diagnostics returned by {@code GET /api/telemetry/link}.
 *
 * @param state current link connection state
 * @param address configured link address
 * @param reconnectAttempts failed attempts since the last successful connect
 * @param lastError last connection failure, when any
 * @param lastConnectedAt last successful connect (ISO-8601), when any
 * @param snapshotAgeMs age of the stored snapshot, {@code null} before the first update
 * @param subscribers currently connected push subscribers
 * @param framesDecoded frames accepted since start-up
 * @param framesDiscarded malformed or unrecognized frames since start-up
 */
public record LinkStatusResponse(
    String state,
    String address,
    int reconnectAttempts,
    String lastError,
    String lastConnectedAt,
    Long snapshotAgeMs,
    int subscribers,
    long framesDecoded,
    long framesDiscarded) {}
