package com.skyrelay.bridge.mavlink;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * MAVLink common-dialect messages the bridge understands.
 *
 * <p>Each entry carries the message id, the CRC_EXTRA seed and the full (v1) payload length.
 */
public enum MavlinkMessage {
  HEARTBEAT(0, 50, 9),
  SYS_STATUS(1, 124, 31),
  GPS_RAW_INT(24, 24, 30),
  ATTITUDE(30, 39, 28),
  GLOBAL_POSITION_INT(33, 104, 28),
  BATTERY_STATUS(147, 154, 36);

  private static final Map<Integer, MavlinkMessage> BY_ID = Stream.of(values())
      .collect(Collectors.toUnmodifiableMap(MavlinkMessage::id, Function.identity()));

  private final int id;
  private final int crcExtra;
  private final int payloadLength;

  MavlinkMessage(int id, int crcExtra, int payloadLength) {
    this.id = id;
    this.crcExtra = crcExtra;
    this.payloadLength = payloadLength;
  }

  public int id() {
    return id;
  }

  public int crcExtra() {
    return crcExtra;
  }

  public int payloadLength() {
    return payloadLength;
  }

  public static Optional<MavlinkMessage> byId(int id) {
    return Optional.ofNullable(BY_ID.get(id));
  }
}
