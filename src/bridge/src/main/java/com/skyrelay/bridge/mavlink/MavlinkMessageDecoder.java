package com.skyrelay.bridge.mavlink;

import com.skyrelay.bridge.model.TelemetryUpdate;
import java.nio.ByteBuffer;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps verified MAVLink frames to partial telemetry updates.
 *
 * <p>Sentinel values the protocol uses for "not available" (for example {@code -1} battery remaining)
 * are left out of the update so they never overwrite a known value.
 */
public class MavlinkMessageDecoder {
  private static final int MAV_TYPE_GCS = 6;
  private static final int MAV_AUTOPILOT_INVALID = 8;
  private static final int MAV_MODE_FLAG_SAFETY_ARMED = 0x80;
  private static final int UINT16_UNKNOWN = 0xFFFF;
  private static final int SATELLITES_UNKNOWN = 255;

  private final boolean relativeAltitude;

  /**
   * Creates a decoder.
   *
   * @param altitudeReference {@code msl} for altitude above mean sea level, {@code relative} for
   *     altitude above home
   */
  public MavlinkMessageDecoder(String altitudeReference) {
    String normalized = altitudeReference == null ? "msl" : altitudeReference.trim().toLowerCase(Locale.ROOT);
    if (!normalized.equals("msl") && !normalized.equals("relative")) {
      throw new IllegalArgumentException("altitude reference must be 'msl' or 'relative': " + altitudeReference);
    }
    this.relativeAltitude = normalized.equals("relative");
  }

  /**
   * Decodes one frame.
   *
   * @param frame verified frame
   * @return update carrying the fields present in the frame, empty when it carries none
   */
  public Optional<TelemetryUpdate> decode(MavlinkFrame frame) {
    ByteBuffer payload = frame.payloadBuffer();
    TelemetryUpdate update = switch (frame.message()) {
      case HEARTBEAT -> heartbeat(payload);
      case SYS_STATUS -> sysStatus(payload);
      case GPS_RAW_INT -> gpsRaw(payload);
      case ATTITUDE -> attitude(payload);
      case GLOBAL_POSITION_INT -> globalPosition(payload);
      case BATTERY_STATUS -> batteryStatus(payload);
    };
    return update == null || update.isEmpty() ? Optional.empty() : Optional.of(update);
  }

  private TelemetryUpdate heartbeat(ByteBuffer payload) {
    long customMode = Integer.toUnsignedLong(payload.getInt(0));
    int type = payload.get(4) & 0xFF;
    int autopilot = payload.get(5) & 0xFF;
    int baseMode = payload.get(6) & 0xFF;
    // Ground stations and companion components also send heartbeats; only the vehicle's count.
    if (type == MAV_TYPE_GCS || autopilot == MAV_AUTOPILOT_INVALID) {
      return null;
    }
    return TelemetryUpdate.builder()
        .armed((baseMode & MAV_MODE_FLAG_SAFETY_ARMED) != 0)
        .mode(ArduPilotModes.name(autopilot, type, customMode))
        .build();
  }

  private TelemetryUpdate sysStatus(ByteBuffer payload) {
    int voltageMv = payload.getShort(14) & 0xFFFF;
    short currentCa = payload.getShort(16);
    byte remaining = payload.get(30);
    return TelemetryUpdate.builder()
        .voltage(voltageMv == UINT16_UNKNOWN ? null : voltageMv / 1000.0)
        .current(currentCa == -1 ? null : currentCa / 100.0)
        .battery(remaining == -1 ? null : (int) remaining)
        .build();
  }

  private TelemetryUpdate gpsRaw(ByteBuffer payload) {
    int fixType = payload.get(28) & 0xFF;
    int satellites = payload.get(29) & 0xFF;
    return TelemetryUpdate.builder()
        .fixType(fixType)
        .satellites(satellites == SATELLITES_UNKNOWN ? null : satellites)
        .build();
  }

  private TelemetryUpdate attitude(ByteBuffer payload) {
    return TelemetryUpdate.builder()
        .attitude(
            Math.toDegrees(payload.getFloat(4)),
            Math.toDegrees(payload.getFloat(8)),
            Math.toDegrees(payload.getFloat(12)))
        .build();
  }

  private TelemetryUpdate globalPosition(ByteBuffer payload) {
    int lat = payload.getInt(4);
    int lon = payload.getInt(8);
    int alt = relativeAltitude ? payload.getInt(16) : payload.getInt(12);
    return TelemetryUpdate.builder()
        .position(lat / 1e7, lon / 1e7, alt / 1000.0)
        .build();
  }

  private TelemetryUpdate batteryStatus(ByteBuffer payload) {
    byte remaining = payload.get(35);
    return TelemetryUpdate.builder()
        .battery(remaining == -1 ? null : (int) remaining)
        .build();
  }
}
