package com.skyrelay.bridge.mavlink;

import java.util.Map;

/** ArduPilot {@code custom_mode} names per vehicle family. */
final class ArduPilotModes {
  static final int AUTOPILOT_ARDUPILOTMEGA = 3;

  private static final Map<Integer, String> COPTER = Map.ofEntries(
      Map.entry(0, "STABILIZE"),
      Map.entry(1, "ACRO"),
      Map.entry(2, "ALT_HOLD"),
      Map.entry(3, "AUTO"),
      Map.entry(4, "GUIDED"),
      Map.entry(5, "LOITER"),
      Map.entry(6, "RTL"),
      Map.entry(7, "CIRCLE"),
      Map.entry(9, "LAND"),
      Map.entry(11, "DRIFT"),
      Map.entry(13, "SPORT"),
      Map.entry(14, "FLIP"),
      Map.entry(15, "AUTOTUNE"),
      Map.entry(16, "POSHOLD"),
      Map.entry(17, "BRAKE"),
      Map.entry(18, "THROW"),
      Map.entry(19, "AVOID_ADSB"),
      Map.entry(20, "GUIDED_NOGPS"),
      Map.entry(21, "SMART_RTL"),
      Map.entry(22, "FLOWHOLD"),
      Map.entry(23, "FOLLOW"),
      Map.entry(24, "ZIGZAG"),
      Map.entry(25, "SYSTEMID"),
      Map.entry(26, "AUTOROTATE"),
      Map.entry(27, "AUTO_RTL"));

  private static final Map<Integer, String> PLANE = Map.ofEntries(
      Map.entry(0, "MANUAL"),
      Map.entry(1, "CIRCLE"),
      Map.entry(2, "STABILIZE"),
      Map.entry(3, "TRAINING"),
      Map.entry(4, "ACRO"),
      Map.entry(5, "FBWA"),
      Map.entry(6, "FBWB"),
      Map.entry(7, "CRUISE"),
      Map.entry(8, "AUTOTUNE"),
      Map.entry(10, "AUTO"),
      Map.entry(11, "RTL"),
      Map.entry(12, "LOITER"),
      Map.entry(13, "TAKEOFF"),
      Map.entry(14, "AVOID_ADSB"),
      Map.entry(15, "GUIDED"),
      Map.entry(17, "QSTABILIZE"),
      Map.entry(18, "QHOVER"),
      Map.entry(19, "QLOITER"),
      Map.entry(20, "QLAND"),
      Map.entry(21, "QRTL"),
      Map.entry(22, "QAUTOTUNE"),
      Map.entry(23, "QACRO"),
      Map.entry(24, "THERMAL"));

  private static final Map<Integer, String> ROVER = Map.ofEntries(
      Map.entry(0, "MANUAL"),
      Map.entry(1, "ACRO"),
      Map.entry(3, "STEERING"),
      Map.entry(4, "HOLD"),
      Map.entry(5, "LOITER"),
      Map.entry(6, "FOLLOW"),
      Map.entry(7, "SIMPLE"),
      Map.entry(10, "AUTO"),
      Map.entry(11, "RTL"),
      Map.entry(12, "SMART_RTL"),
      Map.entry(15, "GUIDED"));

  private ArduPilotModes() {}

  /**
   * Resolves a mode name from a vehicle heartbeat.
   *
   * @param autopilot MAV_AUTOPILOT value
   * @param vehicleType MAV_TYPE value
   * @param customMode autopilot-specific mode number
   * @return mode name, or {@code MODE_<n>} when the mapping is unknown
   */
  static String name(int autopilot, int vehicleType, long customMode) {
    Map<Integer, String> table = autopilot == AUTOPILOT_ARDUPILOTMEGA ? tableFor(vehicleType) : null;
    String name = table == null ? null : table.get((int) customMode);
    return name != null ? name : "MODE_" + customMode;
  }

  private static Map<Integer, String> tableFor(int vehicleType) {
    return switch (vehicleType) {
      case 1 -> PLANE;
      case 2, 3, 4, 13, 14, 15 -> COPTER;
      case 10, 11 -> ROVER;
      default -> null;
    };
  }
}
