package com.skyrelay.bridge.mavlink;

/** CRC-16/MCRF4XX (X.25) checksum used by MAVLink frames. */
public final class MavlinkCrc {
  private static final int SEED = 0xFFFF;

  private MavlinkCrc() {}

  public static int seed() {
    return SEED;
  }

  public static int accumulate(int crc, int value) {
    int tmp = (value & 0xFF) ^ (crc & 0xFF);
    tmp = (tmp ^ (tmp << 4)) & 0xFF;
    return ((crc >> 8) & 0xFF) ^ (tmp << 8) ^ (tmp << 3) ^ ((tmp >> 4) & 0x0F);
  }

  /**
   * Computes the frame checksum over {@code length} bytes followed by the message CRC_EXTRA byte.
   *
   * @param data frame bytes
   * @param offset first byte after the start marker
   * @param length number of header and payload bytes covered
   * @param crcExtra per-message seed byte
   * @return 16-bit checksum
   */
  public static int compute(byte[] data, int offset, int length, int crcExtra) {
    int crc = SEED;
    for (int i = offset; i < offset + length; i++) {
      crc = accumulate(crc, data[i]);
    }
    return accumulate(crc, crcExtra) & 0xFFFF;
  }
}
