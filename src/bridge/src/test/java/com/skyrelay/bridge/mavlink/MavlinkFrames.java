package com.skyrelay.bridge.mavlink;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.List;

/** Builds wire frames and payloads for parser, decoder and link tests. */
public final class MavlinkFrames {
  private MavlinkFrames() {}

  public static byte[] v1(MavlinkMessage message, int sequence, byte[] payload) {
    int headerLength = MavlinkFrameParser.HEADER_V1;
    byte[] frame = new byte[headerLength + payload.length + 2];
    frame[0] = (byte) MavlinkFrameParser.STX_V1;
    frame[1] = (byte) payload.length;
    frame[2] = (byte) sequence;
    frame[3] = 1;
    frame[4] = 1;
    frame[5] = (byte) message.id();
    System.arraycopy(payload, 0, frame, headerLength, payload.length);
    writeChecksum(frame, headerLength, payload.length, message.crcExtra());
    return frame;
  }

  public static byte[] v2(MavlinkMessage message, int sequence, byte[] payload) {
    return v2(message.id(), message.crcExtra(), sequence, payload, false);
  }

  public static byte[] v2Signed(MavlinkMessage message, int sequence, byte[] payload) {
    return v2(message.id(), message.crcExtra(), sequence, payload, true);
  }

  /** Frame with an arbitrary message id, used for ids the bridge does not know. */
  public static byte[] v2(int messageId, int crcExtra, int sequence, byte[] payload, boolean signed) {
    int headerLength = MavlinkFrameParser.HEADER_V2;
    int signatureLength = signed ? MavlinkFrameParser.SIGNATURE_LENGTH : 0;
    byte[] frame = new byte[headerLength + payload.length + 2 + signatureLength];
    frame[0] = (byte) MavlinkFrameParser.STX_V2;
    frame[1] = (byte) payload.length;
    frame[2] = (byte) (signed ? MavlinkFrameParser.FLAG_SIGNED : 0);
    frame[3] = 0;
    frame[4] = (byte) sequence;
    frame[5] = 1;
    frame[6] = 1;
    frame[7] = (byte) messageId;
    frame[8] = (byte) (messageId >> 8);
    frame[9] = (byte) (messageId >> 16);
    System.arraycopy(payload, 0, frame, headerLength, payload.length);
    writeChecksum(frame, headerLength, payload.length, crcExtra);
    for (int i = 0; i < signatureLength; i++) {
      frame[headerLength + payload.length + 2 + i] = (byte) (0xA0 + i);
    }
    return frame;
  }

  /** Drops trailing zero bytes the way v2 senders do. */
  public static byte[] truncate(byte[] payload) {
    int end = payload.length;
    while (end > 1 && payload[end - 1] == 0) {
      end--;
    }
    return Arrays.copyOf(payload, end);
  }

  public static byte[] concat(byte[]... parts) {
    int total = 0;
    for (byte[] part : parts) {
      total += part.length;
    }
    byte[] out = new byte[total];
    int pos = 0;
    for (byte[] part : parts) {
      System.arraycopy(part, 0, out, pos, part.length);
      pos += part.length;
    }
    return out;
  }

  public static byte[] heartbeat(long customMode, int type, int autopilot, int baseMode) {
    ByteBuffer buffer = payload(MavlinkMessage.HEARTBEAT);
    buffer.putInt(0, (int) customMode);
    buffer.put(4, (byte) type);
    buffer.put(5, (byte) autopilot);
    buffer.put(6, (byte) baseMode);
    buffer.put(7, (byte) 4);
    buffer.put(8, (byte) 3);
    return buffer.array();
  }

  public static byte[] sysStatus(int voltageMv, int currentCa, int remaining) {
    ByteBuffer buffer = payload(MavlinkMessage.SYS_STATUS);
    buffer.putShort(14, (short) voltageMv);
    buffer.putShort(16, (short) currentCa);
    buffer.put(30, (byte) remaining);
    return buffer.array();
  }

  public static byte[] gpsRaw(int fixType, int satellites) {
    ByteBuffer buffer = payload(MavlinkMessage.GPS_RAW_INT);
    buffer.put(28, (byte) fixType);
    buffer.put(29, (byte) satellites);
    return buffer.array();
  }

  public static byte[] attitude(float roll, float pitch, float yaw) {
    ByteBuffer buffer = payload(MavlinkMessage.ATTITUDE);
    buffer.putInt(0, 1000);
    buffer.putFloat(4, roll);
    buffer.putFloat(8, pitch);
    buffer.putFloat(12, yaw);
    return buffer.array();
  }

  public static byte[] globalPosition(int latE7, int lonE7, int altMm, int relativeAltMm) {
    ByteBuffer buffer = payload(MavlinkMessage.GLOBAL_POSITION_INT);
    buffer.putInt(0, 1000);
    buffer.putInt(4, latE7);
    buffer.putInt(8, lonE7);
    buffer.putInt(12, altMm);
    buffer.putInt(16, relativeAltMm);
    return buffer.array();
  }

  public static byte[] batteryStatus(int remaining) {
    ByteBuffer buffer = payload(MavlinkMessage.BATTERY_STATUS);
    buffer.put(35, (byte) remaining);
    return buffer.array();
  }

  /** Parses a single frame, failing when the bytes do not hold exactly one. */
  public static MavlinkFrame parseOne(byte[] frame) {
    MavlinkFrameParser parser = new MavlinkFrameParser();
    List<MavlinkFrame> frames = parser.feed(frame, 0, frame.length);
    if (frames.size() != 1) {
      throw new IllegalArgumentException("expected one frame, parsed " + frames.size());
    }
    return frames.get(0);
  }

  private static ByteBuffer payload(MavlinkMessage message) {
    return ByteBuffer.allocate(message.payloadLength()).order(ByteOrder.LITTLE_ENDIAN);
  }

  private static void writeChecksum(byte[] frame, int headerLength, int payloadLength, int crcExtra) {
    int crc = MavlinkCrc.compute(frame, 1, headerLength - 1 + payloadLength, crcExtra);
    frame[headerLength + payloadLength] = (byte) crc;
    frame[headerLength + payloadLength + 1] = (byte) (crc >> 8);
  }
}
