package com.skyrelay.bridge.mavlink;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Streaming MAVLink v1/v2 frame parser.
 *
 * <p>Bytes may arrive split across reads in any way; incomplete frames are kept until the rest
 * arrives. Garbage between frames, frames failing the CRC check and frames of messages outside
 * {@link MavlinkMessage} are discarded and counted. After a CRC failure the parser resynchronizes on
 * the next start marker. Not thread-safe.
 */
public final class MavlinkFrameParser {
  static final int STX_V1 = 0xFE;
  static final int STX_V2 = 0xFD;
  static final int HEADER_V1 = 6;
  static final int HEADER_V2 = 10;
  static final int CHECKSUM_LENGTH = 2;
  static final int SIGNATURE_LENGTH = 13;
  static final int FLAG_SIGNED = 0x01;

  private byte[] buffer = new byte[1024];
  private int length;
  private long discardedFrames;

  /**
   * Appends received bytes and extracts every complete frame.
   *
   * @param data received bytes
   * @param offset first byte to consume
   * @param count number of bytes to consume
   * @return verified frames in arrival order
   */
  public List<MavlinkFrame> feed(byte[] data, int offset, int count) {
    append(data, offset, count);
    List<MavlinkFrame> frames = new ArrayList<>();
    int pos = 0;
    while (pos < length) {
      int start = nextStart(pos);
      if (start < 0) {
        discardedFrames++;
        pos = length;
        break;
      }
      if (start > pos) {
        discardedFrames++;
        pos = start;
      }

      boolean v2 = (buffer[pos] & 0xFF) == STX_V2;
      int headerLength = v2 ? HEADER_V2 : HEADER_V1;
      if (length - pos < headerLength) {
        break;
      }
      int payloadLength = buffer[pos + 1] & 0xFF;
      int incompatFlags = v2 ? buffer[pos + 2] & 0xFF : 0;
      int signatureLength = (incompatFlags & FLAG_SIGNED) != 0 ? SIGNATURE_LENGTH : 0;
      int frameLength = headerLength + payloadLength + CHECKSUM_LENGTH + signatureLength;
      if (length - pos < frameLength) {
        break;
      }

      int messageId = v2
          ? (buffer[pos + 7] & 0xFF) | (buffer[pos + 8] & 0xFF) << 8 | (buffer[pos + 9] & 0xFF) << 16
          : buffer[pos + 5] & 0xFF;
      Optional<MavlinkMessage> message = MavlinkMessage.byId(messageId);
      if (message.isEmpty()) {
        // Unknown CRC_EXTRA: the frame cannot be verified, skip it whole.
        discardedFrames++;
        pos += frameLength;
        continue;
      }

      int checksumAt = pos + headerLength + payloadLength;
      int expected = (buffer[checksumAt] & 0xFF) | (buffer[checksumAt + 1] & 0xFF) << 8;
      int actual = MavlinkCrc.compute(
          buffer, pos + 1, headerLength - 1 + payloadLength, message.get().crcExtra());
      if (expected != actual || (incompatFlags & ~FLAG_SIGNED) != 0
          || (!v2 && payloadLength != message.get().payloadLength())) {
        discardedFrames++;
        pos += 1;
        continue;
      }

      frames.add(toFrame(v2, pos, headerLength, payloadLength, message.get()));
      pos += frameLength;
    }
    compact(pos);
    return frames;
  }

  /**
   * Returns the number of discarded frames and garbage runs since creation.
   *
   * @return cumulative discard count
   */
  public long discardedFrames() {
    return discardedFrames;
  }

  private MavlinkFrame toFrame(
      boolean v2, int pos, int headerLength, int payloadLength, MavlinkMessage message) {
    // v2 senders strip trailing zero bytes; restore the full layout.
    byte[] payload = new byte[Math.max(payloadLength, message.payloadLength())];
    System.arraycopy(buffer, pos + headerLength, payload, 0, payloadLength);
    int sequence = buffer[pos + (v2 ? 4 : 2)] & 0xFF;
    int systemId = buffer[pos + (v2 ? 5 : 3)] & 0xFF;
    int componentId = buffer[pos + (v2 ? 6 : 4)] & 0xFF;
    return new MavlinkFrame(v2 ? 2 : 1, sequence, systemId, componentId, message, payload);
  }

  private int nextStart(int from) {
    for (int i = from; i < length; i++) {
      int value = buffer[i] & 0xFF;
      if (value == STX_V1 || value == STX_V2) {
        return i;
      }
    }
    return -1;
  }

  private void append(byte[] data, int offset, int count) {
    if (length + count > buffer.length) {
      buffer = Arrays.copyOf(buffer, Math.max(buffer.length * 2, length + count));
    }
    System.arraycopy(data, offset, buffer, length, count);
    length += count;
  }

  private void compact(int consumed) {
    if (consumed == 0) {
      return;
    }
    int remaining = length - consumed;
    System.arraycopy(buffer, consumed, buffer, 0, remaining);
    length = remaining;
  }
}
