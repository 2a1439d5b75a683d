package com.skyrelay.bridge.mavlink;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * One CRC-verified MAVLink frame.
 *
 * @param version protocol version (1 or 2)
 * @param sequence link sequence byte
 * @param systemId sending system
 * @param componentId sending component
 * @param message message definition
 * @param payload payload bytes, zero-extended to the full message length
 */
public record MavlinkFrame(
    int version, int sequence, int systemId, int componentId, MavlinkMessage message, byte[] payload) {

  /**
   * Returns a little-endian read-only view of the payload.
   *
   * @return payload buffer positioned at zero
   */
  public ByteBuffer payloadBuffer() {
    return ByteBuffer.wrap(payload).asReadOnlyBuffer().order(ByteOrder.LITTLE_ENDIAN);
  }
}
