package com.skyrelay.bridge.link.transport;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.SocketTimeoutException;
import java.time.Duration;

/** Listens for MAVLink datagrams on a local UDP port. */
public class UdpLinkTransport implements LinkTransport {
  private final DatagramSocket socket;

  public UdpLinkTransport(String bindHost, int port, Duration readTimeout) throws IOException {
    DatagramSocket bound = new DatagramSocket(null);
    try {
      bound.setReuseAddress(true);
      bound.setSoTimeout((int) Math.max(1L, readTimeout.toMillis()));
      bound.bind(new InetSocketAddress(bindHost, port));
    } catch (IOException ex) {
      bound.close();
      throw ex;
    }
    this.socket = bound;
  }

  @Override
  public int read(byte[] buffer) throws IOException {
    DatagramPacket packet = new DatagramPacket(buffer, buffer.length);
    try {
      socket.receive(packet);
    } catch (SocketTimeoutException ex) {
      return 0;
    }
    return packet.getLength();
  }

  @Override
  public void close() {
    socket.close();
  }
}
