package com.skyrelay.bridge.link.transport;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;

/** Connects to a MAVLink TCP endpoint (SITL, telemetry radio bridges). */
public class TcpLinkTransport implements LinkTransport {
  private static final int CONNECT_TIMEOUT_MS = 5_000;

  private final Socket socket;
  private final InputStream input;

  public TcpLinkTransport(String host, int port, Duration readTimeout) throws IOException {
    Socket connected = new Socket();
    try {
      connected.setTcpNoDelay(true);
      connected.setSoTimeout((int) Math.max(1L, readTimeout.toMillis()));
      connected.connect(new InetSocketAddress(host, port), CONNECT_TIMEOUT_MS);
      this.input = connected.getInputStream();
    } catch (IOException ex) {
      connected.close();
      throw ex;
    }
    this.socket = connected;
  }

  @Override
  public int read(byte[] buffer) throws IOException {
    try {
      return input.read(buffer);
    } catch (SocketTimeoutException ex) {
      return 0;
    }
  }

  @Override
  public void close() throws IOException {
    socket.close();
  }
}
