package com.skyrelay.bridge.link.transport;

import com.fazecast.jSerialComm.SerialPort;
import com.skyrelay.bridge.link.LinkException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reads MAVLink from a serial device (USB flight controller, telemetry radio). */
public class SerialLinkTransport implements LinkTransport {
  private static final Logger log = LoggerFactory.getLogger(SerialLinkTransport.class);

  private final String device;
  private final SerialPort port;

  public SerialLinkTransport(String device, int baudRate, Duration readTimeout) throws IOException {
    if (!devicePresent(device)) {
      throw new LinkException("serial device missing: " + device);
    }
    SerialPort opened = SerialPort.getCommPort(device);
    opened.setComPortParameters(baudRate, 8, SerialPort.ONE_STOP_BIT, SerialPort.NO_PARITY);
    opened.setComPortTimeouts(
        SerialPort.TIMEOUT_READ_SEMI_BLOCKING, (int) Math.max(1L, readTimeout.toMillis()), 0);
    if (!opened.openPort()) {
      throw new LinkException("unable to open serial device " + device + " (error " + opened.getLastErrorCode() + ")");
    }
    this.device = device;
    this.port = opened;
    log.info("Serial device {} opened at {} baud", device, baudRate);
  }

  @Override
  public int read(byte[] buffer) throws IOException {
    int read = port.readBytes(buffer, buffer.length);
    if (read < 0) {
      throw new LinkException("serial read failed on " + device + " (error " + port.getLastErrorCode() + ")");
    }
    return read;
  }

  @Override
  public void close() {
    if (port.closePort()) {
      log.info("Serial device {} closed", device);
    }
  }

  private static boolean devicePresent(String device) {
    if (!device.startsWith("/")) {
      return true; // Windows COMx
    }
    try {
      return Files.isReadable(Path.of(device).toRealPath());
    } catch (IOException ex) {
      return false;
    }
  }
}
