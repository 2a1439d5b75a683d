package com.skyrelay.bridge.link;

import java.util.Locale;

/**
 * Parsed telemetry link address.
 *
 * <p>Accepted forms: {@code udp:<bind-host>:<port>} (alias {@code udpin:}), {@code tcp:<host>:<port>},
 * {@code serial:<device>}, a bare device path ({@code /dev/ttyACM0}, {@code COM3}) and {@code sim:}.
 *
 * @param kind transport kind
 * @param host bind or remote host for network kinds
 * @param port port for network kinds
 * @param device device name for serial links
 */
public record LinkAddress(Kind kind, String host, int port, String device) {

  /** Transport kinds. */
  public enum Kind {
    UDP,
    TCP,
    SERIAL,
    SIMULATED
  }

  /**
   * Parses an address string.
   *
   * @param raw configured address
   * @return parsed address
   * @throws IllegalArgumentException when the address is malformed
   */
  public static LinkAddress parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("link address must not be blank");
    }
    String value = raw.trim();
    int colon = value.indexOf(':');
    String scheme = colon < 0 ? "" : value.substring(0, colon).toLowerCase(Locale.ROOT);
    String rest = colon < 0 ? value : value.substring(colon + 1);

    switch (scheme) {
      case "udp", "udpin" -> {
        return network(Kind.UDP, rest, raw);
      }
      case "tcp" -> {
        return network(Kind.TCP, rest, raw);
      }
      case "serial" -> {
        if (rest.isBlank()) {
          throw new IllegalArgumentException("serial link address needs a device: " + raw);
        }
        return new LinkAddress(Kind.SERIAL, null, 0, rest);
      }
      case "sim" -> {
        return new LinkAddress(Kind.SIMULATED, null, 0, null);
      }
      default -> {
        if (value.startsWith("/") || value.toUpperCase(Locale.ROOT).matches("COM\\d+")) {
          return new LinkAddress(Kind.SERIAL, null, 0, value);
        }
        throw new IllegalArgumentException("unsupported link address: " + raw);
      }
    }
  }

  private static LinkAddress network(Kind kind, String hostPort, String raw) {
    int colon = hostPort.lastIndexOf(':');
    if (colon <= 0 || colon == hostPort.length() - 1) {
      throw new IllegalArgumentException("expected <host>:<port> in link address: " + raw);
    }
    int port;
    try {
      port = Integer.parseInt(hostPort.substring(colon + 1));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("invalid port in link address: " + raw, ex);
    }
    if (port < 1 || port > 65_535) {
      throw new IllegalArgumentException("port out of range in link address: " + raw);
    }
    return new LinkAddress(kind, hostPort.substring(0, colon), port, null);
  }

  @Override
  public String toString() {
    return switch (kind) {
      case UDP -> "udp:" + host + ":" + port;
      case TCP -> "tcp:" + host + ":" + port;
      case SERIAL -> "serial:" + device;
      case SIMULATED -> "sim:";
    };
  }
}
