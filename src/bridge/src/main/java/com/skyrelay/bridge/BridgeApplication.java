package com.skyrelay.bridge;

import com.skyrelay.bridge.config.BridgeProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main Spring Boot entrypoint for the SkyRelay telemetry bridge.
 *
 * <p>The application reads MAVLink telemetry from one flight-controller link and serves the latest
 * state through a pull endpoint and a Server-Sent Events push stream.
 */
@SpringBootApplication
@EnableConfigurationProperties(BridgeProperties.class)
public class BridgeApplication {
  /**
   * Starts the bridge. Start-up aborts when the HTTP listening socket cannot be bound.
   *
   * @param args standard Spring Boot startup arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(BridgeApplication.class, args);
  }
}
