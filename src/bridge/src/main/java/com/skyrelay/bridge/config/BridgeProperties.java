package com.skyrelay.bridge.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration container for the telemetry bridge.
 *
 * <p>Values are bound from {@code bridge.*} in {@code application.yml} and environment variables.
 */
@ConfigurationProperties(prefix = "bridge")
public class BridgeProperties {
  private final Link link = new Link();
  private final Stream stream = new Stream();
  private final Snapshot snapshot = new Snapshot();
  private final Api api = new Api();

  public Link getLink() {
    return link;
  }

  public Stream getStream() {
    return stream;
  }

  public Snapshot getSnapshot() {
    return snapshot;
  }

  public Api getApi() {
    return api;
  }

  /** Flight-controller link: address, transport tuning and reconnect backoff. */
  public static class Link {
    private boolean enabled = true;
    private String address = "udp:0.0.0.0:14550";
    private int baudRate = 57600;
    private Duration readTimeout = Duration.ofSeconds(1);
    private Duration silenceTimeout = Duration.ofSeconds(5);
    private Duration initialBackoff = Duration.ofMillis(500);
    private Duration maxBackoff = Duration.ofSeconds(30);
    private double backoffMultiplier = 2.0;
    private String altitudeReference = "msl";
    private Duration simulationInterval = Duration.ofMillis(500);

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getAddress() {
      return address;
    }

    public void setAddress(String address) {
      this.address = address;
    }

    public int getBaudRate() {
      return baudRate;
    }

    public void setBaudRate(int baudRate) {
      this.baudRate = baudRate;
    }

    public Duration getReadTimeout() {
      return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
      this.readTimeout = readTimeout;
    }

    public Duration getSilenceTimeout() {
      return silenceTimeout;
    }

    public void setSilenceTimeout(Duration silenceTimeout) {
      this.silenceTimeout = silenceTimeout;
    }

    public Duration getInitialBackoff() {
      return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
      this.initialBackoff = initialBackoff;
    }

    public Duration getMaxBackoff() {
      return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
      this.maxBackoff = maxBackoff;
    }

    public double getBackoffMultiplier() {
      return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
      this.backoffMultiplier = backoffMultiplier;
    }

    public String getAltitudeReference() {
      return altitudeReference;
    }

    public void setAltitudeReference(String altitudeReference) {
      this.altitudeReference = altitudeReference;
    }

    public Duration getSimulationInterval() {
      return simulationInterval;
    }

    public void setSimulationInterval(Duration simulationInterval) {
      this.simulationInterval = simulationInterval;
    }
  }

  /** Push stream delivery: per-subscriber queue bound and keep-alive cadence. */
  public static class Stream {
    private int queueCapacity = 64;
    private Duration heartbeatInterval = Duration.ofSeconds(15);

    public int getQueueCapacity() {
      return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
    }

    public Duration getHeartbeatInterval() {
      return heartbeatInterval;
    }

    public void setHeartbeatInterval(Duration heartbeatInterval) {
      this.heartbeatInterval = heartbeatInterval;
    }
  }

  /** Snapshot reporting. */
  public static class Snapshot {
    private Duration staleAfter = Duration.ofSeconds(5);

    public Duration getStaleAfter() {
      return staleAfter;
    }

    public void setStaleAfter(Duration staleAfter) {
      this.staleAfter = staleAfter;
    }
  }

  /** API-level behavior configuration. */
  public static class Api {
    private final Cors cors = new Cors();

    public Cors getCors() {
      return cors;
    }
  }

  /** CORS allowlist used by {@link WebConfig}. */
  public static class Cors {
    private List<String> allowedOrigins = new ArrayList<>();

    public List<String> getAllowedOrigins() {
      return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
      this.allowedOrigins = allowedOrigins == null ? new ArrayList<>() : new ArrayList<>(allowedOrigins);
    }
  }
}
