package com.skyrelay.bridge.model;

/**
 * Partial telemetry carried by one decoded link message.
 *
 * <p>A {@code null} component means the message did not carry that field. Merging an update into a
 * snapshot only overwrites the non-null components.
 */
public record TelemetryUpdate(
    Double lat,
    Double lon,
    Double alt,
    Double roll,
    Double pitch,
    Double yaw,
    Integer battery,
    Double voltage,
    Double current,
    Integer fixType,
    Integer satellites,
    Boolean armed,
    String mode) {

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns whether the update carries no field at all.
   *
   * @return {@code true} when merging it would not change any field
   */
  public boolean isEmpty() {
    return lat == null
        && lon == null
        && alt == null
        && roll == null
        && pitch == null
        && yaw == null
        && battery == null
        && voltage == null
        && current == null
        && fixType == null
        && satellites == null
        && armed == null
        && mode == null;
  }

  /** Fluent builder; unset fields stay absent. */
  public static final class Builder {
    private Double lat;
    private Double lon;
    private Double alt;
    private Double roll;
    private Double pitch;
    private Double yaw;
    private Integer battery;
    private Double voltage;
    private Double current;
    private Integer fixType;
    private Integer satellites;
    private Boolean armed;
    private String mode;

    private Builder() {}

    public Builder position(double lat, double lon, double alt) {
      this.lat = lat;
      this.lon = lon;
      this.alt = alt;
      return this;
    }

    public Builder lat(Double lat) {
      this.lat = lat;
      return this;
    }

    public Builder lon(Double lon) {
      this.lon = lon;
      return this;
    }

    public Builder alt(Double alt) {
      this.alt = alt;
      return this;
    }

    public Builder attitude(double roll, double pitch, double yaw) {
      this.roll = roll;
      this.pitch = pitch;
      this.yaw = yaw;
      return this;
    }

    public Builder battery(Integer battery) {
      this.battery = battery;
      return this;
    }

    public Builder voltage(Double voltage) {
      this.voltage = voltage;
      return this;
    }

    public Builder current(Double current) {
      this.current = current;
      return this;
    }

    public Builder fixType(Integer fixType) {
      this.fixType = fixType;
      return this;
    }

    public Builder satellites(Integer satellites) {
      this.satellites = satellites;
      return this;
    }

    public Builder armed(Boolean armed) {
      this.armed = armed;
      return this;
    }

    public Builder mode(String mode) {
      this.mode = mode;
      return this;
    }

    public TelemetryUpdate build() {
      return new TelemetryUpdate(
          lat, lon, alt, roll, pitch, yaw, battery, voltage, current, fixType, satellites, armed, mode);
    }
  }
}
