package ca.gc.cra.meshradar.domain.mesh;

/**
 * Device and environment metrics reported by a node. Absent metrics are {@code null}.
 *
 * @param batteryLevel battery percentage (101 means powered)
 * @param voltage battery voltage
 * @param channelUtilization percent of airtime in use on the channel
 * @param airUtilTx percent of airtime used by this node's transmissions
 * @param uptimeSeconds seconds since boot
 * @param temperature ambient temperature in degrees Celsius
 * @param relativeHumidity relative humidity percentage
 * @param barometricPressure pressure in hPa
 */
public record TelemetrySnapshot(
    Integer batteryLevel,
    Float voltage,
    Float channelUtilization,
    Float airUtilTx,
    Long uptimeSeconds,
    Float temperature,
    Float relativeHumidity,
    Float barometricPressure) {

  /**
   * Whether the report carried at least one metric.
   *
   * @return {@code true} when any field is present
   */
  public boolean hasAnyMetric() {
    return batteryLevel != null
        || voltage != null
        || channelUtilization != null
        || airUtilTx != null
        || uptimeSeconds != null
        || temperature != null
        || relativeHumidity != null
        || barometricPressure != null;
  }
}
