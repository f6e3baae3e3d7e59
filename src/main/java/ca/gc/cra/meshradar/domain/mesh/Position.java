package ca.gc.cra.meshradar.domain.mesh;

/**
 * Geographic position in decimal degrees.
 *
 * @param latitude latitude in {@code [-90, 90]}
 * @param longitude longitude in {@code [-180, 180]}
 * @param altitude altitude in metres above sea level, or {@code null} when not reported
 */
public record Position(double latitude, double longitude, Integer altitude) {

  private static final double FIXED_POINT_SCALE = 1e-7;

  /**
   * Validates coordinate ranges.
   */
  public Position {
    if (Double.isNaN(latitude) || latitude < -90d || latitude > 90d) {
      throw new IllegalArgumentException("latitude out of range: " + latitude);
    }
    if (Double.isNaN(longitude) || longitude < -180d || longitude > 180d) {
      throw new IllegalArgumentException("longitude out of range: " + longitude);
    }
  }

  /**
   * Builds a position from the mesh fixed-point representation (degrees times 1e7).
   *
   * @param latitudeI fixed-point latitude
   * @param longitudeI fixed-point longitude
   * @param altitude altitude in metres or {@code null}
   * @return position in decimal degrees
   */
  public static Position fromFixedPoint(int latitudeI, int longitudeI, Integer altitude) {
    return new Position(latitudeI * FIXED_POINT_SCALE, longitudeI * FIXED_POINT_SCALE, altitude);
  }
}
