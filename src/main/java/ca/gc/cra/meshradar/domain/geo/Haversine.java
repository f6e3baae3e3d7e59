package ca.gc.cra.meshradar.domain.geo;

import ca.gc.cra.meshradar.domain.mesh.Position;

/**
 * Great-circle distance on a spherical Earth.
 *
 * @since 0.1.0
 */
public final class Haversine {
  /** Mean Earth radius in kilometres. */
  public static final double EARTH_RADIUS_KM = 6371.0d;

  private Haversine() {}

  /**
   * Computes the haversine distance between two positions. Altitude is ignored.
   *
   * @param a first position, or {@code null} when unknown
   * @param b second position, or {@code null} when unknown
   * @return distance in kilometres, or {@code null} when either position is unknown
   */
  public static Double distanceKm(Position a, Position b) {
    if (a == null || b == null) {
      return null;
    }
    double lat1 = Math.toRadians(a.latitude());
    double lat2 = Math.toRadians(b.latitude());
    double dLat = lat2 - lat1;
    double dLon = Math.toRadians(b.longitude() - a.longitude());
    double sinLat = Math.sin(dLat / 2d);
    double sinLon = Math.sin(dLon / 2d);
    double h = sinLat * sinLat + Math.cos(lat1) * Math.cos(lat2) * sinLon * sinLon;
    double c = 2d * Math.atan2(Math.sqrt(h), Math.sqrt(Math.max(0d, 1d - h)));
    return EARTH_RADIUS_KM * c;
  }
}
