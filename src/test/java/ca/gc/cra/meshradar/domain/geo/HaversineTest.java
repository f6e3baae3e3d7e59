package ca.gc.cra.meshradar.domain.geo;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import ca.gc.cra.meshradar.domain.mesh.Position;
import org.junit.jupiter.api.Test;

class HaversineTest {
  private static final Position OTTAWA = new Position(45.4215, -75.6972, null);
  private static final Position TORONTO = new Position(43.6532, -79.3832, 76);

  @Test
  void samePointIsZero() {
    assertEquals(0.0, Haversine.distanceKm(OTTAWA, OTTAWA), 1e-9);
  }

  @Test
  void distanceIsSymmetric() {
    assertEquals(Haversine.distanceKm(OTTAWA, TORONTO), Haversine.distanceKm(TORONTO, OTTAWA), 1e-9);
  }

  @Test
  void knownCityPairIsWithinTolerance() {
    assertEquals(352.0, Haversine.distanceKm(OTTAWA, TORONTO), 3.0);
  }

  @Test
  void unknownPositionYieldsNull() {
    assertNull(Haversine.distanceKm(null, TORONTO));
    assertNull(Haversine.distanceKm(OTTAWA, null));
  }

  @Test
  void antipodesAreHalfTheCircumference() {
    Position north = new Position(90.0, 0.0, null);
    Position south = new Position(-90.0, 0.0, null);

    assertEquals(Math.PI * Haversine.EARTH_RADIUS_KM, Haversine.distanceKm(north, south), 1e-6);
  }
}
