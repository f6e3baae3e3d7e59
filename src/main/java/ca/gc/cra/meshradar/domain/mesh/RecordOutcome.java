package ca.gc.cra.meshradar.domain.mesh;

/**
 * Result of recording a packet sighting.
 *
 * @param packetCreated the canonical packet was inserted by this call
 * @param observationCreated a new gateway observation was inserted by this call
 * @param enriched an opaque canonical packet gained its decoded fields
 */
public record RecordOutcome(boolean packetCreated, boolean observationCreated, boolean enriched) {

  /**
   * Whether the call was a pure duplicate.
   *
   * @return {@code true} when nothing was written
   */
  public boolean duplicate() {
    return !packetCreated && !observationCreated && !enriched;
  }
}
