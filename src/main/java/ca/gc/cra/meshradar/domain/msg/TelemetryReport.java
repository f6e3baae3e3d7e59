package ca.gc.cra.meshradar.domain.msg;

import ca.gc.cra.meshradar.domain.mesh.MessageKind;
import ca.gc.cra.meshradar.domain.mesh.TelemetrySnapshot;
import java.util.Objects;

/**
 * Device or environment telemetry.
 *
 * @param snapshot reported metrics
 * @param time measurement time in epoch seconds; {@code 0} when absent
 */
public record TelemetryReport(TelemetrySnapshot snapshot, long time) implements NormalizedRecord {
  public TelemetryReport {
    Objects.requireNonNull(snapshot, "snapshot");
  }

  @Override
  public MessageKind kind() {
    return MessageKind.TELEMETRY;
  }
}
