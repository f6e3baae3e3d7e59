package ca.gc.cra.meshradar.infrastructure.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class ExponentialBackoffTest {

  @Test
  void doublesUntilCeilingThenResets() {
    ExponentialBackoff backoff = new ExponentialBackoff(100, 500);

    assertEquals(100, backoff.nextDelayMillis());
    assertEquals(200, backoff.nextDelayMillis());
    assertEquals(400, backoff.nextDelayMillis());
    assertEquals(500, backoff.nextDelayMillis());
    assertEquals(500, backoff.nextDelayMillis());

    backoff.reset();
    assertEquals(100, backoff.nextDelayMillis());
  }

  @Test
  void rejectsInvalidBounds() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoff(0, 100));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoff(200, 100));
  }
}
