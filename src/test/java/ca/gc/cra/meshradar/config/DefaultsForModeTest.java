package ca.gc.cra.meshradar.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void ingestDefaultsMirrorIngestConfig() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("ingest");
    IngestConfig ingest = IngestConfig.defaults();

    assertEquals("MQTT", defaults.get("source"));
    assertEquals(ingest.brokerUrl(), defaults.get("brokerUrl"));
    assertEquals(ingest.topicLayout(), defaults.get("topicLayout"));
    assertEquals(Integer.toString(ingest.ingressQueueCapacity()), defaults.get("ingressQueueCapacity"));
    assertEquals("MEMORY", defaults.get("store"));
    assertEquals("otlp", defaults.get("metricsExporter"));
    assertEquals("false", defaults.get("dryRun"));
  }

  @Test
  void ingestDefaultsParseBackToDefaultConfig() {
    assertEquals(IngestConfig.defaults(), IngestConfig.fromMap(DefaultsForMode.asFlatMap("ingest")));
  }

  @Test
  void queryModesDefaultToJdbcStore() {
    Map<String, String> top = DefaultsForMode.asFlatMap("top");
    Map<String, String> graph = DefaultsForMode.asFlatMap(" Graph ");

    assertEquals("JDBC", top.get("store"));
    assertEquals("24", top.get("since"));
    assertEquals("20", top.get("limit"));
    assertEquals("1000", graph.get("limit"));
    assertFalse(graph.containsKey("brokerUrl"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
