package ca.gc.cra.meshradar.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = Map.of("brokerUrl", "tcp://default:1883", "metricsExporter", "otlp");
    Map<String, String> yaml = Map.of("brokerUrl", "tcp://yaml:1883", "decodeWorkers", "2");
    Map<String, String> cli = Map.of("brokerUrl", "tcp://cli:1883", "decodeWorkers", "8");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "ingest",
        Optional.of(yaml),
        cli,
        defaults,
        warnings::add);

    assertEquals("tcp://cli:1883", merged.get("brokerUrl"));
    assertEquals("8", merged.get("decodeWorkers"));
    assertEquals("otlp", merged.get("metricsExporter"));
    assertEquals(2, warnings.size());
    assertTrue(warnings.contains("CLI overrides YAML for key: brokerUrl"));
  }

  @Test
  void yamlOverridesDefaultsSilently() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "ingest", Optional.of(Map.of("store", "MEMORY")), Map.of(), Map.of("store", "JDBC", "jdbcUrl", ""),
        warnings::add);

    assertEquals("MEMORY", merged.get("store"));
    assertTrue(warnings.isEmpty());
  }

  @Test
  void kafkaSourceRequiresBootstrap() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "ingest",
            Optional.empty(),
            Map.of("source", "kafka"),
            Map.of("kafkaBootstrap", ""),
            msg -> {}));
  }

  @Test
  void jdbcStoreRequiresUrl() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "ingest", Optional.empty(), Map.of("store", "JDBC"), Map.of(), msg -> {}));
    assertEquals("jdbcUrl is required when store=JDBC", ex.getMessage());
  }

  @Test
  void queryModesRequireUrl() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "top", Optional.empty(), Map.of(), DefaultsForMode.asFlatMap("top"), msg -> {}));
    assertEquals("jdbcUrl is required for top", ex.getMessage());
  }
}
