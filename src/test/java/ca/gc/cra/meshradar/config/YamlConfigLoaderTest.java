package ca.gc.cra.meshradar.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndModeSections() throws IOException {
    Path yaml = tempDir.resolve("meshradar.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
          jdbcUrl: jdbc:h2:./data/mesh
        ingest:
          brokerUrl: tcp://broker.local:1883
          decodeWorkers: 4
        top:
          limit: 5
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, "ingest");

    assertTrue(result.isPresent());
    Map<String, String> map = result.orElseThrow();
    assertEquals("none", map.get("metricsExporter"));
    assertEquals("jdbc:h2:./data/mesh", map.get("jdbcUrl"));
    assertEquals("tcp://broker.local:1883", map.get("brokerUrl"));
    assertEquals("4", map.get("decodeWorkers"));
    assertFalse(map.containsKey("limit"));
  }

  @Test
  void modeSectionOverridesCommon() throws IOException {
    Path yaml = tempDir.resolve("override.yaml");
    Files.writeString(yaml, """
        common:
          store: MEMORY
        Ingest:
          store: JDBC
        """);

    assertEquals("JDBC", YamlConfigLoader.load(yaml, "ingest").orElseThrow().get("store"));
  }

  @Test
  void listsBecomeCommaSeparatedValues() throws IOException {
    Path yaml = tempDir.resolve("lists.yaml");
    Files.writeString(yaml, """
        ingest:
          topics:
            - msh/US/CA/#
            - msh/US/WA/#
          channelKeys: []
          ignoredSenders: ~
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "ingest").orElseThrow();
    assertEquals("msh/US/CA/#,msh/US/WA/#", map.get("topics"));
    assertEquals("", map.get("channelKeys"));
    assertEquals("", map.get("ignoredSenders"));
  }

  @Test
  void nestedMapsAreFlattened() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        graph:
          output:
            format: text
        """);

    assertEquals("text", YamlConfigLoader.load(yaml, "graph").orElseThrow().get("output.format"));
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertEquals(Map.of(), YamlConfigLoader.load(yaml, "ingest").orElseThrow());
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertFalse(YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "ingest").isPresent());
  }

  @Test
  void invalidRootStructureThrows() throws IOException {
    Path yaml = tempDir.resolve("invalid.yaml");
    Files.writeString(yaml, """
        - ingest:
            brokerUrl: tcp://x:1883
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "ingest"));
  }

  @Test
  void listEntriesMayNotContainCommas() throws IOException {
    Path yaml = tempDir.resolve("comma.yaml");
    Files.writeString(yaml, """
        ingest:
          topics: ["a,b"]
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "ingest"));
  }
}
