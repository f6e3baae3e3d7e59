package ca.gc.cra.meshradar.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"brokerUrl=tcp://localhost:1883", "topics=msh/#"});
    assertEquals("tcp://localhost:1883", map.get("brokerUrl"));
    assertEquals("msh/#", map.get("topics"));
  }

  @Test
  void stripsLeadingDashesFromKeys() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"--store=jdbc", "-limit=5"});
    assertEquals("jdbc", map.get("store"));
    assertEquals("5", map.get("limit"));
  }

  @Test
  void keepsValuesContainingEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"otelResourceAttributes=env=dev,team=mesh"});
    assertEquals("env=dev,team=mesh", map.get("otelResourceAttributes"));
  }

  @Test
  void emptyValueIsKept() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"username="});
    assertTrue(map.containsKey("username"));
    assertEquals("", map.get("username"));
  }

  @Test
  void rejectsArgumentWithoutEquals() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid", "key=value"}));
  }

  @Test
  void rejectsMalformedKeyAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"1bad=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"topics=a\u0007b"}));
  }

  @Test
  void nullAndBlankArgumentsAreSkipped() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
    assertTrue(CliArgsParser.toMap(new String[] {null, "  "}).isEmpty());
  }
}
