package ca.gc.cra.meshradar.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;

class QueryConfigTest {

  @Test
  void fromMapParsesWindowNodeAndChannel() {
    QueryConfig config = QueryConfig.fromMap(Map.of(
        "jdbcUrl", "jdbc:h2:mem:q", "since", "6", "limit", "50", "node", "!0000beef", "channel", "LongFast"));

    assertEquals(Duration.ofHours(6), config.window());
    assertEquals(50, config.limit());
    assertEquals(OptionalLong.of(0xbeefL), config.node());
    assertEquals(Optional.of("LongFast"), config.channel());
    assertEquals(StoreMode.JDBC, config.store().mode());
  }

  @Test
  void defaultsApplyWhenKeysAreBlank() {
    QueryConfig config = QueryConfig.fromMap(Map.of("jdbcUrl", "jdbc:h2:mem:q", "node", "", "channel", " "));

    assertEquals(Duration.ofHours(QueryConfig.DEFAULT_SINCE_HOURS), config.window());
    assertEquals(QueryConfig.DEFAULT_LIMIT, config.limit());
    assertEquals(OptionalLong.empty(), config.node());
    assertEquals(Optional.empty(), config.channel());
  }

  @Test
  void rejectsInvalidInput() {
    assertThrows(IllegalArgumentException.class, () -> QueryConfig.fromMap(Map.of()));
    assertThrows(IllegalArgumentException.class,
        () -> QueryConfig.fromMap(Map.of("jdbcUrl", "jdbc:h2:mem:q", "store", "MEMORY")));
    assertThrows(IllegalArgumentException.class,
        () -> QueryConfig.fromMap(Map.of("jdbcUrl", "jdbc:h2:mem:q", "since", "0")));
    assertThrows(IllegalArgumentException.class,
        () -> QueryConfig.fromMap(Map.of("jdbcUrl", "jdbc:h2:mem:q", "node", "gateway")));
  }
}
