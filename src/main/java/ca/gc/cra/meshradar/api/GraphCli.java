package ca.gc.cra.meshradar.api;

import ca.gc.cra.meshradar.application.port.ClockPort;
import ca.gc.cra.meshradar.application.query.GraphAggregator;
import ca.gc.cra.meshradar.config.CompositionRoot;
import ca.gc.cra.meshradar.config.QueryConfig;
import ca.gc.cra.meshradar.domain.error.StoreException;
import ca.gc.cra.meshradar.domain.mesh.Edge;
import ca.gc.cra.meshradar.domain.mesh.NodeIds;
import ca.gc.cra.meshradar.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.meshradar.infrastructure.persistence.jdbc.JdbcMeshStore;
import ca.gc.cra.meshradar.logging.LoggingConfigurator;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the deduplicated traceroute and neighbor edge list from a JDBC store.
 *
 * @since 0.1.0
 */
public final class GraphCli {
  private static final Logger log = LoggerFactory.getLogger(GraphCli.class);
  private static final String SUMMARY_USAGE =
      "usage: graph jdbcUrl=URL [jdbcUser=U] [jdbcPassword=P] [since=HOURS] [limit=N] [config=PATH]";
  private static final String HELP_TEXT = """
      meshradar mesh graph

      Usage:
        graph jdbcUrl=jdbc:h2:./meshradar [options]

      Prints one line per directed edge: FROM TO KIND LAST_SEEN.

      Options:
        jdbcUrl=URL          Store to query (required)
        jdbcUser=U jdbcPassword=P
        since=HOURS          Look-back window in hours (default 24)
        limit=N              Maximum edges printed (default 1000)
        config=PATH          YAML file; keys from 'common' and 'graph' sections
        --verbose            Enable DEBUG logging
        --help               Show this message
      """;

  private GraphCli() {}

  /**
   * Runs the graph export.
   *
   * @param args command arguments (without the {@code graph} token)
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    return run(args, ClockPort.SYSTEM);
  }

  static ExitCode run(String[] args, ClockPort clock) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    List<String> unknownFlags = input.unknownFlags(Set.of());
    if (!unknownFlags.isEmpty()) {
      log.error("Unknown flags: {}", unknownFlags);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ConfigCliUtils.Resolution resolution = ConfigCliUtils.resolve("graph", input, SUMMARY_USAGE, log);
    if (resolution.failure().isPresent()) {
      return resolution.failure().get();
    }
    QueryConfig config;
    try {
      Map<String, String> configInputs = new LinkedHashMap<>(resolution.effective().orElseThrow());
      TelemetryConfigurator.configureMetrics(configInputs);
      config = QueryConfig.fromMap(configInputs);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid graph arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    long since = clock.nowMillis() - config.window().toMillis();
    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter();
        JdbcMeshStore store = CompositionRoot.openJdbcStore(config.store())) {
      GraphAggregator graph = CompositionRoot.graph(store, metrics);
      List<Edge> edges = graph.edges(since);
      CliPrinter.printLines(render(edges, config.limit()));
      if (edges.size() > config.limit()) {
        log.info("Printed {} of {} edges; raise limit= to see more", config.limit(), edges.size());
      }
      return ExitCode.SUCCESS;
    } catch (StoreException ex) {
      log.error("Graph query failed: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in graph", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static List<String> render(List<Edge> edges, int limit) {
    List<String> lines = new ArrayList<>(Math.min(edges.size(), limit));
    for (Edge edge : edges.subList(0, Math.min(edges.size(), limit))) {
      lines.add(NodeIds.toHex(edge.from()) + " " + NodeIds.toHex(edge.to()) + " " + edge.kind() + " "
          + Instant.ofEpochMilli(edge.observedAt()));
    }
    return lines;
  }
}
