package ca.gc.cra.meshradar.api;

import ca.gc.cra.meshradar.application.port.ClockPort;
import ca.gc.cra.meshradar.application.query.TopTrafficAggregator;
import ca.gc.cra.meshradar.config.CompositionRoot;
import ca.gc.cra.meshradar.config.QueryConfig;
import ca.gc.cra.meshradar.domain.error.StoreException;
import ca.gc.cra.meshradar.domain.mesh.KindCount;
import ca.gc.cra.meshradar.domain.mesh.NodeIds;
import ca.gc.cra.meshradar.domain.mesh.TrafficSummary;
import ca.gc.cra.meshradar.infrastructure.persistence.jdbc.JdbcMeshStore;
import ca.gc.cra.meshradar.logging.LoggingConfigurator;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the top-traffic ranking, or one node's per-kind traffic, from a JDBC store.
 *
 * @since 0.1.0
 */
public final class TopCli {
  private static final Logger log = LoggerFactory.getLogger(TopCli.class);
  private static final String SUMMARY_USAGE =
      "usage: top jdbcUrl=URL [jdbcUser=U] [jdbcPassword=P] [since=HOURS] [limit=N] [node=ID] [channel=NAME] "
          + "[config=PATH]";
  private static final String HELP_TEXT = """
      meshradar top-traffic report

      Usage:
        top jdbcUrl=jdbc:h2:./meshradar [options]

      Options:
        jdbcUrl=URL          Store to query (required)
        jdbcUser=U jdbcPassword=P
        since=HOURS          Look-back window in hours (default 24)
        limit=N              Maximum rows (default 20)
        node=ID              Show per-kind traffic for one node (decimal, 0x or ! hex)
        channel=NAME         Restrict the active node count to one channel
        config=PATH          YAML file; keys from 'common' and 'top' sections
        --verbose            Enable DEBUG logging
        --help               Show this message
      """;

  private TopCli() {}

  /**
   * Runs the report.
   *
   * @param args command arguments (without the {@code top} token)
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

    ConfigCliUtils.Resolution resolution = ConfigCliUtils.resolve("top", input, SUMMARY_USAGE, log);
    if (resolution.failure().isPresent()) {
      return resolution.failure().get();
    }
    QueryConfig config;
    try {
      Map<String, String> configInputs = new LinkedHashMap<>(resolution.effective().orElseThrow());
      TelemetryConfigurator.configureMetrics(configInputs);
      config = QueryConfig.fromMap(configInputs);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid top arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (JdbcMeshStore store = CompositionRoot.openJdbcStore(config.store())) {
      TopTrafficAggregator traffic = CompositionRoot.topTraffic(store, clock);
      if (config.node().isPresent()) {
        long node = config.node().getAsLong();
        CliPrinter.printLines(renderNodeTraffic(node, config.window(), traffic.nodeTraffic(node, config.window())));
      } else {
        long active = traffic.activeNodes(config.window(), config.channel());
        CliPrinter.printLines(renderRanking(config, active, traffic.top(config.window(), config.limit())));
      }
      return ExitCode.SUCCESS;
    } catch (StoreException ex) {
      log.error("Top-traffic query failed: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in top", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static List<String> renderRanking(QueryConfig config, long activeNodes, List<TrafficSummary> rows) {
    List<String> lines = new ArrayList<>(rows.size() + 3);
    lines.add(String.format(Locale.ROOT, "Top traffic, last %dh: %d active nodes%s",
        config.window().toHours(), activeNodes, config.channel().map(c -> " on " + c).orElse("")));
    lines.add(String.format(Locale.ROOT, "%-10s %-24s %-5s %-12s %8s %8s",
        "NODE", "LONG NAME", "SHORT", "CHANNEL", "PACKETS", "SEEN"));
    for (TrafficSummary row : rows) {
      lines.add(String.format(Locale.ROOT, "%-10s %-24s %-5s %-12s %8d %8d",
          NodeIds.toHex(row.nodeId()),
          orDash(row.longName()),
          orDash(row.shortName()),
          orDash(row.channel()),
          row.packetsSent(),
          row.timesSeen()));
    }
    return lines;
  }

  static List<String> renderNodeTraffic(long nodeId, Duration window, List<KindCount> counts) {
    List<String> lines = new ArrayList<>(counts.size() + 2);
    lines.add(String.format(Locale.ROOT, "Traffic from %s, last %dh", NodeIds.toHex(nodeId), window.toHours()));
    lines.add(String.format(Locale.ROOT, "%-6s %-14s %8s", "PORT", "KIND", "PACKETS"));
    for (KindCount count : counts) {
      lines.add(String.format(Locale.ROOT, "%-6d %-14s %8d", count.portNum(), count.kind(), count.count()));
    }
    return lines;
  }

  private static String orDash(String value) {
    return value == null || value.isBlank() ? "-" : value;
  }
}
