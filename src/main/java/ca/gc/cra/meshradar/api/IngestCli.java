package ca.gc.cra.meshradar.api;

import ca.gc.cra.meshradar.application.pipeline.IngestPipelineUseCase;
import ca.gc.cra.meshradar.config.CompositionRoot;
import ca.gc.cra.meshradar.config.IngestConfig;
import ca.gc.cra.meshradar.domain.error.StoreException;
import ca.gc.cra.meshradar.domain.error.TransportException;
import ca.gc.cra.meshradar.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.meshradar.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the live ingest pipeline.
 *
 * @since 0.1.0
 */
public final class IngestCli {
  private static final Logger log = LoggerFactory.getLogger(IngestCli.class);
  private static final Set<String> KNOWN_FLAGS = Set.of("--tail", "--dry-run");
  private static final long SHUTDOWN_WAIT_SECONDS = 10L;
  private static final String SUMMARY_USAGE =
      "usage: ingest [source=MQTT|KAFKA] [brokerUrl=URI] [topics=F1,F2] [store=MEMORY|JDBC] [jdbcUrl=URL] "
          + "[config=PATH] [--tail] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      meshradar ingest pipeline

      Usage:
        ingest [key=value ...] [flags]

      Source:
        source=MQTT|KAFKA            Message source (default MQTT)
        brokerUrl=tcp://HOST:PORT    MQTT broker (tcp:// or ssl://)
        username=USER password=PASS  MQTT credentials
        clientId=ID                  MQTT client id
        topics=F1,F2                 Topic filters (default msh/US/CA/#)
        reconnectInitialMillis=N     First reconnect delay (default 1000)
        reconnectMaxMillis=N         Reconnect delay ceiling (default 30000)
        kafkaBootstrap=HOST:PORT     Kafka bridge brokers; required for source=KAFKA
        kafkaTopic=TOPIC             Kafka bridge topic
        kafkaGroupId=GROUP           Kafka consumer group

      Decoding:
        topicLayout=PATTERN          Topic layout with {gateway} and {channel} (default msh/#/2/e/{channel}/{gateway})
        channelKeys=K1,K2            Base64 AES channel keys (default: public key)
        ignoredSenders=N1,N2         Sender node numbers to skip (decimal, 0x or ! hex)

      Pipeline:
        ingressQueueCapacity=N       Drop-oldest ingress buffer (default 10000)
        decodeWorkers=N storeWorkers=N
        storeQueueCapacity=N storeQueueType=ARRAY|LINKED
        hubQueueCapacity=N           Per-subscriber live queue (default 256)

      Store:
        store=MEMORY|JDBC            Store backend (default MEMORY)
        jdbcUrl=URL jdbcUser=U jdbcPassword=P jdbcPoolSize=N
        storeTimeoutMillis=N storeMaxAttempts=N storeRetryBackoffMillis=N storeDegradedThreshold=N

      Other:
        config=PATH                  YAML file; keys from 'common' and 'ingest' sections
        metricsExporter=otlp|none    Metrics exporter (default otlp)
        otelEndpoint=URL             OTLP metrics endpoint
        otelResourceAttributes=K=V   Comma-separated OTel resource attributes
        --tail                       Print live events to stdout
        --dry-run                    Validate configuration and print the plan
        --verbose                    Enable DEBUG logging
        --help                       Show this message
      """;

  private IngestCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs the ingest command until interrupted.
   *
   * @param args command arguments (without the {@code ingest} token)
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for ingest CLI");
    }
    List<String> unknownFlags = input.unknownFlags(KNOWN_FLAGS);
    if (!unknownFlags.isEmpty()) {
      log.error("Unknown flags: {}", unknownFlags);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ConfigCliUtils.Resolution resolution = ConfigCliUtils.resolve("ingest", input, SUMMARY_USAGE, log);
    if (resolution.failure().isPresent()) {
      return resolution.failure().get();
    }
    Map<String, String> effective = resolution.effective().orElseThrow();
    boolean dryRun = input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(effective, "dryRun");
    boolean tail = input.hasFlag("--tail") || ConfigCliUtils.parseBoolean(effective, "tail");

    Map<String, String> configInputs = new LinkedHashMap<>(effective);
    IngestConfig config;
    try {
      TelemetryConfigurator.configureMetrics(configInputs);
      config = IngestConfig.fromMap(configInputs);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid ingest arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(config, tail);
      return ExitCode.SUCCESS;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter();
        CompositionRoot root = new CompositionRoot(config, metrics)) {
      IngestPipelineUseCase pipeline = root.ingestPipeline();
      log.info("Configured ingest pipeline: source={}, store={}, metricsNoop={}",
          config.source(), config.store().mode(), metrics.isNoop());
      return runUntilStopped(pipeline, tail ? new TailPrinter(root.hub()) : null);
    } catch (IllegalArgumentException ex) {
      log.error("Ingest configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (TransportException ex) {
      log.error("Ingest transport setup failed: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (StoreException ex) {
      log.error("Mesh store unavailable at startup: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Ingest pipeline interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in ingest pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception in ingest pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ExitCode runUntilStopped(IngestPipelineUseCase pipeline, TailPrinter tail) throws Exception {
    CountDownLatch finished = new CountDownLatch(1);
    Thread hook = new Thread(() -> {
      log.info("Shutdown requested; draining ingest pipeline");
      pipeline.stop();
      try {
        if (!finished.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
          log.warn("Ingest pipeline did not stop within {}s", SHUTDOWN_WAIT_SECONDS);
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.warn("Shutdown hook interrupted while waiting for the pipeline");
      }
    }, "meshradar-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    if (tail != null) {
      tail.start();
    }
    try {
      pipeline.run();
      return ExitCode.SUCCESS;
    } finally {
      if (tail != null) {
        tail.close();
      }
      finished.countDown();
      removeHook(hook);
    }
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM already shutting down; shutdown hook stays registered");
    }
  }

  private static void printDryRunPlan(IngestConfig config, boolean tail) {
    List<String> lines = new ArrayList<>();
    lines.add("Ingest dry-run: no broker connection will be made.");
    for (String line : config.describe()) {
      lines.add(" " + line);
    }
    lines.add(" tail=" + tail);
    lines.add(" Re-run without --dry-run to start ingesting.");
    CliPrinter.printLines(lines);
  }
}
