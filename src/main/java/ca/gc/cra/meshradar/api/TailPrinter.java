package ca.gc.cra.meshradar.api;

import ca.gc.cra.meshradar.application.hub.LiveHub;
import ca.gc.cra.meshradar.domain.mesh.NodeIds;
import ca.gc.cra.meshradar.domain.mesh.NormalizedEvent;
import ca.gc.cra.meshradar.domain.msg.TextMessage;
import ca.gc.cra.meshradar.logging.Logs;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints live hub events to stdout for {@code ingest --tail}. Runs on its own daemon thread with its own hub
 * subscription; a slow terminal only loses events from that subscription.
 */
final class TailPrinter implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(TailPrinter.class);
  private static final int MAX_TEXT_CHARS = 200;

  private final LiveHub.Subscription subscription;
  private final Thread thread;
  private volatile boolean running = true;

  TailPrinter(LiveHub hub) {
    this.subscription = Objects.requireNonNull(hub, "hub").subscribe("cli-tail");
    this.thread = new Thread(this::loop, "meshradar-tail");
    this.thread.setDaemon(true);
  }

  void start() {
    thread.start();
  }

  private void loop() {
    try {
      while (running) {
        Optional<NormalizedEvent> event = subscription.poll(250, TimeUnit.MILLISECONDS);
        event.ifPresent(e -> CliPrinter.println(format(e)));
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.debug("Tail printer interrupted");
    }
    long evicted = subscription.evictions();
    if (evicted > 0) {
      log.info("Tail output skipped {} events while the terminal lagged", evicted);
    }
  }

  static String format(NormalizedEvent event) {
    StringBuilder line = new StringBuilder(160)
        .append(Instant.ofEpochMilli(event.observedAt()))
        .append(' ').append(event.kind())
        .append(' ').append(NodeIds.toHex(event.fromNodeId())).append(" (").append(event.fromName()).append(')')
        .append(" -> ").append(NodeIds.destinationLabel(event.toNodeId()))
        .append(" via ").append(event.gatewayId())
        .append(" ch=").append(event.channel());
    if (event.rssi() != null) {
      line.append(" rssi=").append(event.rssi());
    }
    if (event.snr() != null) {
      line.append(" snr=").append(event.snr());
    }
    if (event.hopCount() != null) {
      line.append(" hops=").append(event.hopCount());
    }
    if (event.distanceKm() != null) {
      line.append(String.format(Locale.ROOT, " dist=%.1fkm", event.distanceKm()));
    }
    if (event.record() instanceof TextMessage text) {
      line.append(" \"").append(Logs.truncate(text.text(), MAX_TEXT_CHARS)).append('"');
    }
    return line.toString();
  }

  @Override
  public void close() throws InterruptedException {
    running = false;
    subscription.close();
    thread.join(1_000L);
  }
}
