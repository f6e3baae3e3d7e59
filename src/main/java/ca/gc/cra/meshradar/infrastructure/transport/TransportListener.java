package ca.gc.cra.meshradar.infrastructure.transport;

import ca.gc.cra.meshradar.application.health.ConnectionState;
import ca.gc.cra.meshradar.application.health.HealthCounter;
import ca.gc.cra.meshradar.application.health.PipelineHealth;
import ca.gc.cra.meshradar.application.port.ClockPort;
import ca.gc.cra.meshradar.application.port.MessageSource;
import ca.gc.cra.meshradar.domain.error.TransportException;
import ca.gc.cra.meshradar.domain.mesh.RawMessage;
import ca.gc.cra.meshradar.util.DropOldestQueue;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> {@link MessageSource} that keeps one broker subscription alive and buffers inbound messages.
 * <p><strong>Why:</strong> Decouples the broker callback thread from decode workers so a slow pipeline never stalls
 * the broker session.</p>
 * <p><strong>Role:</strong> Infrastructure adapter feeding the ingest pipeline.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Connect and resubscribe every filter, retrying with exponential backoff until stopped.</li>
 *   <li>Buffer messages in a drop-oldest ingress queue; the callback never blocks.</li>
 *   <li>Publish connection state to {@link PipelineHealth}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #poll()} may be called by several decode workers.</p>
 * <p><strong>Observability:</strong> Ingress evictions count as {@code transport.ingress.dropped}; connect failures
 * log at WARN.</p>
 *
 * @since 0.1.0
 */
public final class TransportListener implements MessageSource {
  private static final Logger log = LoggerFactory.getLogger(TransportListener.class);
  private static final long POLL_WAIT_MILLIS = 25L;
  private static final long JOIN_TIMEOUT_MILLIS = 5_000L;

  private final BrokerClient client;
  private final List<String> filters;
  private final DropOldestQueue<RawMessage> ingress;
  private final ExponentialBackoff backoff;
  private final PipelineHealth health;
  private final ClockPort clock;
  private final AtomicBoolean started = new AtomicBoolean();
  private final CountDownLatch stopSignal = new CountDownLatch(1);
  private final Semaphore connectionLost = new Semaphore(0);
  private volatile Thread connectionThread;

  /**
   * Creates a listener.
   *
   * @param client broker session
   * @param filters topic filters subscribed after every connect; must not be empty
   * @param ingressCapacity ingress buffer size
   * @param backoff reconnect policy
   * @param health health surface receiving connection state and ingress drops
   * @param clock receive-time source
   */
  public TransportListener(
      BrokerClient client,
      List<String> filters,
      int ingressCapacity,
      ExponentialBackoff backoff,
      PipelineHealth health,
      ClockPort clock) {
    this.client = Objects.requireNonNull(client, "client");
    this.filters = List.copyOf(Objects.requireNonNull(filters, "filters"));
    if (this.filters.isEmpty()) {
      throw new IllegalArgumentException("at least one topic filter is required");
    }
    this.ingress = new DropOldestQueue<>(ingressCapacity);
    this.backoff = Objects.requireNonNull(backoff, "backoff");
    this.health = Objects.requireNonNull(health, "health");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Starts the connection thread. Returns immediately; the first connect happens in the background.
   *
   * @throws IllegalStateException if already started
   */
  @Override
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("TransportListener already started");
    }
    Thread thread = new Thread(this::connectionLoop, "meshradar-transport");
    thread.setUncaughtExceptionHandler(
        (t, ex) -> log.error("Transport connection thread {} died", t.getName(), ex));
    connectionThread = thread;
    thread.start();
  }

  @Override
  public Optional<RawMessage> poll() throws InterruptedException {
    return Optional.ofNullable(ingress.poll(POLL_WAIT_MILLIS, TimeUnit.MILLISECONDS));
  }

  /** Number of buffered messages not yet polled. */
  public int backlog() {
    return ingress.size();
  }

  private void connectionLoop() {
    MDC.put("pipeline", "transport");
    try {
      while (stopSignal.getCount() > 0) {
        if (!connectOnce()) {
          long delay = backoff.nextDelayMillis();
          log.debug("Reconnecting in {} ms", delay);
          if (stopSignal.await(delay, TimeUnit.MILLISECONDS)) {
            break;
          }
          continue;
        }
        backoff.reset();
        waitForLoss();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.debug("Transport connection thread interrupted");
    } finally {
      MDC.remove("pipeline");
    }
  }

  private boolean connectOnce() {
    health.connectionState(ConnectionState.CONNECTING);
    connectionLost.drainPermits();
    try {
      client.connect(new Listener());
      client.subscribe(filters);
      health.connectionState(ConnectionState.CONNECTED);
      return true;
    } catch (TransportException ex) {
      log.warn("Broker connect failed: {}", ex.getMessage());
      health.connectionState(ConnectionState.DISCONNECTED);
      disconnectQuietly();
      return false;
    }
  }

  private void waitForLoss() throws InterruptedException {
    while (stopSignal.getCount() > 0) {
      if (connectionLost.tryAcquire(250, TimeUnit.MILLISECONDS)) {
        health.connectionState(ConnectionState.DISCONNECTED);
        return;
      }
    }
  }

  private void disconnectQuietly() {
    try {
      client.disconnect();
    } catch (TransportException ex) {
      log.debug("Disconnect after failed connect also failed: {}", ex.getMessage());
    }
  }

  private void onMessage(String topic, byte[] payload) {
    RawMessage evicted = ingress.offer(new RawMessage(topic, payload, clock.nowMillis()));
    if (evicted != null) {
      health.record(HealthCounter.INGRESS_DROPPED);
    }
  }

  /**
   * Stops reconnecting, closes the broker session and reports {@link ConnectionState#STOPPED}. Buffered messages
   * remain pollable.
   *
   * @throws TransportException if the broker session cannot be closed cleanly
   * @throws InterruptedException if interrupted while waiting for the connection thread
   */
  @Override
  public void close() throws TransportException, InterruptedException {
    stopSignal.countDown();
    Thread thread = connectionThread;
    if (thread != null) {
      thread.join(JOIN_TIMEOUT_MILLIS);
      if (thread.isAlive()) {
        thread.interrupt();
        log.warn("Transport connection thread did not stop within {} ms", JOIN_TIMEOUT_MILLIS);
      }
    }
    try {
      client.close();
    } finally {
      health.connectionState(ConnectionState.STOPPED);
    }
  }

  private final class Listener implements BrokerClient.Listener {
    @Override
    public void onMessage(String topic, byte[] payload) {
      TransportListener.this.onMessage(topic, payload);
    }

    @Override
    public void onConnectionLost(Throwable cause) {
      log.warn("Broker connection lost: {}", cause == null ? "unknown cause" : cause.getMessage());
      connectionLost.release();
    }
  }
}
