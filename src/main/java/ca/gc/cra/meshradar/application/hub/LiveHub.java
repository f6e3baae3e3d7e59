package ca.gc.cra.meshradar.application.hub;

import ca.gc.cra.meshradar.application.health.HealthCounter;
import ca.gc.cra.meshradar.application.health.PipelineHealth;
import ca.gc.cra.meshradar.domain.mesh.NormalizedEvent;
import ca.gc.cra.meshradar.util.DropOldestQueue;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Fans processed events out to live subscribers.
 * <p><strong>Why:</strong> A slow viewer must never stall ingestion; each subscriber owns a bounded drop-oldest
 * queue, so it loses its own oldest events while publishers keep going.</p>
 * <p><strong>Role:</strong> Last stage of the pipeline; consumed by the CLI tail view and any embedding UI.</p>
 * <p><strong>Thread-safety:</strong> {@link #publish(NormalizedEvent)} may be called from every store worker;
 * subscribe and unsubscribe may race with publishing.</p>
 * <p><strong>Observability:</strong> Evictions increment {@code hub.subscriber.evicted}.</p>
 *
 * @since 0.1.0
 */
public final class LiveHub implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(LiveHub.class);

  private final int queueCapacity;
  private final PipelineHealth health;
  private final List<Subscription> subscribers = new CopyOnWriteArrayList<>();
  private final AtomicLong ids = new AtomicLong();
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * Creates a hub.
   *
   * @param queueCapacity per-subscriber queue capacity; must be positive
   * @param health health surface receiving eviction counts
   */
  public LiveHub(int queueCapacity, PipelineHealth health) {
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException("hubQueueCapacity must be positive");
    }
    this.queueCapacity = queueCapacity;
    this.health = Objects.requireNonNull(health, "health");
  }

  /**
   * Registers a subscriber.
   *
   * @param label name used in logs
   * @return subscription handle
   * @throws IllegalStateException if the hub is closed
   */
  public Subscription subscribe(String label) {
    if (closed.get()) {
      throw new IllegalStateException("Live hub is closed");
    }
    Subscription subscription = new Subscription(ids.incrementAndGet(), Objects.requireNonNull(label, "label"));
    subscribers.add(subscription);
    if (closed.get()) {
      unsubscribe(subscription);
      throw new IllegalStateException("Live hub is closed");
    }
    log.debug("Subscriber {} ({}) attached; {} active", subscription.id, label, subscribers.size());
    return subscription;
  }

  /**
   * Detaches a subscriber and releases its queue. Unknown or already closed handles are ignored.
   *
   * @param subscription handle from {@link #subscribe(String)}
   */
  public void unsubscribe(Subscription subscription) {
    if (subscription == null) {
      return;
    }
    subscription.open.set(false);
    boolean removed = subscribers.remove(subscription);
    int discarded = subscription.queue.clear();
    if (removed) {
      log.debug("Subscriber {} ({}) detached after {} evictions; {} queued events discarded",
          subscription.id, subscription.label, subscription.queue.evictions(), discarded);
    }
  }

  /**
   * Delivers an event to every open subscriber without blocking.
   *
   * @param event processed event
   */
  public void publish(NormalizedEvent event) {
    Objects.requireNonNull(event, "event");
    if (closed.get()) {
      return;
    }
    for (Subscription subscription : subscribers) {
      if (subscription.open.get() && subscription.queue.offer(event) != null) {
        health.record(HealthCounter.SUBSCRIBER_EVICTED);
      }
    }
  }

  public int subscriberCount() {
    return subscribers.size();
  }

  /**
   * Detaches every subscriber; later publishes are ignored.
   */
  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      for (Subscription subscription : subscribers) {
        unsubscribe(subscription);
      }
    }
  }

  /**
   * Handle for one live subscriber.
   */
  public final class Subscription implements AutoCloseable {
    private final long id;
    private final String label;
    private final DropOldestQueue<NormalizedEvent> queue;
    private final AtomicBoolean open = new AtomicBoolean(true);

    private Subscription(long id, String label) {
      this.id = id;
      this.label = label;
      this.queue = new DropOldestQueue<>(queueCapacity);
    }

    public long id() {
      return id;
    }

    public String label() {
      return label;
    }

    /**
     * Waits for the next event.
     *
     * @param timeout maximum wait
     * @param unit unit of {@code timeout}
     * @return next event, or empty on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public Optional<NormalizedEvent> poll(long timeout, TimeUnit unit) throws InterruptedException {
      return Optional.ofNullable(queue.poll(timeout, unit));
    }

    /**
     * Removes every queued event, oldest first.
     *
     * @return queued events
     */
    public List<NormalizedEvent> drain() {
      List<NormalizedEvent> events = new ArrayList<>(queue.size());
      queue.drainTo(events, Integer.MAX_VALUE);
      return events;
    }

    /**
     * Events this subscriber lost to overflow.
     *
     * @return eviction count
     */
    public long evictions() {
      return queue.evictions();
    }

    public boolean isOpen() {
      return open.get();
    }

    @Override
    public void close() {
      unsubscribe(this);
    }
  }
}
