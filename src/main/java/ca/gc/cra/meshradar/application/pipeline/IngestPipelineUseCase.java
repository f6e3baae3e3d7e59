package ca.gc.cra.meshradar.application.pipeline;

import ca.gc.cra.meshradar.application.health.HealthCounter;
import ca.gc.cra.meshradar.application.health.PipelineHealth;
import ca.gc.cra.meshradar.application.port.EnvelopeDecoderPort;
import ca.gc.cra.meshradar.application.port.MessageSource;
import ca.gc.cra.meshradar.application.port.MetricsPort;
import ca.gc.cra.meshradar.domain.error.DecodeException;
import ca.gc.cra.meshradar.domain.mesh.DecodedEnvelope;
import ca.gc.cra.meshradar.domain.mesh.RawMessage;
import ca.gc.cra.meshradar.infrastructure.exec.ExecutorFactories;
import java.lang.Thread.UncaughtExceptionHandler;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs live mesh ingestion: message source, decode workers, bounded store queue, store workers.
 * <p>The message source hands off through its own drop-oldest queue, so broker callbacks never block. Decode
 * workers are stateless and run in parallel; they block on the bounded store queue, which is the pipeline's
 * backpressure point. Store workers drain that queue in batches and run {@link PacketProcessor} for each
 * envelope.</p>
 * <p>Per-message failures never leave a worker: decode errors are counted and dropped, unexpected runtime
 * exceptions are counted as {@code pipeline.worker.error} and the worker continues. Instances are not reusable;
 * invoke {@link #run()} at most once.</p>
 *
 * @since 0.1.0
 */
public final class IngestPipelineUseCase {
  private static final Logger log = LoggerFactory.getLogger(IngestPipelineUseCase.class);

  private static final int DEFAULT_DECODE_WORKERS = Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
  private static final int DEFAULT_STORE_WORKERS = 4;
  private static final int DEFAULT_QUEUE_CAPACITY = 1_024;
  private static final int STORE_BATCH_SIZE = 32;
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
  private static final long WORKER_IDLE_POLL_MILLIS = 25L;
  private static final long STATUS_POLL_MILLIS = 250L;

  private final MessageSource source;
  private final EnvelopeDecoderPort decoder;
  private final PacketProcessor processor;
  private final PipelineHealth health;
  private final MetricsPort metrics;
  private final PipelineSettings settings;

  private final BlockingQueue<DecodedEnvelope> storeQueue;
  private final AtomicReference<Thread> runThread = new AtomicReference<>();
  private final AtomicReference<Throwable> workerFailure = new AtomicReference<>();
  private final AtomicBoolean used = new AtomicBoolean();
  private final AtomicBoolean decodeStopRequested = new AtomicBoolean();
  private final AtomicBoolean storeStopRequested = new AtomicBoolean();
  private final AtomicInteger queueHighWaterMark = new AtomicInteger();
  private final CountDownLatch stopSignal = new CountDownLatch(1);
  private final LongAdder received = new LongAdder();
  private final LongAdder decoded = new LongAdder();
  private final LongAdder processed = new LongAdder();
  private final String threadPrefix;

  private ExecutorService decodeExecutor;
  private ExecutorService storeExecutor;

  /**
   * Creates the pipeline with default worker settings.
   *
   * @param source message source (MQTT listener or Kafka bridge)
   * @param decoder envelope decoder
   * @param processor store stage
   * @param health health surface
   */
  public IngestPipelineUseCase(
      MessageSource source, EnvelopeDecoderPort decoder, PacketProcessor processor, PipelineHealth health) {
    this(source, decoder, processor, health, PipelineSettings.defaults());
  }

  /**
   * Creates the pipeline with explicit worker settings.
   *
   * @param source message source (MQTT listener or Kafka bridge)
   * @param decoder envelope decoder
   * @param processor store stage
   * @param health health surface
   * @param settings worker counts and store queue tuning
   */
  public IngestPipelineUseCase(
      MessageSource source,
      EnvelopeDecoderPort decoder,
      PacketProcessor processor,
      PipelineHealth health,
      PipelineSettings settings) {
    this.source = Objects.requireNonNull(source, "source");
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.processor = Objects.requireNonNull(processor, "processor");
    this.health = Objects.requireNonNull(health, "health");
    this.metrics = health.metrics();
    this.settings = Objects.requireNonNull(settings, "settings");
    this.storeQueue = createQueue(settings);
    this.threadPrefix = "ingest-" + Integer.toHexString(System.identityHashCode(this));
  }

  /**
   * Runs ingestion until {@link #stop()} is called or the calling thread is interrupted.
   *
   * @throws Exception if the source cannot start or a worker thread dies
   */
  public void run() throws Exception {
    if (!used.compareAndSet(false, true)) {
      throw new IllegalStateException("Ingest pipeline already ran");
    }
    runThread.set(Thread.currentThread());
    MDC.put("pipeline", "ingest");
    Exception primaryFailure = null;
    boolean started = false;
    try {
      startWorkers();
      source.start();
      started = true;
      log.info("Ingest pipeline started with {} decode workers, {} store workers, {} store queue ({})",
          settings.decodeWorkers(), settings.storeWorkers(), settings.queueCapacity(), settings.queueType());

      while (!Thread.currentThread().isInterrupted()) {
        Throwable failure = workerFailure.get();
        if (failure != null) {
          primaryFailure = failure instanceof Exception ex ? ex : new IllegalStateException("Worker crashed", failure);
          break;
        }
        if (stopSignal.await(STATUS_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
          break;
        }
        metrics.observe("ingest.store.queue.depth", storeQueue.size());
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    } catch (Exception runFailure) {
      primaryFailure = runFailure;
    } finally {
      shutdownWorkers();
      if (started) {
        try {
          source.close();
          log.info("Message source closed");
        } catch (Exception closeFailure) {
          log.error("Failed to close message source", closeFailure);
          if (primaryFailure == null) {
            primaryFailure = closeFailure;
          }
        }
      }
      runThread.set(null);
      log.info("Ingest pipeline stopped after {} messages, {} envelopes, {} events",
          received.sum(), decoded.sum(), processed.sum());
      MDC.remove("pipeline");
    }
    if (primaryFailure != null) {
      throw primaryFailure;
    }
  }

  /**
   * Requests a graceful stop; {@link #run()} returns after in-flight envelopes are stored.
   */
  public void stop() {
    stopSignal.countDown();
  }

  private void startWorkers() {
    UncaughtExceptionHandler handler = this::handleWorkerCrash;
    decodeExecutor = ExecutorFactories.newWorkerPool(settings.decodeWorkers(), threadPrefix + "-decode", handler);
    storeExecutor = ExecutorFactories.newWorkerPool(settings.storeWorkers(), threadPrefix + "-store", handler);
    for (int i = 0; i < settings.storeWorkers(); i++) {
      storeExecutor.execute(new StoreWorker());
    }
    for (int i = 0; i < settings.decodeWorkers(); i++) {
      decodeExecutor.execute(new DecodeWorker());
    }
    metrics.observe("ingest.worker.active", (long) settings.decodeWorkers() + settings.storeWorkers());
  }

  private final class DecodeWorker implements Runnable {
    @Override
    public void run() {
      MDC.put("pipeline", "ingest");
      try {
        while (!decodeStopRequested.get()) {
          Optional<RawMessage> message = source.poll();
          if (message.isEmpty()) {
            continue;
          }
          received.increment();
          Optional<DecodedEnvelope> envelope = decode(message.get());
          if (envelope.isPresent()) {
            decoded.increment();
            storeQueue.put(envelope.get());
            updateQueueHighWater(storeQueue.size());
          }
        }
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        if (!decodeStopRequested.get()) {
          metrics.increment("ingest.decode.worker.interrupted");
        }
      } finally {
        MDC.remove("pipeline");
      }
    }

    private Optional<DecodedEnvelope> decode(RawMessage message) {
      long startNanos = System.nanoTime();
      try {
        return decoder.decode(message);
      } catch (DecodeException ex) {
        health.record(HealthCounter.DECODE_FAILED);
        log.debug("Dropping message on {}: {}", message.topic(), ex.getMessage());
        return Optional.empty();
      } catch (RuntimeException ex) {
        health.record(HealthCounter.WORKER_ERROR);
        log.warn("Unexpected failure decoding message on {}", message.topic(), ex);
        return Optional.empty();
      } finally {
        metrics.observe("ingest.decode.latencyNanos", System.nanoTime() - startNanos);
      }
    }
  }

  private final class StoreWorker implements Runnable {
    @Override
    public void run() {
      MDC.put("pipeline", "ingest");
      List<DecodedEnvelope> batch = new ArrayList<>(STORE_BATCH_SIZE);
      try {
        while (true) {
          if (storeStopRequested.get() && storeQueue.isEmpty()) {
            break;
          }
          DecodedEnvelope envelope = storeQueue.poll(WORKER_IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
          if (envelope == null) {
            continue;
          }
          store(envelope);
          if (storeQueue.drainTo(batch, STORE_BATCH_SIZE) > 0) {
            for (DecodedEnvelope next : batch) {
              store(next);
            }
            batch.clear();
          }
        }
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        if (!storeStopRequested.get()) {
          metrics.increment("ingest.store.worker.interrupted");
        }
      } finally {
        MDC.remove("pipeline");
      }
    }

    private void store(DecodedEnvelope envelope) {
      long startNanos = System.nanoTime();
      try {
        processor.process(envelope);
        processed.increment();
      } catch (RuntimeException ex) {
        health.record(HealthCounter.WORKER_ERROR);
        log.warn("Unexpected failure storing {}", envelope.key(), ex);
      } finally {
        metrics.observe("ingest.store.latencyNanos", System.nanoTime() - startNanos);
      }
    }
  }

  private void shutdownWorkers() {
    log.info("Stopping ingest workers");
    decodeStopRequested.set(true);
    awaitShutdown(decodeExecutor, "decode");
    storeStopRequested.set(true);
    awaitShutdown(storeExecutor, "store");
    int abandoned = storeQueue.size();
    if (abandoned > 0) {
      metrics.observe("ingest.store.queue.abandoned", abandoned);
      log.warn("{} envelopes were still queued at shutdown", abandoned);
    }
    storeQueue.clear();
    metrics.observe("ingest.worker.active", 0);
    metrics.observe("ingest.store.queue.highWater", queueHighWaterMark.get());
  }

  private void awaitShutdown(ExecutorService executor, String stage) {
    if (executor == null) {
      return;
    }
    executor.shutdown();
    boolean terminated = false;
    try {
      terminated = executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      if (!terminated) {
        metrics.increment("ingest." + stage + ".shutdown.force");
        log.warn("{} workers active after {} ms; forcing shutdown", stage, SHUTDOWN_TIMEOUT.toMillis());
        executor.shutdownNow();
        terminated = executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      }
    } catch (InterruptedException ie) {
      metrics.increment("ingest." + stage + ".shutdown.interrupted");
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
    if (!terminated) {
      log.error("{} workers failed to terminate cleanly", stage);
    }
  }

  private void updateQueueHighWater(int depth) {
    int previous;
    do {
      previous = queueHighWaterMark.get();
      if (depth <= previous) {
        return;
      }
    } while (!queueHighWaterMark.compareAndSet(previous, depth));
  }

  private void handleWorkerCrash(Thread thread, Throwable throwable) {
    health.record(HealthCounter.WORKER_ERROR);
    log.error("Ingest worker {} died", thread.getName(), throwable);
    if (workerFailure.compareAndSet(null, throwable)) {
      stop();
    }
  }

  private static BlockingQueue<DecodedEnvelope> createQueue(PipelineSettings settings) {
    return switch (settings.queueType()) {
      case ARRAY -> new ArrayBlockingQueue<>(settings.queueCapacity());
      case LINKED -> new LinkedBlockingQueue<>(settings.queueCapacity());
    };
  }

  /** Queue types supported for the decode-to-store hand-off. */
  public enum QueueType {
    ARRAY,
    LINKED
  }

  /** Worker and queue tuning. */
  public record PipelineSettings(int decodeWorkers, int storeWorkers, int queueCapacity, QueueType queueType) {
    /**
     * Normalizes settings by clamping worker and queue values and defaulting the queue type.
     *
     * @param decodeWorkers requested decode worker count
     * @param storeWorkers requested store worker count
     * @param queueCapacity requested store queue capacity
     * @param queueType desired queue implementation
     */
    public PipelineSettings {
      decodeWorkers = Math.max(1, decodeWorkers);
      storeWorkers = Math.max(1, storeWorkers);
      queueType = Objects.requireNonNullElse(queueType, QueueType.ARRAY);
      queueCapacity = Math.max(storeWorkers, queueCapacity);
    }

    /**
     * Derives settings from the pipeline defaults.
     *
     * @return normalized settings
     */
    public static PipelineSettings defaults() {
      return new PipelineSettings(DEFAULT_DECODE_WORKERS, DEFAULT_STORE_WORKERS, DEFAULT_QUEUE_CAPACITY, QueueType.ARRAY);
    }
  }
}
