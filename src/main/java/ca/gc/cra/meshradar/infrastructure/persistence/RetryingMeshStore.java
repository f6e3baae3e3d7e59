package ca.gc.cra.meshradar.infrastructure.persistence;

import ca.gc.cra.meshradar.application.health.HealthCounter;
import ca.gc.cra.meshradar.application.health.PipelineHealth;
import ca.gc.cra.meshradar.application.port.MeshStorePort;
import ca.gc.cra.meshradar.domain.error.StoreException;
import ca.gc.cra.meshradar.domain.error.StoreTimeoutException;
import ca.gc.cra.meshradar.domain.mesh.DecodedEnvelope;
import ca.gc.cra.meshradar.domain.mesh.MeshNode;
import ca.gc.cra.meshradar.domain.mesh.NodeField;
import ca.gc.cra.meshradar.domain.mesh.RecordOutcome;
import ca.gc.cra.meshradar.domain.mesh.Traceroute;
import ca.gc.cra.meshradar.infrastructure.exec.ExecutorFactories;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Write-side decorator that bounds every store call with a timeout and retries transient
 * failures with exponential backoff. A call that times out is awaited again on retry rather than re-issued, so a
 * late commit still reports its own outcome.
 * <p><strong>Why:</strong> A slow or flapping database must cost the pipeline one dropped write, never a stuck store
 * worker.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent store workers; calls run on a shared daemon call pool.</p>
 * <p><strong>Observability:</strong> Retries and drops are recorded on {@link PipelineHealth}. A run of consecutive
 * drops marks the pipeline degraded; the next successful write clears it.</p>
 *
 * @since 0.1.0
 */
public final class RetryingMeshStore implements MeshStorePort {
  private static final Logger log = LoggerFactory.getLogger(RetryingMeshStore.class);

  private final MeshStorePort delegate;
  private final RetryPolicy policy;
  private final PipelineHealth health;
  private final ExecutorService calls;
  private final AtomicInteger consecutiveDrops = new AtomicInteger();
  private final AtomicBoolean degradedRaised = new AtomicBoolean();

  /**
   * Wraps a store.
   *
   * @param delegate underlying store; closed with this decorator
   * @param policy timeout and retry policy
   * @param callThreads maximum concurrent delegate calls, normally the store worker count
   * @param health health surface
   */
  public RetryingMeshStore(MeshStorePort delegate, RetryPolicy policy, int callThreads, PipelineHealth health) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.health = Objects.requireNonNull(health, "health");
    this.calls = ExecutorFactories.newCallPool(callThreads, "meshradar-store-call",
        (thread, ex) -> log.error("Store call thread {} failed", thread.getName(), ex));
  }

  @Override
  public RecordOutcome recordPacket(DecodedEnvelope envelope) {
    return call("recordPacket", () -> delegate.recordPacket(envelope));
  }

  @Override
  public <T> MeshNode mergeObservation(long nodeId, NodeField<T> field, T value, long observedAt) {
    return call("mergeObservation", () -> delegate.mergeObservation(nodeId, field, value, observedAt));
  }

  @Override
  public MeshNode touchNode(long nodeId, long observedAt) {
    return call("touchNode", () -> delegate.touchNode(nodeId, observedAt));
  }

  @Override
  public Traceroute.Merge recordTraceroute(Traceroute incoming) {
    return call("recordTraceroute", () -> delegate.recordTraceroute(incoming));
  }

  private <T> T call(String operation, Callable<T> action) {
    StoreException last = null;
    Future<T> pending = null;
    long backoff = policy.backoffMillis();
    for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
      if (pending == null) {
        pending = calls.submit(action);
      }
      try {
        T result = await(operation, pending);
        onSuccess();
        return result;
      } catch (StoreTimeoutException ex) {
        // A call still running is awaited again on the next attempt, never re-issued.
        last = ex;
        if (!(ex.getCause() instanceof TimeoutException)) {
          pending = null;
        }
      } catch (StoreException ex) {
        last = ex;
        pending = null;
        if (!ex.isTransient()) {
          break;
        }
      }
      if (attempt < policy.maxAttempts()) {
        health.record(HealthCounter.STORE_RETRY);
        log.debug("{} attempt {} failed, retrying in {} ms: {}", operation, attempt, backoff, last.getMessage());
        try {
          sleep(backoff, operation);
        } catch (StoreException ex) {
          cancel(pending);
          throw ex;
        }
        backoff = Math.min(backoff * 2, policy.maxBackoffMillis());
      }
    }
    cancel(pending);
    onDrop(operation, last);
    throw last;
  }

  private <T> T await(String operation, Future<T> future) {
    try {
      return future.get(policy.timeoutMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      throw new StoreTimeoutException(operation + " exceeded " + policy.timeoutMillis() + " ms", ex);
    } catch (InterruptedException ex) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new StoreException(operation + " interrupted", ex, false);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof StoreException) {
        throw (StoreException) cause;
      }
      throw new StoreException(operation + " failed: " + cause, cause, false);
    }
  }

  private static void cancel(Future<?> future) {
    if (future != null) {
      future.cancel(true);
    }
  }

  private void sleep(long millis, String operation) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new StoreException(operation + " interrupted during backoff", ex, false);
    }
  }

  private void onSuccess() {
    consecutiveDrops.set(0);
    if (degradedRaised.compareAndSet(true, false)) {
      health.clearDegraded();
    }
  }

  private void onDrop(String operation, StoreException cause) {
    health.record(HealthCounter.STORE_DROPPED);
    int drops = consecutiveDrops.incrementAndGet();
    log.warn("Dropped {} after {} consecutive failures: {}", operation, drops, cause.getMessage());
    if (drops >= policy.degradedThreshold() && degradedRaised.compareAndSet(false, true)) {
      health.markDegraded("store unavailable: " + drops + " consecutive writes dropped");
    }
  }

  @Override
  public void close() {
    calls.shutdownNow();
    delegate.close();
  }

  /**
   * Timeout and retry settings.
   *
   * @param timeoutMillis per-attempt timeout
   * @param maxAttempts attempts per write including the first
   * @param backoffMillis first backoff delay
   * @param maxBackoffMillis backoff ceiling
   * @param degradedThreshold consecutive drops before the pipeline is marked degraded
   */
  public record RetryPolicy(
      long timeoutMillis, int maxAttempts, long backoffMillis, long maxBackoffMillis, int degradedThreshold) {

    public RetryPolicy {
      if (timeoutMillis <= 0 || maxAttempts <= 0 || backoffMillis < 0 || maxBackoffMillis < backoffMillis
          || degradedThreshold <= 0) {
        throw new IllegalArgumentException("invalid store retry policy");
      }
    }

    public static RetryPolicy defaults() {
      return new RetryPolicy(2_000L, 3, 50L, 1_000L, 5);
    }
  }
}
