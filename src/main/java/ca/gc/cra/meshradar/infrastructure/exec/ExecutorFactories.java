package ca.gc.cra.meshradar.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the executors behind MESHRADAR's pipeline stages.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size pool for long-running worker loops (decode and store workers).
   *
   * <p>Threads are non-daemon so shutdown is explicit. The hand-off queue is synchronous: submitting more loops than
   * {@code size} is rejected.</p>
   *
   * @param size number of worker threads to allocate
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service
   */
  public static ExecutorService newWorkerPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "meshradar-worker" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNull(handler, "handler");
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new SynchronousQueue<>(),
        namedThreads(threadPrefix, false, effectiveHandler),
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds a pool that runs individual store calls so callers can bound them with a timeout.
   *
   * <p>Threads are daemon: an abandoned call stuck in I/O must not keep the JVM alive.</p>
   *
   * @param size maximum concurrent calls
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler installed on each thread
   * @return configured executor service
   */
  public static ExecutorService newCallPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    ThreadPoolExecutor executor = new ThreadPoolExecutor(
        size,
        size,
        30L,
        TimeUnit.SECONDS,
        new LinkedBlockingQueue<>(),
        namedThreads(prefix, true, Objects.requireNonNull(handler, "handler")),
        new ThreadPoolExecutor.AbortPolicy());
    executor.allowCoreThreadTimeOut(true);
    return executor;
  }

  private static ThreadFactory namedThreads(String prefix, boolean daemon, UncaughtExceptionHandler handler) {
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(prefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(handler);
      return thread;
    };
  }
}
