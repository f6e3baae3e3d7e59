package ca.gc.cra.meshradar.util;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO whose {@link #offer(Object)} never blocks: when full, the oldest element is evicted to make room.
 *
 * <p>Used where producers must not be slowed by consumers: the broker callback thread and live hub publishers.</p>
 *
 * @param <T> element type
 * @since 0.1.0
 */
public final class DropOldestQueue<T> {
  private final int capacity;
  private final ArrayDeque<T> items;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private long evictions;

  /**
   * Creates a queue.
   *
   * @param capacity maximum number of retained elements; must be positive
   */
  public DropOldestQueue(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
    this.items = new ArrayDeque<>(capacity);
  }

  /**
   * Appends an element, evicting the oldest one when the queue is full.
   *
   * @param item element to append
   * @return evicted element, or {@code null} when nothing was evicted
   */
  public T offer(T item) {
    Objects.requireNonNull(item, "item");
    lock.lock();
    try {
      T evicted = null;
      if (items.size() >= capacity) {
        evicted = items.pollFirst();
        evictions++;
      }
      items.addLast(item);
      notEmpty.signal();
      return evicted;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes the oldest element, waiting up to the timeout for one to arrive.
   *
   * @param timeout maximum wait
   * @param unit unit of {@code timeout}
   * @return oldest element, or {@code null} on timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public T poll(long timeout, TimeUnit unit) throws InterruptedException {
    long nanos = unit.toNanos(timeout);
    lock.lockInterruptibly();
    try {
      while (items.isEmpty()) {
        if (nanos <= 0L) {
          return null;
        }
        nanos = notEmpty.awaitNanos(nanos);
      }
      return items.pollFirst();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Moves up to {@code maxElements} queued elements into {@code sink}, oldest first.
   *
   * @param sink destination
   * @param maxElements maximum to move
   * @return number moved
   */
  public int drainTo(Collection<? super T> sink, int maxElements) {
    lock.lock();
    try {
      int moved = 0;
      while (moved < maxElements && !items.isEmpty()) {
        sink.add(items.pollFirst());
        moved++;
      }
      return moved;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Discards every queued element.
   *
   * @return number discarded
   */
  public int clear() {
    lock.lock();
    try {
      int discarded = items.size();
      items.clear();
      return discarded;
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return items.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Total elements evicted since creation.
   *
   * @return eviction count
   */
  public long evictions() {
    lock.lock();
    try {
      return evictions;
    } finally {
      lock.unlock();
    }
  }
}
