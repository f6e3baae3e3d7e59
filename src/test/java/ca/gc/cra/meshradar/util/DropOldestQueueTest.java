package ca.gc.cra.meshradar.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class DropOldestQueueTest {

  @Test
  void fullQueueEvictsOldestEntry() {
    DropOldestQueue<Integer> queue = new DropOldestQueue<>(3);

    for (int i = 1; i <= 3; i++) {
      assertNull(queue.offer(i));
    }
    assertEquals(1, queue.offer(4));
    assertEquals(2, queue.offer(5));

    List<Integer> drained = new ArrayList<>();
    assertEquals(3, queue.drainTo(drained, 10));
    assertEquals(List.of(3, 4, 5), drained);
    assertEquals(2, queue.evictions());
  }

  @Test
  void pollTimesOutWhenEmpty() throws InterruptedException {
    DropOldestQueue<String> queue = new DropOldestQueue<>(1);

    assertNull(queue.poll(10, TimeUnit.MILLISECONDS));
  }

  @Test
  void pollWakesOnOffer() throws InterruptedException {
    DropOldestQueue<String> queue = new DropOldestQueue<>(1);
    CountDownLatch polling = new CountDownLatch(1);
    Thread producer = new Thread(() -> {
      try {
        polling.await();
        queue.offer("event");
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    });
    producer.start();

    polling.countDown();
    assertEquals("event", queue.poll(5, TimeUnit.SECONDS));
    producer.join();
  }

  @Test
  void clearDiscardsQueuedEntries() {
    DropOldestQueue<Integer> queue = new DropOldestQueue<>(3);
    queue.offer(1);
    queue.offer(2);

    assertEquals(2, queue.clear());
    assertEquals(0, queue.size());
  }

  @Test
  void capacityMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new DropOldestQueue<>(0));
  }
}
