package ca.gc.cra.meshradar.infrastructure.persistence.memory;

import static ca.gc.cra.meshradar.testutil.MeshFixtures.decoded;
import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.meshradar.domain.mesh.NodeField;
import ca.gc.cra.meshradar.infrastructure.persistence.MeshStoreContract;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class InMemoryMeshStoreTest extends MeshStoreContract {

  @Override
  protected void openStore() {
    InMemoryMeshStore memory = new InMemoryMeshStore();
    store = memory;
    query = memory;
  }

  @Test
  void concurrentCopiesCreateExactlyOnePacket() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Boolean>> results = new ArrayList<>();
      for (int i = 0; i < 32; i++) {
        String gateway = String.format("!%08x", 0xa00 + i);
        results.add(pool.submit(() -> {
          start.await();
          return store.recordPacket(decoded(7, 0x99).gateway(gateway).build()).packetCreated();
        }));
      }
      start.countDown();
      int created = 0;
      for (Future<Boolean> result : results) {
        if (result.get(10, TimeUnit.SECONDS)) {
          created++;
        }
      }
      assertEquals(1, created);
      assertEquals(32, query.observations(7, 0x99).size());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void concurrentMergesConvergeOnNewestValue() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      List<Future<?>> results = new ArrayList<>();
      for (int i = 1; i <= 200; i++) {
        long stamp = i;
        results.add(pool.submit(() -> store.mergeObservation(0x5, NodeField.LONG_NAME, "name-" + stamp, stamp)));
      }
      for (Future<?> result : results) {
        result.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }
    assertEquals("name-200", query.findNode(0x5).orElseThrow().get(NodeField.LONG_NAME).orElseThrow());
    assertEquals(200L, query.findNode(0x5).orElseThrow().lastSeen());
  }
}
