package dev.podflow.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void queuesTasksBeyondPoolSize() throws Exception {
    ExecutorService pool = ExecutorFactories.newPublishPool(1, null, null);
    try {
      CountDownLatch release = new CountDownLatch(1);
      List<Future<String>> futures = new ArrayList<>();
      for (int i = 0; i < 3; i++) {
        futures.add(pool.submit(() -> {
          release.await(5, TimeUnit.SECONDS);
          return Thread.currentThread().getName();
        }));
      }
      release.countDown();

      for (Future<String> future : futures) {
        assertEquals("podflow-publish-0", future.get(5, TimeUnit.SECONDS));
      }
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void workerThreadsAreDaemonsWithPrefix() throws Exception {
    ExecutorService pool = ExecutorFactories.newPublishPool(2, "fanout", (t, ex) -> {});
    try {
      Thread worker = pool.submit(Thread::currentThread).get(5, TimeUnit.SECONDS);
      assertTrue(worker.isDaemon());
      assertTrue(worker.getName().startsWith("fanout-"));
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void rejectsNonPositiveSize() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newPublishPool(0, "p", null));
  }
}
