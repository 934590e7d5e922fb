package com.onthegomap.tilerunner.cleanup;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

class CleanupRegistryTest {

  private final CleanupRegistry registry = new CleanupRegistry();

  @Test
  void testDrainsInReverseOrder() {
    List<String> order = new ArrayList<>();
    registry.register(TransientResource.of("first", () -> order.add("first")));
    registry.register(TransientResource.of("second", () -> order.add("second")));
    registry.register(TransientResource.of("third", () -> order.add("third")));

    var report = registry.drainAll();

    assertEquals(List.of("third", "second", "first"), order);
    assertEquals(3, report.released());
    assertTrue(report.isClean());
    assertEquals(0, registry.pending());
  }

  @Test
  void testDrainRunsOnce() {
    List<String> released = new ArrayList<>();
    registry.register(TransientResource.of("dir", () -> released.add("dir")));

    registry.drainAll();
    assertSame(DrainReport.NOTHING, registry.drainAll());
    assertEquals(List.of("dir"), released);
    assertTrue(registry.isDrained());
    assertThrows(IllegalStateException.class,
      () -> registry.register(TransientResource.of("late", () -> true)));
  }

  @Test
  void testEarlyReleaseIsSkippedByDrain(@TempDir Path tmp) throws IOException {
    Path dir = Files.createDirectories(tmp.resolve("workspace").resolve("nested"));
    Files.writeString(dir.resolve("file.txt"), "data");
    var resource = registry.register(TransientResource.ofPath(tmp.resolve("workspace")));
    registry.register(TransientResource.ofPath(tmp.resolve("missing")));

    assertTrue(registry.release(resource));
    assertTrue(registry.release(resource));
    assertFalse(Files.exists(tmp.resolve("workspace")));
    assertEquals(1, registry.pending());

    var report = registry.drainAll();
    assertEquals(0, report.released());
    assertEquals(2, report.alreadyRemoved());
  }

  @Test
  void testFailureDoesNotStopDrain() {
    List<String> released = new ArrayList<>();
    registry.register(TransientResource.of("ok1", () -> released.add("ok1")));
    registry.register(TransientResource.of("broken", () -> {
      throw new IOException("locked");
    }));
    registry.register(TransientResource.of("ok2", () -> released.add("ok2")));

    var report = registry.drainAll();

    assertEquals(List.of("ok2", "ok1"), released);
    assertFalse(report.isClean());
    assertEquals(1, report.failures().size());
    assertEquals("broken", report.failures().get(0).description());
    assertEquals("locked", report.failures().get(0).error().getMessage());
  }

  @Test
  void testFailedEarlyReleaseIsRetriedByDrain() {
    int[] attempts = {0};
    var resource = registry.register(TransientResource.of("flaky", () -> {
      if (attempts[0]++ == 0) {
        throw new IOException("busy");
      }
      return true;
    }));

    assertFalse(registry.release(resource));
    assertEquals(1, registry.pending());
    assertEquals(1, registry.drainAll().released());
    assertEquals(2, attempts[0]);
  }

  @Test
  void testReleaseUnknownResource() {
    assertThrows(IllegalArgumentException.class, () -> registry.release(TransientResource.of("x", () -> true)));
  }

  @Test
  @Timeout(10)
  void testConcurrentRegistration() throws InterruptedException {
    List<Integer> released = new CopyOnWriteArrayList<>();
    ExecutorService executor = Executors.newFixedThreadPool(4);
    CountDownLatch done = new CountDownLatch(100);
    for (int i = 0; i < 100; i++) {
      int id = i;
      executor.execute(() -> {
        var resource = registry.register(TransientResource.of("r" + id, () -> released.add(id)));
        if (id % 2 == 0) {
          registry.release(resource);
        }
        done.countDown();
      });
    }
    done.await();
    executor.shutdown();
    assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

    assertEquals(50, registry.pending());
    var report = registry.drainAll();
    assertEquals(50, report.released());
    assertEquals(50, report.alreadyRemoved());
    assertEquals(100, released.size());
  }
}
