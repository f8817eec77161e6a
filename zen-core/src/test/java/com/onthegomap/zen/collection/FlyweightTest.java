package com.onthegomap.zen.collection;

import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.zen.util.ZenException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

class FlyweightTest {

  @Test
  void testReturnsSameValueForEqualKeys() {
    Flyweight<String, Object> table = new Flyweight<>();
    AtomicInteger builds = new AtomicInteger();
    Object a = table.getOrAdd("a", () -> {
      builds.incrementAndGet();
      return new Object();
    });
    Object b = table.getOrAdd(new String("a"), () -> {
      builds.incrementAndGet();
      return new Object();
    });
    assertSame(a, b);
    assertEquals(1, builds.get());
    assertEquals(1, table.size());
    assertTrue(table.contains("a"));
    assertFalse(table.contains("b"));
  }

  @Test
  void testBuildArgsPassedToBuilder() {
    Flyweight<Integer, String> table = new Flyweight<>();
    assertEquals("x10", table.getOrAdd(1, 10, i -> "x" + i));
    assertEquals("x10", table.getOrAdd(1, 20, i -> "x" + i));
  }

  @Test
  void testBuilderMayReenterTable() {
    Flyweight<Integer, String> table = new Flyweight<>();
    String result = table.getOrAdd(3, () -> table.getOrAdd(2, () -> table.getOrAdd(1, () -> "1") + "2") + "3");
    assertEquals("123", result);
    assertEquals(3, table.size());
    assertEquals("12", table.getOrAdd(2, () -> "other"));
  }

  @Test
  void testNullBuildRejected() {
    Flyweight<Integer, String> table = new Flyweight<>();
    assertThrows(ZenException.class, () -> table.getOrAdd(1, () -> null));
    assertFalse(table.contains(1));
  }

  @Test
  void testSeed() {
    Flyweight<Integer, String> table = new Flyweight<>();
    assertEquals("a", table.seed(1, "a"));
    assertEquals("a", table.seed(1, "b"));
    assertEquals("a", table.getOrAdd(1, () -> "c"));
  }

  @Test
  void testArrayKey() {
    assertEquals(Flyweight.arrayKey("a", 1L, 2), Flyweight.arrayKey("a", 1L, 2));
    assertEquals(Flyweight.arrayKey("a", 1L, 2).hashCode(), Flyweight.arrayKey("a", 1L, 2).hashCode());
    assertNotEquals(Flyweight.arrayKey("a", 1L, 2), Flyweight.arrayKey("a", 2, 1L));
    assertNotEquals(Flyweight.arrayKey("a"), Flyweight.arrayKey("a", "b"));
  }

  @Test
  void testArrayKeyCopiesParts() {
    Object[] parts = {"a", "b"};
    var key = Flyweight.arrayKey(parts);
    parts[1] = "c";
    assertEquals(Flyweight.arrayKey("a", "b"), key);
  }

  @Test
  @Timeout(30)
  void testConcurrentCallersSeeOneValue() throws Exception {
    int threads = 8;
    Flyweight<Integer, Object> table = new Flyweight<>();
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      List<Future<List<Object>>> futures = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        futures.add(executor.submit(() -> {
          start.await();
          List<Object> results = new ArrayList<>();
          for (int i = 0; i < 1_000; i++) {
            results.add(table.getOrAdd(i, Object::new));
          }
          return results;
        }));
      }
      start.countDown();
      List<Object> first = futures.get(0).get();
      for (var future : futures) {
        List<Object> other = future.get();
        for (int i = 0; i < first.size(); i++) {
          assertSame(first.get(i), other.get(i), "key " + i);
        }
      }
      Set<Object> distinct = ConcurrentHashMap.newKeySet();
      distinct.addAll(first);
      assertEquals(1_000, distinct.size());
      assertEquals(1_000, table.size());
    } finally {
      executor.shutdownNow();
      assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
    }
  }

  @Test
  @Timeout(30)
  void testBuilderRunsOncePerKey() throws Exception {
    Flyweight<String, Object> table = new Flyweight<>();
    AtomicInteger builds = new AtomicInteger();
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    AtomicReference<Thread> second = new AtomicReference<>();
    ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      Future<Object> first = executor.submit(() -> table.getOrAdd("k", () -> {
        builds.incrementAndGet();
        entered.countDown();
        try {
          release.await();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException(e);
        }
        return new Object();
      }));
      assertTrue(entered.await(10, TimeUnit.SECONDS));
      Future<Object> waiting = executor.submit(() -> {
        second.set(Thread.currentThread());
        return table.getOrAdd("k", () -> {
          builds.incrementAndGet();
          return new Object();
        });
      });
      // wait until the second caller blocks on the in-progress build
      while (second.get() == null || second.get().getState() != Thread.State.WAITING) {
        Thread.sleep(1);
      }
      release.countDown();
      assertSame(first.get(), waiting.get());
      assertEquals(1, builds.get());
      assertEquals(1, table.size());
    } finally {
      executor.shutdownNow();
      assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
    }
  }

  @Test
  void testBuilderRequestingOwnKeyRejected() {
    Flyweight<Integer, String> table = new Flyweight<>();
    assertThrows(ZenException.class, () -> table.getOrAdd(1, () -> table.getOrAdd(1, () -> "inner")));
    assertFalse(table.contains(1));
  }

  @Test
  void testFailedBuildCanBeRetried() {
    Flyweight<Integer, String> table = new Flyweight<>();
    assertThrows(IllegalStateException.class, () -> table.getOrAdd(1, () -> {
      throw new IllegalStateException("boom");
    }));
    assertFalse(table.contains(1));
    assertEquals("ok", table.getOrAdd(1, () -> "ok"));
  }
}
