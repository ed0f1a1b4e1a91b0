package io.calx.engine.memory;

import static org.junit.jupiter.api.Assertions.*;

import io.calx.engine.expr.Expression;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MemoryManagerTest {
  private final Expression x = Expression.variable("x");
  private final Expression sinX = Expression.sin(Expression.variable("x"));

  private AtomicLong now;
  private ExpressionPool pool;

  @BeforeEach
  void setUp() {
    now = new AtomicLong();
    pool = new ExpressionPool(MemoryConfig.defaults(), now::get);
  }

  // ===== Lookup =====

  @Test
  void testSecondRequestIsAHit() {
    SharedExpression a = pool.createShared(sinX);
    SharedExpression b = pool.createShared(Expression.sin(x));

    assertTrue(a.sharesNodeWith(b));
    assertEquals(2, a.refCount());

    MemoryStats stats = pool.getStats();
    assertEquals(1, stats.cacheHits());
    assertEquals(1, stats.cacheMisses());
    assertEquals(1, stats.pooledEntries());
    assertEquals(1, stats.activeExpressions());
    assertEquals(1, stats.sharedExpressions());
    assertEquals(50.0, stats.hitRate(), 1e-9);
  }

  @Test
  void testDistinctExpressionsAreDistinctNodes() {
    SharedExpression a = pool.createShared(x);
    SharedExpression b = pool.createShared(sinX);
    assertFalse(a.sharesNodeWith(b));
    assertEquals(2, pool.poolSize());
    assertEquals(0, pool.getStats().sharedExpressions());
  }

  @Test
  void testSharingDisabled() {
    ExpressionPool unshared =
        new ExpressionPool(MemoryConfig.defaults().withSharing(false), now::get);
    SharedExpression a = unshared.createShared(x);
    SharedExpression b = unshared.createShared(x);
    assertFalse(a.sharesNodeWith(b));
    assertEquals(0, unshared.poolSize());
    assertEquals(2, unshared.getStats().cacheMisses());
    assertEquals(a, b);
  }

  @Test
  void testPoolSizeLimit() {
    ExpressionPool small = new ExpressionPool(MemoryConfig.defaults().withMaxPoolSize(1), now::get);
    small.createShared(x);
    SharedExpression first = small.createShared(sinX);
    SharedExpression second = small.createShared(sinX);
    assertEquals(1, small.poolSize());
    assertFalse(first.sharesNodeWith(second));
  }

  @Test
  void testRecordHitCountsWithoutPooling() {
    pool.recordHit();
    assertEquals(1, pool.getStats().cacheHits());
    assertEquals(0, pool.poolSize());
  }

  // ===== Cleanup =====

  @Test
  void testCleanupDropsReleasedEntries() {
    SharedExpression kept = pool.createShared(x);
    SharedExpression dropped = pool.createShared(sinX);
    dropped.release();

    assertEquals(1, pool.getStats().activeExpressions());
    assertEquals(1, pool.cleanup());
    assertEquals(1, pool.poolSize());
    assertTrue(pool.createShared(x).sharesNodeWith(kept));
  }

  @Test
  void testEntryStaysWhileAnyHandleLives() {
    SharedExpression a = pool.createShared(x);
    SharedExpression b = a.cloneShared();
    a.release();
    assertEquals(0, pool.cleanup());
    b.release();
    assertEquals(1, pool.cleanup());
    assertEquals(0, pool.poolSize());
  }

  @Test
  void testInPlaceWriteInvalidatesEntry() {
    SharedExpression handle = pool.createShared(x);
    handle.makeMut().set(Expression.variable("y"));

    SharedExpression fresh = pool.createShared(x);
    assertFalse(fresh.sharesNodeWith(handle));
    assertEquals(1, pool.cleanup());
    assertEquals(Expression.variable("y"), handle.get());
  }

  @Test
  void testStatsTriggerCleanupAfterInterval() {
    ExpressionPool timed =
        new ExpressionPool(
            MemoryConfig.defaults().withCleanupInterval(Duration.ofSeconds(10)), now::get);
    timed.createShared(x).release();
    assertEquals(1, timed.getStats().pooledEntries());

    now.addAndGet(Duration.ofSeconds(11).toNanos());
    assertEquals(0, timed.getStats().pooledEntries());
  }

  @Test
  void testStatsTriggerCleanupAboveThreshold() {
    MemoryConfig tiny = new MemoryConfig(true, 100, 10, 1, Duration.ofHours(1));
    ExpressionPool pressured = new ExpressionPool(tiny, now::get);
    SharedExpression live = pressured.createShared(x);
    pressured.createShared(sinX).release();

    MemoryStats stats = pressured.getStats();
    assertEquals(1, stats.pooledEntries());
    assertTrue(live.isUnique());
  }

  @Test
  void testClearAll() {
    pool.createShared(x);
    pool.createShared(x);
    pool.clearAll();
    MemoryStats stats = pool.getStats();
    assertEquals(0, stats.pooledEntries());
    assertEquals(0, stats.cacheHits());
    assertEquals(0, stats.cacheMisses());
  }

  // ===== Accounting =====

  @Test
  void testCopyOnWriteIsCounted() {
    SharedExpression a = pool.createShared(x);
    SharedExpression b = a.cloneShared();
    b.makeMut().set(sinX);
    assertEquals(1, pool.getStats().cowTriggers());
    a.makeMut().set(sinX);
    assertEquals(1, pool.getStats().cowTriggers());
  }

  @Test
  void testEstimatedUsageGrowsWithLiveNodes() {
    pool.createShared(x);
    long small = pool.getStats().estimatedMemoryUsage();
    pool.createShared(Expression.add(sinX, Expression.cos(x)));
    long large = pool.getStats().estimatedMemoryUsage();
    assertTrue(small >= ExpressionPool.ENTRY_OVERHEAD_BYTES);
    assertTrue(large > small);
  }

  @Test
  void testDefaultFactory() {
    MemoryManager manager = MemoryManager.create();
    assertEquals(MemoryConfig.defaults(), manager.config());
    SharedExpression a = manager.createShared(x);
    assertTrue(manager.createShared(x).sharesNodeWith(a));
  }
}
