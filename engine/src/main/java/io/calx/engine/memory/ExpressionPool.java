package io.calx.engine.memory;

import io.calx.engine.expr.Expression;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import java.lang.ref.WeakReference;
import java.util.Objects;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MemoryManager} backed by a primitive-keyed index from structural hash to a chain of
 * entries. A lookup confirms a hash match with structural equality before reusing a node.
 */
final class ExpressionPool implements MemoryManager, ExpressionNode.CopyObserver {
  private static final Logger log = LoggerFactory.getLogger(ExpressionPool.class);

  /** Per entry bookkeeping: the entry, its weak reference and the index slot. */
  static final long ENTRY_OVERHEAD_BYTES = 64;

  private final MemoryConfig config;
  private final LongSupplier clock;
  private final Long2ObjectOpenHashMap<PoolEntry> index = new Long2ObjectOpenHashMap<>();

  private int size;
  private long hits;
  private long misses;
  private long cowTriggers;
  private long lastCleanup;

  ExpressionPool(MemoryConfig config, LongSupplier clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.lastCleanup = clock.getAsLong();
  }

  @Override
  public SharedExpression createShared(Expression expression) {
    Objects.requireNonNull(expression, "expression");
    if (!config.enableSharing()) {
      misses++;
      return new SharedExpression(new ExpressionNode(expression, this));
    }
    long hash = expression.structuralHash();
    PoolEntry head = index.get(hash);
    for (PoolEntry e = head; e != null; e = e.next) {
      ExpressionNode node = e.node.get();
      if (node != null && node.value.equals(expression)) {
        hits++;
        node.refCount++;
        return new SharedExpression(node);
      }
    }
    misses++;
    ExpressionNode node = new ExpressionNode(expression, this);
    if (size < config.maxPoolSize()) {
      index.put(hash, new PoolEntry(hash, node, head));
      size++;
    }
    return new SharedExpression(node);
  }

  @Override
  public void recordHit() {
    hits++;
  }

  @Override
  public void copiedOnWrite() {
    cowTriggers++;
  }

  @Override
  public MemoryStats getStats() {
    MemoryStats stats = snapshot();
    if (shouldCleanup(stats)) {
      int removed = cleanup();
      if (removed > 0) {
        stats = snapshot();
      }
    }
    return stats;
  }

  private boolean shouldCleanup(MemoryStats stats) {
    long elapsed = stats.timestampNanos() - lastCleanup;
    return elapsed >= config.cleanupInterval().toNanos()
        || stats.estimatedMemoryUsage() >= config.cleanupThresholdBytes();
  }

  private MemoryStats snapshot() {
    long active = 0;
    long shared = 0;
    long bytes = 0;
    for (PoolEntry head : index.values()) {
      for (PoolEntry e = head; e != null; e = e.next) {
        ExpressionNode node = e.node.get();
        if (node == null || node.refCount <= 0) {
          continue;
        }
        active++;
        if (node.refCount > 1) {
          shared++;
        }
        bytes += node.value.estimatedBytes() + ENTRY_OVERHEAD_BYTES;
      }
    }
    return new MemoryStats(
        active, shared, size, hits, misses, cowTriggers, bytes, clock.getAsLong());
  }

  @Override
  public int cleanup() {
    int before = size;
    long[] keys = index.keySet().toLongArray();
    for (long key : keys) {
      PoolEntry kept = null;
      PoolEntry tail = null;
      for (PoolEntry e = index.get(key); e != null; e = e.next) {
        if (!isRetained(e)) {
          size--;
          continue;
        }
        PoolEntry copy = new PoolEntry(e.hash, e.node, null);
        if (kept == null) {
          kept = copy;
        } else {
          tail.next = copy;
        }
        tail = copy;
      }
      if (kept == null) {
        index.remove(key);
      } else {
        index.put(key, kept);
      }
    }
    lastCleanup = clock.getAsLong();
    int removed = before - size;
    log.debug("Pool cleanup removed {} of {} entries", removed, before);
    return removed;
  }

  private static boolean isRetained(PoolEntry e) {
    ExpressionNode node = e.node.get();
    return node != null && node.refCount > 0 && node.value.structuralHash() == e.hash;
  }

  @Override
  public void clearAll() {
    index.clear();
    size = 0;
    hits = 0;
    misses = 0;
    cowTriggers = 0;
    lastCleanup = clock.getAsLong();
    log.debug("Pool cleared");
  }

  @Override
  public int poolSize() {
    return size;
  }

  @Override
  public MemoryConfig config() {
    return config;
  }

  private static final class PoolEntry {
    final long hash;
    final WeakReference<ExpressionNode> node;
    PoolEntry next;

    PoolEntry(long hash, ExpressionNode node, PoolEntry next) {
      this(hash, new WeakReference<>(node), next);
    }

    PoolEntry(long hash, WeakReference<ExpressionNode> node, PoolEntry next) {
      this.hash = hash;
      this.node = node;
      this.next = next;
    }
  }
}
