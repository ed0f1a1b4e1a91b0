package io.calx.engine;

import io.calx.engine.builder.ExpressionBuilder;
import io.calx.engine.expr.Evaluator;
import io.calx.engine.memory.MemoryManager;
import io.calx.engine.memory.MemoryMonitor;
import io.calx.engine.memory.MemoryStats;
import io.calx.engine.simplify.Simplifier;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-session context. Owns one memory manager with its builder, a simplifier, an evaluator and
 * a monitor, so independent computations never share pools or caches.
 *
 * <p>A session belongs to one thread at a time.
 */
public final class CalxSession implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CalxSession.class);

  private final EngineConfig config;
  private final MemoryManager memory;
  private final ExpressionBuilder builder;
  private final Simplifier simplifier;
  private final Evaluator evaluator;
  private final MemoryMonitor monitor;
  private final long startNanos = System.nanoTime();
  private boolean closed;

  private CalxSession(EngineConfig config) {
    this.config = config;
    this.memory = MemoryManager.create(config.memory());
    this.builder = new ExpressionBuilder(memory);
    this.simplifier = Simplifier.create(config);
    this.evaluator = new Evaluator(config.allowComplexResults());
    this.monitor = new MemoryMonitor(memory);
  }

  public static CalxSession create() {
    return create(EngineConfig.defaults());
  }

  public static CalxSession create(EngineConfig config) {
    return new CalxSession(Objects.requireNonNull(config, "config"));
  }

  public EngineConfig config() {
    return config;
  }

  public ExpressionBuilder builder() {
    checkOpen();
    return builder;
  }

  public Simplifier simplifier() {
    checkOpen();
    return simplifier;
  }

  public Evaluator evaluator() {
    return evaluator;
  }

  public MemoryManager memory() {
    checkOpen();
    return memory;
  }

  public MemoryMonitor monitor() {
    return monitor;
  }

  public Duration uptime() {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }

  public boolean isClosed() {
    return closed;
  }

  /** Clears the pool and the simplifier cache. Handles obtained earlier stay usable. */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    MemoryStats last = memory.getStats();
    monitor.disable();
    simplifier.clearCache();
    memory.clearAll();
    log.debug(
        "Session closed after {} ms: {} pooled, {} hits, {} misses",
        uptime().toMillis(),
        last.pooledEntries(),
        last.cacheHits(),
        last.cacheMisses());
  }

  private void checkOpen() {
    if (closed) {
      throw new IllegalStateException("Session is closed");
    }
  }
}
