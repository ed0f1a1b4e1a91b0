package io.calx.engine.memory;

import io.calx.engine.expr.Expression;

/**
 * Hash-consing pool for expression nodes.
 *
 * <p>{@link #createShared} returns a handle to an existing node when a structurally equal
 * expression is already pooled, so equal subtrees built through one manager share storage. The
 * pool does not keep nodes alive on its own: it holds weak references, does not count towards a
 * node's reference count, and {@link #cleanup()} drops entries nobody holds a handle to.
 *
 * <p>Not thread-safe. Use one manager per session or thread, or guard it externally.
 */
public interface MemoryManager {

  /**
   * Creates a manager with {@link MemoryConfig#defaults() default} settings.
   *
   * @return a new manager
   */
  static MemoryManager create() {
    return create(MemoryConfig.defaults());
  }

  /**
   * Creates a manager with the given settings.
   *
   * @param config pool settings
   * @return a new manager
   */
  static MemoryManager create(MemoryConfig config) {
    return new ExpressionPool(config, System::nanoTime);
  }

  /**
   * Returns a handle for {@code expression}, reusing a pooled node when one is structurally equal.
   * Every call counts as either a hit or a miss.
   */
  SharedExpression createShared(Expression expression);

  /** Counts a request that a caller served from its own cache (e.g. interned leaves). */
  void recordHit();

  MemoryStats getStats();

  /**
   * Removes entries whose node has no live handle, was collected, or was rewritten in place.
   *
   * @return number of removed entries
   */
  int cleanup();

  /** Drops every entry and resets statistics. Existing handles stay valid. */
  void clearAll();

  int poolSize();

  MemoryConfig config();
}
