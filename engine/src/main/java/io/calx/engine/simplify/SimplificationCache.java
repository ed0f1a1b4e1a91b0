package io.calx.engine.simplify;

import io.calx.engine.expr.Expression;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * LRU memo of simplification results keyed by structural equality. Both the input and the fixed
 * point are stored, so simplifying a result again is a hit.
 *
 * <p>Not thread-safe; one instance belongs to one engine.
 */
final class SimplificationCache {
  private final int maxSize;
  private final Map<Expression, Expression> cache;
  private long hits;
  private long misses;
  private long evictions;

  SimplificationCache(int maxSize) {
    if (maxSize < 0) {
      throw new IllegalArgumentException("maxSize must be >= 0: " + maxSize);
    }
    this.maxSize = maxSize;
    // access order for LRU
    this.cache =
        new LinkedHashMap<Expression, Expression>(16, 0.75f, true) {
          @Override
          protected boolean removeEldestEntry(Map.Entry<Expression, Expression> eldest) {
            if (size() > SimplificationCache.this.maxSize) {
              evictions++;
              return true;
            }
            return false;
          }
        };
  }

  /** @return the cached fixed point of {@code input}, or {@code null} */
  Expression get(Expression input) {
    Expression result = cache.get(input);
    if (result != null) {
      hits++;
    } else {
      misses++;
    }
    return result;
  }

  void put(Expression input, Expression result) {
    if (maxSize == 0) {
      return;
    }
    cache.put(input, result);
    if (!input.equals(result)) {
      cache.put(result, result);
    }
  }

  int size() {
    return cache.size();
  }

  long hits() {
    return hits;
  }

  long misses() {
    return misses;
  }

  long evictions() {
    return evictions;
  }

  /**
   * Returns the cache hit rate as a percentage (0-100).
   *
   * @return the hit rate percentage
   */
  double hitRate() {
    long total = hits + misses;
    if (total == 0) {
      return 0.0;
    }
    return (hits * 100.0) / total;
  }

  /** Clears all cached entries and resets statistics. */
  void clear() {
    cache.clear();
    hits = 0;
    misses = 0;
    evictions = 0;
  }
}
