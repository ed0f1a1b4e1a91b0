package io.calx.engine.simplify;

/**
 * Counters of a {@link Simplifier} since creation or the last {@link Simplifier#clearCache()}.
 *
 * @param simplifications calls that ran the rewrite loop (cache hits excluded)
 * @param passes rewrite passes over all calls, confirming passes included
 * @param rewrites individual rule applications
 * @param budgetExhaustions calls that ended with {@link RewriteBudgetExceededException}
 * @param cacheHits calls answered from the cache
 * @param cacheMisses calls not answered from the cache
 * @param cacheEvictions entries dropped by the LRU policy
 * @param cacheSize current number of cached entries
 */
public record RewriteStats(
    long simplifications,
    long passes,
    long rewrites,
    long budgetExhaustions,
    long cacheHits,
    long cacheMisses,
    long cacheEvictions,
    int cacheSize) {

  /**
   * Returns the cache hit rate as a percentage (0-100).
   *
   * @return the hit rate percentage
   */
  public double cacheHitRate() {
    long total = cacheHits + cacheMisses;
    if (total == 0) {
      return 0.0;
    }
    return (cacheHits * 100.0) / total;
  }
}
