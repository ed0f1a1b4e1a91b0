package io.calx.engine.memory;

/**
 * Snapshot of pool statistics.
 *
 * @param activeExpressions pooled nodes with at least one live handle
 * @param sharedExpressions pooled nodes with more than one live handle
 * @param pooledEntries entries currently held by the pool, live or not
 * @param cacheHits construction requests served by an existing node
 * @param cacheMisses construction requests that created a node
 * @param cowTriggers copies made because an aliased node was written
 * @param estimatedMemoryUsage heuristic footprint of the live pooled expressions, in bytes
 * @param timestampNanos clock reading when the snapshot was taken
 */
public record MemoryStats(
    long activeExpressions,
    long sharedExpressions,
    long pooledEntries,
    long cacheHits,
    long cacheMisses,
    long cowTriggers,
    long estimatedMemoryUsage,
    long timestampNanos) {

  /**
   * Returns the pool hit rate as a percentage (0-100).
   *
   * @return the hit rate percentage
   */
  public double hitRate() {
    long total = cacheHits + cacheMisses;
    if (total == 0) {
      return 0.0;
    }
    return (cacheHits * 100.0) / total;
  }
}
