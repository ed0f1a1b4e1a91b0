package io.calx.engine.memory;

import io.calx.engine.expr.Expression;

/**
 * Equality checks that count which short cut decided them. Useful to judge how much sharing a
 * workload actually gets.
 */
public final class ExpressionComparator {
  private long identityHits;
  private long hashRejections;
  private long deepComparisons;

  /**
   * Same reference is equal, differing cached hashes are not, anything else is compared
   * structurally.
   */
  public boolean fastEquals(Expression a, Expression b) {
    if (a == b) {
      identityHits++;
      return true;
    }
    if (a.structuralHash() != b.structuralHash()) {
      hashRejections++;
      return false;
    }
    deepComparisons++;
    return a.equals(b);
  }

  public boolean fastEquals(SharedExpression a, SharedExpression b) {
    if (a.sharesNodeWith(b)) {
      identityHits++;
      return true;
    }
    return fastEquals(a.get(), b.get());
  }

  public long identityHits() {
    return identityHits;
  }

  public long hashRejections() {
    return hashRejections;
  }

  public long deepComparisons() {
    return deepComparisons;
  }

  public void reset() {
    identityHits = 0;
    hashRejections = 0;
    deepComparisons = 0;
  }
}
