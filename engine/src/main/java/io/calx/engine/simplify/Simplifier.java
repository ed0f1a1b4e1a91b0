package io.calx.engine.simplify;

import io.calx.engine.EngineConfig;
import io.calx.engine.expr.Expression;
import io.calx.engine.memory.SharedExpression;
import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites expressions to canonical form by repeated application of the enabled {@link
 * RuleFamily rule families} until nothing changes.
 *
 * <p>Simplification is total and deterministic: every well-formed expression either reaches a
 * fixed point or the call ends with {@link RewriteBudgetExceededException}. Simplifying a result
 * again returns it unchanged.
 *
 * <p>Instances are not thread-safe.
 */
public interface Simplifier {
  /**
   * Creates a simplifier with the default configuration.
   *
   * @return a new simplifier
   */
  static Simplifier create() {
    return create(EngineConfig.defaults());
  }

  /**
   * Creates a simplifier with the given pass budget, cache size and rule families.
   *
   * @param config engine configuration
   * @return a new simplifier
   */
  static Simplifier create(EngineConfig config) {
    List<RewriteRule> rules = new ArrayList<>();
    for (RuleFamily family : RuleFamily.values()) {
      if (config.enabledFamilies().contains(family)) {
        rules.add(family.newRule());
      }
    }
    return new RewriteEngine(rules, config.maxRewritePasses(), config.simplificationCacheSize());
  }

  /**
   * Simplifies with the configured pass budget.
   *
   * @throws RewriteBudgetExceededException if no fixed point is reached within the budget
   */
  Expression simplify(Expression expression);

  /**
   * Simplifies with an explicit pass budget.
   *
   * @param maxPasses maximum number of passes, the pass confirming the fixed point included
   * @throws RewriteBudgetExceededException if no fixed point is reached within the budget
   */
  Expression simplify(Expression expression, int maxPasses);

  /**
   * Simplifies a handle. When nothing changes a clone of {@code expression} is returned,
   * otherwise a new unique handle. The argument is not released.
   */
  SharedExpression simplify(SharedExpression expression);

  RewriteStats stats();

  /** Drops cached results and resets the counters. */
  void clearCache();
}
