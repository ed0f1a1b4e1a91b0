package io.calx.engine.simplify;

import io.calx.engine.expr.Expression;
import io.calx.engine.expr.Expressions;
import io.calx.engine.memory.SharedExpression;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-point rewriter. Each pass rebuilds the tree bottom-up; at every node the rules are tried
 * in order and the first one that changes the node wins, for at most {@link #LOCAL_STEPS} steps.
 * A pass without any rewrite ends the loop.
 */
final class RewriteEngine implements Simplifier {
  private static final Logger log = LoggerFactory.getLogger(RewriteEngine.class);

  static final int LOCAL_STEPS = 8;

  private final List<RewriteRule> rules;
  private final int maxPasses;
  private final SimplificationCache cache;

  private long simplifications;
  private long passes;
  private long rewrites;
  private long budgetExhaustions;

  RewriteEngine(List<RewriteRule> rules, int maxPasses, int cacheSize) {
    if (maxPasses < 1) {
      throw new IllegalArgumentException("maxPasses must be >= 1: " + maxPasses);
    }
    this.rules = List.copyOf(rules);
    this.maxPasses = maxPasses;
    this.cache = new SimplificationCache(cacheSize);
  }

  @Override
  public Expression simplify(Expression expression) {
    return simplify(expression, maxPasses);
  }

  @Override
  public Expression simplify(Expression expression, int maxPasses) {
    Objects.requireNonNull(expression, "expression");
    if (maxPasses < 1) {
      throw new IllegalArgumentException("maxPasses must be >= 1: " + maxPasses);
    }
    Expression cached = cache.get(expression);
    if (cached != null) {
      return cached;
    }
    simplifications++;
    Expression current = expression;
    for (int pass = 1; pass <= maxPasses; pass++) {
      PassState state = new PassState();
      Expression next =
          Expressions.<Expression>fold(
              current, (node, children) -> rewriteNode(node.withChildren(children), state));
      passes++;
      if (state.rewrites == 0) {
        log.trace("Fixed point after {} passes: {}", pass, next);
        cache.put(expression, next);
        return next;
      }
      rewrites += state.rewrites;
      current = next;
    }
    budgetExhaustions++;
    log.debug("Rewrite budget of {} passes exhausted, last form {}", maxPasses, current);
    throw new RewriteBudgetExceededException(maxPasses, current);
  }

  @Override
  public SharedExpression simplify(SharedExpression expression) {
    Expression input = expression.get();
    Expression result = simplify(input);
    return result.equals(input) ? expression.cloneShared() : SharedExpression.of(result);
  }

  private Expression rewriteNode(Expression node, PassState state) {
    Expression current = node;
    for (int step = 0; step < LOCAL_STEPS; step++) {
      Expression rewritten = firstRewrite(current);
      if (rewritten == null) {
        break;
      }
      state.rewrites++;
      current = rewritten;
    }
    return current;
  }

  private Expression firstRewrite(Expression node) {
    for (RewriteRule rule : rules) {
      Optional<Expression> result = rule.apply(node);
      if (result.isPresent() && !result.get().equals(node)) {
        return result.get();
      }
    }
    return null;
  }

  @Override
  public RewriteStats stats() {
    return new RewriteStats(
        simplifications,
        passes,
        rewrites,
        budgetExhaustions,
        cache.hits(),
        cache.misses(),
        cache.evictions(),
        cache.size());
  }

  @Override
  public void clearCache() {
    cache.clear();
    simplifications = 0;
    passes = 0;
    rewrites = 0;
    budgetExhaustions = 0;
  }

  private static final class PassState {
    int rewrites;
  }
}
