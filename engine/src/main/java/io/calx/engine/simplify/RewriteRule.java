package io.calx.engine.simplify;

import io.calx.engine.expr.Expression;
import java.util.Optional;

/**
 * A local rewrite. The engine calls {@link #apply} on every node, bottom-up, after the node's
 * children have been rewritten.
 *
 * <p>Implementations must be pure: the same node always yields the same answer. Returning a value
 * structurally equal to the input counts as no rewrite.
 */
@FunctionalInterface
public interface RewriteRule {
  /**
   * @param node the node to inspect; its children are already rewritten for this pass
   * @return the replacement, or empty when the rule does not apply
   */
  Optional<Expression> apply(Expression node);
}
