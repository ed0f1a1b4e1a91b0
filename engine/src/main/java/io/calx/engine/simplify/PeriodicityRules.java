package io.calx.engine.simplify;

import io.calx.engine.expr.Expression;
import io.calx.engine.expr.UnaryOperator;
import io.calx.numeric.BigRational;
import java.util.Optional;

/** Reduces the π multiple of a sin/cos argument modulo 2π and of a tan argument modulo π. */
final class PeriodicityRules implements RewriteRule {
  private static final BigRational TWO = BigRational.of(2);

  @Override
  public Optional<Expression> apply(Expression node) {
    if (!(node instanceof Expression.Unary)) {
      return Optional.empty();
    }
    UnaryOperator op = ((Expression.Unary) node).op();
    if (!op.isTrigonometric()) {
      return Optional.empty();
    }
    BigRational period = op == UnaryOperator.TAN ? BigRational.ONE : TWO;
    Expression arg = ((Expression.Unary) node).operand();
    return AngleDecomposition.of(arg)
        .filter(AngleDecomposition::hasPiTerm)
        .filter(angle -> angle.piMultiple().signum() < 0
            || angle.piMultiple().compareTo(period) >= 0)
        .map(angle -> angle.withPiMultiple(AngleDecomposition.reduce(angle.piMultiple(), period)))
        .map(reduced -> Expression.unary(op, reduced));
  }
}
