package io.calx.engine.simplify;

import io.calx.engine.expr.Expression;
import io.calx.engine.expr.UnaryOperator;
import io.calx.numeric.BigRational;
import java.util.Optional;

/**
 * Parity of the trigonometric and hyperbolic functions, and the reduction formulas for arguments
 * shifted by {@code π/2}, {@code π} or {@code 3π/2}.
 */
final class InductionRules implements RewriteRule {
  private static final BigRational HALF = BigRational.of(1, 2);
  private static final BigRational THREE_HALVES = BigRational.of(3, 2);

  @Override
  public Optional<Expression> apply(Expression node) {
    if (!(node instanceof Expression.Unary)) {
      return Optional.empty();
    }
    UnaryOperator op = ((Expression.Unary) node).op();
    Expression arg = ((Expression.Unary) node).operand();
    if (Patterns.isNegativeForm(arg)) {
      Optional<Expression> reflected = parity(op, Patterns.negated(arg));
      if (reflected.isPresent()) {
        return reflected;
      }
    }
    if (op.isTrigonometric()) {
      return AngleDecomposition.of(arg).flatMap(angle -> shift(op, angle));
    }
    return Optional.empty();
  }

  private static Optional<Expression> parity(UnaryOperator op, Expression u) {
    switch (op) {
      case SIN:
      case TAN:
      case ASIN:
      case ATAN:
      case SINH:
      case TANH:
        return Optional.of(Expression.negate(Expression.unary(op, u)));
      case COS:
      case COSH:
        return Optional.of(Expression.unary(op, u));
      case ACOS:
        return Optional.of(Expression.subtract(Patterns.PI, Expression.unary(op, u)));
      default:
        return Optional.empty();
    }
  }

  private static Optional<Expression> shift(UnaryOperator op, AngleDecomposition angle) {
    if (!angle.hasPiTerm() || !angle.hasRest()) {
      return Optional.empty();
    }
    BigRational q = angle.piMultiple();
    Expression r = angle.rest();
    if (q.signum() == 0) {
      return Optional.of(Expression.unary(op, r));
    }
    if (op == UnaryOperator.TAN) {
      return q.equals(BigRational.ONE) ? Optional.of(Expression.tan(r)) : Optional.empty();
    }
    boolean sine = op == UnaryOperator.SIN;
    if (q.equals(HALF)) {
      // sin(π/2 + r) = cos r, cos(π/2 + r) = -sin r
      return Optional.of(sine ? Expression.cos(r) : Expression.negate(Expression.sin(r)));
    }
    if (q.equals(BigRational.ONE)) {
      return Optional.of(Expression.negate(Expression.unary(op, r)));
    }
    if (q.equals(THREE_HALVES)) {
      return Optional.of(sine ? Expression.negate(Expression.cos(r)) : Expression.sin(r));
    }
    return Optional.empty();
  }
}
