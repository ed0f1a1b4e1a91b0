package io.calx.engine.simplify;

import io.calx.engine.expr.BinaryOperator;
import io.calx.engine.expr.Expression;
import io.calx.engine.expr.UnaryOperator;
import io.calx.numeric.Arithmetic;
import io.calx.numeric.BigRational;
import io.calx.numeric.IntegerValue;
import io.calx.numeric.NumberValue;
import io.calx.numeric.RationalValue;
import java.math.BigInteger;
import java.util.Optional;

/**
 * Square roots of literals: perfect squares become exact values, square factors move outside
 * ({@code sqrt(8) = 2 * sqrt(2)}) and denominators are made rational ({@code sqrt(1/2) =
 * sqrt(2)/2}). Also {@code sqrt(u)^2 = u} and {@code sqrt(a) * sqrt(b) = sqrt(ab)} for positive
 * integer literals.
 */
final class RadicalRules implements RewriteRule {
  /** Trial division bound when looking for square factors. */
  static final long MAX_TRIAL_FACTOR = 100_000L;

  @Override
  public Optional<Expression> apply(Expression node) {
    if (Patterns.isUnary(node, UnaryOperator.SQRT)) {
      Expression u = Patterns.operand(node);
      return Patterns.isCoefficient(u) ? root(Patterns.value(u)) : Optional.empty();
    }
    if (Patterns.isBinary(node, BinaryOperator.POWER)
        && Patterns.isUnary(Patterns.left(node), UnaryOperator.SQRT)
        && Patterns.smallInteger(Patterns.right(node)).orElse(0) == 2) {
      return Optional.of(Patterns.operand(Patterns.left(node)));
    }
    if (Patterns.isBinary(node, BinaryOperator.MULTIPLY)) {
      BigInteger a = positiveRadicand(Patterns.left(node));
      BigInteger b = positiveRadicand(Patterns.right(node));
      if (a != null && b != null) {
        return Optional.of(Expression.sqrt(Expression.number(IntegerValue.of(a.multiply(b)))));
      }
    }
    return Optional.empty();
  }

  private static Optional<Expression> root(NumberValue v) {
    if (v.isNegative() || !v.isRational()) {
      return Optional.empty();
    }
    Optional<NumberValue> exact = Arithmetic.exactSqrt(v);
    if (exact.isPresent()) {
      return Optional.of(Expression.number(exact.get()));
    }
    if (v instanceof IntegerValue) {
      BigInteger[] split = extractSquare(((IntegerValue) v).value());
      if (split[0].equals(BigInteger.ONE)) {
        return Optional.empty();
      }
      return Optional.of(Patterns.scaled(IntegerValue.of(split[0]), sqrtOf(split[1])));
    }
    // sqrt(p/q) = sqrt(pq) / q
    BigRational q = ((RationalValue) v).value();
    BigInteger[] split = extractSquare(q.numerator().multiply(q.denominator()));
    BigRational outside = BigRational.of(split[0], q.denominator());
    Expression numerator = Patterns.scaled(IntegerValue.of(outside.numerator()), sqrtOf(split[1]));
    if (outside.denominator().equals(BigInteger.ONE)) {
      return Optional.of(numerator);
    }
    return Optional.of(
        Expression.divide(numerator, Expression.number(IntegerValue.of(outside.denominator()))));
  }

  /** @return {@code {f, m}} with {@code n = f² m}, square factors found by bounded trial division */
  static BigInteger[] extractSquare(BigInteger n) {
    BigInteger outside = BigInteger.ONE;
    BigInteger inside = n;
    for (long p = 2; p <= MAX_TRIAL_FACTOR; p++) {
      BigInteger bp = BigInteger.valueOf(p);
      BigInteger square = bp.multiply(bp);
      if (square.compareTo(inside) > 0) {
        break;
      }
      while (inside.mod(square).signum() == 0) {
        inside = inside.divide(square);
        outside = outside.multiply(bp);
      }
    }
    return new BigInteger[] {outside, inside};
  }

  private static Expression sqrtOf(BigInteger n) {
    return Expression.sqrt(Expression.number(IntegerValue.of(n)));
  }

  private static BigInteger positiveRadicand(Expression e) {
    if (Patterns.isUnary(e, UnaryOperator.SQRT)
        && Patterns.isCoefficient(Patterns.operand(e))
        && Patterns.value(Patterns.operand(e)) instanceof IntegerValue) {
      BigInteger n = ((IntegerValue) Patterns.value(Patterns.operand(e))).value();
      return n.signum() > 0 ? n : null;
    }
    return null;
  }
}
