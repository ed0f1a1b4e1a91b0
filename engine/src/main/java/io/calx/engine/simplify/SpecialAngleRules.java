package io.calx.engine.simplify;

import io.calx.engine.expr.Expression;
import io.calx.engine.expr.UnaryOperator;
import io.calx.numeric.BigRational;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Exact values of sin, cos and tan at multiples of {@code π/6} and {@code π/4}, and of the
 * inverse functions at the matching arguments. Values are literals or {@code sqrt(n)/d}; a float
 * is never produced.
 */
final class SpecialAngleRules implements RewriteRule {
  private static final BigRational TWO = BigRational.of(2);
  private static final BigRational HALF = BigRational.of(1, 2);

  private static final Expression SQRT2_OVER_2 = radicalOver(2, 2);
  private static final Expression SQRT3_OVER_2 = radicalOver(3, 2);
  private static final Expression SQRT3_OVER_3 = radicalOver(3, 3);
  private static final Expression SQRT3 = Expression.sqrt(Expression.integer(3));

  // first quadrant, in units of π
  private static final Map<BigRational, Expression> SINE = new LinkedHashMap<>();
  private static final Map<BigRational, Expression> TANGENT = new LinkedHashMap<>();
  private static final Map<Expression, Expression> ARCSINE = new LinkedHashMap<>();
  private static final Map<Expression, Expression> ARCCOSINE = new LinkedHashMap<>();
  private static final Map<Expression, Expression> ARCTANGENT = new LinkedHashMap<>();

  static {
    SINE.put(BigRational.ZERO, Patterns.ZERO);
    SINE.put(BigRational.of(1, 6), Expression.rational(1, 2));
    SINE.put(BigRational.of(1, 4), SQRT2_OVER_2);
    SINE.put(BigRational.of(1, 3), SQRT3_OVER_2);
    SINE.put(HALF, Patterns.ONE);

    TANGENT.put(BigRational.ZERO, Patterns.ZERO);
    TANGENT.put(BigRational.of(1, 6), SQRT3_OVER_3);
    TANGENT.put(BigRational.of(1, 4), Patterns.ONE);
    TANGENT.put(BigRational.of(1, 3), SQRT3);

    ARCSINE.put(Patterns.ZERO, Patterns.ZERO);
    ARCSINE.put(Expression.rational(1, 2), piOver(6));
    ARCSINE.put(SQRT2_OVER_2, piOver(4));
    ARCSINE.put(SQRT3_OVER_2, piOver(3));
    ARCSINE.put(Patterns.ONE, piOver(2));

    ARCCOSINE.put(Patterns.ZERO, piOver(2));
    ARCCOSINE.put(Expression.rational(1, 2), piOver(3));
    ARCCOSINE.put(SQRT2_OVER_2, piOver(4));
    ARCCOSINE.put(SQRT3_OVER_2, piOver(6));
    ARCCOSINE.put(Patterns.ONE, Patterns.ZERO);

    ARCTANGENT.put(Patterns.ZERO, Patterns.ZERO);
    ARCTANGENT.put(SQRT3_OVER_3, piOver(6));
    ARCTANGENT.put(Patterns.ONE, piOver(4));
    ARCTANGENT.put(SQRT3, piOver(3));
  }

  @Override
  public Optional<Expression> apply(Expression node) {
    if (!(node instanceof Expression.Unary)) {
      return Optional.empty();
    }
    UnaryOperator op = ((Expression.Unary) node).op();
    Expression arg = ((Expression.Unary) node).operand();
    switch (op) {
      case SIN:
        return piMultiple(arg).flatMap(SpecialAngleRules::sine);
      case COS:
        return piMultiple(arg).flatMap(q -> sine(q.add(HALF)));
      case TAN:
        return piMultiple(arg).flatMap(SpecialAngleRules::tangent);
      case ASIN:
        return Optional.ofNullable(ARCSINE.get(arg));
      case ACOS:
        return Optional.ofNullable(ARCCOSINE.get(arg));
      case ATAN:
        return Optional.ofNullable(ARCTANGENT.get(arg));
      default:
        return Optional.empty();
    }
  }

  /** {@code q} when the argument is exactly {@code q·π}, an exact zero counting as {@code q = 0}. */
  private static Optional<BigRational> piMultiple(Expression arg) {
    return AngleDecomposition.of(arg)
        .filter(angle -> !angle.hasRest())
        .map(AngleDecomposition::piMultiple);
  }

  static Optional<Expression> sine(BigRational q) {
    BigRational r = AngleDecomposition.reduce(q, TWO);
    boolean negative = false;
    if (r.compareTo(BigRational.ONE) >= 0) {
      negative = true;
      r = r.subtract(BigRational.ONE);
    }
    if (r.compareTo(HALF) > 0) {
      r = BigRational.ONE.subtract(r);
    }
    Expression value = SINE.get(r);
    if (value == null) {
      return Optional.empty();
    }
    return Optional.of(negative ? Patterns.negated(value) : value);
  }

  static Optional<Expression> tangent(BigRational q) {
    BigRational r = AngleDecomposition.reduce(q, BigRational.ONE);
    if (r.equals(HALF)) {
      return Optional.empty();
    }
    boolean negative = false;
    if (r.compareTo(HALF) > 0) {
      negative = true;
      r = BigRational.ONE.subtract(r);
    }
    Expression value = TANGENT.get(r);
    if (value == null) {
      return Optional.empty();
    }
    return Optional.of(negative ? Patterns.negated(value) : value);
  }

  private static Expression radicalOver(int radicand, int denominator) {
    return Expression.divide(
        Expression.sqrt(Expression.integer(radicand)), Expression.integer(denominator));
  }

  private static Expression piOver(int n) {
    return Expression.divide(Patterns.PI, Expression.integer(n));
  }
}
