package io.calx.engine.simplify;

import io.calx.engine.expr.BinaryOperator;
import io.calx.engine.expr.Expression;
import io.calx.engine.expr.MathConstant;
import io.calx.engine.expr.UnaryOperator;
import io.calx.numeric.Arithmetic;
import io.calx.numeric.BigRational;
import io.calx.numeric.ComputeException;
import io.calx.numeric.IntegerValue;
import io.calx.numeric.NumberValue;
import io.calx.numeric.RationalValue;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Matching and construction helpers shared by the rule families. */
final class Patterns {
  private static final Logger log = LoggerFactory.getLogger(Patterns.class);

  static final Expression ZERO = Expression.integer(0);
  static final Expression ONE = Expression.integer(1);
  static final Expression TWO = Expression.integer(2);
  static final Expression PI = Expression.pi();

  private Patterns() {}

  /** A number literal usable as a coefficient, i.e. anything but a symbolic value. */
  static boolean isCoefficient(Expression e) {
    return e instanceof Expression.NumberLiteral
        && !((Expression.NumberLiteral) e).value().isSymbolic();
  }

  static NumberValue value(Expression e) {
    return ((Expression.NumberLiteral) e).value();
  }

  static boolean isExactZero(Expression e) {
    return isCoefficient(e) && value(e).isExact() && value(e).isZero();
  }

  static boolean isExactOne(Expression e) {
    return isCoefficient(e) && value(e).isExact() && value(e).isOne();
  }

  static boolean isExactMinusOne(Expression e) {
    return isCoefficient(e) && value(e).isExact() && value(e).negate().isOne();
  }

  static boolean isUnary(Expression e, UnaryOperator op) {
    return e instanceof Expression.Unary && ((Expression.Unary) e).op() == op;
  }

  static boolean isBinary(Expression e, BinaryOperator op) {
    return e instanceof Expression.Binary && ((Expression.Binary) e).op() == op;
  }

  static Expression operand(Expression unary) {
    return ((Expression.Unary) unary).operand();
  }

  static Expression left(Expression binary) {
    return ((Expression.Binary) binary).left();
  }

  static Expression right(Expression binary) {
    return ((Expression.Binary) binary).right();
  }

  static boolean isPi(Expression e) {
    return e instanceof Expression.Constant
        && ((Expression.Constant) e).constant() == MathConstant.PI;
  }

  /** Integer literal value, if {@code e} is one that fits an int. */
  static Optional<Integer> smallInteger(Expression e) {
    if (isCoefficient(e) && value(e) instanceof IntegerValue) {
      IntegerValue v = (IntegerValue) value(e);
      if (v.value().bitLength() < 31) {
        return Optional.of(v.value().intValue());
      }
    }
    return Optional.empty();
  }

  /** Exact rational view of an Integer or Rational value. */
  static Optional<BigRational> rational(NumberValue value) {
    if (value instanceof IntegerValue) {
      return Optional.of(BigRational.of(((IntegerValue) value).value()));
    }
    if (value instanceof RationalValue) {
      return Optional.of(((RationalValue) value).value());
    }
    return Optional.empty();
  }

  /**
   * Applies a binary operator to two literals. Symbolic results and arithmetic failures such as
   * float overflow count as "cannot fold".
   */
  static Optional<NumberValue> fold(BinaryOperator op, NumberValue a, NumberValue b) {
    NumberValue result;
    try {
      switch (op) {
        case ADD:
          result = a.add(b);
          break;
        case SUBTRACT:
          result = a.subtract(b);
          break;
        case MULTIPLY:
          result = a.multiply(b);
          break;
        case DIVIDE:
          result = a.divide(b);
          break;
        case MODULO:
          result = Arithmetic.modulo(a, b);
          break;
        case POWER:
          result = a.pow(b);
          break;
        default:
          return Optional.empty();
      }
    } catch (ComputeException e) {
      log.trace("Not folding {} {} {}: {}", a, op.symbol(), b, e.getMessage());
      return Optional.empty();
    }
    return result.isSymbolic() ? Optional.empty() : Optional.of(result);
  }

  /** {@code c * base} in canonical shape: 0, base, -base or a product with the number first. */
  static Expression scaled(NumberValue c, Expression base) {
    if (c.isExact() && c.isZero()) {
      return ZERO;
    }
    if (c.isExact() && c.isOne()) {
      return base;
    }
    if (c.isExact() && c.negate().isOne()) {
      return negated(base);
    }
    return Expression.multiply(Expression.number(c), base);
  }

  /** Canonical negation of {@code e}. */
  static Expression negated(Expression e) {
    if (isCoefficient(e)) {
      return Expression.number(value(e).negate());
    }
    if (isUnary(e, UnaryOperator.NEGATE)) {
      return operand(e);
    }
    if (isBinary(e, BinaryOperator.MULTIPLY) && isCoefficient(left(e))) {
      return scaled(value(left(e)).negate(), right(e));
    }
    return Expression.negate(e);
  }

  /** {@code -u}, a negative real literal or a product led by one. */
  static boolean isNegativeForm(Expression e) {
    if (isUnary(e, UnaryOperator.NEGATE)) {
      return true;
    }
    if (isCoefficient(e)) {
      return value(e).isNegative();
    }
    return isBinary(e, BinaryOperator.MULTIPLY)
        && isCoefficient(left(e))
        && value(left(e)).isNegative();
  }

  static Expression square(UnaryOperator op, Expression u) {
    return Expression.power(Expression.unary(op, u), TWO);
  }

  /** @return the argument of {@code op(u)^2}, or {@code null} when {@code e} has another shape */
  static Expression squaredArgument(Expression e, UnaryOperator op) {
    if (isBinary(e, BinaryOperator.POWER)
        && isUnary(left(e), op)
        && smallInteger(right(e)).orElse(0) == 2) {
      return operand(left(e));
    }
    return null;
  }

  /**
   * Whether {@code e} is non-zero for every assignment of its variables. Only literal facts are
   * used; a variable is never assumed to be non-zero.
   */
  static boolean isProvablyNonZero(Expression e) {
    Deque<Expression> pending = new ArrayDeque<>();
    pending.push(e);
    while (!pending.isEmpty()) {
      Expression current = pending.pop();
      switch (current.kind()) {
        case NUMBER:
          NumberValue v = value(current);
          if (v.isSymbolic() || v.isZero()) {
            return false;
          }
          break;
        case CONSTANT:
          if (!((Expression.Constant) current).constant().isNonZero()) {
            return false;
          }
          break;
        case UNARY:
          UnaryOperator op = ((Expression.Unary) current).op();
          if (op == UnaryOperator.EXP) {
            break;
          }
          if (op != UnaryOperator.NEGATE
              && op != UnaryOperator.PLUS
              && op != UnaryOperator.ABS
              && op != UnaryOperator.SQRT) {
            return false;
          }
          pending.push(operand(current));
          break;
        case BINARY:
          BinaryOperator bop = ((Expression.Binary) current).op();
          if (bop == BinaryOperator.MULTIPLY || bop == BinaryOperator.DIVIDE) {
            pending.push(left(current));
            pending.push(right(current));
          } else if (bop == BinaryOperator.POWER) {
            pending.push(left(current));
          } else {
            return false;
          }
          break;
        default:
          return false;
      }
    }
    return true;
  }
}
