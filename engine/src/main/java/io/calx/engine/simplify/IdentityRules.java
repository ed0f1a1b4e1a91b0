package io.calx.engine.simplify;

import io.calx.engine.expr.BinaryOperator;
import io.calx.engine.expr.Expression;
import io.calx.engine.expr.MathConstant;
import io.calx.engine.expr.UnaryOperator;
import io.calx.numeric.Arithmetic;
import io.calx.numeric.ComplexValue;
import io.calx.numeric.IntegerValue;
import io.calx.numeric.NumberValue;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Algebraic identities, literal folding and like-term collection.
 *
 * <p>Products are kept with their literal factor first ({@code 3 * x}, never {@code x * 3}), and
 * negation is pulled outward through products and quotients so sums see it as a coefficient.
 * Rules that need {@code x != 0} only fire when that is evident from literals.
 */
final class IdentityRules implements RewriteRule {
  static final int MAX_FOLDED_FACTORIAL = 20;

  @Override
  public Optional<Expression> apply(Expression node) {
    switch (node.kind()) {
      case FUNCTION:
        return function((Expression.Function) node);
      case UNARY:
        return unary((Expression.Unary) node);
      case BINARY:
        return binary((Expression.Binary) node);
      default:
        return Optional.empty();
    }
  }

  private Optional<Expression> function(Expression.Function node) {
    if (node.args().size() != 1) {
      return Optional.empty();
    }
    return UnaryOperator.fromFunctionName(node.name())
        .map(op -> Expression.unary(op, node.args().get(0)));
  }

  private Optional<Expression> unary(Expression.Unary node) {
    Expression u = node.operand();
    switch (node.op()) {
      case PLUS:
        return Optional.of(u);
      case NEGATE:
        return changed(node, Patterns.negated(u));
      case ABS:
        if (Patterns.isCoefficient(u)) {
          return literal(Arithmetic.abs(Patterns.value(u)));
        }
        if (Patterns.isUnary(u, UnaryOperator.ABS)) {
          return Optional.of(u);
        }
        if (Patterns.isUnary(u, UnaryOperator.NEGATE)) {
          return Optional.of(Expression.unary(UnaryOperator.ABS, Patterns.operand(u)));
        }
        return Optional.empty();
      case LN:
        if (Patterns.isExactOne(u)) {
          return Optional.of(Patterns.ZERO);
        }
        if (u instanceof Expression.Constant
            && ((Expression.Constant) u).constant() == MathConstant.E) {
          return Optional.of(Patterns.ONE);
        }
        return Optional.empty();
      case EXP:
        return Patterns.isExactZero(u) ? Optional.of(Patterns.ONE) : Optional.empty();
      case FACTORIAL:
        return factorial(u);
      case REAL:
      case IMAGINARY:
      case CONJUGATE:
        return complexPart(node.op(), u);
      default:
        return Optional.empty();
    }
  }

  private Optional<Expression> factorial(Expression u) {
    Optional<Integer> n = Patterns.smallInteger(u);
    if (n.isEmpty() || n.get() < 0 || n.get() > MAX_FOLDED_FACTORIAL) {
      return Optional.empty();
    }
    BigInteger result = BigInteger.ONE;
    for (int i = 2; i <= n.get(); i++) {
      result = result.multiply(BigInteger.valueOf(i));
    }
    return Optional.of(Expression.number(IntegerValue.of(result)));
  }

  private Optional<Expression> complexPart(UnaryOperator op, Expression u) {
    if (!Patterns.isCoefficient(u)) {
      return Optional.empty();
    }
    NumberValue v = Patterns.value(u);
    if (v instanceof ComplexValue) {
      ComplexValue c = (ComplexValue) v;
      switch (op) {
        case REAL:
          return literal(c.real());
        case IMAGINARY:
          return literal(c.imaginary());
        default:
          return literal(c.conjugate());
      }
    }
    if (!v.isReal()) {
      return Optional.empty();
    }
    return op == UnaryOperator.IMAGINARY ? Optional.of(Patterns.ZERO) : Optional.of(u);
  }

  private Optional<Expression> binary(Expression.Binary node) {
    Expression l = node.left();
    Expression r = node.right();
    if (Patterns.isCoefficient(l) && Patterns.isCoefficient(r)) {
      Optional<NumberValue> folded = Patterns.fold(node.op(), Patterns.value(l), Patterns.value(r));
      if (folded.isPresent()) {
        return Optional.of(Expression.number(folded.get()));
      }
    }
    switch (node.op()) {
      case ADD:
      case SUBTRACT:
        return sum(node);
      case MULTIPLY:
        return product(node, l, r);
      case DIVIDE:
        return quotient(l, r);
      case POWER:
        return power(l, r);
      default:
        return Optional.empty();
    }
  }

  private Optional<Expression> sum(Expression.Binary node) {
    Optional<List<SumTerms.Term>> terms = SumTerms.flatten(node);
    if (terms.isPresent()) {
      return changed(node, SumTerms.rebuild(terms.get()));
    }
    // coefficients would mix exact and inexact values; only the trivial laws apply
    Expression l = node.left();
    Expression r = node.right();
    if (Patterns.isExactZero(r)) {
      return Optional.of(l);
    }
    if (node.op() == BinaryOperator.ADD) {
      return Patterns.isExactZero(l) ? Optional.of(r) : Optional.empty();
    }
    if (Patterns.isExactZero(l)) {
      return Optional.of(Patterns.negated(r));
    }
    return l.equals(r) ? Optional.of(Patterns.ZERO) : Optional.empty();
  }

  private Optional<Expression> product(Expression node, Expression l, Expression r) {
    if (Patterns.isExactZero(l) || Patterns.isExactZero(r)) {
      return Optional.of(Patterns.ZERO);
    }
    if (Patterns.isExactOne(l)) {
      return Optional.of(r);
    }
    if (Patterns.isExactOne(r)) {
      return Optional.of(l);
    }
    if (Patterns.isExactMinusOne(l)) {
      return Optional.of(Patterns.negated(r));
    }
    if (Patterns.isExactMinusOne(r)) {
      return Optional.of(Patterns.negated(l));
    }

    boolean leftNumber = Patterns.isCoefficient(l);
    if (!leftNumber && Patterns.isCoefficient(r)) {
      return Optional.of(Expression.multiply(r, l));
    }
    if (leftNumber) {
      NumberValue c = Patterns.value(l);
      if (Patterns.isBinary(r, BinaryOperator.MULTIPLY) && Patterns.isCoefficient(Patterns.left(r))) {
        return Patterns.fold(BinaryOperator.MULTIPLY, c, Patterns.value(Patterns.left(r)))
            .map(merged -> Patterns.scaled(merged, Patterns.right(r)));
      }
      if (Patterns.isUnary(r, UnaryOperator.NEGATE)) {
        return Optional.of(Patterns.scaled(c.negate(), Patterns.operand(r)));
      }
      return Optional.empty();
    }

    if (Patterns.isBinary(r, BinaryOperator.MULTIPLY) && Patterns.isCoefficient(Patterns.left(r))) {
      return Optional.of(
          Patterns.scaled(
              Patterns.value(Patterns.left(r)), Expression.multiply(l, Patterns.right(r))));
    }
    if (Patterns.isBinary(l, BinaryOperator.MULTIPLY) && Patterns.isCoefficient(Patterns.left(l))) {
      return Optional.of(
          Patterns.scaled(
              Patterns.value(Patterns.left(l)), Expression.multiply(Patterns.right(l), r)));
    }
    if (Patterns.isUnary(l, UnaryOperator.NEGATE)) {
      return Optional.of(Patterns.negated(Expression.multiply(Patterns.operand(l), r)));
    }
    if (Patterns.isUnary(r, UnaryOperator.NEGATE)) {
      return Optional.of(Patterns.negated(Expression.multiply(l, Patterns.operand(r))));
    }
    if (l.equals(r)) {
      return Optional.of(Expression.power(l, Patterns.TWO));
    }
    return mergePowers(node, l, r);
  }

  /** {@code x^a * x^b -> x^(a+b)} for integer exponents, a bare factor counting as {@code ^1}. */
  private Optional<Expression> mergePowers(Expression node, Expression l, Expression r) {
    Expression leftBase = baseOf(l);
    Expression rightBase = baseOf(r);
    if (!leftBase.equals(rightBase)) {
      return Optional.empty();
    }
    long exponent = (long) exponentOf(l) + exponentOf(r);
    if (exponent > Integer.MAX_VALUE || exponent < Integer.MIN_VALUE) {
      return Optional.empty();
    }
    return changed(node, Expression.power(leftBase, Expression.integer(exponent)));
  }

  private static Expression baseOf(Expression e) {
    if (Patterns.isBinary(e, BinaryOperator.POWER)
        && Patterns.smallInteger(Patterns.right(e)).isPresent()) {
      return Patterns.left(e);
    }
    return e;
  }

  private static int exponentOf(Expression e) {
    if (Patterns.isBinary(e, BinaryOperator.POWER)) {
      return Patterns.smallInteger(Patterns.right(e)).orElse(1);
    }
    return 1;
  }

  private Optional<Expression> quotient(Expression l, Expression r) {
    if (Patterns.isExactOne(r)) {
      return Optional.of(l);
    }
    if (Patterns.isExactMinusOne(r)) {
      return Optional.of(Patterns.negated(l));
    }
    if (Patterns.isExactZero(l) && Patterns.isProvablyNonZero(r)) {
      return Optional.of(Patterns.ZERO);
    }
    if (l.equals(r) && Patterns.isProvablyNonZero(r)) {
      return Optional.of(Patterns.ONE);
    }
    if (Patterns.isUnary(l, UnaryOperator.NEGATE)) {
      return Optional.of(Patterns.negated(Expression.divide(Patterns.operand(l), r)));
    }
    if (Patterns.isUnary(r, UnaryOperator.NEGATE)) {
      return Optional.of(Patterns.negated(Expression.divide(l, Patterns.operand(r))));
    }
    return Optional.empty();
  }

  private Optional<Expression> power(Expression base, Expression exponent) {
    if (Patterns.isExactOne(exponent)) {
      return Optional.of(base);
    }
    if (Patterns.isExactZero(exponent) && Patterns.isProvablyNonZero(base)) {
      return Optional.of(Patterns.ONE);
    }
    if (Patterns.isExactOne(base)) {
      return Optional.of(Patterns.ONE);
    }
    if (Patterns.isExactZero(base)
        && Patterns.isCoefficient(exponent)
        && Patterns.value(exponent).isPositive()) {
      return Optional.of(Patterns.ZERO);
    }
    Optional<Integer> n = Patterns.smallInteger(exponent);
    if (n.isEmpty()) {
      return Optional.empty();
    }
    if (Patterns.isBinary(base, BinaryOperator.POWER)) {
      Optional<Integer> inner = Patterns.smallInteger(Patterns.right(base));
      if (inner.isPresent()) {
        long product = (long) inner.get() * n.get();
        if (product <= Integer.MAX_VALUE && product >= Integer.MIN_VALUE) {
          return Optional.of(Expression.power(Patterns.left(base), Expression.integer(product)));
        }
      }
      return Optional.empty();
    }
    if (Patterns.isUnary(base, UnaryOperator.NEGATE)) {
      Expression raised = Expression.power(Patterns.operand(base), exponent);
      return Optional.of(n.get() % 2 == 0 ? raised : Expression.negate(raised));
    }
    return Optional.empty();
  }

  private static Optional<Expression> literal(NumberValue value) {
    return value.isSymbolic() ? Optional.empty() : Optional.of(Expression.number(value));
  }

  private static Optional<Expression> changed(Expression before, Expression after) {
    return after.equals(before) ? Optional.empty() : Optional.of(after);
  }
}
