package io.calx.engine.simplify;

import io.calx.engine.expr.BinaryOperator;
import io.calx.engine.expr.Expression;
import io.calx.engine.expr.UnaryOperator;
import io.calx.numeric.NumberValue;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flat view of a sum as coefficient times base terms.
 *
 * <p>Flattening walks through {@code +}, {@code -}, negation, products with a literal factor and
 * quotients by a literal, so {@code 2 * (x + y) - x / 4} becomes {@code 7/4 x + 2 y}. Equal bases
 * are merged and keep the position of their first appearance; literal terms merge into a single
 * constant term with a {@code null} base.
 */
final class SumTerms {
  private SumTerms() {}

  /** One summand. {@code base == null} marks the constant term. */
  record Term(Expression base, NumberValue coefficient) {
    boolean isConstant() {
      return base == null;
    }

    Term withCoefficient(NumberValue c) {
      return new Term(base, c);
    }
  }

  private record Pending(Expression expression, NumberValue coefficient) {}

  /**
   * @return the merged terms, or empty when merging coefficients would need inexact mixing or
   *     otherwise leave the exact tower
   */
  static Optional<List<Term>> flatten(Expression root) {
    List<Term> terms = new ArrayList<>();
    Map<Expression, Integer> index = new HashMap<>();
    int constantIndex = -1;

    Deque<Pending> stack = new ArrayDeque<>();
    stack.push(new Pending(root, NumberValue.one()));
    while (!stack.isEmpty()) {
      Pending p = stack.pop();
      Expression e = p.expression();
      NumberValue c = p.coefficient();

      if (Patterns.isBinary(e, BinaryOperator.ADD)) {
        stack.push(new Pending(Patterns.right(e), c));
        stack.push(new Pending(Patterns.left(e), c));
        continue;
      }
      if (Patterns.isBinary(e, BinaryOperator.SUBTRACT)) {
        stack.push(new Pending(Patterns.right(e), c.negate()));
        stack.push(new Pending(Patterns.left(e), c));
        continue;
      }
      if (Patterns.isUnary(e, UnaryOperator.NEGATE)) {
        stack.push(new Pending(Patterns.operand(e), c.negate()));
        continue;
      }
      if (Patterns.isBinary(e, BinaryOperator.MULTIPLY)
          && (Patterns.isCoefficient(Patterns.left(e))
              || Patterns.isCoefficient(Patterns.right(e)))) {
        boolean numberFirst = Patterns.isCoefficient(Patterns.left(e));
        Expression factor = numberFirst ? Patterns.left(e) : Patterns.right(e);
        Expression rest = numberFirst ? Patterns.right(e) : Patterns.left(e);
        Optional<NumberValue> scaled =
            Patterns.fold(BinaryOperator.MULTIPLY, c, Patterns.value(factor));
        if (scaled.isEmpty()) {
          return Optional.empty();
        }
        stack.push(new Pending(rest, scaled.get()));
        continue;
      }
      if (Patterns.isBinary(e, BinaryOperator.DIVIDE)
          && Patterns.isCoefficient(Patterns.right(e))
          && !Patterns.value(Patterns.right(e)).isZero()) {
        Optional<NumberValue> scaled =
            Patterns.fold(BinaryOperator.DIVIDE, c, Patterns.value(Patterns.right(e)));
        if (scaled.isEmpty()) {
          return Optional.empty();
        }
        stack.push(new Pending(Patterns.left(e), scaled.get()));
        continue;
      }

      if (Patterns.isCoefficient(e)) {
        Optional<NumberValue> v = Patterns.fold(BinaryOperator.MULTIPLY, c, Patterns.value(e));
        if (v.isEmpty()) {
          return Optional.empty();
        }
        if (constantIndex < 0) {
          constantIndex = terms.size();
          terms.add(new Term(null, v.get()));
        } else if (!merge(terms, constantIndex, v.get())) {
          return Optional.empty();
        }
        continue;
      }

      Integer at = index.get(e);
      if (at == null) {
        index.put(e, terms.size());
        terms.add(new Term(e, c));
      } else if (!merge(terms, at, c)) {
        return Optional.empty();
      }
    }
    return Optional.of(terms);
  }

  private static boolean merge(List<Term> terms, int at, NumberValue c) {
    Term existing = terms.get(at);
    Optional<NumberValue> sum = Patterns.fold(BinaryOperator.ADD, existing.coefficient(), c);
    if (sum.isEmpty()) {
      return false;
    }
    terms.set(at, existing.withCoefficient(sum.get()));
    return true;
  }

  /**
   * Rebuilds a left-nested sum. Exact zero terms vanish; a term with a negative coefficient after
   * the first is written as a subtraction.
   */
  static Expression rebuild(List<Term> terms) {
    Expression result = null;
    for (Term t : terms) {
      NumberValue c = t.coefficient();
      if (c.isExact() && c.isZero()) {
        continue;
      }
      if (result == null) {
        result = piece(c, t.base());
      } else if (c.isNegative()) {
        result = Expression.subtract(result, piece(c.negate(), t.base()));
      } else {
        result = Expression.add(result, piece(c, t.base()));
      }
    }
    return result == null ? Patterns.ZERO : result;
  }

  private static Expression piece(NumberValue c, Expression base) {
    return base == null ? Expression.number(c) : Patterns.scaled(c, base);
  }

  static int indexOfConstant(List<Term> terms) {
    for (int i = 0; i < terms.size(); i++) {
      if (terms.get(i).isConstant()) {
        return i;
      }
    }
    return -1;
  }
}
