package io.calx.engine.simplify;

import io.calx.engine.expr.BinaryOperator;
import io.calx.engine.expr.Expression;
import io.calx.engine.expr.UnaryOperator;
import io.calx.numeric.NumberValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code k sin²u + k cos²u = k} and its rearrangements {@code c - c sin²u = c cos²u}, {@code c -
 * c cos²u = c sin²u}, found anywhere in a flattened sum, plus {@code sin u / cos u = tan u}.
 */
final class PythagoreanRules implements RewriteRule {

  @Override
  public Optional<Expression> apply(Expression node) {
    if (Patterns.isBinary(node, BinaryOperator.DIVIDE)) {
      return quotient(node);
    }
    if (Patterns.isBinary(node, BinaryOperator.ADD)
        || Patterns.isBinary(node, BinaryOperator.SUBTRACT)) {
      return SumTerms.flatten(node).flatMap(PythagoreanRules::fold);
    }
    return Optional.empty();
  }

  private static Optional<Expression> quotient(Expression node) {
    Expression l = Patterns.left(node);
    Expression r = Patterns.right(node);
    if (Patterns.isUnary(l, UnaryOperator.SIN)
        && Patterns.isUnary(r, UnaryOperator.COS)
        && Patterns.operand(l).equals(Patterns.operand(r))) {
      return Optional.of(Expression.tan(Patterns.operand(l)));
    }
    return Optional.empty();
  }

  private static Optional<Expression> fold(List<SumTerms.Term> terms) {
    int constant = SumTerms.indexOfConstant(terms);
    for (int i = 0; i < terms.size(); i++) {
      SumTerms.Term t = terms.get(i);
      if (t.isConstant()) {
        continue;
      }
      UnaryOperator op = UnaryOperator.SIN;
      Expression u = Patterns.squaredArgument(t.base(), op);
      if (u == null) {
        op = UnaryOperator.COS;
        u = Patterns.squaredArgument(t.base(), op);
      }
      if (u == null) {
        continue;
      }
      UnaryOperator other = op == UnaryOperator.SIN ? UnaryOperator.COS : UnaryOperator.SIN;
      NumberValue k = t.coefficient();

      for (int j = 0; j < terms.size(); j++) {
        SumTerms.Term partner = terms.get(j);
        if (j != i
            && !partner.isConstant()
            && u.equals(Patterns.squaredArgument(partner.base(), other))
            && k.equals(partner.coefficient())) {
          return Optional.of(SumTerms.rebuild(collapse(terms, i, j, constant, k)));
        }
      }

      if (constant >= 0) {
        NumberValue c = terms.get(constant).coefficient();
        if (!c.isZero() && k.equals(c.negate())) {
          List<SumTerms.Term> result = new ArrayList<>(terms);
          result.set(i, new SumTerms.Term(Patterns.square(other, u), c));
          result.remove(constant);
          return Optional.of(SumTerms.rebuild(result));
        }
      }
    }
    return Optional.empty();
  }

  /** Replaces the pair {@code i, j} by the constant {@code k}. */
  private static List<SumTerms.Term> collapse(
      List<SumTerms.Term> terms, int i, int j, int constant, NumberValue k) {
    List<SumTerms.Term> result = new ArrayList<>(terms.size());
    for (int n = 0; n < terms.size(); n++) {
      if (n == j) {
        continue;
      }
      SumTerms.Term t = terms.get(n);
      if (n == i) {
        if (constant < 0) {
          result.add(new SumTerms.Term(null, k));
        }
        continue;
      }
      if (n == constant) {
        Optional<NumberValue> merged = Patterns.fold(BinaryOperator.ADD, t.coefficient(), k);
        if (merged.isEmpty()) {
          return terms;
        }
        result.add(t.withCoefficient(merged.get()));
        continue;
      }
      result.add(t);
    }
    return result;
  }
}
