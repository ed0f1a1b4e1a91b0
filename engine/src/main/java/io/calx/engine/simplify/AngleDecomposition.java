package io.calx.engine.simplify;

import io.calx.engine.expr.Expression;
import io.calx.numeric.BigRational;
import io.calx.numeric.NumberValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits a trigonometric argument into {@code q·π + rest}, with {@code q} an exact rational.
 * Products and quotients of π by literals, negations and nested sums all contribute to {@code q}.
 */
final class AngleDecomposition {
  private final List<SumTerms.Term> terms;
  private final int piIndex;
  private final BigRational piMultiple;

  private AngleDecomposition(List<SumTerms.Term> terms, int piIndex, BigRational piMultiple) {
    this.terms = terms;
    this.piIndex = piIndex;
    this.piMultiple = piMultiple;
  }

  static Optional<AngleDecomposition> of(Expression argument) {
    Optional<List<SumTerms.Term>> flat = SumTerms.flatten(argument);
    if (flat.isEmpty()) {
      return Optional.empty();
    }
    List<SumTerms.Term> terms = flat.get();
    for (int i = 0; i < terms.size(); i++) {
      SumTerms.Term t = terms.get(i);
      if (!t.isConstant() && Patterns.isPi(t.base())) {
        Optional<BigRational> q = Patterns.rational(t.coefficient());
        if (q.isPresent()) {
          return Optional.of(new AngleDecomposition(terms, i, q.get()));
        }
      }
    }
    return Optional.of(new AngleDecomposition(terms, -1, BigRational.ZERO));
  }

  /** The rational multiple of π; zero when no π term is present. */
  BigRational piMultiple() {
    return piMultiple;
  }

  boolean hasPiTerm() {
    return piIndex >= 0;
  }

  /** Whether anything other than the π multiple remains, ignoring exact zero terms. */
  boolean hasRest() {
    for (int i = 0; i < terms.size(); i++) {
      NumberValue c = terms.get(i).coefficient();
      if (i != piIndex && !(c.isExact() && c.isZero())) {
        return true;
      }
    }
    return false;
  }

  /** The argument without its π multiple. */
  Expression rest() {
    List<SumTerms.Term> copy = new ArrayList<>(terms);
    if (piIndex >= 0) {
      copy.remove(piIndex);
    }
    return SumTerms.rebuild(copy);
  }

  /** The argument with its π multiple replaced by {@code q}. */
  Expression withPiMultiple(BigRational q) {
    List<SumTerms.Term> copy = new ArrayList<>(terms);
    SumTerms.Term piTerm = new SumTerms.Term(Patterns.PI, NumberValue.rational(q));
    if (piIndex >= 0) {
      copy.set(piIndex, piTerm);
    } else {
      copy.add(piTerm);
    }
    return SumTerms.rebuild(copy);
  }

  /** {@code q} reduced into {@code [0, period)}. */
  static BigRational reduce(BigRational q, BigRational period) {
    BigRational turns = BigRational.of(q.divide(period).floor());
    return q.subtract(turns.multiply(period));
  }
}
