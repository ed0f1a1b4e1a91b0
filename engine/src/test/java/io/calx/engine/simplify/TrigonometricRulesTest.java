package io.calx.engine.simplify;

import static org.junit.jupiter.api.Assertions.*;

import io.calx.engine.expr.Expression;
import io.calx.engine.expr.UnaryOperator;
import io.calx.numeric.BigRational;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class TrigonometricRulesTest {
  private final Simplifier simplifier = Simplifier.create();
  private final Expression x = Expression.variable("x");
  private final Expression pi = Expression.pi();

  private Expression times(long numerator, long denominator) {
    return Expression.multiply(Expression.rational(numerator, denominator), pi);
  }

  private Expression simplify(UnaryOperator op, Expression argument) {
    return simplifier.simplify(Expression.unary(op, argument));
  }

  private static Expression radicalOver(int radicand, int denominator) {
    return Expression.divide(
        Expression.sqrt(Expression.integer(radicand)), Expression.integer(denominator));
  }

  // ===== Special angles =====

  @ParameterizedTest
  @CsvSource({
    "SIN, 0, 1, 0",
    "SIN, 1, 6, 1/2",
    "SIN, 1, 2, 1",
    "SIN, 5, 6, 1/2",
    "SIN, 1, 1, 0",
    "SIN, 7, 6, -1/2",
    "SIN, 3, 2, -1",
    "COS, 1, 3, 1/2",
    "COS, 1, 2, 0",
    "COS, 1, 1, -1",
    "COS, 2, 3, -1/2",
    "COS, 2, 1, 1",
    "TAN, 1, 4, 1",
    "TAN, 3, 4, -1",
    "TAN, 1, 1, 0",
  })
  public void testRationalValues(String op, long numerator, long denominator, String expected) {
    Expression result = simplify(UnaryOperator.valueOf(op), times(numerator, denominator));
    assertEquals(expected, result.toString());
  }

  @Test
  public void testRadicalValues() {
    assertEquals(radicalOver(2, 2), simplify(UnaryOperator.SIN, times(1, 4)));
    assertEquals(radicalOver(3, 2), simplify(UnaryOperator.SIN, times(1, 3)));
    assertEquals(radicalOver(3, 2), simplify(UnaryOperator.COS, times(1, 6)));
    assertEquals(Expression.negate(radicalOver(2, 2)), simplify(UnaryOperator.COS, times(3, 4)));
    assertEquals(radicalOver(3, 3), simplify(UnaryOperator.TAN, times(1, 6)));
    assertEquals(Expression.sqrt(Expression.integer(3)), simplify(UnaryOperator.TAN, times(1, 3)));
  }

  @Test
  public void testQuotientArguments() {
    Expression sixth = Expression.divide(pi, Expression.integer(6));
    assertEquals(Expression.rational(1, 2), simplify(UnaryOperator.SIN, sixth));
    assertEquals(Expression.integer(0), simplify(UnaryOperator.SIN, pi));
    assertEquals(Expression.integer(0), simplify(UnaryOperator.SIN, Expression.integer(0)));
    assertEquals(Expression.integer(1), simplify(UnaryOperator.COS, Expression.integer(0)));
  }

  @Test
  public void testTangentPoleIsLeftAlone() {
    Expression half = Expression.divide(pi, Expression.integer(2));
    assertEquals(Expression.tan(half), simplify(UnaryOperator.TAN, half));
  }

  @Test
  public void testOtherAnglesAreLeftAlone() {
    assertEquals(Expression.sin(times(1, 5)), simplify(UnaryOperator.SIN, times(1, 5)));
    assertEquals(
        Expression.sin(Expression.integer(2)), simplify(UnaryOperator.SIN, Expression.integer(2)));
  }

  // ===== Reduction formulas and periodicity =====

  @Test
  public void testShiftsByMultiplesOfHalfPi() {
    assertEquals("cos(x)", simplify(UnaryOperator.SIN, Expression.add(x, times(1, 2))).toString());
    assertEquals("-sin(x)", simplify(UnaryOperator.COS, Expression.add(x, times(1, 2))).toString());
    assertEquals("-sin(x)", simplify(UnaryOperator.SIN, Expression.add(x, pi)).toString());
    assertEquals("-cos(x)", simplify(UnaryOperator.COS, Expression.add(pi, x)).toString());
    assertEquals("-cos(x)", simplify(UnaryOperator.SIN, Expression.add(x, times(3, 2))).toString());
    assertEquals("sin(x)", simplify(UnaryOperator.COS, Expression.add(x, times(3, 2))).toString());
    assertEquals("tan(x)", simplify(UnaryOperator.TAN, Expression.add(x, pi)).toString());
  }

  @Test
  public void testFullPeriodsAreRemoved() {
    Expression twoPi = Expression.multiply(Expression.integer(2), pi);
    Expression threePi = Expression.multiply(Expression.integer(3), pi);
    Expression fourPi = Expression.multiply(Expression.integer(4), pi);
    assertEquals("sin(x)", simplify(UnaryOperator.SIN, Expression.add(x, twoPi)).toString());
    assertEquals("cos(x)", simplify(UnaryOperator.COS, Expression.subtract(x, fourPi)).toString());
    assertEquals("tan(x)", simplify(UnaryOperator.TAN, Expression.add(x, threePi)).toString());
    assertEquals("-sin(x)", simplify(UnaryOperator.SIN, Expression.add(x, threePi)).toString());
  }

  @Test
  public void testPeriodicityKeepsTheFractionalPart() {
    Expression arg = Expression.add(x, times(9, 4));
    Expression result = simplify(UnaryOperator.SIN, arg);
    assertEquals(Expression.sin(Expression.add(x, times(1, 4))), result);
  }

  @Test
  public void testReduceIntoPeriod() {
    BigRational two = BigRational.of(2);
    assertEquals(BigRational.of(1, 4), AngleDecomposition.reduce(BigRational.of(9, 4), two));
    assertEquals(BigRational.of(7, 4), AngleDecomposition.reduce(BigRational.of(-1, 4), two));
    assertEquals(BigRational.ZERO, AngleDecomposition.reduce(BigRational.of(-4), two));
  }

  // ===== Inverse functions =====

  @Test
  public void testInverseValues() {
    assertEquals("π / 6", simplify(UnaryOperator.ASIN, Expression.rational(1, 2)).toString());
    assertEquals("π / 4", simplify(UnaryOperator.ASIN, radicalOver(2, 2)).toString());
    assertEquals("π / 2", simplify(UnaryOperator.ACOS, Expression.integer(0)).toString());
    assertEquals("0", simplify(UnaryOperator.ACOS, Expression.integer(1)).toString());
    Expression sqrt3 = Expression.sqrt(Expression.integer(3));
    assertEquals("π / 3", simplify(UnaryOperator.ATAN, sqrt3).toString());
    assertEquals("π / 4", simplify(UnaryOperator.ATAN, Expression.integer(1)).toString());
  }

  @Test
  public void testInverseParity() {
    assertEquals("-asin(x)", simplify(UnaryOperator.ASIN, Expression.negate(x)).toString());
    assertEquals("-atan(x)", simplify(UnaryOperator.ATAN, Expression.negate(x)).toString());
    assertEquals("π - acos(x)", simplify(UnaryOperator.ACOS, Expression.negate(x)).toString());
    assertEquals("-(π / 6)", simplify(UnaryOperator.ASIN, Expression.rational(-1, 2)).toString());
  }

  @Test
  public void testHyperbolicParity() {
    assertEquals("cosh(x)", simplify(UnaryOperator.COSH, Expression.negate(x)).toString());
    assertEquals("-tanh(x)", simplify(UnaryOperator.TANH, Expression.negate(x)).toString());
  }
}
