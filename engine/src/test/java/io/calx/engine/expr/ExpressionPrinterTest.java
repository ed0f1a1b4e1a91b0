package io.calx.engine.expr;

import static org.junit.jupiter.api.Assertions.*;

import io.calx.numeric.NumberValue;
import org.junit.jupiter.api.Test;

public class ExpressionPrinterTest {
  private final Expression x = Expression.variable("x");
  private final Expression y = Expression.variable("y");
  private final Expression z = Expression.variable("z");
  private final Expression one = Expression.integer(1);
  private final Expression two = Expression.integer(2);

  private static String print(Expression e) {
    return ExpressionPrinter.print(e);
  }

  @Test
  public void testInfixSpacing() {
    assertEquals("x + 1", print(Expression.add(x, one)));
    assertEquals("2 * x", print(Expression.multiply(two, x)));
    assertEquals("x / y", print(Expression.divide(x, y)));
    assertEquals("x % 2", print(Expression.binary(BinaryOperator.MODULO, x, two)));
    assertEquals("x^2", print(Expression.power(x, two)));
  }

  @Test
  public void testPrecedenceParentheses() {
    assertEquals("(x + 1) * y", print(Expression.multiply(Expression.add(x, one), y)));
    assertEquals("x + 1 * y", print(Expression.add(x, Expression.multiply(one, y))));
    assertEquals("(x * y)^2", print(Expression.power(Expression.multiply(x, y), two)));
  }

  @Test
  public void testLeftAssociativity() {
    assertEquals("x - y - z", print(Expression.subtract(Expression.subtract(x, y), z)));
    assertEquals("x - (y - z)", print(Expression.subtract(x, Expression.subtract(y, z))));
    assertEquals("x / (y / z)", print(Expression.divide(x, Expression.divide(y, z))));
  }

  @Test
  public void testPowerIsRightAssociative() {
    assertEquals("x^y^2", print(Expression.power(x, Expression.power(y, two))));
    assertEquals("(x^y)^2", print(Expression.power(Expression.power(x, y), two)));
  }

  @Test
  public void testPrefixAndPostfix() {
    assertEquals("-x", print(Expression.negate(x)));
    assertEquals("-(x + 1)", print(Expression.negate(Expression.add(x, one))));
    assertEquals("-sin(x)", print(Expression.negate(Expression.sin(x))));
    assertEquals("x!", print(Expression.unary(UnaryOperator.FACTORIAL, x)));
    assertEquals("(x + 1)!", print(Expression.unary(UnaryOperator.FACTORIAL, Expression.add(x, one))));
  }

  @Test
  public void testFunctionStyle() {
    assertEquals("sqrt(2)", print(Expression.sqrt(two)));
    assertEquals("sin(x)^2", print(Expression.power(Expression.sin(x), two)));
    assertEquals("max(x, y, 1)", print(Expression.function("max", x, y, one)));
    assertEquals("conj(x)", print(Expression.unary(UnaryOperator.CONJUGATE, x)));
  }

  @Test
  public void testNumberLiterals() {
    assertEquals("6", print(Expression.rational(6, 1)));
    assertEquals("1/3 * x", print(Expression.multiply(Expression.rational(1, 3), x)));
    assertEquals("x^(1/2)", print(Expression.power(x, Expression.rational(1, 2))));
    assertEquals("(-2)^2", print(Expression.power(Expression.integer(-2), two)));
    assertEquals(
        "(3+4i) * x",
        print(
            Expression.multiply(
                Expression.number(
                    NumberValue.complex(NumberValue.integer(3), NumberValue.integer(4))),
                x)));
  }

  @Test
  public void testConstants() {
    assertEquals("π / 6", print(Expression.divide(Expression.pi(), Expression.integer(6))));
    assertEquals("e", print(Expression.constant(MathConstant.E)));
  }

  @Test
  public void testToStringUsesPrinter() {
    Expression e = Expression.add(Expression.sin(x), Expression.cos(x));
    assertEquals(print(e), e.toString());
  }
}
