package io.calx.numeric;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import org.junit.jupiter.api.Test;

public class BigRationalTest {

  @Test
  public void testReducesToLowestTerms() {
    BigRational r = BigRational.of(6, 8);
    assertEquals(BigInteger.valueOf(3), r.numerator());
    assertEquals(BigInteger.valueOf(4), r.denominator());
  }

  @Test
  public void testDenominatorIsAlwaysPositive() {
    BigRational r = BigRational.of(3, -9);
    assertEquals(BigInteger.valueOf(-1), r.numerator());
    assertEquals(BigInteger.valueOf(3), r.denominator());
    assertEquals(-1, r.signum());
  }

  @Test
  public void testZeroDenominatorThrows() {
    assertThrows(ArithmeticException.class, () -> BigRational.of(1, 0));
  }

  @Test
  public void testEqualFractionsAreEqual() {
    assertEquals(BigRational.of(2, 4), BigRational.of(-1, -2));
    assertEquals(BigRational.of(2, 4).hashCode(), BigRational.of(1, 2).hashCode());
  }

  @Test
  public void testArithmetic() {
    BigRational third = BigRational.of(1, 3);
    BigRational sixth = BigRational.of(1, 6);
    assertEquals(BigRational.of(1, 2), third.add(sixth));
    assertEquals(BigRational.of(1, 6), third.subtract(sixth));
    assertEquals(BigRational.of(1, 18), third.multiply(sixth));
    assertEquals(BigRational.of(2), third.divide(sixth));
    assertEquals(BigRational.of(1, 27), third.pow(3));
    assertEquals(BigRational.of(9), third.pow(-2));
    assertEquals(BigRational.ONE, third.pow(0));
  }

  @Test
  public void testFloor() {
    assertEquals(BigInteger.valueOf(2), BigRational.of(7, 3).floor());
    assertEquals(BigInteger.valueOf(-3), BigRational.of(-7, 3).floor());
    assertEquals(BigInteger.valueOf(-2), BigRational.of(-2).floor());
  }

  @Test
  public void testDecimalConversion() {
    assertEquals(BigRational.of(1, 8), BigRational.of(new BigDecimal("0.125")));
    assertEquals(BigRational.of(1200), BigRational.of(new BigDecimal("1.2E+3")));
    assertEquals(0, new BigDecimal("0.25").compareTo(BigRational.of(1, 4).toBigDecimal(MathContext.DECIMAL64)));
  }

  @Test
  public void testTerminatingDecimals() {
    assertTrue(BigRational.of(3, 40).hasTerminatingDecimal());
    assertTrue(BigRational.of(7).hasTerminatingDecimal());
    assertFalse(BigRational.of(1, 6).hasTerminatingDecimal());
    assertEquals(0, new BigDecimal("0.075").compareTo(BigRational.of(3, 40).toBigDecimalExact()));
    assertThrows(ArithmeticException.class, () -> BigRational.of(1, 3).toBigDecimalExact());
  }

  @Test
  public void testOrdering() {
    assertTrue(BigRational.of(1, 3).compareTo(BigRational.of(1, 2)) < 0);
    assertTrue(BigRational.of(-1, 2).compareTo(BigRational.of(-1, 3)) < 0);
    assertEquals(0, BigRational.of(2, 6).compareTo(BigRational.of(1, 3)));
  }

  @Test
  public void testToString() {
    assertEquals("3/4", BigRational.of(3, 4).toString());
    assertEquals("-5", BigRational.of(10, -2).toString());
  }
}
