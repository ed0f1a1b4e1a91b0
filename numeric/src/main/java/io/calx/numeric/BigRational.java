package io.calx.numeric;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.Objects;

/**
 * Arbitrary precision fraction kept in lowest terms with a positive denominator.
 *
 * <p>Two equal fractions always have the same numerator and denominator, so {@link #equals} and
 * {@link #hashCode} are plain component comparisons.
 */
public final class BigRational implements Comparable<BigRational> {
  public static final BigRational ZERO = new BigRational(BigInteger.ZERO, BigInteger.ONE);
  public static final BigRational ONE = new BigRational(BigInteger.ONE, BigInteger.ONE);

  private final BigInteger numerator;
  private final BigInteger denominator;

  private BigRational(BigInteger numerator, BigInteger denominator) {
    this.numerator = numerator;
    this.denominator = denominator;
  }

  /**
   * Creates a reduced fraction.
   *
   * @throws ArithmeticException if {@code denominator} is zero
   */
  public static BigRational of(BigInteger numerator, BigInteger denominator) {
    Objects.requireNonNull(numerator, "numerator");
    Objects.requireNonNull(denominator, "denominator");
    if (denominator.signum() == 0) {
      throw new ArithmeticException("Zero denominator");
    }
    if (numerator.signum() == 0) {
      return ZERO;
    }
    if (denominator.signum() < 0) {
      numerator = numerator.negate();
      denominator = denominator.negate();
    }
    BigInteger gcd = numerator.gcd(denominator);
    if (!gcd.equals(BigInteger.ONE)) {
      numerator = numerator.divide(gcd);
      denominator = denominator.divide(gcd);
    }
    return new BigRational(numerator, denominator);
  }

  public static BigRational of(long numerator, long denominator) {
    return of(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
  }

  public static BigRational of(BigInteger value) {
    return new BigRational(value, BigInteger.ONE);
  }

  public static BigRational of(long value) {
    return of(BigInteger.valueOf(value));
  }

  /** Exact conversion of a terminating decimal. */
  public static BigRational of(BigDecimal value) {
    if (value.scale() <= 0) {
      return of(value.toBigIntegerExact());
    }
    return of(value.unscaledValue(), BigInteger.TEN.pow(value.scale()));
  }

  public BigInteger numerator() {
    return numerator;
  }

  public BigInteger denominator() {
    return denominator;
  }

  public boolean isInteger() {
    return denominator.equals(BigInteger.ONE);
  }

  public int signum() {
    return numerator.signum();
  }

  public BigRational add(BigRational other) {
    if (denominator.equals(other.denominator)) {
      return of(numerator.add(other.numerator), denominator);
    }
    return of(
        numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
        denominator.multiply(other.denominator));
  }

  public BigRational subtract(BigRational other) {
    return add(other.negate());
  }

  public BigRational multiply(BigRational other) {
    return of(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
  }

  /**
   * @throws ArithmeticException if {@code other} is zero
   */
  public BigRational divide(BigRational other) {
    return of(numerator.multiply(other.denominator), denominator.multiply(other.numerator));
  }

  public BigRational negate() {
    return new BigRational(numerator.negate(), denominator);
  }

  public BigRational abs() {
    return numerator.signum() < 0 ? negate() : this;
  }

  /** Integral power; negative exponents invert first. */
  public BigRational pow(int exponent) {
    if (exponent == 0) {
      return ONE;
    }
    if (exponent < 0) {
      return of(denominator.pow(-exponent), numerator.pow(-exponent));
    }
    return new BigRational(numerator.pow(exponent), denominator.pow(exponent));
  }

  /** Largest integer not greater than this value. */
  public BigInteger floor() {
    BigInteger[] qr = numerator.divideAndRemainder(denominator);
    if (qr[1].signum() < 0) {
      return qr[0].subtract(BigInteger.ONE);
    }
    return qr[0];
  }

  /** True when the denominator has no prime factors other than 2 and 5. */
  public boolean hasTerminatingDecimal() {
    BigInteger d = denominator.shiftRight(denominator.getLowestSetBit());
    BigInteger five = BigInteger.valueOf(5);
    while (d.mod(five).signum() == 0) {
      d = d.divide(five);
    }
    return d.equals(BigInteger.ONE);
  }

  /**
   * Exact decimal expansion.
   *
   * @throws ArithmeticException if the expansion does not terminate
   */
  public BigDecimal toBigDecimalExact() {
    if (isInteger()) {
      return new BigDecimal(numerator);
    }
    return new BigDecimal(numerator).divide(new BigDecimal(denominator));
  }

  public BigDecimal toBigDecimal(MathContext mc) {
    if (isInteger()) {
      return new BigDecimal(numerator);
    }
    return new BigDecimal(numerator).divide(new BigDecimal(denominator), mc);
  }

  public double doubleValue() {
    if (isInteger()) {
      return numerator.doubleValue();
    }
    return toBigDecimal(MathContext.DECIMAL64).doubleValue();
  }

  @Override
  public int compareTo(BigRational other) {
    return numerator.multiply(other.denominator).compareTo(other.numerator.multiply(denominator));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BigRational)) {
      return false;
    }
    BigRational that = (BigRational) o;
    return numerator.equals(that.numerator) && denominator.equals(that.denominator);
  }

  @Override
  public int hashCode() {
    return 31 * numerator.hashCode() + denominator.hashCode();
  }

  @Override
  public String toString() {
    return isInteger() ? numerator.toString() : numerator + "/" + denominator;
  }
}
