package io.calx.numeric;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * A value of the exact numeric tower.
 *
 * <p>Variants are closed: {@link IntegerValue}, {@link RationalValue}, {@link RealValue}, {@link
 * ComplexValue}, {@link FloatValue} and {@link SymbolicValue}. Values produced by the factory
 * methods and by {@link Arithmetic} are canonical, so equal exact numbers of the same kind compare
 * equal with {@link Object#equals}. Operations never throw for division by zero; the result is a
 * {@link SymbolicValue} tagged with the reason instead.
 *
 * <p>{@link #toString()} is the display contract: {@code 6/1} shows as {@code 6}, complex numbers
 * as {@code a+bi}, {@code a-bi}, {@code i} or {@code -i}.
 */
public sealed interface NumberValue
    permits IntegerValue, RationalValue, RealValue, ComplexValue, FloatValue, SymbolicValue {

  NumericKind kind();

  boolean isZero();

  boolean isOne();

  boolean isNegative();

  boolean isPositive();

  /** Float is the only inexact kind. */
  default boolean isExact() {
    return kind() != NumericKind.FLOAT;
  }

  default boolean isInteger() {
    return kind() == NumericKind.INTEGER;
  }

  /** Integer or Rational. */
  default boolean isRational() {
    NumericKind kind = kind();
    return kind == NumericKind.INTEGER || kind == NumericKind.RATIONAL;
  }

  /** Any kind on the real line, Float included. */
  default boolean isReal() {
    NumericKind kind = kind();
    return kind == NumericKind.INTEGER
        || kind == NumericKind.RATIONAL
        || kind == NumericKind.REAL
        || kind == NumericKind.FLOAT;
  }

  /** A complex value with a non-zero imaginary part. */
  default boolean isComplex() {
    return kind() == NumericKind.COMPLEX;
  }

  default boolean isSymbolic() {
    return kind() == NumericKind.SYMBOLIC;
  }

  /**
   * Floating approximation of this value. Complex numbers approximate to their modulus, symbolic
   * values to {@code NaN}.
   */
  double approximate();

  /** Converts a Float to its exact rational form; every other kind is returned unchanged. */
  default NumberValue toExact() {
    return this;
  }

  default NumberValue add(NumberValue other) {
    return Arithmetic.add(this, other);
  }

  default NumberValue subtract(NumberValue other) {
    return Arithmetic.subtract(this, other);
  }

  default NumberValue multiply(NumberValue other) {
    return Arithmetic.multiply(this, other);
  }

  default NumberValue divide(NumberValue other) {
    return Arithmetic.divide(this, other);
  }

  default NumberValue pow(NumberValue exponent) {
    return Arithmetic.pow(this, exponent);
  }

  default NumberValue negate() {
    return Arithmetic.negate(this);
  }

  default NumberValue abs() {
    return Arithmetic.abs(this);
  }

  static NumberValue zero() {
    return IntegerValue.ZERO;
  }

  static NumberValue one() {
    return IntegerValue.ONE;
  }

  static NumberValue integer(long value) {
    return IntegerValue.of(value);
  }

  static NumberValue integer(BigInteger value) {
    return IntegerValue.of(value);
  }

  /** A reduced fraction; a zero denominator yields a symbolic division-by-zero value. */
  static NumberValue rational(long numerator, long denominator) {
    return rational(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
  }

  static NumberValue rational(BigInteger numerator, BigInteger denominator) {
    if (denominator.signum() == 0) {
      return Arithmetic.divide(IntegerValue.of(numerator), IntegerValue.ZERO);
    }
    return RationalValue.normalize(BigRational.of(numerator, denominator));
  }

  static NumberValue rational(BigRational value) {
    return RationalValue.normalize(value);
  }

  static NumberValue real(BigDecimal value) {
    return new RealValue(value);
  }

  static NumberValue real(String value) {
    return new RealValue(new BigDecimal(value));
  }

  /** A complex value; collapses to its real part when the imaginary part is zero. */
  static NumberValue complex(NumberValue real, NumberValue imaginary) {
    return ComplexValue.normalize(real, imaginary);
  }

  static NumberValue imaginaryUnit() {
    return ComplexValue.I;
  }

  static NumberValue floating(double value) {
    return new FloatValue(value);
  }

  /**
   * Lifts both operands to a common kind.
   *
   * @see Arithmetic#promote(NumberValue, NumberValue)
   */
  static Arithmetic.Promoted promoteTypes(NumberValue left, NumberValue right) {
    return Arithmetic.promote(left, right);
  }
}
