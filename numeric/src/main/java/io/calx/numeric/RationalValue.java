package io.calx.numeric;

import java.util.Objects;

/**
 * Exact fraction. Arithmetic results whose denominator reduces to one are returned as {@link
 * IntegerValue} instead; a directly constructed {@code 6/1} still displays as {@code 6}.
 */
public record RationalValue(BigRational value) implements NumberValue {

  public RationalValue {
    Objects.requireNonNull(value, "value");
  }

  static NumberValue normalize(BigRational value) {
    if (value.isInteger()) {
      return IntegerValue.of(value.numerator());
    }
    return new RationalValue(value);
  }

  @Override
  public NumericKind kind() {
    return NumericKind.RATIONAL;
  }

  @Override
  public boolean isZero() {
    return value.signum() == 0;
  }

  @Override
  public boolean isOne() {
    return value.equals(BigRational.ONE);
  }

  @Override
  public boolean isNegative() {
    return value.signum() < 0;
  }

  @Override
  public boolean isPositive() {
    return value.signum() > 0;
  }

  @Override
  public boolean isInteger() {
    return value.isInteger();
  }

  @Override
  public double approximate() {
    return value.doubleValue();
  }

  @Override
  public String toString() {
    return value.toString();
  }
}
