package io.calx.numeric;

import java.math.BigInteger;
import java.util.Objects;

/** Arbitrary precision integer. */
public record IntegerValue(BigInteger value) implements NumberValue {
  static final IntegerValue ZERO = new IntegerValue(BigInteger.ZERO);
  static final IntegerValue ONE = new IntegerValue(BigInteger.ONE);

  public IntegerValue {
    Objects.requireNonNull(value, "value");
  }

  public static IntegerValue of(long value) {
    if (value == 0) {
      return ZERO;
    }
    if (value == 1) {
      return ONE;
    }
    return new IntegerValue(BigInteger.valueOf(value));
  }

  public static IntegerValue of(BigInteger value) {
    return new IntegerValue(value);
  }

  @Override
  public NumericKind kind() {
    return NumericKind.INTEGER;
  }

  @Override
  public boolean isZero() {
    return value.signum() == 0;
  }

  @Override
  public boolean isOne() {
    return value.equals(BigInteger.ONE);
  }

  @Override
  public boolean isNegative() {
    return value.signum() < 0;
  }

  @Override
  public boolean isPositive() {
    return value.signum() > 0;
  }

  public boolean isEven() {
    return !value.testBit(0);
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
