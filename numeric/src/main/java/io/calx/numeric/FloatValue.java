package io.calx.numeric;

import java.math.BigDecimal;

/**
 * Double precision approximation. Never mixes with exact kinds; call {@link #toExact()} first.
 */
public record FloatValue(double value) implements NumberValue {

  @Override
  public NumericKind kind() {
    return NumericKind.FLOAT;
  }

  @Override
  public boolean isZero() {
    return value == 0.0;
  }

  @Override
  public boolean isOne() {
    return value == 1.0;
  }

  @Override
  public boolean isNegative() {
    return value < 0.0;
  }

  @Override
  public boolean isPositive() {
    return value > 0.0;
  }

  @Override
  public double approximate() {
    return value;
  }

  /** Rational form of the shortest decimal that round-trips to this double. */
  @Override
  public NumberValue toExact() {
    if (!Double.isFinite(value)) {
      return this;
    }
    return RationalValue.normalize(BigRational.of(BigDecimal.valueOf(value)));
  }

  @Override
  public String toString() {
    return Double.toString(value);
  }
}
