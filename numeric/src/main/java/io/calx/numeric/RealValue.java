package io.calx.numeric;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Arbitrary precision decimal. Equality ignores the scale, so {@code 2.50} equals {@code 2.5}.
 */
public record RealValue(BigDecimal value) implements NumberValue {

  public RealValue {
    Objects.requireNonNull(value, "value");
  }

  @Override
  public NumericKind kind() {
    return NumericKind.REAL;
  }

  @Override
  public boolean isZero() {
    return value.signum() == 0;
  }

  @Override
  public boolean isOne() {
    return value.compareTo(BigDecimal.ONE) == 0;
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
  public double approximate() {
    return value.doubleValue();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof RealValue && value.compareTo(((RealValue) o).value) == 0;
  }

  @Override
  public int hashCode() {
    return value.signum() == 0 ? 0 : value.stripTrailingZeros().hashCode();
  }

  @Override
  public String toString() {
    return value.toPlainString();
  }
}
