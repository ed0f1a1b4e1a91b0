package io.calx.numeric;

import java.util.Objects;

/**
 * Complex number with real-kind components (Integer, Rational, Real or Float).
 *
 * <p>Values built through {@link NumberValue#complex} or {@link Arithmetic} always have a
 * non-zero imaginary part; a zero imaginary part collapses to the real component.
 */
public record ComplexValue(NumberValue real, NumberValue imaginary) implements NumberValue {
  static final ComplexValue I = new ComplexValue(IntegerValue.ZERO, IntegerValue.ONE);

  public ComplexValue {
    Objects.requireNonNull(real, "real");
    Objects.requireNonNull(imaginary, "imaginary");
    if (!real.isReal() || !imaginary.isReal()) {
      throw new IllegalArgumentException(
          "Complex components must be real numbers: " + real + ", " + imaginary);
    }
  }

  static NumberValue normalize(NumberValue real, NumberValue imaginary) {
    if (real.isSymbolic()) {
      return real;
    }
    if (imaginary.isSymbolic()) {
      return imaginary;
    }
    if (imaginary.isZero()) {
      return real;
    }
    return new ComplexValue(real, imaginary);
  }

  @Override
  public NumericKind kind() {
    return NumericKind.COMPLEX;
  }

  @Override
  public boolean isZero() {
    return real.isZero() && imaginary.isZero();
  }

  @Override
  public boolean isOne() {
    return real.isOne() && imaginary.isZero();
  }

  @Override
  public boolean isNegative() {
    return false;
  }

  @Override
  public boolean isPositive() {
    return false;
  }

  @Override
  public boolean isExact() {
    return real.isExact() && imaginary.isExact();
  }

  public NumberValue conjugate() {
    return normalize(real, imaginary.negate());
  }

  /** Modulus. */
  @Override
  public double approximate() {
    return Math.hypot(real.approximate(), imaginary.approximate());
  }

  @Override
  public NumberValue toExact() {
    return normalize(real.toExact(), imaginary.toExact());
  }

  @Override
  public String toString() {
    if (imaginary.isZero()) {
      return real.toString();
    }
    if (real.isZero()) {
      if (imaginary.isOne()) {
        return "i";
      }
      if (imaginary.negate().isOne()) {
        return "-i";
      }
      return imaginary + "i";
    }
    if (imaginary.isNegative()) {
      NumberValue magnitude = imaginary.negate();
      return real + "-" + (magnitude.isOne() ? "" : magnitude.toString()) + "i";
    }
    return real + "+" + (imaginary.isOne() ? "" : imaginary.toString()) + "i";
  }
}
