package io.calx.engine.expr;

import java.util.Locale;
import java.util.Optional;

/** Named mathematical constants. */
public enum MathConstant {
  PI("π", Math.PI),
  E("e", Math.E),
  I("i", Double.NaN),
  EULER_GAMMA("γ", 0.5772156649015329),
  GOLDEN_RATIO("φ", 1.618033988749895),
  CATALAN("G", 0.915965594177219),
  POSITIVE_INFINITY("∞", Double.POSITIVE_INFINITY),
  NEGATIVE_INFINITY("-∞", Double.NEGATIVE_INFINITY),
  UNDEFINED("undefined", Double.NaN);

  private final String symbol;
  private final double approximation;

  MathConstant(String symbol, double approximation) {
    this.symbol = symbol;
    this.approximation = approximation;
  }

  public String symbol() {
    return symbol;
  }

  /** @return double approximation; {@code NaN} for {@link #I} and {@link #UNDEFINED} */
  public double approximation() {
    return approximation;
  }

  public boolean isReal() {
    return this != I && this != UNDEFINED;
  }

  /** Non-zero for every constant that denotes a number. */
  public boolean isNonZero() {
    return this != UNDEFINED;
  }

  /**
   * Resolves a constant from its symbol or a common spelling ({@code pi}, {@code phi}, {@code
   * inf}...).
   */
  public static Optional<MathConstant> fromName(String name) {
    switch (name.toLowerCase(Locale.ROOT)) {
      case "pi":
      case "π":
        return Optional.of(PI);
      case "e":
        return Optional.of(E);
      case "i":
        return Optional.of(I);
      case "gamma":
      case "euler_gamma":
      case "γ":
        return Optional.of(EULER_GAMMA);
      case "phi":
      case "golden_ratio":
      case "φ":
        return Optional.of(GOLDEN_RATIO);
      case "catalan":
      case "g":
        return Optional.of(CATALAN);
      case "inf":
      case "infinity":
      case "∞":
        return Optional.of(POSITIVE_INFINITY);
      case "-inf":
      case "-infinity":
      case "-∞":
        return Optional.of(NEGATIVE_INFINITY);
      case "undefined":
      case "nan":
        return Optional.of(UNDEFINED);
      default:
        return Optional.empty();
    }
  }
}
