package io.calx.numeric;

import java.util.Objects;

/**
 * A number that could not be resolved to a concrete value.
 *
 * <p>Carries the {@link Reason} and a textual rendering of the unresolved computation, so a
 * downstream layer can still present it, or turn a {@link Reason#DIVISION_BY_ZERO} into an error.
 */
public record SymbolicValue(Reason reason, String text) implements NumberValue {

  /** Why a value stayed symbolic. */
  public enum Reason {
    DIVISION_BY_ZERO,
    /** {@code 0/0} and {@code 0^0}. */
    INDETERMINATE,
    /** Float combined with an exact kind. */
    INEXACT_MIX,
    /** No exact closed form (irrational roots, constants, transcendental functions). */
    UNEVALUATED
  }

  public SymbolicValue {
    Objects.requireNonNull(reason, "reason");
    Objects.requireNonNull(text, "text");
  }

  @Override
  public NumericKind kind() {
    return NumericKind.SYMBOLIC;
  }

  @Override
  public boolean isZero() {
    return false;
  }

  @Override
  public boolean isOne() {
    return false;
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
  public double approximate() {
    return Double.NaN;
  }

  @Override
  public String toString() {
    return text;
  }
}
