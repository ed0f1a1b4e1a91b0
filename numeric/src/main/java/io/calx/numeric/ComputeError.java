package io.calx.numeric;

/**
 * Closed taxonomy of computation failures.
 *
 * <p>Arithmetic itself never raises for division by zero; those results are folded into a {@link
 * SymbolicValue}. The categories below are used by evaluation and rewriting, where a caller has to
 * decide how to continue.
 */
public enum ComputeError {
  /** Modulo by zero, or a division the caller asked to be strict about. Not recoverable. */
  DIVISION_BY_ZERO("DIV_ZERO", false),
  /** Evaluation hit a free variable with no binding. Recoverable by supplying one. */
  UNDEFINED_VARIABLE("UNDEF_VAR", true),
  /** Operation outside its mathematical domain (negative factorial, log of zero). */
  DOMAIN_ERROR("DOMAIN", false),
  /** A finite floating-point computation overflowed to infinity. */
  OVERFLOW("OVERFLOW", false),
  /** Rewriting did not reach a fixed point within its pass budget. Recoverable. */
  TIMEOUT("TIMEOUT", true);

  private final String code;
  private final boolean recoverable;

  ComputeError(String code, boolean recoverable) {
    this.code = code;
    this.recoverable = recoverable;
  }

  public String code() {
    return code;
  }

  public boolean isRecoverable() {
    return recoverable;
  }
}
