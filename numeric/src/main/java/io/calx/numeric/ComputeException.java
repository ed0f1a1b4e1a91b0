package io.calx.numeric;

import java.util.Objects;

/**
 * Base exception for computation errors raised by evaluation and rewriting.
 *
 * <p>The message carries the failing context and the {@link ComputeError#code() error code} so a
 * log line alone identifies the failure.
 */
public class ComputeException extends RuntimeException {
  private final ComputeError error;
  private final String context;

  public ComputeException(ComputeError error, String message) {
    this(error, message, null, null);
  }

  public ComputeException(ComputeError error, String message, String context) {
    this(error, message, context, null);
  }

  public ComputeException(ComputeError error, String message, String context, Throwable cause) {
    super(formatMessage(message, context, Objects.requireNonNull(error, "error")), cause);
    this.error = error;
    this.context = context;
  }

  private static String formatMessage(String message, String context, ComputeError error) {
    StringBuilder sb = new StringBuilder(message);
    if (context != null) {
      sb.append(" [Context: ").append(context).append("]");
    }
    sb.append(" [Error Code: ").append(error.code()).append("]");
    return sb.toString();
  }

  public ComputeError getError() {
    return error;
  }

  public String getErrorCode() {
    return error.code();
  }

  /** @return the expression, variable or operation the error refers to; may be {@code null} */
  public String getContext() {
    return context;
  }

  public boolean isRecoverable() {
    return error.isRecoverable();
  }

  /**
   * Creates an exception for a modulo (or strict division) by zero.
   *
   * @param dividend textual form of the dividend
   * @return a new exception instance
   */
  public static ComputeException divisionByZero(String dividend) {
    return new ComputeException(ComputeError.DIVISION_BY_ZERO, "Division by zero", dividend);
  }

  /**
   * Creates an exception for a variable that has no binding.
   *
   * @param name the variable name
   * @return a new exception instance
   */
  public static ComputeException undefinedVariable(String name) {
    return new ComputeException(ComputeError.UNDEFINED_VARIABLE, "Undefined variable '" + name + "'", name);
  }

  /**
   * Creates an exception for an operation applied outside of its domain.
   *
   * @param operation the offending operation, e.g. {@code factorial(-1)}
   * @param reason short explanation
   * @return a new exception instance
   */
  public static ComputeException domainError(String operation, String reason) {
    return new ComputeException(ComputeError.DOMAIN_ERROR, "Domain error: " + reason, operation);
  }

  /**
   * Creates an exception for a floating-point overflow.
   *
   * @param operation the operation that overflowed
   * @return a new exception instance
   */
  public static ComputeException overflow(String operation) {
    return new ComputeException(ComputeError.OVERFLOW, "Numeric overflow", operation);
  }

  /**
   * Creates an exception for a computation that exhausted its step budget.
   *
   * @param steps the budget that was exhausted
   * @return a new exception instance
   */
  public static ComputeException timeout(int steps) {
    return new ComputeException(
        ComputeError.TIMEOUT, "Computation did not converge", steps + " steps");
  }
}
