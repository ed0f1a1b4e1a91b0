package io.calx.engine.simplify;

import io.calx.engine.expr.Expression;
import io.calx.numeric.ComputeError;
import io.calx.numeric.ComputeException;

/**
 * Thrown when rewriting does not reach a fixed point within the pass budget. The last
 * intermediate form is still a valid rewrite of the input and may be used as is, or simplified
 * again with a larger budget.
 */
public class RewriteBudgetExceededException extends ComputeException {
  private final int passes;
  private final transient Expression lastForm;

  public RewriteBudgetExceededException(int passes, Expression lastForm) {
    super(ComputeError.TIMEOUT, "Rewriting did not reach a fixed point", passes + " passes");
    this.passes = passes;
    this.lastForm = lastForm;
  }

  public int getPasses() {
    return passes;
  }

  public Expression getLastForm() {
    return lastForm;
  }
}
