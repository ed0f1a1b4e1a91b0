package io.calx.engine.memory;

import io.calx.engine.expr.Expression;
import java.util.function.UnaryOperator;

/**
 * Write access to the value behind a {@link SharedExpression}.
 *
 * <p>Every write re-checks that the owning handle is unique, so a cell obtained before the handle
 * was cloned again still cannot write through to the other handles.
 */
public final class ExpressionCell {
  private final SharedExpression owner;

  ExpressionCell(SharedExpression owner) {
    this.owner = owner;
  }

  public Expression get() {
    return owner.get();
  }

  public void set(Expression value) {
    owner.set(value);
  }

  public void update(UnaryOperator<Expression> function) {
    owner.set(function.apply(owner.get()));
  }
}
