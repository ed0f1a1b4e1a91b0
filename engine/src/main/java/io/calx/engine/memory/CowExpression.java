package io.calx.engine.memory;

import io.calx.engine.expr.Expression;
import java.util.Objects;

/**
 * Copy-on-write view over a {@link SharedExpression}: reads are free, the first write copies the
 * node if it is aliased.
 */
public final class CowExpression implements AutoCloseable {
  private final SharedExpression inner;
  private boolean modified;

  private CowExpression(SharedExpression inner) {
    this.inner = inner;
  }

  /** Takes over the given handle. */
  public static CowExpression from(SharedExpression handle) {
    return new CowExpression(Objects.requireNonNull(handle, "handle"));
  }

  public static CowExpression of(Expression value) {
    return new CowExpression(SharedExpression.of(value));
  }

  public Expression asRef() {
    return inner.get();
  }

  /** Marks this view as modified and returns write access to a unique node. */
  public ExpressionCell asMut() {
    modified = true;
    return inner.makeMut();
  }

  public boolean isModified() {
    return modified;
  }

  public int refCount() {
    return inner.refCount();
  }

  /** A new, unmodified view over a second handle to the same node. */
  public CowExpression fork() {
    return new CowExpression(inner.cloneShared());
  }

  /** Hands out the underlying handle; this view must not be used afterwards. */
  public SharedExpression intoShared() {
    return inner;
  }

  public Expression intoOwned() {
    return inner.intoOwned();
  }

  @Override
  public void close() {
    inner.release();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof CowExpression && inner.fastEquals(((CowExpression) o).inner);
  }

  @Override
  public int hashCode() {
    return inner.hashCode();
  }

  @Override
  public String toString() {
    return inner.toString();
  }
}
