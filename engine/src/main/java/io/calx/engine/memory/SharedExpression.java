package io.calx.engine.memory;

import io.calx.engine.expr.Expression;
import java.util.Objects;

/**
 * Reference-counted handle to an expression node.
 *
 * <p>{@link #cloneShared()} hands out another handle to the same node and increments the count;
 * {@link #release()} gives one back. Writes go through {@link #makeMut()}, which first copies the
 * node when other handles still alias it, so a write is never visible through another handle.
 *
 * <p>Counts are plain integers: a handle, and every handle cloned from it, must stay confined to
 * one thread or be guarded externally.
 */
public final class SharedExpression implements AutoCloseable {
  private ExpressionNode node;
  private boolean released;

  SharedExpression(ExpressionNode node) {
    this.node = node;
  }

  /** Wraps a value in a new, unpooled node. The returned handle is unique. */
  public static SharedExpression of(Expression value) {
    return new SharedExpression(new ExpressionNode(Objects.requireNonNull(value, "value"), null));
  }

  public Expression get() {
    return node().value;
  }

  /** @return number of live handles on this handle's node */
  public int refCount() {
    return node().refCount;
  }

  public boolean isUnique() {
    return node().refCount == 1;
  }

  public boolean isReleased() {
    return released;
  }

  /** Another handle to the same node; the count grows by one. */
  public SharedExpression cloneShared() {
    ExpressionNode n = node();
    n.refCount++;
    return new SharedExpression(n);
  }

  /**
   * Gives this handle's reference back. Releasing twice is a no-op; any other use of a released
   * handle throws {@link IllegalStateException}.
   */
  public void release() {
    if (released) {
      return;
    }
    released = true;
    node.refCount--;
  }

  @Override
  public void close() {
    release();
  }

  /**
   * Mutable access to the value. If the node is aliased it is copied first and this handle moves
   * to the copy, leaving the other handles untouched; afterwards this handle is unique.
   */
  public ExpressionCell makeMut() {
    ensureUnique();
    return new ExpressionCell(this);
  }

  void ensureUnique() {
    ExpressionNode n = node();
    if (n.refCount > 1) {
      node = n.detach();
    }
  }

  void set(Expression value) {
    ensureUnique();
    node.value = Objects.requireNonNull(value, "value");
  }

  public long structuralHash() {
    return get().structuralHash();
  }

  /** {@code true} when both handles refer to the same node. */
  public boolean sharesNodeWith(SharedExpression other) {
    return node() == other.node();
  }

  /**
   * Equality with short cuts: same node is equal, differing cached hashes are not, anything else is
   * compared structurally.
   */
  public boolean fastEquals(SharedExpression other) {
    if (sharesNodeWith(other)) {
      return true;
    }
    Expression a = get();
    Expression b = other.get();
    if (a.structuralHash() != b.structuralHash()) {
      return false;
    }
    return a.equals(b);
  }

  /** Releases this handle and returns its value. Expressions are immutable, so no copy is made. */
  public Expression intoOwned() {
    Expression value = get();
    release();
    return value;
  }

  ExpressionNode node() {
    if (released) {
      throw new IllegalStateException("SharedExpression has been released");
    }
    return node;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof SharedExpression && fastEquals((SharedExpression) o);
  }

  @Override
  public int hashCode() {
    return get().hashCode();
  }

  @Override
  public String toString() {
    return released ? "<released>" : get().toString();
  }
}
