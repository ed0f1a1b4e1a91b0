package io.calx.engine.memory;

import io.calx.engine.expr.Expression;

/** Mutable cell shared by all handles that alias it. */
final class ExpressionNode {
  Expression value;
  int refCount;
  final CopyObserver observer;

  ExpressionNode(Expression value, CopyObserver observer) {
    this.value = value;
    this.refCount = 1;
    this.observer = observer;
  }

  /** A fresh, exclusively owned node with the same value. */
  ExpressionNode detach() {
    refCount--;
    if (observer != null) {
      observer.copiedOnWrite();
    }
    return new ExpressionNode(value, observer);
  }

  /** Notified whenever an aliased node is copied before a write. */
  interface CopyObserver {
    void copiedOnWrite();
  }
}
