/**
 * The expression graph.
 *
 * <p>{@link io.calx.engine.expr.Expression} nodes are immutable and cache their structural hash,
 * so hashing and equality never walk an unchanged subtree twice. {@link
 * io.calx.engine.expr.Expressions} provides stack-safe traversals (fold, substitution, variable
 * collection), {@link io.calx.engine.expr.ExpressionPrinter} the canonical text form and {@link
 * io.calx.engine.expr.Evaluator} exact and approximate evaluation.
 */
package io.calx.engine.expr;
