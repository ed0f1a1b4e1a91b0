/**
 * Exact numeric tower.
 *
 * <p>{@link io.calx.numeric.NumberValue} is the closed set of numeric values used by the
 * expression engine: arbitrary precision integers, reduced fractions, decimals, complex numbers,
 * IEEE doubles and unresolved symbolic results. {@link io.calx.numeric.Arithmetic} implements the
 * promotion rules and all operations.
 *
 * <p>Key guarantees:
 *
 * <ul>
 *   <li>Exactness: integer and rational arithmetic never rounds; {@code 1/3 + 1/3 + 1/3} is the
 *       integer {@code 1}.
 *   <li>Canonical results: denominators of one collapse to integers, zero imaginary parts to
 *       reals.
 *   <li>Totality: division by zero produces a {@link io.calx.numeric.SymbolicValue} rather than an
 *       exception.
 * </ul>
 *
 * <p>Errors that callers must handle are reported with {@link io.calx.numeric.ComputeException},
 * categorised by {@link io.calx.numeric.ComputeError}.
 */
package io.calx.numeric;
