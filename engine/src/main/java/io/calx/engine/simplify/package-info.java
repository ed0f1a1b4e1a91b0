/**
 * Fixed-point term rewriting: the {@link io.calx.engine.simplify.Simplifier} entry point, the
 * ordered {@link io.calx.engine.simplify.RuleFamily rule families} and their shared matching
 * helpers.
 */
package io.calx.engine.simplify;
