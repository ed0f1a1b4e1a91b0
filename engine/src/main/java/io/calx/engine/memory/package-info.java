/**
 * Shared ownership of expressions.
 *
 * <p>{@link io.calx.engine.memory.SharedExpression} is an explicitly reference-counted handle with
 * copy-on-write mutation; {@link io.calx.engine.memory.CowExpression} tracks whether a view was
 * written. {@link io.calx.engine.memory.MemoryManager} pools nodes by structural hash and reports
 * {@link io.calx.engine.memory.MemoryStats}; {@link io.calx.engine.memory.MemoryMonitor} exposes
 * them to polling callers.
 *
 * <p>Reference counts are not atomic. Handles derived from one another belong to one thread at a
 * time.
 */
package io.calx.engine.memory;
