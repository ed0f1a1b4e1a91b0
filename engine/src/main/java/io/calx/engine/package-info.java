/**
 * Session entry points: {@link io.calx.engine.CalxSession} bundles the pool, builder, simplifier,
 * evaluator and monitor configured by one {@link io.calx.engine.EngineConfig}.
 */
package io.calx.engine;
