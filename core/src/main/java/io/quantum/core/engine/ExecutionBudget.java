package io.quantum.core.engine;

import io.quantum.core.config.RuntimeConfig;

/**
 * Limits applied to one component execution. Checked cooperatively between statements and on
 * every loop iteration.
 *
 * <p>Immutable and thread-safe.
 *
 * @param maxSteps          statements one execution may run
 * @param maxWallClockMs    wall-clock limit in milliseconds
 * @param maxLoopIterations iterations a single loop may run
 * @param maxCallDepth      nesting limit for function and component calls
 */
public record ExecutionBudget(long maxSteps, long maxWallClockMs, long maxLoopIterations, int maxCallDepth) {

    /** Default budget: 1M steps, 30s, 100k iterations per loop, depth 64. */
    public static final ExecutionBudget DEFAULT = new ExecutionBudget(1_000_000, 30_000, 100_000, 64);

    public ExecutionBudget {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive, got: " + maxSteps);
        }
        if (maxWallClockMs <= 0) {
            throw new IllegalArgumentException("maxWallClockMs must be positive, got: " + maxWallClockMs);
        }
        if (maxLoopIterations <= 0) {
            throw new IllegalArgumentException("maxLoopIterations must be positive, got: " + maxLoopIterations);
        }
        if (maxCallDepth <= 0) {
            throw new IllegalArgumentException("maxCallDepth must be positive, got: " + maxCallDepth);
        }
    }

    public static ExecutionBudget from(RuntimeConfig config) {
        return new ExecutionBudget(
                config.maxSteps(), config.maxWallClockMs(), config.maxLoopIterations(), config.maxCallDepth());
    }
}
