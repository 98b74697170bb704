package io.quantum.core.config;

/**
 * Tuning knobs of the component runtime. Use {@link #builder()} to construct instances; every
 * field has a default.
 *
 * @param expressionCacheEnabled cache compiled expressions by normalized text
 * @param expressionCacheSize    maximum number of compiled expressions kept
 * @param astCacheEnabled        cache parsed files by path and fingerprint
 * @param astCacheSize           maximum number of parsed files kept
 * @param maxCallDepth           nesting limit for function and component calls
 * @param maxSteps               statements one execution may run
 * @param maxWallClockMs         wall-clock limit of one execution in milliseconds
 * @param maxLoopIterations      iterations a single loop may run
 * @param strictAttributes       reject unknown attributes on {@code q:} tags
 */
public record RuntimeConfig(
        boolean expressionCacheEnabled,
        int expressionCacheSize,
        boolean astCacheEnabled,
        int astCacheSize,
        int maxCallDepth,
        long maxSteps,
        long maxWallClockMs,
        long maxLoopIterations,
        boolean strictAttributes) {

    /** All defaults. */
    public static final RuntimeConfig DEFAULT = builder().build();

    public RuntimeConfig {
        requirePositive("expressionCacheSize", expressionCacheSize);
        requirePositive("astCacheSize", astCacheSize);
        requirePositive("maxCallDepth", maxCallDepth);
        requirePositive("maxSteps", maxSteps);
        requirePositive("maxWallClockMs", maxWallClockMs);
        requirePositive("maxLoopIterations", maxLoopIterations);
    }

    private static void requirePositive(String field, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(field + " must be positive, got: " + value);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-filled with this configuration. */
    public Builder toBuilder() {
        return new Builder()
                .expressionCacheEnabled(expressionCacheEnabled)
                .expressionCacheSize(expressionCacheSize)
                .astCacheEnabled(astCacheEnabled)
                .astCacheSize(astCacheSize)
                .maxCallDepth(maxCallDepth)
                .maxSteps(maxSteps)
                .maxWallClockMs(maxWallClockMs)
                .maxLoopIterations(maxLoopIterations)
                .strictAttributes(strictAttributes);
    }

    /** Builder for {@link RuntimeConfig}. */
    public static final class Builder {
        private boolean expressionCacheEnabled = true;
        private int expressionCacheSize = 10_000;
        private boolean astCacheEnabled = true;
        private int astCacheSize = 500;
        private int maxCallDepth = 64;
        private long maxSteps = 1_000_000;
        private long maxWallClockMs = 30_000;
        private long maxLoopIterations = 100_000;
        private boolean strictAttributes = true;

        Builder() {}

        public Builder expressionCacheEnabled(boolean expressionCacheEnabled) {
            this.expressionCacheEnabled = expressionCacheEnabled;
            return this;
        }

        public Builder expressionCacheSize(int expressionCacheSize) {
            this.expressionCacheSize = expressionCacheSize;
            return this;
        }

        public Builder astCacheEnabled(boolean astCacheEnabled) {
            this.astCacheEnabled = astCacheEnabled;
            return this;
        }

        public Builder astCacheSize(int astCacheSize) {
            this.astCacheSize = astCacheSize;
            return this;
        }

        public Builder maxCallDepth(int maxCallDepth) {
            this.maxCallDepth = maxCallDepth;
            return this;
        }

        public Builder maxSteps(long maxSteps) {
            this.maxSteps = maxSteps;
            return this;
        }

        public Builder maxWallClockMs(long maxWallClockMs) {
            this.maxWallClockMs = maxWallClockMs;
            return this;
        }

        public Builder maxLoopIterations(long maxLoopIterations) {
            this.maxLoopIterations = maxLoopIterations;
            return this;
        }

        public Builder strictAttributes(boolean strictAttributes) {
            this.strictAttributes = strictAttributes;
            return this;
        }

        public RuntimeConfig build() {
            return new RuntimeConfig(
                    expressionCacheEnabled,
                    expressionCacheSize,
                    astCacheEnabled,
                    astCacheSize,
                    maxCallDepth,
                    maxSteps,
                    maxWallClockMs,
                    maxLoopIterations,
                    strictAttributes);
        }
    }
}
