package io.github.eutro.mir2cfim.api;

/**
 * How a {@link CfimCompiler} structures declarations.
 */
public final class StructuringOptions {
    /**
     * The default options: reconstruct asserts, structure on the calling thread,
     * and collect failures rather than throwing them.
     */
    public static final StructuringOptions DEFAULT = builder().build();

    private final boolean reconstructAsserts;
    private final int parallelism;
    private final boolean failFast;

    private StructuringOptions(Builder builder) {
        this.reconstructAsserts = builder.reconstructAsserts;
        this.parallelism = builder.parallelism;
        this.failFast = builder.failFast;
    }

    /**
     * Create a new builder, initialised to the default options.
     *
     * @return The builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create a builder initialised to these options.
     *
     * @return The builder.
     */
    public Builder toBuilder() {
        return new Builder()
                .setReconstructAsserts(reconstructAsserts)
                .setParallelism(parallelism)
                .setFailFast(failFast);
    }

    public boolean shouldReconstructAsserts() {
        return reconstructAsserts;
    }

    public int getParallelism() {
        return parallelism;
    }

    public boolean isFailFast() {
        return failFast;
    }

    @Override
    public String toString() {
        return "StructuringOptions{" +
                "reconstructAsserts=" + reconstructAsserts +
                ", parallelism=" + parallelism +
                ", failFast=" + failFast +
                '}';
    }

    /**
     * A builder for {@link StructuringOptions}.
     */
    public static final class Builder {
        private boolean reconstructAsserts = true;
        private int parallelism = 1;
        private boolean failFast = false;

        private Builder() {
        }

        /**
         * Set whether {@code if c { panic } else { ... }} is rewritten into an assertion. Enabled by default.
         *
         * @param reconstructAsserts Whether to reconstruct asserts.
         * @return This builder, for convenience.
         */
        public Builder setReconstructAsserts(boolean reconstructAsserts) {
            this.reconstructAsserts = reconstructAsserts;
            return this;
        }

        /**
         * Set how many declarations may be structured at once. With 1, the default,
         * everything happens on the thread running the compilation.
         *
         * @param parallelism The number of worker threads.
         * @return This builder, for convenience.
         */
        public Builder setParallelism(int parallelism) {
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be positive, got " + parallelism);
            }
            this.parallelism = parallelism;
            return this;
        }

        /**
         * Set whether the first declaration that cannot be structured aborts the compilation,
         * instead of being reported in the result. Disabled by default.
         *
         * @param failFast Whether to fail fast.
         * @return This builder, for convenience.
         */
        public Builder setFailFast(boolean failFast) {
            this.failFast = failFast;
            return this;
        }

        public StructuringOptions build() {
            return new StructuringOptions(this);
        }
    }
}
