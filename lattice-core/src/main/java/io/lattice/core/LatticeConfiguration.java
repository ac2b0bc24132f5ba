package io.lattice.core;

/**
 * Immutable configuration for an object registry.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * LatticeConfiguration config = LatticeConfiguration.builder()
 *     .initialCapacity(4096)
 *     .fairLocking(true)
 *     .build();
 * </pre>
 *
 * @see SharedObjectRegistry
 */
public final class LatticeConfiguration {

    private static final LatticeConfiguration DEFAULTS = builder().build();

    // Arena sizing
    private final int initialCapacity;

    // Lock policy of the shared registry
    private final boolean fairLocking;

    // Diagnostics
    private final int treeDumpIndent;

    private LatticeConfiguration(Builder builder) {
        this.initialCapacity = builder.initialCapacity;
        this.fairLocking = builder.fairLocking;
        this.treeDumpIndent = builder.treeDumpIndent;
    }

    /**
     * Create a new builder for LatticeConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static LatticeConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Get the number of arena slots allocated up front.
     *
     * @return initial slot capacity
     */
    public int initialCapacity() {
        return initialCapacity;
    }

    /**
     * Check if the shared registry's reader/writer lock uses a fair ordering policy.
     *
     * @return true if fair locking is enabled (default: false)
     */
    public boolean fairLocking() {
        return fairLocking;
    }

    /**
     * Get the number of spaces per depth level in tree dumps.
     *
     * @return indent width
     */
    public int treeDumpIndent() {
        return treeDumpIndent;
    }

    @Override
    public String toString() {
        return "LatticeConfiguration{initialCapacity=" + initialCapacity
                + ", fairLocking=" + fairLocking
                + ", treeDumpIndent=" + treeDumpIndent + "}";
    }

    /**
     * Builder for LatticeConfiguration.
     */
    public static class Builder {
        private int initialCapacity = 64;
        private boolean fairLocking = false;
        private int treeDumpIndent = 2;

        private Builder() {
        }

        /**
         * Set the number of arena slots allocated up front.
         *
         * @param initialCapacity slot count, must be positive
         * @return this builder for method chaining
         */
        public Builder initialCapacity(int initialCapacity) {
            this.initialCapacity = initialCapacity;
            return this;
        }

        public Builder fairLocking(boolean fairLocking) {
            this.fairLocking = fairLocking;
            return this;
        }

        /**
         * Set the indent width used by tree dumps.
         *
         * @param treeDumpIndent spaces per level, must not be negative
         * @return this builder for method chaining
         */
        public Builder treeDumpIndent(int treeDumpIndent) {
            this.treeDumpIndent = treeDumpIndent;
            return this;
        }

        /**
         * Build the immutable LatticeConfiguration.
         *
         * @return a new LatticeConfiguration instance
         */
        public LatticeConfiguration build() {
            if (initialCapacity <= 0) {
                throw new IllegalArgumentException("initialCapacity must be positive: " + initialCapacity);
            }
            if (treeDumpIndent < 0) {
                throw new IllegalArgumentException("treeDumpIndent must not be negative: " + treeDumpIndent);
            }
            return new LatticeConfiguration(this);
        }
    }
}
