package com.character.roster.loader;

/**
 * Options for {@link EntityLoader}.
 */
public class LoaderOptions {

    private static final int DEFAULT_PROGRESS_INTERVAL = 100;

    private final boolean escalateDanglingReferences;
    private final int progressInterval;

    private LoaderOptions(Builder builder) {
        this.escalateDanglingReferences = builder.escalateDanglingReferences;
        this.progressInterval = builder.progressInterval;
    }

    /**
     * When true, relationship ids that resolve to nothing are reported as errors
     * as well as warnings.
     */
    public boolean isEscalateDanglingReferences() {
        return escalateDanglingReferences;
    }

    /**
     * Number of parsed records between progress callbacks.
     */
    public int getProgressInterval() {
        return progressInterval;
    }

    /**
     * Creates default options.
     */
    public static LoaderOptions defaults() {
        return builder().build();
    }

    /**
     * Creates options that treat every dangling relationship id as an error.
     */
    public static LoaderOptions strictReferences() {
        return builder().escalateDanglingReferences(true).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean escalateDanglingReferences = false;
        private int progressInterval = DEFAULT_PROGRESS_INTERVAL;

        public Builder escalateDanglingReferences(boolean escalateDanglingReferences) {
            this.escalateDanglingReferences = escalateDanglingReferences;
            return this;
        }

        public Builder progressInterval(int progressInterval) {
            if (progressInterval < 1) {
                throw new IllegalArgumentException("progressInterval must be at least 1, got " + progressInterval);
            }
            this.progressInterval = progressInterval;
            return this;
        }

        public LoaderOptions build() {
            return new LoaderOptions(this);
        }
    }

    @Override
    public String toString() {
        return "LoaderOptions{" +
                "escalateDanglingReferences=" + escalateDanglingReferences +
                ", progressInterval=" + progressInterval +
                '}';
    }
}
