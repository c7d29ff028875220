package com.character.roster.loader;

/**
 * Decides whether a {@link LoadResult} is good enough for the caller to proceed.
 * The loader itself never applies a policy; it always returns what it found.
 */
public enum LoadPolicy {
    /**
     * Accepts every result.
     */
    LENIENT {
        @Override
        public boolean accepts(LoadResult result) {
            return true;
        }
    },

    /**
     * Accepts a result unless characters were registered without a player among them.
     */
    REQUIRE_PLAYER {
        @Override
        public boolean accepts(LoadResult result) {
            return result.registry().isEmpty() || result.hasPlayer();
        }
    },

    /**
     * Accepts only a result without errors.
     */
    STRICT {
        @Override
        public boolean accepts(LoadResult result) {
            return !result.hasErrors();
        }
    };

    public abstract boolean accepts(LoadResult result);
}
