package com.character.roster.loader;

/**
 * Callback interface for tracking progress of a load run.
 *
 * <p>{@link EntityLoader} calls it while parsing, every {@link LoaderOptions#getProgressInterval()}
 * records, and once more after linking with {@code processed == total} and the message
 * {@code "Load completed"}. Registration and linking do not report intermediate progress.</p>
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * Called to report progress.
     *
     * @param processed the number of raw records parsed so far, including rejected ones
     * @param total     the number of raw records in the batch
     * @param message   progress message
     */
    void onProgress(long processed, long total, String message);

    /**
     * A no-op progress callback.
     */
    ProgressCallback NOOP = (processed, total, message) -> {};
}
