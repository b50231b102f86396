package com.tanumd.core.codec;

/**
 * Options for encoding a container. Neither flag changes the produced bytes.
 *
 * @param computeHashes recompute each attachment digest before writing and fail if it
 *     disagrees with the stored metadata
 * @param dedupByHash compute the entry checksum once per distinct content
 */
public record WriteMode(boolean computeHashes, boolean dedupByHash) {

    /**
     * Hash-checking writes without deduplication.
     *
     * @return default mode
     */
    public static WriteMode defaults() {
        return new WriteMode(true, false);
    }
}
