package com.tanumd.core.codec;

/**
 * Options for decoding a container.
 *
 * @param verifyHashes recompute every attachment digest while reading and fail on a mismatch
 * @param lazyAttachments keep the archive image and load attachment bytes on first access;
 *     only takes effect when {@code verifyHashes} is off, in which case each digest is
 *     checked when its bytes are first loaded
 */
public record ReadMode(boolean verifyHashes, boolean lazyAttachments) {

    /**
     * Verifying, eager reads.
     *
     * @return default mode
     */
    public static ReadMode defaults() {
        return new ReadMode(true, false);
    }

    /**
     * Whether attachment bytes are deferred.
     *
     * @return true for lazy reads
     */
    public boolean defersAttachments() {
        return lazyAttachments && !verifyHashes;
    }
}
