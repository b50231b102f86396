package com.tanumd.core.attachment;

import java.io.IOException;

/**
 * Deferred source of attachment bytes, used when a container is read lazily.
 */
@FunctionalInterface
public interface ByteLoader {

    /**
     * Loads the full attachment content.
     *
     * @return attachment bytes
     * @throws IOException if the backing source cannot be read
     */
    byte[] load() throws IOException;
}
