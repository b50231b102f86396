package com.tanumd.core.error;

/**
 * Base type for every failure raised by the TMD core.
 *
 * <p>I/O problems are reported as {@link java.io.IOException} and are not part of this
 * hierarchy. Everything else (broken container structure, attachment integrity, database
 * lifecycle) is unchecked and carries a message naming the invariant that failed.
 *
 * @see TmdFormatException
 * @see AttachmentException
 * @see DatabaseException
 */
public abstract class TmdException extends RuntimeException {

    protected TmdException(String message) {
        super(message);
    }

    protected TmdException(String message, Throwable cause) {
        super(message, cause);
    }
}
