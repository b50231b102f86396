package com.tanumd.core.error;

import java.util.Objects;

/**
 * Attachment store failure.
 *
 * <p>The {@link Reason} lets callers distinguish corruption ({@code LENGTH_MISMATCH},
 * {@code DIGEST_MISMATCH}) from plain usage errors without parsing the message.
 */
public class AttachmentException extends TmdException {

    /**
     * Which attachment invariant failed.
     */
    public enum Reason {
        DUPLICATE_ID,
        DUPLICATE_PATH,
        NOT_FOUND,
        LENGTH_MISMATCH,
        DIGEST_MISMATCH,
        INVALID_PATH
    }

    private final Reason reason;

    public AttachmentException(Reason reason, String message) {
        super("attachment error: " + message);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public AttachmentException(Reason reason, String message, Throwable cause) {
        super("attachment error: " + message, cause);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    /**
     * Returns the failed invariant.
     *
     * @return failure reason
     */
    public Reason reason() {
        return reason;
    }
}
