package com.tanumd.core.error;

/**
 * Structural error in a {@code .tmd} or {@code .tmdz} container: missing required entry,
 * bad trailer signature or length, out-of-bounds offset, undeclared archive entry, or
 * unparseable metadata.
 */
public class TmdFormatException extends TmdException {

    public TmdFormatException(String message) {
        super("invalid format: " + message);
    }

    public TmdFormatException(String message, Throwable cause) {
        super("invalid format: " + message, cause);
    }
}
