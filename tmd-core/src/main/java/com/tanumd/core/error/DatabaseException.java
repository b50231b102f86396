package com.tanumd.core.error;

import java.util.Objects;

/**
 * Embedded database failure: connection or statement error, migration version mismatch,
 * or a byte image that is not a SQLite database.
 */
public class DatabaseException extends TmdException {

    /**
     * Kind of database failure.
     */
    public enum Reason {
        /** JDBC connection or statement failure. */
        SQL,
        /** Migration requested from a version other than the stored one. */
        VERSION_MISMATCH,
        /** Byte image lacks the SQLite header. */
        INVALID_DATABASE
    }

    private final Reason reason;

    public DatabaseException(Reason reason, String message) {
        super("sqlite: " + message);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public DatabaseException(Reason reason, String message, Throwable cause) {
        super("sqlite: " + message, cause);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public Reason reason() {
        return reason;
    }
}
