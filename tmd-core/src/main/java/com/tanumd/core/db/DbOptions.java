package com.tanumd.core.db;

import java.util.Locale;
import java.util.Set;

/**
 * SQLite settings applied when a document database is initialized.
 *
 * @param pageSize page size in bytes (power of two between 512 and 65536), or null for the default
 * @param journalMode journal mode (e.g., "DELETE", "TRUNCATE", "MEMORY"), or null for the default
 * @param synchronous synchronous level ("OFF", "NORMAL", "FULL", "EXTRA"), or null for the default
 */
public record DbOptions(
    Integer pageSize,
    String journalMode,
    String synchronous
) {
    private static final Set<String> JOURNAL_MODES =
        Set.of("DELETE", "TRUNCATE", "PERSIST", "MEMORY", "WAL", "OFF");
    private static final Set<String> SYNCHRONOUS_LEVELS = Set.of("OFF", "NORMAL", "FULL", "EXTRA");

    /**
     * Compact constructor with validation.
     */
    public DbOptions {
        if (pageSize != null && (pageSize < 512 || pageSize > 65536 || Integer.bitCount(pageSize) != 1)) {
            throw new IllegalArgumentException("pageSize must be a power of two between 512 and 65536: " + pageSize);
        }
        if (journalMode != null) {
            journalMode = journalMode.toUpperCase(Locale.ROOT);
            if (!JOURNAL_MODES.contains(journalMode)) {
                throw new IllegalArgumentException("unsupported journal mode: " + journalMode);
            }
        }
        if (synchronous != null) {
            synchronous = synchronous.toUpperCase(Locale.ROOT);
            if (!SYNCHRONOUS_LEVELS.contains(synchronous)) {
                throw new IllegalArgumentException("unsupported synchronous level: " + synchronous);
            }
        }
    }

    /**
     * Returns options that leave every SQLite default untouched.
     *
     * @return default options
     */
    public static DbOptions defaults() {
        return new DbOptions(null, null, null);
    }
}
