package com.tanumd.core.model;

import java.util.List;
import java.util.Set;

/**
 * Entry names shared by the archive and directory forms of a document.
 */
public final class ArchiveLayout {

    public static final String MANIFEST = "manifest.json";
    public static final String MARKDOWN = "index.md";
    public static final String ATTACHMENTS = "attachments.json";
    public static final String DATABASE = "db/main.sqlite3";

    /** Fixed leading entries, in archive order. */
    public static final List<String> METADATA_ENTRIES = List.of(MANIFEST, MARKDOWN, ATTACHMENTS, DATABASE);

    private static final Set<String> RESERVED = Set.copyOf(METADATA_ENTRIES);

    private ArchiveLayout() {
        // Utility class
    }

    /**
     * Checks whether a normalized logical path collides with a metadata entry.
     *
     * @param logicalPath normalized path
     * @return true if the name is reserved
     */
    public static boolean isReserved(String logicalPath) {
        return RESERVED.contains(logicalPath);
    }
}
