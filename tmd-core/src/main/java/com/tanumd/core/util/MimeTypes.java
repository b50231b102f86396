package com.tanumd.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Media type guessing for files added to a document.
 */
public final class MimeTypes {

    private static final Logger log = LoggerFactory.getLogger(MimeTypes.class);

    public static final String OCTET_STREAM = "application/octet-stream";

    private static final Map<String, String> BY_EXTENSION = Map.ofEntries(
        Map.entry("png", "image/png"),
        Map.entry("jpg", "image/jpeg"),
        Map.entry("jpeg", "image/jpeg"),
        Map.entry("gif", "image/gif"),
        Map.entry("webp", "image/webp"),
        Map.entry("svg", "image/svg+xml"),
        Map.entry("pdf", "application/pdf"),
        Map.entry("json", "application/json"),
        Map.entry("csv", "text/csv"),
        Map.entry("txt", "text/plain"),
        Map.entry("md", "text/markdown"),
        Map.entry("html", "text/html"),
        Map.entry("sqlite", "application/vnd.sqlite3"),
        Map.entry("sqlite3", "application/vnd.sqlite3"),
        Map.entry("zip", "application/zip")
    );

    private MimeTypes() {
        // Utility class
    }

    /**
     * Guesses a media type by extension alone.
     *
     * @param fileName file name or logical path
     * @return media type, {@link #OCTET_STREAM} if unknown
     */
    public static String fromName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        if (dot <= slash + 1 || dot == fileName.length() - 1) {
            return OCTET_STREAM;
        }
        String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        return BY_EXTENSION.getOrDefault(extension, OCTET_STREAM);
    }

    /**
     * Guesses a media type for a file from the extension table, asking the platform for
     * extensions the table does not know.
     *
     * @param file file on disk
     * @return media type, {@link #OCTET_STREAM} if unknown
     */
    public static String probe(Path file) {
        Path name = file.getFileName();
        String known = name == null ? OCTET_STREAM : fromName(name.toString());
        if (!OCTET_STREAM.equals(known)) {
            return known;
        }
        try {
            String probed = Files.probeContentType(file);
            return probed == null || probed.isBlank() ? OCTET_STREAM : probed;
        } catch (IOException e) {
            log.debug("Content type probe failed for {}: {}", file, e.getMessage());
            return OCTET_STREAM;
        }
    }
}
