package com.tanumd.core.codec;

import com.tanumd.core.error.TmdFormatException;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Container layout on disk.
 */
public enum Format {
    /** Markdown prefix followed by a ZIP archive whose comment carries the prefix length. */
    TMD("tmd"),
    /** Plain ZIP archive. */
    TMDZ("tmdz");

    private static final byte[] ZIP_LOCAL_HEADER = {'P', 'K', 0x03, 0x04};

    private final String extension;

    Format(String extension) {
        this.extension = extension;
    }

    /**
     * File extension without the dot.
     *
     * @return extension
     */
    public String extension() {
        return extension;
    }

    /**
     * Guesses the format of a complete file.
     *
     * <p>Content that starts with a ZIP local file header is {@link #TMDZ} unless it also ends
     * with a TMD trailer announcing a non-empty Markdown prefix (Markdown that happens to start
     * with {@code PK\3\4}). Any other non-empty content is assumed to start with Markdown and
     * therefore to be {@link #TMD}.
     *
     * @param content file bytes
     * @return detected format, or empty for empty input
     */
    public static Optional<Format> sniff(byte[] content) {
        if (content == null || content.length == 0) {
            return Optional.empty();
        }
        if (startsWithZipHeader(content) && !hasMarkdownPrefix(content)) {
            return Optional.of(TMDZ);
        }
        return Optional.of(TMD);
    }

    private static boolean startsWithZipHeader(byte[] content) {
        return content.length >= ZIP_LOCAL_HEADER.length
            && content[0] == ZIP_LOCAL_HEADER[0]
            && content[1] == ZIP_LOCAL_HEADER[1]
            && content[2] == ZIP_LOCAL_HEADER[2]
            && content[3] == ZIP_LOCAL_HEADER[3];
    }

    private static boolean hasMarkdownPrefix(byte[] content) {
        try {
            return TmdTrailer.split(content).markdownLength() > 0;
        } catch (TmdFormatException e) {
            // No trailer: a plain archive.
            return false;
        }
    }

    /**
     * Resolves the format from a file name extension (case-insensitive).
     *
     * @param fileName file name or path string
     * @return format, or empty for other extensions
     */
    public static Optional<Format> fromFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".tmdz")) {
            return Optional.of(TMDZ);
        }
        if (lower.endsWith(".tmd")) {
            return Optional.of(TMD);
        }
        return Optional.empty();
    }

    /**
     * Resolves the format from a path's file name.
     *
     * @param path file path
     * @return format, or empty for other extensions
     */
    public static Optional<Format> fromPath(Path path) {
        Path fileName = path == null ? null : path.getFileName();
        return fileName == null ? Optional.empty() : fromFileName(fileName.toString());
    }
}
