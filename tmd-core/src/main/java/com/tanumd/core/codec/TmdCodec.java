package com.tanumd.core.codec;

import com.tanumd.core.db.DbOptions;
import com.tanumd.core.document.TmdDocument;
import com.tanumd.core.error.TmdFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Reads and writes documents as {@code .tmd} and {@code .tmdz} containers.
 *
 * <p>Writing serializes the whole document. Output is deterministic: the same document
 * content always encodes to the same bytes. Writes to a path go through a sibling temporary
 * file that replaces the destination only after it is complete.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TmdCodec.write(doc, Path.of("notes.tmdz"));
 *
 * try (TmdDocument copy = TmdCodec.read(Path.of("notes.tmdz"))) {
 *     System.out.println(copy.markdown());
 * }
 * }</pre>
 */
public final class TmdCodec {

    private static final Logger log = LoggerFactory.getLogger(TmdCodec.class);

    private TmdCodec() {
        // Utility class
    }

    /**
     * Encodes with default write options.
     *
     * @param doc document
     * @param format target layout
     * @return container bytes
     * @throws IOException if the database cannot be read
     */
    public static byte[] encode(TmdDocument doc, Format format) throws IOException {
        return encode(doc, format, WriteMode.defaults());
    }

    /**
     * Encodes a document.
     *
     * @param doc document
     * @param format target layout
     * @param mode write options
     * @return container bytes
     * @throws IOException if the database cannot be read
     * @throws IllegalStateException if an attachment edit is still open
     */
    public static byte[] encode(TmdDocument doc, Format format, WriteMode mode) throws IOException {
        Objects.requireNonNull(doc, "doc must not be null");
        Objects.requireNonNull(format, "format must not be null");
        byte[] archive = new ContainerWriter(mode == null ? WriteMode.defaults() : mode).writeArchive(doc);
        if (format == Format.TMDZ) {
            return archive;
        }
        byte[] markdown = doc.markdown().getBytes(StandardCharsets.UTF_8);
        byte[] joined = TmdTrailer.join(markdown, archive);
        log.debug("Framed {} markdown bytes in front of a {} byte archive", markdown.length, archive.length);
        return joined;
    }

    public static void write(TmdDocument doc, OutputStream out, Format format, WriteMode mode) throws IOException {
        out.write(encode(doc, format, mode));
        out.flush();
    }

    /**
     * Writes to a path, choosing the layout from its extension.
     *
     * @param doc document
     * @param target {@code .tmd} or {@code .tmdz} file
     * @throws IOException if writing fails
     * @throws IllegalArgumentException if the extension is not recognized
     */
    public static void write(TmdDocument doc, Path target) throws IOException {
        Format format = Format.fromPath(target)
            .orElseThrow(() -> new IllegalArgumentException("cannot infer container format from " + target));
        write(doc, target, format, WriteMode.defaults());
    }

    public static void write(TmdDocument doc, Path target, Format format) throws IOException {
        write(doc, target, format, WriteMode.defaults());
    }

    /**
     * Writes atomically: the destination is replaced only by a complete container.
     *
     * @param doc document
     * @param target destination file
     * @param format layout
     * @param mode write options
     * @throws IOException if writing fails; the destination is then unchanged
     */
    public static void write(TmdDocument doc, Path target, Format format, WriteMode mode) throws IOException {
        byte[] bytes = encode(doc, format, mode);
        Path absolute = target.toAbsolutePath();
        Path parent = absolute.getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, "." + absolute.getFileName(), ".tmp");
        try {
            Files.write(temp, bytes);
            try {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        log.info("Wrote {} ({} bytes, {})", absolute, bytes.length, format);
    }

    /**
     * Decodes with default read options, sniffing the layout.
     *
     * @param bytes container bytes
     * @return document
     * @throws IOException if the database file cannot be materialized
     */
    public static TmdDocument decode(byte[] bytes) throws IOException {
        return decode(bytes, null, ReadMode.defaults(), DbOptions.defaults());
    }

    public static TmdDocument decode(byte[] bytes, Format format, ReadMode mode) throws IOException {
        return decode(bytes, format, mode, DbOptions.defaults());
    }

    /**
     * Decodes a container.
     *
     * @param bytes container bytes
     * @param format layout, or null to sniff it from the leading bytes
     * @param mode read options
     * @param dbOptions settings for the materialized database
     * @return document
     * @throws IOException if the database file cannot be materialized
     * @throws TmdFormatException if the container is malformed
     */
    public static TmdDocument decode(byte[] bytes, Format format, ReadMode mode, DbOptions dbOptions)
        throws IOException {
        Objects.requireNonNull(bytes, "bytes must not be null");
        Format resolved = format != null
            ? format
            : Format.sniff(bytes).orElseThrow(() -> new TmdFormatException("empty input"));
        ContainerReader reader = new ContainerReader(mode == null ? ReadMode.defaults() : mode, dbOptions);
        if (resolved == Format.TMDZ) {
            return reader.readArchive(bytes, null);
        }
        TmdTrailer.Split split = TmdTrailer.split(bytes);
        String markdown = ContainerReader.decodeMarkdown(split.markdown(bytes), "markdown section");
        log.debug("Located {} byte markdown prefix, EOCD at {}", split.markdownLength(), split.eocdOffset());
        return reader.readArchive(split.archive(bytes), markdown);
    }

    public static TmdDocument read(InputStream in, Format format, ReadMode mode) throws IOException {
        return decode(in.readAllBytes(), format, mode, DbOptions.defaults());
    }

    /**
     * Reads a file, choosing the layout from its extension or, failing that, its content.
     *
     * @param source container file
     * @return document
     * @throws IOException if reading fails
     */
    public static TmdDocument read(Path source) throws IOException {
        return read(source, null, ReadMode.defaults(), DbOptions.defaults());
    }

    public static TmdDocument read(Path source, Format format) throws IOException {
        return read(source, format, ReadMode.defaults(), DbOptions.defaults());
    }

    /**
     * Reads a file.
     *
     * @param source container file
     * @param format layout, or null to use the extension and then the content
     * @param mode read options
     * @param dbOptions settings for the materialized database
     * @return document
     * @throws IOException if reading fails
     */
    public static TmdDocument read(Path source, Format format, ReadMode mode, DbOptions dbOptions)
        throws IOException {
        byte[] bytes = Files.readAllBytes(source);
        Format resolved = format != null ? format : Format.fromPath(source).orElse(null);
        log.debug("Reading {} ({} bytes)", source, bytes.length);
        return decode(bytes, resolved, mode, dbOptions);
    }
}
