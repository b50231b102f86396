package com.tanumd.cli;

import com.tanumd.core.codec.Format;
import com.tanumd.core.codec.TmdCodec;
import com.tanumd.core.config.TmdConfig;
import com.tanumd.core.document.TmdDocument;
import com.tanumd.core.workspace.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Loads and saves documents in any of their three forms: workspace directory, {@code .tmd}
 * and {@code .tmdz}.
 */
public final class DocumentIO {

    private static final Logger log = LoggerFactory.getLogger(DocumentIO.class);

    private DocumentIO() {
        // Utility class
    }

    /**
     * Loads a document from a directory or a container file.
     *
     * @param input workspace directory or container file
     * @param config read and database options
     * @return document, to be closed by the caller
     * @throws IOException if the input is missing or unreadable
     */
    public static TmdDocument load(Path input, TmdConfig config) throws IOException {
        if (Files.isDirectory(input)) {
            log.debug("Loading workspace {}", input);
            return Workspace.read(input, config.database().toDbOptions());
        }
        if (!Files.exists(input)) {
            throw new NoSuchFileException(input.toString());
        }
        return TmdCodec.read(input, null, config.read().toReadMode(), config.database().toDbOptions());
    }

    /**
     * Saves a document. {@code .tmd} and {@code .tmdz} targets become containers; anything
     * else becomes a workspace directory.
     *
     * @param doc document
     * @param output target path
     * @param config write options
     * @throws IOException if writing fails
     */
    public static void save(TmdDocument doc, Path output, TmdConfig config) throws IOException {
        Optional<Format> format = Format.fromPath(output);
        if (format.isPresent()) {
            TmdCodec.write(doc, output, format.get(), config.write().toWriteMode());
        } else {
            Workspace.write(doc, output);
        }
    }

    /**
     * Saves a document as a container, using the configured default layout when the target
     * has no recognized extension.
     *
     * @param doc document
     * @param output target file
     * @param config write options
     * @return layout written
     * @throws IOException if writing fails
     */
    public static Format pack(TmdDocument doc, Path output, TmdConfig config) throws IOException {
        Format format = Format.fromPath(output).orElse(config.write().effectiveFormat());
        TmdCodec.write(doc, output, format, config.write().toWriteMode());
        return format;
    }
}
