package com.tanumd.core.workspace;

import com.tanumd.core.attachment.AttachmentStore;
import com.tanumd.core.db.DatabaseHandle;
import com.tanumd.core.db.DbOptions;
import com.tanumd.core.document.TmdDocument;
import com.tanumd.core.error.TmdFormatException;
import com.tanumd.core.model.ArchiveLayout;
import com.tanumd.core.model.AttachmentIndex;
import com.tanumd.core.model.AttachmentMeta;
import com.tanumd.core.model.Manifest;
import com.tanumd.core.util.JsonSupport;
import com.tanumd.core.util.MimeTypes;
import com.tanumd.core.util.Timestamps;
import com.tanumd.core.util.Utf8;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Directory form of a document, used for editing with ordinary tools.
 *
 * <p>Layout:
 * <pre>
 * index.md              Markdown body
 * manifest.json         manifest
 * attachments.json      attachment metadata (optional)
 * db/main.sqlite3       embedded database (optional)
 * images/logo.png       attachments at their logical paths
 * </pre>
 *
 * <p>Files in a workspace are expected to change between reads, so attachment length and
 * digest are always recomputed from the files. Without {@code attachments.json} every other
 * regular file (dot-files excepted) becomes an attachment with a guessed media type.
 */
public final class Workspace {

    private static final Logger log = LoggerFactory.getLogger(Workspace.class);

    private Workspace() {
        // Utility class
    }

    /**
     * Creates a new workspace directory with a starter document.
     *
     * @param directory directory to create; must not exist
     * @param title document title, or null for a default
     * @throws IOException if the directory exists or cannot be written
     */
    public static void scaffold(Path directory, String title) throws IOException {
        if (Files.exists(directory)) {
            throw new FileAlreadyExistsException(directory.toString(), null, "target directory already exists");
        }
        String effectiveTitle = title == null || title.isBlank() ? "New TMD Document" : title;
        Files.createDirectories(directory.resolve("images"));
        Files.createDirectories(directory.resolve("data"));

        String markdown = "# " + effectiveTitle + "\n\nWelcome to **Tanu Markdown**!\n\n"
            + "Start editing `index.md` to add your content.\n";
        Files.writeString(directory.resolve(ArchiveLayout.MARKDOWN), markdown);

        Manifest manifest = Manifest.create(UUID.randomUUID(), Timestamps.nowUtc())
            .toBuilder()
            .title(effectiveTitle)
            .build();
        Files.write(directory.resolve(ArchiveLayout.MANIFEST), JsonSupport.mapper().writeValueAsBytes(manifest));
        log.info("Initialized new workspace at {}", directory);
    }

    /**
     * Writes a document as a directory. Existing files with the same names are replaced.
     *
     * @param doc document
     * @param directory target directory, created if needed
     * @throws IOException if writing fails
     */
    public static void write(TmdDocument doc, Path directory) throws IOException {
        if (doc.isEditingAttachments()) {
            throw new IllegalStateException("cannot write while an attachment edit is in progress");
        }
        Path root = directory.toAbsolutePath().normalize();
        Files.createDirectories(root);

        Files.writeString(root.resolve(ArchiveLayout.MARKDOWN), doc.markdown(), StandardCharsets.UTF_8);
        Files.write(root.resolve(ArchiveLayout.MANIFEST), JsonSupport.mapper().writeValueAsBytes(doc.manifest()));
        List<AttachmentMeta> attachments = doc.attachments();
        Files.write(root.resolve(ArchiveLayout.ATTACHMENTS),
            JsonSupport.mapper().writeValueAsBytes(new AttachmentIndex(attachments)));
        Path database = resolveInside(root, ArchiveLayout.DATABASE);
        Files.createDirectories(database.getParent());
        Files.write(database, doc.databaseBytes());

        for (AttachmentMeta meta : attachments) {
            Path target = resolveInside(root, meta.logicalPath());
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            ByteBuffer data = doc.attachmentData(meta.id()).orElseThrow();
            byte[] bytes = new byte[data.remaining()];
            data.get(bytes);
            Files.write(target, bytes);
            log.debug("Wrote attachment {} ({} bytes)", meta.logicalPath(), bytes.length);
        }
        log.info("Wrote workspace {} with {} attachments", root, attachments.size());
    }

    /**
     * Reads a workspace directory with default database settings.
     *
     * @param directory workspace directory
     * @return document
     * @throws IOException if reading fails
     */
    public static TmdDocument read(Path directory) throws IOException {
        return read(directory, DbOptions.defaults());
    }

    /**
     * Reads a workspace directory.
     *
     * @param directory workspace directory
     * @param dbOptions settings for the database
     * @return document
     * @throws IOException if a required file is missing or unreadable
     * @throws TmdFormatException if metadata cannot be parsed or a path escapes the directory
     */
    public static TmdDocument read(Path directory, DbOptions dbOptions) throws IOException {
        Path root = directory.toAbsolutePath().normalize();
        String markdown = decode(Files.readAllBytes(root.resolve(ArchiveLayout.MARKDOWN)));
        Manifest manifest = parseJson(root.resolve(ArchiveLayout.MANIFEST), Manifest.class);

        AttachmentStore store = new AttachmentStore();
        Path indexFile = root.resolve(ArchiveLayout.ATTACHMENTS);
        if (Files.isRegularFile(indexFile)) {
            AttachmentIndex index = parseJson(indexFile, AttachmentIndex.class);
            for (AttachmentMeta meta : index.attachments()) {
                rejectReserved(meta.logicalPath());
                byte[] bytes = Files.readAllBytes(resolveInside(root, meta.logicalPath()));
                store.insertVerified(meta.withContent(bytes.length, null), bytes, false);
            }
        } else {
            for (Path file : discover(root)) {
                String logicalPath = root.relativize(file).toString().replace('\\', '/');
                store.insert(UUID.randomUUID(), logicalPath, MimeTypes.probe(file), Files.readAllBytes(file));
            }
        }

        if (manifest.coverImage() != null && store.lookupById(manifest.coverImage().id()).isEmpty()) {
            log.warn("Cover image {} is not among the attachments in {}; clearing it",
                manifest.coverImage().id(), root);
            manifest = manifest.toBuilder().coverImage(null).build();
        }

        Path databaseFile = root.resolve(ArchiveLayout.DATABASE);
        DatabaseHandle database = Files.isRegularFile(databaseFile)
            ? DatabaseHandle.fromBytes(Files.readAllBytes(databaseFile), dbOptions)
            : DatabaseHandle.newEmpty(dbOptions);
        log.debug("Read workspace {} with {} attachments", root, store.size());
        return TmdDocument.assemble(markdown, manifest, store, database);
    }

    private static List<Path> discover(Path root) throws IOException {
        List<Path> files = new ArrayList<>();
        try (Stream<Path> paths = Files.walk(root)) {
            paths.filter(Files::isRegularFile)
                .filter(path -> !isHidden(root.relativize(path)))
                .filter(path -> !ArchiveLayout.isReserved(root.relativize(path).toString().replace('\\', '/')))
                .sorted()
                .forEach(files::add);
        }
        return files;
    }

    private static boolean isHidden(Path relative) {
        for (Path part : relative) {
            if (part.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }

    private static Path resolveInside(Path root, String logicalPath) {
        Path resolved = root.resolve(logicalPath).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new TmdFormatException("path `" + logicalPath + "` escapes the workspace directory");
        }
        return resolved;
    }

    private static void rejectReserved(String logicalPath) {
        if (ArchiveLayout.isReserved(logicalPath)) {
            throw new TmdFormatException("attachment `" + logicalPath + "` collides with a reserved entry");
        }
    }

    private static <T> T parseJson(Path file, Class<T> type) throws IOException {
        byte[] json = Files.readAllBytes(file);
        try {
            return JsonSupport.mapper().readValue(json, type);
        } catch (IOException e) {
            throw new TmdFormatException("failed to parse " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private static String decode(byte[] bytes) {
        try {
            return Utf8.decodeStrict(bytes);
        } catch (CharacterCodingException e) {
            throw new TmdFormatException(ArchiveLayout.MARKDOWN + " is not valid UTF-8", e);
        }
    }
}
