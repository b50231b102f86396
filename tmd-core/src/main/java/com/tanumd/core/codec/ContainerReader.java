package com.tanumd.core.codec;

import com.tanumd.core.attachment.AttachmentStore;
import com.tanumd.core.db.DatabaseHandle;
import com.tanumd.core.db.DbOptions;
import com.tanumd.core.document.TmdDocument;
import com.tanumd.core.error.AttachmentException;
import com.tanumd.core.error.AttachmentException.Reason;
import com.tanumd.core.error.TmdFormatException;
import com.tanumd.core.model.ArchiveLayout;
import com.tanumd.core.model.AttachmentIndex;
import com.tanumd.core.model.AttachmentMeta;
import com.tanumd.core.model.Manifest;
import com.tanumd.core.model.Semver;
import com.tanumd.core.util.Digests;
import com.tanumd.core.util.JsonSupport;
import com.tanumd.core.util.LogicalPaths;
import com.tanumd.core.util.Utf8;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.CharacterCodingException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses ZIP bytes into a document.
 *
 * <p>All metadata is validated before any attachment bytes or the database are materialized:
 * required entries must exist exactly once, every non-metadata entry must be a declared
 * attachment, and every declared attachment must have an entry.
 */
final class ContainerReader {

    private static final Logger log = LoggerFactory.getLogger(ContainerReader.class);

    private static final long MAX_ENTRY_SIZE = Integer.MAX_VALUE - 8;

    private final ReadMode mode;
    private final DbOptions dbOptions;

    ContainerReader(ReadMode mode, DbOptions dbOptions) {
        this.mode = mode;
        this.dbOptions = dbOptions;
    }

    /**
     * Decodes an archive.
     *
     * @param archive ZIP bytes, retained for lazy attachment loading
     * @param markdown authoritative Markdown body, or null to use {@code index.md}
     * @return decoded document
     * @throws IOException if the database file cannot be materialized
     */
    TmdDocument readArchive(byte[] archive, String markdown) throws IOException {
        Contents contents;
        try (ZipFile zip = open(archive)) {
            contents = readContents(zip, archive, markdown);
        } catch (IOException e) {
            throw new TmdFormatException("unreadable ZIP archive: " + e.getMessage(), e);
        }
        if (!DatabaseHandle.isSqliteImage(contents.database)) {
            throw new TmdFormatException(ArchiveLayout.DATABASE + " is not a SQLite database");
        }
        DatabaseHandle database = DatabaseHandle.fromBytes(contents.database, dbOptions);
        log.debug("Decoded document {} with {} attachments", contents.manifest.docId(), contents.store.size());
        return TmdDocument.assemble(contents.markdown, contents.manifest, contents.store, database);
    }

    private Contents readContents(ZipFile zip, byte[] archive, String markdownOverride) throws IOException {
        Map<String, ZipArchiveEntry> entries = indexEntries(zip);
        for (String required : ArchiveLayout.METADATA_ENTRIES) {
            if (!entries.containsKey(required)) {
                throw new TmdFormatException("missing required entry `" + required + "`");
            }
        }

        Manifest manifest = parseJson(readEntry(zip, entries.get(ArchiveLayout.MANIFEST)), Manifest.class,
            ArchiveLayout.MANIFEST);
        if (!manifest.tmdVersion().isReadableBy(Semver.CURRENT)) {
            throw new TmdFormatException("unsupported tmd_version " + manifest.tmdVersion()
                + " (this reader supports " + Semver.CURRENT.major() + ".x)");
        }
        String markdown = markdownOverride != null
            ? markdownOverride
            : decodeMarkdown(readEntry(zip, entries.get(ArchiveLayout.MARKDOWN)), ArchiveLayout.MARKDOWN);
        AttachmentIndex index = parseJson(readEntry(zip, entries.get(ArchiveLayout.ATTACHMENTS)),
            AttachmentIndex.class, ArchiveLayout.ATTACHMENTS);

        Map<String, AttachmentMeta> declared = declaredAttachments(index);
        for (String name : entries.keySet()) {
            if (!ArchiveLayout.isReserved(name) && !declared.containsKey(name)) {
                throw new TmdFormatException("ZIP archive contains undeclared entry `" + name + "`");
            }
        }
        for (String path : declared.keySet()) {
            if (!entries.containsKey(path)) {
                throw new TmdFormatException("missing entry for attachment `" + path + "`");
            }
        }
        if (manifest.coverImage() != null && declared.values().stream()
            .noneMatch(meta -> meta.id().equals(manifest.coverImage().id()))) {
            throw new TmdFormatException("cover image " + manifest.coverImage().id()
                + " does not name a declared attachment");
        }

        AttachmentStore store = new AttachmentStore();
        for (AttachmentMeta meta : declared.values()) {
            ZipArchiveEntry entry = entries.get(meta.logicalPath());
            if (mode.defersAttachments() && Digests.isSha256Hex(meta.sha256())) {
                if (entry.getSize() != meta.length()) {
                    throw new AttachmentException(Reason.LENGTH_MISMATCH, String.format(
                        "attachment `%s` length mismatch: manifest=%d actual=%d",
                        meta.logicalPath(), meta.length(), entry.getSize()));
                }
                String name = meta.logicalPath();
                store.insertLazy(meta, () -> loadEntry(archive, name));
            } else {
                store.insertVerified(meta, readEntry(zip, entry), mode.verifyHashes());
            }
        }

        byte[] database = readEntry(zip, entries.get(ArchiveLayout.DATABASE));
        return new Contents(markdown, manifest, store, database);
    }

    private static Map<String, ZipArchiveEntry> indexEntries(ZipFile zip) {
        Map<String, ZipArchiveEntry> entries = new LinkedHashMap<>();
        for (ZipArchiveEntry entry : Collections.list(zip.getEntries())) {
            if (entry.isDirectory()) {
                continue;
            }
            if (entries.put(entry.getName(), entry) != null) {
                throw new TmdFormatException("ZIP archive contains duplicate entry `" + entry.getName() + "`");
            }
        }
        return entries;
    }

    private static Map<String, AttachmentMeta> declaredAttachments(AttachmentIndex index) {
        Map<String, AttachmentMeta> declared = new LinkedHashMap<>();
        for (AttachmentMeta meta : index.attachments()) {
            String normalized;
            try {
                normalized = LogicalPaths.normalize(meta.logicalPath());
            } catch (AttachmentException e) {
                throw new TmdFormatException("invalid attachment path `" + meta.logicalPath() + "`", e);
            }
            if (!normalized.equals(meta.logicalPath())) {
                throw new TmdFormatException("attachment path `" + meta.logicalPath() + "` is not normalized");
            }
            if (ArchiveLayout.isReserved(normalized)) {
                throw new TmdFormatException("attachment `" + normalized + "` collides with a reserved entry");
            }
            if (declared.put(normalized, meta) != null) {
                throw new TmdFormatException("attachment `" + normalized + "` is declared twice");
            }
        }
        return declared;
    }

    private static byte[] loadEntry(byte[] archive, String name) throws IOException {
        try (ZipFile zip = open(archive)) {
            ZipArchiveEntry entry = zip.getEntry(name);
            if (entry == null) {
                throw new IOException("entry `" + name + "` disappeared from the archive");
            }
            return readEntry(zip, entry);
        }
    }

    private static byte[] readEntry(ZipFile zip, ZipArchiveEntry entry) throws IOException {
        long size = entry.getSize();
        if (size < 0 || size > MAX_ENTRY_SIZE) {
            throw new TmdFormatException("entry `" + entry.getName() + "` has unsupported size " + size);
        }
        try (InputStream in = zip.getInputStream(entry)) {
            byte[] data = in.readNBytes((int) size);
            if (data.length != size || in.read() != -1) {
                throw new TmdFormatException("entry `" + entry.getName() + "` does not match its declared size " + size);
            }
            return data;
        }
    }

    private static ZipFile open(byte[] archive) throws IOException {
        return ZipFile.builder()
            .setSeekableByteChannel(new SeekableInMemoryByteChannel(archive))
            .get();
    }

    private static <T> T parseJson(byte[] json, Class<T> type, String entryName) {
        try {
            T value = JsonSupport.mapper().readValue(json, type);
            if (value == null) {
                throw new TmdFormatException(entryName + " must contain a JSON object");
            }
            return value;
        } catch (IOException e) {
            throw new TmdFormatException("failed to parse " + entryName + ": " + e.getMessage(), e);
        }
    }

    static String decodeMarkdown(byte[] bytes, String source) {
        try {
            return Utf8.decodeStrict(bytes);
        } catch (CharacterCodingException e) {
            throw new TmdFormatException(source + " is not valid UTF-8", e);
        }
    }

    private record Contents(String markdown, Manifest manifest, AttachmentStore store, byte[] database) {
    }
}
