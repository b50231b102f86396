package com.tanumd.core.attachment;

import com.tanumd.core.error.AttachmentException;
import com.tanumd.core.error.AttachmentException.Reason;
import com.tanumd.core.model.AttachmentMeta;
import com.tanumd.core.util.Digests;
import com.tanumd.core.util.LogicalPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory table of attachment blobs for one document.
 *
 * <p>Entries are keyed by id, with a unique secondary index by logical path. Both tables are
 * updated together by every operation, so a path always resolves to an existing id and every
 * id has exactly one path.
 *
 * <p>Length and digest are always derived from the stored bytes. The only way to change the
 * bytes after insertion is {@link #mutateBytes(UUID)}, whose handle recomputes both on close.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AttachmentStore store = new AttachmentStore();
 * UUID id = store.insert(UUID.randomUUID(), "images/pixel.png", "image/png", bytes);
 *
 * try (AttachmentBytes data = store.mutateBytes(id)) {
 *     data.append(moreBytes);
 * }
 * // length and sha256 now describe the appended content
 * }</pre>
 *
 * <p>Not thread-safe.
 */
public final class AttachmentStore {

    private static final Logger log = LoggerFactory.getLogger(AttachmentStore.class);

    private final Map<UUID, Entry> entries = new HashMap<>();
    private final Map<String, UUID> byPath = new HashMap<>();

    /**
     * Inserts new bytes, computing length and digest.
     *
     * @param id new attachment id
     * @param logicalPath logical path (normalized before use)
     * @param mediaType declared media type
     * @param bytes content, copied into the store
     * @return {@code id}
     * @throws AttachmentException if the id or normalized path already exist, or the path is invalid
     */
    public UUID insert(UUID id, String logicalPath, String mediaType, byte[] bytes) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(bytes, "bytes must not be null");
        String path = LogicalPaths.normalize(logicalPath);
        checkAvailable(id, path);

        byte[] data = bytes.clone();
        AttachmentMeta meta = AttachmentMeta.of(id, path, mediaType, data.length, Digests.sha256Hex(data));
        put(new Entry(meta, data, null));
        log.debug("Inserted attachment {} at {} ({} bytes)", id, path, data.length);
        return id;
    }

    /**
     * Inserts an entry decoded from a container.
     *
     * <p>Length is always checked. With {@code verify} the digest is recomputed and compared to
     * the declared one; without it the digest is still recomputed (the stored metadata always
     * describes the stored bytes) and a disagreement is only logged.
     *
     * @param meta declared metadata
     * @param bytes decoded content, owned by the store afterwards
     * @param verify whether a digest mismatch is an error
     * @throws AttachmentException on length or (when verifying) digest mismatch, or duplicates
     */
    public void insertVerified(AttachmentMeta meta, byte[] bytes, boolean verify) {
        Objects.requireNonNull(meta, "meta must not be null");
        Objects.requireNonNull(bytes, "bytes must not be null");
        String path = LogicalPaths.normalize(meta.logicalPath());
        checkAvailable(meta.id(), path);
        checkLength(meta, bytes.length);

        String actual = Digests.sha256Hex(bytes);
        if (meta.sha256() != null && !meta.sha256().equalsIgnoreCase(actual)) {
            if (verify) {
                throw digestMismatch(meta, actual);
            }
            log.warn("Attachment `{}` declares sha256 {} but content hashes to {}; keeping computed digest",
                path, meta.sha256(), actual);
        }
        put(new Entry(meta.withLogicalPath(path).withContent(bytes.length, actual), bytes, null));
    }

    /**
     * Inserts an entry whose bytes are loaded on first access.
     *
     * <p>The declared digest is required and is checked when the bytes are materialized; a
     * mismatch fails that access and the bytes are never handed out.
     *
     * @param meta declared metadata, including length and digest
     * @param loader deferred byte source
     * @throws AttachmentException on duplicates or a missing/invalid declared digest
     */
    public void insertLazy(AttachmentMeta meta, ByteLoader loader) {
        Objects.requireNonNull(meta, "meta must not be null");
        Objects.requireNonNull(loader, "loader must not be null");
        String path = LogicalPaths.normalize(meta.logicalPath());
        checkAvailable(meta.id(), path);
        if (!Digests.isSha256Hex(meta.sha256())) {
            throw new AttachmentException(Reason.DIGEST_MISMATCH,
                "attachment `" + path + "` has no valid declared sha256 for lazy loading");
        }
        AttachmentMeta normalized = meta.withLogicalPath(path)
            .withContent(meta.length(), meta.sha256().toLowerCase());
        put(new Entry(normalized, null, loader));
    }

    /**
     * Removes an attachment.
     *
     * @param id attachment id
     * @return metadata of the removed attachment
     * @throws AttachmentException if absent
     */
    public AttachmentMeta remove(UUID id) {
        Entry entry = require(id);
        checkNotEditing(entry);
        entries.remove(id);
        byPath.remove(entry.meta.logicalPath());
        log.debug("Removed attachment {} at {}", id, entry.meta.logicalPath());
        return entry.meta;
    }

    /**
     * Moves an attachment to a new logical path.
     *
     * @param id attachment id
     * @param newPath new logical path (normalized before use)
     * @return updated metadata
     * @throws AttachmentException if the id is absent, the path is invalid, or another
     *     attachment already uses it
     */
    public AttachmentMeta rename(UUID id, String newPath) {
        Entry entry = require(id);
        checkNotEditing(entry);
        String path = LogicalPaths.normalize(newPath);
        String oldPath = entry.meta.logicalPath();
        if (path.equals(oldPath)) {
            return entry.meta;
        }
        UUID holder = byPath.get(path);
        if (holder != null) {
            throw new AttachmentException(Reason.DUPLICATE_PATH, "attachment `" + path + "` already exists");
        }
        byPath.remove(oldPath);
        byPath.put(path, id);
        entry.meta = entry.meta.withLogicalPath(path);
        log.debug("Renamed attachment {} from {} to {}", id, oldPath, path);
        return entry.meta;
    }

    /**
     * Replaces display metadata. Length, digest, path and id are not affected.
     *
     * @param id attachment id
     * @param title display title
     * @param alt alternative text
     * @param extras extension fields
     * @return updated metadata
     * @throws AttachmentException if absent
     */
    public AttachmentMeta updateMeta(UUID id, String title, String alt, Map<String, Object> extras) {
        Entry entry = require(id);
        entry.meta = entry.meta.withDisplay(title, alt, extras);
        return entry.meta;
    }

    /**
     * Looks up metadata by id.
     *
     * @param id attachment id
     * @return metadata, or empty if absent
     */
    public Optional<AttachmentMeta> lookupById(UUID id) {
        Entry entry = id == null ? null : entries.get(id);
        return entry == null ? Optional.empty() : Optional.of(entry.meta);
    }

    /**
     * Looks up metadata by logical path. The path is normalized first; an invalid path simply
     * yields empty.
     *
     * @param logicalPath logical path
     * @return metadata, or empty if absent
     */
    public Optional<AttachmentMeta> lookupByPath(String logicalPath) {
        return LogicalPaths.tryNormalize(logicalPath)
            .map(byPath::get)
            .flatMap(this::lookupById);
    }

    /**
     * Returns a read-only view of an attachment's bytes.
     *
     * @param id attachment id
     * @return read-only buffer, or empty if absent
     * @throws IllegalStateException if the attachment is being edited
     * @throws AttachmentException if lazily loaded bytes fail verification
     */
    public Optional<ByteBuffer> read(UUID id) {
        Entry entry = id == null ? null : entries.get(id);
        if (entry == null) {
            return Optional.empty();
        }
        checkNotEditing(entry);
        return Optional.of(ByteBuffer.wrap(materialize(entry)).asReadOnlyBuffer());
    }

    /**
     * Opens a stream over an attachment's bytes.
     *
     * @param id attachment id
     * @return input stream
     * @throws AttachmentException if absent
     */
    public InputStream openStream(UUID id) {
        Entry entry = require(id);
        checkNotEditing(entry);
        return new ByteArrayInputStream(materialize(entry));
    }

    /**
     * Grants exclusive mutable access to an attachment's bytes until the handle is closed.
     *
     * <p>Closing the handle stores the buffer and recomputes length and digest. While it is
     * open, reading, renaming, removing or editing the same attachment fails.
     *
     * @param id attachment id
     * @return scoped handle, to be used in try-with-resources
     * @throws AttachmentException if absent
     * @throws IllegalStateException if a handle is already open for this attachment
     */
    public AttachmentBytes mutateBytes(UUID id) {
        Entry entry = require(id);
        checkNotEditing(entry);
        byte[] current = materialize(entry);
        entry.editing = true;
        return new AttachmentBytes(this, id, current);
    }

    /**
     * Returns a snapshot of all metadata ordered by logical path.
     *
     * @return metadata list
     */
    public List<AttachmentMeta> list() {
        return entries.values().stream()
            .map(entry -> entry.meta)
            .sorted(Comparator.comparing(AttachmentMeta::logicalPath))
            .toList();
    }

    /**
     * Returns whether any {@link AttachmentBytes} handle is still open.
     *
     * @return true while an edit is in progress
     */
    public boolean isEditing() {
        return entries.values().stream().anyMatch(entry -> entry.editing);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Creates an independent copy. Byte arrays are copied; pending lazy loaders are shared
     * since they read from an immutable source.
     *
     * @return deep copy
     * @throws IllegalStateException if an edit is in progress
     */
    public AttachmentStore deepCopy() {
        if (isEditing()) {
            throw new IllegalStateException("cannot copy attachments while an edit is in progress");
        }
        AttachmentStore copy = new AttachmentStore();
        for (Entry entry : entries.values()) {
            byte[] data = entry.data == null ? null : entry.data.clone();
            copy.put(new Entry(entry.meta, data, entry.loader));
        }
        return copy;
    }

    /**
     * Called by {@link AttachmentBytes#close()}.
     */
    void release(UUID id, byte[] data) {
        Entry entry = entries.get(id);
        if (entry == null || !entry.editing) {
            throw new IllegalStateException("attachment " + id + " is not being edited");
        }
        entry.data = data;
        entry.loader = null;
        entry.meta = entry.meta.withContent(data.length, Digests.sha256Hex(data));
        entry.editing = false;
        log.debug("Refreshed attachment {} metadata ({} bytes)", id, data.length);
    }

    private byte[] materialize(Entry entry) {
        if (entry.data != null) {
            return entry.data;
        }
        byte[] loaded;
        try {
            loaded = entry.loader.load();
        } catch (IOException e) {
            throw new UncheckedIOException(
                "failed to load attachment `" + entry.meta.logicalPath() + "`", e);
        }
        checkLength(entry.meta, loaded.length);
        String actual = Digests.sha256Hex(loaded);
        if (!actual.equals(entry.meta.sha256())) {
            throw digestMismatch(entry.meta, actual);
        }
        entry.data = loaded;
        entry.loader = null;
        return loaded;
    }

    private void put(Entry entry) {
        entries.put(entry.meta.id(), entry);
        byPath.put(entry.meta.logicalPath(), entry.meta.id());
    }

    private Entry require(UUID id) {
        Entry entry = id == null ? null : entries.get(id);
        if (entry == null) {
            throw new AttachmentException(Reason.NOT_FOUND, "attachment id " + id + " not found");
        }
        return entry;
    }

    private void checkAvailable(UUID id, String path) {
        if (entries.containsKey(id)) {
            throw new AttachmentException(Reason.DUPLICATE_ID, "attachment id " + id + " already exists");
        }
        if (byPath.containsKey(path)) {
            throw new AttachmentException(Reason.DUPLICATE_PATH, "attachment `" + path + "` already exists");
        }
    }

    private static void checkNotEditing(Entry entry) {
        if (entry.editing) {
            throw new IllegalStateException(
                "attachment `" + entry.meta.logicalPath() + "` is being edited");
        }
    }

    private static void checkLength(AttachmentMeta meta, long actual) {
        if (meta.length() != actual) {
            throw new AttachmentException(Reason.LENGTH_MISMATCH, String.format(
                "attachment `%s` length mismatch: manifest=%d actual=%d",
                meta.logicalPath(), meta.length(), actual));
        }
    }

    private static AttachmentException digestMismatch(AttachmentMeta meta, String actual) {
        return new AttachmentException(Reason.DIGEST_MISMATCH, String.format(
            "attachment `%s` sha256 mismatch: manifest=%s actual=%s",
            meta.logicalPath(), meta.sha256(), actual));
    }

    private static final class Entry {
        private AttachmentMeta meta;
        private byte[] data;
        private ByteLoader loader;
        private boolean editing;

        private Entry(AttachmentMeta meta, byte[] data, ByteLoader loader) {
            this.meta = meta;
            this.data = data;
            this.loader = loader;
        }
    }

    @Override
    public String toString() {
        return "AttachmentStore{size=" + entries.size() + "}";
    }
}
