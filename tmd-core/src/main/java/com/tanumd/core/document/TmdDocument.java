package com.tanumd.core.document;

import com.tanumd.core.attachment.AttachmentBytes;
import com.tanumd.core.attachment.AttachmentStore;
import com.tanumd.core.db.DatabaseHandle;
import com.tanumd.core.db.DbOptions;
import com.tanumd.core.db.SqlFunction;
import com.tanumd.core.error.AttachmentException;
import com.tanumd.core.error.AttachmentException.Reason;
import com.tanumd.core.model.ArchiveLayout;
import com.tanumd.core.model.AttachmentMeta;
import com.tanumd.core.model.AttachmentRef;
import com.tanumd.core.model.LinkRef;
import com.tanumd.core.model.Manifest;
import com.tanumd.core.util.LogicalPaths;
import com.tanumd.core.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * A TMD document: Markdown body, manifest, attachments and embedded SQLite database.
 *
 * <p>The document exclusively owns its parts. All changes happen in memory; nothing is
 * persisted until the document is written by the codec or as a workspace. Every mutator moves
 * {@code modified_utc} forward.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * try (TmdDocument doc = TmdDocument.create("# Trip report\n")) {
 *     doc.setTitle("Trip report");
 *     UUID cover = doc.addAttachment("images/cover.png", "image/png", pngBytes);
 *     doc.setCoverImage(cover);
 *     doc.resetDatabase("CREATE TABLE stops(name TEXT, km REAL);", 1);
 *     TmdCodec.write(doc, Path.of("trip.tmd"));
 * }
 * }</pre>
 *
 * <p>Not thread-safe.
 */
public final class TmdDocument implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TmdDocument.class);

    private String markdown;
    private Manifest manifest;
    private final AttachmentStore attachments;
    private final DatabaseHandle database;

    private TmdDocument(String markdown, Manifest manifest, AttachmentStore attachments, DatabaseHandle database) {
        this.markdown = Objects.requireNonNull(markdown, "markdown must not be null");
        this.manifest = Objects.requireNonNull(manifest, "manifest must not be null");
        this.attachments = Objects.requireNonNull(attachments, "attachments must not be null");
        this.database = Objects.requireNonNull(database, "database must not be null");
    }

    /**
     * Creates a new document with a fresh id, no attachments and an empty database.
     *
     * @param markdown Markdown body
     * @return new document
     * @throws IOException if the database file cannot be created
     */
    public static TmdDocument create(String markdown) throws IOException {
        return create(markdown, DbOptions.defaults());
    }

    /**
     * Creates a new document whose database uses the given settings.
     *
     * @param markdown Markdown body
     * @param options database settings
     * @return new document
     * @throws IOException if the database file cannot be created
     */
    public static TmdDocument create(String markdown, DbOptions options) throws IOException {
        Objects.requireNonNull(markdown, "markdown must not be null");
        Manifest manifest = Manifest.create(UUID.randomUUID(), Timestamps.nowUtc());
        TmdDocument doc = new TmdDocument(markdown, manifest, new AttachmentStore(), DatabaseHandle.newEmpty(options));
        log.debug("Created document {}", manifest.docId());
        return doc;
    }

    /**
     * Assembles a document from decoded parts. Ownership of the store and database passes
     * to the document.
     *
     * @param markdown Markdown body
     * @param manifest manifest
     * @param attachments attachment store
     * @param database database handle
     * @return document
     */
    public static TmdDocument assemble(String markdown, Manifest manifest,
                                       AttachmentStore attachments, DatabaseHandle database) {
        return new TmdDocument(markdown, manifest, attachments, database);
    }

    public String markdown() {
        return markdown;
    }

    public void setMarkdown(String markdown) {
        this.markdown = Objects.requireNonNull(markdown, "markdown must not be null");
        touch();
    }

    public Manifest manifest() {
        return manifest;
    }

    /**
     * Applies a change to the manifest. The document id and creation time cannot change.
     *
     * @param change function producing the new manifest
     * @throws IllegalArgumentException if the id or creation time were altered
     */
    public void updateManifest(UnaryOperator<Manifest> change) {
        Manifest updated = Objects.requireNonNull(change.apply(manifest), "updated manifest must not be null");
        if (!updated.docId().equals(manifest.docId())) {
            throw new IllegalArgumentException("doc_id cannot be changed");
        }
        if (!updated.createdUtc().equals(manifest.createdUtc())) {
            throw new IllegalArgumentException("created_utc cannot be changed");
        }
        manifest = updated;
        touch();
    }

    public void setTitle(String title) {
        updateManifest(m -> m.toBuilder().title(title).build());
    }

    public void setTags(List<String> tags) {
        updateManifest(m -> m.toBuilder().tags(tags).build());
    }

    public void setAuthors(List<String> authors) {
        updateManifest(m -> m.toBuilder().authors(authors).build());
    }

    public void addLink(String rel, String href) {
        LinkRef link = new LinkRef(rel, href);
        updateManifest(m -> m.toBuilder().addLink(link).build());
    }

    /**
     * Sets or clears the cover image.
     *
     * @param id attachment id, or null to clear
     * @throws AttachmentException if the id does not name an attachment
     */
    public void setCoverImage(UUID id) {
        if (id != null && attachments.lookupById(id).isEmpty()) {
            throw new AttachmentException(Reason.NOT_FOUND, "cover image attachment " + id + " not found");
        }
        AttachmentRef ref = id == null ? null : new AttachmentRef(id);
        updateManifest(m -> m.toBuilder().coverImage(ref).build());
    }

    /**
     * Moves {@code modified_utc} to now, never backwards.
     */
    public void touch() {
        manifest = manifest.withModifiedUtc(Timestamps.advance(manifest.modifiedUtc()));
    }

    /**
     * Adds an attachment with a fresh id.
     *
     * @param logicalPath path inside the container
     * @param mediaType declared media type
     * @param bytes content
     * @return new attachment id
     * @throws AttachmentException on an invalid, duplicate or reserved path
     */
    public UUID addAttachment(String logicalPath, String mediaType, byte[] bytes) {
        String path = requireUnreserved(logicalPath);
        UUID id = attachments.insert(UUID.randomUUID(), path, mediaType, bytes);
        touch();
        return id;
    }

    /**
     * Adds an attachment read fully from a stream. The stream is not closed.
     *
     * @param logicalPath path inside the container
     * @param mediaType declared media type
     * @param content content stream
     * @return new attachment id
     * @throws IOException if reading fails
     */
    public UUID addAttachment(String logicalPath, String mediaType, InputStream content) throws IOException {
        return addAttachment(logicalPath, mediaType, content.readAllBytes());
    }

    /**
     * Removes an attachment. A cover image reference to it is cleared.
     *
     * @param id attachment id
     * @return removed metadata
     */
    public AttachmentMeta removeAttachment(UUID id) {
        AttachmentMeta removed = attachments.remove(id);
        AttachmentRef cover = manifest.coverImage();
        if (cover != null && cover.id().equals(id)) {
            manifest = manifest.toBuilder().coverImage(null).build();
        }
        touch();
        return removed;
    }

    public AttachmentMeta renameAttachment(UUID id, String newPath) {
        AttachmentMeta renamed = attachments.rename(id, requireUnreserved(newPath));
        touch();
        return renamed;
    }

    /**
     * Replaces an attachment's display metadata.
     *
     * @param id attachment id
     * @param title display title
     * @param alt alternative text
     * @param extras extension fields
     * @return updated metadata
     */
    public AttachmentMeta describeAttachment(UUID id, String title, String alt, Map<String, Object> extras) {
        AttachmentMeta updated = attachments.updateMeta(id, title, alt, extras);
        touch();
        return updated;
    }

    public Optional<AttachmentMeta> attachment(UUID id) {
        return attachments.lookupById(id);
    }

    public Optional<AttachmentMeta> attachmentByPath(String logicalPath) {
        return attachments.lookupByPath(logicalPath);
    }

    /**
     * Lists attachment metadata ordered by logical path.
     *
     * @return snapshot list
     */
    public List<AttachmentMeta> attachments() {
        return attachments.list();
    }

    public Optional<ByteBuffer> attachmentData(UUID id) {
        return attachments.read(id);
    }

    public InputStream openAttachment(UUID id) {
        return attachments.openStream(id);
    }

    /**
     * Opens an attachment for in-place editing. Length and digest are refreshed when the
     * returned handle is closed.
     *
     * @param id attachment id
     * @return scoped handle
     */
    public AttachmentBytes editAttachment(UUID id) {
        AttachmentBytes handle = attachments.mutateBytes(id);
        touch();
        return handle;
    }

    /**
     * Whether an {@link #editAttachment(UUID)} handle is still open.
     *
     * @return true during an edit
     */
    public boolean isEditingAttachments() {
        return attachments.isEditing();
    }

    public <T> T withRead(SqlFunction<T> work) {
        return database.withRead(work);
    }

    public <T> T withWrite(SqlFunction<T> work) {
        T result = database.withWrite(work);
        touch();
        return result;
    }

    /**
     * Replaces the database content with a new schema.
     *
     * @param schemaSql schema statements
     * @param version schema version to record
     */
    public void resetDatabase(String schemaSql, int version) {
        database.reset(schemaSql, version);
        manifest = manifest.withDbSchemaVersion(version);
        touch();
    }

    /**
     * Applies one schema migration step.
     *
     * @param stepSql migration statements
     * @param from expected current version
     * @param to version after the step
     */
    public void migrateDatabase(String stepSql, int from, int to) {
        database.migrate(stepSql, from, to);
        manifest = manifest.withDbSchemaVersion(to);
        touch();
    }

    public void exportDatabase(Path target) throws IOException {
        database.exportTo(target);
    }

    /**
     * Replaces the database with an external SQLite file.
     *
     * @param source SQLite file
     * @throws IOException if reading fails
     */
    public void importDatabase(Path source) throws IOException {
        database.importFrom(source);
        manifest = manifest.withDbSchemaVersion(database.userVersion());
        touch();
    }

    public int databaseVersion() {
        return database.userVersion();
    }

    public byte[] databaseBytes() throws IOException {
        return database.toBytes();
    }

    public DbOptions databaseOptions() {
        return database.options();
    }

    /**
     * Creates an independent deep copy with the same document id.
     *
     * @return copy with its own database file
     * @throws IOException if the database cannot be copied
     */
    public TmdDocument copy() throws IOException {
        AttachmentStore storeCopy = attachments.deepCopy();
        return new TmdDocument(markdown, manifest, storeCopy, database.copy());
    }

    /**
     * Releases the database and deletes its temporary file.
     */
    @Override
    public void close() {
        database.close();
    }

    private static String requireUnreserved(String logicalPath) {
        String path = LogicalPaths.normalize(logicalPath);
        if (ArchiveLayout.isReserved(path)) {
            throw new AttachmentException(Reason.INVALID_PATH, "`" + path + "` is a reserved container entry");
        }
        return path;
    }

    @Override
    public String toString() {
        return "TmdDocument{docId=" + manifest.docId() + ", attachments=" + attachments.size() + "}";
    }
}
