package com.tanumd.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.tanumd.core.document.TmdDocument;
import com.tanumd.core.error.AttachmentException;
import com.tanumd.core.error.AttachmentException.Reason;
import com.tanumd.core.error.TmdFormatException;
import com.tanumd.core.model.ArchiveLayout;
import com.tanumd.core.model.AttachmentIndex;
import com.tanumd.core.model.AttachmentMeta;
import com.tanumd.core.util.Digests;
import com.tanumd.core.util.JsonSupport;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.zip.CRC32;
import java.util.zip.ZipEntry;

/**
 * Serializes a document into ZIP bytes.
 *
 * <p>Entries are written uncompressed in a fixed order with a fixed timestamp, so equal
 * documents always produce equal bytes.
 */
final class ContainerWriter {

    private static final Logger log = LoggerFactory.getLogger(ContainerWriter.class);

    /** DOS timestamp of every entry: 2020-01-01 00:00 local time, written identically in every zone. */
    private static final LocalDateTime ENTRY_TIME = LocalDateTime.of(2020, 1, 1, 0, 0);

    private final WriteMode mode;
    private final long entryTime;
    private final Map<String, Long> crcByDigest = new HashMap<>();

    ContainerWriter(WriteMode mode) {
        this.mode = mode;
        this.entryTime = ENTRY_TIME.atZone(ZoneId.systemDefault()).toInstant().toEpochMilli();
    }

    /**
     * Builds the archive with an empty comment.
     *
     * @param doc document to serialize
     * @return ZIP bytes
     * @throws IOException if the database cannot be read
     */
    byte[] writeArchive(TmdDocument doc) throws IOException {
        if (doc.isEditingAttachments()) {
            throw new IllegalStateException("cannot encode while an attachment edit is in progress");
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipArchiveOutputStream zip = new ZipArchiveOutputStream(out)) {
            zip.setEncoding(StandardCharsets.UTF_8.name());
            zip.setMethod(ZipEntry.STORED);

            AttachmentIndex index = new AttachmentIndex(doc.attachments());
            Map<UUID, ByteBuffer> contents = new HashMap<>();
            for (AttachmentMeta meta : index.attachments()) {
                if (ArchiveLayout.isReserved(meta.logicalPath())) {
                    throw new TmdFormatException("attachment `" + meta.logicalPath() + "` collides with a reserved entry");
                }
                ByteBuffer data = doc.attachmentData(meta.id())
                    .orElseThrow(() -> new AttachmentException(Reason.NOT_FOUND,
                        "missing data for attachment " + meta.id()));
                checkContent(meta, data);
                contents.put(meta.id(), data);
            }

            putEntry(zip, ArchiveLayout.MANIFEST, ByteBuffer.wrap(toJson(doc.manifest())), null);
            putEntry(zip, ArchiveLayout.MARKDOWN, ByteBuffer.wrap(doc.markdown().getBytes(StandardCharsets.UTF_8)), null);
            putEntry(zip, ArchiveLayout.ATTACHMENTS, ByteBuffer.wrap(toJson(index)), null);
            putEntry(zip, ArchiveLayout.DATABASE, ByteBuffer.wrap(doc.databaseBytes()), null);
            for (AttachmentMeta meta : index.attachments()) {
                putEntry(zip, meta.logicalPath(), contents.get(meta.id()), meta.sha256());
            }
            zip.finish();
        }
        log.debug("Wrote archive of {} bytes with {} attachments", out.size(), doc.attachments().size());
        return out.toByteArray();
    }

    private void checkContent(AttachmentMeta meta, ByteBuffer data) {
        if (data.remaining() != meta.length()) {
            throw new AttachmentException(Reason.LENGTH_MISMATCH, String.format(
                "attachment `%s` length mismatch: manifest=%d actual=%d",
                meta.logicalPath(), meta.length(), data.remaining()));
        }
        if (mode.computeHashes()) {
            String actual = Digests.sha256Hex(data);
            if (!actual.equals(meta.sha256())) {
                throw new AttachmentException(Reason.DIGEST_MISMATCH, String.format(
                    "attachment `%s` sha256 mismatch: manifest=%s actual=%s",
                    meta.logicalPath(), meta.sha256(), actual));
            }
        }
    }

    private void putEntry(ZipArchiveOutputStream zip, String name, ByteBuffer data, String digest) throws IOException {
        ZipArchiveEntry entry = new ZipArchiveEntry(name);
        entry.setMethod(ZipEntry.STORED);
        entry.setTime(entryTime);
        entry.setSize(data.remaining());
        entry.setCrc(crc(data, digest));
        zip.putArchiveEntry(entry);
        if (data.hasArray()) {
            zip.write(data.array(), data.arrayOffset() + data.position(), data.remaining());
        } else {
            byte[] copy = new byte[data.remaining()];
            data.duplicate().get(copy);
            zip.write(copy);
        }
        zip.closeArchiveEntry();
    }

    private long crc(ByteBuffer data, String digest) {
        if (mode.dedupByHash() && digest != null) {
            return crcByDigest.computeIfAbsent(digest, key -> computeCrc(data));
        }
        return computeCrc(data);
    }

    private static long computeCrc(ByteBuffer data) {
        CRC32 crc = new CRC32();
        crc.update(data.duplicate());
        return crc.getValue();
    }

    private static byte[] toJson(Object value) {
        try {
            return JsonSupport.mapper().writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new TmdFormatException("failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
