package com.tanumd.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Metadata of one attachment, as listed in {@code attachments.json}.
 *
 * <p>{@code length} and {@code sha256} describe the attachment bytes. The attachment store
 * derives them from the bytes it holds; a record read from an archive carries the declared
 * values until the store has checked them.
 *
 * @param id immutable attachment id
 * @param logicalPath normalized path inside the container
 * @param mime declared media type
 * @param length byte length
 * @param sha256 lowercase hex SHA-256 of the bytes, or null when not declared
 * @param title optional display title
 * @param alt optional alternative text
 * @param extras forward compatible extension fields
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AttachmentMeta(
    @JsonProperty("id") UUID id,
    @JsonProperty("logical_path") String logicalPath,
    @JsonProperty("mime") String mime,
    @JsonProperty("length") long length,
    @JsonProperty("sha256") String sha256,
    @JsonProperty("title") String title,
    @JsonProperty("alt") String alt,
    @JsonProperty("extras") Map<String, Object> extras
) {
    /**
     * Compact constructor with validation.
     */
    public AttachmentMeta {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(logicalPath, "logicalPath must not be null");
        if (mime == null || mime.isBlank()) {
            mime = "application/octet-stream";
        }
        if (length < 0) {
            throw new IllegalArgumentException("length must not be negative");
        }
        extras = extras == null || extras.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }

    /**
     * Creates metadata for freshly stored bytes.
     *
     * @param id attachment id
     * @param logicalPath normalized path
     * @param mime media type
     * @param length byte length
     * @param sha256 hex digest
     * @return metadata without display fields
     */
    public static AttachmentMeta of(UUID id, String logicalPath, String mime, long length, String sha256) {
        return new AttachmentMeta(id, logicalPath, mime, length, sha256, null, null, Map.of());
    }

    /**
     * Returns a copy at a different logical path.
     *
     * @param newPath normalized path
     * @return updated metadata
     */
    public AttachmentMeta withLogicalPath(String newPath) {
        return new AttachmentMeta(id, newPath, mime, length, sha256, title, alt, extras);
    }

    /**
     * Returns a copy describing different content.
     *
     * @param newLength byte length
     * @param newSha256 hex digest
     * @return updated metadata
     */
    public AttachmentMeta withContent(long newLength, String newSha256) {
        return new AttachmentMeta(id, logicalPath, mime, newLength, newSha256, title, alt, extras);
    }

    /**
     * Returns a copy with different display fields.
     *
     * @param newTitle display title
     * @param newAlt alternative text
     * @param newExtras extension fields
     * @return updated metadata
     */
    public AttachmentMeta withDisplay(String newTitle, String newAlt, Map<String, Object> newExtras) {
        return new AttachmentMeta(id, logicalPath, mime, length, sha256, newTitle, newAlt, newExtras);
    }
}
