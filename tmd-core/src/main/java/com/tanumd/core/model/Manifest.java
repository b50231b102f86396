package com.tanumd.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Structured document metadata stored as {@code manifest.json}.
 *
 * <p><b>Example JSON:</b>
 * <pre>{@code
 * {
 *   "tmd_version" : { "major" : 1, "minor" : 0, "patch" : 0 },
 *   "doc_id" : "0b9c5f0e-5d1c-4c7e-a9a8-0d2f3c0e8a11",
 *   "title" : "Quarterly report",
 *   "authors" : [ "Tanu" ],
 *   "created_utc" : "2025-10-01T08:00:00Z",
 *   "modified_utc" : "2025-10-02T09:30:00Z",
 *   "tags" : [ "report" ],
 *   "cover_image" : { "id" : "5f0c..." },
 *   "links" : [ { "rel" : "source", "href" : "https://example.org" } ],
 *   "db_schema_version" : 2,
 *   "extras" : { }
 * }
 * }</pre>
 *
 * @param tmdVersion container format version
 * @param docId stable document id, never regenerated
 * @param title optional title
 * @param authors author names
 * @param createdUtc creation time
 * @param modifiedUtc last modification time, never before {@code createdUtc}
 * @param tags free-form tags
 * @param coverImage optional cover attachment
 * @param links typed links
 * @param dbSchemaVersion informational mirror of the embedded database user version
 * @param extras forward compatible extension fields
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Manifest(
    @JsonProperty("tmd_version") Semver tmdVersion,
    @JsonProperty("doc_id") UUID docId,
    @JsonProperty("title") String title,
    @JsonProperty("authors") List<String> authors,
    @JsonProperty("created_utc") Instant createdUtc,
    @JsonProperty("modified_utc") Instant modifiedUtc,
    @JsonProperty("tags") List<String> tags,
    @JsonProperty("cover_image") AttachmentRef coverImage,
    @JsonProperty("links") List<LinkRef> links,
    @JsonProperty("db_schema_version") Integer dbSchemaVersion,
    @JsonProperty("extras") Map<String, Object> extras
) {
    /**
     * Compact constructor with validation.
     */
    public Manifest {
        Objects.requireNonNull(docId, "docId must not be null");
        Objects.requireNonNull(createdUtc, "createdUtc must not be null");
        if (tmdVersion == null) {
            tmdVersion = Semver.CURRENT;
        }
        if (modifiedUtc == null) {
            modifiedUtc = createdUtc;
        }
        if (modifiedUtc.isBefore(createdUtc)) {
            throw new IllegalArgumentException(
                "modified_utc " + modifiedUtc + " is before created_utc " + createdUtc);
        }
        authors = authors == null ? List.of() : List.copyOf(authors);
        tags = tags == null ? List.of() : List.copyOf(tags);
        links = links == null ? List.of() : List.copyOf(links);
        extras = extras == null || extras.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }

    /**
     * Creates the manifest of a brand new document.
     *
     * @param docId document id
     * @param now creation time
     * @return manifest with current format version and no optional fields
     */
    public static Manifest create(UUID docId, Instant now) {
        return new Manifest(Semver.CURRENT, docId, null, List.of(), now, now,
            List.of(), null, List.of(), null, Map.of());
    }

    /**
     * Returns a builder initialised from this manifest.
     *
     * @return builder
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Returns a copy with a new modification time.
     *
     * @param modified modification time
     * @return updated manifest
     */
    public Manifest withModifiedUtc(Instant modified) {
        return toBuilder().modifiedUtc(modified).build();
    }

    /**
     * Returns a copy with a new database schema version mirror.
     *
     * @param version schema version, or null to clear
     * @return updated manifest
     */
    public Manifest withDbSchemaVersion(Integer version) {
        return toBuilder().dbSchemaVersion(version).build();
    }

    /**
     * Mutable builder for {@link Manifest} copies.
     */
    public static final class Builder {
        private Semver tmdVersion;
        private final UUID docId;
        private String title;
        private List<String> authors;
        private final Instant createdUtc;
        private Instant modifiedUtc;
        private List<String> tags;
        private AttachmentRef coverImage;
        private List<LinkRef> links;
        private Integer dbSchemaVersion;
        private Map<String, Object> extras;

        private Builder(Manifest source) {
            this.tmdVersion = source.tmdVersion();
            this.docId = source.docId();
            this.title = source.title();
            this.authors = new ArrayList<>(source.authors());
            this.createdUtc = source.createdUtc();
            this.modifiedUtc = source.modifiedUtc();
            this.tags = new ArrayList<>(source.tags());
            this.coverImage = source.coverImage();
            this.links = new ArrayList<>(source.links());
            this.dbSchemaVersion = source.dbSchemaVersion();
            this.extras = new LinkedHashMap<>(source.extras());
        }

        public Builder tmdVersion(Semver value) {
            this.tmdVersion = value;
            return this;
        }

        public Builder title(String value) {
            this.title = value;
            return this;
        }

        public Builder authors(List<String> value) {
            this.authors = new ArrayList<>(value);
            return this;
        }

        public Builder modifiedUtc(Instant value) {
            this.modifiedUtc = value;
            return this;
        }

        public Builder tags(List<String> value) {
            this.tags = new ArrayList<>(value);
            return this;
        }

        public Builder coverImage(AttachmentRef value) {
            this.coverImage = value;
            return this;
        }

        public Builder links(List<LinkRef> value) {
            this.links = new ArrayList<>(value);
            return this;
        }

        public Builder addLink(LinkRef value) {
            this.links.add(value);
            return this;
        }

        public Builder dbSchemaVersion(Integer value) {
            this.dbSchemaVersion = value;
            return this;
        }

        public Builder extras(Map<String, Object> value) {
            this.extras = new LinkedHashMap<>(value);
            return this;
        }

        public Builder putExtra(String key, Object value) {
            this.extras.put(key, value);
            return this;
        }

        /**
         * Builds the manifest. The document id and creation time always come from the source.
         *
         * @return new manifest
         */
        public Manifest build() {
            return new Manifest(tmdVersion, docId, title, authors, createdUtc, modifiedUtc,
                tags, coverImage, links, dbSchemaVersion, extras);
        }
    }
}
