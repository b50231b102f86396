package com.tanumd.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Content of {@code attachments.json}: the metadata of every attachment, ordered by
 * logical path.
 *
 * @param attachments attachment metadata
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AttachmentIndex(
    @JsonProperty("attachments") List<AttachmentMeta> attachments
) {
    public AttachmentIndex {
        if (attachments == null) {
            attachments = List.of();
        } else {
            attachments.forEach(meta -> Objects.requireNonNull(meta, "attachment entry must not be null"));
            attachments = attachments.stream().sorted(Comparator.comparing(AttachmentMeta::logicalPath)).toList();
        }
    }
}
