package com.tanumd.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.UUID;

/**
 * Reference to an attachment by identifier.
 *
 * @param id attachment id
 */
public record AttachmentRef(@JsonProperty("id") UUID id) {

    /**
     * Compact constructor with validation.
     */
    public AttachmentRef {
        Objects.requireNonNull(id, "id must not be null");
    }
}
