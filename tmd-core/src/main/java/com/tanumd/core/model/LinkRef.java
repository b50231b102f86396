package com.tanumd.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Typed link from the document to an external or internal resource.
 *
 * @param rel relation name (e.g., "source", "license")
 * @param href link target
 */
public record LinkRef(
    @JsonProperty("rel") String rel,
    @JsonProperty("href") String href
) {
    /**
     * Compact constructor with validation.
     */
    public LinkRef {
        Objects.requireNonNull(rel, "rel must not be null");
        Objects.requireNonNull(href, "href must not be null");
    }
}
