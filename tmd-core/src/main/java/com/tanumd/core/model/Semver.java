package com.tanumd.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Container format version.
 *
 * @param major incompatible layout changes
 * @param minor backward compatible additions
 * @param patch fixes
 */
public record Semver(
    @JsonProperty("major") int major,
    @JsonProperty("minor") int minor,
    @JsonProperty("patch") int patch
) {
    /** Format version written by this implementation. */
    public static final Semver CURRENT = new Semver(1, 0, 0);

    /**
     * Compact constructor with validation.
     */
    public Semver {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("version components must not be negative");
        }
    }

    /**
     * Checks whether a document written with this version can be read by an implementation
     * supporting {@code supported}.
     *
     * @param supported version understood by the reader
     * @return true if the major versions agree
     */
    public boolean isReadableBy(Semver supported) {
        return major == supported.major();
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
