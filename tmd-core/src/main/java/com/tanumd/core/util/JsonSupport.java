package com.tanumd.core.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson configuration for container metadata.
 *
 * <p>Output is pretty printed, map keys are sorted and instants are written as ISO-8601
 * strings, so the same metadata always produces the same bytes.
 */
public final class JsonSupport {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private JsonSupport() {
        // Utility class
    }

    /**
     * Returns the shared, fully configured mapper. Do not reconfigure it.
     *
     * @return object mapper
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
