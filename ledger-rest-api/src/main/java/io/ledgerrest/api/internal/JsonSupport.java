package io.ledgerrest.api.internal;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Shared JSON configuration for the HTTP surface.
 *
 * <p>
 * <strong>Internal Use Only:</strong> not part of the public API.
 */
public final class JsonSupport {

    /**
     * Shared, thread-safe mapper. Record components are written in
     * {@code snake_case}, {@code byte[]} values as base64 text, and properties
     * and map entries in key order.
     */
    public static final ObjectMapper MAPPER = JsonMapper.builder()
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private JsonSupport() {
        // Utility class - prevent instantiation
    }
}
