package com.ryuqq.repoup.adapter.runner.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson mapper for objects the engine persists (manifest, package index, lease).
 *
 * <p>Output is canonical: properties sorted alphabetically, map entries sorted by key, ISO-8601
 * instants, no pretty printing. Identical values therefore always encode to identical bytes, which
 * keeps content digests stable across runs. Unknown properties are ignored on read.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public final class RepoupJson {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(SerializationFeature.INDENT_OUTPUT)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .serializationInclusion(JsonInclude.Include.NON_NULL)
        .build();

    private RepoupJson() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Thread-safe shared mapper. Do not reconfigure.
     *
     * @return mapper
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
