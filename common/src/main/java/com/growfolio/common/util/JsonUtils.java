package com.growfolio.common.util;

/*
 * 09/21/2026 - 12:25 PM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * JSON settings shared by the API boundary: snake case keys, ISO-8601 instants, lenient on unknown fields.
 */
public final class JsonUtils {

    private static final Logger log = LoggerFactory.getLogger(JsonUtils.class);

    private static final ObjectMapper MAPPER = newMapper();

    private JsonUtils() {}

    /**
     * A new mapper with the API settings, for components that register their own modules.
     */
    public static ObjectMapper newMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, false)
                .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true);
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Serialize to JSON. Throws on failure since request bodies are always our own records.
     */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * Pull a human readable message out of an error body.
     * Accepts {@code {"error":{"message":...}}} and {@code {"error":"...","message":"..."}}; anything else
     * that is not blank is returned as-is.
     */
    public static Optional<String> extractErrorMessage(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode root = MAPPER.readTree(body);
            JsonNode error = root.path("error");
            if (error.isObject() && error.path("message").isTextual()) {
                return Optional.of(error.path("message").asText());
            }
            if (root.path("message").isTextual()) {
                return Optional.of(root.path("message").asText());
            }
            if (error.isTextual()) {
                return Optional.of(error.asText());
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: {}", e.getOriginalMessage());
        }
        return Optional.of(body.trim());
    }
}
