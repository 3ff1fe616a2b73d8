package com.tally.eventmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * JSON parsing and serialization for {@link ExternalEvent}.
 *
 * <p>Accepts the common webhook shape {@code {"id", "type", "created", "data": {"object": {...}},
 * "metadata": {...}}}. Metadata is read from the top level and then from the data object, the data
 * object winning on conflicts. {@code created} may be epoch seconds or an ISO-8601 string.
 */
public final class EventSerializer {

    private static final ObjectMapper MAPPER = createMapper();
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private EventSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Parses a raw webhook body.
     *
     * @param json the request body
     * @return the parsed event; fields missing from the JSON are null or empty
     * @throws EventSerializationException if the body is not a JSON object
     */
    public static ExternalEvent parse(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json == null ? "" : json);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Malformed event body", e);
        }
        if (root == null || !root.isObject()) {
            throw new EventSerializationException("Event body must be a JSON object", null);
        }

        JsonNode dataObject = root.path("data").path("object");
        Map<String, Object> payload =
                dataObject.isObject() ? MAPPER.convertValue(dataObject, PAYLOAD_TYPE) : Map.of();

        Map<String, String> metadata = new LinkedHashMap<>();
        collectMetadata(root.path("metadata"), metadata);
        collectMetadata(dataObject.path("metadata"), metadata);

        return new ExternalEvent(
                textOrNull(root.get("id")),
                textOrNull(root.get("type")),
                parseCreated(root.get("created")),
                payload,
                metadata);
    }

    /**
     * Parses, returning empty on malformed input.
     */
    public static Optional<ExternalEvent> tryParse(String json) {
        try {
            return Optional.of(parse(json));
        } catch (EventSerializationException e) {
            return Optional.empty();
        }
    }

    /**
     * Serializes an event to JSON.
     *
     * @throws EventSerializationException if serialization fails
     */
    public static String serialize(ExternalEvent event) {
        try {
            return MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException(
                    "Failed to serialize event: " + event.eventId(), e);
        }
    }

    /** Returns the shared ObjectMapper (for advanced use). */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    private static void collectMetadata(JsonNode node, Map<String, String> target) {
        if (!node.isObject()) {
            return;
        }
        node.fields()
                .forEachRemaining(
                        e -> {
                            if (e.getValue().isValueNode() && !e.getValue().isNull()) {
                                target.put(e.getKey(), e.getValue().asText());
                            }
                        });
    }

    private static Instant parseCreated(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return Instant.ofEpochSecond(node.asLong());
        }
        try {
            return Instant.parse(node.asText());
        } catch (DateTimeParseException e) {
            throw new EventSerializationException("Unparseable created timestamp", e);
        }
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    /** Exception thrown when event parsing or serialization fails. */
    public static class EventSerializationException extends RuntimeException {
        public EventSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
