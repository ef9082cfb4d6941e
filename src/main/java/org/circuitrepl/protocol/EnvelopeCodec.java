package org.circuitrepl.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Encodes and decodes protocol envelopes as single-line JSON objects.
 * <p>
 * Also converts typed payload and result records to and from the {@link JsonNode} trees
 * carried inside {@link Request} and {@link Response}. Instances are thread-safe.
 */
public final class EnvelopeCodec {

    private final ObjectMapper objectMapper;

    public EnvelopeCodec() {
        this.objectMapper = new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE, true)
                .configure(SerializationFeature.INDENT_OUTPUT, false);
    }

    public String encode(final Object envelope) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Cannot encode " + envelope.getClass().getSimpleName(), e);
        }
    }

    public Request decodeRequest(final String line) {
        return decode(line, Request.class);
    }

    public Response decodeResponse(final String line) {
        return decode(line, Response.class);
    }

    public ControlSignal decodeControlSignal(final String line) {
        return decode(line, ControlSignal.class);
    }

    /**
     * Converts a payload or result record to a JSON tree.
     */
    public JsonNode toTree(final Object value) {
        return value == null ? objectMapper.createObjectNode() : objectMapper.valueToTree(value);
    }

    /**
     * Converts a JSON tree to the given record type. A missing tree decodes as an empty object.
     *
     * @throws ProtocolException if the tree does not match the target type.
     */
    public <T> T fromTree(final JsonNode tree, final Class<T> type) {
        final JsonNode source = tree == null || tree.isNull() ? objectMapper.createObjectNode() : tree;
        try {
            return objectMapper.treeToValue(source, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ProtocolException("Malformed " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private <T> T decode(final String line, final Class<T> type) {
        if (line == null || line.isBlank()) {
            throw new ProtocolException("Empty frame");
        }
        try {
            return objectMapper.readValue(line, type);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed " + type.getSimpleName() + " frame: " + e.getOriginalMessage(), e);
        }
    }
}
