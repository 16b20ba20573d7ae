package io.rpcgateway.json.jackson;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.rpcgateway.json.spi.ArrayNode;
import io.rpcgateway.json.spi.JsonCodec;
import io.rpcgateway.json.spi.JsonException;
import io.rpcgateway.json.spi.JsonNode;
import io.rpcgateway.json.spi.ObjectNode;

import java.util.Objects;

/**
 * Jackson implementation of JsonCodec.
 * Provides JSON parsing and serialization using Jackson's tree model.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private final ObjectMapper mapper;

    /**
     * Creates a Jackson codec with a default ObjectMapper that rejects trailing content after the root value.
     */
    public JacksonJsonCodec() {
        this(new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS));
    }

    /**
     * Creates a Jackson codec with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public byte[] writeBytes(JsonNode value) throws JsonException {
        try {
            return mapper.writeValueAsBytes(JacksonJsonNode.unwrap(value));
        } catch (Exception e) {
            throw new JsonException("Failed to serialize node to bytes", e);
        }
    }

    @Override
    public String writeString(JsonNode value) throws JsonException {
        try {
            return mapper.writeValueAsString(JacksonJsonNode.unwrap(value));
        } catch (Exception e) {
            throw new JsonException("Failed to serialize node to string", e);
        }
    }

    @Override
    public JsonNode readTree(String json) throws JsonException {
        com.fasterxml.jackson.databind.JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (Exception e) {
            throw new JsonException("Failed to parse string to tree", e);
        }
        return requireContent(node);
    }

    @Override
    public ObjectNode createObjectNode() {
        return new JacksonObjectNode(mapper.createObjectNode());
    }

    @Override
    public ArrayNode createArrayNode() {
        return new JacksonArrayNode(mapper.createArrayNode());
    }

    @Override
    public JsonNode nullNode() {
        return JacksonJsonNode.wrap(mapper.nullNode());
    }

    @Override
    public JsonNode textNode(String value) {
        return JacksonJsonNode.wrap(mapper.getNodeFactory().textNode(value));
    }

    @Override
    public JsonNode numberNode(long value) {
        return JacksonJsonNode.wrap(mapper.getNodeFactory().numberNode(value));
    }

    private static JsonNode requireContent(com.fasterxml.jackson.databind.JsonNode node) throws JsonException {
        // empty input yields null or MissingNode depending on the source
        if (node == null || node.isMissingNode()) {
            throw new JsonException("No JSON content");
        }
        return JacksonJsonNode.wrap(node);
    }
}
