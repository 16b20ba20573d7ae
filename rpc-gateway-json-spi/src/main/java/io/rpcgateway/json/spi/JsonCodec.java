package io.rpcgateway.json.spi;

/**
 * Minimal JSON codec interface providing tree parsing, tree construction, and serialization.
 * Implementations wrap specific JSON libraries (Jackson, Gson, etc.).
 */
public interface JsonCodec {

    // ===== Serialization =====

    /**
     * Serializes a tree to JSON bytes (UTF-8).
     * @param value the node to serialize
     * @return JSON bytes
     * @throws JsonException if serialization fails
     */
    byte[] writeBytes(JsonNode value) throws JsonException;

    /**
     * Serializes a tree to a JSON string.
     * @param value the node to serialize
     * @return JSON string
     * @throws JsonException if serialization fails
     */
    String writeString(JsonNode value) throws JsonException;

    // ===== Tree parsing =====

    /**
     * Parses JSON text into a tree.
     * @param json JSON string
     * @return the root node, never null
     * @throws JsonException if the text is not valid JSON (including empty input)
     */
    JsonNode readTree(String json) throws JsonException;

    // ===== Tree construction =====

    ObjectNode createObjectNode();

    ArrayNode createArrayNode();

    JsonNode nullNode();

    JsonNode textNode(String value);

    JsonNode numberNode(long value);
}
