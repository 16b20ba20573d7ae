package io.rpcgateway.json.spi;

/**
 * Mutable JSON array node builder.
 */
public interface ArrayNode extends JsonNode {

    ArrayNode add(String value);

    ArrayNode add(long value);

    /**
     * Adds a JsonNode value. A {@code null} value is written as JSON null.
     */
    ArrayNode add(JsonNode value);
}
