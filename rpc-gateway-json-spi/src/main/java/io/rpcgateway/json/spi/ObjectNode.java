package io.rpcgateway.json.spi;

/**
 * Mutable JSON object node builder.
 * Field order is insertion order.
 */
public interface ObjectNode extends JsonNode {

    ObjectNode put(String fieldName, String value);

    ObjectNode put(String fieldName, long value);

    ObjectNode put(String fieldName, boolean value);

    /**
     * Sets a JsonNode field. A {@code null} value is written as JSON null.
     */
    ObjectNode set(String fieldName, JsonNode value);

    ObjectNode putNull(String fieldName);
}
