package io.rpcgateway.json.spi;

import java.util.Iterator;

/**
 * Abstraction for a JSON tree node. Represents any JSON value (object, array, string, number, boolean, null).
 * Implementations provide access to node content and structure without exposing the underlying JSON library.
 */
public interface JsonNode {

    /**
     * Returns the node type.
     */
    JsonNodeType getNodeType();

    default boolean isObject() {
        return getNodeType() == JsonNodeType.OBJECT;
    }

    default boolean isArray() {
        return getNodeType() == JsonNodeType.ARRAY;
    }

    default boolean isTextual() {
        return getNodeType() == JsonNodeType.STRING;
    }

    default boolean isNumber() {
        return getNodeType() == JsonNodeType.NUMBER;
    }

    default boolean isNull() {
        return getNodeType() == JsonNodeType.NULL;
    }

    /**
     * Gets a field by name from an object node.
     * Returns null if this is not an object or the field doesn't exist.
     */
    JsonNode get(String fieldName);

    /**
     * Gets an element by index from an array node.
     * Returns null if this is not an array or index is out of bounds.
     */
    JsonNode get(int index);

    /**
     * Returns the number of fields (objects) or elements (arrays); 0 for scalars.
     */
    int size();

    /**
     * Returns the text value of a text node, or the string representation of any other scalar.
     */
    String asText();

    /**
     * Returns the long value of this node, or 0 if not numeric.
     */
    long asLong();

    /**
     * Returns an iterator over the elements (for array nodes).
     */
    Iterator<JsonNode> elements();
}
