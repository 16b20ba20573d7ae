package io.rpcgateway.json.jackson;

import io.rpcgateway.json.spi.JsonNode;
import io.rpcgateway.json.spi.ObjectNode;

/**
 * Jackson implementation of ObjectNode.
 */
final class JacksonObjectNode extends JacksonJsonNode implements ObjectNode {
    private final com.fasterxml.jackson.databind.node.ObjectNode objectDelegate;

    JacksonObjectNode(com.fasterxml.jackson.databind.node.ObjectNode delegate) {
        super(delegate);
        this.objectDelegate = delegate;
    }

    @Override
    public ObjectNode put(String fieldName, String value) {
        objectDelegate.put(fieldName, value);
        return this;
    }

    @Override
    public ObjectNode put(String fieldName, long value) {
        objectDelegate.put(fieldName, value);
        return this;
    }

    @Override
    public ObjectNode put(String fieldName, boolean value) {
        objectDelegate.put(fieldName, value);
        return this;
    }

    @Override
    public ObjectNode set(String fieldName, JsonNode value) {
        objectDelegate.set(fieldName, JacksonJsonNode.unwrap(value));
        return this;
    }

    @Override
    public ObjectNode putNull(String fieldName) {
        objectDelegate.putNull(fieldName);
        return this;
    }
}
