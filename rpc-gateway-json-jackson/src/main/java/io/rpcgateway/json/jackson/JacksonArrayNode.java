package io.rpcgateway.json.jackson;

import io.rpcgateway.json.spi.ArrayNode;
import io.rpcgateway.json.spi.JsonNode;

/**
 * Jackson implementation of ArrayNode.
 */
final class JacksonArrayNode extends JacksonJsonNode implements ArrayNode {
    private final com.fasterxml.jackson.databind.node.ArrayNode arrayDelegate;

    JacksonArrayNode(com.fasterxml.jackson.databind.node.ArrayNode delegate) {
        super(delegate);
        this.arrayDelegate = delegate;
    }

    @Override
    public ArrayNode add(String value) {
        arrayDelegate.add(value);
        return this;
    }

    @Override
    public ArrayNode add(long value) {
        arrayDelegate.add(value);
        return this;
    }

    @Override
    public ArrayNode add(JsonNode value) {
        arrayDelegate.add(JacksonJsonNode.unwrap(value));
        return this;
    }
}
