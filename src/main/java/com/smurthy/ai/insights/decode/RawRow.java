package com.smurthy.ai.insights.decode;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One row array with all wrappers removed.
 */
public record RawRow(JsonNode node) {

    public JsonNode get(int index) {
        return node.get(index);
    }

    public int size() {
        return node.size();
    }
}
