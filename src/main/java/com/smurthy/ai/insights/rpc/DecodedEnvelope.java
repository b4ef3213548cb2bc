package com.smurthy.ai.insights.rpc;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * All entries of all frames of one response. Only {@code ["wrb.fr", procedureId, innerJson, ...]}
 * entries carry data; bookkeeping entries such as {@code ["di", ...]} and {@code ["e", ...]} are ignored.
 */
public record DecodedEnvelope(List<JsonNode> entries) {

    public static final String DATA_TAG = "wrb.fr";

    public DecodedEnvelope {
        entries = List.copyOf(entries);
    }

    /**
     * @return the first data-bearing entry for {@code procedureId}
     */
    public Optional<JsonNode> dataEntry(String procedureId) {
        return entries.stream()
                .filter(JsonNode::isArray)
                .filter(e -> DATA_TAG.equals(e.path(0).asText(null)))
                .filter(e -> procedureId.equals(e.path(1).asText(null)))
                .findFirst();
    }
}
