package com.smurthy.ai.insights.extract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One result row: dimension name to value, plus its metrics.
 */
public record SemanticRow(Map<String, String> dimensions, Metrics metrics) {

    public SemanticRow {
        // keep the requested dimension order
        dimensions = Collections.unmodifiableMap(new LinkedHashMap<>(dimensions));
    }

    public String dimension(String name) {
        return dimensions.get(name);
    }
}
