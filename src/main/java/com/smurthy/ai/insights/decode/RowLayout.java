package com.smurthy.ai.insights.decode;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * What a single row looks like once all wrappers are removed.
 */
public enum RowLayout {

    /**
     * {@code [dimensionInfo[], metricSlot[], metricSlot[], ...]}
     */
    METRIC_ROW {
        @Override
        public boolean fits(JsonNode row) {
            return row != null && row.isArray() && row.size() >= 2
                    && row.get(0).isArray() && row.get(1).isArray();
        }
    },

    /**
     * {@code [siteUrl, permissionLevel, ...]}
     */
    SITE_ROW {
        @Override
        public boolean fits(JsonNode row) {
            return row != null && row.isArray() && row.size() >= 1 && row.get(0).isTextual();
        }
    },

    /**
     * {@code [url, field, field, ...]}: a flat record whose fields are located by name in the position table.
     */
    RECORD_ROW {
        @Override
        public boolean fits(JsonNode row) {
            return row != null && row.isArray() && row.size() >= 2 && row.get(0).isTextual();
        }
    };

    public abstract boolean fits(JsonNode row);
}
