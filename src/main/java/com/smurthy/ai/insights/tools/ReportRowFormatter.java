package com.smurthy.ai.insights.tools;

import com.smurthy.ai.insights.extract.Metrics;
import com.smurthy.ai.insights.extract.SemanticRow;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens report rows for tool output: dimensions first, then clicks, impressions,
 * CTR as a percentage with two decimals and average position with one decimal.
 * Metrics the row does not carry are left out.
 */
final class ReportRowFormatter {

    private ReportRowFormatter() {
    }

    static List<Map<String, Object>> format(List<SemanticRow> rows) {
        return rows.stream().map(ReportRowFormatter::format).toList();
    }

    static Map<String, Object> format(SemanticRow row) {
        Map<String, Object> flat = new LinkedHashMap<>(row.dimensions());
        Metrics metrics = row.metrics();
        putIfPresent(flat, "clicks", metrics.clicks());
        putIfPresent(flat, "impressions", metrics.impressions());
        if (metrics.ctr() != null) {
            flat.put("ctr", round(metrics.ctr() * 100, 2));
        }
        if (metrics.position() != null) {
            flat.put("position", round(metrics.position(), 1));
        }
        return flat;
    }

    static double round(double value, int decimals) {
        return BigDecimal.valueOf(value).setScale(decimals, RoundingMode.HALF_UP).doubleValue();
    }

    private static void putIfPresent(Map<String, Object> flat, String key, Object value) {
        if (value != null) {
            flat.put(key, value);
        }
    }
}
