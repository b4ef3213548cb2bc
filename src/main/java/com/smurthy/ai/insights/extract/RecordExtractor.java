package com.smurthy.ai.insights.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.smurthy.ai.insights.decode.RawRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps flat record rows (sitemaps, URL inspection) to typed records, reading each field at the
 * index the position table gives for its name. Fields the table does not map are absent.
 */
@Component
public class RecordExtractor {

    private static final Logger log = LoggerFactory.getLogger(RecordExtractor.class);

    static final int MAX_REFERRING_URLS = 5;
    static final String UNKNOWN = "UNKNOWN";

    public ExtractionResult<SitemapEntry> extractSitemaps(List<RawRow> rows, ProcedureLayout layout) {
        List<SitemapEntry> sitemaps = new ArrayList<>(rows.size());
        int skipped = 0;
        for (RawRow row : rows) {
            String path = text(field(row, layout, "path"));
            if (path == null || path.isBlank()) {
                skipped++;
                continue;
            }
            sitemaps.add(new SitemapEntry(
                    path,
                    timestamp(field(row, layout, "lastSubmitted")),
                    timestamp(field(row, layout, "lastDownloaded")),
                    flag(field(row, layout, "isPending")),
                    flag(field(row, layout, "isSitemapsIndex")),
                    count(field(row, layout, "warnings")),
                    count(field(row, layout, "errors")),
                    text(field(row, layout, "type")),
                    submittedUrls(field(row, layout, "contents"), layout)));
        }
        if (skipped > 0) {
            log.debug("{}: {} of {} sitemap rows had no path", layout.procedure(), skipped, rows.size());
        }
        return new ExtractionResult<>(sitemaps, skipped);
    }

    /**
     * @return the first row that names a URL, or empty when none does
     */
    public Optional<UrlInspection> extractInspection(List<RawRow> rows, ProcedureLayout layout) {
        for (RawRow row : rows) {
            String url = text(field(row, layout, "url"));
            if (url == null || url.isBlank()) {
                continue;
            }
            List<String> referring = strings(field(row, layout, "referringUrls"));
            return Optional.of(new UrlInspection(
                    url,
                    state(field(row, layout, "coverageState")),
                    state(field(row, layout, "robotsTxtState")),
                    state(field(row, layout, "indexingState")),
                    timestamp(field(row, layout, "lastCrawlTime")),
                    state(field(row, layout, "pageFetchState")),
                    text(field(row, layout, "crawledAs")),
                    text(field(row, layout, "googleCanonical")),
                    text(field(row, layout, "userCanonical")),
                    referring.size() > MAX_REFERRING_URLS ? referring.subList(0, MAX_REFERRING_URLS) : referring,
                    state(field(row, layout, "mobileUsability")),
                    strings(field(row, layout, "mobileIssues")),
                    state(field(row, layout, "richResultsVerdict"))));
        }
        return Optional.empty();
    }

    private static JsonNode field(RawRow row, ProcedureLayout layout, String name) {
        return layout.fieldIndex(name)
                .filter(index -> index < row.size())
                .map(row::get)
                .filter(node -> !node.isNull())
                .orElse(null);
    }

    private static String text(JsonNode node) {
        if (node == null || !node.isValueNode()) {
            return null;
        }
        String value = node.asText();
        return value.isEmpty() ? null : value;
    }

    private static String state(JsonNode node) {
        String value = text(node);
        return value == null ? UNKNOWN : value;
    }

    /**
     * Epoch milliseconds become ISO-8601 instants; text is passed through.
     */
    static String timestamp(JsonNode node) {
        if (node != null && node.isIntegralNumber()) {
            return Instant.ofEpochMilli(node.longValue()).toString();
        }
        return text(node);
    }

    private static Boolean flag(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.intValue() != 0;
        }
        return null;
    }

    private static Long count(JsonNode node) {
        return node != null && node.isNumber() ? Math.round(node.doubleValue()) : null;
    }

    private static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            for (JsonNode element : node) {
                String value = text(element);
                if (value != null) {
                    values.add(value);
                }
            }
        }
        return values;
    }

    /**
     * Sums the submitted count of every {@code [type, submitted, ...]} content entry.
     */
    private static Long submittedUrls(JsonNode contents, ProcedureLayout layout) {
        if (contents == null || !contents.isArray()) {
            return null;
        }
        int submittedIndex = layout.fieldIndex("contentSubmitted").orElse(1);
        long total = 0;
        for (JsonNode entry : contents) {
            JsonNode submitted = entry.isArray() ? entry.get(submittedIndex) : null;
            if (submitted != null && submitted.isNumber()) {
                total += Math.round(submitted.doubleValue());
            }
        }
        return total;
    }
}
