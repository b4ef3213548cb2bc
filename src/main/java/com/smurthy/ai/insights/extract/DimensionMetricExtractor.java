package com.smurthy.ai.insights.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.smurthy.ai.insights.decode.RawRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps decoded rows to {@link SemanticRow}s using the position table.
 *
 * Row layout: element 0 is the dimension-info slot, holding each dimension at its code's position;
 * elements 1..n are metric slots {@code [typeCode, value...]}.
 */
@Component
public class DimensionMetricExtractor {

    private static final Logger log = LoggerFactory.getLogger(DimensionMetricExtractor.class);

    private final PositionTable positionTable;

    public DimensionMetricExtractor(PositionTable positionTable) {
        this.positionTable = positionTable;
    }

    /**
     * @throws IllegalArgumentException if a requested dimension is unknown to the procedure
     */
    public ExtractionResult<SemanticRow> extract(List<RawRow> rows, List<String> requestedDimensions, ProcedureLayout layout) {
        Map<String, Integer> codes = resolveCodes(requestedDimensions, layout);
        MetricSlotLayout slots = positionTable.metricSlots();

        List<SemanticRow> result = new ArrayList<>(rows.size());
        int skipped = 0;
        for (RawRow row : rows) {
            Optional<Map<String, String>> dimensions = dimensions(row.get(0), codes);
            if (dimensions.isEmpty()) {
                skipped++;
                continue;
            }
            result.add(new SemanticRow(dimensions.get(), metrics(row, slots)));
        }

        if (skipped > 0) {
            log.debug("{}: {} of {} rows lacked a requested dimension", layout.procedure(), skipped, rows.size());
        }
        return new ExtractionResult<>(result, skipped);
    }

    public ExtractionResult<SiteEntry> extractSites(List<RawRow> rows, ProcedureLayout layout) {
        List<SiteEntry> sites = new ArrayList<>(rows.size());
        int skipped = 0;
        for (RawRow row : rows) {
            JsonNode url = row.get(0);
            if (url == null || !url.isTextual() || url.asText().isBlank()) {
                skipped++;
                continue;
            }
            sites.add(new SiteEntry(url.asText(), permissionLevel(row.size() > 1 ? row.get(1) : null, layout)));
        }
        return new ExtractionResult<>(sites, skipped);
    }

    private static Map<String, Integer> resolveCodes(List<String> requestedDimensions, ProcedureLayout layout) {
        List<String> requested = requestedDimensions == null || requestedDimensions.isEmpty()
                ? namesByCode(layout)
                : requestedDimensions;
        if (layout.correlatedDimensions() && requestedDimensions != null && !requestedDimensions.isEmpty()) {
            // every row holds all correlated values, so a partial request still reads them all
            requested = new ArrayList<>(requestedDimensions);
            for (String name : namesByCode(layout)) {
                if (!requested.contains(name)) {
                    requested.add(name);
                }
            }
        }

        Map<String, Integer> codes = new LinkedHashMap<>();
        for (String name : requested) {
            Integer code = layout.dimensionCode(name).orElseThrow(() -> new IllegalArgumentException(
                    "Unknown dimension '" + name + "' for " + layout.procedure()
                            + ". Known: " + layout.dimensionCodes().keySet()));
            codes.put(name, code);
        }
        return codes;
    }

    private static List<String> namesByCode(ProcedureLayout layout) {
        return layout.dimensionCodes().entrySet().stream()
                .sorted(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .toList();
    }

    private static Optional<Map<String, String>> dimensions(JsonNode info, Map<String, Integer> codes) {
        if (info == null || !info.isArray()) {
            return Optional.empty();
        }
        Map<String, String> values = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : codes.entrySet()) {
            JsonNode value = info.get(entry.getValue());
            if (value == null || value.isNull() || value.isContainerNode()) {
                return Optional.empty();
            }
            values.put(entry.getKey(), value.asText());
        }
        return Optional.of(values);
    }

    static Metrics metrics(RawRow row, MetricSlotLayout slots) {
        Map<MetricKind, Double> found = new EnumMap<>(MetricKind.class);
        for (int i = 1; i < row.size(); i++) {
            JsonNode slot = row.get(i);
            if (slot == null || !slot.isArray()) {
                continue;
            }
            JsonNode typeCode = slot.get(slots.typeCodeIndex());
            if (typeCode == null || !typeCode.isIntegralNumber()) {
                continue;
            }
            Optional<MetricKind> kind = slots.kindFor(typeCode.intValue());
            if (kind.isEmpty() || found.containsKey(kind.get())) {
                continue;
            }
            firstNumber(slot, slots).ifPresent(value -> found.put(kind.get(), value));
        }
        return new Metrics(
                asLong(found.get(MetricKind.CLICKS)),
                asLong(found.get(MetricKind.IMPRESSIONS)),
                found.get(MetricKind.CTR),
                found.get(MetricKind.POSITION));
    }

    /**
     * Scans for the value, never visiting the type-code index.
     */
    private static Optional<Double> firstNumber(JsonNode slot, MetricSlotLayout slots) {
        for (int j = slots.firstValueIndex(); j < slot.size(); j++) {
            if (j == slots.typeCodeIndex()) {
                continue;
            }
            JsonNode candidate = slot.get(j);
            if (candidate.isNumber()) {
                return Optional.of(candidate.doubleValue());
            }
        }
        return Optional.empty();
    }

    private static Long asLong(Double value) {
        return value == null ? null : Math.round(value);
    }

    private static String permissionLevel(JsonNode code, ProcedureLayout layout) {
        if (code == null || code.isNull()) {
            return "unknown";
        }
        if (code.isTextual()) {
            return code.asText();
        }
        if (code.isIntegralNumber()) {
            return layout.permissionLevels().getOrDefault(code.intValue(), "unknown");
        }
        return "unknown";
    }
}
