package com.smurthy.ai.insights.extract;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.insights.decode.RowLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Position table read from {@code position-tables/search-console-<version>.json} on the classpath.
 */
public class JsonPositionTable implements PositionTable {

    private static final Logger log = LoggerFactory.getLogger(JsonPositionTable.class);

    private final String version;
    private final Map<SearchConsoleProcedure, ProcedureLayout> layouts;
    private final MetricSlotLayout metricSlots;

    JsonPositionTable(String version, Map<SearchConsoleProcedure, ProcedureLayout> layouts, MetricSlotLayout metricSlots) {
        for (SearchConsoleProcedure procedure : SearchConsoleProcedure.values()) {
            if (!layouts.containsKey(procedure)) {
                throw new IllegalStateException("Position table " + version + " has no layout for " + procedure);
            }
        }
        this.version = version;
        this.layouts = new EnumMap<>(layouts);
        this.metricSlots = metricSlots;
    }

    public static JsonPositionTable load(ObjectMapper objectMapper, String version) {
        String location = "position-tables/search-console-" + version + ".json";
        ClassPathResource resource = new ClassPathResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Position table " + location + " not found on the classpath");
        }
        try (InputStream in = resource.getInputStream()) {
            TableDocument document = objectMapper.readValue(in, TableDocument.class);
            Map<SearchConsoleProcedure, ProcedureLayout> layouts = new EnumMap<>(SearchConsoleProcedure.class);
            document.procedures().forEach((procedure, p) -> layouts.put(procedure, new ProcedureLayout(
                    procedure, p.rpcId(), p.rowLayout(), p.rowListPath(), p.dimensions(),
                    p.honorsDateRange(), p.correlatedDimensions(), p.permissionLevels(), p.fields())));
            log.info("Loaded Search Console position table {} ({} procedures)", document.version(), layouts.size());
            return new JsonPositionTable(document.version(), layouts, document.metricSlots());
        } catch (IOException e) {
            throw new IllegalStateException("Could not read position table " + location, e);
        }
    }

    @Override
    public String version() {
        return version;
    }

    @Override
    public ProcedureLayout layout(SearchConsoleProcedure procedure) {
        return layouts.get(procedure);
    }

    @Override
    public MetricSlotLayout metricSlots() {
        return metricSlots;
    }

    public record TableDocument(String version,
                         MetricSlotLayout metricSlots,
                         Map<SearchConsoleProcedure, ProcedureDocument> procedures) {
    }

    public record ProcedureDocument(String rpcId,
                             RowLayout rowLayout,
                             List<Integer> rowListPath,
                             Map<String, Integer> dimensions,
                             boolean honorsDateRange,
                             boolean correlatedDimensions,
                             Map<Integer, String> permissionLevels,
                             Map<String, Integer> fields) {
    }
}
