package com.smurthy.ai.insights.extract;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.insights.decode.RowLayout;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonPositionTableTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void testLoadsEveryProcedure() {
        JsonPositionTable table = JsonPositionTable.load(objectMapper, "v1");

        assertThat(table.version()).isEqualTo("v1");
        for (SearchConsoleProcedure procedure : SearchConsoleProcedure.values()) {
            assertThat(table.layout(procedure)).as(procedure.name()).isNotNull();
        }
        assertThat(table.metricSlots().kindFor(3)).contains(MetricKind.CTR);
        assertThat(table.layout(SearchConsoleProcedure.LIST_SITES).rowLayout()).isEqualTo(RowLayout.SITE_ROW);
        assertThat(table.layout(SearchConsoleProcedure.PERFORMANCE_OVER_TIME).honorsDateRange()).isFalse();
    }

    @Test
    void testRecordFieldsAreNamed() {
        JsonPositionTable table = JsonPositionTable.load(objectMapper, "v1");

        ProcedureLayout inspection = table.layout(SearchConsoleProcedure.URL_INSPECTION);
        assertThat(inspection.rowLayout()).isEqualTo(RowLayout.RECORD_ROW);
        assertThat(inspection.fieldIndex("url")).contains(0);
        assertThat(inspection.fieldIndex("richResultsVerdict")).contains(12);
        assertThat(inspection.fieldIndex("clicks")).isEmpty();
        assertThat(table.layout(SearchConsoleProcedure.SITEMAPS).fieldIndex("contents")).contains(8);
    }

    @Test
    void testDimensionCodesArePerProcedure() {
        JsonPositionTable table = JsonPositionTable.load(objectMapper, "v1");

        // the query/page procedure orders its pair the other way round
        assertThat(table.layout(SearchConsoleProcedure.SEARCH_ANALYTICS).dimensionCode("page")).contains(1);
        assertThat(table.layout(SearchConsoleProcedure.QUERY_PAGE).dimensionCode("page")).contains(0);
        assertThat(table.layout(SearchConsoleProcedure.QUERY_PAGE).correlatedDimensions()).isTrue();
    }

    @Test
    void testUnknownVersion() {
        assertThatThrownBy(() -> JsonPositionTable.load(objectMapper, "v999"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("v999");
    }

    @Test
    void testIncompleteTableIsRejected() {
        ProcedureLayout only = new ProcedureLayout(SearchConsoleProcedure.LIST_SITES, "SM7Bqb", RowLayout.SITE_ROW,
                List.of(0), Map.of(), true, false, Map.of(), Map.of());
        MetricSlotLayout slots = new MetricSlotLayout(0, 1, Map.of(1, MetricKind.CLICKS));

        assertThatThrownBy(() -> new JsonPositionTable("test", Map.of(SearchConsoleProcedure.LIST_SITES, only), slots))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("SEARCH_ANALYTICS");
    }
}
