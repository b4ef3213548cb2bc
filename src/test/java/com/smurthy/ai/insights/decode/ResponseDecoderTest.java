package com.smurthy.ai.insights.decode;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.smurthy.ai.insights.exception.RpcDecodeException;
import com.smurthy.ai.insights.extract.DimensionMetricExtractor;
import com.smurthy.ai.insights.extract.JsonPositionTable;
import com.smurthy.ai.insights.extract.PositionTable;
import com.smurthy.ai.insights.extract.ProcedureLayout;
import com.smurthy.ai.insights.extract.SearchConsoleProcedure;
import com.smurthy.ai.insights.extract.SemanticRow;
import com.smurthy.ai.insights.rpc.DecodedEnvelope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseDecoderTest {

    private static final String ROW_1 = "[[\"running shoes\",null,null,null,null],[1,12],[2,340],[3,0.0353],[4,4.2]]";
    private static final String ROW_2 = "[[\"trail shoes\",null,null,null,null],[1,3],[2,95],[3,0.0316],[4,7.9]]";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ResponseDecoder decoder;
    private DimensionMetricExtractor extractor;
    private ProcedureLayout searchAnalytics;

    @BeforeEach
    void setUp() {
        PositionTable table = JsonPositionTable.load(objectMapper, "v1");
        decoder = new ResponseDecoder(objectMapper);
        extractor = new DimensionMetricExtractor(table);
        searchAnalytics = table.layout(SearchConsoleProcedure.SEARCH_ANALYTICS);
    }

    @Test
    @DisplayName("Shapes A, B and C with the same content decode and extract to identical rows")
    void testShapeEquivalence() {
        // Given the same two rows in the three known nestings
        String shapeA = "[null,[[" + ROW_1 + "," + ROW_2 + "]]]";
        String shapeB = "[null,[[[" + ROW_1 + "],[[" + ROW_2 + "]]]]]";
        String shapeC = "[null,[" + ROW_1 + "," + ROW_2 + "]]";

        // When
        DecodeResult a = decoder.decode(envelope("OLiH4d", shapeA), searchAnalytics);
        DecodeResult b = decoder.decode(envelope("OLiH4d", shapeB), searchAnalytics);
        DecodeResult c = decoder.decode(envelope("OLiH4d", shapeC), searchAnalytics);

        // Then
        assertThat(a.shape()).isEqualTo(RowShape.A);
        assertThat(b.shape()).isEqualTo(RowShape.B);
        assertThat(c.shape()).isEqualTo(RowShape.C);

        List<SemanticRow> fromA = extract(a);
        assertThat(fromA).hasSize(2);
        assertThat(extract(b)).isEqualTo(fromA);
        assertThat(extract(c)).isEqualTo(fromA);
        assertThat(fromA.get(0).dimension("query")).isEqualTo("running shoes");
        assertThat(fromA.get(0).metrics().clicks()).isEqualTo(12L);
    }

    @Test
    @DisplayName("Malformed rows are skipped and counted, not fatal")
    void testSkipsMalformedRows() {
        String payload = "[null,[[" + ROW_1 + ",\"garbage\",[42]," + ROW_2 + "]]]";

        DecodeResult result = decoder.decode(envelope("OLiH4d", payload), searchAnalytics);

        assertThat(result.rows()).hasSize(2);
        assertThat(result.skippedRows()).isEqualTo(2);
    }

    @Test
    @DisplayName("No matching shape is an RpcDecodeError listing every attempt")
    void testNoShapeMatches() {
        assertThatThrownBy(() -> decoder.decode(envelope("OLiH4d", "[null,[[\"x\",\"y\"]]]"), searchAnalytics))
                .isInstanceOf(RpcDecodeException.class)
                .hasMessageContaining("A: ")
                .hasMessageContaining("B: ")
                .hasMessageContaining("C: ");
    }

    @Test
    void testUnwrapIsCapped() {
        // three wrappers is one more than the decoder removes
        String payload = "[null,[[[[[" + ROW_1 + "]]]]]]";

        assertThatThrownBy(() -> decoder.decode(envelope("OLiH4d", payload), searchAnalytics))
                .isInstanceOf(RpcDecodeException.class);
    }

    @Test
    @DisplayName("Null payloads and null row lists mean zero rows")
    void testNullPayloads() {
        assertThat(decoder.decode(envelope("OLiH4d", "null"), searchAnalytics).rows()).isEmpty();
        assertThat(decoder.decode(envelope("OLiH4d", "[null,null]"), searchAnalytics).rows()).isEmpty();
        assertThat(decoder.decode(envelope("OLiH4d", "[null,[[]]]"), searchAnalytics).rows()).isEmpty();

        ArrayNode entryWithoutPayload = objectMapper.createArrayNode().add("wrb.fr").add("OLiH4d").addNull();
        assertThat(decoder.decode(new DecodedEnvelope(List.of(entryWithoutPayload)), searchAnalytics).rows()).isEmpty();
    }

    @Test
    void testMissingEntry() {
        assertThatThrownBy(() -> decoder.decode(envelope("nDAfwb", "[]"), searchAnalytics))
                .isInstanceOf(RpcDecodeException.class)
                .hasMessageContaining("OLiH4d");
    }

    @Test
    void testInnerPayloadMustBeJson() {
        assertThatThrownBy(() -> decoder.decode(envelope("OLiH4d", "[unterminated"), searchAnalytics))
                .isInstanceOf(RpcDecodeException.class);
    }

    private List<SemanticRow> extract(DecodeResult result) {
        return extractor.extract(result.rows(), List.of("query"), searchAnalytics).rows();
    }

    private DecodedEnvelope envelope(String procedureId, String innerJson) {
        ArrayNode entry = objectMapper.createArrayNode().add("wrb.fr").add(procedureId).add(innerJson).addNull();
        ArrayNode bookkeeping = objectMapper.createArrayNode().add("di").add(42);
        return new DecodedEnvelope(List.of(bookkeeping, entry));
    }
}
