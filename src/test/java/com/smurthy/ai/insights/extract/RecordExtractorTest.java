package com.smurthy.ai.insights.extract;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.insights.decode.RawRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecordExtractorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private PositionTable table;
    private RecordExtractor extractor;

    @BeforeEach
    void setUp() {
        table = JsonPositionTable.load(objectMapper, "v1");
        extractor = new RecordExtractor();
    }

    @Test
    @DisplayName("A short sitemap row leaves the missing trailing fields absent")
    void testShortSitemapRow() throws Exception {
        ExtractionResult<SitemapEntry> result = extractor.extractSitemaps(
                List.of(row("[\"https://example.com/sitemap.xml\",\"pending\"]")),
                table.layout(SearchConsoleProcedure.SITEMAPS));

        assertThat(result.rows()).containsExactly(
                new SitemapEntry("https://example.com/sitemap.xml", "pending", null, null, null, null, null, null, null));
    }

    @Test
    void testBlankPathIsSkipped() throws Exception {
        ExtractionResult<SitemapEntry> result = extractor.extractSitemaps(
                List.of(row("[\"\",1714550400000]"), row("[\"https://example.com/a.xml\",null]")),
                table.layout(SearchConsoleProcedure.SITEMAPS));

        assertThat(result.rows()).extracting(SitemapEntry::path).containsExactly("https://example.com/a.xml");
        assertThat(result.skippedRows()).isEqualTo(1);
    }

    @Test
    @DisplayName("Sitemap flags serialize under their Search Console names")
    void testSitemapJsonNames() throws Exception {
        String json = objectMapper.writeValueAsString(
                new SitemapEntry("https://example.com/s.xml", null, null, true, false, 0L, 0L, "WEB", 3L));

        assertThat(json)
                .contains("\"isPending\":true", "\"isSitemapsIndex\":false", "\"urlCount\":3")
                .doesNotContain("lastSubmitted");
    }

    @Test
    @DisplayName("Inspection states the response leaves out read as UNKNOWN")
    void testInspectionDefaults() throws Exception {
        UrlInspection inspection = extractor.extractInspection(
                List.of(row("[\"https://example.com/\",null]")),
                table.layout(SearchConsoleProcedure.URL_INSPECTION)).orElseThrow();

        assertThat(inspection.url()).isEqualTo("https://example.com/");
        assertThat(inspection.coverageState()).isEqualTo("UNKNOWN");
        assertThat(inspection.indexingState()).isEqualTo("UNKNOWN");
        assertThat(inspection.mobileUsability()).isEqualTo("UNKNOWN");
        assertThat(inspection.lastCrawlTime()).isNull();
        assertThat(inspection.referringUrls()).isEmpty();
    }

    @Test
    void testInspectionWithoutUrlIsEmpty() throws Exception {
        assertThat(extractor.extractInspection(List.of(row("[\"\",\"INDEXED\"]")),
                table.layout(SearchConsoleProcedure.URL_INSPECTION))).isEmpty();
    }

    @Test
    void testTimestampText() throws Exception {
        assertThat(RecordExtractor.timestamp(objectMapper.readTree("0"))).isEqualTo("1970-01-01T00:00:00Z");
        assertThat(RecordExtractor.timestamp(objectMapper.readTree("\"yesterday\""))).isEqualTo("yesterday");
        assertThat(RecordExtractor.timestamp(null)).isNull();
    }

    private RawRow row(String json) throws Exception {
        return new RawRow(objectMapper.readTree(json));
    }
}
