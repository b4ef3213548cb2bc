package com.smurthy.ai.insights.service;

import com.smurthy.ai.insights.decode.DecodeResult;
import com.smurthy.ai.insights.decode.ResponseDecoder;
import com.smurthy.ai.insights.exception.EmptyResultException;
import com.smurthy.ai.insights.extract.DimensionMetricExtractor;
import com.smurthy.ai.insights.extract.ExtractionResult;
import com.smurthy.ai.insights.extract.PositionTable;
import com.smurthy.ai.insights.extract.ProcedureLayout;
import com.smurthy.ai.insights.extract.RecordExtractor;
import com.smurthy.ai.insights.extract.SearchConsoleProcedure;
import com.smurthy.ai.insights.extract.SemanticRow;
import com.smurthy.ai.insights.extract.SiteEntry;
import com.smurthy.ai.insights.extract.SitemapEntry;
import com.smurthy.ai.insights.extract.UrlInspection;
import com.smurthy.ai.insights.filter.DateRangeFilter;
import com.smurthy.ai.insights.filter.DatedRow;
import com.smurthy.ai.insights.rpc.DecodedEnvelope;
import com.smurthy.ai.insights.rpc.RpcChannel;
import com.smurthy.ai.insights.rpc.RpcRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Runs the call, decode, extract and (where needed) filter pipeline for each Search Console report.
 */
@Service
public class SearchConsoleService {

    private static final Logger log = LoggerFactory.getLogger(SearchConsoleService.class);

    static final String DATE_DIMENSION = "date";
    static final String INSPECTION_LANGUAGE = "en";

    private final RpcChannel channel;
    private final ResponseDecoder decoder;
    private final DimensionMetricExtractor extractor;
    private final RecordExtractor recordExtractor;
    private final DateRangeFilter dateRangeFilter;
    private final PositionTable positionTable;

    public SearchConsoleService(RpcChannel channel,
                                ResponseDecoder decoder,
                                DimensionMetricExtractor extractor,
                                RecordExtractor recordExtractor,
                                DateRangeFilter dateRangeFilter,
                                PositionTable positionTable) {
        this.channel = channel;
        this.decoder = decoder;
        this.extractor = extractor;
        this.recordExtractor = recordExtractor;
        this.dateRangeFilter = dateRangeFilter;
        this.positionTable = positionTable;
    }

    public AnalyticsResult<SiteEntry> listSites() {
        ProcedureLayout layout = positionTable.layout(SearchConsoleProcedure.LIST_SITES);
        DecodeResult decoded = decoder.decode(channel.call(new RpcRequest(layout.rpcId(), List.of())), layout);
        ExtractionResult<SiteEntry> sites = extractor.extractSites(decoded.rows(), layout);
        if (sites.rows().isEmpty()) {
            throw new EmptyResultException("This Google account has no Search Console properties");
        }
        return new AnalyticsResult<>(layout.procedure(), sites.rows(),
                decoded.skippedRows() + sites.skippedRows(), decoded.shape());
    }

    public AnalyticsResult<SitemapEntry> listSitemaps(String siteUrl) {
        requireSite(siteUrl);
        ProcedureLayout layout = positionTable.layout(SearchConsoleProcedure.SITEMAPS);
        DecodeResult decoded = decoder.decode(channel.call(new RpcRequest(layout.rpcId(), List.of(siteUrl))), layout);
        ExtractionResult<SitemapEntry> sitemaps = recordExtractor.extractSitemaps(decoded.rows(), layout);
        if (sitemaps.rows().isEmpty()) {
            throw new EmptyResultException("No sitemaps found for " + siteUrl
                    + ". Submit sitemaps at search.google.com/search-console");
        }
        log.info("{} for {}: {} sitemaps", layout.procedure(), siteUrl, sitemaps.rows().size());
        return new AnalyticsResult<>(layout.procedure(), sitemaps.rows(),
                decoded.skippedRows() + sitemaps.skippedRows(), decoded.shape());
    }

    /**
     * Index status of {@code url}, which must belong to the property {@code siteUrl}.
     */
    public UrlInspection inspectUrl(String siteUrl, String url) {
        requireSite(siteUrl);
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        ProcedureLayout layout = positionTable.layout(SearchConsoleProcedure.URL_INSPECTION);
        RpcRequest request = new RpcRequest(layout.rpcId(), List.of(siteUrl, url, INSPECTION_LANGUAGE));
        DecodeResult decoded = decoder.decode(channel.call(request), layout);
        UrlInspection inspection = recordExtractor.extractInspection(decoded.rows(), layout)
                .orElseThrow(() -> new EmptyResultException("No inspection result for " + url + " in " + siteUrl));
        log.info("{} for {}: coverage {}", layout.procedure(), url, inspection.coverageState());
        return inspection;
    }

    public AnalyticsResult<SemanticRow> searchAnalytics(SearchAnalyticsQuery query) {
        ProcedureLayout layout = positionTable.layout(SearchConsoleProcedure.SEARCH_ANALYTICS);
        List<Integer> codes = query.dimensions().stream()
                .map(name -> layout.dimensionCode(name).orElseThrow(() -> new IllegalArgumentException(
                        "Unknown dimension '" + name + "'. Known: " + layout.dimensionCodes().keySet())))
                .toList();
        List<Object> args = Arrays.asList(
                query.siteUrl(),
                List.of(query.startDate().toString(), query.endDate().toString()),
                codes,
                query.rowLimit());
        return run(layout, args, query.dimensions(), query.siteUrl());
    }

    /**
     * Highest-click rows for a single dimension, best first.
     */
    public AnalyticsResult<SemanticRow> top(String siteUrl, String dimension, LocalDate start, LocalDate end, int limit) {
        AnalyticsResult<SemanticRow> result = searchAnalytics(
                new SearchAnalyticsQuery(siteUrl, start, end, List.of(dimension), limit));
        List<SemanticRow> ranked = result.rows().stream()
                .sorted(Comparator.comparing((SemanticRow r) -> r.metrics().clicks(),
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(limit)
                .toList();
        return new AnalyticsResult<>(result.procedure(), ranked, result.skippedRows(), result.shape());
    }

    /**
     * Query and landing-page pairs; every row carries both dimensions.
     */
    public AnalyticsResult<SemanticRow> queryPages(String siteUrl, LocalDate start, LocalDate end, int rowLimit) {
        requireRange(siteUrl, start, end);
        if (rowLimit < 1) {
            throw new IllegalArgumentException("row_limit must be positive");
        }
        ProcedureLayout layout = positionTable.layout(SearchConsoleProcedure.QUERY_PAGE);
        List<Object> args = Arrays.asList(siteUrl, List.of(start.toString(), end.toString()), rowLimit);
        return run(layout, args, List.of("query", "page"), siteUrl);
    }

    /**
     * Daily totals between {@code start} and {@code end}. The server returns its full history,
     * which is filtered locally when the position table says the procedure ignores dates.
     */
    public AnalyticsResult<SemanticRow> performanceOverTime(String siteUrl, LocalDate start, LocalDate end) {
        requireRange(siteUrl, start, end);
        ProcedureLayout layout = positionTable.layout(SearchConsoleProcedure.PERFORMANCE_OVER_TIME);
        List<Object> args = Arrays.asList(siteUrl, null);
        AnalyticsResult<SemanticRow> all = run(layout, args, List.of(DATE_DIMENSION), siteUrl);
        if (layout.honorsDateRange()) {
            return all;
        }

        DateRangeFilter.DatedRows dated = dateRangeFilter.toDated(all.rows(), DATE_DIMENSION);
        List<SemanticRow> inRange = dateRangeFilter.filter(dated.rows(), start, end).stream()
                .map(DatedRow::row)
                .toList();
        log.debug("Kept {} of {} daily rows between {} and {}", inRange.size(), all.rows().size(), start, end);
        if (inRange.isEmpty()) {
            throw new EmptyResultException("No daily data for " + siteUrl + " between " + start + " and " + end);
        }
        return new AnalyticsResult<>(layout.procedure(), inRange, all.skippedRows() + dated.skippedRows(), all.shape());
    }

    private static void requireSite(String siteUrl) {
        if (siteUrl == null || siteUrl.isBlank()) {
            throw new IllegalArgumentException("site_url is required");
        }
    }

    private static void requireRange(String siteUrl, LocalDate start, LocalDate end) {
        requireSite(siteUrl);
        if (start == null || end == null) {
            throw new IllegalArgumentException("start_date and end_date are required");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start_date " + start + " is after end_date " + end);
        }
    }

    private AnalyticsResult<SemanticRow> run(ProcedureLayout layout, List<Object> args,
                                             List<String> dimensions, String siteUrl) {
        DecodedEnvelope envelope = channel.call(new RpcRequest(layout.rpcId(), args));
        DecodeResult decoded = decoder.decode(envelope, layout);
        ExtractionResult<SemanticRow> extracted = extractor.extract(decoded.rows(), dimensions, layout);
        if (extracted.rows().isEmpty()) {
            throw new EmptyResultException("Search Console returned no " + layout.procedure() + " rows for " + siteUrl);
        }
        log.info("{} for {}: {} rows ({} skipped)", layout.procedure(), siteUrl,
                extracted.rows().size(), decoded.skippedRows() + extracted.skippedRows());
        return new AnalyticsResult<>(layout.procedure(), extracted.rows(),
                decoded.skippedRows() + extracted.skippedRows(), decoded.shape());
    }
}
