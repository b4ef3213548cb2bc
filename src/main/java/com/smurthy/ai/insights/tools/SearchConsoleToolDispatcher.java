package com.smurthy.ai.insights.tools;

import com.smurthy.ai.insights.auth.AntiForgeryTokenCache;
import com.smurthy.ai.insights.exception.ErrorKind;
import com.smurthy.ai.insights.exception.InsightsException;
import com.smurthy.ai.insights.extract.SemanticRow;
import com.smurthy.ai.insights.extract.SitemapEntry;
import com.smurthy.ai.insights.filter.DateRangeFilter;
import com.smurthy.ai.insights.service.AnalyticsResult;
import com.smurthy.ai.insights.service.SearchAnalyticsQuery;
import com.smurthy.ai.insights.service.SearchConsoleService;
import com.smurthy.ai.insights.session.SessionCookieProvider;
import com.smurthy.ai.insights.session.SessionCookies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single entry point for every tool: validates parameters, runs the service call and
 * turns every failure into a {@link ToolResult}. Nothing thrown here reaches the caller.
 */
@Component
public class SearchConsoleToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(SearchConsoleToolDispatcher.class);

    public static final String LIST_SITES = "gsc_list_sites";
    public static final String SEARCH_ANALYTICS = "gsc_search_analytics";
    public static final String TOP_QUERIES = "gsc_top_queries";
    public static final String TOP_PAGES = "gsc_top_pages";
    public static final String QUERY_PAGES = "gsc_query_pages";
    public static final String PERFORMANCE_OVER_TIME = "gsc_performance_over_time";
    public static final String LIST_SITEMAPS = "gsc_list_sitemaps";
    public static final String INSPECT_URL = "gsc_inspect_url";
    public static final String REFRESH_SESSION = "refresh_google_session";

    static final int DATA_LAG_DAYS = 3;
    static final int DEFAULT_RANGE_DAYS = 28;
    static final int MAX_ROW_LIMIT = 1000;
    static final int DEFAULT_ROW_LIMIT = 100;
    static final int MAX_TOP_LIMIT = 200;
    static final int DEFAULT_TOP_LIMIT = 20;

    private final SearchConsoleService service;
    private final SessionCookieProvider sessions;
    private final AntiForgeryTokenCache antiForgeryTokens;
    private final Clock clock;

    public SearchConsoleToolDispatcher(SearchConsoleService service,
                                       SessionCookieProvider sessions,
                                       AntiForgeryTokenCache antiForgeryTokens,
                                       Clock clock) {
        this.service = service;
        this.sessions = sessions;
        this.antiForgeryTokens = antiForgeryTokens;
        this.clock = clock;
    }

    public ToolResult invoke(String toolName, Map<String, Object> params) {
        Map<String, Object> args = params == null ? Map.of() : params;
        log.info("[TOOL] {} {}", toolName, args);
        try {
            return switch (toolName == null ? "" : toolName) {
                case LIST_SITES -> fromResult(toolName, service.listSites());
                case SEARCH_ANALYTICS -> searchAnalytics(args);
                case TOP_QUERIES -> top(toolName, "query", args);
                case TOP_PAGES -> top(toolName, "page", args);
                case QUERY_PAGES -> queryPages(args);
                case PERFORMANCE_OVER_TIME -> performanceOverTime(args);
                case LIST_SITEMAPS -> listSitemaps(args);
                case INSPECT_URL -> ToolResult.success(INSPECT_URL,
                        service.inspectUrl(requiredString(args, "site_url"), requiredString(args, "url")), 0);
                case REFRESH_SESSION -> refreshSession();
                default -> ToolResult.error(toolName, ErrorKind.INVALID_ARGUMENT, "Unknown tool '" + toolName + "'");
            };
        } catch (InsightsException e) {
            log.warn("[TOOL] {} failed with {}: {}", toolName, e.kind(), e.getMessage());
            return ToolResult.error(toolName, e);
        } catch (IllegalArgumentException e) {
            log.warn("[TOOL] {} rejected arguments: {}", toolName, e.getMessage());
            return ToolResult.error(toolName, ErrorKind.INVALID_ARGUMENT, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[TOOL] {} failed unexpectedly", toolName, e);
            return ToolResult.error(toolName, ErrorKind.INTERNAL_ERROR, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private ToolResult searchAnalytics(Map<String, Object> args) {
        LocalDate[] range = dateRange(args);
        List<String> dimensions = dimensions(optionalString(args, "dimensions"));
        int rowLimit = clamp(optionalInt(args, "row_limit", DEFAULT_ROW_LIMIT), MAX_ROW_LIMIT);
        SearchAnalyticsQuery query = new SearchAnalyticsQuery(
                requiredString(args, "site_url"), range[0], range[1], dimensions, rowLimit);
        return fromReport(SEARCH_ANALYTICS, service.searchAnalytics(query));
    }

    private ToolResult top(String tool, String dimension, Map<String, Object> args) {
        LocalDate[] range = dateRange(args);
        int limit = clamp(optionalInt(args, "limit", DEFAULT_TOP_LIMIT), MAX_TOP_LIMIT);
        return fromReport(tool, service.top(requiredString(args, "site_url"), dimension, range[0], range[1], limit));
    }

    private ToolResult queryPages(Map<String, Object> args) {
        LocalDate[] range = dateRange(args);
        int rowLimit = clamp(optionalInt(args, "row_limit", DEFAULT_ROW_LIMIT), MAX_ROW_LIMIT);
        return fromReport(QUERY_PAGES, service.queryPages(requiredString(args, "site_url"), range[0], range[1], rowLimit));
    }

    private ToolResult performanceOverTime(Map<String, Object> args) {
        LocalDate[] range = dateRange(args);
        return fromReport(PERFORMANCE_OVER_TIME,
                service.performanceOverTime(requiredString(args, "site_url"), range[0], range[1]));
    }

    private ToolResult listSitemaps(Map<String, Object> args) {
        String siteUrl = requiredString(args, "site_url");
        AnalyticsResult<SitemapEntry> result = service.listSitemaps(siteUrl);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("site", siteUrl);
        data.put("sitemaps", result.rows());
        data.put("total", result.rows().size());
        return ToolResult.success(LIST_SITEMAPS, data, result.skippedRows());
    }

    private ToolResult refreshSession() {
        SessionCookies cookies = sessions.refresh();
        antiForgeryTokens.invalidate();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("browser", cookies.source().displayName());
        data.put("cookieCount", cookies.size());
        data.put("message", "Google session reloaded from " + cookies.source().displayName());
        return ToolResult.success(REFRESH_SESSION, data, 0);
    }

    private static ToolResult fromResult(String tool, AnalyticsResult<?> result) {
        return ToolResult.success(tool, result.rows(), result.skippedRows());
    }

    private static ToolResult fromReport(String tool, AnalyticsResult<SemanticRow> result) {
        return ToolResult.success(tool, ReportRowFormatter.format(result.rows()), result.skippedRows());
    }

    /**
     * Missing dates default to the 28 days ending 3 days ago in the clock's zone, since the newest days are not final yet.
     */
    LocalDate[] dateRange(Map<String, Object> args) {
        String start = optionalString(args, "start_date");
        String end = optionalString(args, "end_date");
        LocalDate endDate = end != null ? DateRangeFilter.parseDate(end) : LocalDate.now(clock).minusDays(DATA_LAG_DAYS);
        LocalDate startDate = start != null ? DateRangeFilter.parseDate(start) : endDate.minusDays(DEFAULT_RANGE_DAYS - 1);
        if (startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("start_date " + startDate + " is after end_date " + endDate);
        }
        return new LocalDate[]{startDate, endDate};
    }

    static List<String> dimensions(String csv) {
        if (csv == null) {
            return List.of("query");
        }
        List<String> names = Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        return names.isEmpty() ? List.of("query") : names;
    }

    static int clamp(int value, int max) {
        return Math.max(1, Math.min(max, value));
    }

    private static String requiredString(Map<String, Object> args, String name) {
        String value = optionalString(args, name);
        if (value == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }

    private static String optionalString(Map<String, Object> args, String name) {
        Object value = args.get(name);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    private static int optionalInt(Map<String, Object> args, String name, int defaultValue) {
        Object value = args.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'");
        }
    }
}
