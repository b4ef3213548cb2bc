package com.smurthy.ai.insights.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Search Console tools exposed over MCP. Every method returns a JSON {@link ToolResult}.
 */
@Component
public class SearchConsoleTools {

    private static final Logger log = LoggerFactory.getLogger(SearchConsoleTools.class);

    private final SearchConsoleToolDispatcher dispatcher;
    private final ObjectMapper objectMapper;

    public SearchConsoleTools(SearchConsoleToolDispatcher dispatcher, ObjectMapper objectMapper) {
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
    }

    @Tool(name = SearchConsoleToolDispatcher.LIST_SITES,
            description = "List every Google Search Console property the signed-in Google account can access, "
                    + "with its permission level.")
    public String listSites() {
        return invoke(SearchConsoleToolDispatcher.LIST_SITES, Map.of());
    }

    @Tool(name = SearchConsoleToolDispatcher.SEARCH_ANALYTICS,
            description = "Get Search Console performance rows grouped by dimensions. Each row has clicks, impressions, "
                    + "ctr as a percentage (2 decimals) and average position (1 decimal). "
                    + "Dimensions: query, page, country, device, searchAppearance.")
    public String searchAnalytics(
            @ToolParam(description = "Property URL exactly as in Search Console, e.g. 'https://example.com/' or 'sc-domain:example.com'") String siteUrl,
            @ToolParam(description = "Start date YYYY-MM-DD (default: 28 days before end_date)", required = false) String startDate,
            @ToolParam(description = "End date YYYY-MM-DD (default: 3 days ago)", required = false) String endDate,
            @ToolParam(description = "Comma-separated dimensions (default: query)", required = false) String dimensions,
            @ToolParam(description = "Maximum rows, 1-1000 (default 100)", required = false) Integer rowLimit) {
        Map<String, Object> params = new HashMap<>();
        params.put("site_url", siteUrl);
        params.put("start_date", startDate);
        params.put("end_date", endDate);
        params.put("dimensions", dimensions);
        params.put("row_limit", rowLimit);
        return invoke(SearchConsoleToolDispatcher.SEARCH_ANALYTICS, params);
    }

    @Tool(name = SearchConsoleToolDispatcher.TOP_QUERIES,
            description = "Get the search queries that brought the most clicks to a property, best first. "
                    + "ctr is a percentage, position an average rank.")
    public String topQueries(
            @ToolParam(description = "Property URL exactly as in Search Console") String siteUrl,
            @ToolParam(description = "Number of queries, 1-200 (default 20)", required = false) Integer limit,
            @ToolParam(description = "Start date YYYY-MM-DD", required = false) String startDate,
            @ToolParam(description = "End date YYYY-MM-DD", required = false) String endDate) {
        return invoke(SearchConsoleToolDispatcher.TOP_QUERIES, topParams(siteUrl, limit, startDate, endDate));
    }

    @Tool(name = SearchConsoleToolDispatcher.TOP_PAGES,
            description = "Get the pages that received the most clicks from Google Search, best first. "
                    + "ctr is a percentage, position an average rank.")
    public String topPages(
            @ToolParam(description = "Property URL exactly as in Search Console") String siteUrl,
            @ToolParam(description = "Number of pages, 1-200 (default 20)", required = false) Integer limit,
            @ToolParam(description = "Start date YYYY-MM-DD", required = false) String startDate,
            @ToolParam(description = "End date YYYY-MM-DD", required = false) String endDate) {
        return invoke(SearchConsoleToolDispatcher.TOP_PAGES, topParams(siteUrl, limit, startDate, endDate));
    }

    @Tool(name = SearchConsoleToolDispatcher.QUERY_PAGES,
            description = "Get query and landing page pairs with their clicks, impressions, "
                    + "ctr as a percentage and average position.")
    public String queryPages(
            @ToolParam(description = "Property URL exactly as in Search Console") String siteUrl,
            @ToolParam(description = "Start date YYYY-MM-DD", required = false) String startDate,
            @ToolParam(description = "End date YYYY-MM-DD", required = false) String endDate,
            @ToolParam(description = "Maximum rows, 1-1000 (default 100)", required = false) Integer rowLimit) {
        Map<String, Object> params = new HashMap<>();
        params.put("site_url", siteUrl);
        params.put("start_date", startDate);
        params.put("end_date", endDate);
        params.put("row_limit", rowLimit);
        return invoke(SearchConsoleToolDispatcher.QUERY_PAGES, params);
    }

    @Tool(name = SearchConsoleToolDispatcher.PERFORMANCE_OVER_TIME,
            description = "Get daily clicks, impressions, ctr (percentage) and average position for a property "
                    + "over a date range.")
    public String performanceOverTime(
            @ToolParam(description = "Property URL exactly as in Search Console") String siteUrl,
            @ToolParam(description = "Start date YYYY-MM-DD", required = false) String startDate,
            @ToolParam(description = "End date YYYY-MM-DD", required = false) String endDate) {
        Map<String, Object> params = new HashMap<>();
        params.put("site_url", siteUrl);
        params.put("start_date", startDate);
        params.put("end_date", endDate);
        return invoke(SearchConsoleToolDispatcher.PERFORMANCE_OVER_TIME, params);
    }

    @Tool(name = SearchConsoleToolDispatcher.LIST_SITEMAPS,
            description = "List the sitemaps submitted for a property with their submission and download times, "
                    + "pending and index flags, warnings, errors and submitted URL count.")
    public String listSitemaps(
            @ToolParam(description = "Property URL exactly as in Search Console") String siteUrl) {
        Map<String, Object> params = new HashMap<>();
        params.put("site_url", siteUrl);
        return invoke(SearchConsoleToolDispatcher.LIST_SITEMAPS, params);
    }

    @Tool(name = SearchConsoleToolDispatcher.INSPECT_URL,
            description = "Inspect how Google indexes one URL of a property: coverage, robots.txt, indexing and "
                    + "fetch states, last crawl time, canonicals, referring URLs, mobile usability and rich results.")
    public String inspectUrl(
            @ToolParam(description = "Property URL exactly as in Search Console") String siteUrl,
            @ToolParam(description = "Full URL of the page to inspect, inside the property") String url) {
        Map<String, Object> params = new HashMap<>();
        params.put("site_url", siteUrl);
        params.put("url", url);
        return invoke(SearchConsoleToolDispatcher.INSPECT_URL, params);
    }

    @Tool(name = SearchConsoleToolDispatcher.REFRESH_SESSION,
            description = "Re-read the Google login from the browser. Use after logging in again or when a tool "
                    + "reports an expired or missing session.")
    public String refreshGoogleSession() {
        return invoke(SearchConsoleToolDispatcher.REFRESH_SESSION, Map.of());
    }

    private static Map<String, Object> topParams(String siteUrl, Integer limit, String startDate, String endDate) {
        Map<String, Object> params = new HashMap<>();
        params.put("site_url", siteUrl);
        params.put("limit", limit);
        params.put("start_date", startDate);
        params.put("end_date", endDate);
        return params;
    }

    private String invoke(String tool, Map<String, Object> params) {
        ToolResult result = dispatcher.invoke(tool, params);
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            log.error("Could not serialize result of {}", tool, e);
            return "{\"tool\":\"" + tool + "\",\"success\":false,\"errorKind\":\"INTERNAL_ERROR\"}";
        }
    }
}
