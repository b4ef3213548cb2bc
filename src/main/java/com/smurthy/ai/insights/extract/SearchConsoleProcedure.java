package com.smurthy.ai.insights.extract;

/**
 * Search Console report procedures this server knows how to call. Their rpc ids and row layouts
 * live in the position table, not here.
 */
public enum SearchConsoleProcedure {
    SEARCH_ANALYTICS,
    QUERY_PAGE,
    PERFORMANCE_OVER_TIME,
    LIST_SITES,
    SITEMAPS,
    URL_INSPECTION
}
