package com.smurthy.ai.insights.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Search Console batchexecute endpoint settings.
 */
@ConfigurationProperties(prefix = "insights.rpc")
public record RpcProperties(
        @DefaultValue("https://search.google.com") String baseUrl,
        @DefaultValue("/_/SearchConsoleAggReportUi/data/batchexecute") String batchExecutePath,
        @DefaultValue("/search-console/performance/search-analytics") String sourcePath,
        @DefaultValue("https://search.google.com") String origin,
        @DefaultValue("Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36")
        String userAgent,
        @DefaultValue("30s") Duration timeout,
        @DefaultValue("1h") Duration antiForgeryTtl,
        @DefaultValue("v1") String positionTableVersion,
        @DefaultValue("SM7Bqb") String probeProcedureId
) {
}
