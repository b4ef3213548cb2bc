package com.smurthy.ai.insights.extract;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Index status of one URL as Search Console last saw it. States the response did not carry are {@code UNKNOWN}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UrlInspection(
        String url,
        String coverageState,
        String robotsTxtState,
        String indexingState,
        String lastCrawlTime,
        String pageFetchState,
        String crawledAs,
        String googleCanonical,
        String userCanonical,
        List<String> referringUrls,
        String mobileUsability,
        List<String> mobileIssues,
        String richResultsVerdict
) {

    public UrlInspection {
        referringUrls = referringUrls == null ? List.of() : List.copyOf(referringUrls);
        mobileIssues = mobileIssues == null ? List.of() : List.copyOf(mobileIssues);
    }
}
