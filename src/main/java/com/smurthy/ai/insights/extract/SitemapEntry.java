package com.smurthy.ai.insights.extract;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A sitemap submitted for a property.
 *
 * @param lastSubmitted  ISO-8601 instant, or the server's own text when it is not a timestamp
 * @param urlCount       URLs submitted across all content types of the sitemap
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SitemapEntry(
        String path,
        String lastSubmitted,
        String lastDownloaded,
        @JsonProperty("isPending") Boolean pending,
        @JsonProperty("isSitemapsIndex") Boolean sitemapsIndex,
        Long warnings,
        Long errors,
        String type,
        Long urlCount
) {
}
