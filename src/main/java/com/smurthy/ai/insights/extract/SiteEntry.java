package com.smurthy.ai.insights.extract;

/**
 * A Search Console property the signed-in account can see.
 */
public record SiteEntry(String siteUrl, String permissionLevel) {
}
