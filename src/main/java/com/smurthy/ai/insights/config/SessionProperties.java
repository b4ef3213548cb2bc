package com.smurthy.ai.insights.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

/**
 * Where to find the Google session and how long to trust it.
 */
@ConfigurationProperties(prefix = "insights.session")
public record SessionProperties(
        @DefaultValue("chrome") String browser,
        @DefaultValue({"chrome", "chromium", "brave", "edge", "firefox"}) List<String> fallbackBrowsers,
        String cookieStorePath,
        @DefaultValue("5m") Duration ttl,
        @DefaultValue({"SID", "HSID", "SSID", "APISID", "SAPISID"}) List<String> requiredCookies,
        @DefaultValue("google.com") String cookieDomain,
        String safeStoragePassword
) {
}
