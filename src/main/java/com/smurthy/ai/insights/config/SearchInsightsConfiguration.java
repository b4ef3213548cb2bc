package com.smurthy.ai.insights.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.insights.extract.JsonPositionTable;
import com.smurthy.ai.insights.extract.PositionTable;
import com.smurthy.ai.insights.rpc.OkHttpRpcTransport;
import com.smurthy.ai.insights.rpc.RpcTransport;
import com.smurthy.ai.insights.session.ChromiumCookieStoreReader;
import com.smurthy.ai.insights.session.CookieStoreLocator;
import com.smurthy.ai.insights.session.FirefoxCookieStoreReader;
import com.smurthy.ai.insights.tools.SearchConsoleTools;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the session, transport and tool beans.
 */
@Configuration
public class SearchInsightsConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SearchInsightsConfiguration.class);

    /**
     * Default report dates follow the local calendar; the credential caches only read instants.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public CookieStoreLocator cookieStoreLocator() {
        CookieStoreLocator locator = CookieStoreLocator.forCurrentPlatform();
        log.info("Looking for browser cookie stores on {}", locator.platform());
        return locator;
    }

    @Bean
    public ChromiumCookieStoreReader chromiumCookieStoreReader(CookieStoreLocator locator, SessionProperties properties) {
        return ChromiumCookieStoreReader.forPlatform(locator.platform(), properties.safeStoragePassword());
    }

    @Bean
    public FirefoxCookieStoreReader firefoxCookieStoreReader() {
        return new FirefoxCookieStoreReader();
    }

    /**
     * The whole-call timeout is set per request from {@code insights.rpc.timeout}.
     */
    @Bean
    public OkHttpClient okHttpClient(RpcProperties properties) {
        return new OkHttpClient.Builder()
                .connectTimeout(properties.timeout())
                .readTimeout(Duration.ZERO)
                .writeTimeout(Duration.ZERO)
                .followRedirects(false)
                .build();
    }

    @Bean
    public RpcTransport rpcTransport(OkHttpClient okHttpClient) {
        return new OkHttpRpcTransport(okHttpClient);
    }

    @Bean
    public PositionTable positionTable(ObjectMapper objectMapper, RpcProperties properties) {
        return JsonPositionTable.load(objectMapper, properties.positionTableVersion());
    }

    @Bean
    public ToolCallbackProvider searchConsoleToolCallbacks(SearchConsoleTools tools) {
        return MethodToolCallbackProvider.builder()
                .toolObjects(tools)
                .build();
    }
}
