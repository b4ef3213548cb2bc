package com.smurthy.ai.insights.auth;

import com.smurthy.ai.insights.config.RpcProperties;
import com.smurthy.ai.insights.exception.AntiForgeryFetchFailedException;
import com.smurthy.ai.insights.exception.RpcTransportException;
import com.smurthy.ai.insights.rpc.RpcChannel;
import com.smurthy.ai.insights.session.CredentialCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Caches the anti-forgery token and fetches a new one with a token-less probe request.
 * A probe that fails in transport leaves the cache untouched.
 */
@Component
public class AntiForgeryTokenCache {

    private static final Logger log = LoggerFactory.getLogger(AntiForgeryTokenCache.class);

    private final CredentialCache<AntiForgeryToken> cache;
    private final Clock clock;

    public AntiForgeryTokenCache(RpcProperties properties, Clock clock) {
        this.cache = new CredentialCache<>("anti-forgery-token", properties.antiForgeryTtl(), clock,
                e -> e instanceof RpcTransportException);
        this.clock = clock;
    }

    public AntiForgeryToken getToken(RpcChannel channel) {
        return getToken(channel, null);
    }

    /**
     * @param timeout probe timeout, or null for the configured default
     */
    public AntiForgeryToken getToken(RpcChannel channel, Duration timeout) {
        return cache.get(() -> fetch(channel, timeout));
    }

    /**
     * Called after the server rejected {@code rejected}. Fetches at most once: if a concurrent caller
     * already replaced the rejected token, that newer token is returned instead.
     */
    public AntiForgeryToken refreshAfterRejection(RpcChannel channel, AntiForgeryToken rejected) {
        return refreshAfterRejection(channel, rejected, null);
    }

    public AntiForgeryToken refreshAfterRejection(RpcChannel channel, AntiForgeryToken rejected, Duration timeout) {
        return cache.refreshIfCurrent(rejected, () -> fetch(channel, timeout));
    }

    public void invalidate() {
        cache.invalidate();
    }

    public CredentialCache.State state() {
        return cache.state();
    }

    private AntiForgeryToken fetch(RpcChannel channel, Duration timeout) {
        String body = timeout == null ? channel.probe() : channel.probe(timeout);
        String value = AntiForgeryToken.extract(body).orElseThrow(() -> new AntiForgeryFetchFailedException(
                "Search Console probe response did not contain an anti-forgery token"));
        log.info("Fetched a new anti-forgery token");
        return new AntiForgeryToken(value, clock.instant());
    }
}
