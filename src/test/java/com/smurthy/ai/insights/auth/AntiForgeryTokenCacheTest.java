package com.smurthy.ai.insights.auth;

import com.smurthy.ai.insights.config.RpcProperties;
import com.smurthy.ai.insights.exception.AntiForgeryFetchFailedException;
import com.smurthy.ai.insights.rpc.RpcChannel;
import com.smurthy.ai.insights.session.CredentialCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AntiForgeryTokenCacheTest {

    @Mock
    private RpcChannel channel;

    private AntiForgeryTokenCache cache;

    @BeforeEach
    void setUp() {
        RpcProperties properties = new RpcProperties("https://search.google.com", "/batchexecute", "/search-console",
                "https://search.google.com", "test-agent", Duration.ofSeconds(5), Duration.ofHours(1), "v1", "SM7Bqb");
        cache = new AntiForgeryTokenCache(properties, Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should extract the token from the probe response and cache it")
    void testFetchAndCache() {
        // Given
        when(channel.probe()).thenReturn(")]}'\n\n[[\"er\",null,null,null,null,400,null,null,null,3],[\"xsrf\",\"AFoagUtoken1\",null]]");

        // When
        AntiForgeryToken first = cache.getToken(channel);
        AntiForgeryToken second = cache.getToken(channel);

        // Then
        assertThat(first.value()).isEqualTo("AFoagUtoken1");
        assertThat(second).isSameAs(first);
        verify(channel, times(1)).probe();
    }

    @Test
    @DisplayName("Refresh after rejection probes exactly once")
    void testRefreshAfterRejection() {
        when(channel.probe()).thenReturn("[\"xsrf\",\"old\"", "[\"xsrf\",\"new\"");
        AntiForgeryToken rejected = cache.getToken(channel);

        AntiForgeryToken refreshed = cache.refreshAfterRejection(channel, rejected);

        assertThat(refreshed.value()).isEqualTo("new");
        verify(channel, times(2)).probe();
    }

    @Test
    @DisplayName("A caller holding an already replaced token gets the newer token without another probe")
    void testRefreshIsNotRepeatedForStaleToken() {
        when(channel.probe()).thenReturn("[\"xsrf\",\"old\"", "[\"xsrf\",\"new\"");
        AntiForgeryToken rejected = cache.getToken(channel);

        // Given two callers that both saw the same rejection
        AntiForgeryToken fromFirst = cache.refreshAfterRejection(channel, rejected);
        AntiForgeryToken fromSecond = cache.refreshAfterRejection(channel, rejected);

        // Then only one refresh probe was sent
        assertThat(fromSecond).isEqualTo(fromFirst);
        verify(channel, times(2)).probe();
    }

    @Test
    @DisplayName("Should fail with AntiForgeryFetchFailed when the probe has no token")
    void testMissingToken() {
        when(channel.probe()).thenReturn("<html>sign in</html>");

        assertThatThrownBy(() -> cache.getToken(channel))
                .isInstanceOf(AntiForgeryFetchFailedException.class);
        assertThat(cache.state()).isEqualTo(CredentialCache.State.INVALID);
    }

    @Test
    void testInvalidateForcesNewProbe() {
        when(channel.probe()).thenReturn("[\"xsrf\",\"one\"", "[\"xsrf\",\"two\"");
        cache.getToken(channel);

        cache.invalidate();

        assertThat(cache.getToken(channel).value()).isEqualTo("two");
    }
}
