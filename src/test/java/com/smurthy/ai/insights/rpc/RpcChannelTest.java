package com.smurthy.ai.insights.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.insights.auth.AntiForgeryTokenCache;
import com.smurthy.ai.insights.auth.AuthTokenGenerator;
import com.smurthy.ai.insights.config.RpcProperties;
import com.smurthy.ai.insights.exception.ErrorKind;
import com.smurthy.ai.insights.exception.RpcAuthException;
import com.smurthy.ai.insights.exception.RpcTransportException;
import com.smurthy.ai.insights.session.BrowserProfile;
import com.smurthy.ai.insights.session.CredentialCache;
import com.smurthy.ai.insights.session.SessionCookieProvider;
import com.smurthy.ai.insights.session.SessionCookies;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RpcChannelTest {

    private static final byte[] LIST_SITES_BODY = RpcFixtures.framedBody(
            RpcFixtures.dataFrame("SM7Bqb", List.of(List.of(List.of("https://example.com/", 1)))),
            RpcFixtures.bookkeepingFrame());

    @Mock
    private SessionCookieProvider sessions;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ScriptedTransport transport;
    private AntiForgeryTokenCache antiForgeryTokens;
    private RpcChannel channel;

    @BeforeEach
    void setUp() {
        SessionCookies cookies = new SessionCookies(BrowserProfile.CHROME, Map.of());
        when(sessions.getCookies()).thenReturn(cookies);
        when(sessions.sessionSecret(any())).thenReturn("sapisid-value");
        when(sessions.cookieHeader(any())).thenReturn("SAPISID=sapisid-value; SID=sid");

        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        RpcProperties properties = new RpcProperties("https://search.google.com",
                "/_/SearchConsoleAggReportUi/data/batchexecute", "/search-console", "https://search.google.com",
                "test-agent", Duration.ofSeconds(5), Duration.ofHours(1), "v1", "SM7Bqb");
        transport = new ScriptedTransport();
        antiForgeryTokens = new AntiForgeryTokenCache(properties, clock);
        channel = new RpcChannel(transport, sessions, new AuthTokenGenerator(clock), antiForgeryTokens,
                new RpcFrameReader(objectMapper), objectMapper, properties);
    }

    @Test
    @DisplayName("First call probes for a token, then sends the request with it")
    void testProbeThenCall() {
        // Given
        transport.then(RpcFixtures.antiForgeryRejection("token-1"))
                .then(RpcFixtures.ok(LIST_SITES_BODY));

        // When
        DecodedEnvelope envelope = channel.call(new RpcRequest("SM7Bqb", List.of()));

        // Then
        assertThat(envelope.dataEntry("SM7Bqb")).isPresent();
        List<RpcHttpRequest> sent = transport.requests();
        assertThat(sent).hasSize(2);
        assertThat(sent.get(0).form()).doesNotContainKey("at");
        assertThat(sent.get(1).form()).containsEntry("at", "token-1");

        RpcHttpRequest call = sent.get(1);
        assertThat(call.url())
                .startsWith("https://search.google.com/_/SearchConsoleAggReportUi/data/batchexecute?rpcids=SM7Bqb")
                .contains("&source-path=%2Fsearch-console", "&hl=en", "&_reqid=", "&rt=c");
        assertThat(call.headers())
                .containsEntry("Authorization", new AuthTokenGenerator(Clock.fixed(
                        Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC))
                        .generate("sapisid-value", "https://search.google.com"))
                .containsEntry("Cookie", "SAPISID=sapisid-value; SID=sid")
                .containsEntry("Origin", "https://search.google.com")
                .containsEntry("X-Same-Domain", "1");
        assertThat(call.timeout()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("f.req carries [[[procedureId, argsJson, null, sequenceId]]]")
    void testBatchPayload() throws Exception {
        String payload = channel.batchPayload(new RpcRequest("OLiH4d",
                Arrays.asList("https://example.com/", List.of("2024-04-01", "2024-04-28"), List.of(0), 100)));

        JsonNode call = objectMapper.readTree(payload).get(0).get(0);
        assertThat(call.get(0).asText()).isEqualTo("OLiH4d");
        assertThat(objectMapper.readTree(call.get(1).asText()).get(0).asText()).isEqualTo("https://example.com/");
        assertThat(call.get(2).isNull()).isTrue();
        assertThat(call.get(3).isTextual()).isTrue();
    }

    @Test
    @DisplayName("A rejected token is refreshed once and the call replayed once")
    void testReplayAfterRejection() {
        transport.then(RpcFixtures.antiForgeryRejection("stale"))   // probe
                .then(RpcFixtures.antiForgeryRejection("ignored"))  // call rejected
                .then(RpcFixtures.antiForgeryRejection("fresh"))    // refresh probe
                .then(RpcFixtures.ok(LIST_SITES_BODY));             // replay

        channel.call(new RpcRequest("SM7Bqb", List.of()));

        List<RpcHttpRequest> sent = transport.requests();
        assertThat(sent).hasSize(4);
        assertThat(sent.get(1).form()).containsEntry("at", "stale");
        assertThat(sent.get(3).form()).containsEntry("at", "fresh");
    }

    @Test
    @DisplayName("A second rejection is an RpcAuthError, not another retry")
    void testSecondRejectionFails() {
        transport.then(RpcFixtures.antiForgeryRejection("stale"))
                .then(RpcFixtures.antiForgeryRejection("x"))
                .then(RpcFixtures.antiForgeryRejection("fresh"))
                .then(RpcFixtures.antiForgeryRejection("y"));

        assertThatThrownBy(() -> channel.call(new RpcRequest("SM7Bqb", List.of())))
                .isInstanceOf(RpcAuthException.class)
                .satisfies(e -> assertThat(((RpcAuthException) e).getStatusCode()).isEqualTo(400));
        assertThat(transport.requests()).hasSize(4);
    }

    @Test
    void testForbiddenIsAuthError() {
        transport.then(RpcFixtures.antiForgeryRejection("token"))
                .then(new RpcHttpResponse(403, "denied".getBytes(StandardCharsets.UTF_8)));

        assertThatThrownBy(() -> channel.call(new RpcRequest("SM7Bqb", List.of())))
                .isInstanceOf(RpcAuthException.class);
    }

    @Test
    void testServerErrorIsTransportError() {
        transport.then(RpcFixtures.antiForgeryRejection("token"))
                .then(new RpcHttpResponse(500, "oops".getBytes(StandardCharsets.UTF_8)));

        assertThatThrownBy(() -> channel.call(new RpcRequest("SM7Bqb", List.of())))
                .isInstanceOf(RpcTransportException.class)
                .hasMessageContaining("HTTP 500");
    }

    @Test
    void testRateLimitCarriesHint() {
        transport.then(RpcFixtures.antiForgeryRejection("token"))
                .then(new RpcHttpResponse(429, new byte[0]));

        assertThatThrownBy(() -> channel.call(new RpcRequest("SM7Bqb", List.of())))
                .isInstanceOfSatisfying(RpcTransportException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ErrorKind.RPC_TRANSPORT_ERROR);
                    assertThat(e.remediation()).contains("rate limiting");
                });
    }

    @Test
    @DisplayName("Timeouts propagate as RpcTransportError and keep the cached token")
    void testTimeout() {
        transport.then(RpcFixtures.antiForgeryRejection("token"))
                .thenFail(new SocketTimeoutException("timeout"));

        assertThatThrownBy(() -> channel.call(new RpcRequest("SM7Bqb", List.of()), Duration.ofMillis(200)))
                .isInstanceOf(RpcTransportException.class)
                .hasMessageContaining("timed out after 200 ms");
        assertThat(antiForgeryTokens.getToken(channel).value()).isEqualTo("token");
    }

    @Test
    void testConnectionFailure() {
        transport.thenFail(new UnknownHostException("search.google.com"));

        assertThatThrownBy(() -> channel.call(new RpcRequest("SM7Bqb", List.of())))
                .isInstanceOf(RpcTransportException.class);
    }

    @Test
    @DisplayName("A token fetch that times out is not remembered; the next call fetches again")
    void testTokenFetchTimeoutIsNotCached() {
        transport.thenFail(new SocketTimeoutException("timeout"))
                .then(RpcFixtures.antiForgeryRejection("token-after-timeout"))
                .then(RpcFixtures.ok(LIST_SITES_BODY));

        assertThatThrownBy(() -> channel.call(new RpcRequest("SM7Bqb", List.of())))
                .isInstanceOf(RpcTransportException.class)
                .hasMessageContaining("timed out");
        assertThat(antiForgeryTokens.state()).isEqualTo(CredentialCache.State.EMPTY);

        DecodedEnvelope envelope = channel.call(new RpcRequest("SM7Bqb", List.of()));

        assertThat(envelope.dataEntry("SM7Bqb")).isPresent();
        assertThat(transport.requests()).hasSize(3);
        assertThat(transport.requests().get(2).form()).containsEntry("at", "token-after-timeout");
    }

    @Test
    @DisplayName("The caller's timeout also applies to the token fetch")
    void testTokenFetchUsesCallTimeout() {
        transport.then(RpcFixtures.antiForgeryRejection("token"))
                .then(RpcFixtures.ok(LIST_SITES_BODY));

        channel.call(new RpcRequest("SM7Bqb", List.of()), Duration.ofMillis(750));

        assertThat(transport.requests())
                .extracting(RpcHttpRequest::timeout)
                .containsExactly(Duration.ofMillis(750), Duration.ofMillis(750));
    }
}
