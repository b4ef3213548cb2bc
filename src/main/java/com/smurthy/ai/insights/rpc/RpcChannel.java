package com.smurthy.ai.insights.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.insights.auth.AntiForgeryToken;
import com.smurthy.ai.insights.auth.AntiForgeryTokenCache;
import com.smurthy.ai.insights.auth.AuthTokenGenerator;
import com.smurthy.ai.insights.config.RpcProperties;
import com.smurthy.ai.insights.exception.RpcAuthException;
import com.smurthy.ai.insights.exception.RpcTransportException;
import com.smurthy.ai.insights.session.SessionCookieProvider;
import com.smurthy.ai.insights.session.SessionCookies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Client for the Search Console batchexecute endpoint.
 *
 * Each call sends one procedure in one batch. A call whose anti-forgery token is rejected
 * is replayed exactly once with a refreshed token; nothing else is retried.
 */
@Component
public class RpcChannel {

    private static final Logger log = LoggerFactory.getLogger(RpcChannel.class);

    static final int ANTI_FORGERY_REJECTION_STATUS = 400;
    private static final String SEQUENCE_ID = "generic";

    private final RpcTransport transport;
    private final SessionCookieProvider sessions;
    private final AuthTokenGenerator authTokens;
    private final AntiForgeryTokenCache antiForgeryTokens;
    private final RpcFrameReader frameReader;
    private final ObjectMapper objectMapper;
    private final RpcProperties properties;
    private final AtomicInteger requestCounter = new AtomicInteger();

    public RpcChannel(RpcTransport transport,
                      SessionCookieProvider sessions,
                      AuthTokenGenerator authTokens,
                      AntiForgeryTokenCache antiForgeryTokens,
                      RpcFrameReader frameReader,
                      ObjectMapper objectMapper,
                      RpcProperties properties) {
        this.transport = transport;
        this.sessions = sessions;
        this.authTokens = authTokens;
        this.antiForgeryTokens = antiForgeryTokens;
        this.frameReader = frameReader;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public DecodedEnvelope call(RpcRequest request) {
        return call(request, properties.timeout());
    }

    public DecodedEnvelope call(RpcRequest request, Duration timeout) {
        SessionCookies cookies = sessions.getCookies();
        AntiForgeryToken token = antiForgeryTokens.getToken(this, timeout);

        RpcHttpResponse response = exchange(request, cookies, token.value(), timeout);
        if (isAntiForgeryRejection(response)) {
            log.info("Anti-forgery token rejected for {}, refreshing and replaying once", request.procedureId());
            token = antiForgeryTokens.refreshAfterRejection(this, token, timeout);
            response = exchange(request, cookies, token.value(), timeout);
            if (isAntiForgeryRejection(response)) {
                throw new RpcAuthException("Search Console rejected a freshly fetched anti-forgery token for "
                        + request.procedureId(), response.statusCode());
            }
        }

        checkStatus(response, request.procedureId());
        DecodedEnvelope envelope = frameReader.readEnvelope(response.body());
        log.debug("{} returned {} envelope entries", request.procedureId(), envelope.entries().size());
        return envelope;
    }

    /**
     * Sends a request without an anti-forgery token. The server answers with a rejection whose body
     * carries a fresh token.
     *
     * @return the raw response body
     */
    public String probe() {
        return probe(properties.timeout());
    }

    public String probe(Duration timeout) {
        SessionCookies cookies = sessions.getCookies();
        RpcRequest request = new RpcRequest(properties.probeProcedureId(), List.of());
        RpcHttpResponse response = exchange(request, cookies, null, timeout);
        if (response.statusCode() == 401 || response.statusCode() == 403) {
            throw new RpcAuthException("Search Console refused the session while fetching an anti-forgery token (HTTP "
                    + response.statusCode() + ")", response.statusCode());
        }
        return response.bodyAsString();
    }

    static boolean isAntiForgeryRejection(RpcHttpResponse response) {
        return response.statusCode() == ANTI_FORGERY_REJECTION_STATUS
                && AntiForgeryToken.XSRF_PATTERN.matcher(response.bodyAsString()).find();
    }

    private RpcHttpResponse exchange(RpcRequest request, SessionCookies cookies, String antiForgeryToken, Duration timeout) {
        RpcHttpRequest httpRequest = buildHttpRequest(request, cookies, antiForgeryToken, timeout);
        try {
            return transport.execute(httpRequest);
        } catch (InterruptedIOException e) {
            throw new RpcTransportException("Search Console call " + request.procedureId() + " timed out after "
                    + timeout.toMillis() + " ms", e);
        } catch (IOException e) {
            throw new RpcTransportException("Search Console call " + request.procedureId() + " failed: "
                    + e.getMessage(), e);
        }
    }

    RpcHttpRequest buildHttpRequest(RpcRequest request, SessionCookies cookies, String antiForgeryToken, Duration timeout) {
        String origin = properties.origin();

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", authTokens.generate(sessions.sessionSecret(cookies), origin));
        headers.put("Cookie", sessions.cookieHeader(cookies));
        headers.put("Origin", origin);
        headers.put("X-Origin", origin);
        headers.put("Referer", origin + "/");
        headers.put("User-Agent", properties.userAgent());
        headers.put("X-Same-Domain", "1");
        headers.put("X-Goog-AuthUser", "0");

        Map<String, String> form = new LinkedHashMap<>();
        form.put("f.req", batchPayload(request));
        if (antiForgeryToken != null) {
            form.put("at", antiForgeryToken);
        }

        return new RpcHttpRequest(url(request.procedureId()), headers, form, timeout);
    }

    /**
     * {@code [[[procedureId, argsAsJsonString, null, sequenceId]]]}
     */
    String batchPayload(RpcRequest request) {
        try {
            String args = objectMapper.writeValueAsString(request.args());
            List<Object> call = Arrays.asList(request.procedureId(), args, null, SEQUENCE_ID);
            return objectMapper.writeValueAsString(List.of(List.of(call)));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Arguments of " + request.procedureId() + " are not serializable", e);
        }
    }

    private String url(String procedureId) {
        int reqId = 100_000 * requestCounter.incrementAndGet() + 1_234;
        return properties.baseUrl() + properties.batchExecutePath()
                + "?rpcids=" + encode(procedureId)
                + "&source-path=" + encode(properties.sourcePath())
                + "&hl=en"
                + "&_reqid=" + reqId
                + "&rt=c";
    }

    private static void checkStatus(RpcHttpResponse response, String procedureId) {
        int status = response.statusCode();
        if (response.isSuccessful()) {
            return;
        }
        if (status == 401 || status == 403) {
            throw new RpcAuthException("Search Console denied " + procedureId + " (HTTP " + status + ")", status);
        }
        if (status == 429) {
            throw new RpcTransportException("Search Console rate-limited " + procedureId + " (HTTP 429)",
                    "Google is rate limiting requests. Wait a minute before retrying.");
        }
        String body = response.bodyAsString();
        throw new RpcTransportException("Search Console returned HTTP " + status + " for " + procedureId + ": "
                + (body.length() > 200 ? body.substring(0, 200) : body));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
