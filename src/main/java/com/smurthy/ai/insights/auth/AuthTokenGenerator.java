package com.smurthy.ai.insights.auth;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;

/**
 * Builds the {@code Authorization: SAPISIDHASH <ts>_<sha1>} header Google's web front ends accept
 * in place of an OAuth token.
 */
@Component
public class AuthTokenGenerator {

    private final Clock clock;

    public AuthTokenGenerator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Generates a header value for the current second.
     */
    public String generate(String sessionSecret, String origin) {
        return generate(sessionSecret, clock.instant().getEpochSecond(), origin);
    }

    /**
     * Pure form: the same inputs always give the same header.
     *
     * @param timestampSeconds Unix time in seconds
     */
    public String generate(String sessionSecret, long timestampSeconds, String origin) {
        if (sessionSecret == null || sessionSecret.isEmpty()) {
            throw new IllegalArgumentException("Session secret is required");
        }
        String input = timestampSeconds + " " + sessionSecret + " " + origin;
        return "SAPISIDHASH " + timestampSeconds + "_" + sha1Hex(input);
    }

    static String sha1Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 is not available", e);
        }
    }
}
