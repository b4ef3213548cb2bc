package com.smurthy.ai.insights.auth;

import java.time.Instant;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The rotating {@code at} form parameter every batchexecute call must carry.
 */
public record AntiForgeryToken(String value, Instant fetchedAt) {

    /**
     * Search Console embeds a fresh token in the body of a rejected request: {@code ["xsrf","<token>"}.
     */
    public static final Pattern XSRF_PATTERN = Pattern.compile("\\[\"xsrf\",\"([^\"]+)\"");

    public static Optional<String> extract(String body) {
        if (body == null) {
            return Optional.empty();
        }
        Matcher matcher = XSRF_PATTERN.matcher(body);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    @Override
    public String toString() {
        // never log the token itself
        return "AntiForgeryToken[fetchedAt=" + fetchedAt + "]";
    }
}
