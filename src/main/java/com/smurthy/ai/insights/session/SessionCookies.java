package com.smurthy.ai.insights.session;

import java.util.Map;
import java.util.Optional;

/**
 * A validated cookie set and the browser it was read from.
 */
public record SessionCookies(BrowserProfile source, Map<String, CookieRecord> cookies) {

    public SessionCookies {
        cookies = Map.copyOf(cookies);
    }

    public Optional<String> value(String name) {
        CookieRecord cookie = cookies.get(name);
        if (cookie == null || cookie.value() == null || cookie.value().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(cookie.value());
    }

    public int size() {
        return cookies.size();
    }
}
