package com.smurthy.ai.insights.session;

import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Instant;
import java.util.List;

/**
 * Reads {@code moz_cookies} from a Firefox profile. Values are stored in plain text.
 */
public class FirefoxCookieStoreReader extends SqliteCookieStoreReader {

    // Anything larger is a millisecond timestamp (some Firefox versions write those)
    private static final long MILLIS_THRESHOLD = 100_000_000_000L;

    private static final String COOKIE_QUERY = """
            SELECT host, name, value, path, expiry, isSecure, isHttpOnly, sameSite
            FROM moz_cookies
            WHERE host = ? OR host LIKE ?
            """;

    @Override
    public boolean supports(BrowserProfile profile) {
        return profile.engine() == BrowserProfile.Engine.GECKO;
    }

    @Override
    protected List<CookieRecord> query(JdbcTemplate jdbcTemplate, BrowserProfile profile, String domain) {
        return jdbcTemplate.query(COOKIE_QUERY, (rs, rowNum) -> new CookieRecord(
                rs.getString("name"),
                rs.getString("value"),
                rs.getString("host"),
                rs.getString("path"),
                rs.getInt("isSecure") != 0,
                rs.getInt("isHttpOnly") != 0,
                CookieRecord.SameSite.fromFirefox(rs.getInt("sameSite")),
                fromExpiry(rs.getLong("expiry"))
        ), domain, subdomainPattern(domain));
    }

    static Instant fromExpiry(long expiry) {
        if (expiry <= 0) {
            return null;
        }
        return expiry > MILLIS_THRESHOLD ? Instant.ofEpochMilli(expiry) : Instant.ofEpochSecond(expiry);
    }
}
