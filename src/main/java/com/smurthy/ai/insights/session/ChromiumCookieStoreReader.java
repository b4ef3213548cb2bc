package com.smurthy.ai.insights.session;

import com.smurthy.ai.insights.exception.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Instant;
import java.util.List;
import java.util.function.Function;

/**
 * Reads the {@code cookies} table of Chrome, Chromium, Brave and Edge profiles.
 */
public class ChromiumCookieStoreReader extends SqliteCookieStoreReader {

    private static final Logger log = LoggerFactory.getLogger(ChromiumCookieStoreReader.class);

    // Seconds between 1601-01-01 (Windows/WebKit epoch) and 1970-01-01
    static final long WEBKIT_EPOCH_OFFSET_SECONDS = 11_644_473_600L;

    private static final String COOKIE_QUERY = """
            SELECT host_key, name, value, encrypted_value, path, expires_utc, is_secure, is_httponly, samesite
            FROM cookies
            WHERE host_key = ? OR host_key LIKE ?
            """;

    private final Function<BrowserProfile, ChromiumCookieDecryptor> decryptors;

    public ChromiumCookieStoreReader(Function<BrowserProfile, ChromiumCookieDecryptor> decryptors) {
        this.decryptors = decryptors;
    }

    /**
     * Builds a reader that derives keys the way the browser does on {@code platform}.
     *
     * @param safeStoragePassword Linux keyring password for v11 values; on macOS, overrides the Keychain lookup
     */
    public static ChromiumCookieStoreReader forPlatform(CookieStoreLocator.Platform platform, String safeStoragePassword) {
        return new ChromiumCookieStoreReader(profile -> switch (platform) {
            case LINUX -> ChromiumCookieDecryptor.linux(safeStoragePassword);
            case MAC -> ChromiumCookieDecryptor.mac(
                    hasText(safeStoragePassword) ? safeStoragePassword : MacKeychain.safeStoragePassword(profile));
            case WINDOWS -> throw new SessionNotFoundException(
                    profile.displayName() + " cookies on Windows are protected by DPAPI, which is not supported. "
                            + "Use Firefox, or run the server on macOS or Linux.");
        });
    }

    @Override
    public boolean supports(BrowserProfile profile) {
        return profile.engine() == BrowserProfile.Engine.CHROMIUM;
    }

    @Override
    protected List<CookieRecord> query(JdbcTemplate jdbcTemplate, BrowserProfile profile, String domain) {
        ChromiumCookieDecryptor decryptor = decryptors.apply(profile);
        int metaVersion = metaVersion(jdbcTemplate);

        return jdbcTemplate.query(COOKIE_QUERY, (rs, rowNum) -> {
            String value = rs.getString("value");
            byte[] encrypted = rs.getBytes("encrypted_value");
            if ((value == null || value.isEmpty()) && encrypted != null && encrypted.length > 0) {
                value = decryptor.decrypt(encrypted, metaVersion);
            }
            return new CookieRecord(
                    rs.getString("name"),
                    value,
                    rs.getString("host_key"),
                    rs.getString("path"),
                    rs.getInt("is_secure") != 0,
                    rs.getInt("is_httponly") != 0,
                    CookieRecord.SameSite.fromChromium(rs.getInt("samesite")),
                    fromWebKitMicros(rs.getLong("expires_utc")));
        }, domain, subdomainPattern(domain));
    }

    /**
     * Chromium stores expiry as microseconds since 1601-01-01; 0 marks a session cookie.
     */
    static Instant fromWebKitMicros(long micros) {
        if (micros <= 0) {
            return null;
        }
        long epochMicros = micros - WEBKIT_EPOCH_OFFSET_SECONDS * 1_000_000L;
        return Instant.ofEpochSecond(Math.floorDiv(epochMicros, 1_000_000L), Math.floorMod(epochMicros, 1_000_000L) * 1_000L);
    }

    private static int metaVersion(JdbcTemplate jdbcTemplate) {
        try {
            String version = jdbcTemplate.queryForObject("SELECT value FROM meta WHERE key = 'version'", String.class);
            return version == null ? 0 : Integer.parseInt(version.trim());
        } catch (DataAccessException | NumberFormatException e) {
            log.debug("No usable meta version in cookie store, assuming legacy layout: {}", e.getMessage());
            return 0;
        }
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
