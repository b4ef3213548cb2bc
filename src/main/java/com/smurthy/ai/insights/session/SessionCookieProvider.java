package com.smurthy.ai.insights.session;

import com.smurthy.ai.insights.config.SessionProperties;
import com.smurthy.ai.insights.exception.IncompleteSessionException;
import com.smurthy.ai.insights.exception.InsightsException;
import com.smurthy.ai.insights.exception.SessionNotFoundException;
import com.smurthy.ai.insights.exception.SessionStoreLockedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Supplies the Google session cookies of the locally logged-in browser.
 *
 * The cookie set is cached for {@code insights.session.ttl}. This is the only component
 * that touches a browser cookie store.
 */
@Service
public class SessionCookieProvider {

    private static final Logger log = LoggerFactory.getLogger(SessionCookieProvider.class);

    /**
     * Cookies carrying the session secret, in lookup order.
     */
    static final List<String> SESSION_SECRET_NAMES = List.of("SAPISID", "__Secure-3PAPISID", "__Secure-1PAPISID");

    /**
     * Cookies Google's web front end expects on authenticated requests.
     */
    static final List<String> AUTH_COOKIE_NAMES = List.of(
            "SAPISID", "__Secure-1PAPISID", "__Secure-3PAPISID", "__Secure-1PSID", "__Secure-3PSID",
            "SID", "HSID", "SSID", "APISID", "OSID", "NID");

    private final SessionProperties properties;
    private final CookieStoreLocator locator;
    private final List<CookieStoreReader> readers;
    private final Clock clock;
    private final CredentialCache<SessionCookies> cache;

    public SessionCookieProvider(SessionProperties properties,
                                 CookieStoreLocator locator,
                                 List<CookieStoreReader> readers,
                                 Clock clock) {
        this.properties = properties;
        this.locator = locator;
        this.readers = readers;
        this.clock = clock;
        this.cache = new CredentialCache<>("session-cookies", properties.ttl(), clock);
    }

    /**
     * Returns the cached cookie set, reading the configured browser (then the fallbacks) on a miss.
     */
    public SessionCookies getCookies() {
        return cache.get(this::loadFromCandidates);
    }

    /**
     * Returns cookies read from {@code hint} only. A cached set from another browser is replaced.
     */
    public SessionCookies getCookies(BrowserProfile hint) {
        if (hint == null) {
            return getCookies();
        }
        return cache.getIf(cookies -> cookies.source() == hint, () -> loadFrom(hint));
    }

    /**
     * Discards the cached set and reads the cookie store again, whatever the ttl says.
     */
    public SessionCookies refresh() {
        log.info("Refreshing Google session cookies");
        return cache.refresh(this::loadFromCandidates);
    }

    public CredentialCache.State cacheState() {
        return cache.state();
    }

    /**
     * @return the value hashed into the SAPISIDHASH authorization header
     * @throws IncompleteSessionException if none of the secret-bearing cookies is present
     */
    public String sessionSecret(SessionCookies cookies) {
        for (String name : SESSION_SECRET_NAMES) {
            Optional<String> value = cookies.value(name);
            if (value.isPresent()) {
                return value.get();
            }
        }
        throw new IncompleteSessionException(
                "No SAPISID cookie in the " + cookies.source().displayName() + " session", SESSION_SECRET_NAMES);
    }

    /**
     * Builds the {@code Cookie} header: known auth cookies first, then every {@code __Secure-}/{@code __Host-} cookie.
     */
    public String cookieHeader(SessionCookies cookies) {
        Map<String, String> selected = new LinkedHashMap<>();
        for (String name : AUTH_COOKIE_NAMES) {
            cookies.value(name).ifPresent(value -> selected.put(name, value));
        }
        cookies.cookies().keySet().stream()
                .filter(name -> name.startsWith("__Secure-") || name.startsWith("__Host-"))
                .sorted()
                .forEach(name -> cookies.value(name).ifPresent(value -> selected.putIfAbsent(name, value)));

        return selected.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("; "));
    }

    private SessionCookies loadFromCandidates() {
        List<InsightsException> failures = new ArrayList<>();
        for (BrowserProfile candidate : candidates()) {
            try {
                return loadFrom(candidate);
            } catch (SessionNotFoundException | IncompleteSessionException | SessionStoreLockedException e) {
                log.info("No usable session in {}: {}", candidate.displayName(), e.getMessage());
                failures.add(e);
            }
        }
        throw mostRelevant(failures);
    }

    private Set<BrowserProfile> candidates() {
        Set<BrowserProfile> ordered = new LinkedHashSet<>();
        ordered.add(BrowserProfile.fromName(properties.browser()));
        for (String name : properties.fallbackBrowsers()) {
            ordered.add(BrowserProfile.fromName(name));
        }
        return ordered;
    }

    /**
     * Reports the failure the user can act on most directly: a locked store, then a partial login,
     * then "nothing found" with every browser's reason.
     */
    static InsightsException mostRelevant(List<InsightsException> failures) {
        Optional<InsightsException> locked = failures.stream()
                .filter(SessionStoreLockedException.class::isInstance).findFirst();
        if (locked.isPresent()) {
            return locked.get();
        }
        Optional<InsightsException> incomplete = failures.stream()
                .filter(IncompleteSessionException.class::isInstance).findFirst();
        if (incomplete.isPresent()) {
            return incomplete.get();
        }
        String reasons = failures.stream().map(Throwable::getMessage).collect(Collectors.joining("; "));
        return new SessionNotFoundException("No Google session found in any browser. " + reasons);
    }

    SessionCookies loadFrom(BrowserProfile profile) {
        Path store = storeFor(profile);
        CookieStoreReader reader = readers.stream()
                .filter(r -> r.supports(profile))
                .findFirst()
                .orElseThrow(() -> new SessionNotFoundException("No cookie reader for " + profile.displayName()));

        String domain = properties.cookieDomain();
        List<CookieRecord> records = reader.read(profile, store, domain);
        Map<String, CookieRecord> cookies = usableCookies(records, domain, clock.instant());
        if (cookies.isEmpty()) {
            throw new SessionNotFoundException(
                    "No " + domain + " cookies in the " + profile.displayName() + " store; you may not be logged in");
        }

        List<String> missing = properties.requiredCookies().stream()
                .filter(name -> !cookies.containsKey(name))
                .toList();
        if (!missing.isEmpty()) {
            throw new IncompleteSessionException(
                    profile.displayName() + " session is missing required cookies " + missing, missing);
        }

        log.info("Loaded {} Google cookies from {}", cookies.size(), profile.displayName());
        return new SessionCookies(profile, cookies);
    }

    private Path storeFor(BrowserProfile profile) {
        String override = properties.cookieStorePath();
        if (override != null && !override.isBlank()
                && profile == BrowserProfile.fromName(properties.browser())) {
            return Path.of(override);
        }
        return locator.locate(profile).orElseThrow(() -> new SessionNotFoundException(
                "No " + profile.displayName() + " cookie store found on " + locator.platform()));
    }

    /**
     * Drops expired, empty and foreign-domain cookies. When a name appears on several hosts,
     * the broadest domain (shortest host) wins.
     */
    static Map<String, CookieRecord> usableCookies(List<CookieRecord> records, String domain, Instant now) {
        Map<String, CookieRecord> byName = new LinkedHashMap<>();
        for (CookieRecord cookie : records) {
            if (cookie.value() == null || cookie.value().isEmpty() || cookie.isExpired(now)
                    || !matchesDomain(cookie.domain(), domain)) {
                continue;
            }
            byName.merge(cookie.name(), cookie, (current, candidate) ->
                    bareHost(candidate.domain()).length() < bareHost(current.domain()).length() ? candidate : current);
        }
        return byName;
    }

    static boolean matchesDomain(String host, String domain) {
        if (host == null) {
            return false;
        }
        String bare = bareHost(host).toLowerCase(Locale.ROOT);
        String wanted = domain.toLowerCase(Locale.ROOT);
        return bare.equals(wanted) || bare.endsWith("." + wanted);
    }

    private static String bareHost(String host) {
        return host.startsWith(".") ? host.substring(1) : host;
    }
}
