package com.smurthy.ai.insights.session;

import java.util.Locale;

/**
 * Browsers whose cookie store can hold a Google session.
 *
 * Directory names are relative to the platform's application data root
 * (~/.config on Linux, ~/Library/Application Support on macOS, %LOCALAPPDATA% or %APPDATA% on Windows).
 */
public enum BrowserProfile {

    CHROME("Chrome", Engine.CHROMIUM, "Chrome Safe Storage",
            "google-chrome", "Google/Chrome", "Google/Chrome/User Data"),
    CHROMIUM("Chromium", Engine.CHROMIUM, "Chromium Safe Storage",
            "chromium", "Chromium", "Chromium/User Data"),
    BRAVE("Brave", Engine.CHROMIUM, "Brave Safe Storage",
            "BraveSoftware/Brave-Browser", "BraveSoftware/Brave-Browser", "BraveSoftware/Brave-Browser/User Data"),
    EDGE("Edge", Engine.CHROMIUM, "Microsoft Edge Safe Storage",
            "microsoft-edge", "Microsoft Edge", "Microsoft/Edge/User Data"),
    FIREFOX("Firefox", Engine.GECKO, null,
            "../.mozilla/firefox", "Firefox/Profiles", "Mozilla/Firefox/Profiles");

    public enum Engine { CHROMIUM, GECKO }

    private final String displayName;
    private final Engine engine;
    private final String safeStorageService;
    private final String linuxDir;
    private final String macDir;
    private final String windowsDir;

    BrowserProfile(String displayName, Engine engine, String safeStorageService,
                   String linuxDir, String macDir, String windowsDir) {
        this.displayName = displayName;
        this.engine = engine;
        this.safeStorageService = safeStorageService;
        this.linuxDir = linuxDir;
        this.macDir = macDir;
        this.windowsDir = windowsDir;
    }

    public String displayName() {
        return displayName;
    }

    public Engine engine() {
        return engine;
    }

    /**
     * macOS Keychain service holding the cookie encryption password (Chromium browsers only).
     */
    public String safeStorageService() {
        return safeStorageService;
    }

    String dataDir(CookieStoreLocator.Platform platform) {
        return switch (platform) {
            case LINUX -> linuxDir;
            case MAC -> macDir;
            case WINDOWS -> windowsDir;
        };
    }

    /**
     * Resolves "chrome", "Brave", "EDGE" etc. to a profile.
     */
    public static BrowserProfile fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Browser name is required");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (BrowserProfile profile : values()) {
            if (profile.name().equals(normalized) || profile.displayName.equalsIgnoreCase(name.trim())) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown browser '" + name + "'. Supported: chrome, chromium, brave, edge, firefox");
    }
}
