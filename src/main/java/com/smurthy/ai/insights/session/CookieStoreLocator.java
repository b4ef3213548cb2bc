package com.smurthy.ai.insights.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Comparator;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Finds the on-disk cookie database for a browser on the current platform.
 *
 * Chromium browsers: {@code <user data>/Default/Network/Cookies}, falling back to the pre-96 {@code Default/Cookies}.
 * Firefox: the most recently modified {@code <profile>/cookies.sqlite} under the profiles root.
 */
public class CookieStoreLocator {

    private static final Logger log = LoggerFactory.getLogger(CookieStoreLocator.class);

    public enum Platform {
        LINUX, MAC, WINDOWS;

        public static Platform detect(String osName) {
            String os = osName == null ? "" : osName.toLowerCase(Locale.ROOT);
            if (os.contains("win")) {
                return WINDOWS;
            }
            if (os.contains("mac") || os.contains("darwin")) {
                return MAC;
            }
            return LINUX;
        }
    }

    private final Platform platform;
    private final Path home;
    private final Map<String, String> env;

    public CookieStoreLocator(Platform platform, Path home, Map<String, String> env) {
        this.platform = platform;
        this.home = home;
        this.env = env;
    }

    public static CookieStoreLocator forCurrentPlatform() {
        return new CookieStoreLocator(
                Platform.detect(System.getProperty("os.name")),
                Path.of(System.getProperty("user.home")),
                System.getenv());
    }

    public Platform platform() {
        return platform;
    }

    public Optional<Path> locate(BrowserProfile profile) {
        Path root = dataRoot(profile).resolve(profile.dataDir(platform)).normalize();
        Optional<Path> store = profile.engine() == BrowserProfile.Engine.GECKO
                ? newestFirefoxStore(root)
                : chromiumStore(root);
        log.debug("Cookie store for {}: {}", profile.displayName(), store.map(Path::toString).orElse("not found"));
        return store;
    }

    private Path dataRoot(BrowserProfile profile) {
        return switch (platform) {
            case LINUX -> home.resolve(".config");
            case MAC -> home.resolve("Library").resolve("Application Support");
            case WINDOWS -> {
                // Chromium keeps user data under LOCALAPPDATA, Firefox profiles under APPDATA
                String key = profile.engine() == BrowserProfile.Engine.GECKO ? "APPDATA" : "LOCALAPPDATA";
                String dir = env.get(key);
                yield dir != null ? Path.of(dir) : home.resolve("AppData").resolve(
                        profile.engine() == BrowserProfile.Engine.GECKO ? "Roaming" : "Local");
            }
        };
    }

    private Optional<Path> chromiumStore(Path userDataDir) {
        Path network = userDataDir.resolve("Default").resolve("Network").resolve("Cookies");
        if (Files.isRegularFile(network)) {
            return Optional.of(network);
        }
        Path legacy = userDataDir.resolve("Default").resolve("Cookies");
        return Files.isRegularFile(legacy) ? Optional.of(legacy) : Optional.empty();
    }

    private Optional<Path> newestFirefoxStore(Path profilesRoot) {
        if (!Files.isDirectory(profilesRoot)) {
            return Optional.empty();
        }
        try (Stream<Path> profiles = Files.list(profilesRoot)) {
            return profiles
                    .map(dir -> dir.resolve("cookies.sqlite"))
                    .filter(Files::isRegularFile)
                    .max(Comparator.comparing(CookieStoreLocator::lastModified));
        } catch (IOException e) {
            log.warn("Could not list Firefox profiles under {}: {}", profilesRoot, e.getMessage());
            return Optional.empty();
        }
    }

    private static FileTime lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            return FileTime.fromMillis(0);
        }
    }
}
