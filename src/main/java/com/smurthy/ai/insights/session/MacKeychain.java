package com.smurthy.ai.insights.session;

import com.smurthy.ai.insights.exception.SessionNotFoundException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Looks up a Chromium browser's "Safe Storage" password with the macOS {@code security} tool.
 * The first lookup may show a Keychain permission prompt.
 */
final class MacKeychain {

    private static final long LOOKUP_TIMEOUT_SECONDS = 30;

    private MacKeychain() {
    }

    static String safeStoragePassword(BrowserProfile profile) {
        ProcessBuilder builder = new ProcessBuilder(
                "security", "find-generic-password", "-w", "-s", profile.safeStorageService());
        builder.redirectErrorStream(true);
        try {
            Process process = builder.start();
            if (!process.waitFor(LOOKUP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new SessionNotFoundException(
                        "Timed out waiting for the Keychain to release '" + profile.safeStorageService() + "'");
            }
            String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).trim();
            if (process.exitValue() != 0 || output.isEmpty()) {
                throw new SessionNotFoundException(
                        "Keychain entry '" + profile.safeStorageService() + "' is not available: " + output);
            }
            return output;
        } catch (IOException e) {
            throw new SessionNotFoundException("Could not run the macOS security tool: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SessionNotFoundException("Interrupted while reading the Keychain", e);
        }
    }
}
