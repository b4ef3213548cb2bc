package com.smurthy.ai.insights.session;

import java.time.Instant;

/**
 * One cookie as read from a browser store. Immutable once read.
 */
public record CookieRecord(
        String name,
        String value,
        String domain,
        String path,
        boolean secure,
        boolean httpOnly,
        SameSite sameSite,
        Instant expiresAt  // null for session cookies
) {

    public boolean isExpired(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }

    public enum SameSite {
        UNSPECIFIED, NO_RESTRICTION, LAX, STRICT;

        /**
         * Chromium stores -1 (unspecified), 0 (none), 1 (lax), 2 (strict).
         */
        public static SameSite fromChromium(int code) {
            return switch (code) {
                case 0 -> NO_RESTRICTION;
                case 1 -> LAX;
                case 2 -> STRICT;
                default -> UNSPECIFIED;
            };
        }

        /**
         * Firefox stores 0 (none), 1 (lax), 2 (strict); newer profiles use 256 for unset.
         */
        public static SameSite fromFirefox(int code) {
            return switch (code) {
                case 0 -> NO_RESTRICTION;
                case 1 -> LAX;
                case 2 -> STRICT;
                default -> UNSPECIFIED;
            };
        }
    }
}
