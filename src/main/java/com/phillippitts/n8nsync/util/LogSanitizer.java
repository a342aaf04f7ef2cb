package com.phillippitts.n8nsync.util;

/** Utility for safe logging of remote response bodies and credentials. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters, appending "..." when cut;
     * returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String trimmed = s.strip();
        return trimmed.length() <= max ? trimmed : trimmed.substring(0, max) + "...";
    }

    /**
     * Masks all but the last four characters of a secret.
     */
    public static String mask(String secret) {
        if (secret == null || secret.isEmpty()) {
            return "";
        }
        if (secret.length() <= 4) {
            return "****";
        }
        return "****" + secret.substring(secret.length() - 4);
    }
}
