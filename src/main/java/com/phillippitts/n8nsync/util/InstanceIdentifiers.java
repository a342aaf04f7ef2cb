package com.phillippitts.n8nsync.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Derives the per-instance subdirectory name so that several n8n instances can share one
 * workflows root without their files colliding.
 */
public final class InstanceIdentifiers {

    private InstanceIdentifiers() {
    }

    /**
     * Builds a readable slug from a host URL.
     *
     * <pre>
     * http://localhost:5678        -> local_5678
     * https://acme.app.n8n.cloud   -> acme_cloud
     * https://prod.example.com     -> prod_example
     * https://n8n.internal.io      -> n8n_internal
     * </pre>
     */
    public static String hostSlug(String host) {
        String clean = host == null ? "" : host.trim()
                .replaceFirst("^https?://", "")
                .replaceFirst("/+$", "");

        if (clean.startsWith("localhost:")) {
            return "local_" + clean.substring("localhost:".length());
        }

        clean = clean
                .replaceFirst("\\.app\\.n8n\\.cloud$", "_cloud")
                .replaceFirst("\\.example\\.com$", "_example")
                .replaceFirst("\\.(com|io|net|org)$", "");

        return clean.replaceAll("[.\\-:]", "_").toLowerCase(Locale.ROOT);
    }

    /**
     * Host slug plus the first six hex characters of the API key's SHA-256, used when no
     * identifier is configured.
     */
    public static String fallbackIdentifier(String host, String apiKey) {
        String key = apiKey == null ? "" : apiKey;
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(key.getBytes(StandardCharsets.UTF_8));
            return hostSlug(host) + "_" + HexFormat.of().formatHex(digest).substring(0, 6);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
