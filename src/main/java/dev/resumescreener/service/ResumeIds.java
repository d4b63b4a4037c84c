package dev.resumescreener.service;

import dev.resumescreener.util.HashUtils;

/**
 * Stable resume identifiers derived from where the source document is stored.
 */
public final class ResumeIds {

    private ResumeIds() {
    }

    /**
     * SHA-1 hex of the trimmed storage key, so the same upload always maps to the same id.
     */
    public static String canonical(String storageKey) {
        if (storageKey == null || storageKey.isBlank()) {
            throw new IllegalArgumentException("Storage key must not be blank");
        }
        return HashUtils.sha1Hex(storageKey.trim());
    }
}
