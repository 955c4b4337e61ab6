package com.piiguard.domain.model;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * SHA-256 digest of a case-normalized plaintext, stored in the sidecar column next to
 * each encrypted column so equality lookups work without decryption.
 *
 * <p>An indexing aid, not a security boundary.
 *
 * @param hex 64 lower-case hex characters
 */
public record SearchHash(String hex) {

    private static final Pattern HEX_DIGEST = Pattern.compile("^[0-9a-f]{64}$");

    public SearchHash {
        Objects.requireNonNull(hex, "Search hash must not be null");
        hex = hex.toLowerCase(Locale.ROOT);
        if (!HEX_DIGEST.matcher(hex).matches()) {
            throw new IllegalArgumentException("Search hash must be 64 hex characters");
        }
    }

    @Override
    public String toString() {
        return hex;
    }
}
