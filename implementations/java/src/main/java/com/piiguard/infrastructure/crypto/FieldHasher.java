package com.piiguard.infrastructure.crypto;

import com.piiguard.domain.model.SearchHash;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Deterministic SHA-256 hash for the searchable sidecar column of each encrypted field.
 *
 * <p>Input is lower-cased with {@link Locale#ROOT} and not trimmed, so the digest matches
 * values already stored by the HR application.
 */
@Component
public class FieldHasher {

    private static final String ALGORITHM = "SHA-256";

    public SearchHash hash(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            throw new IllegalArgumentException("Data must be a non-empty string");
        }

        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            byte[] hash = digest.digest(plaintext.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8));
            return new SearchHash(HexFormat.of().formatHex(hash));
        } catch (NoSuchAlgorithmException e) {
            throw new CryptoException("SHA-256 not available", e);
        }
    }

    /**
     * Equality lookup against a stored sidecar value. Null or empty input never matches.
     */
    public boolean matches(String plaintext, SearchHash stored) {
        if (plaintext == null || plaintext.isEmpty() || stored == null) {
            return false;
        }
        return MessageDigest.isEqual(
            hash(plaintext).hex().getBytes(StandardCharsets.US_ASCII),
            stored.hex().getBytes(StandardCharsets.US_ASCII));
    }
}
