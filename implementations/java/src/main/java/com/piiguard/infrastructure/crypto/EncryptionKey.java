package com.piiguard.infrastructure.crypto;

import com.piiguard.config.ConfigurationException;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import javax.security.auth.DestroyFailedException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

/**
 * Process-wide AES-256 key, loaded once at startup.
 *
 * <p>The configured secret is either the raw 32-character value or {@code base64:}
 * followed by the Base64 encoding of 32 bytes. Anything else is a
 * {@link ConfigurationException}.
 *
 * <p>Key bytes never appear in logs, exception messages or {@link #toString()}. A single
 * {@link SecretKeySpec} is built at load time and the decoded secret is zeroed straight
 * away, so the spec holds the only copy. {@link #close()} destroys that spec where the JDK
 * supports it; on JDK 17 {@code SecretKeySpec} cannot be destroyed, and its internal copy
 * (plus any key schedule the cipher provider caches) stays on the heap until collected.
 * The key is unusable after {@link #close()}. Rotation requires a restart.
 *
 * @since 1.0.0
 */
@Slf4j
public final class EncryptionKey implements AutoCloseable {

    public static final int KEY_LENGTH = 32;

    private static final String BASE64_PREFIX = "base64:";
    private static final String ALGORITHM = "AES";

    private final SecretKeySpec secretKey;
    private volatile boolean destroyed;

    private EncryptionKey(byte[] keyBytes) {
        try {
            this.secretKey = new SecretKeySpec(keyBytes, ALGORITHM);
        } finally {
            Arrays.fill(keyBytes, (byte) 0);
        }
    }

    /**
     * Builds the key from its configured secret.
     *
     * @throws ConfigurationException if the secret is missing, undecodable or not 32 bytes
     */
    public static EncryptionKey fromSecret(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new ConfigurationException("Encryption key is not configured");
        }

        byte[] bytes;
        if (secret.startsWith(BASE64_PREFIX)) {
            try {
                bytes = Base64.getDecoder().decode(secret.substring(BASE64_PREFIX.length()));
            } catch (IllegalArgumentException e) {
                // cause omitted: its message can echo part of the secret
                throw new ConfigurationException("Encryption key is not valid Base64");
            }
        } else {
            bytes = secret.getBytes(StandardCharsets.UTF_8);
        }

        if (bytes.length != KEY_LENGTH) {
            int length = bytes.length;
            Arrays.fill(bytes, (byte) 0);
            throw new ConfigurationException(
                "Encryption key must be exactly " + KEY_LENGTH + " bytes but was " + length);
        }

        return new EncryptionKey(bytes);
    }

    /**
     * @return the shared AES key; callers must not keep it beyond one cipher operation
     * @throws IllegalStateException after {@link #close()}
     */
    SecretKey secretKey() {
        if (destroyed) {
            throw new IllegalStateException("Encryption key has been destroyed");
        }
        return secretKey;
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public void close() {
        if (destroyed) {
            return;
        }
        destroyed = true;
        try {
            secretKey.destroy();
        } catch (DestroyFailedException e) {
            log.debug("Key spec cannot be destroyed on this JDK, released to the garbage collector");
        }
    }

    @Override
    public String toString() {
        return "EncryptionKey[AES-256, REDACTED]";
    }
}
