package com.piiguard.infrastructure.crypto;

/**
 * Thrown when a cryptographic operation fails.
 *
 * <p>Messages never include key material or plaintext.
 */
public class CryptoException extends RuntimeException {

    public CryptoException(String message) {
        super(message);
    }

    public CryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
