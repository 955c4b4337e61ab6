package com.piiguard.infrastructure.crypto;

/**
 * Thrown when GCM tag verification fails: the value was tampered with or was encrypted
 * under a different key.
 */
public class CiphertextAuthenticationException extends CryptoException {

    public CiphertextAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
