package com.piiguard.infrastructure.crypto;

/**
 * Thrown when a stored value is not a well-formed {@code iv:tag:ciphertext} triple.
 */
public class MalformedCiphertextException extends CryptoException {

    public MalformedCiphertextException(String message) {
        super(message);
    }

    public MalformedCiphertextException(String message, Throwable cause) {
        super(message, cause);
    }
}
