package com.piiguard.infrastructure.crypto;

import com.piiguard.domain.model.EncryptedBlob;

/**
 * Field-level authenticated encryption.
 *
 * <p>Implementations are stateless apart from the process key and safe to call from
 * any number of threads.
 *
 * @since 1.0.0
 */
public interface CryptoVault {

    /**
     * Encrypt a field value under a freshly generated IV.
     *
     * @param plaintext non-empty value to protect
     * @return new blob; two calls with the same plaintext never return equal blobs
     * @throws IllegalArgumentException if plaintext is null or empty
     */
    EncryptedBlob encrypt(String plaintext);

    /**
     * Decrypt and authenticate a blob.
     *
     * @return the exact original plaintext
     * @throws CiphertextAuthenticationException if the tag does not verify
     */
    String decrypt(EncryptedBlob blob);

    /**
     * Decrypt the stored {@code iv_hex:tag_hex:ciphertext_hex} form.
     *
     * @throws MalformedCiphertextException if the value is not a well-formed triple
     * @throws CiphertextAuthenticationException if the tag does not verify
     */
    default String decrypt(String serialized) {
        return decrypt(EncryptedBlob.parse(serialized));
    }

    /**
     * Encrypt straight to the storage format.
     */
    default String encryptToString(String plaintext) {
        return encrypt(plaintext).serialize();
    }
}
