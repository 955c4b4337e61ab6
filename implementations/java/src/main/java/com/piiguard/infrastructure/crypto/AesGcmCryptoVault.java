package com.piiguard.infrastructure.crypto;

import com.piiguard.domain.model.EncryptedBlob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;

/**
 * AES-256-GCM field encryption under a single process key.
 *
 * Security properties:
 * - Fresh random 128-bit IV per encryption, so equal plaintexts never share ciphertext
 * - 128-bit authentication tag (integrity + confidentiality)
 * - Tag failures surface as {@link CiphertextAuthenticationException}, never as a value
 *
 * The 16-byte IV matches the values already stored by the HR application.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AesGcmCryptoVault implements CryptoVault {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_TAG_LENGTH = 128; // bits

    private final EncryptionKey encryptionKey;

    private final SecureRandom secureRandom = new SecureRandom();

    @Override
    public EncryptedBlob encrypt(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            throw new IllegalArgumentException("Plaintext must be a non-empty string");
        }

        byte[] iv = new byte[EncryptedBlob.IV_LENGTH];
        secureRandom.nextBytes(iv);

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, encryptionKey.secretKey(), new GCMParameterSpec(GCM_TAG_LENGTH, iv));

            // GCM produces ciphertext || auth_tag
            byte[] ciphertextWithTag = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            int ciphertextLength = ciphertextWithTag.length - EncryptedBlob.TAG_LENGTH;
            byte[] ciphertext = new byte[ciphertextLength];
            byte[] authTag = new byte[EncryptedBlob.TAG_LENGTH];

            System.arraycopy(ciphertextWithTag, 0, ciphertext, 0, ciphertextLength);
            System.arraycopy(ciphertextWithTag, ciphertextLength, authTag, 0, authTag.length);

            log.debug("Encrypted {} bytes", ciphertextLength);

            return new EncryptedBlob(iv, authTag, ciphertext);

        } catch (GeneralSecurityException e) {
            log.error("Encryption failed", e);
            throw new CryptoException("Failed to encrypt data", e);
        }
    }

    @Override
    public String decrypt(EncryptedBlob blob) {
        if (blob == null) {
            throw new MalformedCiphertextException("Encrypted value is missing");
        }

        byte[] ciphertext = blob.getCiphertext();
        byte[] authTag = blob.getAuthTag();

        byte[] ciphertextWithTag = ByteBuffer.allocate(ciphertext.length + authTag.length)
            .put(ciphertext)
            .put(authTag)
            .array();

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, encryptionKey.secretKey(), new GCMParameterSpec(GCM_TAG_LENGTH, blob.getIv()));

            byte[] plaintext = cipher.doFinal(ciphertextWithTag);

            log.debug("Decrypted {} bytes", plaintext.length);

            return new String(plaintext, StandardCharsets.UTF_8);

        } catch (AEADBadTagException e) {
            log.error("Decryption failed: authentication tag mismatch for {}", blob);
            throw new CiphertextAuthenticationException(
                "Encrypted value failed authentication (tampered or wrong key)", e);
        } catch (GeneralSecurityException e) {
            log.error("Decryption failed for {}", blob, e);
            throw new CryptoException("Failed to decrypt data", e);
        }
    }
}
