package com.piiguard.domain.model;

import com.piiguard.infrastructure.crypto.MalformedCiphertextException;
import lombok.EqualsAndHashCode;

import java.io.Serializable;
import java.util.HexFormat;

/**
 * Encrypted field value produced by AES-256-GCM.
 *
 * <p>Storage format is {@code iv_hex:tag_hex:ciphertext_hex}. The persistence layer
 * stores that string byte-for-byte; this class is the only place that builds or parses it.
 *
 * <p><strong>Security Guarantees:</strong>
 * <ul>
 *   <li>Immutable - all byte arrays are copied in and out</li>
 *   <li>All three components are always present</li>
 *   <li>Parsing fails closed on any structural anomaly</li>
 *   <li>{@link #toString()} never prints the full ciphertext</li>
 * </ul>
 *
 * @since 1.0.0
 */
@EqualsAndHashCode
public final class EncryptedBlob implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int IV_LENGTH = 16;
    public static final int TAG_LENGTH = 16;

    private static final String SEPARATOR = ":";
    private static final HexFormat HEX = HexFormat.of();

    private final byte[] iv;
    private final byte[] authTag;
    private final byte[] ciphertext;

    /**
     * Creates a blob from its raw components.
     *
     * @param iv 16-byte initialization vector
     * @param authTag 16-byte GCM authentication tag
     * @param ciphertext non-empty ciphertext
     * @throws MalformedCiphertextException if any component has the wrong shape
     */
    public EncryptedBlob(byte[] iv, byte[] authTag, byte[] ciphertext) {
        if (iv == null || iv.length != IV_LENGTH) {
            throw new MalformedCiphertextException("IV must be exactly " + IV_LENGTH + " bytes");
        }
        if (authTag == null || authTag.length != TAG_LENGTH) {
            throw new MalformedCiphertextException("Authentication tag must be exactly " + TAG_LENGTH + " bytes");
        }
        if (ciphertext == null || ciphertext.length == 0) {
            throw new MalformedCiphertextException("Ciphertext must not be empty");
        }
        this.iv = iv.clone();
        this.authTag = authTag.clone();
        this.ciphertext = ciphertext.clone();
    }

    /**
     * Parses the colon-joined hex form.
     *
     * @param serialized {@code iv_hex:tag_hex:ciphertext_hex}
     * @return parsed blob
     * @throws MalformedCiphertextException unless the input has exactly three hex segments
     *         of the expected lengths
     */
    public static EncryptedBlob parse(String serialized) {
        if (serialized == null || serialized.isEmpty()) {
            throw new MalformedCiphertextException("Encrypted value is empty");
        }

        // -1 keeps trailing empty segments so "a:b:" is rejected as malformed
        String[] parts = serialized.split(SEPARATOR, -1);
        if (parts.length != 3) {
            throw new MalformedCiphertextException(
                "Expected 3 segments but found " + parts.length);
        }

        return new EncryptedBlob(
            decodeSegment(parts[0], "IV"),
            decodeSegment(parts[1], "authentication tag"),
            decodeSegment(parts[2], "ciphertext")
        );
    }

    private static byte[] decodeSegment(String segment, String name) {
        try {
            return HEX.parseHex(segment);
        } catch (IllegalArgumentException e) {
            throw new MalformedCiphertextException(name + " segment is not valid hex", e);
        }
    }

    /**
     * @return {@code iv_hex:tag_hex:ciphertext_hex}
     */
    public String serialize() {
        return HEX.formatHex(iv) + SEPARATOR + HEX.formatHex(authTag) + SEPARATOR + HEX.formatHex(ciphertext);
    }

    public byte[] getIv() {
        return iv.clone();
    }

    public byte[] getAuthTag() {
        return authTag.clone();
    }

    public byte[] getCiphertext() {
        return ciphertext.clone();
    }

    /**
     * Safe representation for logs: IV prefix and ciphertext length only.
     */
    @Override
    public String toString() {
        return String.format(
            "EncryptedBlob[iv=%s..., ciphertextLength=%d]",
            HEX.formatHex(iv, 0, 4),
            ciphertext.length
        );
    }
}
