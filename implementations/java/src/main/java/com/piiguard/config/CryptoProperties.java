package com.piiguard.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Field encryption settings, bound from {@code pii.crypto.*}.
 *
 * <p>{@code key} is supplied through the {@code PII_ENCRYPTION_KEY} environment variable.
 */
@ConfigurationProperties(prefix = "pii.crypto")
@Getter
@Setter
public class CryptoProperties {

    /**
     * 32-character secret, or {@code base64:} followed by 32 Base64-encoded bytes.
     */
    private String key;

    @Override
    public String toString() {
        return "CryptoProperties[key=" + (key == null || key.isBlank() ? "<unset>" : "<redacted>") + "]";
    }
}
