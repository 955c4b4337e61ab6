package com.piiguard.config;

import com.piiguard.infrastructure.crypto.EncryptionKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Loads the field encryption key once at startup.
 *
 * A missing or wrong-length key throws {@link ConfigurationException} here, which
 * aborts context startup. The key is zeroed when the context closes.
 */
@Configuration
@EnableConfigurationProperties(CryptoProperties.class)
@Slf4j
public class CryptoConfiguration {

    @Bean(destroyMethod = "close")
    public EncryptionKey encryptionKey(CryptoProperties properties) {
        EncryptionKey key = EncryptionKey.fromSecret(properties.getKey());
        log.info("Field encryption key loaded ({} bytes, AES-256-GCM)", EncryptionKey.KEY_LENGTH);
        return key;
    }
}
