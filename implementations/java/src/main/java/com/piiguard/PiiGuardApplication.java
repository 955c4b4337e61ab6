package com.piiguard;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * PII protection and role-scoped access control engine for the HR record system.
 *
 * <ul>
 *   <li><strong>Field-Level Encryption</strong>: AES-256-GCM with a searchable SHA-256 sidecar</li>
 *   <li><strong>Data Scope</strong>: all / department / self row filtering</li>
 *   <li><strong>Field Access</strong>: decrypted, masked or omitted per viewer</li>
 *   <li><strong>Edit Control</strong>: per-role field allow-lists with partial rejection</li>
 * </ul>
 *
 * <p>Embedded by the record-management service, which supplies authenticated principals
 * and stores the encrypted values.
 *
 * @since 1.0.0
 */
@SpringBootApplication
@Slf4j
public class PiiGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(PiiGuardApplication.class, args);
        log.info("PII guard started: field encryption AES-256-GCM, data scope enforcement enabled");
    }
}
