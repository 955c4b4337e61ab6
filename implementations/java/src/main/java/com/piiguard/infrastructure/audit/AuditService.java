package com.piiguard.infrastructure.audit;

/**
 * Records security-relevant events: sensitive reads, edit rejections, scope violations
 * and decryption failures. Details never contain plaintext or key material.
 */
public interface AuditService {

    String CATEGORY_SENSITIVE_DATA = "SENSITIVE_DATA";
    String CATEGORY_ACCESS = "ACCESS";
    String CATEGORY_CRYPTO = "CRYPTO";

    void record(String category, String action, String resourceId, String principalId, String detail);
}
