package com.piiguard.infrastructure.audit;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Writes audit events to the application log under the {@code AUDIT} prefix, where the
 * log shipper forwards them to the SIEM. Crypto events are logged at error level.
 *
 * Each event also increments {@code audit.events}, tagged by category and action, so
 * alerting can fire on a spike of denials or decryption failures.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoggingAuditService implements AuditService {

    private final MeterRegistry meterRegistry;

    @Override
    public void record(String category, String action, String resourceId, String principalId, String detail) {
        if (CATEGORY_CRYPTO.equals(category)) {
            log.error("AUDIT category={} action={} resourceId={} principal={} detail={}",
                category, action, resourceId, principalId, detail);
        } else {
            log.info("AUDIT category={} action={} resourceId={} principal={} detail={}",
                category, action, resourceId, principalId, detail);
        }

        meterRegistry.counter("audit.events",
            "category", String.valueOf(category),
            "action", String.valueOf(action)).increment();
    }
}
