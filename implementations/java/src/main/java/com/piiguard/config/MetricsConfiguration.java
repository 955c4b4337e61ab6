package com.piiguard.config;

import com.piiguard.infrastructure.security.EditDecision;
import com.piiguard.infrastructure.security.QueryFilter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

/**
 * Timing for the crypto and policy hot paths.
 *
 * Tags carry method names and outcomes only. No field values, identities or key
 * material end up in metrics.
 */
@Configuration
public class MetricsConfiguration {

    /**
     * Times every {@code CryptoVault} call.
     */
    @Aspect
    @Component
    public static class CryptoPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public CryptoPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.piiguard.infrastructure.crypto.CryptoVault.*(..))")
        public Object timeCryptoOperation(ProceedingJoinPoint joinPoint) throws Throwable {
            Timer.Sample sample = Timer.start(meterRegistry);
            String outcome = "failure";
            try {
                Object result = joinPoint.proceed();
                outcome = "success";
                return result;
            } finally {
                sample.stop(Timer.builder("crypto.operation")
                    .tag("method", joinPoint.getSignature().getName())
                    .tag("outcome", outcome)
                    .description("Field encryption and decryption timing")
                    .register(meterRegistry));
            }
        }
    }

    /**
     * Times scope resolution and edit decisions, tagged with whether access was narrowed.
     */
    @Aspect
    @Component
    public static class AuthorizationPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public AuthorizationPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.piiguard.infrastructure.security.DataScopeResolver.resolveFilter(..))"
            + " || execution(* com.piiguard.infrastructure.security.FieldAccessController.canEditFields(..))")
        public Object timeAuthorization(ProceedingJoinPoint joinPoint) throws Throwable {
            Timer.Sample sample = Timer.start(meterRegistry);
            String outcome = "error";
            try {
                Object result = joinPoint.proceed();
                outcome = outcomeOf(result);
                return result;
            } finally {
                sample.stop(Timer.builder("security.authorization")
                    .tag("method", joinPoint.getSignature().getName())
                    .tag("outcome", outcome)
                    .description("Authorization decision timing")
                    .register(meterRegistry));
            }
        }

        private static String outcomeOf(Object result) {
            if (result instanceof QueryFilter) {
                QueryFilter filter = (QueryFilter) result;
                if (filter.denyAll()) {
                    return "denied";
                }
                return filter.getRejectedDepartmentId().isPresent() ? "narrowed" : "granted";
            }
            if (result instanceof EditDecision) {
                EditDecision decision = (EditDecision) result;
                if (decision.editable().isEmpty() && !decision.rejected().isEmpty()) {
                    return "denied";
                }
                return decision.rejected().isEmpty() ? "granted" : "narrowed";
            }
            return "granted";
        }
    }
}
