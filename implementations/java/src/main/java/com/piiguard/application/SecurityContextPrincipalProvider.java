package com.piiguard.application;

import com.piiguard.domain.model.Principal;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Provider for the current {@link Principal} from Spring Security.
 *
 * The authentication filter stores the verified token claims as the
 * {@link Authentication}'s details. Authorities other than {@code ROLE_*} are added as
 * granted permissions.
 */
@Component
@RequiredArgsConstructor
public class SecurityContextPrincipalProvider {

    private static final String ROLE_PREFIX = "ROLE_";

    private final PrincipalFactory principalFactory;

    public Principal getCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()) {
            throw new SecurityException("No authenticated user");
        }

        Map<String, Object> claims = new HashMap<>();
        if (authentication.getDetails() instanceof Map) {
            ((Map<?, ?>) authentication.getDetails()).forEach((key, value) -> {
                if (key != null) {
                    claims.put(key.toString(), value);
                }
            });
        }
        claims.putIfAbsent(PrincipalFactory.CLAIM_SUBJECT, authentication.getName());

        List<String> permissions = authentication.getAuthorities().stream()
            .map(GrantedAuthority::getAuthority)
            .filter(authority -> authority != null && !authority.startsWith(ROLE_PREFIX))
            .collect(Collectors.toList());

        return principalFactory.fromClaims(claims, permissions);
    }
}
