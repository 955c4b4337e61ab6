package com.piiguard.application;

import com.piiguard.domain.model.DataScope;
import com.piiguard.domain.model.Principal;
import com.piiguard.domain.model.Role;
import com.piiguard.infrastructure.security.Permissions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the per-request {@link Principal} from claims the authentication layer has
 * already verified.
 *
 * Claims read:
 * - sub (identity, required)
 * - role: admin | hr_admin | department_manager | employee
 * - data_scope: all | department | self
 * - department_id, employee_id
 * - can_view_sensitive: boolean
 * - permissions: list of permission strings, or one space/comma separated string
 *
 * An unknown role leaves the principal without a role; a missing or unknown data
 * scope falls back to self.
 */
@Component
@Slf4j
public class PrincipalFactory {

    public static final String CLAIM_SUBJECT = "sub";
    public static final String CLAIM_ROLE = "role";
    public static final String CLAIM_DATA_SCOPE = "data_scope";
    public static final String CLAIM_DEPARTMENT_ID = "department_id";
    public static final String CLAIM_EMPLOYEE_ID = "employee_id";
    public static final String CLAIM_CAN_VIEW_SENSITIVE = "can_view_sensitive";
    public static final String CLAIM_PERMISSIONS = "permissions";

    public Principal fromClaims(Map<String, ?> claims) {
        return fromClaims(claims, Set.of());
    }

    /**
     * @param additionalPermissions permissions granted outside the claims, e.g. by
     *        framework authorities
     * @throws SecurityException if the claims carry no subject
     */
    public Principal fromClaims(Map<String, ?> claims, Collection<String> additionalPermissions) {
        if (claims == null) {
            throw new SecurityException("No authenticated user");
        }

        String identity = stringClaim(claims, CLAIM_SUBJECT);
        if (identity == null || identity.isBlank()) {
            throw new SecurityException("Verified claims carry no subject");
        }

        String roleClaim = stringClaim(claims, CLAIM_ROLE);
        Role role = Role.fromClaim(roleClaim).orElse(null);
        if (role == null) {
            log.warn("Unrecognized role claim {} for principal={}, no role granted", roleClaim, identity);
        }

        String scopeClaim = stringClaim(claims, CLAIM_DATA_SCOPE);
        DataScope dataScope = DataScope.fromClaim(scopeClaim).orElseGet(() -> {
            log.warn("Unrecognized data scope {} for principal={}, restricting to self", scopeClaim, identity);
            return DataScope.SELF;
        });

        Set<String> permissions = permissionsClaim(claims.get(CLAIM_PERMISSIONS));
        if (additionalPermissions != null) {
            additionalPermissions.stream().filter(Objects::nonNull).forEach(permissions::add);
        }

        return Principal.builder()
            .identity(identity)
            .role(role)
            .dataScope(dataScope)
            .departmentId(stringClaim(claims, CLAIM_DEPARTMENT_ID))
            .employeeId(stringClaim(claims, CLAIM_EMPLOYEE_ID))
            .canViewSensitive(booleanClaim(claims.get(CLAIM_CAN_VIEW_SENSITIVE)))
            .grantedPermissions(permissions)
            .build();
    }

    /**
     * Principal for a token-scoped self-service flow such as a one-time onboarding link.
     *
     * <p>Always {@code SELF} scope, bound to exactly the employee the token was issued for,
     * with only the self permissions.
     */
    public Principal forSelfServiceToken(String tokenSubject, String employeeId) {
        if (tokenSubject == null || tokenSubject.isBlank()) {
            throw new SecurityException("Self-service token carries no subject");
        }
        if (employeeId == null || employeeId.isBlank()) {
            throw new SecurityException("Self-service token is not bound to an employee");
        }

        return Principal.builder()
            .identity(tokenSubject)
            .role(Role.EMPLOYEE)
            .dataScope(DataScope.SELF)
            .employeeId(employeeId)
            .canViewSensitive(false)
            .grantedPermission(Permissions.Employees.VIEW_SELF)
            .grantedPermission(Permissions.Employees.UPDATE_SELF_LIMITED)
            .build();
    }

    private static String stringClaim(Map<String, ?> claims, String name) {
        Object value = claims.get(name);
        return value == null ? null : value.toString();
    }

    private static boolean booleanClaim(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    private static Set<String> permissionsClaim(Object value) {
        Set<String> permissions = new LinkedHashSet<>();
        if (value instanceof Collection) {
            for (Object permission : (Collection<?>) value) {
                if (permission != null) {
                    permissions.add(permission.toString());
                }
            }
        } else if (value != null) {
            for (String permission : value.toString().split("[\\s,]+")) {
                if (!permission.isEmpty()) {
                    permissions.add(permission);
                }
            }
        }
        return permissions;
    }
}
