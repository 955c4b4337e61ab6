package com.piiguard.infrastructure.security;

import com.piiguard.domain.model.Principal;
import com.piiguard.domain.model.Role;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Static role-to-permission table plus the single wildcard matcher used everywhere.
 *
 * Matching order for {@code hasPermission(required, granted)}:
 * 1. {@code *} grants everything
 * 2. exact match
 * 3. {@code resource.*} where resource is the part of required before the first dot
 *
 * Matching is case-sensitive. No other wildcard shapes are recognized, so
 * {@code reports.view_*} or {@code *.view_all} grant nothing. Never throws.
 */
@Service
@Slf4j
public class PermissionPolicy {

    private static final Map<Role, Set<String>> ROLE_PERMISSIONS = buildRoleTable();

    private static Map<Role, Set<String>> buildRoleTable() {
        Map<Role, Set<String>> table = new EnumMap<>(Role.class);

        table.put(Role.ADMIN, Set.of(Permissions.ALL));

        table.put(Role.HR_ADMIN, Set.of(
            Permissions.Employees.VIEW_ALL,
            Permissions.Employees.CREATE,
            Permissions.Employees.UPDATE_ALL,
            Permissions.Employees.DELETE,
            Permissions.Employees.EXPORT,
            Permissions.Employees.IMPORT,
            Permissions.Departments.VIEW_ALL,
            Permissions.Reports.VIEW_ALL,
            Permissions.Reports.EXPORT_ALL,
            Permissions.Onboarding.MANAGE,
            Permissions.Onboarding.CREATE,
            Permissions.Onboarding.VIEW_ALL,
            Permissions.Onboarding.UPDATE,
            Permissions.Onboarding.SEND_NOTIFICATION
        ));

        table.put(Role.DEPARTMENT_MANAGER, Set.of(
            Permissions.Employees.VIEW_DEPARTMENT,
            Permissions.Employees.UPDATE_DEPARTMENT,
            Permissions.Employees.EXPORT_DEPARTMENT,
            Permissions.Departments.VIEW,
            Permissions.Reports.VIEW_DEPARTMENT,
            Permissions.Reports.EXPORT_DEPARTMENT
        ));

        table.put(Role.EMPLOYEE, Set.of(
            Permissions.Employees.VIEW_SELF,
            Permissions.Employees.UPDATE_SELF_LIMITED,
            Permissions.Departments.VIEW
        ));

        return table;
    }

    public boolean hasPermission(String required, Collection<String> granted) {
        if (required == null || granted == null || granted.isEmpty()) {
            return false;
        }

        if (granted.contains(Permissions.ALL)) {
            return true;
        }

        if (granted.contains(required)) {
            return true;
        }

        int dot = required.indexOf('.');
        if (dot <= 0) {
            return false;
        }
        return granted.contains(required.substring(0, dot) + Permissions.WILDCARD_SUFFIX);
    }

    /**
     * Checks against the principal's role defaults plus its explicitly granted permissions.
     */
    public boolean hasPermission(Principal principal, String required) {
        if (principal == null) {
            return false;
        }
        boolean granted = hasPermission(required, effectivePermissions(principal));
        if (!granted) {
            log.debug("Permission {} not held by principal={} role={}",
                required, principal.getIdentity(), principal.getRole());
        }
        return granted;
    }

    /**
     * @return the role's default permissions; empty for a null role
     */
    public Set<String> getRolePermissions(Role role) {
        if (role == null) {
            return Set.of();
        }
        return ROLE_PERMISSIONS.getOrDefault(role, Set.of());
    }

    /**
     * Lookup by claim value ({@code hr_admin}, ...). Unrecognized names get no permissions.
     */
    public Set<String> getRolePermissions(String roleName) {
        return Role.fromClaim(roleName)
            .map(this::getRolePermissions)
            .orElseGet(() -> {
                log.warn("Unrecognized role {}, granting no permissions", roleName);
                return Set.of();
            });
    }

    public Set<String> effectivePermissions(Principal principal) {
        Set<String> effective = new HashSet<>(getRolePermissions(principal.getRole()));
        if (principal.getGrantedPermissions() != null) {
            effective.addAll(principal.getGrantedPermissions());
            effective.remove(null);
        }
        return Set.copyOf(effective);
    }
}
