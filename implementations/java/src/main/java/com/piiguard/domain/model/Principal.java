package com.piiguard.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Objects;
import java.util.Set;

/**
 * Immutable authenticated caller for a single request.
 *
 * <p>Built by the authentication layer from verified token claims and discarded when the
 * request ends. Claims are trusted as given; nothing here re-verifies them.
 *
 * <p>{@code role} is {@code null} when the token carried a role this engine does not
 * recognize. Every policy treats that as no access.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class Principal {
    String identity;
    Role role;
    DataScope dataScope;
    String departmentId;
    String employeeId;
    boolean canViewSensitive;
    @Singular
    Set<String> grantedPermissions;

    public boolean hasScope(DataScope scope) {
        return dataScope == scope;
    }

    /**
     * True when {@code targetEmployeeId} names this principal's own employee record.
     */
    public boolean isSelf(String targetEmployeeId) {
        return employeeId != null && Objects.equals(employeeId, targetEmployeeId);
    }
}
