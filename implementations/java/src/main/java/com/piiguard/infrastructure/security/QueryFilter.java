package com.piiguard.infrastructure.security;

import com.piiguard.domain.model.ProtectedEntity;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Row restriction produced by {@link DataScopeResolver}.
 *
 * <p>The persistence layer turns {@link #asCriteria()} into its where clause; in-memory
 * callers use {@link #matches(ProtectedEntity)}. A deny-all filter matches nothing and has
 * no criteria, so callers must check {@link #denyAll()} first.
 *
 * @param departmentId required owner department, or null
 * @param employeeId required owner employee, or null
 * @param denyAll true when the principal may see no rows at all
 * @param rejectedDepartmentId a requested department outside the principal's scope; the
 *        filter was not widened or switched to it
 */
public record QueryFilter(
    String departmentId,
    String employeeId,
    boolean denyAll,
    String rejectedDepartmentId
) {

    public static final String DEPARTMENT_ID = "department_id";
    public static final String EMPLOYEE_ID = "employee_id";

    public static QueryFilter unrestricted() {
        return new QueryFilter(null, null, false, null);
    }

    public static QueryFilter department(String departmentId) {
        return new QueryFilter(Objects.requireNonNull(departmentId), null, false, null);
    }

    public static QueryFilter employee(String employeeId) {
        return new QueryFilter(null, Objects.requireNonNull(employeeId), false, null);
    }

    public static QueryFilter denyingAll() {
        return new QueryFilter(null, null, true, null);
    }

    QueryFilter withRejectedDepartment(String requestedDepartmentId) {
        return new QueryFilter(departmentId, employeeId, denyAll, requestedDepartmentId);
    }

    public boolean isUnrestricted() {
        return !denyAll && departmentId == null && employeeId == null;
    }

    public Optional<String> getRejectedDepartmentId() {
        return Optional.ofNullable(rejectedDepartmentId);
    }

    public boolean matches(ProtectedEntity entity) {
        if (denyAll || entity == null) {
            return false;
        }
        if (departmentId != null && !departmentId.equals(entity.getOwnerDepartmentId())) {
            return false;
        }
        return employeeId == null || employeeId.equals(entity.getOwnerEmployeeId());
    }

    /**
     * Column equality criteria, e.g. {@code {department_id=D1}}. Empty means unrestricted.
     *
     * @throws IllegalStateException for a deny-all filter
     */
    public Map<String, String> asCriteria() {
        if (denyAll) {
            throw new IllegalStateException("Deny-all filter has no criteria");
        }
        Map<String, String> criteria = new LinkedHashMap<>();
        if (departmentId != null) {
            criteria.put(DEPARTMENT_ID, departmentId);
        }
        if (employeeId != null) {
            criteria.put(EMPLOYEE_ID, employeeId);
        }
        return Map.copyOf(criteria);
    }
}
