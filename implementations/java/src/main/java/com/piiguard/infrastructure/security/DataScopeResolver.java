package com.piiguard.infrastructure.security;

import com.piiguard.domain.model.Principal;
import com.piiguard.domain.model.ProtectedEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Single source of truth for which rows a principal may see.
 *
 * Scope rules:
 * - ALL: unrestricted; a requested department narrows the filter
 * - DEPARTMENT: forced to the principal's department
 * - SELF: forced to the principal's employee record
 *
 * A requested department outside the scope is recorded on the filter as rejected and
 * never substituted. Missing scope data yields a deny-all filter. Never throws.
 */
@Service
@Slf4j
public class DataScopeResolver {

    public QueryFilter resolveFilter(Principal principal, String requestedDepartmentId) {
        if (principal == null || principal.getDataScope() == null) {
            log.warn("Data scope missing, denying all rows");
            return QueryFilter.denyingAll();
        }

        switch (principal.getDataScope()) {
            case ALL:
                log.debug("Data scope: all - principal={} requestedDepartment={}",
                    principal.getIdentity(), requestedDepartmentId);
                return requestedDepartmentId != null
                    ? QueryFilter.department(requestedDepartmentId)
                    : QueryFilter.unrestricted();

            case DEPARTMENT:
                if (principal.getDepartmentId() == null) {
                    log.warn("Department scope without department for principal={}, denying all rows",
                        principal.getIdentity());
                    return QueryFilter.denyingAll();
                }
                QueryFilter departmentFilter = QueryFilter.department(principal.getDepartmentId());
                if (requestedDepartmentId != null && !requestedDepartmentId.equals(principal.getDepartmentId())) {
                    log.warn("Rejected department {} outside scope of principal={} (department {})",
                        requestedDepartmentId, principal.getIdentity(), principal.getDepartmentId());
                    return departmentFilter.withRejectedDepartment(requestedDepartmentId);
                }
                log.debug("Data scope: department - principal={} restricted to {}",
                    principal.getIdentity(), principal.getDepartmentId());
                return departmentFilter;

            case SELF:
                if (principal.getEmployeeId() == null) {
                    log.warn("Self scope without employee record for principal={}, denying all rows",
                        principal.getIdentity());
                    return QueryFilter.denyingAll();
                }
                QueryFilter selfFilter = QueryFilter.employee(principal.getEmployeeId());
                if (requestedDepartmentId != null) {
                    log.warn("Rejected department {} for self-scoped principal={}",
                        requestedDepartmentId, principal.getIdentity());
                    return selfFilter.withRejectedDepartment(requestedDepartmentId);
                }
                log.debug("Data scope: self - principal={} restricted to own record", principal.getIdentity());
                return selfFilter;

            default:
                return QueryFilter.denyingAll();
        }
    }

    public boolean canAccessDepartment(Principal principal, String departmentId) {
        if (principal == null || departmentId == null || principal.getDataScope() == null) {
            return false;
        }
        switch (principal.getDataScope()) {
            case ALL:
                return true;
            case DEPARTMENT:
                return departmentId.equals(principal.getDepartmentId());
            default:
                return false;
        }
    }

    /**
     * Whether a single record falls inside the principal's scope.
     */
    public boolean canAccessRecord(Principal principal, ProtectedEntity record) {
        return resolveFilter(principal, null).matches(record);
    }
}
