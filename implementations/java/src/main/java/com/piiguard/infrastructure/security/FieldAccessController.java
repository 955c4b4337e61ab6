package com.piiguard.infrastructure.security;

import com.piiguard.domain.model.DataScope;
import com.piiguard.domain.model.EncryptedBlob;
import com.piiguard.domain.model.MaskKind;
import com.piiguard.domain.model.Principal;
import com.piiguard.domain.model.ProtectedEntity;
import com.piiguard.domain.model.Role;
import com.piiguard.domain.model.SensitiveField;
import com.piiguard.infrastructure.crypto.CryptoVault;
import com.piiguard.infrastructure.masking.MaskingPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Field-level access decisions: may this principal view or edit this field of this record.
 *
 * Every decision is a pure function of (principal, target, fields). Row visibility is
 * not decided here; that belongs to {@link DataScopeResolver}.
 *
 * View rule: plaintext only for principals holding can_view_sensitive with ALL scope,
 * or for the record's own employee. Everyone else gets the masked value, or nothing
 * when the field has no mask.
 *
 * Edit rules:
 * - ADMIN / HR_ADMIN with employees.update_all: every requested field
 * - DEPARTMENT_MANAGER with employees.update_department, target in own department (even with
 *   ALL scope): allow-list
 * - EMPLOYEE with employees.update_self_limited, editing own record: smaller allow-list
 * - anything else: nothing
 *
 * Identity fields (name, id_card, employee_number) are on neither allow-list.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FieldAccessController {

    private static final Map<Role, Set<String>> FIELD_EDIT_ALLOW_LIST = buildAllowList();

    private final CryptoVault cryptoVault;
    private final MaskingPolicy maskingPolicy;
    private final PermissionPolicy permissionPolicy;
    private final DataScopeResolver dataScopeResolver;

    private static Map<Role, Set<String>> buildAllowList() {
        Map<Role, Set<String>> allowList = new EnumMap<>(Role.class);
        allowList.put(Role.DEPARTMENT_MANAGER,
            Set.of("phone", "email", "position", "emergency_contact", "emergency_phone"));
        allowList.put(Role.EMPLOYEE,
            Set.of("phone", "email", "address", "emergency_contact", "emergency_phone"));
        return allowList;
    }

    /**
     * @return the fields {@code role} may change on a record it does not fully own; empty for
     *         roles that edit everything or nothing through this path
     */
    public Set<String> getEditableFieldAllowList(Role role) {
        return role == null ? Set.of() : FIELD_EDIT_ALLOW_LIST.getOrDefault(role, Set.of());
    }

    /**
     * Gate that must pass before any decryption for display.
     */
    public boolean canViewSensitive(Principal principal, String targetEmployeeId) {
        if (principal == null) {
            return false;
        }
        if (principal.isCanViewSensitive() && principal.hasScope(DataScope.ALL)) {
            return true;
        }
        return principal.isSelf(targetEmployeeId);
    }

    /**
     * Renders one sensitive field for the principal: plaintext, masked value, or nothing.
     *
     * @throws com.piiguard.infrastructure.crypto.CryptoException if the stored value cannot
     *         be decrypted; a failure is never replaced by a masked value
     */
    public FieldView present(Principal principal, ProtectedEntity record, SensitiveField field) {
        Objects.requireNonNull(record, "Record must not be null");
        Objects.requireNonNull(field, "Field must not be null");

        Optional<EncryptedBlob> blob = record.getEncryptedField(field);
        if (blob.isEmpty()) {
            return FieldView.absent(field);
        }

        if (canViewSensitive(principal, record.getOwnerEmployeeId())) {
            return FieldView.decrypted(field, cryptoVault.decrypt(blob.get()));
        }

        Optional<MaskKind> maskKind = field.getMaskKind();
        if (maskKind.isEmpty()) {
            log.debug("Omitting {} of employee {} for principal={}",
                field.getFieldName(), record.getOwnerEmployeeId(), identityOf(principal));
            return FieldView.omitted(field);
        }

        String plaintext = cryptoVault.decrypt(blob.get());
        return FieldView.masked(field, maskingPolicy.mask(plaintext, maskKind.get()));
    }

    public EditDecision canEditFields(Principal principal, ProtectedEntity target, Collection<String> requestedFields) {
        Objects.requireNonNull(target, "Target must not be null");
        return canEditFields(principal, target.getOwnerEmployeeId(), target.getOwnerDepartmentId(), requestedFields);
    }

    /**
     * Decides which of the requested fields the principal may change on the target employee.
     * Rejected fields are returned individually, not all-or-nothing.
     */
    public EditDecision canEditFields(
            Principal principal,
            String targetEmployeeId,
            String targetDepartmentId,
            Collection<String> requestedFields) {

        Set<String> requested = normalize(requestedFields);

        if (principal == null || principal.getRole() == null || targetEmployeeId == null) {
            log.warn("Edit denied: unrecognized principal or missing target employee");
            return EditDecision.denied(requested);
        }

        Role role = principal.getRole();
        EditDecision decision;

        if ((role == Role.ADMIN || role == Role.HR_ADMIN)
                && permissionPolicy.hasPermission(principal, Permissions.Employees.UPDATE_ALL)) {
            decision = EditDecision.allowAll(requested);

        } else if (role == Role.DEPARTMENT_MANAGER
                && permissionPolicy.hasPermission(principal, Permissions.Employees.UPDATE_DEPARTMENT)
                && isOwnDepartment(principal, targetDepartmentId)
                && dataScopeResolver.canAccessDepartment(principal, targetDepartmentId)) {
            decision = EditDecision.partial(requested, getEditableFieldAllowList(role));

        } else if (role == Role.EMPLOYEE
                && principal.isSelf(targetEmployeeId)
                && permissionPolicy.hasPermission(principal, Permissions.Employees.UPDATE_SELF_LIMITED)) {
            decision = EditDecision.partial(requested, getEditableFieldAllowList(role));

        } else {
            log.warn("Edit denied: principal={} role={} target employee={} department={}",
                principal.getIdentity(), role, targetEmployeeId, targetDepartmentId);
            return EditDecision.denied(requested);
        }

        if (!decision.rejected().isEmpty()) {
            log.warn("Edit partially rejected: principal={} target employee={} rejected={}",
                principal.getIdentity(), targetEmployeeId, decision.rejected());
        }
        return decision;
    }

    /**
     * Managers edit only inside their own department, whatever scope the token grants.
     */
    private static boolean isOwnDepartment(Principal principal, String targetDepartmentId) {
        return targetDepartmentId != null && targetDepartmentId.equals(principal.getDepartmentId());
    }

    private static Set<String> normalize(Collection<String> requestedFields) {
        Set<String> requested = new LinkedHashSet<>();
        if (requestedFields != null) {
            for (String field : requestedFields) {
                if (field != null) {
                    requested.add(field);
                }
            }
        }
        return requested;
    }

    private static String identityOf(Principal principal) {
        return principal == null ? null : principal.getIdentity();
    }
}
