package com.piiguard.application;

import com.piiguard.domain.model.Principal;
import com.piiguard.domain.model.ProtectedRecord;
import com.piiguard.domain.model.SearchHash;
import com.piiguard.domain.model.SensitiveField;
import com.piiguard.infrastructure.audit.AuditService;
import com.piiguard.infrastructure.crypto.CryptoException;
import com.piiguard.infrastructure.crypto.CryptoVault;
import com.piiguard.infrastructure.crypto.FieldHasher;
import com.piiguard.infrastructure.security.AccessDeniedException;
import com.piiguard.infrastructure.security.DataScopeResolver;
import com.piiguard.infrastructure.security.EditDecision;
import com.piiguard.infrastructure.security.FieldAccessController;
import com.piiguard.infrastructure.security.FieldEditRejectedException;
import com.piiguard.infrastructure.security.FieldView;
import com.piiguard.infrastructure.security.PermissionPolicy;
import com.piiguard.infrastructure.security.Permissions;
import com.piiguard.infrastructure.security.QueryFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Application service for reading and writing employee records that carry PII.
 *
 * <p>Orchestrates the read path (scope filter first, then per-field presentation) and the
 * write path (edit check, then encrypt and hash every accepted sensitive value). Storage is
 * the caller's concern: records come in and go out as values.
 *
 * @since 1.0.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProtectedRecordService {

    private final CryptoVault cryptoVault;
    private final FieldHasher fieldHasher;
    private final PermissionPolicy permissionPolicy;
    private final DataScopeResolver dataScopeResolver;
    private final FieldAccessController fieldAccessController;
    private final AuditService auditService;

    /**
     * Create a record for a new employee.
     *
     * @param principal caller, needs employees.create and access to the department
     * @param sensitiveValues plaintext PII; null or empty values are skipped
     * @param attributes non-sensitive values
     * @return the record to persist
     */
    public ProtectedRecord create(
            Principal principal,
            String ownerEmployeeId,
            String ownerDepartmentId,
            Map<SensitiveField, String> sensitiveValues,
            Map<String, String> attributes) {

        Objects.requireNonNull(ownerEmployeeId, "Owner employee ID must not be null");

        if (!permissionPolicy.hasPermission(principal, Permissions.Employees.CREATE)
                || (ownerDepartmentId != null && !dataScopeResolver.canAccessDepartment(principal, ownerDepartmentId))) {
            auditService.record(AuditService.CATEGORY_ACCESS, "CREATE_DENIED",
                ownerEmployeeId, identityOf(principal), "department=" + ownerDepartmentId);
            throw new AccessDeniedException("Access denied: not permitted to create employee records");
        }

        log.info("Creating protected record for employee {}", ownerEmployeeId);

        ProtectedRecord record = ProtectedRecord.create(ownerEmployeeId, ownerDepartmentId);

        if (sensitiveValues != null) {
            for (Map.Entry<SensitiveField, String> entry : sensitiveValues.entrySet()) {
                if (entry.getValue() != null && !entry.getValue().isEmpty()) {
                    record = encryptInto(record, entry.getKey(), entry.getValue());
                }
            }
        }
        if (attributes != null) {
            for (Map.Entry<String, String> entry : attributes.entrySet()) {
                record = record.withAttribute(entry.getKey(), entry.getValue());
            }
        }

        return record;
    }

    /**
     * Visible records, rendered for the principal. Out-of-scope rows are dropped before any
     * field is decrypted.
     */
    public List<RecordView> listVisible(
            Principal principal,
            Collection<ProtectedRecord> records,
            String requestedDepartmentId) {

        QueryFilter filter = dataScopeResolver.resolveFilter(principal, requestedDepartmentId);

        filter.getRejectedDepartmentId().ifPresent(rejected ->
            auditService.record(AuditService.CATEGORY_ACCESS, "SCOPE_REJECTED",
                rejected, identityOf(principal), "requested department outside data scope"));

        if (filter.denyAll() || records == null) {
            return List.of();
        }

        return records.stream()
            .filter(filter::matches)
            .map(record -> render(principal, record))
            .collect(Collectors.toList());
    }

    /**
     * @throws AccessDeniedException if the record is outside the principal's data scope
     */
    public RecordView view(Principal principal, ProtectedRecord record) {
        requireInScope(principal, record, "VIEW_DENIED");
        return render(principal, record);
    }

    /**
     * Records in scope whose stored search hash equals the hash of {@code value}.
     */
    public List<RecordView> findBySensitiveValue(
            Principal principal,
            Collection<ProtectedRecord> records,
            SensitiveField field,
            String value) {

        QueryFilter filter = dataScopeResolver.resolveFilter(principal, null);
        if (filter.denyAll() || records == null) {
            return List.of();
        }

        SearchHash wanted = fieldHasher.hash(value);

        return records.stream()
            .filter(filter::matches)
            .filter(record -> record.getSearchHash(field).map(wanted::equals).orElse(false))
            .map(record -> render(principal, record))
            .collect(Collectors.toList());
    }

    /**
     * Apply submitted changes. Fields the principal may not edit are left untouched and
     * reported by name.
     *
     * @param changes field name to new plaintext value; null or empty clears the field
     * @throws AccessDeniedException if the record is outside the principal's data scope
     * @throws FieldEditRejectedException if none of the submitted fields may be edited
     */
    public EditOutcome applyEdits(Principal principal, ProtectedRecord record, Map<String, String> changes) {
        requireInScope(principal, record, "EDIT_DENIED");

        if (changes == null || changes.isEmpty()) {
            return new EditOutcome(record, Set.of(), Set.of());
        }

        EditDecision decision = fieldAccessController.canEditFields(principal, record, changes.keySet());

        if (decision.editable().isEmpty()) {
            auditService.record(AuditService.CATEGORY_ACCESS, "EDIT_REJECTED",
                record.getOwnerEmployeeId(), identityOf(principal), "fields=" + decision.rejected());
            throw new FieldEditRejectedException(decision.rejected());
        }

        ProtectedRecord updated = record;
        for (String fieldName : decision.editable()) {
            String value = changes.get(fieldName);
            Optional<SensitiveField> sensitive = SensitiveField.fromFieldName(fieldName);

            if (sensitive.isPresent()) {
                updated = value == null || value.isEmpty()
                    ? updated.withoutEncryptedField(sensitive.get())
                    : encryptInto(updated, sensitive.get(), value);
            } else {
                updated = updated.withAttribute(fieldName, value == null || value.isEmpty() ? null : value);
            }
        }

        if (!decision.rejected().isEmpty()) {
            auditService.record(AuditService.CATEGORY_ACCESS, "EDIT_PARTIALLY_REJECTED",
                record.getOwnerEmployeeId(), identityOf(principal), "fields=" + decision.rejected());
        }

        log.info("Applied {} field edits to employee {} by principal={}",
            decision.editable().size(), record.getOwnerEmployeeId(), identityOf(principal));

        return new EditOutcome(updated, decision.editable(), decision.rejected());
    }

    private ProtectedRecord encryptInto(ProtectedRecord record, SensitiveField field, String plaintext) {
        // fresh IV on every write, even when the plaintext is unchanged
        return record.withEncryptedField(field, cryptoVault.encrypt(plaintext), fieldHasher.hash(plaintext));
    }

    private RecordView render(Principal principal, ProtectedRecord record) {
        Map<SensitiveField, FieldView> fields = new EnumMap<>(SensitiveField.class);
        List<String> decrypted = new ArrayList<>();

        for (SensitiveField field : record.getEncryptedFields().keySet()) {
            FieldView view;
            try {
                view = fieldAccessController.present(principal, record, field);
            } catch (CryptoException e) {
                auditService.record(AuditService.CATEGORY_CRYPTO, "DECRYPT_FAILED",
                    record.getOwnerEmployeeId(), identityOf(principal),
                    "field=" + field.getFieldName() + " error=" + e.getClass().getSimpleName());
                throw e;
            }
            if (view.visibility() == FieldView.Visibility.DECRYPTED) {
                decrypted.add(field.getFieldName());
            }
            fields.put(field, view);
        }

        if (!decrypted.isEmpty() && !principal.isSelf(record.getOwnerEmployeeId())) {
            auditService.record(AuditService.CATEGORY_SENSITIVE_DATA, "VIEW_DECRYPTED",
                record.getOwnerEmployeeId(), identityOf(principal), "fields=" + decrypted);
        }

        return new RecordView(record.getOwnerEmployeeId(), record.getOwnerDepartmentId(),
            fields, record.getAttributes());
    }

    private void requireInScope(Principal principal, ProtectedRecord record, String action) {
        Objects.requireNonNull(record, "Record must not be null");
        if (!dataScopeResolver.canAccessRecord(principal, record)) {
            auditService.record(AuditService.CATEGORY_ACCESS, action,
                record.getOwnerEmployeeId(), identityOf(principal), "record outside data scope");
            throw new AccessDeniedException("Access denied: record is outside your data scope");
        }
    }

    private static String identityOf(Principal principal) {
        return principal == null ? null : principal.getIdentity();
    }
}
