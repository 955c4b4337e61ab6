package com.piiguard.domain.model;

import java.util.Map;
import java.util.Optional;

/**
 * Capability implemented by every entity that carries encrypted fields.
 *
 * <p>Access checks and field presentation work against this interface only.
 */
public interface ProtectedEntity {

    String getOwnerEmployeeId();

    String getOwnerDepartmentId();

    /**
     * @return unmodifiable view of the encrypted columns present on this entity
     */
    Map<SensitiveField, EncryptedBlob> getEncryptedFields();

    default Optional<EncryptedBlob> getEncryptedField(SensitiveField field) {
        return Optional.ofNullable(getEncryptedFields().get(field));
    }
}
