package com.piiguard.application;

import com.piiguard.domain.model.SensitiveField;
import com.piiguard.infrastructure.security.FieldView;

import java.util.Map;
import java.util.Optional;

/**
 * A record as one principal may see it. Safe to return across the API boundary.
 *
 * @param ownerEmployeeId employee the record belongs to
 * @param ownerDepartmentId employee's department
 * @param fields presentation of every sensitive field the record holds
 * @param attributes non-sensitive values
 */
public record RecordView(
    String ownerEmployeeId,
    String ownerDepartmentId,
    Map<SensitiveField, FieldView> fields,
    Map<String, String> attributes
) {

    public RecordView {
        fields = Map.copyOf(fields);
        attributes = Map.copyOf(attributes);
    }

    public Optional<FieldView> field(SensitiveField field) {
        return Optional.ofNullable(fields.get(field));
    }

    /**
     * Display value of a field: plaintext or masked text, empty when omitted or absent.
     */
    public Optional<String> displayValue(SensitiveField field) {
        return field(field).flatMap(FieldView::getValue);
    }
}
