package com.piiguard.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Employee attributes stored encrypted, each with its column name and display mask.
 *
 * <p>A field without a mask kind is omitted entirely when the viewer may not see it.
 */
public enum SensitiveField {
    NAME("name", MaskKind.GENERIC),
    PHONE("phone", MaskKind.PHONE),
    ID_CARD("id_card", MaskKind.ID_CARD),
    BANK_CARD("bank_card", MaskKind.BANK_CARD),
    BIRTH_DATE("birth_date", null),
    EMERGENCY_PHONE("emergency_phone", MaskKind.PHONE);

    private final String fieldName;
    private final MaskKind maskKind;

    SensitiveField(String fieldName, MaskKind maskKind) {
        this.fieldName = fieldName;
        this.maskKind = maskKind;
    }

    public String getFieldName() {
        return fieldName;
    }

    public Optional<MaskKind> getMaskKind() {
        return Optional.ofNullable(maskKind);
    }

    public static Optional<SensitiveField> fromFieldName(String fieldName) {
        return Arrays.stream(values())
            .filter(field -> field.fieldName.equals(fieldName))
            .findFirst();
    }
}
