package com.piiguard.infrastructure.security;

import com.piiguard.domain.model.SensitiveField;

import java.util.Optional;

/**
 * What a viewer receives for one sensitive field. Never carries the encrypted blob.
 *
 * @param field the field
 * @param visibility how the value was produced
 * @param value plaintext for {@code DECRYPTED}, redacted text for {@code MASKED},
 *        otherwise null
 */
public record FieldView(SensitiveField field, Visibility visibility, String value) {

    public enum Visibility {
        /** Viewer may see the plaintext. */
        DECRYPTED,
        /** Viewer sees a partially redacted display value. */
        MASKED,
        /** Viewer may not see the field and it has no display mask. */
        OMITTED,
        /** Record has no value for the field. */
        ABSENT
    }

    static FieldView decrypted(SensitiveField field, String plaintext) {
        return new FieldView(field, Visibility.DECRYPTED, plaintext);
    }

    static FieldView masked(SensitiveField field, String masked) {
        return new FieldView(field, Visibility.MASKED, masked);
    }

    static FieldView omitted(SensitiveField field) {
        return new FieldView(field, Visibility.OMITTED, null);
    }

    static FieldView absent(SensitiveField field) {
        return new FieldView(field, Visibility.ABSENT, null);
    }

    public Optional<String> getValue() {
        return Optional.ofNullable(value);
    }

    @Override
    public String toString() {
        String shown = visibility == Visibility.DECRYPTED ? "<plaintext>" : value;
        return "FieldView[" + field.getFieldName() + ", " + visibility + ", " + shown + "]";
    }
}
