package com.piiguard.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Employee-owned record carrying encrypted fields, their search hashes, and plain
 * (non-sensitive) attributes.
 *
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>Every encrypted field has a search hash computed from the same plaintext</li>
 *   <li>Owner employee and department never change after creation</li>
 *   <li>Immutable - writes return a new instance</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode
public final class ProtectedRecord implements ProtectedEntity {

    private final String ownerEmployeeId;
    private final String ownerDepartmentId;
    private final Map<SensitiveField, EncryptedBlob> encryptedFields;
    private final Map<SensitiveField, SearchHash> searchHashes;
    private final Map<String, String> attributes;

    private ProtectedRecord(
            String ownerEmployeeId,
            String ownerDepartmentId,
            Map<SensitiveField, EncryptedBlob> encryptedFields,
            Map<SensitiveField, SearchHash> searchHashes,
            Map<String, String> attributes) {

        this.ownerEmployeeId = Objects.requireNonNull(ownerEmployeeId, "Owner employee ID must not be null");
        this.ownerDepartmentId = ownerDepartmentId;
        this.encryptedFields = Collections.unmodifiableMap(copyOf(encryptedFields));
        this.searchHashes = Collections.unmodifiableMap(copyOf(searchHashes));
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * Creates an empty record for an employee.
     *
     * @param ownerEmployeeId employee the record belongs to
     * @param ownerDepartmentId employee's department, may be {@code null} when unassigned
     */
    public static ProtectedRecord create(String ownerEmployeeId, String ownerDepartmentId) {
        return new ProtectedRecord(ownerEmployeeId, ownerDepartmentId,
            Map.of(), Map.of(), Map.of());
    }

    /**
     * Returns a copy with {@code field} replaced. The blob and hash must come from the
     * same plaintext.
     */
    public ProtectedRecord withEncryptedField(SensitiveField field, EncryptedBlob blob, SearchHash hash) {
        Objects.requireNonNull(field, "Field must not be null");
        Objects.requireNonNull(blob, "Encrypted value must not be null");
        Objects.requireNonNull(hash, "Search hash must not be null");

        Map<SensitiveField, EncryptedBlob> fields = copyOf(encryptedFields);
        fields.put(field, blob);
        Map<SensitiveField, SearchHash> hashes = copyOf(searchHashes);
        hashes.put(field, hash);

        return new ProtectedRecord(ownerEmployeeId, ownerDepartmentId, fields, hashes, attributes);
    }

    public ProtectedRecord withoutEncryptedField(SensitiveField field) {
        Map<SensitiveField, EncryptedBlob> fields = copyOf(encryptedFields);
        fields.remove(field);
        Map<SensitiveField, SearchHash> hashes = copyOf(searchHashes);
        hashes.remove(field);

        return new ProtectedRecord(ownerEmployeeId, ownerDepartmentId, fields, hashes, attributes);
    }

    public ProtectedRecord withAttribute(String name, String value) {
        Objects.requireNonNull(name, "Attribute name must not be null");

        Map<String, String> updated = new LinkedHashMap<>(attributes);
        if (value == null) {
            updated.remove(name);
        } else {
            updated.put(name, value);
        }

        return new ProtectedRecord(ownerEmployeeId, ownerDepartmentId, encryptedFields, searchHashes, updated);
    }

    public Optional<SearchHash> getSearchHash(SensitiveField field) {
        return Optional.ofNullable(searchHashes.get(field));
    }

    public Optional<String> getAttribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    private static <V> Map<SensitiveField, V> copyOf(Map<SensitiveField, V> source) {
        Map<SensitiveField, V> copy = new EnumMap<>(SensitiveField.class);
        copy.putAll(source);
        return copy;
    }

    @Override
    public String toString() {
        return String.format(
            "ProtectedRecord[employee=%s, department=%s, encryptedFields=%s, attributes=%s]",
            ownerEmployeeId,
            ownerDepartmentId,
            encryptedFields.keySet(),
            attributes.keySet()
        );
    }
}
