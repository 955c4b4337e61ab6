package com.piiguard.infrastructure.security;

import com.piiguard.domain.model.DataScope;
import com.piiguard.domain.model.EncryptedBlob;
import com.piiguard.domain.model.Principal;
import com.piiguard.domain.model.ProtectedRecord;
import com.piiguard.domain.model.Role;
import com.piiguard.domain.model.SensitiveField;
import com.piiguard.infrastructure.crypto.AesGcmCryptoVault;
import com.piiguard.infrastructure.crypto.CiphertextAuthenticationException;
import com.piiguard.infrastructure.crypto.EncryptionKey;
import com.piiguard.infrastructure.crypto.FieldHasher;
import com.piiguard.infrastructure.masking.MaskingPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FieldAccessControllerTest {

    private EncryptionKey key;
    private AesGcmCryptoVault vault;
    private final FieldHasher hasher = new FieldHasher();
    private FieldAccessController controller;

    @BeforeEach
    void setUp() {
        key = EncryptionKey.fromSecret("test-key-0123456789abcdefghijklm");
        vault = new AesGcmCryptoVault(key);
        controller = new FieldAccessController(vault, new MaskingPolicy(), new PermissionPolicy(), new DataScopeResolver());
    }

    @AfterEach
    void tearDown() {
        key.close();
    }

    private static Principal employee(String employeeId, String departmentId) {
        return Principal.builder()
            .identity("user-" + employeeId)
            .role(Role.EMPLOYEE)
            .dataScope(DataScope.SELF)
            .departmentId(departmentId)
            .employeeId(employeeId)
            .build();
    }

    private static Principal manager(String departmentId) {
        return Principal.builder()
            .identity("manager-" + departmentId)
            .role(Role.DEPARTMENT_MANAGER)
            .dataScope(DataScope.DEPARTMENT)
            .departmentId(departmentId)
            .employeeId("M-" + departmentId)
            .build();
    }

    private static Principal hrAdmin(boolean canViewSensitive) {
        return Principal.builder()
            .identity("hr")
            .role(Role.HR_ADMIN)
            .dataScope(DataScope.ALL)
            .employeeId("HR1")
            .canViewSensitive(canViewSensitive)
            .build();
    }

    private ProtectedRecord record(String employeeId, String departmentId) {
        ProtectedRecord record = ProtectedRecord.create(employeeId, departmentId);
        record = withField(record, SensitiveField.NAME, "Alexandra Chen");
        record = withField(record, SensitiveField.PHONE, "13812345678");
        record = withField(record, SensitiveField.ID_CARD, "110101199001011234");
        record = withField(record, SensitiveField.BIRTH_DATE, "1990-01-01");
        return record;
    }

    private ProtectedRecord withField(ProtectedRecord record, SensitiveField field, String value) {
        return record.withEncryptedField(field, vault.encrypt(value), hasher.hash(value));
    }

    @Nested
    @DisplayName("canViewSensitive()")
    class CanViewSensitive {

        @Test
        @DisplayName("Employee should see own data but not a colleague's")
        void selfOnly() {
            Principal e1 = employee("E1", "D1");

            assertTrue(controller.canViewSensitive(e1, "E1"));
            assertFalse(controller.canViewSensitive(e1, "E2"));
        }

        @Test
        @DisplayName("Flag holder with ALL scope should see everyone's data")
        void flagWithAllScope() {
            assertTrue(controller.canViewSensitive(hrAdmin(true), "E9"));
            assertFalse(controller.canViewSensitive(hrAdmin(false), "E9"));
        }

        @Test
        @DisplayName("Flag holder without ALL scope should not see other employees' data")
        void flagWithoutAllScope() {
            Principal flaggedManager = Principal.builder()
                .identity("manager-D1")
                .role(Role.DEPARTMENT_MANAGER)
                .dataScope(DataScope.DEPARTMENT)
                .departmentId("D1")
                .employeeId("M-D1")
                .canViewSensitive(true)
                .build();

            assertFalse(controller.canViewSensitive(flaggedManager, "E2"));
        }

        @Test
        @DisplayName("A principal with no employee record is never self")
        void noEmployeeRecord() {
            Principal principal = Principal.builder().identity("svc").dataScope(DataScope.SELF).build();

            assertFalse(controller.canViewSensitive(principal, null));
            assertFalse(controller.canViewSensitive(null, "E1"));
        }
    }

    @Nested
    @DisplayName("present()")
    class Present {

        @Test
        @DisplayName("Owner should receive plaintext")
        void ownerSeesPlaintext() {
            ProtectedRecord record = record("E1", "D1");

            FieldView phone = controller.present(employee("E1", "D1"), record, SensitiveField.PHONE);

            assertEquals(FieldView.Visibility.DECRYPTED, phone.visibility());
            assertThat(phone.getValue()).contains("13812345678");
        }

        @Test
        @DisplayName("Colleague should receive masked values")
        void colleagueSeesMasked() {
            ProtectedRecord record = record("E2", "D1");
            Principal e1 = employee("E1", "D1");

            assertThat(controller.present(e1, record, SensitiveField.PHONE).value()).isEqualTo("138****5678");
            assertThat(controller.present(e1, record, SensitiveField.ID_CARD).value()).isEqualTo("110***********1234");
            assertThat(controller.present(e1, record, SensitiveField.NAME).value()).isEqualTo("Ale****Chen");
        }

        @Test
        @DisplayName("Fields without a mask should be omitted for non-viewers")
        void unmaskedFieldOmitted() {
            FieldView birthDate = controller.present(manager("D1"), record("E2", "D1"), SensitiveField.BIRTH_DATE);

            assertEquals(FieldView.Visibility.OMITTED, birthDate.visibility());
            assertThat(birthDate.getValue()).isEmpty();
        }

        @Test
        @DisplayName("Missing fields should be reported absent")
        void missingFieldAbsent() {
            FieldView bankCard = controller.present(hrAdmin(true), record("E2", "D1"), SensitiveField.BANK_CARD);

            assertEquals(FieldView.Visibility.ABSENT, bankCard.visibility());
        }

        @Test
        @DisplayName("A tampered value should fail, not fall back to a mask")
        void tamperedValuePropagates() {
            String[] parts = vault.encryptToString("13812345678").split(":");
            String tag = (parts[1].charAt(0) == '0' ? '1' : '0') + parts[1].substring(1);
            ProtectedRecord record = ProtectedRecord.create("E2", "D1").withEncryptedField(
                SensitiveField.PHONE,
                EncryptedBlob.parse(parts[0] + ":" + tag + ":" + parts[2]),
                hasher.hash("13812345678"));

            assertThatThrownBy(() -> controller.present(employee("E1", "D1"), record, SensitiveField.PHONE))
                .isInstanceOf(CiphertextAuthenticationException.class);
        }

        @Test
        @DisplayName("Rendered views should not print plaintext")
        void viewToStringHidesPlaintext() {
            FieldView view = controller.present(employee("E1", "D1"), record("E1", "D1"), SensitiveField.PHONE);

            assertThat(view.toString()).doesNotContain("13812345678");
        }
    }

    @Nested
    @DisplayName("canEditFields()")
    class CanEditFields {

        @Test
        @DisplayName("Manager should edit allow-listed fields in own department and be refused the rest")
        void managerPartialRejection() {
            EditDecision decision = controller.canEditFields(manager("D1"), "E2", "D1", List.of("phone", "id_card"));

            assertFalse(decision.allowedAll());
            assertThat(decision.editable()).containsExactly("phone");
            assertThat(decision.rejected()).containsExactly("id_card");
        }

        @Test
        @DisplayName("Manager should edit nothing in another department")
        void managerOtherDepartment() {
            EditDecision decision = controller.canEditFields(manager("D1"), "E3", "D2", List.of("phone"));

            assertFalse(decision.allowedAll());
            assertThat(decision.editable()).isEmpty();
            assertThat(decision.rejected()).containsExactly("phone");
        }

        @Test
        @DisplayName("Manager token with ALL scope should still edit nothing outside own department")
        void managerAllScopeOtherDepartment() {
            Principal wideManager = Principal.builder()
                .identity("manager-wide")
                .role(Role.DEPARTMENT_MANAGER)
                .dataScope(DataScope.ALL)
                .departmentId("D1")
                .employeeId("M-D1")
                .build();

            EditDecision otherDepartment = controller.canEditFields(wideManager, "E9", "D2", List.of("phone", "id_card"));
            EditDecision ownDepartment = controller.canEditFields(wideManager, "E2", "D1", List.of("phone", "id_card"));

            assertThat(otherDepartment.editable()).isEmpty();
            assertThat(otherDepartment.rejected()).containsExactly("phone", "id_card");
            assertThat(ownDepartment.editable()).containsExactly("phone");
            assertThat(ownDepartment.rejected()).containsExactly("id_card");
        }

        @Test
        @DisplayName("Manager without a department should edit nothing")
        void managerWithoutDepartment() {
            Principal detached = Principal.builder()
                .identity("manager-none")
                .role(Role.DEPARTMENT_MANAGER)
                .dataScope(DataScope.ALL)
                .employeeId("M0")
                .build();

            assertThat(controller.canEditFields(detached, "E2", "D1", List.of("phone")).editable()).isEmpty();
        }

        @Test
        @DisplayName("HR admin should edit every requested field")
        void hrAdminAllowedAll() {
            EditDecision decision = controller.canEditFields(hrAdmin(false), "E2", "D1",
                List.of("name", "id_card", "bank_card", "phone"));

            assertTrue(decision.allowedAll());
            assertThat(decision.rejected()).isEmpty();
            assertThat(decision.editable()).containsExactly("name", "id_card", "bank_card", "phone");
        }

        @Test
        @DisplayName("Admin should edit every requested field through the wildcard")
        void adminAllowedAll() {
            Principal admin = Principal.builder().identity("root").role(Role.ADMIN).dataScope(DataScope.ALL).build();

            assertTrue(controller.canEditFields(admin, "E2", "D1", List.of("position")).allowedAll());
        }

        @Test
        @DisplayName("Employee should edit own contact fields but not identity fields")
        void employeeSelfEdit() {
            EditDecision decision = controller.canEditFields(employee("E1", "D1"), record("E1", "D1"),
                List.of("address", "emergency_phone", "name", "position"));

            assertThat(decision.editable()).containsExactly("address", "emergency_phone");
            assertThat(decision.rejected()).containsExactly("name", "position");
        }

        @Test
        @DisplayName("Employee should edit nothing on a colleague's record")
        void employeeOtherRecord() {
            EditDecision decision = controller.canEditFields(employee("E1", "D1"), "E2", "D1", List.of("phone"));

            assertThat(decision.editable()).isEmpty();
            assertThat(decision.rejected()).containsExactly("phone");
        }

        @Test
        @DisplayName("Role without the matching permission should edit nothing")
        void roleWithoutPermission() {
            Principal readOnlyHr = hrAdmin(false);
            PermissionPolicy restricted = new PermissionPolicy() {
                @Override
                public boolean hasPermission(Principal principal, String required) {
                    return false;
                }
            };
            FieldAccessController strict = new FieldAccessController(vault, new MaskingPolicy(), restricted,
                new DataScopeResolver());

            assertThat(strict.canEditFields(readOnlyHr, "E2", "D1", List.of("phone")).editable()).isEmpty();
        }

        @Test
        @DisplayName("Unrecognized role should edit nothing")
        void unknownRole() {
            Principal unknown = Principal.builder().identity("x").dataScope(DataScope.ALL).employeeId("E2").build();

            EditDecision decision = controller.canEditFields(unknown, "E2", "D1", List.of("phone"));

            assertThat(decision.editable()).isEmpty();
            assertThat(decision.rejected()).containsExactly("phone");
        }

        @Test
        @DisplayName("requireAll() should report every rejected field")
        void requireAllThrows() {
            EditDecision decision = controller.canEditFields(manager("D1"), "E2", "D1",
                Arrays.asList("phone", "id_card", null, "name"));

            assertThatThrownBy(decision::requireAll)
                .isInstanceOf(FieldEditRejectedException.class)
                .satisfies(e -> assertThat(((FieldEditRejectedException) e).getRejectedFields())
                    .containsExactlyInAnyOrder("id_card", "name"));
        }

        @Test
        @DisplayName("Allow-lists should not contain identity fields")
        void allowListsExcludeIdentity() {
            for (Role role : Role.values()) {
                assertThat(controller.getEditableFieldAllowList(role))
                    .doesNotContain("name", "id_card", "employee_number");
            }
        }
    }
}
