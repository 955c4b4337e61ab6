package com.piiguard.infrastructure.masking;

import com.piiguard.domain.model.MaskKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class MaskingPolicyTest {

    private final MaskingPolicy policy = new MaskingPolicy();

    @Nested
    @DisplayName("Phone")
    class Phone {

        @Test
        @DisplayName("Should keep the first 3 and last 4 digits")
        void shouldMaskElevenDigits() {
            assertThat(policy.mask("13812345678", MaskKind.PHONE)).isEqualTo("138****5678");
        }

        @Test
        @DisplayName("Should return other shapes unchanged")
        void shouldLeaveOtherShapes() {
            assertThat(policy.mask("1381234567", MaskKind.PHONE)).isEqualTo("1381234567");
            assertThat(policy.mask("+8613812345678", MaskKind.PHONE)).isEqualTo("+8613812345678");
        }
    }

    @Nested
    @DisplayName("ID card")
    class IdCard {

        @Test
        @DisplayName("Should keep the first 3 and last 4 characters")
        void shouldMaskEighteenDigits() {
            assertThat(policy.mask("110101199001011234", MaskKind.ID_CARD)).isEqualTo("110***********1234");
        }

        @Test
        @DisplayName("Should mask an ID ending in the X check character instead of passing it through")
        void shouldMaskCheckCharacter() {
            assertThat(policy.mask("11010119900101123X", MaskKind.ID_CARD)).isEqualTo("110***********123X");
            assertThat(policy.mask("11010119900101123x", MaskKind.ID_CARD)).isEqualTo("110***********123x");
        }

        @Test
        @DisplayName("Should return an 18-character value with a non-digit body unchanged")
        void shouldLeaveLettersInBody() {
            assertThat(policy.mask("11010119900101A23X", MaskKind.ID_CARD)).isEqualTo("11010119900101A23X");
        }

        @Test
        @DisplayName("Should return a 15-digit ID unchanged")
        void shouldLeaveShortId() {
            assertThat(policy.mask("110101900101123", MaskKind.ID_CARD)).isEqualTo("110101900101123");
        }
    }

    @Nested
    @DisplayName("Bank card")
    class BankCard {

        @ParameterizedTest
        @CsvSource({
            "6222021234567890, **** **** **** 7890",
            "6222 0212 3456 7890, **** **** **** 7890",
            "6222-0212-3456-7890, **** **** **** 7890",
            "622202123456, **** **** **** 3456"
        })
        @DisplayName("Should keep only the last 4 digits")
        void shouldMaskCard(String card, String expected) {
            assertThat(policy.mask(card, MaskKind.BANK_CARD)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should return short numbers unchanged")
        void shouldLeaveShortNumbers() {
            assertThat(policy.mask("12345678901", MaskKind.BANK_CARD)).isEqualTo("12345678901");
        }
    }

    @Nested
    @DisplayName("Generic")
    class Generic {

        @Test
        @DisplayName("Should keep the first 3 and last 4 characters of long values")
        void shouldMaskLongValue() {
            assertThat(policy.mask("abcdefghij", MaskKind.GENERIC)).isEqualTo("abc****ghij");
        }

        @Test
        @DisplayName("Should fully mask values of 7 characters or fewer")
        void shouldFullyMaskShortValue() {
            assertThat(policy.mask("abcdefg", MaskKind.GENERIC)).isEqualTo("****");
            assertThat(policy.mask("张三", MaskKind.GENERIC)).isEqualTo("****");
        }
    }

    @Test
    @DisplayName("Should return an empty string for null or empty input")
    void shouldHandleEmpty() {
        assertThat(policy.mask(null, MaskKind.PHONE)).isEmpty();
        assertThat(policy.mask("", MaskKind.GENERIC)).isEmpty();
    }

    @Test
    @DisplayName("Should return the value unchanged when no mask kind is given")
    void shouldPassThroughWithoutKind() {
        assertThat(policy.mask("13812345678", null)).isEqualTo("13812345678");
    }
}
