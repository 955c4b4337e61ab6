package com.piiguard.infrastructure.crypto;

import com.piiguard.domain.model.SearchHash;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FieldHasherTest {

    private final FieldHasher hasher = new FieldHasher();

    @Test
    @DisplayName("Should produce the SHA-256 hex digest")
    void shouldProduceSha256() {
        // sha256("abc")
        assertThat(hasher.hash("abc").hex())
            .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    @DisplayName("Should ignore case")
    void shouldIgnoreCase() {
        assertThat(hasher.hash("ABC")).isEqualTo(hasher.hash("abc"));
        assertThat(hasher.hash("Alice@Example.COM")).isEqualTo(hasher.hash("alice@example.com"));
    }

    @Test
    @DisplayName("Should not trim whitespace")
    void shouldNotTrim() {
        assertThat(hasher.hash(" abc")).isNotEqualTo(hasher.hash("abc"));
    }

    @Test
    @DisplayName("Should be deterministic")
    void shouldBeDeterministic() {
        assertThat(hasher.hash("13812345678")).isEqualTo(hasher.hash("13812345678"));
    }

    @Test
    @DisplayName("Should reject null or empty input")
    void shouldRejectEmpty() {
        assertThatThrownBy(() -> hasher.hash(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> hasher.hash("")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should match a stored hash and never match empty input")
    void shouldMatchStored() {
        SearchHash stored = hasher.hash("13812345678");

        assertThat(hasher.matches("13812345678", stored)).isTrue();
        assertThat(hasher.matches("13812345679", stored)).isFalse();
        assertThat(hasher.matches("", stored)).isFalse();
        assertThat(hasher.matches("13812345678", null)).isFalse();
    }
}
