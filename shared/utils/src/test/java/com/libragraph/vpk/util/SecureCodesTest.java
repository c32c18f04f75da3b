package com.libragraph.vpk.util;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.*;

class SecureCodesTest {

    @Test
    void shouldGenerateRequestedLength() {
        assertThat(SecureCodes.generate(32)).hasSize(32);
        assertThat(SecureCodes.generate(1)).hasSize(1);
    }

    @Test
    void shouldDrawOnlyFromSelectedCharsets() {
        String digits = SecureCodes.generate(200, EnumSet.of(SecureCodes.Charset.DIGITS));
        assertThat(digits).matches("[0-9]+");

        String letters = SecureCodes.generate(200,
                EnumSet.of(SecureCodes.Charset.LOWERCASE, SecureCodes.Charset.UPPERCASE));
        assertThat(letters).matches("[a-zA-Z]+");
    }

    @Test
    void defaultCodeShouldBeAlphanumeric() {
        assertThat(SecureCodes.generate(100)).matches("[a-zA-Z0-9]+");
    }

    @Test
    void shouldNotRepeatCodes() {
        assertThat(SecureCodes.generate(32)).isNotEqualTo(SecureCodes.generate(32));
    }

    @Test
    void shouldRejectInvalidArguments() {
        assertThatIllegalArgumentException().isThrownBy(() -> SecureCodes.generate(0));
        assertThatIllegalArgumentException()
                .isThrownBy(() -> SecureCodes.generate(8, EnumSet.noneOf(SecureCodes.Charset.class)));
    }
}
