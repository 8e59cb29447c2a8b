package com.carrental.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CaptchaServiceTest {

    private final CaptchaService captcha = new CaptchaService();

    @Test
    void generatedCodes_useUnambiguousAlphabet() {
        for (int i = 0; i < 50; i++) {
            String code = captcha.generateCode();
            assertThat(code).hasSize(CaptchaService.CODE_LENGTH);
            assertThat(code.chars()).allMatch(c -> CaptchaService.ALPHABET.indexOf(c) >= 0);
            assertThat(code).doesNotContain("0", "O", "1", "I");
        }
    }

    @Test
    void validate_ignoresCaseAndSurroundingSpaces() {
        assertThat(captcha.validate(" ab3cd ", "AB3CD")).isTrue();
        assertThat(captcha.validate("AB3CE", "AB3CD")).isFalse();
        assertThat(captcha.validate("AB3CD", null)).isFalse();
        assertThat(captcha.validate(null, "AB3CD")).isFalse();
    }
}
