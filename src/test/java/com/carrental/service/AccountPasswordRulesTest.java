package com.carrental.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AccountPasswordRulesTest {

    @Test
    void strongPassword_hasNoProblems() {
        assertThat(AccountService.passwordProblems("Password1")).isEmpty();
    }

    @Test
    void shortPassword_reportsLengthOnly() {
        assertThat(AccountService.passwordProblems("Ab1"))
                .containsExactly("Password must be at least 6 characters long.");
        assertThat(AccountService.passwordProblems(null)).hasSize(1);
    }

    @Test
    void missingCharacterClasses_areEachReported() {
        assertThat(AccountService.passwordProblems("abcdefg")).containsExactly(
                "Password must contain a digit.",
                "Password must contain an upper-case letter.");
        assertThat(AccountService.passwordProblems("ABCDEF12"))
                .containsExactly("Password must contain a lower-case letter.");
    }
}
