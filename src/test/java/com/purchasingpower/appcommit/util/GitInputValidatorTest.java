package com.purchasingpower.appcommit.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Git input validation")
class GitInputValidatorTest {

    @ParameterizedTest
    @ValueSource(strings = {"main", "feature/add-auth", "release/1.0.0", "hotfix_2024"})
    @DisplayName("Should accept ordinary branch names")
    void testValidateBranchName_Valid(String branch) {
        assertDoesNotThrow(() -> GitInputValidator.validateBranchName(branch));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "main?x=1", "a b", "/main", "main/", ".hidden", "a..b", "a//b", "topic.lock", "100%"})
    @DisplayName("Should reject names that are not safe ref path segments")
    void testValidateBranchName_Invalid(String branch) {
        assertThrows(IllegalArgumentException.class, () -> GitInputValidator.validateBranchName(branch));
    }

    @Test
    @DisplayName("Should validate owner and repository segments")
    void testValidateRepoSegment() {
        assertDoesNotThrow(() -> GitInputValidator.validateRepoSegment("owner", "octo-org"));
        assertDoesNotThrow(() -> GitInputValidator.validateRepoSegment("name", "my.repo_1"));
        assertThrows(IllegalArgumentException.class, () -> GitInputValidator.validateRepoSegment("owner", "a/b"));
        assertThrows(IllegalArgumentException.class, () -> GitInputValidator.validateRepoSegment("name", null));
    }

    @Test
    @DisplayName("Should accept only full object ids")
    void testValidateObjectId() {
        assertDoesNotThrow(() -> GitInputValidator.validateObjectId("aa218f56b14c9653891f9e74264a383fa43fefbd"));
        assertThrows(IllegalArgumentException.class, () -> GitInputValidator.validateObjectId("aa218f5"));
    }
}
