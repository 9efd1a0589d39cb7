package io.github.samzhu.eduhub.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class DisplayIdsTest {

    @Test
    void shouldPadToThreeDigits() {
        assertThat(DisplayIds.format("STU", 7)).isEqualTo("STU_007");
        assertThat(DisplayIds.format("COURSE", 42)).isEqualTo("COURSE_042");
        assertThat(DisplayIds.format("SUB", 1000)).isEqualTo("SUB_1000");
    }

    @Test
    void shouldParseSuffixForMatchingPrefix() {
        assertThat(DisplayIds.parseSuffix("INST_012", "INST")).isEqualTo(12);
        assertThat(DisplayIds.parseSuffix("STU_1000", "STU")).isEqualTo(1000);
    }

    @Test
    void shouldReturnZeroForMismatchedId() {
        assertThat(DisplayIds.parseSuffix("STU_001", "INST")).isZero();
        assertThat(DisplayIds.parseSuffix("STU_abc", "STU")).isZero();
        assertThat(DisplayIds.parseSuffix(null, "STU")).isZero();
    }

    @Test
    void patternShouldOnlyMatchIdsWithPrefix() {
        // Given
        String pattern = DisplayIds.patternFor("STU");

        // Then
        assertThat("STU_001").matches(pattern);
        assertThat("STU_1234").matches(pattern);
        assertThat("STUDENT_001").doesNotMatch(pattern);
        assertThat("INST_001").doesNotMatch(pattern);
    }
}
