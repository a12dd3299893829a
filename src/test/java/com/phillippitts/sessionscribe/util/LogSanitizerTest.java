package com.phillippitts.sessionscribe.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNullOrNonPositiveMax() {
        assertThat(LogSanitizer.sanitize(null)).isEmpty();
        assertThat(LogSanitizer.sanitize("hello", 0)).isEmpty();
        assertThat(LogSanitizer.sanitize("hello", -1)).isEmpty();
    }

    @Test
    void shouldReplaceControlCharacters() {
        assertThat(LogSanitizer.sanitize("Alice\r\n[INFO] forged")).isEqualTo("Alice  [INFO] forged");
        assertThat(LogSanitizer.sanitize("tab\there")).isEqualTo("tab here");
    }

    @Test
    void shouldTruncateLongValues() {
        assertThat(LogSanitizer.sanitize("hello world", 5)).isEqualTo("hello...");
        assertThat(LogSanitizer.sanitize("12345", 5)).isEqualTo("12345");
        assertThat(LogSanitizer.sanitize("a".repeat(500))).hasSize(123);
    }

    @Test
    void shouldPreserveUnicode() {
        assertThat(LogSanitizer.sanitize("Zoë 🎧")).isEqualTo("Zoë 🎧");
    }
}
