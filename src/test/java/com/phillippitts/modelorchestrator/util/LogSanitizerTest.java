package com.phillippitts.modelorchestrator.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNullOrNonPositiveMax() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", -1)).isEmpty();
        assertThat(LogSanitizer.preview(null, 10)).isEmpty();
    }

    @Test
    void shouldKeepShortStrings() {
        assertThat(LogSanitizer.truncate("hello", 10)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("12345", 5)).isEqualTo("12345");
    }

    @Test
    void shouldTruncateLongStrings() {
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("a".repeat(10000), 100)).isEqualTo("a".repeat(100));
    }

    @Test
    void previewFlattensWhitespaceAndMarksCut() {
        assertThat(LogSanitizer.preview("Explain\n\nquicksort  please", 100)).isEqualTo("Explain quicksort please");
        assertThat(LogSanitizer.preview("Explain quicksort please", 7)).isEqualTo("Explain...");
    }
}
