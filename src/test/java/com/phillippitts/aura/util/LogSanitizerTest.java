package com.phillippitts.aura.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void truncatesLongText() {
        assertThat(LogSanitizer.truncate("fever and rash on cheeks", 5)).isEqualTo("fever");
    }

    @Test
    void shortTextIsUnchanged() {
        assertThat(LogSanitizer.truncate("fever", 80)).isEqualTo("fever");
    }

    @Test
    void nullOrNonPositiveMaxYieldsEmpty() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("fever", 0)).isEmpty();
    }

    @Test
    void previewFlattensLineBreaks() {
        assertThat(LogSanitizer.preview("fever\nrash\r\non cheeks")).isEqualTo("fever rash on cheeks");
        assertThat(LogSanitizer.preview(null)).isEmpty();
    }

    @Test
    void previewMarksCutText() {
        String preview = LogSanitizer.preview("a".repeat(100));

        assertThat(preview).hasSize(LogSanitizer.DEFAULT_PREVIEW_CHARS + 3).endsWith("...");
    }
}
