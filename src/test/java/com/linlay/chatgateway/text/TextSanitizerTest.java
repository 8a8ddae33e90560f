package com.linlay.chatgateway.text;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextSanitizerTest {

    @Test
    void shouldDropControlAndFormatCharactersButKeepLineBreaks() {
        String raw = "a\u0000b\u200Bc\nd\te\r\n";

        assertThat(TextSanitizer.sanitize(raw)).isEqualTo("abc\nd\te\r\n");
    }

    @Test
    void shouldApplyCompatibilityNormalization() {
        assertThat(TextSanitizer.sanitize("ﬁle ①")).isEqualTo("file 1");
    }

    @Test
    void shouldKeepCyrillicText() {
        assertThat(TextSanitizer.sanitize("Привет, мир")).isEqualTo("Привет, мир");
    }

    @Test
    void stripInvalidSequencesShouldRemoveLoneSurrogatesAndReplacementChar() {
        String raw = "ok\uD800-\uDC00-\uFFFD-\uD83D\uDE00";

        assertThat(TextSanitizer.stripInvalidSequences(raw)).isEqualTo("ok---\uD83D\uDE00");
    }

    @Test
    void stripInvalidSequencesShouldReturnSameInstanceWhenClean() {
        String clean = "nothing to strip";

        assertThat(TextSanitizer.stripInvalidSequences(clean)).isSameAs(clean);
    }
}
