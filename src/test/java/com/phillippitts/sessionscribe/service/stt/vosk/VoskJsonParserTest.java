package com.phillippitts.sessionscribe.service.stt.vosk;

import com.phillippitts.sessionscribe.service.stt.vosk.VoskJsonParser.VoskResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class VoskJsonParserTest {

    @Test
    void shouldParseFinalResultWithWordTimings() {
        // Arrange
        String json = """
                {"text": " hello world ", "result": [
                  {"word": "hello", "start": 0.5, "end": 0.9, "conf": 0.8},
                  {"word": "world", "start": 1.0, "end": 1.6, "conf": 1.0}
                ]}""";

        // Act
        VoskResult result = VoskJsonParser.parseFinal(json);

        // Assert
        assertThat(result.text()).isEqualTo("hello world");
        assertThat(result.confidence()).isCloseTo(0.9, within(1e-9));
        assertThat(result.startSeconds()).isEqualTo(0.5);
        assertThat(result.endSeconds()).isEqualTo(1.6);
    }

    @Test
    void shouldUseFirstAlternative() {
        // Arrange
        String json = """
                {"alternatives": [
                  {"text": "best guess", "confidence": 312.5},
                  {"text": "worse guess", "confidence": 120.0}
                ]}""";

        // Act
        VoskResult result = VoskJsonParser.parseFinal(json);

        // Assert
        assertThat(result.text()).isEqualTo("best guess");
        assertThat(result.confidence()).isEqualTo(1.0);
        assertThat(result.startSeconds()).isNull();
    }

    @Test
    void shouldReturnEmptyResultForBlankOrMalformedInput() {
        assertThat(VoskJsonParser.parseFinal(null).isEmpty()).isTrue();
        assertThat(VoskJsonParser.parseFinal("   ").isEmpty()).isTrue();
        assertThat(VoskJsonParser.parseFinal("{not json").isEmpty()).isTrue();
        assertThat(VoskJsonParser.parseFinal("{\"alternatives\": []}").isEmpty()).isTrue();
        assertThat(VoskJsonParser.parseFinal("{\"text\": \"\"}").confidence()).isNull();
    }

    @Test
    void shouldParsePartialText() {
        assertThat(VoskJsonParser.parsePartial("{\"partial\": \"hel\"}")).isEqualTo("hel");
        assertThat(VoskJsonParser.parsePartial("{}")).isEmpty();
        assertThat(VoskJsonParser.parsePartial("oops")).isEmpty();
    }
}
