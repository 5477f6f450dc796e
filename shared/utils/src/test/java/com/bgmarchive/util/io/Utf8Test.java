package com.bgmarchive.util.io;

import org.junit.jupiter.api.Test;

import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class Utf8Test {

    @Test
    void shouldDecodeValidUtf8() throws Exception {
        byte[] bytes = "名前 name".getBytes(StandardCharsets.UTF_8);
        assertThat(Utf8.decode(bytes)).isEqualTo("名前 name");
    }

    @Test
    void shouldRejectMalformedSequence() {
        byte[] bytes = {'{', (byte) 0xC3, (byte) 0x28, '}'};
        assertThatThrownBy(() -> Utf8.decode(bytes)).isInstanceOf(CharacterCodingException.class);
    }

    @Test
    void shouldRejectTruncatedSequence() {
        byte[] bytes = {'a', (byte) 0xE5, (byte) 0x90};
        assertThatThrownBy(() -> Utf8.decode(bytes)).isInstanceOf(CharacterCodingException.class);
    }

    @Test
    void blankDetection() {
        assertThat(Utf8.isBlank(new byte[0])).isTrue();
        assertThat(Utf8.isBlank(" \t\r ".getBytes(StandardCharsets.US_ASCII))).isTrue();
        assertThat(Utf8.isBlank(" x ".getBytes(StandardCharsets.US_ASCII))).isFalse();
        assertThat(Utf8.isBlank(new byte[]{(byte) 0xC3})).isFalse();
    }

    @Test
    void blankDetectionShouldCoverUnicodeWhitespace() {
        assertThat(Utf8.isBlank("\u3000".getBytes(StandardCharsets.UTF_8))).isTrue();
        assertThat(Utf8.isBlank(" \u00A0\t".getBytes(StandardCharsets.UTF_8))).isTrue();
        assertThat(Utf8.isBlank("\u0085\u2007\u202F\u001F".getBytes(StandardCharsets.UTF_8))).isTrue();
        assertThat(Utf8.isBlank("\u3000x".getBytes(StandardCharsets.UTF_8))).isFalse();
        assertThat(Utf8.isBlank(new byte[]{' ', (byte) 0xE3, (byte) 0x80})).isFalse();
    }

    @Test
    void lenientReplacesMalformedBytes() {
        assertThat(Utf8.lenient(new byte[]{'a', (byte) 0xFF})).isEqualTo("a\uFFFD");
    }
}
