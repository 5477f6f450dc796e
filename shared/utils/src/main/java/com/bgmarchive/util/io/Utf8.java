package com.bgmarchive.util.io;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Strict UTF-8 helpers. Malformed input is reported, never replaced.
 */
public final class Utf8 {

    private Utf8() {}

    /**
     * Decodes the bytes as UTF-8.
     *
     * @throws CharacterCodingException on malformed or unmappable input
     */
    public static String decode(byte[] bytes) throws CharacterCodingException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        return decoder.decode(ByteBuffer.wrap(bytes)).toString();
    }

    /**
     * True if the line is empty or holds only whitespace.
     *
     * <p>ASCII lines are checked on the raw bytes. Lines with non-ASCII bytes are decoded
     * leniently and checked per code point, so U+3000 and U+00A0 count as blank while
     * malformed bytes never do.
     */
    public static boolean isBlank(byte[] bytes) {
        boolean ascii = true;
        for (byte b : bytes) {
            if (b < 0) {
                ascii = false;
            } else if (!isSpace(b)) {
                return false;
            }
        }
        return ascii || lenient(bytes).codePoints().allMatch(Utf8::isSpace);
    }

    /**
     * Java whitespace, every Unicode space separator including the non-breaking ones,
     * and NEL (U+0085).
     */
    static boolean isSpace(int codePoint) {
        return Character.isWhitespace(codePoint)
                || Character.isSpaceChar(codePoint)
                || codePoint == 0x85;
    }

    /**
     * Renders bytes for diagnostics: the decoded text when valid, otherwise the
     * text with malformed sequences replaced by U+FFFD.
     */
    public static String lenient(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
