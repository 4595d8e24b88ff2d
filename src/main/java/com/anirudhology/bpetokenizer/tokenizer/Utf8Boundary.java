package com.anirudhology.bpetokenizer.tokenizer;

import java.nio.charset.StandardCharsets;

/**
 * UTF-8 reassembly for characters whose bytes are split across adjacent tokens.
 * <p>
 * A multi-byte character belongs to the token that completes it. When decoding a
 * token, the incomplete sequence at the end of the previous token is put in front
 * of the current bytes, and an incomplete sequence at the end of the current bytes
 * is held back for the next token. Bytes that cannot form a character come out as
 * U+FFFD.
 */
final class Utf8Boundary {

    private static final byte[] EMPTY = new byte[0];

    private Utf8Boundary() {
    }

    /**
     * Decodes the text attributable to the current token.
     *
     * @param previous raw bytes of the previous token, empty when there is none
     * @param current  raw bytes of the current token
     * @return text completed by the current token
     */
    static String decode(byte[] previous, byte[] current) {
        final int pending = incompleteTail(previous, previous.length);

        final byte[] combined = new byte[pending + current.length];
        System.arraycopy(previous, previous.length - pending, combined, 0, pending);
        System.arraycopy(current, 0, combined, pending, current.length);

        final int withheld = incompleteTail(combined, combined.length);
        return new String(combined, 0, combined.length - withheld, StandardCharsets.UTF_8);
    }

    static String decode(byte[] current) {
        return decode(EMPTY, current);
    }

    /**
     * Length of the incomplete sequence at the end of {@code bytes[0, length)}: the
     * trailing lead byte and its continuation bytes when fewer continuation bytes
     * follow it than the lead byte announces.
     *
     * @return 0 to 3
     */
    static int incompleteTail(byte[] bytes, int length) {
        final int limit = Math.min(3, length);
        for (int k = 1; k <= limit; k++) {
            final int b = Byte.toUnsignedInt(bytes[length - k]);
            if (isContinuation(b)) {
                continue;
            }
            return sequenceLength(b) > k ? k : 0;
        }
        return 0;
    }

    static boolean isContinuation(int b) {
        return (b & 0xC0) == 0x80;
    }

    /**
     * @return number of bytes announced by a lead byte, 1 for ASCII and invalid bytes
     */
    static int sequenceLength(int lead) {
        if ((lead & 0xE0) == 0xC0) {
            return 2;
        }
        if ((lead & 0xF0) == 0xE0) {
            return 3;
        }
        if ((lead & 0xF8) == 0xF0) {
            return 4;
        }
        return 1;
    }
}
