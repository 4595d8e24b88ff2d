package com.anirudhology.bpetokenizer.tokenizer;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Fixed bijection between the 256 byte values and 256 printable characters.
 * <p>
 * Printable Latin-1 bytes ('!'..'~', '¡'..'¬', '®'..'ÿ') stand for themselves.
 * The remaining 68 bytes (control characters, space, DEL, NBSP, soft hyphen) are
 * shifted, in ascending byte order, to U+0100, U+0101, ... so that every byte has a
 * visible representation. For example, space (0x20) becomes 'Ġ' (U+0120) and
 * newline (0x0A) becomes 'Ċ' (U+010A).
 * <p>
 * Every symbol is a single UTF-16 char, so a token of n bytes is a string of
 * length n.
 */
public final class ByteAlphabet {

    // byte value -> symbol
    private static final char[] BYTE_TO_SYMBOL = new char[256];

    // symbol -> byte value, -1 for chars outside the alphabet. Largest symbol is U+0143.
    private static final int[] SYMBOL_TO_BYTE = new int[0x144];

    static {
        Arrays.fill(SYMBOL_TO_BYTE, -1);
        int shifted = 0;
        for (int b = 0; b < 256; b++) {
            char symbol;
            if (isPrintable(b)) {
                symbol = (char) b;
            } else {
                symbol = (char) (256 + shifted);
                shifted++;
            }
            BYTE_TO_SYMBOL[b] = symbol;
            SYMBOL_TO_BYTE[symbol] = b;
        }
    }

    private ByteAlphabet() {
    }

    private static boolean isPrintable(int b) {
        return (b >= '!' && b <= '~') || (b >= 0xA1 && b <= 0xAC) || (b >= 0xAE && b <= 0xFF);
    }

    /**
     * @param b raw byte
     * @return the alphabet symbol standing for the byte
     */
    public static char symbolFor(byte b) {
        return BYTE_TO_SYMBOL[Byte.toUnsignedInt(b)];
    }

    /**
     * Maps raw bytes to their symbol string, one char per byte.
     *
     * @param bytes raw bytes, typically the UTF-8 encoding of a piece of text
     * @return symbol string of the same length
     */
    public static String encode(byte[] bytes) {
        final char[] symbols = new char[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            symbols[i] = symbolFor(bytes[i]);
        }
        return new String(symbols);
    }

    /**
     * @param symbol a char of a token string
     * @return the byte value (0-255) the symbol stands for, or -1 if the char is not
     * part of the alphabet
     */
    public static int byteFor(char symbol) {
        if (symbol >= SYMBOL_TO_BYTE.length) {
            return -1;
        }
        return SYMBOL_TO_BYTE[symbol];
    }

    public static boolean contains(char symbol) {
        return byteFor(symbol) >= 0;
    }

    /**
     * Maps a token string back to raw bytes. A token holding any char outside the
     * alphabet was not produced from bytes, so the whole token is taken as text and
     * encoded as UTF-8.
     *
     * @param symbols token string
     * @return raw bytes
     */
    public static byte[] decode(String symbols) {
        final byte[] bytes = new byte[symbols.length()];
        for (int i = 0; i < symbols.length(); i++) {
            final int b = byteFor(symbols.charAt(i));
            if (b < 0) {
                return symbols.getBytes(StandardCharsets.UTF_8);
            }
            bytes[i] = (byte) b;
        }
        return bytes;
    }
}
