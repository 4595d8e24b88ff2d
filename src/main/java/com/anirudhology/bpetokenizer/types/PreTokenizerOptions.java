package com.anirudhology.bpetokenizer.types;

/**
 * Options of the ByteLevel pre-tokenizer as found in the configuration document.
 *
 * @param addPrefixSpace prepend a space when the input does not start with whitespace
 * @param useRegex       split non-special spans with the byte-level segmentation pattern
 * @param trimOffsets    parsed for completeness; offsets are not produced
 */
public record PreTokenizerOptions(boolean addPrefixSpace, boolean useRegex, boolean trimOffsets) {

    // Defaults of the reference ByteLevel pre-tokenizer
    public static PreTokenizerOptions defaults() {
        return new PreTokenizerOptions(true, true, true);
    }
}
