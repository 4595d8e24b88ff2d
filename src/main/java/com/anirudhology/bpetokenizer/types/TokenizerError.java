package com.anirudhology.bpetokenizer.types;

/**
 * The four kinds of failure a tokenizer call can report.
 */
public enum TokenizerError {
    // Operation attempted before a successful load
    UNINITIALIZED,
    // Bad path, malformed document or unsupported feature
    LOAD_FAILURE,
    // Unknown symbol without unk fallback, or unresolved special token
    ENCODE_FAILURE,
    // Id not present in the vocabulary
    DECODE_FAILURE
}
