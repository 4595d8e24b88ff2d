package com.anirudhology.bpetokenizer.types;

/**
 * Detailed cause of a {@link TokenizerException}. Every reason belongs to exactly
 * one {@link TokenizerError} kind.
 */
public enum FailureReason {
    NOT_LOADED(TokenizerError.UNINITIALIZED),

    UNREADABLE_PATH(TokenizerError.LOAD_FAILURE),
    MALFORMED_DOCUMENT(TokenizerError.LOAD_FAILURE),
    UNSUPPORTED_MODEL(TokenizerError.LOAD_FAILURE),
    UNSUPPORTED_PRE_TOKENIZER(TokenizerError.LOAD_FAILURE),
    UNSUPPORTED_NORMALIZER(TokenizerError.LOAD_FAILURE),
    DUPLICATE_VOCABULARY_ENTRY(TokenizerError.LOAD_FAILURE),

    UNKNOWN_SYMBOL(TokenizerError.ENCODE_FAILURE),
    UNRESOLVED_SPECIAL_TOKEN(TokenizerError.ENCODE_FAILURE),

    INVALID_ID(TokenizerError.DECODE_FAILURE);

    private final TokenizerError error;

    FailureReason(TokenizerError error) {
        this.error = error;
    }

    public TokenizerError error() {
        return this.error;
    }
}
