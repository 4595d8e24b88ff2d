package com.anirudhology.bpetokenizer.tokenizer;

/**
 * A verbatim string that is matched whole against raw input and never split by BPE.
 *
 * @param content the literal text of the token
 * @param id      id inserted into the vocabulary for the token
 * @param special true for control tokens such as {@code <|endoftext|>}
 */
public record AddedToken(String content, int id, boolean special) {

    public AddedToken {
        if (content == null || content.isEmpty()) {
            throw new IllegalArgumentException("Added token content must not be empty, id: " + id);
        }
    }
}
