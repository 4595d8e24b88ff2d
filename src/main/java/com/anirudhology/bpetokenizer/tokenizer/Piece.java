package com.anirudhology.bpetokenizer.tokenizer;

/**
 * One unit of pre-tokenized input.
 *
 * @param symbols      byte-alphabet symbols of the piece, or the verbatim content of an added token
 * @param addedTokenId id of the added token this piece matched, -1 for ordinary pieces
 */
public record Piece(String symbols, int addedTokenId) {

    private static final int NONE = -1;

    public static Piece ofSymbols(String symbols) {
        return new Piece(symbols, NONE);
    }

    public static Piece ofAddedToken(AddedToken addedToken) {
        return new Piece(addedToken.content(), addedToken.id());
    }

    public boolean isAddedToken() {
        return this.addedTokenId != NONE;
    }
}
