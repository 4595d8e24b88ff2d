package com.anirudhology.bpetokenizer.tokenizer;

import com.anirudhology.bpetokenizer.types.PreTokenizerOptions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ByteLevelPreTokenizerTest {

    private static final PreTokenizerOptions REGEX = new PreTokenizerOptions(false, true, false);
    private static final PreTokenizerOptions NO_REGEX = new PreTokenizerOptions(false, false, false);

    private static List<String> symbols(ByteLevelPreTokenizer preTokenizer, String text) {
        return preTokenizer.split(text).stream().map(Piece::symbols).toList();
    }

    @Test
    void regexSplitsWordsSpacesAndPunctuation() {
        final ByteLevelPreTokenizer preTokenizer = new ByteLevelPreTokenizer(REGEX, List.of());
        assertEquals(List.of("Hello", "Ġworld", "!"), symbols(preTokenizer, "Hello world!"));
    }

    @Test
    void regexGroupsContractionsAndDigits() {
        final ByteLevelPreTokenizer preTokenizer = new ByteLevelPreTokenizer(REGEX, List.of());
        assertEquals(List.of("I", "'m", "Ġfine"), symbols(preTokenizer, "I'm fine"));
        assertEquals(List.of("abc", "Ġ123"), symbols(preTokenizer, "abc 123"));
    }

    @Test
    void regexKeepsLastSpaceOfARunWithTheNextWord() {
        final ByteLevelPreTokenizer preTokenizer = new ByteLevelPreTokenizer(REGEX, List.of());
        assertEquals(List.of("a", "Ġ", "Ġb"), symbols(preTokenizer, "a  b"));
        assertEquals(List.of("a", "Ċ"), symbols(preTokenizer, "a\n"));
    }

    @Test
    void withoutRegexTheWholeSpanIsOnePiece() {
        final ByteLevelPreTokenizer preTokenizer = new ByteLevelPreTokenizer(NO_REGEX, List.of());
        assertEquals(List.of("HelloĠworld!"), symbols(preTokenizer, "Hello world!"));
    }

    @Test
    void prefixSpaceIsAddedOnlyWhenMissing() {
        final ByteLevelPreTokenizer preTokenizer =
                new ByteLevelPreTokenizer(new PreTokenizerOptions(true, true, false), List.of());
        assertEquals(List.of("ĠHello"), symbols(preTokenizer, "Hello"));
        assertEquals(List.of("ĠHello"), symbols(preTokenizer, " Hello"));
        assertEquals(List.of("Ċ", "Hello"), symbols(preTokenizer, "\nHello"));
    }

    @Test
    void multiByteCharactersBecomeOneSymbolPerByte() {
        final ByteLevelPreTokenizer preTokenizer = new ByteLevelPreTokenizer(NO_REGEX, List.of());
        // é is C3 A9 in UTF-8
        assertEquals(List.of("Ã©"), symbols(preTokenizer, "é"));
    }

    @Test
    void addedTokensAreCarvedOutBeforeSplitting() {
        final AddedToken bos = new AddedToken("<s>", 1, true);
        final AddedToken eos = new AddedToken("</s>", 2, true);
        final ByteLevelPreTokenizer preTokenizer = new ByteLevelPreTokenizer(REGEX, List.of(bos, eos));

        final List<Piece> pieces = preTokenizer.split("<s>Hi there</s>");

        assertEquals(4, pieces.size());
        assertTrue(pieces.get(0).isAddedToken());
        assertEquals(1, pieces.get(0).addedTokenId());
        assertEquals("Hi", pieces.get(1).symbols());
        assertFalse(pieces.get(1).isAddedToken());
        assertEquals("Ġthere", pieces.get(2).symbols());
        assertEquals(2, pieces.get(3).addedTokenId());
    }

    @Test
    void prefixSpaceGoesOnTextAfterALeadingAddedToken() {
        final AddedToken bos = new AddedToken("<s>", 1, true);
        final ByteLevelPreTokenizer preTokenizer =
                new ByteLevelPreTokenizer(new PreTokenizerOptions(true, true, false), List.of(bos));

        assertEquals(List.of(Piece.ofAddedToken(bos), Piece.ofSymbols("ĠHello")), preTokenizer.split("<s>Hello"));
        assertEquals(List.of(Piece.ofSymbols("ĠHi"), Piece.ofAddedToken(bos), Piece.ofSymbols("Ġthere")),
                preTokenizer.split("Hi<s> there"));
    }

    @Test
    void longestAddedTokenWinsAtTheSamePosition() {
        final AddedToken shortToken = new AddedToken("<|end", 10, true);
        final AddedToken longToken = new AddedToken("<|endoftext|>", 11, true);
        final ByteLevelPreTokenizer preTokenizer =
                new ByteLevelPreTokenizer(NO_REGEX, List.of(shortToken, longToken));

        final List<Piece> pieces = preTokenizer.split("a<|endoftext|>b");

        assertEquals(List.of(Piece.ofSymbols("a"), Piece.ofAddedToken(longToken), Piece.ofSymbols("b")), pieces);
    }

    @Test
    void addedTokenContentIsNotByteMapped() {
        final AddedToken spaced = new AddedToken("new line", 5, false);
        final ByteLevelPreTokenizer preTokenizer = new ByteLevelPreTokenizer(REGEX, List.of(spaced));
        assertEquals(List.of("new line"), symbols(preTokenizer, "new line"));
    }

    @Test
    void emptyInputHasNoPieces() {
        final ByteLevelPreTokenizer preTokenizer =
                new ByteLevelPreTokenizer(new PreTokenizerOptions(true, true, false), List.of());
        assertTrue(preTokenizer.split("").isEmpty());
    }
}
