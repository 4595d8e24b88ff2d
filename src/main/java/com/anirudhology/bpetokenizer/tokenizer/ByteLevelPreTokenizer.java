package com.anirudhology.bpetokenizer.tokenizer;

import com.anirudhology.bpetokenizer.types.PreTokenizerOptions;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits raw text into pieces ready for BPE.
 * <p>
 * Steps, in order:
 * 1. Carve out added tokens, scanning left to right (longest match wins)
 * 2. Prepend a space to each remaining span, if configured and the span does not
 *    start with whitespace
 * 3. Segment the spans with the byte-level pattern, if enabled
 * 4. Map each segment's UTF-8 bytes to byte-alphabet symbols
 */
public final class ByteLevelPreTokenizer {

    // Contractions, letter runs, digit runs, punctuation runs and whitespace runs,
    // each optionally led by a single space
    static final Pattern BYTE_LEVEL_PATTERN = Pattern.compile(
            "'s|'t|'re|'ve|'m|'ll|'d| ?\\p{L}+| ?\\p{N}+| ?[^\\s\\p{L}\\p{N}]+|\\s+(?!\\S)|\\s+",
            Pattern.UNICODE_CHARACTER_CLASS);

    private final PreTokenizerOptions options;

    // First char -> added tokens starting with it, longest first
    private final Map<Character, List<AddedToken>> addedTokensByFirstChar;

    public ByteLevelPreTokenizer(PreTokenizerOptions options, List<AddedToken> addedTokens) {
        this.options = options;

        final Map<Character, List<AddedToken>> index = new HashMap<>();
        for (AddedToken addedToken : addedTokens) {
            index.computeIfAbsent(addedToken.content().charAt(0), c -> new ArrayList<>()).add(addedToken);
        }
        for (List<AddedToken> candidates : index.values()) {
            candidates.sort(Comparator.comparingInt((AddedToken t) -> t.content().length()).reversed());
        }
        this.addedTokensByFirstChar = Collections.unmodifiableMap(index);
    }

    public PreTokenizerOptions options() {
        return this.options;
    }

    /**
     * @param text raw input
     * @return pieces in input order, empty for empty input
     */
    public List<Piece> split(String text) {
        final List<Piece> pieces = new ArrayList<>();
        if (text.isEmpty()) {
            return pieces;
        }

        int spanStart = 0;
        int position = 0;
        while (position < text.length()) {
            final AddedToken match = matchAddedToken(text, position);
            if (match == null) {
                position++;
                continue;
            }
            splitSpan(text.substring(spanStart, position), pieces);
            pieces.add(Piece.ofAddedToken(match));
            position += match.content().length();
            spanStart = position;
        }
        splitSpan(text.substring(spanStart), pieces);
        return pieces;
    }

    private AddedToken matchAddedToken(String input, int position) {
        final List<AddedToken> candidates = this.addedTokensByFirstChar.get(input.charAt(position));
        if (candidates == null) {
            return null;
        }
        for (AddedToken candidate : candidates) {
            if (input.startsWith(candidate.content(), position)) {
                return candidate;
            }
        }
        return null;
    }

    private void splitSpan(String span, List<Piece> pieces) {
        if (span.isEmpty()) {
            return;
        }
        final String prefixed = this.options.addPrefixSpace() && !Character.isWhitespace(span.charAt(0))
                ? " " + span
                : span;
        if (!this.options.useRegex()) {
            pieces.add(toPiece(prefixed));
            return;
        }
        final Matcher matcher = BYTE_LEVEL_PATTERN.matcher(prefixed);
        while (matcher.find()) {
            pieces.add(toPiece(matcher.group()));
        }
    }

    private static Piece toPiece(String segment) {
        return Piece.ofSymbols(ByteAlphabet.encode(segment.getBytes(StandardCharsets.UTF_8)));
    }
}
