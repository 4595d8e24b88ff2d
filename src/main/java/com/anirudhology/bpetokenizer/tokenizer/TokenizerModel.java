package com.anirudhology.bpetokenizer.tokenizer;

import com.anirudhology.bpetokenizer.types.PreTokenizerOptions;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Everything a successful load produces. Immutable, so one instance can serve
 * concurrent encode and decode calls without locking.
 */
public final class TokenizerModel {

    private final Vocabulary vocabulary;
    private final MergeTable mergeTable;
    private final SpecialTokenRegistry specialTokens;
    private final ByteLevelPreTokenizer preTokenizer;
    private final BPEEngine engine;

    // Added tokens are verbatim text, not byte-alphabet symbols
    private final Map<Integer, AddedToken> addedTokensById;

    public TokenizerModel(Vocabulary vocabulary, MergeTable mergeTable, SpecialTokenRegistry specialTokens,
                          PreTokenizerOptions preTokenizerOptions) {
        this.vocabulary = vocabulary;
        this.mergeTable = mergeTable;
        this.specialTokens = specialTokens;
        this.preTokenizer = new ByteLevelPreTokenizer(preTokenizerOptions, specialTokens.addedTokens());
        this.engine = new BPEEngine(vocabulary, mergeTable, specialTokens.resolvedId(SpecialTokenRegistry.UNK));

        final Map<Integer, AddedToken> byId = new HashMap<>();
        for (AddedToken addedToken : specialTokens.addedTokens()) {
            byId.put(addedToken.id(), addedToken);
        }
        this.addedTokensById = Collections.unmodifiableMap(byId);
    }

    public Vocabulary vocabulary() {
        return this.vocabulary;
    }

    public MergeTable mergeTable() {
        return this.mergeTable;
    }

    public SpecialTokenRegistry specialTokens() {
        return this.specialTokens;
    }

    public ByteLevelPreTokenizer preTokenizer() {
        return this.preTokenizer;
    }

    public BPEEngine engine() {
        return this.engine;
    }

    /**
     * @param id token id
     * @return raw bytes the token stands for, or {@code null} if the id is not in the vocabulary
     */
    public byte[] rawBytes(int id) {
        final AddedToken addedToken = this.addedTokensById.get(id);
        if (addedToken != null) {
            return addedToken.content().getBytes(StandardCharsets.UTF_8);
        }
        final String token = this.vocabulary.tokenOf(id);
        return token == null ? null : ByteAlphabet.decode(token);
    }
}
