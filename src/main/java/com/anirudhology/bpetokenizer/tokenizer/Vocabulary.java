package com.anirudhology.bpetokenizer.tokenizer;

import com.anirudhology.bpetokenizer.types.FailureReason;
import com.anirudhology.bpetokenizer.types.TokenizerException;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Bidirectional mapping between token strings and integer ids.
 * <p>
 * Ids are unique but need not be dense. Instances are only created through
 * {@link Builder} and cannot be modified afterwards.
 */
public final class Vocabulary {

    // Stores mapping of token string against its id
    private final Map<String, Integer> tokenToId;

    // Stores mapping of id against the token string for decoding
    private final Map<Integer, String> idToToken;

    private final int maxId;

    private Vocabulary(Map<String, Integer> tokenToId, Map<Integer, String> idToToken, int maxId) {
        this.tokenToId = Collections.unmodifiableMap(tokenToId);
        this.idToToken = Collections.unmodifiableMap(idToToken);
        this.maxId = maxId;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param token token string
     * @return id of the token, empty if the token is not in the vocabulary
     */
    public OptionalInt idOf(String token) {
        final Integer id = this.tokenToId.get(token);
        return id == null ? OptionalInt.empty() : OptionalInt.of(id);
    }

    /**
     * @param id token id
     * @return token string, or {@code null} if the id is not in the vocabulary
     */
    public String tokenOf(int id) {
        return this.idToToken.get(id);
    }

    public boolean contains(int id) {
        return this.idToToken.containsKey(id);
    }

    public boolean contains(String token) {
        return this.tokenToId.containsKey(token);
    }

    public int size() {
        return this.tokenToId.size();
    }

    /**
     * @return largest id in the vocabulary, -1 when empty
     */
    public int maxId() {
        return this.maxId;
    }

    /**
     * Collects entries and rejects duplicates. Not thread safe.
     */
    public static final class Builder {

        private final Map<String, Integer> tokenToId = new HashMap<>();
        private final Map<Integer, String> idToToken = new HashMap<>();
        private int maxId = -1;

        private Builder() {
        }

        /**
         * Adds a vocabulary entry. Both the token string and the id must be new.
         *
         * @throws TokenizerException with {@link FailureReason#DUPLICATE_VOCABULARY_ENTRY}
         */
        public Builder add(String token, int id) {
            if (id < 0) {
                throw new TokenizerException(FailureReason.MALFORMED_DOCUMENT,
                        "Negative token id " + id + " for '" + token + "'");
            }
            if (this.tokenToId.containsKey(token)) {
                throw new TokenizerException(FailureReason.DUPLICATE_VOCABULARY_ENTRY,
                        "Duplicate token string '" + token + "'");
            }
            if (this.idToToken.containsKey(id)) {
                throw new TokenizerException(FailureReason.DUPLICATE_VOCABULARY_ENTRY,
                        "Duplicate token id " + id + " for '" + token + "' and '" + this.idToToken.get(id) + "'");
            }
            this.tokenToId.put(token, id);
            this.idToToken.put(id, token);
            this.maxId = Math.max(this.maxId, id);
            return this;
        }

        /**
         * Adds an added token. Re-adding an entry that already exists with the same
         * id is accepted, since tokenizer documents usually list added tokens in
         * the model vocabulary as well.
         *
         * @throws TokenizerException when the token or the id is bound differently
         */
        public Builder addIfAbsent(String token, int id) {
            final Integer existing = this.tokenToId.get(token);
            if (existing != null && existing == id) {
                return this;
            }
            return add(token, id);
        }

        public Vocabulary build() {
            return new Vocabulary(new HashMap<>(this.tokenToId), new HashMap<>(this.idToToken), this.maxId);
        }
    }
}
