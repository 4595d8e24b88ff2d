package com.anirudhology.bpetokenizer.tokenizer;

import com.anirudhology.bpetokenizer.types.FailureReason;
import com.anirudhology.bpetokenizer.types.TokenizerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Named special tokens (bos, eos, unk, pad, ...) and the verbatim added tokens.
 * <p>
 * A name can be in one of three states:
 * <ul>
 *   <li>unconfigured: no companion file mentions it, callers fall back to a default id</li>
 *   <li>resolved: configured and found in the vocabulary</li>
 *   <li>unresolved: configured but absent from the vocabulary; any encode that needs
 *   it fails</li>
 * </ul>
 */
public final class SpecialTokenRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(SpecialTokenRegistry.class);

    public static final String BOS = "bos";
    public static final String EOS = "eos";
    public static final String UNK = "unk";
    public static final String PAD = "pad";

    // name -> token text as configured (or "#<id>" for numeric bindings)
    private final Map<String, String> configured;

    // name -> id, only for names found in the vocabulary
    private final Map<String, Integer> resolved;

    private final List<AddedToken> addedTokens;

    // Ids reported by isSpecial: special added tokens plus every resolved name
    private final Set<Integer> specialIds;

    private SpecialTokenRegistry(Map<String, String> configured, Map<String, Integer> resolved,
                                 List<AddedToken> addedTokens) {
        this.configured = Collections.unmodifiableMap(configured);
        this.resolved = Collections.unmodifiableMap(resolved);
        this.addedTokens = Collections.unmodifiableList(addedTokens);

        final Set<Integer> ids = new HashSet<>(resolved.values());
        for (AddedToken addedToken : addedTokens) {
            if (addedToken.special()) {
                ids.add(addedToken.id());
            }
        }
        this.specialIds = Collections.unmodifiableSet(ids);
    }

    public static Builder builder(Vocabulary vocabulary) {
        return new Builder(vocabulary);
    }

    public boolean isConfigured(String name) {
        return this.configured.containsKey(name);
    }

    /**
     * @return id of the name if it is configured and resolved, otherwise empty
     */
    public OptionalInt resolvedId(String name) {
        final Integer id = this.resolved.get(name);
        return id == null ? OptionalInt.empty() : OptionalInt.of(id);
    }

    /**
     * Id to report for the name, never failing.
     *
     * @param defaultId id used when the name is unconfigured or unresolved
     */
    public int idOrDefault(String name, int defaultId) {
        return this.resolved.getOrDefault(name, defaultId);
    }

    /**
     * Id to insert for the name during encode.
     *
     * @param defaultId id used when no companion file configures the name
     * @throws TokenizerException with {@link FailureReason#UNRESOLVED_SPECIAL_TOKEN}
     *                            when the name is configured but was not found in the vocabulary
     */
    public int requireId(String name, int defaultId) {
        final Integer id = this.resolved.get(name);
        if (id != null) {
            return id;
        }
        if (this.configured.containsKey(name)) {
            throw new TokenizerException(FailureReason.UNRESOLVED_SPECIAL_TOKEN,
                    "Special token '" + name + "' (" + this.configured.get(name) + ") is not in the vocabulary");
        }
        return defaultId;
    }

    public List<AddedToken> addedTokens() {
        return this.addedTokens;
    }

    public boolean isSpecial(int id) {
        return this.specialIds.contains(id);
    }

    /**
     * Binds names against a finished vocabulary. The first binding of a name wins,
     * so sources must be applied from most to least authoritative.
     */
    public static final class Builder {

        private final Vocabulary vocabulary;
        private final Map<String, String> configured = new HashMap<>();
        private final Map<String, Integer> resolved = new HashMap<>();
        private final List<AddedToken> addedTokens = new ArrayList<>();

        private Builder(Vocabulary vocabulary) {
            this.vocabulary = vocabulary;
        }

        public boolean isBound(String name) {
            return this.configured.containsKey(name);
        }

        /**
         * Binds a name to a token string. An unknown string leaves the name
         * unresolved without failing.
         */
        public Builder bind(String name, String token) {
            if (isBound(name)) {
                return this;
            }
            this.configured.put(name, token);
            final OptionalInt id = this.vocabulary.idOf(token);
            if (id.isPresent()) {
                this.resolved.put(name, id.getAsInt());
                LOG.debug("Special token '{}' -> '{}' ({})", name, token, id.getAsInt());
            } else {
                LOG.warn("Special token '{}' -> '{}' is not in the vocabulary, leaving it unresolved", name, token);
            }
            return this;
        }

        /**
         * Binds a name directly to an id, as generation configs do.
         */
        public Builder bindId(String name, int id) {
            if (isBound(name)) {
                return this;
            }
            this.configured.put(name, "#" + id);
            if (this.vocabulary.contains(id)) {
                this.resolved.put(name, id);
                LOG.debug("Special token '{}' -> id {}", name, id);
            } else {
                LOG.warn("Special token '{}' -> id {} is not in the vocabulary, leaving it unresolved", name, id);
            }
            return this;
        }

        public Builder addedToken(AddedToken addedToken) {
            this.addedTokens.add(addedToken);
            return this;
        }

        public SpecialTokenRegistry build() {
            return new SpecialTokenRegistry(new HashMap<>(this.configured), new HashMap<>(this.resolved),
                    new ArrayList<>(this.addedTokens));
        }
    }
}
