package com.anirudhology.bpetokenizer.tokenizer;

import com.anirudhology.bpetokenizer.data.TokenizerConfigLoader;
import com.anirudhology.bpetokenizer.types.FailureReason;
import com.anirudhology.bpetokenizer.types.TokenizerException;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Byte-level BPE tokenizer driven by a {@code tokenizer.json} document.
 * <p>
 * A new instance is {@link TokenizerState#UNINITIALIZED}; every operation except
 * {@link #load(Path)} fails with {@link com.anirudhology.bpetokenizer.types.TokenizerError#UNINITIALIZED}
 * until a load succeeds. A successful load publishes an immutable {@link TokenizerModel},
 * after which encode and decode need no locking.
 * <p>
 * Reloading is allowed but must not overlap with other calls on the same instance.
 */
public class BPETokenizer implements Tokenizer {

    private final TokenizerConfigLoader loader;

    // Ids used for bos/eos when no companion file configures them
    private final int defaultBosId;
    private final int defaultEosId;

    // null while uninitialized
    private volatile TokenizerModel model;

    public BPETokenizer() {
        this(0, 0);
    }

    /**
     * @param defaultBosId bos id used when the loaded files do not configure one
     * @param defaultEosId eos id used when the loaded files do not configure one
     */
    public BPETokenizer(int defaultBosId, int defaultEosId) {
        this.loader = new TokenizerConfigLoader();
        this.defaultBosId = defaultBosId;
        this.defaultEosId = defaultEosId;
    }

    /**
     * Loads the tokenizer. On failure the instance is left uninitialized, even if an
     * earlier load had succeeded.
     *
     * @param path a tokenizer document or a directory containing {@code tokenizer.json}
     * @throws TokenizerException with {@link com.anirudhology.bpetokenizer.types.TokenizerError#LOAD_FAILURE}
     */
    @Override
    public void load(Path path) {
        this.model = null;
        this.model = this.loader.load(path);
    }

    public TokenizerState state() {
        return this.model == null ? TokenizerState.UNINITIALIZED : TokenizerState.LOADED;
    }

    /**
     * Encodes text without bos/eos.
     */
    public List<Integer> encode(String text) {
        return encode(text, 0, 0);
    }

    /**
     * Encodes text and surrounds it with repeated bos/eos ids.
     * <p>
     * The counts are repetition counts, not ids: {@code encode("hi", 1, 0)} yields
     * the bos id followed by the ids of "hi".
     *
     * @throws TokenizerException with {@link FailureReason#UNKNOWN_SYMBOL} or
     *                            {@link FailureReason#UNRESOLVED_SPECIAL_TOKEN}
     */
    @Override
    public List<Integer> encode(String text, int bosCount, int eosCount) {
        final TokenizerModel loaded = requireLoaded();
        Objects.requireNonNull(text, "text");
        if (bosCount < 0 || eosCount < 0) {
            throw new IllegalArgumentException("bos/eos counts must not be negative, got: " + bosCount + ", " + eosCount);
        }

        // Resolve special ids first so an unresolved one fails before any work is done
        final SpecialTokenRegistry specialTokens = loaded.specialTokens();
        final int bosId = bosCount > 0 ? specialTokens.requireId(SpecialTokenRegistry.BOS, this.defaultBosId) : -1;
        final int eosId = eosCount > 0 ? specialTokens.requireId(SpecialTokenRegistry.EOS, this.defaultEosId) : -1;

        final List<Integer> ids = new ArrayList<>(text.length() + bosCount + eosCount);
        for (int i = 0; i < bosCount; i++) {
            ids.add(bosId);
        }
        for (Piece piece : loaded.preTokenizer().split(text)) {
            if (piece.isAddedToken()) {
                ids.add(piece.addedTokenId());
            } else {
                loaded.engine().encode(piece.symbols(), ids);
            }
        }
        for (int i = 0; i < eosCount; i++) {
            ids.add(eosId);
        }
        return ids;
    }

    /**
     * Decodes one token, using the previous token to complete characters whose
     * UTF-8 bytes straddle the two. An incomplete character at the end of the
     * current token is left for the call that decodes the next token.
     *
     * @throws TokenizerException with {@link FailureReason#INVALID_ID} if the current id is unknown
     */
    @Override
    public String decode(int previousId, int currentId) {
        final TokenizerModel loaded = requireLoaded();
        final byte[] current = loaded.rawBytes(currentId);
        if (current == null) {
            throw new TokenizerException(FailureReason.INVALID_ID, "Token id " + currentId + " is not in the vocabulary");
        }
        final byte[] previous = loaded.rawBytes(previousId);
        return previous == null ? Utf8Boundary.decode(current) : Utf8Boundary.decode(previous, current);
    }

    /**
     * Decodes a whole id sequence as one byte stream. Unlike the pairwise decode,
     * an incomplete character at the end is emitted as U+FFFD.
     *
     * @throws TokenizerException with {@link FailureReason#INVALID_ID} if any id is unknown
     */
    public String decode(List<Integer> ids) {
        final TokenizerModel loaded = requireLoaded();
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        for (int id : ids) {
            final byte[] raw = loaded.rawBytes(id);
            if (raw == null) {
                throw new TokenizerException(FailureReason.INVALID_ID, "Token id " + id + " is not in the vocabulary");
            }
            bytes.write(raw, 0, raw.length);
        }
        return bytes.toString(StandardCharsets.UTF_8);
    }

    /**
     * @return configured bos id, or the default when none is configured or resolved
     */
    @Override
    public int bosToken() {
        return requireLoaded().specialTokens().idOrDefault(SpecialTokenRegistry.BOS, this.defaultBosId);
    }

    /**
     * @return configured eos id, or the default when none is configured or resolved
     */
    @Override
    public int eosToken() {
        return requireLoaded().specialTokens().idOrDefault(SpecialTokenRegistry.EOS, this.defaultEosId);
    }

    public int vocabSize() {
        return requireLoaded().vocabulary().size();
    }

    public OptionalInt tokenToId(String token) {
        return requireLoaded().vocabulary().idOf(token);
    }

    public Optional<String> idToToken(int id) {
        return Optional.ofNullable(requireLoaded().vocabulary().tokenOf(id));
    }

    public boolean isSpecialToken(int id) {
        return requireLoaded().specialTokens().isSpecial(id);
    }

    private TokenizerModel requireLoaded() {
        final TokenizerModel loaded = this.model;
        if (loaded == null) {
            throw TokenizerException.notLoaded();
        }
        return loaded;
    }
}
