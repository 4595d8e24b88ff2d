package com.anirudhology.bpetokenizer.tokenizer;

import java.nio.file.Path;
import java.util.List;

/**
 * Text to token ids and back.
 * <p>
 * {@link #load(Path)} must not run concurrently with any other call on the same
 * instance. Once it has returned, {@link #encode} and {@link #decode} may be called
 * from any number of threads.
 */
public interface Tokenizer {

    /**
     * Loads a tokenizer document, or a directory holding {@code tokenizer.json} and
     * optional companion files, replacing any previously loaded state.
     */
    void load(Path path);

    /**
     * @param text     raw input
     * @param bosCount how many times to prepend the bos id
     * @param eosCount how many times to append the eos id
     * @return token ids
     */
    List<Integer> encode(String text, int bosCount, int eosCount);

    /**
     * Decodes one token in the context of the token before it.
     *
     * @param previousId id decoded just before, or any id outside the vocabulary (e.g. -1) at stream start
     * @param currentId  id to decode
     * @return text completed by the current token
     */
    String decode(int previousId, int currentId);

    int bosToken();

    int eosToken();
}
