package com.anirudhology.bpetokenizer.types;

/**
 * Raised by every tokenizer operation that cannot complete. The instance that threw
 * it stays usable: a failed encode or decode never modifies loaded state.
 */
public class TokenizerException extends RuntimeException {

    private final FailureReason reason;

    public TokenizerException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TokenizerException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /**
     * @return coarse failure kind, e.g. {@link TokenizerError#LOAD_FAILURE}
     */
    public TokenizerError getError() {
        return this.reason.error();
    }

    /**
     * @return the specific cause within {@link #getError()}
     */
    public FailureReason getReason() {
        return this.reason;
    }

    public static TokenizerException notLoaded() {
        return new TokenizerException(FailureReason.NOT_LOADED, "Tokenizer is not loaded yet");
    }
}
