package com.anirudhology.bpetokenizer.tokenizer;

public enum TokenizerState {
    UNINITIALIZED,
    LOADED
}
