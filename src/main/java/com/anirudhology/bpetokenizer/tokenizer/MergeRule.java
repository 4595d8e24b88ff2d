package com.anirudhology.bpetokenizer.tokenizer;

/**
 * One merge rule: the adjacent pair (left, right) becomes a single symbol.
 *
 * @param left  left component
 * @param right right component
 * @param rank  priority, lower merges first
 */
public record MergeRule(String left, String right, int rank) {

    public String merged() {
        return this.left + this.right;
    }
}
