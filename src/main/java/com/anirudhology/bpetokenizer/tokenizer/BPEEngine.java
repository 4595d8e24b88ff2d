package com.anirudhology.bpetokenizer.tokenizer;

import com.anirudhology.bpetokenizer.types.FailureReason;
import com.anirudhology.bpetokenizer.types.TokenizerException;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.PriorityQueue;

/**
 * Byte-pair merging of a single piece.
 * <p>
 * Starting from one symbol per byte, the adjacent pair with the lowest rank is
 * merged until a single symbol remains or no adjacent pair has a rule. Only the
 * two pairs around a merged position change, so only those are ranked again
 * after each merge.
 * <p>
 * Instances are immutable and can be shared between threads.
 */
public final class BPEEngine {

    private final Vocabulary vocabulary;
    private final MergeTable mergeTable;

    // Fallback for symbols missing from the vocabulary, empty when unk is not resolved
    private final OptionalInt unkId;

    public BPEEngine(Vocabulary vocabulary, MergeTable mergeTable, OptionalInt unkId) {
        this.vocabulary = vocabulary;
        this.mergeTable = mergeTable;
        this.unkId = unkId;
    }

    /**
     * Merges the symbols of a piece and resolves them to ids.
     *
     * @param symbols byte-alphabet symbols of one piece
     * @param out     list the ids are appended to
     * @throws TokenizerException with {@link FailureReason#UNKNOWN_SYMBOL} when a final
     *                            symbol is not in the vocabulary and unk is not resolved
     */
    public void encode(String symbols, List<Integer> out) {
        for (String symbol : merge(symbols)) {
            final OptionalInt id = this.vocabulary.idOf(symbol);
            if (id.isPresent()) {
                out.add(id.getAsInt());
            } else if (this.unkId.isPresent()) {
                out.add(this.unkId.getAsInt());
            } else {
                throw new TokenizerException(FailureReason.UNKNOWN_SYMBOL,
                        "Symbol '" + symbol + "' is not in the vocabulary and no unk token is resolved");
            }
        }
    }

    public List<Integer> encode(String symbols) {
        final List<Integer> ids = new ArrayList<>();
        encode(symbols, ids);
        return ids;
    }

    /**
     * Applies merge rules to a symbol sequence.
     * <p>
     * Symbols are kept in a linked list over their start positions and candidate
     * pairs in a queue ordered by rank, then position. A queued pair whose symbols
     * have changed since it was queued is skipped.
     *
     * @param symbols one char per initial symbol
     * @return the final symbols, in order
     */
    List<String> merge(String symbols) {
        final int length = symbols.length();
        if (length < 2) {
            return length == 0 ? new ArrayList<>() : new ArrayList<>(List.of(symbols));
        }

        // parts[i] is the symbol starting at position i, null once merged into its left neighbour
        final String[] parts = new String[length];
        final int[] previous = new int[length];
        final int[] next = new int[length];
        for (int i = 0; i < length; i++) {
            parts[i] = String.valueOf(symbols.charAt(i));
            previous[i] = i - 1;
            next[i] = i + 1;
        }

        final PriorityQueue<Candidate> queue = new PriorityQueue<>();
        for (int i = 0; i < length - 1; i++) {
            offer(queue, parts, i, i + 1);
        }

        while (!queue.isEmpty()) {
            final Candidate candidate = queue.poll();
            final int left = candidate.left();
            final int right = candidate.right();
            if (parts[left] == null || next[left] != right
                    || !parts[left].equals(candidate.leftSymbol())
                    || !parts[right].equals(candidate.rightSymbol())) {
                continue;
            }

            parts[left] = parts[left] + parts[right];
            parts[right] = null;
            next[left] = next[right];
            if (next[left] < length) {
                previous[next[left]] = left;
            }

            if (previous[left] >= 0) {
                offer(queue, parts, previous[left], left);
            }
            if (next[left] < length) {
                offer(queue, parts, left, next[left]);
            }
        }

        // Position 0 is never merged away, so it heads the list
        final List<String> merged = new ArrayList<>();
        for (int i = 0; i < length; i = next[i]) {
            merged.add(parts[i]);
        }
        return merged;
    }

    private void offer(PriorityQueue<Candidate> queue, String[] parts, int left, int right) {
        final int rank = this.mergeTable.rankOf(parts[left], parts[right]);
        if (rank != MergeTable.NO_MERGE) {
            queue.add(new Candidate(rank, left, right, parts[left], parts[right]));
        }
    }

    // Lowest rank first, leftmost on ties
    private record Candidate(int rank, int left, int right, String leftSymbol, String rightSymbol)
            implements Comparable<Candidate> {

        @Override
        public int compareTo(Candidate other) {
            final int byRank = Integer.compare(this.rank, other.rank);
            return byRank != 0 ? byRank : Integer.compare(this.left, other.left);
        }
    }
}
