package com.anirudhology.bpetokenizer.tokenizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rank lookup for ordered pairs of token strings.
 * <p>
 * Ranks follow insertion order: the first accepted rule gets rank 0 and every
 * following one the next integer, so ranks are unique and strictly increasing.
 */
public final class MergeTable {

    private static final Logger LOG = LoggerFactory.getLogger(MergeTable.class);

    // Rank of a pair that has no rule
    public static final int NO_MERGE = Integer.MAX_VALUE;

    private final Map<Pair, Integer> ranks;
    private final List<MergeRule> rules;

    private MergeTable(Map<Pair, Integer> ranks, List<MergeRule> rules) {
        this.ranks = Collections.unmodifiableMap(ranks);
        this.rules = Collections.unmodifiableList(rules);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return rank of the pair, {@link #NO_MERGE} if the pair is unmergeable
     */
    public int rankOf(String left, String right) {
        return this.ranks.getOrDefault(new Pair(left, right), NO_MERGE);
    }

    public int size() {
        return this.rules.size();
    }

    /**
     * @return rules in rank order
     */
    public List<MergeRule> rules() {
        return this.rules;
    }

    private record Pair(String left, String right) {
    }

    public static final class Builder {

        private final Map<Pair, Integer> ranks = new HashMap<>();
        private final List<MergeRule> rules = new ArrayList<>();

        private Builder() {
        }

        /**
         * Appends a rule with the next sequential rank. A pair that is already
         * present keeps its first rank.
         */
        public Builder add(String left, String right) {
            final int rank = this.rules.size();
            if (this.ranks.putIfAbsent(new Pair(left, right), rank) != null) {
                LOG.debug("Ignoring duplicate merge rule '{}' '{}'", left, right);
                return this;
            }
            this.rules.add(new MergeRule(left, right, rank));
            return this;
        }

        public MergeTable build() {
            return new MergeTable(new HashMap<>(this.ranks), new ArrayList<>(this.rules));
        }
    }
}
