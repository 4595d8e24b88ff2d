package com.anirudhology.bpetokenizer.data;

import com.google.gson.JsonElement;
import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Map;

/**
 * Gson mapping of the parts of {@code tokenizer.json} the tokenizer reads.
 * Sections it does not model (decoder, post_processor, padding, truncation) are
 * ignored by Gson.
 */
final class TokenizerDocument {

    String version;

    ModelSection model;

    // Must be absent or null, kept as a raw element so any present value is detected
    JsonElement normalizer;

    @SerializedName("pre_tokenizer")
    PreTokenizerSection preTokenizer;

    @SerializedName("added_tokens")
    List<AddedTokenEntry> addedTokens;

    static final class ModelSection {

        String type;

        // Gson rejects duplicate keys while filling a map
        Map<String, Integer> vocab;

        // Entries are strings ("a b", "#version: 0.2") or two-element arrays
        List<JsonElement> merges;

        @SerializedName("unk_token")
        String unkToken;
    }

    static final class PreTokenizerSection {

        String type;

        @SerializedName("add_prefix_space")
        Boolean addPrefixSpace;

        @SerializedName("use_regex")
        Boolean useRegex;

        @SerializedName("trim_offsets")
        Boolean trimOffsets;
    }

    static final class AddedTokenEntry {

        String content;

        Integer id;

        boolean special;
    }
}
