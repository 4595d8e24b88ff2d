package com.anirudhology.bpetokenizer.data;

import com.anirudhology.bpetokenizer.tokenizer.AddedToken;
import com.anirudhology.bpetokenizer.tokenizer.MergeTable;
import com.anirudhology.bpetokenizer.tokenizer.SpecialTokenRegistry;
import com.anirudhology.bpetokenizer.tokenizer.TokenizerModel;
import com.anirudhology.bpetokenizer.tokenizer.Vocabulary;
import com.anirudhology.bpetokenizer.types.FailureReason;
import com.anirudhology.bpetokenizer.types.PreTokenizerOptions;
import com.anirudhology.bpetokenizer.types.TokenizerException;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Reads a tokenizer definition from disk into a {@link TokenizerModel}.
 * <p>
 * The path is either a {@code tokenizer.json} document or a directory holding one.
 * For a directory the optional companion files are read as well, each filling only
 * the special-token names not bound by the files before it:
 * 1. special_tokens_map.json - name_token -> "text" or {"content": "text"}
 * 2. tokenizer_config.json   - same shape as above
 * 3. generation_config.json  - bos_token_id / eos_token_id as numbers or arrays
 * <p>
 * Features the engine does not implement (non-BPE models, pre-tokenizers other than
 * ByteLevel, any normalizer) fail the load instead of being skipped.
 */
public class TokenizerConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(TokenizerConfigLoader.class);

    private static final Gson GSON = new Gson();

    public static final String TOKENIZER_FILE = "tokenizer.json";
    public static final String SPECIAL_TOKENS_MAP_FILE = "special_tokens_map.json";
    public static final String TOKENIZER_CONFIG_FILE = "tokenizer_config.json";
    public static final String GENERATION_CONFIG_FILE = "generation_config.json";

    private static final String VERSION_HEADER = "#version";
    private static final String TOKEN_KEY_SUFFIX = "_token";
    private static final BigDecimal MAX_ID = BigDecimal.valueOf(Integer.MAX_VALUE);

    /**
     * @param path tokenizer document or directory containing {@value #TOKENIZER_FILE}
     * @return the loaded, immutable model
     * @throws TokenizerException with {@link com.anirudhology.bpetokenizer.types.TokenizerError#LOAD_FAILURE}
     */
    public TokenizerModel load(Path path) {
        if (path == null || !Files.exists(path)) {
            throw new TokenizerException(FailureReason.UNREADABLE_PATH, "Tokenizer path does not exist: " + path);
        }
        final boolean directory = Files.isDirectory(path);
        final Path documentPath = directory ? path.resolve(TOKENIZER_FILE) : path;
        if (!Files.isRegularFile(documentPath)) {
            throw new TokenizerException(FailureReason.UNREADABLE_PATH, "No " + TOKENIZER_FILE + " found in: " + path);
        }

        final TokenizerDocument document = readDocument(documentPath);
        final TokenizerDocument.ModelSection modelSection = checkModel(document, documentPath);
        checkNormalizer(document, documentPath);
        final PreTokenizerOptions preTokenizerOptions = parsePreTokenizer(document.preTokenizer, documentPath);

        final Vocabulary.Builder vocabularyBuilder = Vocabulary.builder();
        for (Map.Entry<String, Integer> entry : modelSection.vocab.entrySet()) {
            if (entry.getValue() == null) {
                throw malformed(documentPath, "vocab entry '" + entry.getKey() + "' has no id");
            }
            vocabularyBuilder.add(entry.getKey(), entry.getValue());
        }
        final List<AddedToken> addedTokens = parseAddedTokens(document, documentPath);
        for (AddedToken addedToken : addedTokens) {
            vocabularyBuilder.addIfAbsent(addedToken.content(), addedToken.id());
        }
        final Vocabulary vocabulary = vocabularyBuilder.build();

        final MergeTable mergeTable = parseMerges(modelSection.merges, documentPath);

        final SpecialTokenRegistry.Builder registryBuilder = SpecialTokenRegistry.builder(vocabulary);
        addedTokens.forEach(registryBuilder::addedToken);
        if (directory) {
            readSpecialTokenFile(path.resolve(SPECIAL_TOKENS_MAP_FILE), registryBuilder);
            readSpecialTokenFile(path.resolve(TOKENIZER_CONFIG_FILE), registryBuilder);
            readGenerationConfig(path.resolve(GENERATION_CONFIG_FILE), registryBuilder);
        }
        if (modelSection.unkToken != null) {
            registryBuilder.bind(SpecialTokenRegistry.UNK, modelSection.unkToken);
        }

        LOG.info("Loaded tokenizer from {}: {} vocabulary entries, {} merges, {} added tokens",
                documentPath, vocabulary.size(), mergeTable.size(), addedTokens.size());
        return new TokenizerModel(vocabulary, mergeTable, registryBuilder.build(), preTokenizerOptions);
    }

    private static TokenizerDocument readDocument(Path documentPath) {
        final TokenizerDocument document;
        try (Reader reader = Files.newBufferedReader(documentPath, StandardCharsets.UTF_8)) {
            document = GSON.fromJson(reader, TokenizerDocument.class);
        } catch (IOException e) {
            LOG.error("Error reading tokenizer document due to: {}", e.getMessage());
            throw new TokenizerException(FailureReason.UNREADABLE_PATH, "Failed to read " + documentPath, e);
        } catch (JsonParseException e) {
            throw new TokenizerException(FailureReason.MALFORMED_DOCUMENT,
                    "Malformed tokenizer document " + documentPath + ": " + e.getMessage(), e);
        }
        if (document == null) {
            throw malformed(documentPath, "document is empty");
        }
        return document;
    }

    private static TokenizerDocument.ModelSection checkModel(TokenizerDocument document, Path documentPath) {
        final TokenizerDocument.ModelSection model = document.model;
        if (model == null) {
            throw malformed(documentPath, "missing model section");
        }
        if (!"BPE".equals(model.type)) {
            throw new TokenizerException(FailureReason.UNSUPPORTED_MODEL,
                    "Unsupported model type '" + model.type + "' in " + documentPath + ", only BPE is supported");
        }
        if (model.vocab == null) {
            throw malformed(documentPath, "missing model.vocab");
        }
        return model;
    }

    private static void checkNormalizer(TokenizerDocument document, Path documentPath) {
        if (document.normalizer != null && !document.normalizer.isJsonNull()) {
            throw new TokenizerException(FailureReason.UNSUPPORTED_NORMALIZER,
                    "Normalizers are not supported, found " + document.normalizer + " in " + documentPath);
        }
    }

    private static PreTokenizerOptions parsePreTokenizer(TokenizerDocument.PreTokenizerSection section,
                                                         Path documentPath) {
        if (section == null || !"ByteLevel".equals(section.type)) {
            final String type = section == null ? null : section.type;
            throw new TokenizerException(FailureReason.UNSUPPORTED_PRE_TOKENIZER,
                    "Unsupported pre_tokenizer '" + type + "' in " + documentPath + ", only ByteLevel is supported");
        }
        final PreTokenizerOptions defaults = PreTokenizerOptions.defaults();
        final PreTokenizerOptions options = new PreTokenizerOptions(
                section.addPrefixSpace != null ? section.addPrefixSpace : defaults.addPrefixSpace(),
                section.useRegex != null ? section.useRegex : defaults.useRegex(),
                section.trimOffsets != null ? section.trimOffsets : defaults.trimOffsets());
        if (options.trimOffsets()) {
            LOG.debug("trim_offsets is set but offsets are not produced, ignoring it");
        }
        return options;
    }

    private static List<AddedToken> parseAddedTokens(TokenizerDocument document, Path documentPath) {
        if (document.addedTokens == null) {
            return List.of();
        }
        return document.addedTokens.stream()
                .map(entry -> {
                    if (entry == null || entry.content == null || entry.content.isEmpty() || entry.id == null) {
                        throw malformed(documentPath, "added token needs a non-empty content and an id");
                    }
                    return new AddedToken(entry.content, entry.id, entry.special);
                })
                .toList();
    }

    /**
     * Normalizes the three merge entry forms into one rank-ordered table.
     */
    static MergeTable parseMerges(List<JsonElement> merges, Path documentPath) {
        final MergeTable.Builder builder = MergeTable.builder();
        if (merges == null) {
            return builder.build();
        }
        for (JsonElement merge : merges) {
            if (merge != null && merge.isJsonPrimitive() && merge.getAsJsonPrimitive().isString()) {
                final String line = merge.getAsString();
                if (line.startsWith(VERSION_HEADER)) {
                    LOG.debug("Skipping merges header '{}'", line);
                    continue;
                }
                final int separator = line.indexOf(' ');
                if (separator <= 0 || separator == line.length() - 1 || line.indexOf(' ', separator + 1) >= 0) {
                    throw malformed(documentPath, "merge '" + line + "' must be two tokens separated by one space");
                }
                builder.add(line.substring(0, separator), line.substring(separator + 1));
            } else if (merge != null && merge.isJsonArray() && isStringPair(merge.getAsJsonArray())) {
                final JsonArray pair = merge.getAsJsonArray();
                builder.add(pair.get(0).getAsString(), pair.get(1).getAsString());
            } else {
                throw malformed(documentPath, "unsupported merge entry " + merge);
            }
        }
        return builder.build();
    }

    private static boolean isStringPair(JsonArray array) {
        return array.size() == 2 && isString(array.get(0)) && isString(array.get(1));
    }

    private static boolean isString(JsonElement element) {
        return element.isJsonPrimitive() && element.getAsJsonPrimitive().isString();
    }

    private static void readSpecialTokenFile(Path file, SpecialTokenRegistry.Builder registryBuilder) {
        final JsonObject root = readCompanion(file);
        if (root == null) {
            return;
        }
        for (Map.Entry<String, JsonElement> entry : root.entrySet()) {
            final String key = entry.getKey();
            if (!key.endsWith(TOKEN_KEY_SUFFIX) || key.length() == TOKEN_KEY_SUFFIX.length()) {
                continue;
            }
            final String text = tokenText(entry.getValue());
            if (text != null) {
                registryBuilder.bind(key.substring(0, key.length() - TOKEN_KEY_SUFFIX.length()), text);
            }
        }
    }

    private static void readGenerationConfig(Path file, SpecialTokenRegistry.Builder registryBuilder) {
        final JsonObject root = readCompanion(file);
        if (root == null) {
            return;
        }
        bindNumericId(file, root.get("bos_token_id"), SpecialTokenRegistry.BOS, registryBuilder);
        bindNumericId(file, root.get("eos_token_id"), SpecialTokenRegistry.EOS, registryBuilder);
    }

    private static void bindNumericId(Path file, JsonElement value, String name,
                                      SpecialTokenRegistry.Builder registryBuilder) {
        JsonElement idElement = value;
        // Several stop ids may be listed; the first one is the primary id
        if (idElement != null && idElement.isJsonArray() && !idElement.getAsJsonArray().isEmpty()) {
            idElement = idElement.getAsJsonArray().get(0);
        }
        if (idElement != null && idElement.isJsonPrimitive() && idElement.getAsJsonPrimitive().isNumber()) {
            final BigDecimal id = idElement.getAsBigDecimal();
            if (id.signum() < 0 || id.compareTo(MAX_ID) > 0 || id.stripTrailingZeros().scale() > 0) {
                throw malformed(file, name + "_token_id " + idElement + " is not a valid token id");
            }
            registryBuilder.bindId(name, id.intValueExact());
        }
    }

    /**
     * @return literal token text of a special-token value, {@code null} for shapes that carry none
     */
    private static String tokenText(JsonElement value) {
        if (value == null || value.isJsonNull()) {
            return null;
        }
        if (value.isJsonPrimitive()) {
            final JsonPrimitive primitive = value.getAsJsonPrimitive();
            return primitive.isString() ? primitive.getAsString() : null;
        }
        if (value.isJsonObject()) {
            final JsonElement content = value.getAsJsonObject().get("content");
            return content != null && isString(content) ? content.getAsString() : null;
        }
        return null;
    }

    /**
     * @return parsed companion file, {@code null} when the file does not exist
     */
    private static JsonObject readCompanion(Path file) {
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            final JsonElement root = JsonParser.parseReader(reader);
            if (!root.isJsonObject()) {
                throw malformed(file, "expected a JSON object");
            }
            LOG.debug("Reading special tokens from {}", file);
            return root.getAsJsonObject();
        } catch (IOException e) {
            throw new TokenizerException(FailureReason.UNREADABLE_PATH, "Failed to read " + file, e);
        } catch (JsonParseException e) {
            throw new TokenizerException(FailureReason.MALFORMED_DOCUMENT,
                    "Malformed companion file " + file + ": " + e.getMessage(), e);
        }
    }

    private static TokenizerException malformed(Path file, String detail) {
        return new TokenizerException(FailureReason.MALFORMED_DOCUMENT, "Malformed " + file + ": " + detail);
    }
}
