package com.anirudhology.bpetokenizer.tokenizer;

import com.anirudhology.bpetokenizer.types.FailureReason;
import com.anirudhology.bpetokenizer.types.TokenizerError;
import com.anirudhology.bpetokenizer.types.TokenizerException;
import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VocabularyTest {

    @Test
    void mapsBothDirectionsWithSparseIds() {
        final Vocabulary vocabulary = Vocabulary.builder()
                .add("a", 0)
                .add("b", 7)
                .add("ab", 42)
                .build();

        assertEquals(3, vocabulary.size());
        assertEquals(42, vocabulary.maxId());
        assertEquals(OptionalInt.of(7), vocabulary.idOf("b"));
        assertEquals("ab", vocabulary.tokenOf(42));
        assertTrue(vocabulary.contains(0));
        assertFalse(vocabulary.contains(1));
        assertNull(vocabulary.tokenOf(1));
        assertEquals(OptionalInt.empty(), vocabulary.idOf("c"));
    }

    @Test
    void duplicateIdIsRejected() {
        final Vocabulary.Builder builder = Vocabulary.builder().add("a", 0);
        final TokenizerException e = assertThrows(TokenizerException.class, () -> builder.add("b", 0));
        assertEquals(FailureReason.DUPLICATE_VOCABULARY_ENTRY, e.getReason());
        assertEquals(TokenizerError.LOAD_FAILURE, e.getError());
    }

    @Test
    void duplicateStringIsRejected() {
        final Vocabulary.Builder builder = Vocabulary.builder().add("a", 0);
        final TokenizerException e = assertThrows(TokenizerException.class, () -> builder.add("a", 1));
        assertEquals(FailureReason.DUPLICATE_VOCABULARY_ENTRY, e.getReason());
    }

    @Test
    void addIfAbsentAcceptsIdenticalEntryOnly() {
        final Vocabulary.Builder builder = Vocabulary.builder().add("<s>", 1);
        builder.addIfAbsent("<s>", 1);
        builder.addIfAbsent("</s>", 2);
        assertThrows(TokenizerException.class, () -> builder.addIfAbsent("<s>", 3));
        assertThrows(TokenizerException.class, () -> builder.addIfAbsent("<pad>", 2));
        assertEquals(2, builder.build().size());
    }

    @Test
    void builtVocabularyIsNotAffectedByLaterBuilderChanges() {
        final Vocabulary.Builder builder = Vocabulary.builder().add("a", 0);
        final Vocabulary vocabulary = builder.build();
        builder.add("b", 1);
        assertEquals(1, vocabulary.size());
    }
}
