package com.entity.extraction.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Similarity Tests")
class SimilarityTest {

    @Nested
    @DisplayName("LevenshteinSimilarity")
    class LevenshteinTests {

        private final LevenshteinSimilarity similarity = new LevenshteinSimilarity();

        @ParameterizedTest
        @CsvSource({
                "kitten, sitting, 3",
                "abcd, abcx, 1",
                "'', abc, 3",
                "same, same, 0"
        })
        @DisplayName("distance should count single-character edits")
        void distance(String a, String b, int expected) {
            assertEquals(expected, LevenshteinSimilarity.distance(a, b));
        }

        @Test
        @DisplayName("Should normalize by the longer length")
        void normalized() {
            assertEquals(0.75, similarity.compute("abcd", "abcx"), 1e-9);
            assertEquals(0.5625, similarity.compute("Acme Corp", "Acme Corporation"), 1e-9);
        }

        @Test
        @DisplayName("Should ignore case by default")
        void ignoresCase() {
            assertEquals(1.0, similarity.compute("ACME", "acme"));
            assertTrue(new LevenshteinSimilarity(false).compute("ACME", "acme") < 1.0);
        }

        @Test
        @DisplayName("Should be symmetric and handle null and empty input")
        void symmetricAndEdgeCases() {
            assertEquals(similarity.compute("Jon", "John"), similarity.compute("John", "Jon"));
            assertEquals(0.0, similarity.compute(null, "a"));
            assertEquals(0.0, similarity.compute("", "a"));
            assertEquals(1.0, similarity.compute("", ""));
        }
    }

    @Nested
    @DisplayName("KeyTermExtractor")
    class KeyTermTests {

        private final KeyTermExtractor extractor = new KeyTermExtractor();

        @Test
        @DisplayName("Should lower-case, strip punctuation and drop short and stop words")
        void extractsKeyTerms() {
            Set<String> terms = extractor.extract("The CEO of Acme, Inc. met with an investor!");

            assertEquals(Set.of("ceo", "acme", "inc", "met", "investor"), terms);
        }

        @Test
        @DisplayName("Empty and null text yield no terms")
        void emptyText() {
            assertTrue(extractor.extract(null).isEmpty());
            assertTrue(extractor.extract("").isEmpty());
            assertTrue(extractor.extract("a an of to").isEmpty());
        }
    }

    @Nested
    @DisplayName("JaccardSimilarity")
    class JaccardTests {

        private final JaccardSimilarity similarity = new JaccardSimilarity();

        @Test
        @DisplayName("Should divide intersection by union")
        void ratio() {
            assertEquals(0.5, similarity.compute(Set.of("a", "b", "c"), Set.of("b", "c", "d")), 1e-9);
            assertEquals(1.0, similarity.compute("budget meeting today", "Today: budget meeting."), 1e-9);
        }

        @Test
        @DisplayName("Empty term sets score zero")
        void emptySets() {
            assertEquals(0.0, similarity.compute(Set.of(), Set.of("a")));
            assertEquals(0.0, similarity.compute("of to", "of to"));
            assertEquals(0.0, similarity.compute((String) null, "x"));
        }
    }
}
