package com.company.consolidation.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextSimilarityTest {

    @Test
    void shouldReturnOneForIdenticalTextIgnoringCase() {
        assertEquals(1.0, TextSimilarity.textSimilarity("Flood Warning", "flood warning"));
    }

    @Test
    void shouldReturnZeroForEmptyInput() {
        assertEquals(0.0, TextSimilarity.textSimilarity("", "flood"));
        assertEquals(0.0, TextSimilarity.textSimilarity("flood", "   "));
        assertEquals(0.0, TextSimilarity.textSimilarity(null, "flood"));
    }

    @Test
    void shouldReturnZeroWithoutSharedBigrams() {
        assertEquals(0.0, TextSimilarity.textSimilarity("abc", "xyz"));
    }

    @Test
    void shouldComputeDiceCoefficient() {
        // ni gh ht vs na ac ch ht: one shared of 4 + 4
        assertEquals(0.25, TextSimilarity.textSimilarity("night", "nacht"), 1e-12);
    }

    @Test
    void shouldCountRepeatedBigramsOnlyOnce() {
        // aa aa vs aa: one shared of 2 + 1
        assertEquals(2.0 / 3.0, TextSimilarity.textSimilarity("aaa", "aa"), 1e-12);
    }

    @Test
    void shouldBeSymmetric() {
        String a = "Earthquake in California";
        String b = "Earthquake near San Francisco";
        assertEquals(TextSimilarity.textSimilarity(a, b), TextSimilarity.textSimilarity(b, a));
    }

    @Test
    void shouldIgnoreWhitespace() {
        assertEquals(1.0, TextSimilarity.textSimilarity("Miami Beach", "MiamiBeach"));
    }

    @Test
    void shouldReturnZeroForSingleCharacterDifference() {
        assertEquals(0.0, TextSimilarity.textSimilarity("a", "b"));
    }
}
