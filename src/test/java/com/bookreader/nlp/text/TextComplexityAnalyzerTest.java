package com.bookreader.nlp.text;

import com.bookreader.nlp.EngineFixtures;
import com.bookreader.nlp.text.TextComplexityAnalyzer.TextProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextComplexityAnalyzerTest {

    private final TextComplexityAnalyzer analyzer = new TextComplexityAnalyzer(EngineFixtures.NAME_FINDER);

    @Test
    @DisplayName("complexity should average saturated word and sentence length")
    void complexity() {
        assertEquals(0.5, TextComplexityAnalyzer.complexity(5.0, 10.0), 1e-9);
        assertEquals(1.0, TextComplexityAnalyzer.complexity(20.0, 40.0), 1e-9);
        assertEquals(0.0, TextComplexityAnalyzer.complexity(0.0, 0.0), 1e-9);
    }

    @Test
    @DisplayName("profile should count words and sentences and detect names")
    void profile() {
        TextProfile profile = analyzer.profile("Иван пришел. Он сел.");

        assertEquals(4, profile.wordCount());
        assertEquals(2, profile.sentenceCount());
        assertEquals(2.0, profile.avgSentenceLength(), 1e-9);
        assertTrue(profile.hasPersonNames());
        assertEquals(TextComplexityAnalyzer.complexity(profile.avgWordLength(), 2.0), profile.complexity(), 1e-9);
    }

    @Test
    @DisplayName("profile of empty text should be all zeros")
    void emptyProfile() {
        TextProfile profile = analyzer.profile("");

        assertEquals(0, profile.length());
        assertEquals(0, profile.wordCount());
        assertEquals(0.0, profile.complexity(), 1e-9);
        assertFalse(profile.hasPersonNames());
    }
}
