package com.bookreader.nlp.text;

import com.bookreader.nlp.EngineFixtures;
import com.bookreader.nlp.core.DescriptionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RussianLexiconTest {

    private final RussianLexicon lexicon = EngineFixtures.LEXICON;

    private static Token token(String word) {
        return EngineFixtures.ANALYZER.tokenize(word, 0).get(0);
    }

    @Test
    @DisplayName("should type inflected gazetteer words")
    void typesWords() {
        assertEquals(Optional.of(DescriptionType.LOCATION), lexicon.typeOf(token("холме")));
        assertEquals(Optional.of(DescriptionType.CHARACTER), lexicon.typeOf(token("маг")));
        assertEquals(Optional.of(DescriptionType.OBJECT), lexicon.typeOf(token("свечи")));
        assertEquals(Optional.empty(), lexicon.typeOf(token("поэтому")));
    }

    @Test
    @DisplayName("should recognize adjectives by list and by ending, but not pronominal ones")
    void adjectives() {
        assertTrue(lexicon.isAdjective(token("Высокий")));
        assertTrue(lexicon.isAdjective(token("синего")));
        assertFalse(lexicon.isAdjective(token("который")));
        assertFalse(lexicon.isAdjective(token("замок")));
    }

    @Test
    @DisplayName("should separate descriptive and action vocabulary")
    void descriptiveAndAction() {
        assertTrue(lexicon.isDescriptive(token("возвышался")));
        assertTrue(lexicon.isAction(token("побежал")));
        assertFalse(lexicon.isAction(token("возвышался")));
    }

    @Test
    @DisplayName("should know first names regardless of case")
    void firstNames() {
        assertTrue(lexicon.isFirstName("Иван"));
        assertTrue(lexicon.isFirstName("НАТАША"));
        assertFalse(lexicon.isFirstName("Замок"));
    }
}
