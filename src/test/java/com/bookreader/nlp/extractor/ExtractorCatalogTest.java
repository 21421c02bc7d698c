package com.bookreader.nlp.extractor;

import com.bookreader.nlp.EngineFixtures;
import com.bookreader.nlp.EngineFixtures.FakeExtractor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExtractorCatalogTest {

    private final ExtractorCatalog catalog =
        new ExtractorCatalog(EngineFixtures.ANALYZER, EngineFixtures.LEXICON, EngineFixtures.NAME_FINDER);

    @Test
    @DisplayName("should register the built-in extractors")
    void builtIns() {
        assertEquals(Set.of("corenlp", "lexicon", "names"), catalog.names());
    }

    @Test
    @DisplayName("creating an extractor should not load its backend")
    void createIsCheap() {
        DescriptionExtractor extractor = catalog.create("corenlp", EngineFixtures.LENIENT_CONFIG).orElseThrow();

        assertInstanceOf(CoreNlpDescriptionExtractor.class, extractor);
        assertFalse(extractor.isLoaded());
        assertSame(EngineFixtures.LENIENT_CONFIG, extractor.getConfig());
    }

    @Test
    @DisplayName("should return empty for an unknown name")
    void unknown() {
        assertTrue(catalog.create("spacy", EngineFixtures.LENIENT_CONFIG).isEmpty());
    }

    @Test
    @DisplayName("should accept new adapters")
    void register() {
        catalog.register("fake", config -> new FakeExtractor("fake", config, paragraph -> List.of()));

        assertTrue(catalog.contains("fake"));
        assertEquals("fake", catalog.create("fake", EngineFixtures.LENIENT_CONFIG).orElseThrow().getName());
    }
}
