package com.bookreader.nlp;

import com.bookreader.exception.ProcessorConfigurationException;
import com.bookreader.nlp.EngineFixtures.FakeExtractor;
import com.bookreader.nlp.core.CancellationToken;
import com.bookreader.nlp.core.CompleteDescription;
import com.bookreader.nlp.core.DescriptionType;
import com.bookreader.nlp.core.EngineSettings;
import com.bookreader.nlp.core.ExtractionCancelledException;
import com.bookreader.nlp.core.ExtractionResult;
import com.bookreader.nlp.core.Paragraph;
import com.bookreader.nlp.core.ParagraphType;
import com.bookreader.nlp.core.ProcessingMode;
import com.bookreader.nlp.extractor.DescriptionExtractor;
import com.bookreader.nlp.scoring.QualityAssessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the extraction pipeline with the built-in Russian extractors and fakes.
 */
class DescriptionExtractionEngineTest {

    private static final String CASTLE = "Высокий темный замок возвышался на холме.";

    private static final String CHAPTER = """
        Высокий темный замок возвышался на холме. Старые каменные стены покрывал густой мох.

        Старый маг стоял у окна. Его седая борода блестела в свете свечи.

        Он пошел к двери, схватил меч и побежал вниз.
        """;

    private final List<EngineContext> contexts = new ArrayList<>();

    @AfterEach
    void tearDown() {
        contexts.forEach(EngineContext::close);
    }

    private DescriptionExtractionEngine engine(EngineSettings settings, Map<String, ? extends DescriptionExtractor> extractors) {
        EngineContext context = EngineFixtures.context(settings, extractors);
        contexts.add(context);
        return new DescriptionExtractionEngine(context);
    }

    private DescriptionExtractionEngine builtInEngine() {
        return engine(EngineSettings.defaults(), Map.of(
            "lexicon", EngineFixtures.lexiconExtractor(),
            "names", EngineFixtures.namesExtractor()));
    }

    // ========================================================================
    // Acceptance scenarios
    // ========================================================================

    @Nested
    @DisplayName("Acceptance scenarios")
    class Scenarios {

        @Test
        @DisplayName("castle on a hill is a LOCATION description ranked first")
        void castleIsRankedLocation() {
            // Arrange
            DescriptionExtractionEngine engine = builtInEngine();
            List<Paragraph> paragraphs = EngineFixtures.segmenter().segment(CASTLE);

            // Act
            ExtractionResult result = engine.extract(CASTLE, "ch-1", null, ProcessingMode.ENSEMBLE);

            // Assert
            assertEquals(1, paragraphs.size());
            assertEquals(ParagraphType.DESCRIPTION, paragraphs.get(0).type());
            assertTrue(paragraphs.get(0).descriptivenessScore() > 0.3);

            assertFalse(result.descriptions().isEmpty());
            CompleteDescription first = result.descriptions().get(0);
            assertEquals(DescriptionType.LOCATION, first.descriptionType());
            assertTrue(first.text().contains("замок"));
            assertEquals(0, first.chapterOffset());
            assertEquals("ch-1", result.chapterId());
            assertEquals(ProcessingMode.ENSEMBLE, result.mode());
            assertEquals(1.0, result.qualityMetrics().get(QualityAssessor.DESCRIPTIVE_PARAGRAPH_RATIO));
        }

        @Test
        @DisplayName("empty input returns an empty result without error")
        void emptyInput() {
            DescriptionExtractionEngine engine = builtInEngine();

            ExtractionResult result = engine.extract("", "ch-empty", null, null);

            assertTrue(result.descriptions().isEmpty());
            assertTrue(result.processingTime() >= 0.0);
            assertEquals(0, result.paragraphCount());
        }

        @Test
        @DisplayName("whitespace-only and null input are treated as empty")
        void blankInput() {
            DescriptionExtractionEngine engine = builtInEngine();

            assertTrue(engine.extract("   \n\n\t  ", "ch", null, null).isEmpty());
            assertTrue(engine.extract(null, "ch", null, null).isEmpty());
        }
    }

    // ========================================================================
    // Invariants
    // ========================================================================

    @Nested
    @DisplayName("Invariants")
    class Invariants {

        @Test
        @DisplayName("two runs over the same text give identical scores and order")
        void deterministic() {
            DescriptionExtractionEngine engine = builtInEngine();

            ExtractionResult first = engine.extract(CHAPTER, "ch", null, ProcessingMode.ENSEMBLE);
            ExtractionResult second = engine.extract(CHAPTER, "ch", null, ProcessingMode.ENSEMBLE);

            assertFalse(first.descriptions().isEmpty());
            assertEquals(first.descriptions().size(), second.descriptions().size());
            for (int i = 0; i < first.descriptions().size(); i++) {
                CompleteDescription a = first.descriptions().get(i);
                CompleteDescription b = second.descriptions().get(i);
                assertEquals(a.text(), b.text());
                assertEquals(a.chapterOffset(), b.chapterOffset());
                assertEquals(a.overallScore(), b.overallScore());
            }
        }

        @Test
        @DisplayName("overall score is reproduced from the stored breakdown")
        void scoreReproducible() {
            EngineContext context = EngineFixtures.context(EngineSettings.defaults(),
                Map.of("lexicon", EngineFixtures.lexiconExtractor()));
            contexts.add(context);
            DescriptionExtractionEngine engine = new DescriptionExtractionEngine(context);

            ExtractionResult result = engine.extract(CHAPTER, "ch", null, ProcessingMode.PARALLEL);

            assertFalse(result.descriptions().isEmpty());
            for (CompleteDescription description : result.descriptions()) {
                assertEquals(description.overallScore(),
                    context.scorer().overallScore(description.confidenceBreakdown()), 1e-12);
            }
        }

        @Test
        @DisplayName("descriptions are ordered by non-increasing score")
        void ordering() {
            ExtractionResult result = builtInEngine().extract(CHAPTER, "ch", null, ProcessingMode.PARALLEL);

            List<CompleteDescription> descriptions = result.descriptions();
            for (int i = 1; i < descriptions.size(); i++) {
                CompleteDescription previous = descriptions.get(i - 1);
                CompleteDescription current = descriptions.get(i);
                assertTrue(previous.overallScore() >= current.overallScore());
                if (previous.overallScore() == current.overallScore()) {
                    assertTrue(previous.descriptionType().rank() <= current.descriptionType().rank());
                }
            }
        }

        @Test
        @DisplayName("every kept description meets the minimum score")
        void minimumScore() {
            ExtractionResult result = builtInEngine().extract(CHAPTER, "ch", null, ProcessingMode.SEQUENTIAL);

            assertTrue(result.descriptions().stream().allMatch(d -> d.overallScore() >= 0.3));
        }

        @Test
        @DisplayName("dialogue-only text never reaches the extractors")
        void dialogueOnly() {
            FakeExtractor spy = new FakeExtractor("spy", paragraph -> List.of());
            DescriptionExtractionEngine engine = engine(EngineSettings.defaults(), Map.of(
                "lexicon", EngineFixtures.lexiconExtractor(), "spy", spy));

            ExtractionResult result = engine.extract(
                "— Куда ты идешь?\n— Домой, к старому замку.", "ch", null, ProcessingMode.ENSEMBLE);

            assertTrue(result.descriptions().isEmpty());
            assertEquals(2, result.paragraphCount());
            assertTrue(spy.seenParagraphs().isEmpty());
        }
    }

    // ========================================================================
    // Degradation
    // ========================================================================

    @Nested
    @DisplayName("Graceful degradation")
    class Degradation {

        @Test
        @DisplayName("no active extractor is a configuration error")
        void noExtractors() {
            DescriptionExtractionEngine engine = engine(EngineSettings.defaults(), Map.of());

            assertThrows(ProcessorConfigurationException.class,
                () -> engine.extract(CASTLE, "ch", null, ProcessingMode.ENSEMBLE));
        }

        @Test
        @DisplayName("ensemble with a single extractor gives full consensus")
        void ensembleWithOneExtractor() {
            DescriptionExtractionEngine engine = engine(EngineSettings.defaults(),
                Map.of("lexicon", EngineFixtures.lexiconExtractor()));

            ExtractionResult result = engine.extract(CHAPTER, "ch", null, ProcessingMode.ENSEMBLE);

            assertFalse(result.descriptions().isEmpty());
            assertTrue(result.descriptions().stream().allMatch(d -> d.consensusStrength() == 1.0));
            assertEquals(List.of("lexicon"), result.processorsUsed());
        }

        @Test
        @DisplayName("a hung extractor times out and the others still contribute")
        void hungExtractorTimesOut() {
            EngineSettings settings = EngineSettings.defaults().withExtractorTimeoutMs(300);
            DescriptionExtractionEngine engine = engine(settings, Map.of(
                "lexicon", EngineFixtures.lexiconExtractor(),
                "slow", FakeExtractor.hanging("slow")));

            long start = System.nanoTime();
            ExtractionResult result = engine.extract(CASTLE, "ch", null, ProcessingMode.ENSEMBLE);
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertTrue(elapsedMs < 10_000, "took " + elapsedMs + "ms");
            assertFalse(result.descriptions().isEmpty());
            assertEquals(List.of("lexicon", "slow"), result.processorsUsed());
            assertEquals(List.of("lexicon"), result.descriptions().get(0).contributingProcessors());
        }

        @Test
        @DisplayName("a crashing extractor contributes nothing and does not fail the run")
        void crashingExtractor() {
            DescriptionExtractionEngine engine = engine(EngineSettings.defaults(), Map.of(
                "broken", FakeExtractor.failing("broken"),
                "lexicon", EngineFixtures.lexiconExtractor()));

            ExtractionResult result = engine.extract(CASTLE, "ch", null, ProcessingMode.PARALLEL);

            assertFalse(result.descriptions().isEmpty());
            assertEquals(DescriptionType.LOCATION, result.descriptions().get(0).descriptionType());
        }

        @Test
        @DisplayName("single mode falls back when the requested extractor is unknown")
        void singleFallback() {
            DescriptionExtractionEngine engine = builtInEngine();

            ExtractionResult result = engine.extract(CASTLE, "ch", "spacy", ProcessingMode.SINGLE);

            assertEquals(List.of("lexicon"), result.processorsUsed());
            assertTrue(result.recommendations().stream().anyMatch(r -> r.contains("'spacy' is not available")));
            assertFalse(result.descriptions().isEmpty());
        }
    }

    // ========================================================================
    // Cancellation
    // ========================================================================

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("an already cancelled token aborts immediately")
        void cancelledBeforeStart() {
            DescriptionExtractionEngine engine = builtInEngine();
            CancellationToken token = CancellationToken.create();
            token.cancel();

            assertThrows(ExtractionCancelledException.class,
                () -> engine.extract(CASTLE, "ch", null, ProcessingMode.ENSEMBLE, token));
        }

        @Test
        @DisplayName("cancelling during a run aborts in-flight extractors")
        void cancelledDuringRun() {
            EngineSettings settings = EngineSettings.defaults().withExtractorTimeoutMs(30_000);
            DescriptionExtractionEngine engine = engine(settings, Map.of("slow", FakeExtractor.hanging("slow")));
            CancellationToken token = CancellationToken.create();
            CompletableFuture.runAsync(token::cancel, CompletableFuture.delayedExecutor(200, TimeUnit.MILLISECONDS));

            long start = System.nanoTime();
            assertThrows(ExtractionCancelledException.class,
                () -> engine.extract(CASTLE, "ch", null, ProcessingMode.PARALLEL, token));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertTrue(elapsedMs < 10_000, "took " + elapsedMs + "ms");
        }
    }

    @Test
    @DisplayName("adaptive mode reports the delegate it chose")
    void adaptiveReportsDelegate() {
        ExtractionResult result = builtInEngine().extract(CHAPTER, "ch", null, ProcessingMode.ADAPTIVE);

        assertEquals(ProcessingMode.ADAPTIVE, result.mode());
        assertTrue(result.recommendations().get(0).startsWith("Adaptive mode selected "));
    }
}
