package com.bookreader.nlp.segment;

import com.bookreader.nlp.core.EngineSettings;
import com.bookreader.nlp.core.Paragraph;
import com.bookreader.nlp.core.ParagraphType;
import com.bookreader.nlp.core.TextSpan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.bookreader.nlp.EngineFixtures.paragraphs;
import static org.junit.jupiter.api.Assertions.*;

class DescriptionBoundaryDetectorTest {

    private static final String SENTENCE = " Старые каменные стены поднимались над тихим холмом.";
    private static final String CASTLE = "Высокий замок стоял на холме.";
    private static final String TOWER = "Рядом стояла высокая башня.";
    private static final String FOREST = "Вокруг шумел густой лес.";

    private static final DescriptionBoundaryDetector DEFAULTS =
        new DescriptionBoundaryDetector(EngineSettings.Boundaries.defaults());

    private static String prose(String opener, int sentences) {
        return opener + SENTENCE.repeat(sentences);
    }

    private static DescriptionBoundaryDetector detector(int lookahead, int minChars, int maxChars) {
        return new DescriptionBoundaryDetector(new EngineSettings.Boundaries(true, lookahead, minChars, maxChars, 0.3));
    }

    private static List<Paragraph> retyped(List<Paragraph> paragraphs, int index, ParagraphType type, double score) {
        List<Paragraph> copy = new ArrayList<>(paragraphs);
        Paragraph p = copy.get(index);
        copy.set(index, new Paragraph(p.index(), p.text(), p.startOffset(), type, score));
        return copy;
    }

    private static int totalLength(List<Paragraph> paragraphs, int from, int to) {
        int length = 0;
        for (int i = from; i <= to; i++) {
            length += paragraphs.get(i).text().length();
        }
        return length;
    }

    // =========================================================================
    // Growing a run
    // =========================================================================

    @Nested
    @DisplayName("detect")
    class Detect {

        @Test
        @DisplayName("should join coherent descriptive paragraphs into one run")
        void joinsCoherentParagraphs() {
            String text = String.join("\n\n", prose(CASTLE, 3), prose(TOWER, 3), prose(FOREST, 3));
            List<Paragraph> paragraphs = paragraphs(text, ParagraphType.DESCRIPTION, 0.7);

            List<DescriptionBoundary> runs = DEFAULTS.detect(paragraphs);

            assertEquals(1, runs.size());
            DescriptionBoundary run = runs.get(0);
            assertEquals(0, run.startIndex());
            assertEquals(2, run.endIndex());
            assertEquals(3, run.paragraphCount());
            assertEquals(new TextSpan(0, text.length()), run.span());
            assertEquals(totalLength(paragraphs, 0, 2), run.charLength());
            assertEquals(0.6, run.coherence(), 1e-9);
            assertEquals(0.91, run.boundaryConfidence(), 1e-9);
            assertEquals(0.7, run.averageDescriptiveness(), 1e-9);
        }

        @Test
        @DisplayName("should end a run before a dialogue paragraph")
        void stopsAtDialogue() {
            String text = String.join("\n\n",
                prose(CASTLE, 5), prose(TOWER, 5), "— Кто здесь? — спросил он.", prose(TOWER, 5));
            List<Paragraph> paragraphs = retyped(
                paragraphs(text, ParagraphType.DESCRIPTION, 0.7), 2, ParagraphType.DIALOGUE, 0.0);

            List<DescriptionBoundary> runs = DEFAULTS.detect(paragraphs);

            assertEquals(1, runs.size());
            assertEquals(0, runs.get(0).startIndex());
            assertEquals(1, runs.get(0).endIndex());
        }

        @Test
        @DisplayName("should end a run at a stop word")
        void stopsAtStopWord() {
            String text = String.join("\n\n",
                prose(CASTLE, 5), prose(TOWER, 5), "Рядом вдруг что-то упало." + SENTENCE.repeat(5));
            List<Paragraph> paragraphs = paragraphs(text, ParagraphType.DESCRIPTION, 0.7);

            List<DescriptionBoundary> runs = DEFAULTS.detect(paragraphs);

            assertEquals(1, runs.size());
            assertEquals(1, runs.get(0).endIndex());
        }

        @Test
        @DisplayName("should end a run at a weakly descriptive unrelated paragraph")
        void stopsAtUnrelatedNarrative() {
            String text = String.join("\n\n", prose(CASTLE, 10), "Сегодня путники долго шли по дороге." + SENTENCE);
            List<Paragraph> paragraphs = retyped(
                paragraphs(text, ParagraphType.DESCRIPTION, 0.7), 1, ParagraphType.NARRATIVE, 0.2);

            List<DescriptionBoundary> runs = DEFAULTS.detect(paragraphs);

            assertEquals(1, runs.size());
            assertEquals(1, runs.get(0).paragraphCount());
        }

        @Test
        @DisplayName("should not start a run at a weakly descriptive paragraph")
        void weakStart() {
            String text = String.join("\n\n", prose(CASTLE, 5), prose(TOWER, 5), prose(FOREST, 5));

            assertTrue(DEFAULTS.detect(paragraphs(text, ParagraphType.DESCRIPTION, 0.4)).isEmpty());
        }

        @Test
        @DisplayName("should find nothing when switched off")
        void disabled() {
            String text = String.join("\n\n", prose(CASTLE, 5), prose(TOWER, 5));
            DescriptionBoundaryDetector off =
                new DescriptionBoundaryDetector(new EngineSettings.Boundaries(false, 20, 500, 4000, 0.3));

            assertTrue(off.detect(paragraphs(text, ParagraphType.DESCRIPTION, 0.7)).isEmpty());
            assertTrue(DEFAULTS.detect(List.of()).isEmpty());
        }
    }

    // =========================================================================
    // Window and length limits
    // =========================================================================

    @Nested
    @DisplayName("limits")
    class Limits {

        private final String sixTowers = String.join("\n\n", List.of(
            prose(TOWER, 2), prose(TOWER, 2), prose(TOWER, 2), prose(TOWER, 2), prose(TOWER, 2), prose(TOWER, 2)));

        @Test
        @DisplayName("should look at most lookahead paragraphs past the start")
        void lookaheadWindow() {
            List<Paragraph> paragraphs = paragraphs(sixTowers, ParagraphType.DESCRIPTION, 0.7);

            List<DescriptionBoundary> runs = detector(2, 300, 4000).detect(paragraphs);

            assertEquals(2, runs.size());
            assertEquals(List.of(0, 3), runs.stream().map(DescriptionBoundary::startIndex).sorted().toList());
            assertTrue(runs.stream().allMatch(run -> run.paragraphCount() == 3));
        }

        @Test
        @DisplayName("should cover every coherent paragraph inside a wide window")
        void wideWindow() {
            List<Paragraph> paragraphs = paragraphs(sixTowers, ParagraphType.DESCRIPTION, 0.7);

            List<DescriptionBoundary> runs = DEFAULTS.detect(paragraphs);

            assertEquals(1, runs.size());
            assertEquals(6, runs.get(0).paragraphCount());
        }

        @Test
        @DisplayName("should drop runs shorter than the minimum length")
        void minimumLength() {
            String text = String.join("\n\n", prose(CASTLE, 1), prose(TOWER, 1));
            List<Paragraph> paragraphs = paragraphs(text, ParagraphType.DESCRIPTION, 0.7);

            assertTrue(totalLength(paragraphs, 0, 1) < 500);
            assertTrue(DEFAULTS.detect(paragraphs).isEmpty());
        }

        @Test
        @DisplayName("should stop growing before the maximum length is exceeded")
        void maximumLength() {
            String text = String.join("\n\n", prose(CASTLE, 4), prose(TOWER, 4), prose(TOWER, 4));
            List<Paragraph> paragraphs = paragraphs(text, ParagraphType.DESCRIPTION, 0.7);

            List<DescriptionBoundary> runs = detector(20, 200, 500).detect(paragraphs);

            assertEquals(2, runs.size());
            assertEquals(0, runs.get(0).startIndex());
            assertEquals(1, runs.get(0).endIndex());
            assertTrue(runs.get(0).charLength() <= 500);
            assertEquals(2, runs.get(1).startIndex());
            assertEquals(1, runs.get(1).paragraphCount());
        }

        @Test
        @DisplayName("should reject inconsistent limits")
        void invalidSettings() {
            assertThrows(IllegalArgumentException.class,
                () -> new EngineSettings.Boundaries(true, 0, 500, 4000, 0.3));
            assertThrows(IllegalArgumentException.class,
                () -> new EngineSettings.Boundaries(true, 20, 500, 400, 0.3));
            assertThrows(IllegalArgumentException.class,
                () -> new EngineSettings.Boundaries(true, 20, 500, 4000, 1.5));
        }
    }

    // =========================================================================
    // Coherence
    // =========================================================================

    @Nested
    @DisplayName("coherence")
    class Coherence {

        @Test
        @DisplayName("should reward shared colors and pronoun openings")
        void colorsAndPronouns() {
            Paragraph last = new Paragraph(0, "Серые стены.", 0, ParagraphType.DESCRIPTION, 0.7);
            Set<String> runColors = DescriptionBoundaryDetector.colors(last.text());

            Paragraph clouds = new Paragraph(1, "Серые тучи плыли.", 14, ParagraphType.NARRATIVE, 0.5);
            Paragraph pronoun = new Paragraph(1, "Они были серые.", 14, ParagraphType.DESCRIPTION, 0.7);

            assertEquals(Set.of("серые"), runColors);
            assertEquals(0.2, DEFAULTS.coherence(last, clouds, runColors), 1e-9);
            assertEquals(0.6, DEFAULTS.coherence(last, pronoun, runColors), 1e-9);
        }

        @Test
        @DisplayName("should treat dashed and quoted openings as stops")
        void stopSignals() {
            assertTrue(DescriptionBoundaryDetector.hasStopSignal("— Идем, — сказал он."));
            assertTrue(DescriptionBoundaryDetector.hasStopSignal("«Идем»."));
            assertFalse(DescriptionBoundaryDetector.hasStopSignal(TOWER));
        }
    }
}
