package com.bookreader.nlp.scoring;

import com.bookreader.nlp.core.CompleteDescription;
import com.bookreader.nlp.core.ConfidenceBreakdown;
import com.bookreader.nlp.core.DescriptionType;
import com.bookreader.nlp.core.ParagraphType;
import com.bookreader.nlp.segment.SegmentStatistics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QualityAssessorTest {

    private static CompleteDescription description(String text, DescriptionType type, double score,
                                                   double consensus, List<String> processors) {
        return new CompleteDescription(text, type, 0, text.length(),
            new ConfidenceBreakdown(score, score, score, score), score, consensus,
            processors, List.of(), text.split("\\s+").length, Map.of());
    }

    @Test
    @DisplayName("description quality should weigh length, score and word variety")
    void descriptionQuality() {
        CompleteDescription repeated = description("замок замок", DescriptionType.LOCATION, 0.8, 1.0, List.of("lexicon"));

        // 11/200 * 0.3 + 0.8 * 0.5 + 0.5 * 0.2
        assertEquals(0.5165, QualityAssessor.descriptionQuality(repeated), 1e-9);
    }

    @Test
    @DisplayName("quality indicator should map scores to high, medium and low")
    void qualityIndicator() {
        assertEquals("high", QualityAssessor.qualityIndicator(0.8));
        assertEquals("medium", QualityAssessor.qualityIndicator(0.79));
        assertEquals("medium", QualityAssessor.qualityIndicator(0.6));
        assertEquals("low", QualityAssessor.qualityIndicator(0.59));
    }

    @Test
    @DisplayName("metrics for no descriptions should only carry the count")
    void emptyMetrics() {
        Map<String, Double> metrics = QualityAssessor.metrics(List.of(), List.of("lexicon"));

        assertEquals(Map.of(QualityAssessor.DESCRIPTION_COUNT, 0.0), metrics);
    }

    @Test
    @DisplayName("metrics should average scores, consensus and base priority")
    void metrics() {
        List<CompleteDescription> descriptions = List.of(
            description("Высокий темный замок", DescriptionType.LOCATION, 0.9, 1.0, List.of("lexicon", "names")),
            description("Старый маг у окна", DescriptionType.CHARACTER, 0.5, 0.5, List.of("names")));

        Map<String, Double> metrics = QualityAssessor.metrics(descriptions, List.of("lexicon", "names"));

        assertEquals(2.0, metrics.get(QualityAssessor.DESCRIPTION_COUNT));
        assertEquals(0.7, metrics.get(QualityAssessor.AVERAGE_SCORE), 1e-9);
        assertEquals(0.75, metrics.get(QualityAssessor.CONSENSUS_AVERAGE), 1e-9);
        assertEquals(0.5, metrics.get(QualityAssessor.HIGH_QUALITY_RATIO), 1e-9);
        assertEquals(67.5, metrics.get(QualityAssessor.AVERAGE_BASE_PRIORITY), 1e-9);
        assertEquals(QualityAssessor.descriptionQuality(descriptions.get(0)),
            metrics.get(QualityAssessor.PROCESSOR_QUALITY_PREFIX + "lexicon"), 1e-9);
        assertTrue(metrics.containsKey(QualityAssessor.PROCESSOR_QUALITY_PREFIX + "names"));
    }

    @Test
    @DisplayName("recommendations should flag low quality and a lone processor")
    void lowQualityRecommendations() {
        Map<String, Double> metrics = Map.of(
            QualityAssessor.AVERAGE_QUALITY, 0.2,
            QualityAssessor.PROCESSOR_QUALITY_PREFIX + "lexicon", 0.2);

        List<String> recommendations = QualityAssessor.recommendations(metrics, List.of("lexicon"));

        assertEquals(List.of(
            "Low quality results. Consider adjusting confidence thresholds.",
            "Consider using multiple processors for better coverage."), recommendations);
    }

    @Test
    @DisplayName("recommendations should praise excellent processors")
    void excellentProcessor() {
        Map<String, Double> metrics = Map.of(
            QualityAssessor.AVERAGE_QUALITY, 0.75,
            QualityAssessor.PROCESSOR_QUALITY_PREFIX + "lexicon", 0.9,
            QualityAssessor.PROCESSOR_QUALITY_PREFIX + "names", 0.6);

        List<String> recommendations = QualityAssessor.recommendations(metrics, List.of("lexicon", "names"));

        assertEquals(List.of("Processor lexicon showed excellent results."), recommendations);
    }

    @Test
    @DisplayName("segmentation metrics should report descriptive and dialogue shares")
    void segmentationMetrics() {
        SegmentStatistics statistics = new SegmentStatistics(4,
            Map.of(ParagraphType.DESCRIPTION, 2, ParagraphType.DIALOGUE, 1, ParagraphType.NARRATIVE, 1),
            0.45, 120.0, 2);

        Map<String, Double> metrics = QualityAssessor.segmentationMetrics(statistics);

        assertEquals(0.45, metrics.get(QualityAssessor.AVERAGE_DESCRIPTIVENESS));
        assertEquals(0.5, metrics.get(QualityAssessor.DESCRIPTIVE_PARAGRAPH_RATIO));
        assertEquals(0.25, metrics.get(QualityAssessor.DIALOGUE_PARAGRAPH_RATIO));
    }

    @Test
    @DisplayName("segmentation metrics of an empty chapter should be zero")
    void emptySegmentationMetrics() {
        Map<String, Double> metrics = QualityAssessor.segmentationMetrics(new SegmentStatistics(0, Map.of(), 0.0, 0.0, 0));

        assertEquals(0.0, metrics.get(QualityAssessor.DESCRIPTIVE_PARAGRAPH_RATIO));
        assertEquals(0.0, metrics.get(QualityAssessor.DIALOGUE_PARAGRAPH_RATIO));
    }
}
