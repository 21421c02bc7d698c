package com.bookreader.nlp.scoring;

import com.bookreader.nlp.core.CompleteDescription;
import com.bookreader.nlp.core.ParagraphType;
import com.bookreader.nlp.segment.SegmentStatistics;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Quality metrics and tuning recommendations for an extraction run.
 */
public final class QualityAssessor {

    public static final String DESCRIPTION_COUNT = "description_count";
    public static final String AVERAGE_SCORE = "average_score";
    public static final String AVERAGE_QUALITY = "average_quality";
    public static final String CONSENSUS_AVERAGE = "consensus_average";
    public static final String HIGH_QUALITY_RATIO = "high_quality_ratio";
    public static final String AVERAGE_BASE_PRIORITY = "average_base_priority";
    public static final String PROCESSOR_QUALITY_PREFIX = "quality.";
    public static final String AVERAGE_DESCRIPTIVENESS = "average_descriptiveness";
    public static final String DESCRIPTIVE_PARAGRAPH_RATIO = "descriptive_paragraph_ratio";
    public static final String DIALOGUE_PARAGRAPH_RATIO = "dialogue_paragraph_ratio";

    static final double LOW_QUALITY = 0.3;
    static final double EXCELLENT_QUALITY = 0.7;
    static final double HIGH_SCORE = 0.8;
    static final double MEDIUM_SCORE = 0.6;

    private QualityAssessor() {
    }

    /**
     * Metrics describing how much of the chapter was worth extracting from.
     */
    @NotNull
    public static Map<String, Double> segmentationMetrics(@NotNull SegmentStatistics statistics) {
        Map<String, Double> metrics = new LinkedHashMap<>();
        int total = statistics.totalParagraphs();
        metrics.put(AVERAGE_DESCRIPTIVENESS, statistics.averageDescriptiveness());
        metrics.put(DESCRIPTIVE_PARAGRAPH_RATIO, total == 0 ? 0.0 : (double) statistics.descriptiveParagraphs() / total);
        metrics.put(DIALOGUE_PARAGRAPH_RATIO, total == 0 ? 0.0
            : (double) statistics.typeCounts().getOrDefault(ParagraphType.DIALOGUE, 0) / total);
        return metrics;
    }

    /**
     * Per-description quality: length (saturating at 200 chars) 30%, score 50%, word variety 20%.
     */
    public static double descriptionQuality(@NotNull CompleteDescription description) {
        double lengthScore = Math.min(1.0, description.text().length() / 200.0);
        String[] words = description.text().toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+");
        Set<String> distinct = new HashSet<>();
        int total = 0;
        for (String word : words) {
            if (!word.isEmpty()) {
                distinct.add(word);
                total++;
            }
        }
        double variety = total == 0 ? 0.0 : (double) distinct.size() / total;
        return lengthScore * 0.3 + description.overallScore() * 0.5 + variety * 0.2;
    }

    /**
     * Coarse label for a score: high, medium or low.
     */
    @NotNull
    public static String qualityIndicator(double score) {
        if (score >= HIGH_SCORE) {
            return "high";
        }
        if (score >= MEDIUM_SCORE) {
            return "medium";
        }
        return "low";
    }

    @NotNull
    public static Map<String, Double> metrics(
        @NotNull List<CompleteDescription> descriptions,
        @NotNull List<String> processorsUsed
    ) {
        Map<String, Double> metrics = new LinkedHashMap<>();
        int count = descriptions.size();
        metrics.put(DESCRIPTION_COUNT, (double) count);
        if (count == 0) {
            return metrics;
        }

        double score = 0.0;
        double quality = 0.0;
        double consensus = 0.0;
        double basePriority = 0.0;
        int high = 0;
        for (CompleteDescription description : descriptions) {
            score += description.overallScore();
            basePriority += description.descriptionType().basePriority();
            quality += descriptionQuality(description);
            consensus += description.consensusStrength();
            if ("high".equals(qualityIndicator(description.overallScore()))) {
                high++;
            }
        }
        metrics.put(AVERAGE_SCORE, score / count);
        metrics.put(AVERAGE_QUALITY, quality / count);
        metrics.put(CONSENSUS_AVERAGE, consensus / count);
        metrics.put(HIGH_QUALITY_RATIO, (double) high / count);
        metrics.put(AVERAGE_BASE_PRIORITY, basePriority / count);

        for (String processor : processorsUsed) {
            double sum = 0.0;
            int n = 0;
            for (CompleteDescription description : descriptions) {
                if (description.contributingProcessors().contains(processor)) {
                    sum += descriptionQuality(description);
                    n++;
                }
            }
            metrics.put(PROCESSOR_QUALITY_PREFIX + processor, n == 0 ? 0.0 : sum / n);
        }
        return metrics;
    }

    @NotNull
    public static List<String> recommendations(
        @NotNull Map<String, Double> metrics,
        @NotNull List<String> processorsUsed
    ) {
        List<String> recommendations = new ArrayList<>();
        Double averageQuality = metrics.get(AVERAGE_QUALITY);
        if (averageQuality != null && averageQuality < LOW_QUALITY) {
            recommendations.add("Low quality results. Consider adjusting confidence thresholds.");
        }
        if (processorsUsed.size() == 1) {
            recommendations.add("Consider using multiple processors for better coverage.");
        }
        for (String processor : processorsUsed) {
            Double processorQuality = metrics.get(PROCESSOR_QUALITY_PREFIX + processor);
            if (processorQuality != null && processorQuality > EXCELLENT_QUALITY) {
                recommendations.add("Processor " + processor + " showed excellent results.");
            }
        }
        return recommendations;
    }
}
